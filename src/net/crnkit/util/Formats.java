package net.crnkit.util;

import java.util.Collection;
import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Formats {

    /* Everything that is not printable ASCII, plus quotes and backslashes. */
    private static final Pattern ESCAPE = Pattern.compile(
        "[^ !#-&(-\\[\\]-~]");

    // Prevent construction.
    private Formats() {}

    private static String escapeCodeUnit(int ch) {
        switch (ch) {
            case '\n': return "\\n";
            case '\r': return "\\r";
            case '\t': return "\\t";
            case '"': return "\\\"";
            case '\'': return "\\'";
            case '\\': return "\\\\";
            default:
                return String.format((ch < 256) ? "\\x%02x" : "\\u%04x", ch);
        }
    }

    public static String escapeString(String s) {
        Matcher m = ESCAPE.matcher(s);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(sb,
                Matcher.quoteReplacement(escapeCodeUnit(m.group().charAt(0))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static String formatString(String s) {
        if (s == null) return "null";
        return '"' + escapeString(s) + '"';
    }

    public static String formatCharacter(int codePoint) {
        if (codePoint == '\'') return "'\\''";
        if (codePoint == '"') return "'\"'";
        return "'" + escapeString(new String(Character.toChars(codePoint))) +
            "'";
    }

    public static String join(String separator, Collection<?> items) {
        StringBuilder sb = new StringBuilder();
        Iterator<?> it = items.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) sb.append(separator);
        }
        return sb.toString();
    }

}
