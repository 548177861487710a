package net.crnkit.util.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import net.crnkit.util.Formats;
import net.crnkit.util.NamedValue;

/**
 * A (context-free) grammar made of named productions.
 * Productions sharing a name are alternatives of each other; a production
 * matches the concatenation of its symbols. Terminals are matched by the
 * lexer, nonterminals refer to productions by name. The grammar matches
 * whatever its start symbol matches.
 */
public class Grammar {

    /**
     * An (immutable) element of a Production.
     */
    public interface Symbol {

        /* Do not generate an own parsing tree node for this symbol. */
        int SYM_INLINE = 1;
        /* Discard any parsing tree nodes stemming from this symbol (may be
         * overridden on a per-parser basis). */
        int SYM_DISCARD = 2;
        /* Optionally skip this symbol (regular expression x?).
         * If the symbol is not matched, no parse tree is generated for it. */
        int SYM_OPTIONAL = 4;
        /* Permit repetitions of this symbol (regular expression x+).
         * Combine with SYM_OPTIONAL for x*. */
        int SYM_REPEAT = 8;

        /* All known flags combined. */
        int SYM_ALL = SYM_INLINE | SYM_DISCARD | SYM_OPTIONAL | SYM_REPEAT;

        int getFlags();

        Symbol withFlags(int newFlags);

    }

    public static abstract class AbstractSymbol implements Symbol {

        private final int flags;

        public AbstractSymbol(int flags) {
            if ((flags & ~SYM_ALL) != 0)
                throw new IllegalArgumentException("Unknown symbol flags 0x" +
                    Integer.toHexString(flags & ~SYM_ALL));
            this.flags = flags;
        }

        public String toString() {
            return formatWithFlags(toStringBase(), getFlags());
        }

        public boolean equals(Object other) {
            if (! (other instanceof AbstractSymbol)) return false;
            AbstractSymbol co = (AbstractSymbol) other;
            return (getFlags() == co.getFlags() && matches(co) &&
                    co.matches(this));
        }

        public int hashCode() {
            return hashCodeBase() ^ getFlags();
        }

        protected abstract String toStringBase();

        protected abstract boolean matches(AbstractSymbol other);

        protected abstract int hashCodeBase();

        public int getFlags() {
            return flags;
        }

    }

    public static class Nonterminal extends AbstractSymbol {

        private final String reference;

        public Nonterminal(String reference, int flags) {
            super(flags);
            if (reference == null)
                throw new NullPointerException(
                    "Nonterminal reference may not be null");
            this.reference = reference;
        }

        protected String toStringBase() {
            return getReference();
        }

        protected boolean matches(AbstractSymbol other) {
            return ((other instanceof Nonterminal) &&
                getReference().equals(((Nonterminal) other).getReference()));
        }

        protected int hashCodeBase() {
            return reference.hashCode();
        }

        public String getReference() {
            return reference;
        }

        public Nonterminal withFlags(int newFlags) {
            if (newFlags == getFlags()) return this;
            return new Nonterminal(getReference(), newFlags);
        }

    }

    /**
     * A symbol matched by the lexer.
     * The name identifies the token class; tokens produced for this terminal
     * carry the same name. Within one grammar, equal names must denote equal
     * patterns.
     */
    public static class Terminal extends AbstractSymbol
            implements NamedValue {

        private final String name;
        private final Pattern pattern;

        public Terminal(String name, Pattern pattern, int flags) {
            super(flags);
            if (name == null)
                throw new NullPointerException(
                    "Terminal name may not be null");
            if (pattern == null)
                throw new NullPointerException(
                    "Terminal pattern may not be null");
            this.name = name;
            this.pattern = pattern;
        }

        protected String toStringBase() {
            return getName();
        }

        protected boolean matches(AbstractSymbol other) {
            if (! (other instanceof Terminal)) return false;
            Terminal to = (Terminal) other;
            return (getName().equals(to.getName()) &&
                    patternsEqual(getPattern(), to.getPattern()));
        }

        protected int hashCodeBase() {
            return name.hashCode();
        }

        public String getName() {
            return name;
        }

        public Pattern getPattern() {
            return pattern;
        }

        /**
         * How strongly this terminal is preferred over others matching a
         * prospective token of the same length.
         */
        public int getMatchRank() {
            return 0;
        }

        public Token createToken(TextLocation location, String content) {
            return new Token(getName(), location, content);
        }

        public Terminal withFlags(int newFlags) {
            if (newFlags == getFlags()) return this;
            return new Terminal(getName(), getPattern(), newFlags);
        }

        public static boolean patternsEqual(Pattern a, Pattern b) {
            if (a == null) return (b == null);
            if (b == null) return false;
            return (a.pattern().equals(b.pattern()) &&
                    a.flags() == b.flags());
        }

    }

    /**
     * A terminal matching exactly one literal string.
     * Fixed terminals outrank pattern terminals, so that keywords win over
     * identifiers of the same length whenever both are acceptable.
     */
    public static class FixedTerminal extends Terminal {

        private final String content;

        public FixedTerminal(String content, int flags) {
            super(Formats.formatString(content),
                  Pattern.compile(Pattern.quote(content)), flags);
            this.content = content;
        }

        public String getContent() {
            return content;
        }

        public int getMatchRank() {
            return 100;
        }

        public FixedTerminal withFlags(int newFlags) {
            if (newFlags == getFlags()) return this;
            return new FixedTerminal(getContent(), newFlags);
        }

    }

    public static class Production implements NamedValue {

        public static final Pattern NAME_PATTERN = Pattern.compile(
            "[a-zA-Z$_-][A-Za-z0-9$_-]*");

        private final String name;
        private final List<Symbol> symbols;

        public Production(String name, List<Symbol> symbols) {
            if (name == null)
                throw new NullPointerException(
                    "Production name may not be null");
            if (symbols == null)
                throw new NullPointerException(
                    "Production symbols may not be null");
            this.name = name;
            this.symbols = Collections.unmodifiableList(
                new ArrayList<Symbol>(symbols));
        }
        public Production(String name, Symbol... symbols) {
            this(name, Arrays.asList(symbols));
        }

        public String toString() {
            StringBuilder sb = new StringBuilder(name).append(" :=");
            if (symbols.isEmpty()) sb.append(" <empty>");
            for (Symbol s : symbols) sb.append(' ').append(s);
            return sb.toString();
        }

        public boolean equals(Object other) {
            if (! (other instanceof Production)) return false;
            Production po = (Production) other;
            return (getName().equals(po.getName()) &&
                    getSymbols().equals(po.getSymbols()));
        }

        public int hashCode() {
            return getName().hashCode() ^ getSymbols().hashCode();
        }

        public String getName() {
            return name;
        }

        public List<Symbol> getSymbols() {
            return symbols;
        }

    }

    public static final String DEFAULT_START = "$start";

    private final String startName;
    private final Map<String, List<Production>> productions;

    public Grammar(String startName) {
        if (startName == null)
            throw new NullPointerException(
                "Start production name may not be null");
        this.startName = startName;
        this.productions = new LinkedHashMap<String, List<Production>>();
    }
    public Grammar() {
        this(DEFAULT_START);
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getName()).append('@')
          .append(Integer.toHexString(hashCode())).append("[start=")
          .append(startName);
        for (List<Production> ps : productions.values()) {
            for (Production p : ps) sb.append(", ").append(p);
        }
        return sb.append(']').toString();
    }

    public Nonterminal nonterminal(String reference, int flags) {
        return new Nonterminal(reference, flags);
    }
    public Nonterminal nonterminal(String reference) {
        return nonterminal(reference, 0);
    }
    public Terminal terminal(String name, String regex, int flags) {
        return new Terminal(name, Pattern.compile(regex), flags);
    }
    public FixedTerminal literal(String content, int flags) {
        return new FixedTerminal(content, flags);
    }
    public FixedTerminal literal(String content) {
        return literal(content, 0);
    }

    public Nonterminal getStartSymbol() {
        return new Nonterminal(startName, 0);
    }

    public Set<String> getProductionNames() {
        return Collections.unmodifiableSet(productions.keySet());
    }
    public List<Production> getProductions(String name) {
        List<Production> ret = productions.get(name);
        if (ret == null) return Collections.emptyList();
        return Collections.unmodifiableList(ret);
    }

    public void addProduction(Production prod) {
        List<Production> alts = productions.get(prod.getName());
        if (alts == null) {
            alts = new ArrayList<Production>();
            productions.put(prod.getName(), alts);
        }
        if (! alts.contains(prod)) alts.add(prod);
    }
    public Production add(String name, Symbol... symbols) {
        Production ret = new Production(name, symbols);
        addProduction(ret);
        return ret;
    }

    public void validate() throws InvalidGrammarException {
        if (! productions.containsKey(startName))
            throw new InvalidGrammarException("Missing start production " +
                                              startName);
        Map<String, Terminal> terminals = new LinkedHashMap<String, Terminal>();
        for (List<Production> ps : productions.values()) {
            for (Production p : ps) {
                if (! Production.NAME_PATTERN.matcher(p.getName()).matches())
                    throw new InvalidGrammarException(
                        "Invalid production name " + p.getName());
                for (Symbol s : p.getSymbols()) {
                    if (s instanceof Nonterminal) {
                        String ref = ((Nonterminal) s).getReference();
                        if (! productions.containsKey(ref))
                            throw new InvalidGrammarException("Symbol " + s +
                                " referencing a nonexistent production");
                    } else if (s instanceof Terminal) {
                        Terminal t = (Terminal) s;
                        Terminal prev = terminals.get(t.getName());
                        if (prev == null) {
                            terminals.put(t.getName(), t.withFlags(0));
                        } else if (! prev.equals(t.withFlags(0))) {
                            throw new InvalidGrammarException("Terminal " +
                                "name " + t.getName() + " used for " +
                                "different patterns");
                        }
                    }
                }
            }
        }
    }

    /**
     * Collect all distinct terminals of the grammar, flags cleared.
     */
    public Map<String, Terminal> getTerminals() {
        Map<String, Terminal> ret = new LinkedHashMap<String, Terminal>();
        for (List<Production> ps : productions.values()) {
            for (Production p : ps) {
                for (Symbol s : p.getSymbols()) {
                    if (! (s instanceof Terminal)) continue;
                    Terminal t = ((Terminal) s).withFlags(0);
                    if (! ret.containsKey(t.getName()))
                        ret.put(t.getName(), t);
                }
            }
        }
        return ret;
    }

    public static String formatWithFlags(String base, int flags) {
        StringBuilder sb = new StringBuilder();
        if ((flags & Symbol.SYM_INLINE  ) != 0) sb.append('^');
        if ((flags & Symbol.SYM_DISCARD ) != 0) sb.append('~');
        sb.append(base);
        if ((flags & Symbol.SYM_OPTIONAL) != 0) sb.append('?');
        if ((flags & Symbol.SYM_REPEAT  ) != 0) sb.append('+');
        return sb.toString();
    }

}
