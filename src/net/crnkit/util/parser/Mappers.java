package net.crnkit.util.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Various convenience Mapper implementations.
 */
public final class Mappers {

    private static final Mapper<String> CONTENT = new Mapper<String>() {
        public String map(ParseTree tree) throws MappingException {
            if (tree.getToken() == null)
                throw new MappingException("Parse tree " + tree.getName() +
                                           " should have a token");
            return tree.getToken().getContent();
        }
    };

    /* Prevent construction */
    private Mappers() {}

    /**
     * A Mapper that maps leaf parse trees to their tokens' contents.
     */
    public static Mapper<String> content() {
        return CONTENT;
    }

    /**
     * A Mapper that maps every child of a parse tree using element and
     * collects the results into a (modifiable) list.
     */
    public static <T> Mapper<List<T>> aggregate(final Mapper<T> element) {
        return new RecordMapper<List<T>>() {
            protected List<T> mapInner(Provider p) throws MappingException {
                List<T> ret = new ArrayList<T>(
                    p.getParseTree().childCount());
                while (p.hasNext()) ret.add(p.mapNext(element));
                return ret;
            }
        };
    }

    /**
     * A Mapper that requires a parse tree to have exactly one child and maps
     * that using inner.
     */
    public static <T> Mapper<T> unwrap(final Mapper<T> inner) {
        return new RecordMapper<T>() {
            protected T mapInner(Provider p) throws MappingException {
                return p.mapNext(inner);
            }
        };
    }

    /**
     * The first token of a parse tree (in input order), or null if it has
     * none. Useful for reporting locations of whole subtrees.
     */
    public static Token firstToken(ParseTree tree) {
        if (tree.getToken() != null) return tree.getToken();
        for (ParseTree ch : tree.getChildren()) {
            Token ret = firstToken(ch);
            if (ret != null) return ret;
        }
        return null;
    }

}
