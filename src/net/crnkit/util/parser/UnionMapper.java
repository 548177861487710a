package net.crnkit.util.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Mapper dispatching to other mappers depending on the parse tree name.
 */
public class UnionMapper<T> implements Mapper<T> {

    private final Map<String, Mapper<? extends T>> children;

    public UnionMapper() {
        this.children = new LinkedHashMap<String, Mapper<? extends T>>();
    }

    public Map<String, Mapper<? extends T>> getChildren() {
        return children;
    }

    public UnionMapper<T> add(String name, Mapper<? extends T> child) {
        getChildren().put(name, child);
        return this;
    }

    public boolean canMap(ParseTree tree) {
        return getChildren().containsKey(tree.getName());
    }

    public T map(ParseTree tree) throws MappingException {
        Mapper<? extends T> child = getChildren().get(tree.getName());
        if (child == null)
            throw new MappingException("Cannot map parse tree node type " +
                tree.getName() + ", expected any of " +
                getChildren().keySet());
        return child.map(tree);
    }

}
