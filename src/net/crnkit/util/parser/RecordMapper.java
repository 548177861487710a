package net.crnkit.util.parser;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A convenience Mapper decomposing the input parse tree.
 * Subclasses implement mapInner() and pull sub-trees out of the Provider
 * one by one; missing sub-trees and left-over ones are both reported as
 * MappingException-s.
 */
public abstract class RecordMapper<T> implements Mapper<T> {

    /**
     * Parameter object for mapInner().
     * Gives access to the tree being mapped and iterates over its
     * children; the remaining children can also be consumed with a for-each
     * loop.
     */
    public static class Provider implements Iterable<ParseTree>,
                                            Iterator<ParseTree> {

        private final ParseTree tree;
        private final List<ParseTree> children;
        private int index;

        public Provider(ParseTree tree) {
            this.tree = tree;
            this.children = tree.getChildren();
            this.index = 0;
        }

        public ParseTree getParseTree() {
            return tree;
        }

        public Iterator<ParseTree> iterator() {
            return this;
        }

        public boolean hasNext() {
            return index < children.size();
        }

        public ParseTree next() {
            if (! hasNext())
                throw new NoSuchElementException("Parse tree " +
                    tree.getName() + " has too few children");
            return children.get(index++);
        }

        /**
         * Whether the next child exists and has the given name.
         * Allows mapping optional parts without consuming anything.
         */
        public boolean nextIs(String name) {
            return hasNext() && name.equals(children.get(index).getName());
        }

        public void remove() {
            throw new UnsupportedOperationException(
                "May not remove from ParseTree provider");
        }

        public <U> U mapNext(Mapper<U> mapper) throws MappingException {
            if (! hasNext())
                throw new MappingException("Parse tree " + tree.getName() +
                                           " has too few children");
            return mapper.map(next());
        }

    }

    public T map(ParseTree tree) throws MappingException {
        Provider p = new Provider(tree);
        T ret;
        try {
            ret = mapInner(p);
        } catch (NoSuchElementException exc) {
            throw new MappingException(exc.getMessage(), exc);
        }
        if (p.hasNext())
            throw new MappingException("Parse tree " + tree.getName() +
                                       " has too many children");
        return ret;
    }

    protected abstract T mapInner(Provider p) throws MappingException;

}
