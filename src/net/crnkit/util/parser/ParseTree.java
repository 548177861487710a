package net.crnkit.util.parser;

import java.util.List;
import net.crnkit.util.NamedValue;

/**
 * A single parse tree node.
 * The name is either the name of the underlying token (for leaves) or the
 * name of the production that gave rise to the node.
 */
public interface ParseTree extends NamedValue {

    /**
     * The token this node directly corresponds to, or null.
     */
    Token getToken();

    /**
     * The content of the token, or null if there is none.
     */
    String getContent();

    /**
     * An immutable list of this node's children.
     */
    List<ParseTree> getChildren();

    int childCount();

    ParseTree childAt(int index);

}
