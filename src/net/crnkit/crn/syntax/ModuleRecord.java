package net.crnkit.crn.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.crnkit.util.parser.TextLocation;

/**
 * The reactions written on one line, when parsing in modular mode.
 */
public class ModuleRecord extends CrnRecord {

    private final List<ReactionRecord> reactions;

    public ModuleRecord(List<ReactionRecord> reactions,
                        TextLocation location) {
        super(location);
        this.reactions = Collections.unmodifiableList(
            new ArrayList<ReactionRecord>(reactions));
    }

    public String toString() {
        return String.format("%s@%h%s", getClass().getName(), this,
                             reactions);
    }

    public List<ReactionRecord> getReactions() {
        return reactions;
    }

}
