package net.crnkit.crn.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.crnkit.crn.model.SpeciesCategory;
import net.crnkit.util.parser.TextLocation;

/**
 * A declaration like "signals = {A, B}".
 */
public class DeclarationRecord extends CrnRecord {

    private final SpeciesCategory category;
    private final List<String> identifiers;

    public DeclarationRecord(SpeciesCategory category,
                             List<String> identifiers,
                             TextLocation location) {
        super(location);
        if (category == null)
            throw new NullPointerException("Category may not be null");
        this.category = category;
        this.identifiers = Collections.unmodifiableList(
            new ArrayList<String>(identifiers));
    }

    public String toString() {
        return String.format("%s@%h[%s=%s]", getClass().getName(), this,
                             category.getKeyword(), identifiers);
    }

    public SpeciesCategory getCategory() {
        return category;
    }

    public List<String> getIdentifiers() {
        return identifiers;
    }

}
