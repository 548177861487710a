package net.crnkit.crn;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Thrown when species are declared as both signals and fuels.
 */
public class CrnConsistencyException extends CrnException {

    private final List<String> species;

    public CrnConsistencyException(Collection<String> species) {
        this(species, "Species declared as both signal and fuel: " +
             new TreeSet<String>(species));
    }
    public CrnConsistencyException(Collection<String> species,
                                   String message) {
        super(message);
        this.species = Collections.unmodifiableList(
            new ArrayList<String>(new TreeSet<String>(species)));
    }

    /**
     * The offending species, sorted.
     */
    public List<String> getSpecies() {
        return species;
    }

}
