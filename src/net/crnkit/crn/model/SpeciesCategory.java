package net.crnkit.crn.model;

/**
 * The species categories a CRN document may declare.
 */
public enum SpeciesCategory {

    FORMALS("formals"),
    SIGNALS("signals"),
    FUELS("fuels");

    private final String keyword;

    private SpeciesCategory(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The keyword introducing a declaration of this category.
     */
    public String getKeyword() {
        return keyword;
    }

    /**
     * The category with the given keyword, or null if there is none.
     */
    public static SpeciesCategory fromKeyword(String keyword) {
        for (SpeciesCategory c : values()) {
            if (c.getKeyword().equals(keyword)) return c;
        }
        return null;
    }

}
