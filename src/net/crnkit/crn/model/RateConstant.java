package net.crnkit.crn.model;

/**
 * A rate constant as written in the input, or the marker for an
 * unspecified rate.
 * The literal is kept verbatim ("13.78", "1e-3"); units are not
 * interpreted. UNSPECIFIED is distinct from any numeric rate, including
 * zero.
 */
public final class RateConstant {

    public static final RateConstant UNSPECIFIED = new RateConstant(null);

    private final String literal;

    private RateConstant(String literal) {
        this.literal = literal;
    }

    public String toString() {
        return (literal == null) ? "unspecified" : literal;
    }

    public boolean equals(Object other) {
        if (! (other instanceof RateConstant)) return false;
        String ol = ((RateConstant) other).literal;
        return (literal == null) ? (ol == null) : literal.equals(ol);
    }

    public int hashCode() {
        return (literal == null) ? 0 : literal.hashCode();
    }

    public boolean isSpecified() {
        return (literal != null);
    }

    /**
     * The literal as written, or null if unspecified.
     */
    public String getLiteral() {
        return literal;
    }

    public double doubleValue() {
        if (literal == null)
            throw new IllegalStateException("Rate is unspecified");
        return Double.parseDouble(literal);
    }

    public static RateConstant of(String literal) {
        if (literal == null)
            throw new NullPointerException(
                "Rate literal may not be null (use UNSPECIFIED)");
        return new RateConstant(literal);
    }

}
