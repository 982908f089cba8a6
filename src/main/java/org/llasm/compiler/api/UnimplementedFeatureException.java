package org.llasm.compiler.api;

/**
 * Marks input that is valid but maps to a table entry or construct that has not been wired up yet,
 * such as a numeric calling convention code outside the supported vendor range.
 * <p>
 * Deliberately unrelated to {@link LoweringException}: catching semantic failures must never
 * swallow "not yet supported", and vice versa.
 */
public class UnimplementedFeatureException extends Exception {

    private final String feature;
    private final String offending;

    /**
     * @param feature The feature or table that lacks support (e.g. "numeric calling convention").
     * @param offending The spelling that hit the gap.
     */
    public UnimplementedFeatureException(String feature, String offending) {
        super(String.format("support for %s %s not yet implemented", feature, offending));
        this.feature = feature;
        this.offending = offending;
    }

    public String feature() {
        return feature;
    }

    public String offending() {
        return offending;
    }
}
