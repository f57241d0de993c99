package cfdnapro.analysis.trinucleotide;

import picard.PicardException;

/**
 * How a single fragment relates to a target locus. The labels are the ones written by the upstream
 * mismatch annotation.
 */
public enum LocusStatus {
    REF_CONCORDANT("REF:concordant", SupportCategory.CO_REF),
    REF_SINGLE_READ("REF:single_read", SupportCategory.SO_REF),
    MUT_CONCORDANT("MUT:concordant", SupportCategory.CO_MUT),
    MUT_SINGLE_READ("MUT:single_read", SupportCategory.SO_MUT),
    MUT_DISCORDANT("MUT:discordant", SupportCategory.DO),
    OTHER_BASE_CONCORDANT("other_base:concordant", SupportCategory.CO_OTHER),
    OTHER_BASE_SINGLE_READ("other_base:single_read", SupportCategory.SO_OTHER),
    /** Fragment overlaps no target locus. Marks absence, never produced by classification. */
    OUTER_FRAGMENT("outer_fragment", null);

    private final String label;
    private final SupportCategory category;

    LocusStatus(final String label, final SupportCategory category) {
        this.label = label;
        this.category = category;
    }

    public String getLabel() { return label; }
    public SupportCategory getCategory() { return category; }

    public boolean isConcordant() {
        return this == REF_CONCORDANT || this == MUT_CONCORDANT || this == OTHER_BASE_CONCORDANT;
    }

    public boolean isSingleRead() {
        return this == REF_SINGLE_READ || this == MUT_SINGLE_READ || this == OTHER_BASE_SINGLE_READ;
    }

    public static LocusStatus fromLabel(final String label) {
        for (final LocusStatus status : values()) {
            if (status.label.equals(label)) return status;
        }
        throw new PicardException("Unknown locus status: " + label);
    }

    @Override
    public String toString() { return label; }
}
