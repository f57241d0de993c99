package cfdnapro.analysis.trinucleotide;

/**
 * Which fragments the lengths of mutant-supporting fragments are compared against. The downsampled
 * variants draw, with the run seed, as many comparison fragments as there are mutant fragments.
 */
public enum LengthComparison {
    MUT_VS_REF(false, false),
    MUT_VS_OUTER(true, false),
    MUT_VS_REF_NORM(false, true),
    MUT_VS_OUTER_NORM(true, true);

    private final boolean againstOuter;
    private final boolean downsampled;

    LengthComparison(final boolean againstOuter, final boolean downsampled) {
        this.againstOuter = againstOuter;
        this.downsampled = downsampled;
    }

    /** True to compare against fragments overlapping no locus, false for reference-supporting fragments. */
    public boolean isAgainstOuter() { return againstOuter; }

    public boolean isDownsampled() { return downsampled; }
}
