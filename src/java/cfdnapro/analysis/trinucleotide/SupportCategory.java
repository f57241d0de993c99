package cfdnapro.analysis.trinucleotide;

/**
 * Columns of the per-locus support tally. Each fragment-locus status falls in exactly one category.
 */
public enum SupportCategory {
    CO_MUT("MUT", OverlapType.CO_MUT),
    SO_MUT("MUT", OverlapType.SO_MUT),
    CO_REF("REF", null),
    SO_REF("REF", null),
    DO("discordant", OverlapType.DO),
    SO_OTHER("other_base_single_read", OverlapType.SO_MUT),
    CO_OTHER("other_base_concordant", OverlapType.CO_MUT);

    private final String consensusTag;
    private final OverlapType overlapType;

    SupportCategory(final String consensusTag, final OverlapType overlapType) {
        this.consensusTag = consensusTag;
        this.overlapType = overlapType;
    }

    /** Suffix written after the base in a consensus mismatch, e.g. {@code chr1:100:T:MUT}. */
    public String getConsensusTag() { return consensusTag; }

    /**
     * The spectrum stratum a consensus of this category is counted in. Other-base support is folded
     * into the stratum with the same read-pair topology. Null for reference categories.
     */
    public OverlapType getOverlapType() { return overlapType; }
}
