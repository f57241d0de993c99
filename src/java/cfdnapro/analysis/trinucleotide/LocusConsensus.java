package cfdnapro.analysis.trinucleotide;

/**
 * The finalized consensus of one locus: its support tally, the category that won and the single base
 * chosen to represent it. Never modified once built.
 */
public final class LocusConsensus {
    private final TargetMutation target;
    private final SupportTally tally;
    private final SupportCategory category;
    private final char consensusBase;
    private final String fragmentId;

    LocusConsensus(final TargetMutation target, final SupportTally tally, final SupportCategory category,
                   final char consensusBase, final String fragmentId) {
        this.target = target;
        this.tally = tally;
        this.category = category;
        this.consensusBase = consensusBase;
        this.fragmentId = fragmentId;
    }

    public TargetMutation getTarget() { return target; }
    public SupportTally getTally() { return tally; }
    public SupportCategory getCategory() { return category; }
    public char getConsensusBase() { return consensusBase; }

    /** The fragment whose bases were taken as the consensus. */
    public String getFragmentId() { return fragmentId; }

    /** {@code chr:pos:BASE:TAG}, e.g. {@code chr1:1000000:T:MUT}. */
    public String getConsensusMismatch() {
        return target.getLocus() + ":" + consensusBase + ":" + category.getConsensusTag();
    }

    @Override
    public String toString() {
        return target + " " + category + " " + getConsensusMismatch();
    }
}
