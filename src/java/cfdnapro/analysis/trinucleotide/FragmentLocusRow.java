package cfdnapro.analysis.trinucleotide;

/**
 * One (fragment, locus) overlap after joining with the locus table. Fragments overlapping no locus
 * produce a single row with status {@link LocusStatus#OUTER_FRAGMENT} and no locus.
 */
public final class FragmentLocusRow {
    private final String fragmentId;
    private final int fragmentWidth;
    private final LocusKey locusKey;
    private final TargetMutation target;
    private final String locusInfo;
    private final String locusStatus;

    FragmentLocusRow(final String fragmentId, final int fragmentWidth, final LocusKey locusKey,
                     final TargetMutation target, final String locusInfo, final String locusStatus) {
        this.fragmentId = fragmentId;
        this.fragmentWidth = fragmentWidth;
        this.locusKey = locusKey;
        this.target = target;
        this.locusInfo = locusInfo;
        this.locusStatus = locusStatus;
    }

    static FragmentLocusRow outerFragment(final String fragmentId, final int fragmentWidth) {
        return new FragmentLocusRow(fragmentId, fragmentWidth, null, null,
                LocusStatus.OUTER_FRAGMENT.getLabel(), LocusStatus.OUTER_FRAGMENT.getLabel());
    }

    /** The de-duplicated fragment identifier. */
    public String getFragmentId() { return fragmentId; }
    public int getFragmentWidth() { return fragmentWidth; }
    public LocusKey getLocusKey() { return locusKey; }

    /** The matching locus table entry, or null if the annotation refers to an unknown locus. */
    public TargetMutation getTarget() { return target; }
    public String getLocusInfo() { return locusInfo; }
    public String getLocusStatus() { return locusStatus; }

    public boolean isOuterFragment() { return locusKey == null; }

    @Override
    public String toString() {
        return fragmentId + "@" + (isOuterFragment() ? LocusStatus.OUTER_FRAGMENT.getLabel() : locusInfo);
    }
}
