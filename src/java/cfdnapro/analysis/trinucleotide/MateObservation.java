package cfdnapro.analysis.trinucleotide;

/**
 * The base(s) a read pair shows at one locus: one per mate covering it. Classification into a
 * {@link LocusStatus} is a pure function of these bases and the locus' reference and alternate.
 */
public final class MateObservation {
    /** Written upstream in place of a mate base meaning "not the alternate, assume reference". */
    public static final char REFERENCE_PLACEHOLDER = 'R';

    private static final char NO_BASE = 0;

    private final char mate1Base;
    private final char mate2Base;

    private MateObservation(final char mate1Base, final char mate2Base) {
        this.mate1Base = Character.toUpperCase(mate1Base);
        this.mate2Base = mate2Base == NO_BASE ? NO_BASE : Character.toUpperCase(mate2Base);
    }

    /** Only one mate covers the locus. */
    public static MateObservation singleRead(final char base) {
        return new MateObservation(base, NO_BASE);
    }

    /** Both mates cover the locus. */
    public static MateObservation pair(final char mate1Base, final char mate2Base) {
        return new MateObservation(mate1Base, mate2Base);
    }

    public char getMate1Base() { return mate1Base; }

    /** The second mate's base, or {@code 0} for a single-read observation. */
    public char getMate2Base() { return mate2Base; }

    public boolean isPaired() { return mate2Base != NO_BASE; }

    public boolean hasPlaceholder() {
        return mate1Base == REFERENCE_PLACEHOLDER || mate2Base == REFERENCE_PLACEHOLDER;
    }

    /** Substitutes the reference placeholder on either mate with the known reference base. */
    public MateObservation withPlaceholderResolved(final char refBase) {
        if (!hasPlaceholder()) return this;
        return new MateObservation(replace(mate1Base, refBase), replace(mate2Base, refBase));
    }

    /**
     * Classifies this observation against a target. Mates that disagree are always discordant; otherwise the
     * shared base is compared to the reference and alternate. Placeholders count as the reference base.
     */
    public LocusStatus classify(final char refBase, final char altBase) {
        final MateObservation resolved = withPlaceholderResolved(refBase);
        final char ref = Character.toUpperCase(refBase);
        final char alt = Character.toUpperCase(altBase);
        if (resolved.isPaired() && resolved.mate1Base != resolved.mate2Base) {
            return LocusStatus.MUT_DISCORDANT;
        }

        final char base = resolved.mate1Base;
        if (resolved.isPaired()) {
            if (base == ref) return LocusStatus.REF_CONCORDANT;
            if (base == alt) return LocusStatus.MUT_CONCORDANT;
            return LocusStatus.OTHER_BASE_CONCORDANT;
        } else {
            if (base == ref) return LocusStatus.REF_SINGLE_READ;
            if (base == alt) return LocusStatus.MUT_SINGLE_READ;
            return LocusStatus.OTHER_BASE_SINGLE_READ;
        }
    }

    /** Distinct bases seen by the mates, in mate order, leaving out {@code excluded}. */
    public String distinctBasesExcluding(final char excluded) {
        final StringBuilder bases = new StringBuilder(2);
        final char ex = Character.toUpperCase(excluded);
        if (mate1Base != ex) bases.append(mate1Base);
        if (isPaired() && mate2Base != ex && mate2Base != mate1Base) bases.append(mate2Base);
        return bases.toString();
    }

    private static char replace(final char base, final char refBase) {
        return base == REFERENCE_PLACEHOLDER ? Character.toUpperCase(refBase) : base;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof MateObservation)) return false;
        final MateObservation that = (MateObservation) o;
        return mate1Base == that.mate1Base && mate2Base == that.mate2Base;
    }

    @Override
    public int hashCode() {
        return 31 * mate1Base + mate2Base;
    }

    @Override
    public String toString() {
        return isPaired() ? "" + mate1Base + mate2Base : String.valueOf(mate1Base);
    }
}
