package cfdnapro.analysis.trinucleotide;

import htsjdk.samtools.util.SequenceUtil;
import picard.PicardException;

/**
 * A candidate single-base substitution: locus, reference base and alternate base.
 */
public final class TargetMutation {
    private final LocusKey locus;
    private final char refBase;
    private final char altBase;

    public TargetMutation(final LocusKey locus, final char refBase, final char altBase) {
        this.locus = locus;
        this.refBase = checkBase(Character.toUpperCase(refBase), locus);
        this.altBase = checkBase(Character.toUpperCase(altBase), locus);
    }

    public TargetMutation(final String contig, final int position, final char refBase, final char altBase) {
        this(new LocusKey(contig, position), refBase, altBase);
    }

    public LocusKey getLocus() { return locus; }
    public char getRefBase() { return refBase; }
    public char getAltBase() { return altBase; }

    /** The {@code chr:pos:ref:alt} identity used to label consensus rows. */
    public String getTargetKey() {
        return locus + ":" + refBase + ":" + altBase;
    }

    private static char checkBase(final char base, final LocusKey locus) {
        if (!SequenceUtil.isIUPAC((byte) base)) {
            throw new PicardException("Not an IUPAC base at " + locus + ": " + base);
        }
        return base;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetMutation)) return false;
        final TargetMutation that = (TargetMutation) o;
        return refBase == that.refBase && altBase == that.altBase && locus.equals(that.locus);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * locus.hashCode() + refBase) + altBase;
    }

    @Override
    public String toString() {
        return getTargetKey();
    }
}
