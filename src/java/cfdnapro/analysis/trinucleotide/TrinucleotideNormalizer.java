package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.SkippedRecordCounter.SkipReason;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.SequenceUtil;

/**
 * Places a locus consensus in its SBS96 channel, using the reference trinucleotide around the locus.
 *
 * Substitutions are reported on the pyrimidine strand: when the reference base is A or G, the
 * trinucleotide is reverse complemented and both bases of the substitution are complemented.
 */
public class TrinucleotideNormalizer {
    private static final String NUCLEOTIDES = "ACGT";

    private final Log log = Log.getInstance(TrinucleotideNormalizer.class);

    private final ReferenceAccessor reference;

    public TrinucleotideNormalizer(final ReferenceAccessor reference) {
        this.reference = reference;
    }

    /**
     * @return the channel of the consensus, or null if the reference window or the substitution is unusable
     * (the reason is counted)
     */
    public Sbs96Channel normalizeOrNull(final LocusConsensus consensus, final SkippedRecordCounter skipped) {
        final LocusKey locus = consensus.getTarget().getLocus();
        final String window = reference.fetch(locus.getContig(), locus.getPosition() - 1, locus.getPosition() + 1);
        if (!isNucleotides(window) || window.length() != 3) {
            log.warn("Skipping ", consensus.getTarget(), ": reference trinucleotide is ", window);
            skipped.count(SkipReason.AMBIGUOUS_BASE);
            return null;
        }
        if (window.charAt(1) != consensus.getTarget().getRefBase()) {
            log.warn("Reference base of ", consensus.getTarget(), " does not match the genome (", window, "); using the genome.");
        }

        final Sbs96Channel channel = channelOf(window, consensus.getConsensusBase());
        if (channel == null) {
            log.warn("Skipping ", consensus.getTarget(), ": ", window.charAt(1), ">", consensus.getConsensusBase(),
                    " is not a substitution");
            skipped.count(SkipReason.INVALID_SUBSTITUTION);
        }
        return channel;
    }

    /**
     * The channel of {@code altBase} replacing the centre of a reference trinucleotide, or null if the
     * trinucleotide is not plain ACGT or the alternate base is not a different nucleotide.
     */
    public static Sbs96Channel channelOf(final String trinucleotide, final char altBase) {
        if (trinucleotide == null || trinucleotide.length() != 3 || !isNucleotides(trinucleotide)) return null;
        final String context = toPyrimidineContext(trinucleotide);
        final char alt = isPurine(trinucleotide.charAt(1))
                ? (char) SequenceUtil.complement((byte) Character.toUpperCase(altBase))
                : Character.toUpperCase(altBase);
        return Sbs96Channel.of(context.charAt(0), context.charAt(1), alt, context.charAt(2));
    }

    /** Reverse complements a context whose centre base is a purine; returns others upper-cased and unchanged. */
    public static String toPyrimidineContext(final String context) {
        final String upper = context.toUpperCase();
        return isPurine(upper.charAt(upper.length() / 2)) ? SequenceUtil.reverseComplement(upper) : upper;
    }

    public static boolean isPurine(final char base) {
        final char upper = Character.toUpperCase(base);
        return upper == 'A' || upper == 'G';
    }

    private static boolean isNucleotides(final String bases) {
        if (bases == null || bases.isEmpty()) return false;
        for (int i = 0; i < bases.length(); i++) {
            if (NUCLEOTIDES.indexOf(Character.toUpperCase(bases.charAt(i))) < 0) return false;
        }
        return true;
    }
}
