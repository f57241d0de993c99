package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.EndMotifMetrics;
import htsjdk.samtools.util.Histogram;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.SequenceUtil;
import htsjdk.samtools.util.StringUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counts fragment end motifs of fragment-locus rows supporting the reference base and rows supporting the
 * alternate base (concordant or single-read).
 *
 * Both ends of a fragment are read 5' to 3' on their own strand: the first bases of the fragment as they
 * are, and the last bases reverse complemented. Ends whose reference bases cannot be fetched or are not
 * plain ACGT are not counted.
 */
public class EndMotifCollector {
    private final Log log = Log.getInstance(EndMotifCollector.class);

    private final ReferenceAccessor reference;
    private final int motifLength;
    private final Histogram<String> referenceMotifs = new Histogram<String>();
    private final Histogram<String> mutantMotifs = new Histogram<String>();
    private long unusableEnds = 0;

    public EndMotifCollector(final ReferenceAccessor reference, final int motifLength) {
        this.reference = reference;
        this.motifLength = motifLength;
    }

    /**
     * @param support the resolved row, or null if the row could not be resolved
     */
    public void accept(final Fragment fragment, final ResolvedSupport support) {
        if (support == null) return;
        switch (support.getStatus()) {
            case MUT_CONCORDANT:
            case MUT_SINGLE_READ:
                addEnds(fragment, mutantMotifs);
                break;
            case REF_CONCORDANT:
            case REF_SINGLE_READ:
                addEnds(fragment, referenceMotifs);
                break;
            default:
                break;
        }
    }

    public long getUnusableEnds() { return unusableEnds; }

    /**
     * One row for every motif of the configured length, in alphabetical order.
     */
    public List<EndMotifMetrics> getMetrics() {
        final List<String> motifs = new ArrayList<String>();
        for (final byte[] kmer : SequenceUtil.generateAllKmers(motifLength)) {
            motifs.add(StringUtil.bytesToString(kmer));
        }
        Collections.sort(motifs);

        final double referenceTotal = referenceMotifs.getSumOfValues();
        final double mutantTotal = mutantMotifs.getSumOfValues();
        final List<EndMotifMetrics> metrics = new ArrayList<EndMotifMetrics>(motifs.size());
        for (final String motif : motifs) {
            final EndMotifMetrics m = new EndMotifMetrics();
            m.MOTIF = motif;
            m.N_REF = count(referenceMotifs, motif);
            m.FRACTION_REF = referenceTotal == 0 ? 0 : m.N_REF / referenceTotal;
            m.N_MUT = count(mutantMotifs, motif);
            m.FRACTION_MUT = mutantTotal == 0 ? 0 : m.N_MUT / mutantTotal;
            metrics.add(m);
        }
        if (unusableEnds > 0) log.info("Left out ", unusableEnds, " fragment ends without a plain ACGT motif.");
        return metrics;
    }

    private void addEnds(final Fragment fragment, final Histogram<String> motifs) {
        final String left = reference.fetch(fragment.getContig(), fragment.getStart(), fragment.getStart() + motifLength - 1);
        final String right = reference.fetch(fragment.getContig(), fragment.getEnd() - motifLength + 1, fragment.getEnd());
        add(left, motifs, fragment);
        add(right == null ? null : SequenceUtil.reverseComplement(right), motifs, fragment);
    }

    private void add(final String motif, final Histogram<String> motifs, final Fragment fragment) {
        if (motif == null || motif.length() != motifLength || !isNucleotides(motif)) {
            log.debug("No end motif for ", fragment.getId(), ": ", motif);
            unusableEnds++;
            return;
        }
        motifs.increment(motif.toUpperCase());
    }

    private static boolean isNucleotides(final String bases) {
        for (int i = 0; i < bases.length(); i++) {
            if ("ACGT".indexOf(Character.toUpperCase(bases.charAt(i))) < 0) return false;
        }
        return true;
    }

    private static long count(final Histogram<String> histogram, final String motif) {
        final Histogram.Bin<String> bin = histogram.get(motif);
        return bin == null ? 0 : (long) bin.getValue();
    }
}
