package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.FragmentLengthMetrics;
import htsjdk.samtools.util.Histogram;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Collects the lengths of fragment-locus rows supporting the alternate base, the reference base, or no
 * locus at all, and bins them for a {@link LengthComparison}.
 *
 * Alternate support means concordant or single-read alternate support; discordant pairs are left out.
 * A fragment overlapping several loci contributes one length per locus.
 */
public class FragmentLengthCollector {
    /** Lengths are rounded to the nearest multiple of this, halves to even. */
    public static final int SIZE_BIN = 5;

    private static final Comparator<SizedFragment> BY_FRAGMENT_ID = new Comparator<SizedFragment>() {
        @Override
        public int compare(final SizedFragment a, final SizedFragment b) {
            final int byId = a.fragmentId.compareTo(b.fragmentId);
            return byId != 0 ? byId : Integer.compare(a.width, b.width);
        }
    };

    private final Log log = Log.getInstance(FragmentLengthCollector.class);

    private final List<SizedFragment> mutant = new ArrayList<SizedFragment>();
    private final List<SizedFragment> reference = new ArrayList<SizedFragment>();
    private final List<SizedFragment> outer = new ArrayList<SizedFragment>();

    /**
     * @param support the resolved row, or null if the row is an outer fragment or could not be resolved
     */
    public void accept(final FragmentLocusRow row, final ResolvedSupport support) {
        final SizedFragment fragment = new SizedFragment(row.getFragmentId(), row.getFragmentWidth());
        if (row.isOuterFragment()) {
            outer.add(fragment);
            return;
        }
        if (support == null) return;
        switch (support.getStatus()) {
            case MUT_CONCORDANT:
            case MUT_SINGLE_READ:
                mutant.add(fragment);
                break;
            case REF_CONCORDANT:
            case REF_SINGLE_READ:
                reference.add(fragment);
                break;
            default:
                break;
        }
    }

    public int getMutantCount() { return mutant.size(); }
    public int getReferenceCount() { return reference.size(); }
    public int getOuterCount() { return outer.size(); }

    /**
     * Comparison rows first, then mutant rows, each by ascending size.
     */
    public List<FragmentLengthMetrics> getMetrics(final LengthComparison comparison, final long seed) {
        List<SizedFragment> against = comparison.isAgainstOuter() ? outer : reference;
        if (comparison.isDownsampled()) {
            against = downsample(against, mutant.size(), new Random(seed));
        }

        final Histogram<Integer> againstSizes = binned(against);
        final Histogram<Integer> mutantSizes = binned(mutant);
        final long total = against.size() + mutant.size();

        final List<FragmentLengthMetrics> metrics = new ArrayList<FragmentLengthMetrics>();
        addRows(metrics, comparison, false, againstSizes, total);
        addRows(metrics, comparison, true, mutantSizes, total);
        return metrics;
    }

    /** Nearest multiple of {@link #SIZE_BIN}. */
    static int roundSize(final int width) {
        return (int) (Math.rint(width / (double) SIZE_BIN) * SIZE_BIN);
    }

    /**
     * A seeded draw of {@code count} fragments without replacement. The draw depends only on the seed and the
     * set of fragments, not on the order they were collected in.
     */
    List<SizedFragment> downsample(final List<SizedFragment> fragments, final int count, final Random random) {
        if (count >= fragments.size()) {
            if (count > fragments.size()) {
                log.warn("Only ", fragments.size(), " comparison fragments for ", count, " mutant fragments; keeping all.");
            }
            return fragments;
        }
        final List<SizedFragment> sorted = new ArrayList<SizedFragment>(fragments);
        Collections.sort(sorted, BY_FRAGMENT_ID);
        Collections.shuffle(sorted, random);
        return sorted.subList(0, count);
    }

    private static Histogram<Integer> binned(final List<SizedFragment> fragments) {
        final Histogram<Integer> sizes = new Histogram<Integer>();
        for (final SizedFragment fragment : fragments) sizes.increment(roundSize(fragment.width));
        return sizes;
    }

    private static void addRows(final List<FragmentLengthMetrics> metrics, final LengthComparison comparison,
                                final boolean isMutant, final Histogram<Integer> sizes, final long total) {
        for (final Integer size : sizes.keySet()) {
            final FragmentLengthMetrics m = new FragmentLengthMetrics();
            m.COMPARISON = comparison.name();
            m.MUTANT = isMutant;
            m.SIZE = size;
            m.COUNT = (long) sizes.get(size).getValue();
            m.PROPORTION = m.COUNT / (double) total;
            metrics.add(m);
        }
    }

    static final class SizedFragment {
        private final String fragmentId;
        private final int width;

        SizedFragment(final String fragmentId, final int width) {
            this.fragmentId = fragmentId;
            this.width = width;
        }

        String getFragmentId() { return fragmentId; }
        int getWidth() { return width; }
    }
}
