package cfdnapro.analysis.trinucleotide;

import htsjdk.samtools.util.Histogram;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-locus count of supporting fragments in each {@link SupportCategory}, and the fragment lengths behind
 * each count.
 */
public class SupportTally {
    private final Map<SupportCategory, Histogram<Integer>> lengths =
            new EnumMap<SupportCategory, Histogram<Integer>>(SupportCategory.class);

    public SupportTally() {
        for (final SupportCategory category : SupportCategory.values()) {
            lengths.put(category, new Histogram<Integer>());
        }
    }

    public void add(final SupportCategory category, final int fragmentWidth) {
        lengths.get(category).increment(fragmentWidth);
    }

    public int getCount(final SupportCategory category) {
        return (int) lengths.get(category).getCount();
    }

    /** Median fragment length in the category, or null if it has no fragments. */
    public Double getMedianLength(final SupportCategory category) {
        final Histogram<Integer> histogram = lengths.get(category);
        return histogram.isEmpty() ? null : histogram.getMedian();
    }

    public int getTotal() {
        int total = 0;
        for (final SupportCategory category : SupportCategory.values()) total += getCount(category);
        return total;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder("{");
        for (final SupportCategory category : SupportCategory.values()) {
            if (builder.length() > 1) builder.append(", ");
            builder.append(category).append(':').append(getCount(category));
        }
        return builder.append('}').toString();
    }
}
