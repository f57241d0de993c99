package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.SkippedRecordMetrics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Audit of records left out of the consensus and spectrum. Nothing counted here stops a run.
 */
public class SkippedRecordCounter {

    public enum SkipReason {
        /** Annotation refers to a locus that is not in the locus table. */
        UNRESOLVED_LOCUS,
        /** Reference window around a locus is not plain ACGT, or could not be fetched. */
        AMBIGUOUS_BASE,
        /** Consensus base is the reference base or not a nucleotide. */
        INVALID_SUBSTITUTION,
        /** Annotation could not be parsed or contradicts its own status. */
        MALFORMED_ANNOTATION,
        /** Later fragment carrying an already seen logical fragment id. */
        DUPLICATE_FRAGMENT,
        /** Locus without any fragment that qualifies for a consensus. */
        NO_SUPPORT
    }

    private final Map<SkipReason, Long> counts = new EnumMap<SkipReason, Long>(SkipReason.class);

    public SkippedRecordCounter() {
        for (final SkipReason reason : SkipReason.values()) counts.put(reason, 0L);
    }

    public synchronized void count(final SkipReason reason) {
        counts.put(reason, counts.get(reason) + 1);
    }

    public synchronized long getCount(final SkipReason reason) {
        return counts.get(reason);
    }

    public synchronized long getTotal() {
        long total = 0;
        for (final long count : counts.values()) total += count;
        return total;
    }

    public synchronized List<SkippedRecordMetrics> toMetrics() {
        final List<SkippedRecordMetrics> metrics = new ArrayList<SkippedRecordMetrics>();
        for (final Map.Entry<SkipReason, Long> entry : counts.entrySet()) {
            final SkippedRecordMetrics m = new SkippedRecordMetrics();
            m.REASON = entry.getKey().name();
            m.COUNT = entry.getValue();
            metrics.add(m);
        }
        return metrics;
    }
}
