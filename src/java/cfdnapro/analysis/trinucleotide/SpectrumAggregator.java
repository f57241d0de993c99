package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.ConsensusMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.SpectrumMetrics;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Counts consensus loci per SBS96 channel and overlap type.
 *
 * Other-base consensus loci are counted with the overlap type of the same read-pair topology: concordant
 * other-base with CO_MUT, single-read other-base with SO_MUT. When normalizing, every value is divided by
 * the number of loci counted over all channels and overlap types, not per overlap type.
 *
 * Removed types are read as zero when an alternate-base consensus is placed: it is counted with CO_MUT unless
 * its remaining single-read alternate support exceeds its remaining concordant alternate support. Removal
 * applies after the exclude and retain filters, which see the full tally.
 */
public class SpectrumAggregator {
    private final Log log = Log.getInstance(SpectrumAggregator.class);

    private final boolean normalizeCounts;
    private final Set<SupportCategory> excludeIfTypePresent;
    private final Set<SupportCategory> retainIfTypePresent;
    private final Set<SupportCategory> removeType;

    /**
     * @param excludeIfTypePresent loci with any support in one of these categories are not counted
     * @param retainIfTypePresent if not empty, only loci with support in at least one of these categories are counted
     */
    public SpectrumAggregator(final boolean normalizeCounts, final Collection<SupportCategory> excludeIfTypePresent,
                              final Collection<SupportCategory> retainIfTypePresent) {
        this(normalizeCounts, excludeIfTypePresent, retainIfTypePresent, null);
    }

    /**
     * @param removeType tally columns read as zero when placing an alternate-base consensus in its overlap type
     */
    public SpectrumAggregator(final boolean normalizeCounts, final Collection<SupportCategory> excludeIfTypePresent,
                              final Collection<SupportCategory> retainIfTypePresent,
                              final Collection<SupportCategory> removeType) {
        this.normalizeCounts = normalizeCounts;
        this.excludeIfTypePresent = toSet(excludeIfTypePresent);
        this.retainIfTypePresent = toSet(retainIfTypePresent);
        this.removeType = toSet(removeType);
    }

    public SpectrumAggregator(final boolean normalizeCounts) {
        this(normalizeCounts, Collections.<SupportCategory>emptySet(), Collections.<SupportCategory>emptySet());
    }

    /**
     * @return 96 x 3 rows: channels in canonical order, overlap types CO_MUT, SO_MUT, DO within each channel
     */
    public List<SpectrumMetrics> aggregate(final Collection<ConsensusMetrics> loci) {
        final OverlapType[] overlapTypes = OverlapType.values();
        final long[][] counts = new long[Sbs96Channel.values().size()][overlapTypes.length];
        long total = 0;

        for (final ConsensusMetrics locus : loci) {
            if (!passesFilters(locus)) continue;
            final Sbs96Channel channel = Sbs96Channel.fromLabel(locus.SBS96);
            final OverlapType overlapType = overlapTypeOf(locus);
            if (channel == null || overlapType == null) {
                log.warn("Not counting ", locus.TARGET_MUTATION, ": channel ", locus.SBS96, ", consensus type ", locus.CONSENSUS_TYPE);
                continue;
            }
            counts[channel.getIndex()][overlapType.ordinal()]++;
            total++;
        }

        final List<SpectrumMetrics> spectrum = new ArrayList<SpectrumMetrics>(counts.length * overlapTypes.length);
        for (final Sbs96Channel channel : Sbs96Channel.values()) {
            for (final OverlapType overlapType : overlapTypes) {
                final long count = counts[channel.getIndex()][overlapType.ordinal()];
                final SpectrumMetrics m = new SpectrumMetrics();
                m.SBS96 = channel.getLabel();
                m.MUTATION_TYPE = channel.getMutationType();
                m.OVERLAP_TYPE = overlapType.name();
                if (normalizeCounts) m.VALUE = total == 0 ? 0 : count / (double) total;
                else m.VALUE = count;
                spectrum.add(m);
            }
        }
        log.info("Counted ", total, " loci in the SBS96 spectrum.");
        return spectrum;
    }

    boolean passesFilters(final ConsensusMetrics locus) {
        for (final SupportCategory category : excludeIfTypePresent) {
            if (locus.getCount(category) > 0) return false;
        }
        if (retainIfTypePresent.isEmpty()) return true;
        for (final SupportCategory category : retainIfTypePresent) {
            if (locus.getCount(category) > 0) return true;
        }
        return false;
    }

    OverlapType overlapTypeOf(final ConsensusMetrics locus) {
        if (locus.CONSENSUS_TYPE == null) return null;
        final SupportCategory type;
        try {
            type = SupportCategory.valueOf(locus.CONSENSUS_TYPE);
        } catch (final IllegalArgumentException e) {
            return null;
        }
        if (removeType.isEmpty() || (type != SupportCategory.CO_MUT && type != SupportCategory.SO_MUT)) {
            return type.getOverlapType();
        }
        return remaining(locus, SupportCategory.CO_MUT) >= remaining(locus, SupportCategory.SO_MUT)
                ? OverlapType.CO_MUT
                : OverlapType.SO_MUT;
    }

    private int remaining(final ConsensusMetrics locus, final SupportCategory category) {
        return removeType.contains(category) ? 0 : locus.getCount(category);
    }

    private static Set<SupportCategory> toSet(final Collection<SupportCategory> categories) {
        return categories == null || categories.isEmpty()
                ? EnumSet.noneOf(SupportCategory.class)
                : EnumSet.copyOf(categories);
    }
}
