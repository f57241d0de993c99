package cfdnapro.analysis.trinucleotide;

import picard.PicardException;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Settings of one {@link TrinucleotideSpectrumEngine} run.
 */
public final class SpectrumOptions {
    public static final int DEFAULT_MOTIF_LENGTH = 3;

    private final long randomSeed;
    private final boolean normalizeCounts;
    private final int threads;
    private final Set<SupportCategory> excludeIfTypePresent;
    private final Set<SupportCategory> retainIfTypePresent;
    private final Set<SupportCategory> removeType;
    private final LengthComparison lengthComparison;
    private final int motifLength;

    public SpectrumOptions(final long randomSeed, final boolean normalizeCounts, final int threads,
                           final Collection<SupportCategory> excludeIfTypePresent,
                           final Collection<SupportCategory> retainIfTypePresent,
                           final Collection<SupportCategory> removeType,
                           final LengthComparison lengthComparison, final int motifLength) {
        if (threads < 1) throw new PicardException("threads must be at least 1, got " + threads);
        if (motifLength < 1) throw new PicardException("motif length must be at least 1, got " + motifLength);
        if (lengthComparison == null) throw new PicardException("A length comparison is required");
        this.randomSeed = randomSeed;
        this.normalizeCounts = normalizeCounts;
        this.threads = threads;
        this.excludeIfTypePresent = copy(excludeIfTypePresent);
        this.retainIfTypePresent = copy(retainIfTypePresent);
        this.removeType = copy(removeType);
        this.lengthComparison = lengthComparison;
        this.motifLength = motifLength;
    }

    public SpectrumOptions(final long randomSeed, final boolean normalizeCounts, final int threads,
                           final Collection<SupportCategory> excludeIfTypePresent,
                           final Collection<SupportCategory> retainIfTypePresent) {
        this(randomSeed, normalizeCounts, threads, excludeIfTypePresent, retainIfTypePresent,
                Collections.<SupportCategory>emptySet(), LengthComparison.MUT_VS_REF, DEFAULT_MOTIF_LENGTH);
    }

    /** Seed {@value ConsensusSelector#DEFAULT_SEED}, normalized counts, one thread, no filters. */
    public static SpectrumOptions defaults() {
        return new SpectrumOptions(ConsensusSelector.DEFAULT_SEED, true, 1,
                Collections.<SupportCategory>emptySet(), Collections.<SupportCategory>emptySet());
    }

    public long getRandomSeed() { return randomSeed; }
    public boolean isNormalizeCounts() { return normalizeCounts; }
    public int getThreads() { return threads; }
    public Set<SupportCategory> getExcludeIfTypePresent() { return excludeIfTypePresent; }
    public Set<SupportCategory> getRetainIfTypePresent() { return retainIfTypePresent; }

    /** Tally columns read as zero when placing an alternate-base consensus in its overlap type. */
    public Set<SupportCategory> getRemoveType() { return removeType; }
    public LengthComparison getLengthComparison() { return lengthComparison; }
    public int getMotifLength() { return motifLength; }

    private static Set<SupportCategory> copy(final Collection<SupportCategory> categories) {
        return Collections.unmodifiableSet(categories == null || categories.isEmpty()
                ? EnumSet.noneOf(SupportCategory.class)
                : EnumSet.copyOf(categories));
    }
}
