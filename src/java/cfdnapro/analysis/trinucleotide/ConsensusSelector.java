package cfdnapro.analysis.trinucleotide;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Picks one consensus mismatch per locus from its resolved fragments.
 *
 * The category is chosen by fixed priority: any concordant alternate support wins, then any single-read
 * alternate support, and only when neither exists the most frequent of discordant, single-read other-base
 * and concordant other-base support (ties drawn at random). One fragment of the winning category is drawn
 * at random, and if it still offers two bases the alternate is preferred, else one is drawn at random.
 *
 * Every locus draws from its own generator seeded from the run seed and the locus, so the outcome for a
 * locus does not depend on which other loci are processed, in which order, or on which thread.
 */
public class ConsensusSelector {
    public static final long DEFAULT_SEED = 123;

    static final List<SupportCategory> FALLBACK_CATEGORIES =
            Collections.unmodifiableList(Arrays.asList(SupportCategory.DO, SupportCategory.SO_OTHER, SupportCategory.CO_OTHER));

    private static final Comparator<ResolvedSupport> BY_FRAGMENT_ID = new Comparator<ResolvedSupport>() {
        @Override
        public int compare(final ResolvedSupport a, final ResolvedSupport b) {
            return a.getRow().getFragmentId().compareTo(b.getRow().getFragmentId());
        }
    };

    private final long seed;

    public ConsensusSelector(final long seed) {
        this.seed = seed;
    }

    public ConsensusSelector() {
        this(DEFAULT_SEED);
    }

    public static SupportTally tally(final List<ResolvedSupport> supports) {
        final SupportTally tally = new SupportTally();
        for (final ResolvedSupport support : supports) {
            tally.add(support.getCategory(), support.getRow().getFragmentWidth());
        }
        return tally;
    }

    /**
     * @param supports resolved fragments of a single locus
     * @return the consensus, or null if no fragment supports anything but the reference
     */
    public LocusConsensus select(final TargetMutation target, final List<ResolvedSupport> supports) {
        final SupportTally tally = tally(supports);
        final Random random = randomFor(target.getLocus());

        final SupportCategory category = chooseCategory(tally, random);
        if (category == null) return null;

        final List<ResolvedSupport> candidates = new ArrayList<ResolvedSupport>();
        for (final ResolvedSupport support : supports) {
            if (support.getCategory() == category) candidates.add(support);
        }
        Collections.sort(candidates, BY_FRAGMENT_ID);
        final ResolvedSupport chosen = candidates.size() == 1 ? candidates.get(0) : candidates.get(random.nextInt(candidates.size()));

        final char base = disambiguate(chosen.getCandidateBases(), target.getAltBase(), random);
        return new LocusConsensus(target, tally, category, base, chosen.getRow().getFragmentId());
    }

    /**
     * The winning category for a tally, or null if none of the alternate, discordant or other-base
     * categories has any support.
     */
    static SupportCategory chooseCategory(final SupportTally tally, final Random random) {
        if (tally.getCount(SupportCategory.CO_MUT) > 0) return SupportCategory.CO_MUT;
        if (tally.getCount(SupportCategory.SO_MUT) > 0) return SupportCategory.SO_MUT;

        int best = 0;
        final List<SupportCategory> tied = new ArrayList<SupportCategory>();
        for (final SupportCategory category : FALLBACK_CATEGORIES) {
            final int count = tally.getCount(category);
            if (count == 0 || count < best) continue;
            if (count > best) {
                best = count;
                tied.clear();
            }
            tied.add(category);
        }
        if (tied.isEmpty()) return null;
        return tied.size() == 1 ? tied.get(0) : tied.get(random.nextInt(tied.size()));
    }

    /**
     * Reduce candidate bases to one. A single base is returned as is.
     */
    static char disambiguate(final String candidateBases, final char altBase, final Random random) {
        if (candidateBases.length() == 1) return candidateBases.charAt(0);
        if (candidateBases.indexOf(altBase) >= 0) return altBase;
        // TODO confirm with the assay owners whether a pair showing two non-alternate bases should be dropped instead
        return candidateBases.charAt(random.nextInt(candidateBases.length()));
    }

    Random randomFor(final LocusKey locus) {
        return new Random(31 * seed + locus.hashCode());
    }
}
