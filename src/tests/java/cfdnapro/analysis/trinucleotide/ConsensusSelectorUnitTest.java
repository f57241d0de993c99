package cfdnapro.analysis.trinucleotide;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

public class ConsensusSelectorUnitTest {
    private static final TargetMutation TARGET = new TargetMutation("chr1", 1000000, 'C', 'T');
    private final StatusResolver resolver = new StatusResolver();

    private ResolvedSupport support(final String id, final int width, final String bases, final String status) {
        final String info = TARGET.getLocus() + ":" + bases;
        return resolver.resolve(new FragmentLocusRow(id, width, TARGET.getLocus(), TARGET, info, status));
    }

    /** Adds {@code n} fragments of one kind, named {@code prefix0..prefixN-1}. */
    private void add(final List<ResolvedSupport> supports, final int n, final String prefix, final String bases, final String status) {
        for (int i = 0; i < n; i++) supports.add(support(prefix + i, 150 + i, bases, status));
    }

    @Test
    public void testConcordantMutationScenario() {
        final List<ResolvedSupport> supports = new ArrayList<ResolvedSupport>();
        add(supports, 3, "co", "T", "MUT:concordant");
        add(supports, 1, "so", "REF", "REF:single_read");

        final LocusConsensus consensus = new ConsensusSelector().select(TARGET, supports);
        Assert.assertNotNull(consensus);
        Assert.assertEquals(consensus.getCategory(), SupportCategory.CO_MUT);
        Assert.assertEquals(consensus.getConsensusMismatch(), "chr1:1000000:T:MUT");

        final SupportTally tally = consensus.getTally();
        Assert.assertEquals(tally.getCount(SupportCategory.CO_MUT), 3);
        Assert.assertEquals(tally.getCount(SupportCategory.SO_REF), 1);
        Assert.assertEquals(tally.getTotal(), 4);
        Assert.assertEquals(tally.getMedianLength(SupportCategory.CO_MUT).doubleValue(), 151.0, 1e-9);
        Assert.assertEquals(tally.getMedianLength(SupportCategory.SO_REF).doubleValue(), 150.0, 1e-9);
        Assert.assertNull(tally.getMedianLength(SupportCategory.DO));
    }

    @DataProvider(name = "priority")
    public Object[][] priority() {
        // CO_MUT, SO_MUT, DO, SO_OTHER, CO_OTHER counts -> expected category
        return new Object[][]{
                {1, 0, 20, 20, 20, SupportCategory.CO_MUT},
                {1, 30, 0, 0, 0, SupportCategory.CO_MUT},
                {0, 1, 20, 20, 20, SupportCategory.SO_MUT},
                {0, 0, 3, 2, 1, SupportCategory.DO},
                {0, 0, 1, 3, 2, SupportCategory.SO_OTHER},
                {0, 0, 1, 2, 3, SupportCategory.CO_OTHER},
        };
    }

    @Test(dataProvider = "priority")
    public void testPriority(final int coMut, final int soMut, final int discordant, final int soOther, final int coOther,
                             final SupportCategory expected) {
        final List<ResolvedSupport> supports = new ArrayList<ResolvedSupport>();
        add(supports, coMut, "coMut", "T", "MUT:concordant");
        add(supports, soMut, "soMut", "T", "MUT:single_read");
        add(supports, discordant, "do", "RT", "MUT:discordant");
        add(supports, soOther, "soOther", "G", "other_base:single_read");
        add(supports, coOther, "coOther", "A", "other_base:concordant");
        add(supports, 50, "ref", "REF", "REF:concordant");

        for (long seed = 0; seed < 10; seed++) {
            final LocusConsensus consensus = new ConsensusSelector(seed).select(TARGET, supports);
            Assert.assertEquals(consensus.getCategory(), expected);
            Assert.assertEquals(consensus.getTally().getTotal(), supports.size());
        }
    }

    @Test
    public void testReferenceOnlyLocusHasNoConsensus() {
        final List<ResolvedSupport> supports = new ArrayList<ResolvedSupport>();
        add(supports, 4, "ref", "REF", "REF:concordant");
        add(supports, 2, "refSingle", "C", "REF:single_read");
        Assert.assertNull(new ConsensusSelector().select(TARGET, supports));
    }

    @Test
    public void testTiesAreRandomButSeeded() {
        final List<ResolvedSupport> supports = new ArrayList<ResolvedSupport>();
        add(supports, 2, "do", "RT", "MUT:discordant");
        add(supports, 2, "soOther", "G", "other_base:single_read");
        add(supports, 2, "coOther", "A", "other_base:concordant");

        final Set<SupportCategory> seen = new HashSet<SupportCategory>();
        for (long seed = 0; seed < 200; seed++) {
            final LocusConsensus first = new ConsensusSelector(seed).select(TARGET, supports);
            final List<ResolvedSupport> shuffled = new ArrayList<ResolvedSupport>(supports);
            Collections.shuffle(shuffled, new Random(seed));
            final LocusConsensus second = new ConsensusSelector(seed).select(TARGET, shuffled);

            Assert.assertEquals(second.getCategory(), first.getCategory());
            Assert.assertEquals(second.getFragmentId(), first.getFragmentId());
            Assert.assertEquals(second.getConsensusMismatch(), first.getConsensusMismatch());
            seen.add(first.getCategory());
        }
        Assert.assertEquals(seen, new HashSet<SupportCategory>(ConsensusSelector.FALLBACK_CATEGORIES));
    }

    @Test
    public void testDiscordantConsensusIsSingleNonReferenceBase() {
        final List<ResolvedSupport> supports = new ArrayList<ResolvedSupport>();
        add(supports, 3, "do", "RT", "MUT:discordant");
        final LocusConsensus consensus = new ConsensusSelector().select(TARGET, supports);
        Assert.assertEquals(consensus.getCategory(), SupportCategory.DO);
        Assert.assertEquals(consensus.getConsensusMismatch(), "chr1:1000000:T:discordant");
    }

    @Test
    public void testDisambiguate() {
        final Random random = new Random(7);
        Assert.assertEquals(ConsensusSelector.disambiguate("T", 'T', random), 'T');
        Assert.assertEquals(ConsensusSelector.disambiguate("G", 'T', random), 'G');
        Assert.assertEquals(ConsensusSelector.disambiguate("AT", 'T', random), 'T');
        Assert.assertEquals(ConsensusSelector.disambiguate("TA", 'T', random), 'T');

        final Set<Character> drawn = new HashSet<Character>();
        for (int i = 0; i < 100; i++) {
            final char base = ConsensusSelector.disambiguate("AG", 'T', random);
            // a finalized base disambiguates to itself
            Assert.assertEquals(ConsensusSelector.disambiguate(String.valueOf(base), 'T', random), base);
            drawn.add(base);
        }
        Assert.assertEquals(drawn, new HashSet<Character>(Arrays.asList('A', 'G')));
    }
}
