package cfdnapro.analysis.trinucleotide;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class Sbs96ChannelUnitTest {

    @Test
    public void testCanonicalOrder() {
        final List<Sbs96Channel> channels = Sbs96Channel.values();
        Assert.assertEquals(channels.size(), 96);
        Assert.assertEquals(channels.get(0).getLabel(), "A[C>A]A");
        Assert.assertEquals(channels.get(1).getLabel(), "A[C>A]C");
        Assert.assertEquals(channels.get(4).getLabel(), "C[C>A]A");
        Assert.assertEquals(channels.get(16).getLabel(), "A[C>G]A");
        Assert.assertEquals(channels.get(95).getLabel(), "T[T>G]T");

        final Set<String> labels = new HashSet<String>();
        for (int i = 0; i < channels.size(); i++) {
            final Sbs96Channel channel = channels.get(i);
            Assert.assertEquals(channel.getIndex(), i);
            Assert.assertEquals(channel.getMutationType(), Sbs96Channel.MUTATION_TYPES.get(i / 16));
            Assert.assertTrue(channel.getRefBase() == 'C' || channel.getRefBase() == 'T');
            Assert.assertSame(Sbs96Channel.fromLabel(channel.getLabel()), channel);
            labels.add(channel.getLabel());
        }
        Assert.assertEquals(labels.size(), 96);
    }

    @Test
    public void testLookups() {
        final Sbs96Channel channel = Sbs96Channel.of('A', 'C', 'T', 'G');
        Assert.assertEquals(channel.getLabel(), "A[C>T]G");
        Assert.assertEquals(channel.getReferenceContext(), "ACG");
        Assert.assertNull(Sbs96Channel.of('A', 'G', 'T', 'G'));
        Assert.assertNull(Sbs96Channel.of('A', 'C', 'C', 'G'));
        Assert.assertNull(Sbs96Channel.fromLabel("A[C>T]"));
        Assert.assertNull(Sbs96Channel.fromLabel(null));
    }
}
