package cfdnapro.analysis.trinucleotide;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One of the 96 pyrimidine-referenced single base substitution channels, e.g. {@code A[C>T]G}.
 *
 * Channels are ordered by mutation type (C>A, C>G, C>T, T>A, T>C, T>G), then 5' base, then 3' base.
 */
public final class Sbs96Channel {
    public static final List<String> MUTATION_TYPES =
            Collections.unmodifiableList(Arrays.asList("C>A", "C>G", "C>T", "T>A", "T>C", "T>G"));

    private static final char[] BASES = {'A', 'C', 'G', 'T'};

    private static final List<Sbs96Channel> CHANNELS;
    private static final Map<String, Sbs96Channel> BY_LABEL;

    static {
        final List<Sbs96Channel> channels = new ArrayList<Sbs96Channel>(96);
        final Map<String, Sbs96Channel> byLabel = new HashMap<String, Sbs96Channel>();
        for (final String type : MUTATION_TYPES) {
            for (final char fivePrime : BASES) {
                for (final char threePrime : BASES) {
                    final Sbs96Channel channel = new Sbs96Channel(fivePrime, type.charAt(0), type.charAt(2), threePrime, channels.size());
                    channels.add(channel);
                    byLabel.put(channel.getLabel(), channel);
                }
            }
        }
        CHANNELS = Collections.unmodifiableList(channels);
        BY_LABEL = Collections.unmodifiableMap(byLabel);
    }

    private final char fivePrime;
    private final char refBase;
    private final char altBase;
    private final char threePrime;
    private final int index;

    private Sbs96Channel(final char fivePrime, final char refBase, final char altBase, final char threePrime, final int index) {
        this.fivePrime = fivePrime;
        this.refBase = refBase;
        this.altBase = altBase;
        this.threePrime = threePrime;
        this.index = index;
    }

    /** All 96 channels in canonical order. */
    public static List<Sbs96Channel> values() { return CHANNELS; }

    /** The channel with this label, or null if it is not a pyrimidine-referenced substitution. */
    public static Sbs96Channel fromLabel(final String label) {
        return label == null ? null : BY_LABEL.get(label);
    }

    /** Null unless ref is C or T, alt differs from ref and every base is A, C, G or T. */
    public static Sbs96Channel of(final char fivePrime, final char refBase, final char altBase, final char threePrime) {
        return fromLabel(label(fivePrime, refBase, altBase, threePrime));
    }

    public char getFivePrime() { return fivePrime; }
    public char getRefBase() { return refBase; }
    public char getAltBase() { return altBase; }
    public char getThreePrime() { return threePrime; }

    /** Position of this channel in {@link #values()}. */
    public int getIndex() { return index; }

    public String getMutationType() { return refBase + ">" + altBase; }

    /** The pyrimidine-centred reference trinucleotide. */
    public String getReferenceContext() { return "" + fivePrime + refBase + threePrime; }

    public String getLabel() { return label(fivePrime, refBase, altBase, threePrime); }

    private static String label(final char fivePrime, final char refBase, final char altBase, final char threePrime) {
        return fivePrime + "[" + refBase + ">" + altBase + "]" + threePrime;
    }

    @Override
    public String toString() { return getLabel(); }
}
