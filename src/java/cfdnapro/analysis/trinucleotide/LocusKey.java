package cfdnapro.analysis.trinucleotide;

import picard.PicardException;

/**
 * Identity of a candidate mutation site: contig plus 1-based position. Rendered as {@code chr:pos}.
 * Ordered by contig name, then position.
 */
public final class LocusKey implements Comparable<LocusKey> {
    private final String contig;
    private final int position;

    public LocusKey(final String contig, final int position) {
        if (contig == null || contig.isEmpty()) throw new PicardException("Locus contig cannot be empty");
        if (position < 1) throw new PicardException("Locus positions are 1-based, got " + position + " on " + contig);
        this.contig = contig;
        this.position = position;
    }

    /**
     * Parse the coordinate embedded at the front of a colon-delimited string such as
     * {@code chr1:1000000} or {@code chr1:1000000:CT:...}.
     */
    public static LocusKey parse(final String value) {
        if (value == null) throw new PicardException("Cannot parse a locus from a null value");
        final String[] fields = value.split(":");
        if (fields.length < 2) throw new PicardException("Expected chr:pos but found: " + value);
        try {
            return new LocusKey(fields[0], Integer.parseInt(fields[1].trim()));
        } catch (final NumberFormatException e) {
            throw new PicardException("Invalid locus position in: " + value, e);
        }
    }

    public String getContig() { return contig; }
    public int getPosition() { return position; }

    @Override
    public int compareTo(final LocusKey other) {
        final int byContig = this.contig.compareTo(other.contig);
        return byContig != 0 ? byContig : Integer.compare(this.position, other.position);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof LocusKey)) return false;
        final LocusKey that = (LocusKey) o;
        return position == that.position && contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        return 31 * contig.hashCode() + position;
    }

    @Override
    public String toString() {
        return contig + ":" + position;
    }
}
