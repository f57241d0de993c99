package cfdnapro.analysis.trinucleotide;

import picard.PicardException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The genomic interval spanned by one read pair, with the mismatch annotations of every target locus it overlaps.
 */
public final class Fragment {
    private final String id;
    private final String contig;
    private final int start;
    private final int end;
    private final char strand;
    private final List<LocusAnnotation> annotations;

    /**
     * @param start 1-based first base of the fragment
     * @param end 1-based last base of the fragment, inclusive
     */
    public Fragment(final String id, final String contig, final int start, final int end, final char strand,
                    final List<LocusAnnotation> annotations) {
        if (id == null || id.isEmpty()) throw new PicardException("Fragments must have an identifier");
        if (end < start) throw new PicardException("Fragment " + id + " ends before it starts: " + start + "-" + end);
        this.id = id;
        this.contig = contig;
        this.start = start;
        this.end = end;
        this.strand = strand;
        this.annotations = Collections.unmodifiableList(new ArrayList<LocusAnnotation>(annotations));
    }

    public String getId() { return id; }
    public String getContig() { return contig; }
    public int getStart() { return start; }
    public int getEnd() { return end; }
    public char getStrand() { return strand; }
    public List<LocusAnnotation> getAnnotations() { return annotations; }

    /** Fragment length in bases. */
    public int getWidth() { return end - start + 1; }

    /**
     * Raw mismatch annotation of one fragment at one locus, as produced by the pileup annotation step.
     * {@code locusInfo} is {@code chr:pos:BASES[:...]}; {@code locusStatus} may be null when the upstream
     * step did not label the pair.
     */
    public static final class LocusAnnotation {
        private final String locusInfo;
        private final String locusStatus;

        public LocusAnnotation(final String locusInfo, final String locusStatus) {
            this.locusInfo = locusInfo;
            this.locusStatus = locusStatus;
        }

        public String getLocusInfo() { return locusInfo; }
        public String getLocusStatus() { return locusStatus; }

        public LocusKey getLocusKey() { return LocusKey.parse(locusInfo); }

        @Override
        public String toString() { return locusInfo + " (" + locusStatus + ")"; }
    }
}
