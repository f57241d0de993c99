package cfdnapro.analysis.trinucleotide;

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import picard.PicardException;
import picard.util.TabbedTextFileWithHeaderParser;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads fragments from a tab-delimited table with one row per (fragment, locus) overlap and columns
 * FRAGMENT_ID, CHROM, START, END, LOCUS_INFO, LOCUS_STATUS and optionally STRAND.
 *
 * Rows sharing a fragment id are merged into one fragment, in order of first appearance. A LOCUS_INFO of
 * {@code .} or {@code outer_fragment} marks a fragment overlapping no locus; a LOCUS_STATUS of {@code .}
 * leaves the status to be derived from the bases.
 */
public final class FragmentTableReader {
    public static final String FRAGMENT_ID = "FRAGMENT_ID";
    public static final String CHROM = "CHROM";
    public static final String START = "START";
    public static final String END = "END";
    public static final String STRAND = "STRAND";
    public static final String LOCUS_INFO = "LOCUS_INFO";
    public static final String LOCUS_STATUS = "LOCUS_STATUS";

    private static final String MISSING = ".";

    private static final Log log = Log.getInstance(FragmentTableReader.class);

    private FragmentTableReader() {}

    public static List<Fragment> read(final File file) {
        IOUtil.assertFileIsReadable(file);
        final Map<String, FragmentRows> byId = new LinkedHashMap<String, FragmentRows>();
        final TabbedTextFileWithHeaderParser parser = new TabbedTextFileWithHeaderParser(file);
        try {
            for (final String column : new String[]{FRAGMENT_ID, CHROM, START, END, LOCUS_INFO, LOCUS_STATUS}) {
                if (!parser.hasColumn(column)) throw new PicardException(file + " has no " + column + " column");
            }
            final boolean hasStrand = parser.hasColumn(STRAND);
            for (final TabbedTextFileWithHeaderParser.Row row : parser) {
                final String id = row.getField(FRAGMENT_ID);
                FragmentRows rows = byId.get(id);
                if (rows == null) {
                    final String strand = hasStrand ? row.getField(STRAND) : null;
                    rows = new FragmentRows(row.getField(CHROM), parseInt(row, START, file), parseInt(row, END, file),
                            isMissing(strand) ? '*' : strand.charAt(0));
                    byId.put(id, rows);
                }
                final String info = row.getField(LOCUS_INFO);
                if (isMissing(info) || LocusStatus.OUTER_FRAGMENT.getLabel().equals(info)) continue;
                final String status = row.getField(LOCUS_STATUS);
                rows.annotations.add(new Fragment.LocusAnnotation(info, isMissing(status) ? null : status));
            }
        } finally {
            parser.close();
        }

        final List<Fragment> fragments = new ArrayList<Fragment>(byId.size());
        for (final Map.Entry<String, FragmentRows> entry : byId.entrySet()) {
            final FragmentRows rows = entry.getValue();
            fragments.add(new Fragment(entry.getKey(), rows.contig, rows.start, rows.end, rows.strand, rows.annotations));
        }
        log.info("Loaded ", fragments.size(), " fragments from ", file);
        return fragments;
    }

    private static int parseInt(final TabbedTextFileWithHeaderParser.Row row, final String column, final File file) {
        final String value = row.getField(column);
        try {
            if (value != null) return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new PicardException("Invalid " + column + " in " + file + ": " + row.getCurrentLine(), e);
        }
        throw new PicardException("Missing " + column + " in " + file + ": " + row.getCurrentLine());
    }

    private static boolean isMissing(final String value) {
        return value == null || value.trim().isEmpty() || value.trim().equals(MISSING);
    }

    private static final class FragmentRows {
        private final String contig;
        private final int start;
        private final int end;
        private final char strand;
        private final List<Fragment.LocusAnnotation> annotations = new ArrayList<Fragment.LocusAnnotation>();

        private FragmentRows(final String contig, final int start, final int end, final char strand) {
            this.contig = contig;
            this.start = start;
            this.end = end;
            this.strand = strand;
        }
    }
}
