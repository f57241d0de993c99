package cfdnapro.analysis.trinucleotide;

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFFileReader;
import picard.PicardException;
import picard.util.TabbedTextFileWithHeaderParser;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads target mutations from a VCF, or from a tab-delimited table with columns CHROM, POS, REF and ALT.
 */
public final class LocusTableReader {
    public static final String CHROM = "CHROM";
    public static final String POS = "POS";
    public static final String REF = "REF";
    public static final String ALT = "ALT";

    private static final Log log = Log.getInstance(LocusTableReader.class);

    private LocusTableReader() {}

    public static List<TargetMutation> read(final File file) {
        IOUtil.assertFileIsReadable(file);
        final String name = file.getName().toLowerCase();
        final List<TargetMutation> loci = name.endsWith(".vcf") || name.endsWith(".vcf.gz") || name.endsWith(".bcf")
                ? readVcf(file)
                : readTable(file);
        log.info("Loaded ", loci.size(), " target loci from ", file);
        return loci;
    }

    /** Bi-allelic SNVs of a VCF; other records are skipped. */
    static List<TargetMutation> readVcf(final File file) {
        final List<TargetMutation> loci = new ArrayList<TargetMutation>();
        try (final VCFFileReader reader = new VCFFileReader(file, false)) {
            for (final VariantContext vc : reader) {
                if (!vc.isSNP() || !vc.isBiallelic()) {
                    log.debug("Skipping non-SNV record at ", vc.getContig(), ":", vc.getStart());
                    continue;
                }
                loci.add(new TargetMutation(vc.getContig(), vc.getStart(),
                        (char) vc.getReference().getBases()[0], (char) vc.getAlternateAllele(0).getBases()[0]));
            }
        }
        return loci;
    }

    static List<TargetMutation> readTable(final File file) {
        final List<TargetMutation> loci = new ArrayList<TargetMutation>();
        final TabbedTextFileWithHeaderParser parser = new TabbedTextFileWithHeaderParser(file);
        try {
            for (final String column : new String[]{CHROM, POS, REF, ALT}) {
                if (!parser.hasColumn(column)) throw new PicardException(file + " has no " + column + " column");
            }
            for (final TabbedTextFileWithHeaderParser.Row row : parser) {
                final String ref = row.getField(REF);
                final String alt = row.getField(ALT);
                if (ref == null || alt == null || ref.length() != 1 || alt.length() != 1) {
                    throw new PicardException("Expected single-base REF and ALT in " + file + ": " + row.getCurrentLine());
                }
                final String pos = row.getField(POS);
                final int position;
                try {
                    position = Integer.parseInt(pos == null ? "" : pos.trim());
                } catch (final NumberFormatException e) {
                    throw new PicardException("Invalid position in " + file + ": " + row.getCurrentLine(), e);
                }
                loci.add(new TargetMutation(row.getField(CHROM), position, ref.charAt(0), alt.charAt(0)));
            }
        } finally {
            parser.close();
        }
        return loci;
    }
}
