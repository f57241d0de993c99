package cfdnapro.analysis.trinucleotide;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.ReferenceSequenceFile;
import htsjdk.samtools.reference.ReferenceSequenceFileFactory;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.StringUtil;
import picard.PicardException;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;

/**
 * Random access to an indexed FASTA file (a {@code .fai} must sit next to it, and a {@code .gzi} too when the
 * FASTA is bgzipped).
 *
 * The underlying htsjdk reader seeks a single stream, so fetches are serialized.
 */
public class IndexedFastaReferenceAccessor implements ReferenceAccessor, Closeable {
    private final Log log = Log.getInstance(IndexedFastaReferenceAccessor.class);

    private final ReferenceSequenceFile referenceFile;

    public IndexedFastaReferenceAccessor(final File fasta) {
        IOUtil.assertFileIsReadable(fasta);
        this.referenceFile = ReferenceSequenceFileFactory.getReferenceSequenceFile(fasta);
        if (!referenceFile.isIndexed()) {
            CloserUtil.close(referenceFile);
            throw new PicardException("Reference " + fasta + " has no index; create one with samtools faidx.");
        }
    }

    @Override
    public synchronized String fetch(final String contig, final int start, final int end) {
        if (start < 1 || end < start) return null;
        try {
            return StringUtil.bytesToString(referenceFile.getSubsequenceAt(contig, start, end).getBases()).toUpperCase();
        } catch (final SAMException e) {
            // unknown contig, or the window runs past the contig end
            log.debug("Cannot fetch ", contig, ":", start, "-", end, ": ", e.getMessage());
            return null;
        }
    }

    @Override
    public synchronized void close() throws IOException {
        referenceFile.close();
    }
}
