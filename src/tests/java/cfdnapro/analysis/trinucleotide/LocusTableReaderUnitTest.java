package cfdnapro.analysis.trinucleotide;

import org.testng.Assert;
import org.testng.annotations.Test;
import picard.PicardException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

public class LocusTableReaderUnitTest {

    static File writeTemp(final String suffix, final String... lines) throws IOException {
        final File file = File.createTempFile("LocusTableReaderUnitTest.", suffix);
        file.deleteOnExit();
        Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void testReadTable() throws IOException {
        final File file = writeTemp(".txt",
                "CHROM\tPOS\tREF\tALT",
                "chr1\t4\tC\tT",
                "chr1\t9\tg\tt",
                "chr2\t100\tA\tG");
        final List<TargetMutation> loci = LocusTableReader.read(file);
        Assert.assertEquals(loci.size(), 3);
        Assert.assertEquals(loci.get(0).getTargetKey(), "chr1:4:C:T");
        Assert.assertEquals(loci.get(1).getTargetKey(), "chr1:9:G:T");
        Assert.assertEquals(loci.get(2).getLocus(), new LocusKey("chr2", 100));
    }

    @Test
    public void testColumnOrderDoesNotMatter() throws IOException {
        final File file = writeTemp(".tsv",
                "ALT\tREF\tPOS\tCHROM\tNOTE",
                "T\tC\t4\tchr1\tkeep");
        Assert.assertEquals(LocusTableReader.read(file).get(0).getTargetKey(), "chr1:4:C:T");
    }

    @Test(expectedExceptions = PicardException.class)
    public void testMissingColumn() throws IOException {
        LocusTableReader.read(writeTemp(".txt", "CHROM\tPOS\tREF", "chr1\t4\tC"));
    }

    @Test(expectedExceptions = PicardException.class)
    public void testBadPosition() throws IOException {
        LocusTableReader.read(writeTemp(".txt", "CHROM\tPOS\tREF\tALT", "chr1\tfour\tC\tT"));
    }

    @Test(expectedExceptions = PicardException.class)
    public void testMultiBaseAllele() throws IOException {
        LocusTableReader.read(writeTemp(".txt", "CHROM\tPOS\tREF\tALT", "chr1\t4\tCA\tT"));
    }

    @Test
    public void testReadVcf() throws IOException {
        final File file = writeTemp(".vcf",
                "##fileformat=VCFv4.2",
                "##contig=<ID=chr1,length=1000>",
                "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO",
                "chr1\t4\t.\tC\tT\t.\tPASS\t.",
                "chr1\t9\t.\tG\tT,A\t.\tPASS\t.",
                "chr1\t12\t.\tTA\tT\t.\tPASS\t.",
                "chr1\t20\t.\tA\tG\t.\tPASS\t.");
        final List<TargetMutation> loci = LocusTableReader.read(file);
        Assert.assertEquals(loci.size(), 2);
        Assert.assertEquals(loci.get(0).getTargetKey(), "chr1:4:C:T");
        Assert.assertEquals(loci.get(1).getTargetKey(), "chr1:20:A:G");
    }
}
