package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.ConsensusMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.EndMotifMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.FragmentLengthMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.SkippedRecordMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.SpectrumMetrics;
import htsjdk.samtools.metrics.MetricBase;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.IOUtil;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class CollectTrinucleotideSpectrumTest {
    private File workDir;
    private File fasta;
    private File loci;
    private File fragments;

    @BeforeClass
    public void setUp() throws IOException {
        workDir = Files.createTempDirectory("CollectTrinucleotideSpectrumTest").toFile();
        fasta = IndexedFastaReferenceAccessorUnitTest.writeIndexedFasta("chr1", "TTACGTTAGATTTTTTTTTT");
        loci = LocusTableReaderUnitTest.writeTemp(".txt",
                "CHROM\tPOS\tREF\tALT",
                "chr1\t4\tC\tT",
                "chr1\t9\tG\tT",
                "chr1\t12\tT\tC",
                "chr1\t20\tT\tA");
        fragments = LocusTableReaderUnitTest.writeTemp(".txt",
                "FRAGMENT_ID\tCHROM\tSTART\tEND\tSTRAND\tLOCUS_INFO\tLOCUS_STATUS",
                "f1\tchr1\t1\t150\t+\tchr1:4:TT\tMUT:concordant",
                "f2\tchr1\t1\t160\t+\tchr1:4:TT\tMUT:concordant",
                "f3\tchr1\t2\t171\t-\tchr1:4:T\tMUT:single_read",
                "f4\tchr1\t3\t182\t+\tchr1:4:REF\tREF:single_read",
                "f4.1\tchr1\t3\t182\t+\tchr1:4:TT\tMUT:concordant",
                "f5\tchr1\t1\t140\t+\tchr1:9:AG\t.",
                "f5\tchr1\t1\t140\t+\tchr1:12:REF\tREF:concordant",
                "f6\tchr1\t5\t200\t-\t.\t.",
                "f7\tchr1\t8\t210\t+\tchr1:20:A\tMUT:single_read",
                "f8\tchr2\t1\t100\t+\tchr2:50:A\tMUT:single_read");
    }

    @AfterClass
    public void tearDown() {
        IOUtil.deleteDirectoryTree(workDir);
    }

    private CollectTrinucleotideSpectrum program(final String outputName) {
        final File reference = fasta;
        final CollectTrinucleotideSpectrum program = new CollectTrinucleotideSpectrum() {{
            REFERENCE_SEQUENCE = reference;
        }};
        program.FRAGMENTS = fragments;
        program.LOCI = loci;
        program.OUTPUT = new File(workDir, outputName);
        return program;
    }

    private static List<MetricBase> readBeans(final File file) {
        Assert.assertTrue(file.exists(), file + " was not written");
        return MetricsFile.readBeans(file);
    }

    private static List<ConsensusMetrics> readConsensus(final File file) {
        final List<ConsensusMetrics> metrics = new ArrayList<ConsensusMetrics>();
        for (final MetricBase bean : readBeans(file)) metrics.add((ConsensusMetrics) bean);
        return metrics;
    }

    private static List<SpectrumMetrics> readSpectrum(final File file) {
        final List<SpectrumMetrics> metrics = new ArrayList<SpectrumMetrics>();
        for (final MetricBase bean : readBeans(file)) metrics.add((SpectrumMetrics) bean);
        return metrics;
    }

    @Test
    public void testCollect() {
        final CollectTrinucleotideSpectrum program = program("sample");
        Assert.assertEquals(program.doWork(), 0);

        final List<ConsensusMetrics> consensus =
                readConsensus(new File(program.OUTPUT + CollectTrinucleotideSpectrum.CONSENSUS_EXT));
        Assert.assertEquals(consensus.size(), 2);

        final ConsensusMetrics first = consensus.get(0);
        Assert.assertEquals(first.TARGET_MUTATION, "chr1:4:C:T");
        Assert.assertEquals(first.CO_MUT, 2);
        Assert.assertEquals(first.SO_MUT, 1);
        Assert.assertEquals(first.SO_REF, 1);
        Assert.assertEquals(first.CO_MUT_FLENGTH.doubleValue(), 155.0, 1e-6);
        Assert.assertNull(first.DO_FLENGTH);
        Assert.assertEquals(first.CONSENSUS_MISMATCH, "chr1:4:T:MUT");
        Assert.assertEquals(first.SBS96, "A[C>T]G");

        // unlabelled A/G pair at a G>T locus: discordant, the non-reference mate is the consensus
        final ConsensusMetrics second = consensus.get(1);
        Assert.assertEquals(second.TARGET_MUTATION, "chr1:9:G:T");
        Assert.assertEquals(second.DO, 1);
        Assert.assertEquals(second.CONSENSUS_TYPE, "DO");
        Assert.assertEquals(second.CONSENSUS_MISMATCH, "chr1:9:A:discordant");
        Assert.assertEquals(second.REF_TRINUCLEOTIDE, "TCT");
        Assert.assertEquals(second.SBS96, "T[C>T]T");

        final List<SpectrumMetrics> spectrum =
                readSpectrum(new File(program.OUTPUT + CollectTrinucleotideSpectrum.SPECTRUM_EXT));
        Assert.assertEquals(spectrum.size(), 288);
        double total = 0;
        for (final SpectrumMetrics m : spectrum) total += m.VALUE;
        Assert.assertEquals(total, 1.0, 1e-4);

        final Map<String, Long> skipped = new HashMap<String, Long>();
        for (final MetricBase m : readBeans(new File(program.OUTPUT + CollectTrinucleotideSpectrum.SKIPPED_EXT))) {
            final SkippedRecordMetrics s = (SkippedRecordMetrics) m;
            skipped.put(s.REASON, s.COUNT);
        }
        Assert.assertEquals(skipped.get("DUPLICATE_FRAGMENT").longValue(), 1);
        Assert.assertEquals(skipped.get("UNRESOLVED_LOCUS").longValue(), 1);
        Assert.assertEquals(skipped.get("NO_SUPPORT").longValue(), 1);
        // chr1:20 has no 3' neighbour in the reference
        Assert.assertEquals(skipped.get("AMBIGUOUS_BASE").longValue(), 1);
        Assert.assertEquals(skipped.get("MALFORMED_ANNOTATION").longValue(), 0);
    }

    @Test
    public void testCountsAndFilters() {
        final CollectTrinucleotideSpectrum program = program("filtered");
        program.NORMALIZE_COUNTS = false;
        program.EXCLUDE_IF_TYPE_PRESENT = EnumSet.of(SupportCategory.SO_REF);
        Assert.assertEquals(program.doWork(), 0);

        // the filter only applies to the spectrum
        Assert.assertEquals(readBeans(new File(program.OUTPUT + CollectTrinucleotideSpectrum.CONSENSUS_EXT)).size(), 2);

        final List<SpectrumMetrics> spectrum =
                readSpectrum(new File(program.OUTPUT + CollectTrinucleotideSpectrum.SPECTRUM_EXT));
        double total = 0;
        for (final SpectrumMetrics m : spectrum) {
            total += m.VALUE;
            if (m.SBS96.equals("T[C>T]T") && m.OVERLAP_TYPE.equals("DO")) Assert.assertEquals(m.VALUE, 1.0);
        }
        Assert.assertEquals(total, 1.0);
    }

    @Test
    public void testThreadsValidation() {
        final CollectTrinucleotideSpectrum program = program("invalid");
        program.THREADS = 0;
        Assert.assertNotNull(program.customCommandLineValidation());
        program.THREADS = 2;
        program.MOTIF_LENGTH = 0;
        Assert.assertNotNull(program.customCommandLineValidation());
        program.MOTIF_LENGTH = 4;
        final String[] messages = program.customCommandLineValidation();
        Assert.assertTrue(messages == null || messages.length == 0);
    }

    @Test
    public void testFragmentLengthsAndEndMotifs() {
        final CollectTrinucleotideSpectrum program = program("lengths");
        Assert.assertEquals(program.doWork(), 0);

        // reference rows: f4 (180) and f5 at chr1:12 (140); alternate rows: f1, f2, f3 and f7 (203)
        final List<FragmentLengthMetrics> lengths = new ArrayList<FragmentLengthMetrics>();
        for (final MetricBase bean : readBeans(new File(program.OUTPUT + CollectTrinucleotideSpectrum.FRAGMENT_LENGTH_EXT))) {
            lengths.add((FragmentLengthMetrics) bean);
        }
        Assert.assertEquals(lengths.size(), 6);
        final int[] sizes = {140, 180, 150, 160, 170, 205};
        for (int i = 0; i < sizes.length; i++) {
            final FragmentLengthMetrics m = lengths.get(i);
            Assert.assertEquals(m.COMPARISON, "MUT_VS_REF");
            Assert.assertEquals(m.MUTANT, i >= 2);
            Assert.assertEquals(m.SIZE, sizes[i]);
            Assert.assertEquals(m.COUNT, 1);
            Assert.assertEquals(m.PROPORTION, 1 / 6.0, 1e-4);
        }

        // fragment ends past the 20 bp contig are not counted, so only left ends remain
        final Map<String, EndMotifMetrics> motifs = new HashMap<String, EndMotifMetrics>();
        for (final MetricBase bean : readBeans(new File(program.OUTPUT + CollectTrinucleotideSpectrum.END_MOTIF_EXT))) {
            final EndMotifMetrics m = (EndMotifMetrics) bean;
            motifs.put(m.MOTIF, m);
        }
        Assert.assertEquals(motifs.size(), 64);
        Assert.assertEquals(motifs.get("TTA").N_MUT, 2);
        Assert.assertEquals(motifs.get("TTA").FRACTION_MUT, 0.5, 1e-4);
        Assert.assertEquals(motifs.get("TTA").N_REF, 1);
        Assert.assertEquals(motifs.get("TAC").N_MUT, 1);
        Assert.assertEquals(motifs.get("AGA").N_MUT, 1);
        Assert.assertEquals(motifs.get("ACG").N_REF, 1);
        Assert.assertEquals(motifs.get("ACG").FRACTION_REF, 0.5, 1e-4);
        Assert.assertEquals(motifs.get("GGG").N_REF + motifs.get("GGG").N_MUT, 0);
    }

    @Test
    public void testRemoveType() {
        final CollectTrinucleotideSpectrum program = program("removed");
        program.NORMALIZE_COUNTS = false;
        program.REMOVE_TYPE = EnumSet.of(SupportCategory.CO_MUT);
        Assert.assertEquals(program.doWork(), 0);

        // chr1:4 has one single-read alternate fragment left once concordant support is read as zero
        for (final SpectrumMetrics m : readSpectrum(new File(program.OUTPUT + CollectTrinucleotideSpectrum.SPECTRUM_EXT))) {
            if (m.SBS96.equals("A[C>T]G") && m.OVERLAP_TYPE.equals("SO_MUT")) Assert.assertEquals(m.VALUE, 1.0);
            if (m.SBS96.equals("A[C>T]G") && m.OVERLAP_TYPE.equals("CO_MUT")) Assert.assertEquals(m.VALUE, 0.0);
        }
    }
}
