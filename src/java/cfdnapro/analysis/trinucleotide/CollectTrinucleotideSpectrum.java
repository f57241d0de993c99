package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.ConsensusMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.EndMotifMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.FragmentLengthMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.SkippedRecordMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.SpectrumMetrics;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import picard.PicardException;
import picard.cmdline.CommandLineProgram;
import picard.cmdline.StandardOptionDefinitions;
import picard.cmdline.programgroups.DiagnosticsAndQCProgramGroup;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Summarize how cfDNA fragments support each target mutation, and build the SBS96 trinucleotide
 * spectrum of the loci where a mutation is supported.
 *
 * Each fragment overlapping a target locus is classified by what its mates show there: both mates or one
 * mate showing the reference, the alternate or another base, or mates disagreeing. Per locus, one consensus
 * mismatch is chosen with concordant alternate support taking precedence over single-read alternate support,
 * which takes precedence over everything else. The consensus is placed in its pyrimidine-referenced
 * trinucleotide channel and counted by read-pair overlap type.
 *
 * The lengths and end motifs of fragments supporting the alternate base are compared with those of
 * reference-supporting fragments (or, for lengths, of fragments overlapping no locus).
 *
 * Inputs are the annotated fragment table and locus table written by the upstream pileup step; see
 * {@link FragmentTableReader} and {@link LocusTableReader} for their layout.
 */
@CommandLineProgramProperties(
        summary = CollectTrinucleotideSpectrum.USAGE_DETAILS,
        oneLineSummary = CollectTrinucleotideSpectrum.USAGE_SUMMARY,
        programGroup = DiagnosticsAndQCProgramGroup.class
)
public class CollectTrinucleotideSpectrum extends CommandLineProgram {
    static final String USAGE_SUMMARY = "Collect per-locus mutation consensus and the SBS96 spectrum of cfDNA fragments.";
    static final String USAGE_DETAILS = USAGE_SUMMARY +
            " Writes OUTPUT.trinucleotide_consensus_metrics (one row per locus), OUTPUT.sbs96_spectrum_metrics " +
            "(one row per SBS96 channel and overlap type), OUTPUT.fragment_length_metrics, OUTPUT.end_motif_metrics " +
            "and OUTPUT.skipped_record_metrics.";

    public static final String CONSENSUS_EXT = ".trinucleotide_consensus_metrics";
    public static final String SPECTRUM_EXT = ".sbs96_spectrum_metrics";
    public static final String SKIPPED_EXT = ".skipped_record_metrics";
    public static final String FRAGMENT_LENGTH_EXT = ".fragment_length_metrics";
    public static final String END_MOTIF_EXT = ".end_motif_metrics";

    @Argument(shortName = "F", doc = "Fragment table: one row per fragment and overlapped locus.")
    public File FRAGMENTS;

    @Argument(shortName = "L", doc = "Target loci, as a VCF or a table with CHROM, POS, REF and ALT columns.")
    public File LOCI;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME, doc = "Basename for the output metrics files.")
    public File OUTPUT;

    @Argument(doc = "Report spectrum values as fractions of all counted loci instead of counts.")
    public boolean NORMALIZE_COUNTS = true;

    @Argument(doc = "Seed for the random choices between equally supported categories, fragments and bases.")
    public long RANDOM_SEED = ConsensusSelector.DEFAULT_SEED;

    @Argument(doc = "Number of threads used to evaluate loci.")
    public int THREADS = 1;

    @Argument(doc = "Leave loci out of the spectrum if they have any support of these types.", optional = true)
    public Set<SupportCategory> EXCLUDE_IF_TYPE_PRESENT = new HashSet<SupportCategory>();

    @Argument(doc = "If given, only count loci in the spectrum that have support of at least one of these types.", optional = true)
    public Set<SupportCategory> RETAIN_IF_TYPE_PRESENT = new HashSet<SupportCategory>();

    @Argument(doc = "Support types read as zero when deciding whether an alternate-base consensus is counted as " +
            "concordant or single-read.", optional = true)
    public Set<SupportCategory> REMOVE_TYPE = new HashSet<SupportCategory>();

    @Argument(doc = "Fragments the lengths of alternate-supporting fragments are compared against. The _NORM " +
            "variants draw as many comparison fragments as there are alternate-supporting ones.")
    public LengthComparison LENGTH_COMPARISON = LengthComparison.MUT_VS_REF;

    @Argument(doc = "Number of bases in a fragment end motif.")
    public int MOTIF_LENGTH = SpectrumOptions.DEFAULT_MOTIF_LENGTH;

    private final Log log = Log.getInstance(CollectTrinucleotideSpectrum.class);

    public static void main(final String[] args) {
        new CollectTrinucleotideSpectrum().instanceMainWithExit(args);
    }

    @Override
    protected boolean requiresReference() {
        return true;
    }

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> messages = new ArrayList<String>();
        if (THREADS < 1) messages.add("THREADS must be at least 1");
        if (MOTIF_LENGTH < 1) messages.add("MOTIF_LENGTH must be at least 1");
        return messages.isEmpty() ? super.customCommandLineValidation() : messages.toArray(new String[messages.size()]);
    }

    @Override
    protected int doWork() {
        final File consensusOut = new File(OUTPUT + CONSENSUS_EXT);
        final File spectrumOut = new File(OUTPUT + SPECTRUM_EXT);
        final File skippedOut = new File(OUTPUT + SKIPPED_EXT);
        final File lengthOut = new File(OUTPUT + FRAGMENT_LENGTH_EXT);
        final File motifOut = new File(OUTPUT + END_MOTIF_EXT);

        IOUtil.assertFileIsReadable(FRAGMENTS);
        IOUtil.assertFileIsReadable(LOCI);
        IOUtil.assertFileIsReadable(REFERENCE_SEQUENCE);
        IOUtil.assertFileIsWritable(consensusOut);
        IOUtil.assertFileIsWritable(spectrumOut);
        IOUtil.assertFileIsWritable(skippedOut);
        IOUtil.assertFileIsWritable(lengthOut);
        IOUtil.assertFileIsWritable(motifOut);

        final List<TargetMutation> loci = LocusTableReader.read(LOCI);
        final List<Fragment> fragments = FragmentTableReader.read(FRAGMENTS);
        final SpectrumOptions options = new SpectrumOptions(RANDOM_SEED, NORMALIZE_COUNTS, THREADS,
                EXCLUDE_IF_TYPE_PRESENT, RETAIN_IF_TYPE_PRESENT, REMOVE_TYPE, LENGTH_COMPARISON, MOTIF_LENGTH);

        final TrinucleotideSpectrumEngine engine;
        try (final IndexedFastaReferenceAccessor reference = new IndexedFastaReferenceAccessor(REFERENCE_SEQUENCE)) {
            engine = new TrinucleotideSpectrumEngine(loci, reference, options);
            for (final Fragment fragment : fragments) {
                engine.countFragment(fragment);
            }
            engine.finish();
        } catch (final IOException e) {
            throw new PicardException("Error closing reference " + REFERENCE_SEQUENCE, e);
        }

        final MetricsFile<ConsensusMetrics, Integer> consensusFile = getMetricsFile();
        consensusFile.addAllMetrics(engine.getConsensusMetrics());
        consensusFile.write(consensusOut);

        final MetricsFile<SpectrumMetrics, Integer> spectrumFile = getMetricsFile();
        spectrumFile.addAllMetrics(engine.getSpectrumMetrics());
        spectrumFile.write(spectrumOut);

        final MetricsFile<SkippedRecordMetrics, Integer> skippedFile = getMetricsFile();
        skippedFile.addAllMetrics(engine.getSkippedRecordMetrics());
        skippedFile.write(skippedOut);

        final MetricsFile<FragmentLengthMetrics, Integer> lengthFile = getMetricsFile();
        lengthFile.addAllMetrics(engine.getFragmentLengthMetrics());
        lengthFile.write(lengthOut);

        final MetricsFile<EndMotifMetrics, Integer> motifFile = getMetricsFile();
        motifFile.addAllMetrics(engine.getEndMotifMetrics());
        motifFile.write(motifOut);

        log.info("Wrote ", engine.getConsensusMetrics().size(), " consensus loci to ", consensusOut);
        return 0;
    }
}
