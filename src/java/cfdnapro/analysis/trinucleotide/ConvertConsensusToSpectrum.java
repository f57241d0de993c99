package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.ConsensusMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.SpectrumMetrics;
import htsjdk.samtools.metrics.MetricBase;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.IOUtil;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import picard.PicardException;
import picard.cmdline.CommandLineProgram;
import picard.cmdline.StandardOptionDefinitions;
import picard.cmdline.programgroups.DiagnosticsAndQCProgramGroup;

import java.io.File;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@CommandLineProgramProperties(
        summary = ConvertConsensusToSpectrum.USAGE,
        oneLineSummary = ConvertConsensusToSpectrum.USAGE,
        programGroup = DiagnosticsAndQCProgramGroup.class
)
public class ConvertConsensusToSpectrum extends CommandLineProgram {
    static final String USAGE = "Rebuild an SBS96 spectrum from trinucleotide consensus metrics, with other filters or normalization.";

    @Argument(shortName = StandardOptionDefinitions.INPUT_SHORT_NAME,
            doc = "Consensus metrics written by CollectTrinucleotideSpectrum.")
    public File INPUT;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output spectrum metrics. Defaults to the input basename with the spectrum extension.",
            optional = true)
    public File OUTPUT;

    @Argument(doc = "Report spectrum values as fractions of all counted loci instead of counts.")
    public boolean NORMALIZE_COUNTS = true;

    @Argument(doc = "Leave loci out of the spectrum if they have any support of these types.", optional = true)
    public Set<SupportCategory> EXCLUDE_IF_TYPE_PRESENT = new HashSet<SupportCategory>();

    @Argument(doc = "If given, only count loci that have support of at least one of these types.", optional = true)
    public Set<SupportCategory> RETAIN_IF_TYPE_PRESENT = new HashSet<SupportCategory>();

    @Argument(doc = "Support types read as zero when deciding whether an alternate-base consensus is counted as " +
            "concordant or single-read.", optional = true)
    public Set<SupportCategory> REMOVE_TYPE = new HashSet<SupportCategory>();

    public static void main(final String[] args) {
        new ConvertConsensusToSpectrum().instanceMainWithExit(args);
    }

    @Override
    protected int doWork() {
        if (OUTPUT == null) {
            final String input = INPUT.getPath();
            final String base = input.endsWith(CollectTrinucleotideSpectrum.CONSENSUS_EXT)
                    ? input.substring(0, input.length() - CollectTrinucleotideSpectrum.CONSENSUS_EXT.length())
                    : input;
            OUTPUT = new File(base + CollectTrinucleotideSpectrum.SPECTRUM_EXT);
        }
        IOUtil.assertFileIsReadable(INPUT);
        IOUtil.assertFileIsWritable(OUTPUT);

        final List<ConsensusMetrics> loci = new ArrayList<ConsensusMetrics>();
        for (final MetricBase bean : MetricsFile.readBeans(INPUT)) {
            if (!(bean instanceof ConsensusMetrics)) {
                throw new PicardException(INPUT + " does not hold trinucleotide consensus metrics");
            }
            loci.add((ConsensusMetrics) bean);
        }

        final SpectrumAggregator aggregator = new SpectrumAggregator(NORMALIZE_COUNTS, EXCLUDE_IF_TYPE_PRESENT,
                RETAIN_IF_TYPE_PRESENT, REMOVE_TYPE);
        final MetricsFile<SpectrumMetrics, Integer> outputFile = getMetricsFile();
        outputFile.addAllMetrics(aggregator.aggregate(loci));
        outputFile.write(OUTPUT);
        return 0;
    }
}
