package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.SkippedRecordCounter.SkipReason;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.ConsensusMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.EndMotifMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.FragmentLengthMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.SkippedRecordMetrics;
import cfdnapro.analysis.trinucleotide.TrinucleotideMetrics.SpectrumMetrics;
import htsjdk.samtools.util.Log;
import picard.PicardException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Collects fragment support per locus, then builds the consensus table, the SBS96 spectrum and the
 * fragment length and end motif comparisons of mutant-supporting fragments.
 *
 * Feed every fragment of a run through {@link #countFragment(Fragment)}, call {@link #finish()} once, and read
 * the results from the getters. With more than one thread, loci are evaluated concurrently; the reference
 * accessor must then tolerate concurrent calls.
 */
public class TrinucleotideSpectrumEngine {
    private final Log log = Log.getInstance(TrinucleotideSpectrumEngine.class);

    private final SpectrumOptions options;
    private final LocusFragmentJoiner joiner;
    private final StatusResolver resolver = new StatusResolver();
    private final ConsensusSelector selector;
    private final TrinucleotideNormalizer normalizer;
    private final SkippedRecordCounter skipped = new SkippedRecordCounter();
    private final FragmentLengthCollector lengths = new FragmentLengthCollector();
    private final EndMotifCollector motifs;

    private final Map<LocusKey, List<ResolvedSupport>> supportsByLocus = new TreeMap<LocusKey, List<ResolvedSupport>>();
    private long fragments = 0;
    private long outerFragments = 0;
    private boolean finished = false;

    private final List<ConsensusMetrics> consensusMetrics = new ArrayList<ConsensusMetrics>();
    private final List<SpectrumMetrics> spectrumMetrics = new ArrayList<SpectrumMetrics>();
    private final List<FragmentLengthMetrics> fragmentLengthMetrics = new ArrayList<FragmentLengthMetrics>();
    private final List<EndMotifMetrics> endMotifMetrics = new ArrayList<EndMotifMetrics>();

    public TrinucleotideSpectrumEngine(final Collection<TargetMutation> loci, final ReferenceAccessor reference,
                                       final SpectrumOptions options) {
        this.options = options;
        this.joiner = new LocusFragmentJoiner(loci);
        this.selector = new ConsensusSelector(options.getRandomSeed());
        this.normalizer = new TrinucleotideNormalizer(reference);
        this.motifs = new EndMotifCollector(reference, options.getMotifLength());
    }

    /**
     * Join one fragment to the locus table and resolve its status at every locus it overlaps.
     */
    public void countFragment(final Fragment fragment) {
        if (finished) throw new PicardException("Cannot count fragments after finish()");
        fragments++;
        for (final FragmentLocusRow row : joiner.join(fragment, skipped)) {
            if (row.isOuterFragment()) {
                outerFragments++;
                lengths.accept(row, null);
                continue;
            }
            final ResolvedSupport support = resolver.resolveOrNull(row, skipped);
            lengths.accept(row, support);
            motifs.accept(fragment, support);
            if (support != null) {
                List<ResolvedSupport> supports = supportsByLocus.get(row.getLocusKey());
                if (supports == null) {
                    supports = new ArrayList<ResolvedSupport>();
                    supportsByLocus.put(row.getLocusKey(), supports);
                }
                supports.add(support);
            }
        }
    }

    /**
     * Stop counting, pick the consensus of every locus and tally the spectrum.
     */
    public void finish() {
        if (finished) return;
        finished = true;
        log.info("Counted ", fragments, " fragments, ", outerFragments, " overlapping no locus, supporting ",
                supportsByLocus.size(), " of ", joiner.getNumberOfTargets(), " loci.");

        final List<ConsensusMetrics> evaluated = options.getThreads() > 1
                ? evaluateConcurrently(supportsByLocus.keySet())
                : evaluate(supportsByLocus.keySet());
        for (final ConsensusMetrics m : evaluated) {
            if (m != null) consensusMetrics.add(m);
        }

        final SpectrumAggregator aggregator = new SpectrumAggregator(options.isNormalizeCounts(),
                options.getExcludeIfTypePresent(), options.getRetainIfTypePresent(), options.getRemoveType());
        spectrumMetrics.addAll(aggregator.aggregate(consensusMetrics));

        fragmentLengthMetrics.addAll(lengths.getMetrics(options.getLengthComparison(), options.getRandomSeed()));
        endMotifMetrics.addAll(motifs.getMetrics());

        log.info("Finalized ", consensusMetrics.size(), " loci; skipped ", skipped.getTotal(), " records.");
    }

    private List<ConsensusMetrics> evaluate(final Collection<LocusKey> loci) {
        final List<ConsensusMetrics> evaluated = new ArrayList<ConsensusMetrics>(loci.size());
        for (final LocusKey locus : loci) evaluated.add(evaluateLocus(locus));
        return evaluated;
    }

    /** Results come back in the order of {@code loci}, whichever thread evaluated them. */
    private List<ConsensusMetrics> evaluateConcurrently(final Collection<LocusKey> loci) {
        final ExecutorService executor = Executors.newFixedThreadPool(options.getThreads());
        try {
            final List<Callable<ConsensusMetrics>> tasks = new ArrayList<Callable<ConsensusMetrics>>(loci.size());
            for (final LocusKey locus : loci) {
                tasks.add(new Callable<ConsensusMetrics>() {
                    @Override
                    public ConsensusMetrics call() {
                        return evaluateLocus(locus);
                    }
                });
            }
            final List<ConsensusMetrics> evaluated = new ArrayList<ConsensusMetrics>(loci.size());
            for (final Future<ConsensusMetrics> result : executor.invokeAll(tasks)) {
                evaluated.add(result.get());
            }
            return evaluated;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PicardException("Interrupted while evaluating loci", e);
        } catch (final ExecutionException e) {
            throw new PicardException("Failed to evaluate loci", e.getCause());
        } finally {
            executor.shutdown();
        }
    }

    private ConsensusMetrics evaluateLocus(final LocusKey locus) {
        final List<ResolvedSupport> supports = supportsByLocus.get(locus);
        final TargetMutation target = joiner.getTarget(locus);
        final LocusConsensus consensus = selector.select(target, supports);
        if (consensus == null) {
            skipped.count(SkipReason.NO_SUPPORT);
            return null;
        }
        final Sbs96Channel channel = normalizer.normalizeOrNull(consensus, skipped);
        if (channel == null) return null;

        final ConsensusMetrics m = new ConsensusMetrics();
        m.TARGET_MUTATION = target.getTargetKey();
        m.setTally(consensus.getTally());
        m.CONSENSUS_MISMATCH = consensus.getConsensusMismatch();
        m.CONSENSUS_TYPE = consensus.getCategory().name();
        m.REF_TRINUCLEOTIDE = channel.getReferenceContext();
        m.SBS96 = channel.getLabel();
        return m;
    }

    public List<ConsensusMetrics> getConsensusMetrics() { return consensusMetrics; }
    public List<SpectrumMetrics> getSpectrumMetrics() { return spectrumMetrics; }
    public List<SkippedRecordMetrics> getSkippedRecordMetrics() { return skipped.toMetrics(); }
    public SkippedRecordCounter getSkippedRecordCounter() { return skipped; }
    public List<FragmentLengthMetrics> getFragmentLengthMetrics() { return fragmentLengthMetrics; }
    public List<EndMotifMetrics> getEndMotifMetrics() { return endMotifMetrics; }

    /** Fragments seen, duplicates included. */
    public long getFragmentCount() { return fragments; }

    /** De-duplicated fragments that overlap no locus. */
    public long getOuterFragmentCount() { return outerFragments; }
}
