package cfdnapro.analysis.trinucleotide;

import htsjdk.samtools.metrics.MetricBase;

/**
 * Metrics written by {@link CollectTrinucleotideSpectrum} and {@link ConvertConsensusToSpectrum}.
 */
public final class TrinucleotideMetrics {

    private TrinucleotideMetrics() {}

    /**
     * One row per locus that reached a consensus and an SBS96 channel.
     */
    public static class ConsensusMetrics extends MetricBase {
        /** The target substitution, chr:pos:ref:alt. */
        public String TARGET_MUTATION;

        /** Fragments whose two mates both show the alternate base. */
        public int CO_MUT;
        /** Fragments with a single covering mate showing the alternate base. */
        public int SO_MUT;
        /** Fragments whose two mates both show the reference base. */
        public int CO_REF;
        /** Fragments with a single covering mate showing the reference base. */
        public int SO_REF;
        /** Fragments whose mates disagree. */
        public int DO;
        /** Fragments with a single covering mate showing neither reference nor alternate. */
        public int SO_OTHER;
        /** Fragments whose two mates agree on a base that is neither reference nor alternate. */
        public int CO_OTHER;

        /** Median fragment length per category; empty when the category has no fragments. */
        public Double CO_MUT_FLENGTH;
        public Double SO_MUT_FLENGTH;
        public Double CO_REF_FLENGTH;
        public Double SO_REF_FLENGTH;
        public Double DO_FLENGTH;
        public Double SO_OTHER_FLENGTH;
        public Double CO_OTHER_FLENGTH;

        /** chr:pos:base:tag of the fragment chosen to represent the locus. */
        public String CONSENSUS_MISMATCH;
        /** The support category the consensus was drawn from. */
        public String CONSENSUS_TYPE;
        /** Reference trinucleotide on the pyrimidine strand. */
        public String REF_TRINUCLEOTIDE;
        /** SBS96 channel, e.g. A[C>T]G. */
        public String SBS96;

        public int getCount(final SupportCategory category) {
            switch (category) {
                case CO_MUT: return CO_MUT;
                case SO_MUT: return SO_MUT;
                case CO_REF: return CO_REF;
                case SO_REF: return SO_REF;
                case DO: return DO;
                case SO_OTHER: return SO_OTHER;
                case CO_OTHER: return CO_OTHER;
                default: throw new IllegalArgumentException("Unknown category " + category);
            }
        }

        void setTally(final SupportTally tally) {
            CO_MUT = tally.getCount(SupportCategory.CO_MUT);
            SO_MUT = tally.getCount(SupportCategory.SO_MUT);
            CO_REF = tally.getCount(SupportCategory.CO_REF);
            SO_REF = tally.getCount(SupportCategory.SO_REF);
            DO = tally.getCount(SupportCategory.DO);
            SO_OTHER = tally.getCount(SupportCategory.SO_OTHER);
            CO_OTHER = tally.getCount(SupportCategory.CO_OTHER);

            CO_MUT_FLENGTH = tally.getMedianLength(SupportCategory.CO_MUT);
            SO_MUT_FLENGTH = tally.getMedianLength(SupportCategory.SO_MUT);
            CO_REF_FLENGTH = tally.getMedianLength(SupportCategory.CO_REF);
            SO_REF_FLENGTH = tally.getMedianLength(SupportCategory.SO_REF);
            DO_FLENGTH = tally.getMedianLength(SupportCategory.DO);
            SO_OTHER_FLENGTH = tally.getMedianLength(SupportCategory.SO_OTHER);
            CO_OTHER_FLENGTH = tally.getMedianLength(SupportCategory.CO_OTHER);
        }
    }

    /**
     * Long-form SBS96 spectrum: one row per channel and overlap type.
     */
    public static class SpectrumMetrics extends MetricBase {
        public String SBS96;
        public String MUTATION_TYPE;
        /** CO_MUT, SO_MUT or DO. */
        public String OVERLAP_TYPE;
        /** A count, or a fraction of all counted loci when normalized. */
        public double VALUE;
    }

    /**
     * Number of records left out of the analysis, per reason.
     */
    public static class SkippedRecordMetrics extends MetricBase {
        public String REASON;
        public long COUNT;
    }

    /**
     * Binned lengths of fragments supporting the alternate base against a comparison set of fragments.
     */
    public static class FragmentLengthMetrics extends MetricBase {
        /** The comparison the rows belong to, e.g. MUT_VS_REF. */
        public String COMPARISON;
        /** True for fragments supporting the alternate base, false for the comparison fragments. */
        public boolean MUTANT;
        /** Fragment length rounded to the nearest multiple of five. */
        public int SIZE;
        public long COUNT;
        /** COUNT over all fragments of both groups. */
        public double PROPORTION;
    }

    /**
     * Fragment end motifs of reference-supporting and alternate-supporting fragments.
     */
    public static class EndMotifMetrics extends MetricBase {
        public String MOTIF;
        public long N_REF;
        public double FRACTION_REF;
        public long N_MUT;
        public double FRACTION_MUT;
    }
}
