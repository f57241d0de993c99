package cfdnapro.analysis.trinucleotide;

/**
 * A fragment-locus row whose status is settled and whose mate bases are free of placeholders.
 */
public final class ResolvedSupport {
    private final FragmentLocusRow row;
    private final LocusStatus status;
    private final MateObservation observation;
    private final String candidateBases;

    ResolvedSupport(final FragmentLocusRow row, final LocusStatus status, final MateObservation observation,
                    final String candidateBases) {
        this.row = row;
        this.status = status;
        this.observation = observation;
        this.candidateBases = candidateBases;
    }

    public FragmentLocusRow getRow() { return row; }
    public LocusStatus getStatus() { return status; }
    public SupportCategory getCategory() { return status.getCategory(); }
    public MateObservation getObservation() { return observation; }

    /**
     * Bases this fragment could contribute as the consensus mismatch: the observed base, or for a discordant
     * pair the one or two non-reference mate bases.
     */
    public String getCandidateBases() { return candidateBases; }

    @Override
    public String toString() {
        return row.getFragmentId() + " " + status + " " + observation;
    }
}
