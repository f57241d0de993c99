package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.SkippedRecordCounter.SkipReason;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.SequenceUtil;
import picard.PicardException;

/**
 * Settles the status of each fragment-locus row and replaces the reference placeholders in its mate bases.
 *
 * When the upstream annotation carries a status label it is trusted, but the bases must agree with it. Without
 * a label the status is derived from the bases alone: one base is a single read, two bases are a pair.
 */
public class StatusResolver {
    /** Base token written when every covering mate shows the reference. */
    static final String REFERENCE_TOKEN = "REF";

    private final Log log = Log.getInstance(StatusResolver.class);

    /**
     * @return the resolved row, or null if it cannot take part in a consensus (the reason is counted)
     */
    public ResolvedSupport resolveOrNull(final FragmentLocusRow row, final SkippedRecordCounter skipped) {
        if (row.getTarget() == null) {
            log.debug("No locus table entry for ", row.getLocusKey(), " referenced by ", row.getFragmentId());
            skipped.count(SkipReason.UNRESOLVED_LOCUS);
            return null;
        }
        try {
            return resolve(row);
        } catch (final PicardException e) {
            log.debug("Skipping ", row, ": ", e.getMessage());
            skipped.count(SkipReason.MALFORMED_ANNOTATION);
            return null;
        }
    }

    /**
     * Resolve a row that has a locus table entry.
     *
     * @throws PicardException if the annotation is malformed or inconsistent with its status
     */
    public ResolvedSupport resolve(final FragmentLocusRow row) {
        final TargetMutation target = row.getTarget();
        if (target == null) throw new PicardException("No locus table entry for " + row.getLocusKey());
        if (!LocusKey.parse(row.getLocusInfo()).equals(target.getLocus())) {
            throw new PicardException("Annotation " + row.getLocusInfo() + " does not belong to " + target);
        }

        final String token = baseToken(row.getLocusInfo());
        final char ref = target.getRefBase();
        final char alt = target.getAltBase();

        final LocusStatus status;
        final MateObservation observation;
        if (isUnlabelled(row.getLocusStatus())) {
            if (token.equals(REFERENCE_TOKEN)) {
                throw new PicardException("Cannot tell single-read from concordant reference support without a status: " + row);
            }
            observation = parseBases(token, token.length() == 2).withPlaceholderResolved(ref);
            status = observation.classify(ref, alt);
        } else {
            status = LocusStatus.fromLabel(row.getLocusStatus().trim());
            if (status == LocusStatus.OUTER_FRAGMENT) {
                throw new PicardException("Outer fragment status on an annotated locus: " + row);
            }
            final MateObservation parsed;
            if (token.equals(REFERENCE_TOKEN)) {
                parsed = status.isSingleRead() ? MateObservation.singleRead(ref) : MateObservation.pair(ref, ref);
            } else {
                parsed = parseBases(token, !status.isSingleRead());
            }
            if (parsed.hasPlaceholder() && status != LocusStatus.MUT_DISCORDANT) {
                throw new PicardException("Reference placeholder outside a discordant pair: " + row);
            }
            observation = parsed.withPlaceholderResolved(ref);
            final LocusStatus observed = observation.classify(ref, alt);
            if (observed != status) {
                throw new PicardException("Bases " + observation + " at " + target + " mean " + observed + ", not " + status);
            }
        }

        final String candidates = status == LocusStatus.MUT_DISCORDANT
                ? observation.distinctBasesExcluding(ref)
                : String.valueOf(observation.getMate1Base());
        if (candidates.isEmpty()) {
            throw new PicardException("Discordant pair without a non-reference base: " + row);
        }
        return new ResolvedSupport(row, status, observation, candidates);
    }

    /** Third colon-delimited field of a {@code chr:pos:BASES[:...]} annotation. */
    static String baseToken(final String locusInfo) {
        final String[] fields = locusInfo.split(":");
        if (fields.length < 3 || fields[2].isEmpty()) {
            throw new PicardException("No bases in locus annotation: " + locusInfo);
        }
        return fields[2].trim().toUpperCase();
    }

    /**
     * Mate bases of a token. A paired observation given as one base means both mates agree on it.
     */
    private static MateObservation parseBases(final String token, final boolean paired) {
        if (token.length() > 2 || (!paired && token.length() != 1)) {
            throw new PicardException("Unexpected mate bases for a " + (paired ? "pair" : "single read") + ": " + token);
        }
        for (int i = 0; i < token.length(); i++) {
            final char base = token.charAt(i);
            if (base != MateObservation.REFERENCE_PLACEHOLDER && !SequenceUtil.isIUPAC((byte) base)) {
                throw new PicardException("Not a base: " + base + " in " + token);
            }
        }
        if (!paired) return MateObservation.singleRead(token.charAt(0));
        return token.length() == 1
                ? MateObservation.pair(token.charAt(0), token.charAt(0))
                : MateObservation.pair(token.charAt(0), token.charAt(1));
    }

    private static boolean isUnlabelled(final String status) {
        return status == null || status.trim().isEmpty() || status.trim().equals(".");
    }
}
