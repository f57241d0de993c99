package cfdnapro.analysis.trinucleotide;

import cfdnapro.analysis.trinucleotide.SkippedRecordCounter.SkipReason;
import htsjdk.samtools.util.Log;
import picard.PicardException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Attaches locus table entries to fragment annotations, one row per (fragment, locus) overlap.
 *
 * Fragments are de-duplicated on their logical identifier: upstream disambiguation suffixes such as
 * {@code readX.1} are stripped and only the first fragment seen for an identifier is kept. A joiner therefore
 * carries state across calls and is meant to see each fragment of a run exactly once.
 */
public class LocusFragmentJoiner {
    private static final Pattern DISAMBIGUATION_SUFFIX = Pattern.compile("\\.\\d+$");

    private final Log log = Log.getInstance(LocusFragmentJoiner.class);

    private final Map<LocusKey, TargetMutation> targets;
    private final Set<String> seenFragmentIds = new HashSet<String>();

    public LocusFragmentJoiner(final Collection<TargetMutation> loci) {
        this.targets = new HashMap<LocusKey, TargetMutation>();
        for (final TargetMutation target : loci) {
            final TargetMutation existing = this.targets.putIfAbsent(target.getLocus(), target);
            if (existing != null && !existing.equals(target)) {
                log.warn("Locus " + target.getLocus() + " listed more than once, keeping " + existing + " over " + target);
            }
        }
    }

    /** Strips the {@code .N} suffix added upstream to tell apart fragments sharing a read name. */
    public static String logicalFragmentId(final String fragmentId) {
        return DISAMBIGUATION_SUFFIX.matcher(fragmentId).replaceFirst("");
    }

    public TargetMutation getTarget(final LocusKey key) {
        return targets.get(key);
    }

    public int getNumberOfTargets() {
        return targets.size();
    }

    /**
     * Join one fragment. Returns no rows when the fragment duplicates one already seen, a single outer-fragment
     * row when it carries no annotation, and otherwise one row per parseable annotation. Rows for loci missing
     * from the table have a null target.
     */
    public List<FragmentLocusRow> join(final Fragment fragment, final SkippedRecordCounter skipped) {
        final String fragmentId = logicalFragmentId(fragment.getId());
        if (!seenFragmentIds.add(fragmentId)) {
            log.debug("Dropping duplicate fragment ", fragment.getId(), " of ", fragmentId);
            skipped.count(SkipReason.DUPLICATE_FRAGMENT);
            return Collections.emptyList();
        }

        if (fragment.getAnnotations().isEmpty()) {
            return Collections.singletonList(FragmentLocusRow.outerFragment(fragmentId, fragment.getWidth()));
        }

        final List<FragmentLocusRow> rows = new ArrayList<FragmentLocusRow>(fragment.getAnnotations().size());
        for (final Fragment.LocusAnnotation annotation : fragment.getAnnotations()) {
            final LocusKey key;
            try {
                key = annotation.getLocusKey();
            } catch (final PicardException e) {
                log.debug("Cannot read locus of ", fragmentId, ": ", e.getMessage());
                skipped.count(SkipReason.MALFORMED_ANNOTATION);
                continue;
            }
            rows.add(new FragmentLocusRow(fragmentId, fragment.getWidth(), key, targets.get(key),
                    annotation.getLocusInfo(), annotation.getLocusStatus()));
        }
        return rows;
    }
}
