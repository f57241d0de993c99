package cfdnapro.analysis.trinucleotide;

/**
 * Source of reference genome bases.
 */
public interface ReferenceAccessor {

    /**
     * Bases of {@code contig} from {@code start} to {@code end}, 1-based and inclusive, upper-cased.
     *
     * @return the bases, or null if the contig is unknown or the range runs off its end
     */
    String fetch(String contig, int start, int end);
}
