package cfdnapro.analysis.trinucleotide;

/**
 * Read-pair topology by which a locus was supported: both mates, one mate, or mates disagreeing.
 */
public enum OverlapType {
    CO_MUT,
    SO_MUT,
    DO
}
