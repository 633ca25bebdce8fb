package org.winslowlab.ultraseq.utils;

/**
 * BaseUtils contains some basic utilities for manipulating nucleotides.
 */
public final class BaseUtils {

    private BaseUtils() {}

    /**
     * Return the Watson-Crick complement of a base (A <-> T, C <-> G, N <-> N), keeping its case.
     *
     * @param base the base [AaCcGgTtNn]
     * @return the complementary base, or the input base if it's not one of the understood ones
     */
    public static char simpleComplement(final char base) {
        switch (base) {
            case 'A':
                return 'T';
            case 'a':
                return 't';
            case 'C':
                return 'G';
            case 'c':
                return 'g';
            case 'G':
                return 'C';
            case 'g':
                return 'c';
            case 'T':
                return 'A';
            case 't':
                return 'a';
            case 'N':
                return 'N';
            case 'n':
                return 'n';
            default:
                return base;
        }
    }

    /**
     * Reverse complement a sequence of bases. Characters that are not nucleotides are moved but left unchanged.
     *
     * @param bases the sequence of bases, cannot be {@code null}
     * @return the reverse complement of the sequence
     */
    public static String simpleReverseComplement(final String bases) {
        Utils.nonNull(bases, "the bases cannot be null");
        final int length = bases.length();
        final char[] rcbases = new char[length];

        for (int i = 0; i < length; i++) {
            rcbases[i] = simpleComplement(bases.charAt(length - 1 - i));
        }

        return new String(rcbases);
    }
}
