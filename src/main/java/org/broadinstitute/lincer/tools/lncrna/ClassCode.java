package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;

/**
 * Relationship between a query transcript and its closest reference transcript, as reported by the
 * transcript comparator (Cuffcompare and gffcompare share this vocabulary).
 */
public enum ClassCode {
    EXACT_MATCH('=', "complete match of the intron chain"),
    CONTAINED('c', "contained in a reference transcript"),
    CONTAINMENT('k', "contains a reference transcript"),
    RETAINED_INTRONS('m', "retains all introns of a reference transcript"),
    RETAINED_INTRON('n', "retains some introns of a reference transcript"),
    SPLICE_JUNCTION_MATCH('j', "shares at least one splice junction with a reference transcript"),
    INTRON_OVERHANG('e', "single exon overlapping a reference exon and at least 10 bp of a reference intron"),
    GENERIC_OVERLAP('o', "generic exonic overlap with a reference transcript"),
    INTRON_ANTISENSE('s', "intron of the transcript overlaps a reference intron on the opposite strand"),
    EXONIC_ANTISENSE('x', "exonic overlap with a reference on the opposite strand"),
    INTRONIC('i', "falls entirely within a reference intron"),
    CONTAINS_REFERENCE('y', "contains a reference within its intron(s)"),
    POLYMERASE_RUN('p', "possible polymerase run-on fragment"),
    REPEAT('r', "repeat"),
    INTERGENIC('u', "unknown, intergenic transcript"),
    NO_MATCH('.', "tracking file only, multiple classifications"),
    // any other code a comparator may write; never a novel class code
    UNKNOWN('?', "class code not recognized by lincer");

    private final char code;
    private final String description;

    ClassCode(final char code, final String description) {
        this.code = code;
        this.description = description;
    }

    public char getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Strict lookup, for codes given by the user.
     *
     * @param code a one character class code
     * @throws IllegalArgumentException if {@code code} is not one of the known class codes
     */
    public static ClassCode fromCode(final String code) {
        final ClassCode classCode = fromComparatorCode(code);
        Utils.validateArg(classCode != UNKNOWN, () -> "unknown class code '" + code + "'");
        return classCode;
    }

    /**
     * Lenient lookup, for codes read from comparator output.
     *
     * @return the class code of {@code code}, or {@link #UNKNOWN} if it is not a known one
     * @throws IllegalArgumentException if {@code code} is blank
     */
    public static ClassCode fromComparatorCode(final String code) {
        Utils.nonNull(code, "class code");
        final String trimmed = code.trim();
        Utils.validateArg(!trimmed.isEmpty(), "the class code is empty");
        if (trimmed.length() == 1) {
            for (final ClassCode classCode : values()) {
                if (classCode != UNKNOWN && classCode.code == trimmed.charAt(0)) {
                    return classCode;
                }
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return String.valueOf(code);
    }
}
