package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;

/**
 * Classification of a novel transcript by its relationship to the reference annotation and to the known lncRNAs.
 */
public enum TranscriptClass {
    /** Same intron chain as a known lncRNA transcript. */
    KNOWN_ISOFORM("known_isoform"),
    /** Looks like an isoform of one gene against the known lncRNAs and of another gene against the reference. */
    POSSIBLE_ARTIFACT("possible_artifact"),
    /** New isoform of a known lncRNA gene. */
    NOVEL_ISOFORM("novel_isoform"),
    /** No overlap with the reference. */
    INTERGENIC("intergenic"),
    /** Overlaps a reference exon on the opposite strand, unrelated to known lncRNAs. */
    ANTISENSE("antisense"),
    /** Entirely within a reference intron. */
    INTRONIC("intronic"),
    NOT_A_LNCRNA("not_a_lncRNA");

    private final String label;

    TranscriptClass(final String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return {@code true} for the classes whose transcripts make up new lncRNA genes
     */
    public boolean isNovelGene() {
        return this == INTERGENIC || this == ANTISENSE || this == INTRONIC;
    }

    public static TranscriptClass fromLabel(final String label) {
        Utils.nonNull(label, "label");
        for (final TranscriptClass transcriptClass : values()) {
            if (transcriptClass.label.equals(label)) {
                return transcriptClass;
            }
        }
        throw new IllegalArgumentException("unknown transcript class '" + label + "'");
    }

    @Override
    public String toString() {
        return label;
    }
}
