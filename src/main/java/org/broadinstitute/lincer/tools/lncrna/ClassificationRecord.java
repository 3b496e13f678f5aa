package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;

/**
 * A novel transcript with its comparison against the full reference annotation, its comparison against the
 * known lncRNAs ({@code null} if the comparator reported nothing) and the resulting class.
 */
public final class ClassificationRecord {
    private final String transcriptId;
    private final ComparisonRecord againstReference;
    private final ComparisonRecord againstKnownLncRnas;
    private final TranscriptClass transcriptClass;

    public ClassificationRecord(final ComparisonRecord againstReference, final ComparisonRecord againstKnownLncRnas,
                                final TranscriptClass transcriptClass) {
        this.againstReference = Utils.nonNull(againstReference, "comparison against the reference");
        this.transcriptId = againstReference.getTranscriptId();
        Utils.validateArg(againstKnownLncRnas == null || againstKnownLncRnas.getTranscriptId().equals(transcriptId),
                () -> "comparisons are for different transcripts: " + transcriptId + ", " + againstKnownLncRnas.getTranscriptId());
        this.againstKnownLncRnas = againstKnownLncRnas;
        this.transcriptClass = Utils.nonNull(transcriptClass, "transcript class");
    }

    public String getTranscriptId() {
        return transcriptId;
    }

    public ComparisonRecord getAgainstReference() {
        return againstReference;
    }

    /**
     * @return the comparison against the known lncRNAs, or {@code null}
     */
    public ComparisonRecord getAgainstKnownLncRnas() {
        return againstKnownLncRnas;
    }

    /**
     * @return the gene of the known lncRNA matched by this transcript, or {@code null}
     */
    public String getKnownLncRnaGene() {
        return againstKnownLncRnas == null ? null : againstKnownLncRnas.getRefGeneId();
    }

    public TranscriptClass getTranscriptClass() {
        return transcriptClass;
    }

    @Override
    public String toString() {
        return transcriptId + " " + transcriptClass;
    }
}
