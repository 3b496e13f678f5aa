package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;

import java.util.Objects;

/**
 * Comparator verdict for one query transcript: its class code and, where there is one, the matched reference
 * transcript and gene.
 */
public final class ComparisonRecord {
    private final String transcriptId;
    private final ClassCode classCode;
    // the code as the comparator wrote it, kept for UNKNOWN
    private final String classCodeText;
    private final String refId;
    private final String refGeneId;

    /**
     * @param refId matched reference transcript id, or {@code null} if none
     * @param refGeneId matched reference gene id, or {@code null} if none
     */
    public ComparisonRecord(final String transcriptId, final ClassCode classCode, final String refId, final String refGeneId) {
        this(transcriptId, classCode, Utils.nonNull(classCode, "class code").toString(), refId, refGeneId);
    }

    /**
     * @param classCodeText the class code as written in the comparator table
     */
    public ComparisonRecord(final String transcriptId, final ClassCode classCode, final String classCodeText,
                            final String refId, final String refGeneId) {
        this.transcriptId = Utils.nonNull(transcriptId, "transcript id");
        this.classCode = Utils.nonNull(classCode, "class code");
        this.classCodeText = Utils.nonEmpty(classCodeText, "class code text");
        this.refId = refId;
        this.refGeneId = refGeneId;
    }

    public String getTranscriptId() {
        return transcriptId;
    }

    public ClassCode getClassCode() {
        return classCode;
    }

    /**
     * @return the class code as the comparator wrote it, which differs from {@link #getClassCode()} for
     * {@link ClassCode#UNKNOWN}
     */
    public String getClassCodeText() {
        return classCodeText;
    }

    public String getRefId() {
        return refId;
    }

    public String getRefGeneId() {
        return refGeneId;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ComparisonRecord that = (ComparisonRecord) o;
        return transcriptId.equals(that.transcriptId) && classCode == that.classCode
                && classCodeText.equals(that.classCodeText)
                && Objects.equals(refId, that.refId) && Objects.equals(refGeneId, that.refGeneId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transcriptId, classCode, classCodeText, refId, refGeneId);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s %s", transcriptId, classCodeText, refId, refGeneId);
    }
}
