package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;

/**
 * Per transcript statistics over its exons: total exonic length, number of exons and highest exon coverage.
 */
public final class TranscriptSummary {
    private final String transcriptId;
    private final long length;
    private final int exonCount;
    private final double coverage;

    public TranscriptSummary(final String transcriptId, final long length, final int exonCount, final double coverage) {
        this.transcriptId = Utils.nonNull(transcriptId, "transcript id");
        Utils.validateArg(length > 0, "length must be positive");
        Utils.validateArg(exonCount > 0, "exon count must be positive");
        this.length = length;
        this.exonCount = exonCount;
        this.coverage = coverage;
    }

    public String getTranscriptId() {
        return transcriptId;
    }

    public long getLength() {
        return length;
    }

    public int getExonCount() {
        return exonCount;
    }

    public double getCoverage() {
        return coverage;
    }

    /**
     * @return the summary with one more exon of the given length and coverage
     */
    TranscriptSummary addExon(final long exonLength, final double exonCoverage) {
        return new TranscriptSummary(transcriptId, length + exonLength, exonCount + 1, Math.max(coverage, exonCoverage));
    }

    @Override
    public String toString() {
        return String.format("%s length=%d exons=%d coverage=%s", transcriptId, length, exonCount, coverage);
    }
}
