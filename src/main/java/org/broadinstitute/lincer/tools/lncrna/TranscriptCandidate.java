package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;

/**
 * A transcript summary joined with the comparison of its transcript against the reference annotation.
 * The comparison is {@code null} when the comparator reported nothing for the transcript.
 */
public final class TranscriptCandidate {
    private final TranscriptSummary summary;
    private final ComparisonRecord comparison;

    public TranscriptCandidate(final TranscriptSummary summary, final ComparisonRecord comparison) {
        this.summary = Utils.nonNull(summary, "summary");
        Utils.validateArg(comparison == null || comparison.getTranscriptId().equals(summary.getTranscriptId()),
                () -> "summary and comparison are for different transcripts: " + summary.getTranscriptId() + ", " + comparison.getTranscriptId());
        this.comparison = comparison;
    }

    public String getTranscriptId() {
        return summary.getTranscriptId();
    }

    public TranscriptSummary getSummary() {
        return summary;
    }

    /**
     * @return the comparison, or {@code null} if there is none
     */
    public ComparisonRecord getComparison() {
        return comparison;
    }

    public boolean hasComparison() {
        return comparison != null;
    }
}
