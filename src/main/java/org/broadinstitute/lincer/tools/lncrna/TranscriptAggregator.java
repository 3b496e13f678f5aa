package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.codecs.gtf.GtfRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reduces the exon lines of an assembly to one {@link TranscriptSummary} per transcript id.
 * Lines of other features are ignored, so a transcript with no exon line gets no summary.
 */
public final class TranscriptAggregator {

    private TranscriptAggregator() {}

    /**
     * @param records the lines of one assembly; exons must carry {@code transcript_id} and {@code cov}.
     * @return summaries by transcript id, in order of first appearance.
     * @throws org.broadinstitute.lincer.exceptions.UserException.MalformedFile if an exon lacks one of the attributes.
     */
    public static Map<String, TranscriptSummary> aggregate(final Iterable<GtfRecord> records) {
        Utils.nonNull(records, "records");
        final Map<String, TranscriptSummary> summaries = new LinkedHashMap<>();
        for (final GtfRecord record : records) {
            if (!record.isExon()) {
                continue;
            }
            final String transcriptId = record.getTranscriptId();
            final long exonLength = record.getLengthOnReference();
            final double exonCoverage = record.getCoverage();
            summaries.merge(transcriptId,
                    new TranscriptSummary(transcriptId, exonLength, 1, exonCoverage),
                    (current, added) -> current.addExon(exonLength, exonCoverage));
        }
        return Collections.unmodifiableMap(summaries);
    }
}
