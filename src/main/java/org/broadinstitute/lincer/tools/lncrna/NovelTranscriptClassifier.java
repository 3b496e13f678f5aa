package org.broadinstitute.lincer.tools.lncrna;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.utils.Utils;

import java.nio.file.Path;
import java.util.*;

/**
 * Classifies merged novel transcripts by comparing them against both the full reference annotation and the known
 * lncRNA annotation.
 * <p>
 * The rules are tried in this order and the first that matches decides:
 * <ol>
 *     <li>{@code =} against the lncRNAs: {@link TranscriptClass#KNOWN_ISOFORM}</li>
 *     <li>{@code j} against both, with different matched genes: {@link TranscriptClass#POSSIBLE_ARTIFACT}</li>
 *     <li>{@code j} against the lncRNAs: {@link TranscriptClass#NOVEL_ISOFORM}</li>
 *     <li>{@code u} against the reference: {@link TranscriptClass#INTERGENIC}</li>
 *     <li>{@code x} against the reference and {@code u} against the lncRNAs: {@link TranscriptClass#ANTISENSE}</li>
 *     <li>{@code i} against the reference: {@link TranscriptClass#INTRONIC}</li>
 * </ol>
 * Anything else is {@link TranscriptClass#NOT_A_LNCRNA}.
 * </p>
 */
public final class NovelTranscriptClassifier {
    private static final Logger logger = LogManager.getLogger(NovelTranscriptClassifier.class);

    private final TranscriptComparator comparator;

    public NovelTranscriptClassifier(final TranscriptComparator comparator) {
        this.comparator = Utils.nonNull(comparator, "comparator");
    }

    /**
     * @param reference full reference annotation
     * @param knownLncRnas known lncRNA annotation
     * @param novelTranscripts merged novel transcripts
     * @return one record per transcript the comparator reported against the reference, sorted by transcript id
     */
    public SortedMap<String, ClassificationRecord> classify(final Path reference, final Path knownLncRnas, final Path novelTranscripts) {
        final Map<String, ComparisonRecord> againstReference = comparator.compare(reference, novelTranscripts);
        final Map<String, ComparisonRecord> againstKnownLncRnas = comparator.compare(knownLncRnas, novelTranscripts);
        final SortedMap<String, ClassificationRecord> records = classify(againstReference, againstKnownLncRnas);
        if (logger.isDebugEnabled()) {
            final Map<TranscriptClass, Integer> counts = new EnumMap<>(TranscriptClass.class);
            records.values().forEach(r -> counts.merge(r.getTranscriptClass(), 1, Integer::sum));
            logger.debug("Transcript classes: " + counts);
        }
        return records;
    }

    /**
     * Joins the two comparisons on transcript id, keeping every transcript compared against the reference, and
     * classifies each transcript.
     */
    public static SortedMap<String, ClassificationRecord> classify(final Map<String, ComparisonRecord> againstReference,
                                                                   final Map<String, ComparisonRecord> againstKnownLncRnas) {
        Utils.nonNull(againstReference, "comparisons against the reference");
        Utils.nonNull(againstKnownLncRnas, "comparisons against the known lncRNAs");
        final SortedMap<String, ClassificationRecord> records = new TreeMap<>();
        for (final ComparisonRecord all : againstReference.values()) {
            final ComparisonRecord lnc = againstKnownLncRnas.get(all.getTranscriptId());
            records.put(all.getTranscriptId(), new ClassificationRecord(all, lnc, classify(all, lnc)));
        }
        return Collections.unmodifiableSortedMap(records);
    }

    /**
     * @param all comparison against the full reference
     * @param lnc comparison against the known lncRNAs, or {@code null}
     */
    public static TranscriptClass classify(final ComparisonRecord all, final ComparisonRecord lnc) {
        Utils.nonNull(all, "comparison against the reference");
        final ClassCode allCode = all.getClassCode();
        final ClassCode lncCode = lnc == null ? null : lnc.getClassCode();

        if (lncCode == ClassCode.EXACT_MATCH) {
            return TranscriptClass.KNOWN_ISOFORM;
        }
        if (lncCode == ClassCode.SPLICE_JUNCTION_MATCH && allCode == ClassCode.SPLICE_JUNCTION_MATCH
                && !Objects.equals(lnc.getRefGeneId(), all.getRefGeneId())) {
            return TranscriptClass.POSSIBLE_ARTIFACT;
        }
        if (lncCode == ClassCode.SPLICE_JUNCTION_MATCH) {
            return TranscriptClass.NOVEL_ISOFORM;
        }
        if (allCode == ClassCode.INTERGENIC) {
            return TranscriptClass.INTERGENIC;
        }
        if (allCode == ClassCode.EXONIC_ANTISENSE && lncCode == ClassCode.INTERGENIC) {
            return TranscriptClass.ANTISENSE;
        }
        if (allCode == ClassCode.INTRONIC) {
            return TranscriptClass.INTRONIC;
        }
        return TranscriptClass.NOT_A_LNCRNA;
    }
}
