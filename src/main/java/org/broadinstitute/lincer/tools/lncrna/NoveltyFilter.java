package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Selects the transcripts of an assembly that look like genuine novel long transcripts: long enough,
 * multi-exonic, well covered and with a class code that makes them novel with respect to the reference.
 * All thresholds must be met. A transcript without a comparison never passes.
 */
public final class NoveltyFilter {

    public static final int DEFAULT_MIN_TRANSCRIPT_LENGTH = 200;
    public static final int DEFAULT_MIN_EXON_COUNT = 2;
    public static final double DEFAULT_MIN_COVERAGE = 3.0;
    public static final Set<ClassCode> DEFAULT_NOVEL_CLASS_CODES = Collections.unmodifiableSet(EnumSet.of(
            ClassCode.INTERGENIC, ClassCode.SPLICE_JUNCTION_MATCH, ClassCode.INTRONIC, ClassCode.EXONIC_ANTISENSE));

    private final int minTranscriptLength;
    private final int minExonCount;
    private final double minCoverage;
    private final Set<ClassCode> novelClassCodes;

    public NoveltyFilter() {
        this(DEFAULT_MIN_TRANSCRIPT_LENGTH, DEFAULT_MIN_EXON_COUNT, DEFAULT_MIN_COVERAGE, DEFAULT_NOVEL_CLASS_CODES);
    }

    /**
     * @param minTranscriptLength smallest total exonic length kept
     * @param minExonCount smallest number of exons kept
     * @param minCoverage smallest transcript coverage kept
     * @param novelClassCodes class codes against the reference that are kept
     */
    public NoveltyFilter(final int minTranscriptLength, final int minExonCount, final double minCoverage,
                         final Collection<ClassCode> novelClassCodes) {
        Utils.validateArg(minTranscriptLength >= 0, "minimum transcript length cannot be negative");
        Utils.validateArg(minExonCount >= 0, "minimum exon count cannot be negative");
        Utils.validateArg(minCoverage >= 0, "minimum coverage cannot be negative");
        Utils.nonEmpty(novelClassCodes, "novel class codes");
        this.minTranscriptLength = minTranscriptLength;
        this.minExonCount = minExonCount;
        this.minCoverage = minCoverage;
        this.novelClassCodes = Collections.unmodifiableSet(EnumSet.copyOf(novelClassCodes));
    }

    /**
     * Joins summaries with comparisons by transcript id. Every summary yields a candidate, with a {@code null}
     * comparison if the transcript has none.
     *
     * @return the candidates, sorted by transcript id
     */
    public static List<TranscriptCandidate> join(final Map<String, TranscriptSummary> summaries,
                                                 final Map<String, ComparisonRecord> comparisons) {
        Utils.nonNull(summaries, "summaries");
        Utils.nonNull(comparisons, "comparisons");
        return new TreeMap<>(summaries).values().stream()
                .map(s -> new TranscriptCandidate(s, comparisons.get(s.getTranscriptId())))
                .collect(Collectors.toList());
    }

    public boolean passes(final TranscriptCandidate candidate) {
        Utils.nonNull(candidate, "candidate");
        final TranscriptSummary summary = candidate.getSummary();
        return candidate.hasComparison()
                && summary.getLength() >= minTranscriptLength
                && summary.getExonCount() >= minExonCount
                && summary.getCoverage() >= minCoverage
                && novelClassCodes.contains(candidate.getComparison().getClassCode());
    }

    /**
     * @return ids of the candidates that pass, in candidate order
     */
    public Set<String> apply(final Collection<TranscriptCandidate> candidates) {
        Utils.nonNull(candidates, "candidates");
        return candidates.stream()
                .filter(this::passes)
                .map(TranscriptCandidate::getTranscriptId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int getMinTranscriptLength() {
        return minTranscriptLength;
    }

    public int getMinExonCount() {
        return minExonCount;
    }

    public double getMinCoverage() {
        return minCoverage;
    }

    public Set<ClassCode> getNovelClassCodes() {
        return novelClassCodes;
    }

    @Override
    public String toString() {
        return String.format("length >= %d, exons >= %d, coverage >= %s, class code in %s",
                minTranscriptLength, minExonCount, minCoverage, novelClassCodes);
    }
}
