package org.broadinstitute.lincer.tools.lncrna;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.codecs.gtf.GtfReader;
import org.broadinstitute.lincer.utils.codecs.gtf.GtfRecord;
import org.broadinstitute.lincer.utils.io.IOUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the novel long transcripts of one sample: summarizes the transcripts of its assembly, compares them against
 * the reference annotation, writes the joined table to {@code <sample>.summary.tsv}, and copies the lines of the
 * transcripts that pass the {@link NoveltyFilter} to {@code <sample>.novel.gtf}.
 */
public final class NovelTranscriptFinder {
    private static final Logger logger = LogManager.getLogger(NovelTranscriptFinder.class);

    private final TranscriptComparator comparator;
    private final NoveltyFilter filter;

    public NovelTranscriptFinder(final TranscriptComparator comparator, final NoveltyFilter filter) {
        this.comparator = Utils.nonNull(comparator, "comparator");
        this.filter = Utils.nonNull(filter, "filter");
    }

    /**
     * @param sample the sample to process
     * @param reference reference annotation
     * @param outputDirectory where the summary table and novel transcript GTF are written
     * @return the novel transcript GTF of the sample
     */
    public Path findNovelTranscripts(final Sample sample, final Path reference, final Path outputDirectory) {
        Utils.nonNull(sample, "sample");
        Utils.nonNull(reference, "reference");
        Utils.nonNull(outputDirectory, "output directory");
        final Path summaryPath = outputDirectory.resolve(sample.getSummaryFileName());
        final Path novelGtfPath = outputDirectory.resolve(sample.getNovelGtfFileName());

        logger.info("Processing: " + sample.getName());
        logger.info("  Summary: " + summaryPath);
        logger.info("  GTF Out: " + novelGtfPath);

        final Path assembly = sample.getAssembly();
        IOUtils.assertFileIsReadable(assembly);
        final List<GtfRecord> exons = GtfReader.readExons(assembly);
        final Map<String, TranscriptSummary> summaries = TranscriptAggregator.aggregate(exons);
        final Map<String, ComparisonRecord> comparisons = comparator.compare(reference, assembly);
        final List<TranscriptCandidate> candidates = NoveltyFilter.join(summaries, comparisons);

        IOUtils.writeAtomically(summaryPath, tempPath -> {
            try (final TranscriptSummaryTableWriter writer = new TranscriptSummaryTableWriter(tempPath)) {
                writer.writeAllRecords(candidates);
            }
        });

        final Set<String> novelTranscripts = filter.apply(candidates);
        logger.info(String.format("  %d of %d transcripts pass the novelty filter", novelTranscripts.size(), candidates.size()));
        GtfLineSelector.select(assembly, novelGtfPath, novelTranscripts);
        return novelGtfPath;
    }
}
