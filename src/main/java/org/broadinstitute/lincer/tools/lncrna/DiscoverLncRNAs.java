package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.argparser.PositionalArguments;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.lincer.cmdline.CommandLineProgram;
import org.broadinstitute.lincer.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.lincer.cmdline.programgroups.TranscriptDiscoveryProgramGroup;
import org.broadinstitute.lincer.utils.codecs.gtf.GtfReader;
import org.broadinstitute.lincer.utils.codecs.gtf.GtfRecord;
import org.broadinstitute.lincer.utils.config.ConfigFactory;
import org.broadinstitute.lincer.utils.config.LincerConfig;
import org.broadinstitute.lincer.utils.io.IOUtils;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovers novel lncRNAs in de novo transcript assemblies and folds them into a catalog of known lncRNAs.
 *
 * <p>For every sample of the sample sheet, the transcripts of its assembly are compared against the reference
 * annotation, and those that are long, multi-exonic, well covered and novel are kept. The kept transcripts of all
 * samples are merged, classified against the reference and the known lncRNAs, and the novel isoforms of known
 * lncRNA genes and the novel lncRNA genes are added to the known lncRNAs.</p>
 *
 * <h3>Inputs</h3>
 * <ul>
 *     <li>A sample sheet: tab separated, no header, with a sample name and the path of its assembly GTF on each line</li>
 *     <li>The reference annotation GTF, with all annotated transcripts</li>
 *     <li>The known lncRNA GTF</li>
 * </ul>
 *
 * <h3>Outputs</h3>
 * <ul>
 *     <li>{@code <sample>.summary.tsv} and {@code <sample>.novel.gtf} for each sample</li>
 *     <li>{@code novel_transcripts.gtf}: the merged novel transcripts</li>
 *     <li>{@code novel_transcripts.tsv}: the classification of the merged novel transcripts</li>
 *     <li>{@code lncRNA_catalog.gtf}: the lncRNA catalog</li>
 * </ul>
 *
 * <h3>Usage example</h3>
 * <pre>
 * lincer samples.tsv gencode.gtf gencode.lncRNA.gtf -O results
 * </pre>
 *
 * The transcript comparator (cuffcompare) and the assembly merger (cuffmerge) must be on the PATH, or given with
 * --comparator-executable and --merger-executable.
 */
@CommandLineProgramProperties(
        summary = "Discovers novel lncRNAs in de novo transcript assemblies (e.g. from Cufflinks) of several samples, " +
                "classifies them against a reference annotation and known lncRNAs, and writes a catalog with the known " +
                "lncRNAs, the novel isoforms of known lncRNA genes and the novel lncRNA genes.",
        oneLineSummary = "Discovers and catalogs novel lncRNAs from transcript assemblies",
        programGroup = TranscriptDiscoveryProgramGroup.class
)
@DocumentedFeature
public final class DiscoverLncRNAs extends CommandLineProgram {

    public static final String NOVEL_TRANSCRIPTS_GTF = "novel_transcripts.gtf";
    public static final String NOVEL_TRANSCRIPTS_TSV = "novel_transcripts.tsv";
    public static final String CATALOG_GTF = "lncRNA_catalog.gtf";

    private final LincerConfig config = ConfigFactory.getInstance().getLincerConfig();

    @PositionalArguments(minElements = 3, maxElements = 3,
            doc = "SAMPLE_SHEET REFERENCE_GTF LNCRNA_GTF: the sample sheet (sample name and assembly GTF path, tab separated, no header), " +
                    "the GTF with all annotated transcripts and the GTF with the known lncRNA transcripts")
    public List<String> inputs = new ArrayList<>();

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_DIRECTORY_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_DIRECTORY_SHORT_NAME,
            doc = "Directory the outputs are written to", optional = true)
    public File outputDirectory = new File(".");

    @Argument(fullName = StandardArgumentDefinitions.COMPARATOR_EXECUTABLE_LONG_NAME,
            doc = "Transcript comparator, run as <executable> -r <reference> <query>", optional = true)
    public String comparatorExecutable = config.comparator_executable();

    @Argument(fullName = StandardArgumentDefinitions.MERGER_EXECUTABLE_LONG_NAME,
            doc = "Assembly merger, run with a file listing the assemblies to merge", optional = true)
    public String mergerExecutable = config.merger_executable();

    @Argument(fullName = StandardArgumentDefinitions.MIN_TRANSCRIPT_LENGTH_LONG_NAME,
            doc = "Minimum total exonic length of a novel transcript", optional = true, minValue = 0)
    public int minTranscriptLength = config.min_transcript_length();

    @Argument(fullName = StandardArgumentDefinitions.MIN_EXON_COUNT_LONG_NAME,
            doc = "Minimum number of exons of a novel transcript", optional = true, minValue = 0)
    public int minExonCount = config.min_exon_count();

    @Argument(fullName = StandardArgumentDefinitions.MIN_COVERAGE_LONG_NAME,
            doc = "Minimum coverage of a novel transcript (highest coverage of its exons)", optional = true, minValue = 0)
    public double minCoverage = config.min_coverage();

    @Argument(fullName = StandardArgumentDefinitions.NOVEL_CLASS_CODE_LONG_NAME,
            doc = "Class codes, against the reference annotation, of the transcripts considered novel", optional = true)
    public List<String> novelClassCodes = new ArrayList<>(config.novel_class_codes());

    private Path sampleSheet;
    private Path reference;
    private Path knownLncRnas;
    private Path outputPath;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (novelClassCodes.isEmpty()) {
            errors.add("at least one --" + StandardArgumentDefinitions.NOVEL_CLASS_CODE_LONG_NAME + " is required");
        }
        for (final String code : novelClassCodes) {
            try {
                ClassCode.fromCode(code);
            } catch (final IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected void onStartup() {
        sampleSheet = Paths.get(inputs.get(0));
        reference = Paths.get(inputs.get(1));
        knownLncRnas = Paths.get(inputs.get(2));
        IOUtils.assertFileIsReadable(sampleSheet);
        IOUtils.assertFileIsReadable(reference);
        IOUtils.assertFileIsReadable(knownLncRnas);
        outputPath = outputDirectory.toPath();
        IOUtils.createDirectoryIfNeeded(outputPath);
    }

    @Override
    protected Object doWork() {
        logger.info("Loading sample sheet");
        logger.info("  src: " + sampleSheet);
        final List<Sample> samples = SampleSheetReader.readSamples(sampleSheet);

        final TranscriptComparator comparator = new TranscriptComparator(comparatorExecutable);
        final NoveltyFilter filter = makeNoveltyFilter();
        logger.info("Novelty filter: " + filter);
        final NovelTranscriptFinder finder = new NovelTranscriptFinder(comparator, filter);
        final List<Path> novelAssemblies = new ArrayList<>(samples.size());
        for (final Sample sample : samples) {
            novelAssemblies.add(finder.findNovelTranscripts(sample, reference, outputPath));
        }

        logger.info("Merging novel transcripts of " + samples.size() + " samples");
        final Path novelTranscripts = new TranscriptMerger(mergerExecutable)
                .merge(novelAssemblies, outputPath.resolve(NOVEL_TRANSCRIPTS_GTF));

        logger.info("Classifying novel transcripts");
        logger.info("  ref gtf: " + reference);
        logger.info("  lnc gtf: " + knownLncRnas);
        final Map<String, ClassificationRecord> classifications =
                new NovelTranscriptClassifier(comparator).classify(reference, knownLncRnas, novelTranscripts);
        IOUtils.writeAtomically(outputPath.resolve(NOVEL_TRANSCRIPTS_TSV), tempPath -> {
            try (final ClassificationTableWriter writer = new ClassificationTableWriter(tempPath)) {
                writer.writeAllRecords(classifications.values());
            }
        });

        final Path catalog = outputPath.resolve(CATALOG_GTF);
        logger.info("Writing lncRNA GTF");
        logger.info("  final gtf: " + catalog);
        final List<GtfRecord> knownExons = GtfReader.readExons(knownLncRnas);
        final List<GtfRecord> novelExons = GtfReader.readExons(novelTranscripts);
        final List<CatalogEntry> entries = LncRnaCatalogBuilder.build(knownExons, novelExons, classifications);
        CatalogGtfWriter.write(entries, catalog);
        logger.info(String.format("Wrote %d exons to the lncRNA catalog", entries.size()));
        return null;
    }

    private NoveltyFilter makeNoveltyFilter() {
        final Set<ClassCode> classCodes = EnumSet.noneOf(ClassCode.class);
        for (final String code : novelClassCodes) {
            classCodes.add(ClassCode.fromCode(code));
        }
        return new NoveltyFilter(minTranscriptLength, minExonCount, minCoverage, classCodes);
    }
}
