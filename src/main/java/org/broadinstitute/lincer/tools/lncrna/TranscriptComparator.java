package org.broadinstitute.lincer.tools.lncrna;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.io.IOUtils;
import org.broadinstitute.lincer.utils.runtime.ExternalToolException;
import org.broadinstitute.lincer.utils.runtime.ExternalToolExecutor;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Runs the transcript comparator (Cuffcompare, or a tool with the same interface) as
 * {@code <executable> -r <reference> <query>} and reads back its {@code .tmap} table.
 * <p>
 * The comparator writes its tables and logs next to the query with fixed names, so each run happens in a fresh
 * temporary directory holding a symbolic link to the query. The directory and everything the comparator wrote
 * into it are deleted when the run is over, whether it succeeded or not.
 * </p>
 */
public class TranscriptComparator extends ExternalToolExecutor {
    private static final Logger logger = LogManager.getLogger(TranscriptComparator.class);

    public static final String DEFAULT_EXECUTABLE = "cuffcompare";

    /**
     * Prefix of the comparator output files when no {@code -o} option is given.
     */
    public static final String OUTPUT_PREFIX = "cuffcmp";

    public static final String TMAP_EXTENSION = ".tmap";

    private Path lastReference;
    private Path lastQuery;

    public TranscriptComparator() {
        this(DEFAULT_EXECUTABLE);
    }

    public TranscriptComparator(final String executable) {
        super(executable);
    }

    /**
     * @return name of the table the comparator writes for the query named {@code queryFileName}
     */
    public static String getTmapFileName(final String queryFileName) {
        return OUTPUT_PREFIX + "." + queryFileName + TMAP_EXTENSION;
    }

    /**
     * Compares the transcripts of {@code query} against {@code reference}.
     *
     * @return one record per query transcript, sorted by transcript id
     * @throws ExternalToolException if the comparator fails or does not write its table
     */
    public SortedMap<String, ComparisonRecord> compare(final Path reference, final Path query) {
        Utils.nonNull(reference, "reference annotation");
        Utils.nonNull(query, "query assembly");
        IOUtils.assertFileIsReadable(reference);
        IOUtils.assertFileIsReadable(query);
        lastReference = reference.toAbsolutePath();
        lastQuery = query.toAbsolutePath();

        final File workingDirectory = IOUtils.createTempDir("lincer-compare");
        try {
            final Path directory = workingDirectory.toPath();
            final String queryFileName = query.getFileName().toString();
            linkQuery(lastQuery, directory.resolve(queryFileName));

            execute(workingDirectory, "-r", lastReference.toString(), queryFileName);

            final Path tmap = directory.resolve(getTmapFileName(queryFileName));
            if (!Files.exists(tmap)) {
                throw new ExternalToolException(externalExecutableName,
                        String.format("expected output table %s was not written%nCommand Line: %s", tmap.getFileName(), getApproximateCommandLine()));
            }
            final SortedMap<String, ComparisonRecord> records = readTmap(tmap);
            logger.debug(String.format("Read %d comparison records for %s against %s", records.size(), query, reference));
            return records;
        } finally {
            IOUtils.deleteRecursively(workingDirectory.toPath());
        }
    }

    private static void linkQuery(final Path query, final Path link) {
        try {
            Files.createSymbolicLink(link, query);
        } catch (final IOException | UnsupportedOperationException e) {
            throw new UserException.BadTempDir(link.getParent(), "cannot link the query assembly " + query + " into it", e);
        }
    }

    /**
     * Reads a comparator table; if a transcript id is repeated, its first row is kept.
     */
    static SortedMap<String, ComparisonRecord> readTmap(final Path tmap) {
        final SortedMap<String, ComparisonRecord> records = new TreeMap<>();
        try (final TmapTableReader reader = new TmapTableReader(tmap)) {
            for (final ComparisonRecord record : reader) {
                records.putIfAbsent(record.getTranscriptId(), record);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(tmap, e);
        }
        return Collections.unmodifiableSortedMap(records);
    }

    @Override
    public String getApproximateCommandLine() {
        return String.format("%s -r %s %s", externalExecutableName, lastReference, lastQuery);
    }
}
