package org.broadinstitute.lincer.tools.lncrna;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.io.IOUtils;
import org.broadinstitute.lincer.utils.runtime.ExternalToolException;
import org.broadinstitute.lincer.utils.runtime.ExternalToolExecutor;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the assembly merger (Cuffmerge, or a tool with the same interface) over several assemblies, giving it a
 * manifest with one assembly path per line, and copies its merged assembly to the requested output.
 * <p>
 * The merger runs in a fresh temporary directory, where it creates {@value #MERGED_DIRECTORY_NAME} and its logs.
 * The directory is deleted when the run is over, so only the output file remains.
 * </p>
 */
public class TranscriptMerger extends ExternalToolExecutor {
    private static final Logger logger = LogManager.getLogger(TranscriptMerger.class);

    public static final String DEFAULT_EXECUTABLE = "cuffmerge";

    public static final String MANIFEST_FILE_NAME = "novel_transcript_gtfs.txt";
    public static final String MERGED_DIRECTORY_NAME = "merged_asm";
    public static final String MERGED_FILE_NAME = "merged.gtf";

    private Path lastManifest;

    public TranscriptMerger() {
        this(DEFAULT_EXECUTABLE);
    }

    public TranscriptMerger(final String executable) {
        super(executable);
    }

    /**
     * Merges {@code assemblies} into {@code output}.
     *
     * @param assemblies GTF files to merge, listed in the manifest in this order
     * @param output merged GTF, replaced atomically
     * @return {@code output}
     * @throws ExternalToolException if the merger fails or does not write the merged assembly
     */
    public Path merge(final List<Path> assemblies, final Path output) {
        Utils.nonEmpty(assemblies, "assemblies to merge");
        Utils.containsNoNull(assemblies, "assemblies to merge");
        Utils.nonNull(output, "output");
        assemblies.forEach(IOUtils::assertFileIsReadable);

        final File workingDirectory = IOUtils.createTempDir("lincer-merge");
        try {
            final Path directory = workingDirectory.toPath();
            lastManifest = directory.resolve(MANIFEST_FILE_NAME);
            writeManifest(assemblies, lastManifest);

            execute(workingDirectory, MANIFEST_FILE_NAME);

            final Path merged = directory.resolve(MERGED_DIRECTORY_NAME).resolve(MERGED_FILE_NAME);
            if (!Files.isRegularFile(merged)) {
                throw new ExternalToolException(externalExecutableName,
                        String.format("expected merged assembly %s/%s was not written%nCommand Line: %s",
                                MERGED_DIRECTORY_NAME, MERGED_FILE_NAME, getApproximateCommandLine()));
            }
            IOUtils.writeAtomically(output, tempPath -> Files.copy(merged, tempPath));
            logger.debug(String.format("Merged %d assemblies into %s", assemblies.size(), output));
            return output;
        } finally {
            IOUtils.deleteRecursively(workingDirectory.toPath());
        }
    }

    private static void writeManifest(final List<Path> assemblies, final Path manifest) {
        final List<String> lines = assemblies.stream()
                .map(p -> p.toAbsolutePath().toString())
                .collect(Collectors.toList());
        IOUtils.writeAtomically(manifest, tempPath -> Files.write(tempPath, lines, StandardCharsets.UTF_8));
    }

    @Override
    public String getApproximateCommandLine() {
        return String.format("%s %s", externalExecutableName, lastManifest == null ? MANIFEST_FILE_NAME : lastManifest);
    }
}
