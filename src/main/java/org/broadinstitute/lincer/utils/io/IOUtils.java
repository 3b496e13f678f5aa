package org.broadinstitute.lincer.utils.io;

import htsjdk.samtools.util.IOUtil;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.Utils;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * File-system helpers for the pipeline: input checks, output directories, temporary working directories of the
 * external tools and atomic writes of the output files.
 */
public final class IOUtils {
    private static final Logger logger = LogManager.getLogger(IOUtils.class);

    private IOUtils() {}

    /**
     * Writes a whole file at the path it is given.
     */
    @FunctionalInterface
    public interface PathWriter {
        void write(Path path) throws IOException;
    }

    /**
     * Creates a new directory under {@code java.io.tmpdir}. The caller deletes it with {@link #deleteRecursively(Path)}.
     *
     * @throws UserException.BadTempDir if the directory cannot be created
     */
    public static File createTempDir(final String prefix) {
        try {
            return Files.createTempDirectory(prefix).normalize().toFile();
        } catch (final IOException | SecurityException e) {
            throw new UserException.BadTempDir(e.getMessage(), e);
        }
    }

    /**
     * Deletes a file, logging a warning if it stays behind.
     */
    public static boolean tryDelete(final File file) {
        final boolean deleted = FileUtils.deleteQuietly(file);
        if (!deleted && file.exists()) {
            logger.warn("Could not delete " + file);
        }
        return deleted;
    }

    /**
     * Deletes a file or a directory tree. Symbolic links are removed, not followed.
     */
    public static void deleteRecursively(final Path root) {
        if (Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            IOUtil.recursiveDelete(root);
        }
    }

    /**
     * @throws UserException.CouldNotReadInputFile unless {@code path} is an existing, readable regular file
     */
    public static void assertFileIsReadable(final Path path) {
        Utils.nonNull(path, "path");
        if (!Files.exists(path)) {
            throw new UserException.CouldNotReadInputFile(path, "no such file");
        }
        if (!Files.isRegularFile(path)) {
            throw new UserException.CouldNotReadInputFile(path, "not a regular file");
        }
        if (!Files.isReadable(path)) {
            throw new UserException.CouldNotReadInputFile(path, "permission denied");
        }
    }

    /**
     * Creates {@code directory} and its missing parents.
     *
     * @throws UserException.CouldNotCreateOutputFile if it cannot be created or is not writable
     */
    public static void createDirectoryIfNeeded(final Path directory) {
        Utils.nonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(directory, e);
        }
        if (!Files.isWritable(directory)) {
            throw new UserException.CouldNotCreateOutputFile(directory, "the directory is not writable");
        }
    }

    /**
     * @return a hidden, unique path in the directory of {@code target}, so that renaming it onto {@code target}
     * stays within one file system
     */
    public static Path getSiblingTempPath(final Path target) {
        final Path absolute = Utils.nonNull(target, "target").toAbsolutePath();
        return absolute.resolveSibling("." + absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
    }

    /**
     * Has {@code writer} write a sibling temporary file and renames it onto {@code target}. On failure the
     * temporary file is removed and {@code target} is left as it was.
     *
     * @return {@code target}
     * @throws UserException.CouldNotCreateOutputFile if writing or renaming fails
     */
    public static Path writeAtomically(final Path target, final PathWriter writer) {
        Utils.nonNull(writer, "writer");
        final Path temp = getSiblingTempPath(target);
        boolean committed = false;
        try {
            writer.write(temp);
            moveIntoPlace(temp, target);
            committed = true;
            return target;
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(target, e);
        } finally {
            if (!committed) {
                tryDelete(temp.toFile());
            }
        }
    }

    /**
     * Renames {@code source} onto {@code target}, atomically where the file system supports it.
     */
    public static void moveIntoPlace(final Path source, final Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            logger.debug("No atomic move to " + target + ", using a plain one");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
