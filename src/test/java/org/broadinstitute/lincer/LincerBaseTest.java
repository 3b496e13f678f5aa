package org.broadinstitute.lincer;

import htsjdk.samtools.util.Log;
import org.apache.commons.io.FileUtils;
import org.broadinstitute.lincer.utils.LoggingUtils;
import org.broadinstitute.lincer.utils.io.IOUtils;
import org.testng.Assert;
import org.testng.SkipException;
import org.testng.annotations.BeforeSuite;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * This is the base test class for all of our test cases.  All test cases should extend from this
 * class; it sets up the logger, and resolves the location of directories that we rely on.
 */
public abstract class LincerBaseTest {

    private static final String CURRENT_DIRECTORY = System.getProperty("user.dir");
    public static final String lincerDirectory = System.getProperty("lincerdir", CURRENT_DIRECTORY) + "/";

    private static final String publicTestDirRelative = "src/test/resources/";
    public static final String publicTestDir = new File(lincerDirectory, publicTestDirRelative).getAbsolutePath() + "/";
    public static final String packageRootTestDir = publicTestDir + "org/broadinstitute/lincer/";
    public static final String toolsTestDir = packageRootTestDir + "tools/";

    public static final String SHELL = "/bin/sh";

    @BeforeSuite
    public void setTestVerbosity(){
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    /**
     * Returns the location of the resource directory for the tested class.
     */
    public String getToolTestDataDir(){
        return publicTestDir + this.getClass().getPackage().getName().replace(".","/") + "/" + getTestedClassName() + "/";
    }

    /**
     * Returns the name of the class being tested.
     * The default implementation takes the simple name of the test class and removes the trailing "Test".
     * Override if needed.
     */
    public String getTestedClassName(){
        if (getClass().getSimpleName().contains("IntegrationTest"))
            return getClass().getSimpleName().replaceAll("IntegrationTest$", "");
        else if (getClass().getSimpleName().contains("UnitTest"))
            return getClass().getSimpleName().replaceAll("UnitTest$", "");
        else
            return getClass().getSimpleName().replaceAll("Test$", "");
    }

    /**
     * @return a File resolved using getToolTestDataDir as the parent and fileName
     */
    public File getTestFile(String fileName) {
        return new File(getToolTestDataDir(), fileName);
    }

    /**
     * Creates an empty temp directory which will be deleted on exit after tests are complete
     */
    public static File createTempDir(final String prefix){
        final File dir = IOUtils.createTempDir(prefix);
        try {
            FileUtils.forceDeleteOnExit(dir);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        return dir;
    }

    /**
     * Creates a temp file that will be deleted on exit after tests are complete.
     */
    public static File createTempFile(final String name, final String extension) {
        try {
            final File file = File.createTempFile(name, extension);
            file.deleteOnExit();
            return file;
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Writes {@code lines}, each followed by a newline, to a new temp file.
     */
    public static Path createTempFileWithLines(final String name, final String extension, final String... lines) {
        final Path path = createTempFile(name, extension).toPath();
        writeLines(path, lines);
        return path;
    }

    public static void writeLines(final Path path, final String... lines) {
        try {
            Files.write(path, Arrays.asList(lines), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<String> readLines(final Path path) {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Writes a shell script with the given body into {@code directory} and makes it executable.
     * Skips the calling test when no POSIX shell is available.
     *
     * @return the path of the script
     */
    public static Path writeShellScript(final File directory, final String name, final String... bodyLines) {
        if (!new File(SHELL).canExecute()) {
            throw new SkipException(SHELL + " is not available");
        }
        final File script = new File(directory, name);
        final String[] lines = new String[bodyLines.length + 1];
        lines[0] = "#!" + SHELL;
        System.arraycopy(bodyLines, 0, lines, 1, bodyLines.length);
        writeLines(script.toPath(), lines);
        Assert.assertTrue(script.setExecutable(true), "could not make " + script + " executable");
        return script.toPath();
    }

    /**
     * captures {@link System#out} while runnable is executing
     * @param runnable a code block to execute
     * @return everything written to {@link System#out} by runnable
     */
    public static String captureStdout(Runnable runnable){
        return captureSystemStream(runnable, System.out, System::setOut);
    }

    /**
     * captures {@link System#err} while runnable is executing
     * @param runnable a code block to execute
     * @return everything written to {@link System#err} by runnable
     */
    public static String captureStderr(Runnable runnable){
        return captureSystemStream(runnable, System.err, System::setErr);
    }

    private static String captureSystemStream(Runnable runnable,  PrintStream stream, Consumer<? super PrintStream> setter){
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        setter.accept(new PrintStream(out));
        try {
            runnable.run();
        } finally{
            setter.accept(stream);
        }
        return out.toString();
    }

    public static void assertContains(String actual, String expectedSubstring){
        Assert.assertTrue(actual.contains(expectedSubstring),  expectedSubstring +" was not found in " + actual + ".");
    }
}
