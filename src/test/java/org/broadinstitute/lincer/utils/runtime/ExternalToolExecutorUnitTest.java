package org.broadinstitute.lincer.utils.runtime;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.lincer.LincerBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

public final class ExternalToolExecutorUnitTest extends LincerBaseTest {

    private static final class ScriptRunner extends ExternalToolExecutor {
        ScriptRunner(final String executable) {
            super(executable);
        }

        ToolOutput run(final File directory, final String... arguments) {
            return execute(directory, arguments);
        }

        @Override
        public String getApproximateCommandLine() {
            return externalExecutableName;
        }
    }

    @Test
    public void testMissingExecutable() {
        final ScriptRunner runner = new ScriptRunner("lincer-no-such-tool-on-path");
        Assert.assertFalse(runner.externalExecutableExists());
        try {
            runner.run(createTempDir("tool"));
            Assert.fail("expected a missing executable to fail");
        } catch (final ExternalToolException e) {
            Assert.assertEquals(e.getToolName(), "lincer-no-such-tool-on-path");
            assertContains(e.getMessage(), "executable not found");
        }
    }

    @Test
    public void testMissingExecutableGivenAsPath() {
        final File dir = createTempDir("tool");
        final ScriptRunner runner = new ScriptRunner(new File(dir, "absent.sh").getAbsolutePath());
        Assert.assertFalse(runner.externalExecutableExists());
    }

    @Test
    public void testWhichFindsShellOnPath() {
        final File shell = ExternalToolExecutor.which("sh");
        if (shell != null) {
            Assert.assertTrue(shell.isAbsolute());
            Assert.assertTrue(shell.canExecute());
        }
        Assert.assertNull(ExternalToolExecutor.which("lincer-no-such-tool-on-path"));
    }

    @Test
    public void testSuccessfulRunInWorkingDirectory() throws IOException {
        final File scripts = createTempDir("scripts");
        final File work = createTempDir("work");
        final Path script = writeShellScript(scripts, "touch.sh", "echo \"$1\" > out.txt", "pwd", "echo done 1>&2");

        final ScriptRunner runner = new ScriptRunner(script.toString());
        Assert.assertTrue(runner.externalExecutableExists());
        final ExternalToolExecutor.ToolOutput output = runner.run(work, "payload");

        Assert.assertEquals(output.getExitValue(), 0);
        Assert.assertEquals(output.getStdout().trim(), work.getCanonicalPath());
        Assert.assertEquals(output.getStderr(), "done\n");
        Assert.assertTrue(Files.exists(work.toPath().resolve("out.txt")));
        Assert.assertEquals(readLines(work.toPath().resolve("out.txt")), Collections.singletonList("payload"));
    }

    @Test(timeOut = 30000)
    public void testToolReadingStandardInputSeesItsEnd() {
        final File dir = createTempDir("tool");
        final Path script = writeShellScript(dir, "cat.sh", "cat", "echo finished");

        final ExternalToolExecutor.ToolOutput output = new ScriptRunner(script.toString()).run(dir);
        Assert.assertEquals(output.getStdout(), "finished\n");
    }

    @Test(timeOut = 30000)
    public void testLongOutputIsCappedAndDrained() {
        final int extra = 4464;
        final int total = ExternalToolExecutor.CAPTURED_OUTPUT_LIMIT + extra;
        final File dir = createTempDir("tool");
        final Path script = writeShellScript(dir, "chatty.sh", "head -c " + total + " /dev/zero | tr '\\000' a");

        final ExternalToolExecutor.ToolOutput output = new ScriptRunner(script.toString()).run(dir);
        Assert.assertEquals(output.getExitValue(), 0);
        Assert.assertTrue(output.getStdout().startsWith(StringUtils.repeat('a', ExternalToolExecutor.CAPTURED_OUTPUT_LIMIT)));
        assertContains(output.getStdout(), extra + " more bytes not shown");
    }

    @Test
    public void testNonZeroExitFails() {
        final File dir = createTempDir("tool");
        final Path script = writeShellScript(dir, "fail.sh", "echo broken input 1>&2", "exit 7");

        final ScriptRunner runner = new ScriptRunner(script.toString());
        try {
            runner.run(dir, "arg1");
            Assert.fail("expected a failing tool to raise");
        } catch (final ExternalToolException e) {
            assertContains(e.getMessage(), "exited with 7");
            assertContains(e.getMessage(), "arg1");
            assertContains(e.getMessage(), "broken input");
        }
    }
}
