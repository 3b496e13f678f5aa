package org.broadinstitute.lincer;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.lincer.cmdline.CommandLineProgram;
import org.broadinstitute.lincer.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.tools.lncrna.DiscoverLncRNAs;
import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.config.ConfigFactory;
import org.broadinstitute.lincer.utils.config.LincerConfig;

import java.io.PrintStream;

/**
 * Command-line entry point of lincer: loads the configuration, runs {@link DiscoverLncRNAs} and turns its
 * failures into exit values.
 * <p>
 * Argument errors exit with {@value #COMMANDLINE_EXCEPTION_EXIT_VALUE} after printing the usage,
 * {@link UserException}s with {@value #USER_EXCEPTION_EXIT_VALUE}, and anything else with
 * {@value #ANY_OTHER_EXCEPTION_EXIT_VALUE}.
 * </p>
 */
public class Main {

    static {
        // number formatting in the output tables must not depend on the host locale
        Utils.forceJVMLocaleToUSEnglish();
    }

    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "lincer_stacktrace_on_user_exception";
    private static final String STACK_TRACE_ON_USER_EXCEPTION_ENV = "LINCER_STACKTRACE_ON_USER_EXCEPTION";

    private static final String USER_ERROR_PREFIX = "A USER ERROR has occurred: ";

    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, final String prefix) {
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        final String rule = Utils.dupChar('*', 71);
        ps.println(rule);
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println(rule);
    }

    /**
     * Loads the configuration, pointing it at the file given with {@code --lincer-config-file} if present.
     */
    protected LincerConfig setupConfig(final String[] args) {
        return ConfigFactory.getInstance().initializeFromCommandLineArgs(args,
                "--" + StandardArgumentDefinitions.LINCER_CONFIG_FILE_OPTION);
    }

    /**
     * Built after {@link #setupConfig(String[])}, since argument defaults are read from the configuration.
     */
    protected CommandLineProgram makeCommandLineProgram() {
        return new DiscoverLncRNAs();
    }

    /**
     * Runs the tool and lets its exceptions propagate. For tests.
     */
    public Object instanceMain(final String[] args) {
        setupConfig(args);
        return makeCommandLineProgram().instanceMain(args);
    }

    /**
     * Runs the tool and reports any failure on the standard streams.
     *
     * @return 0 on success, otherwise the exit value of the failure
     */
    public final int runAndGetExitValue(final String[] args) {
        CommandLineProgram program = null;
        try {
            setupConfig(args);
            program = makeCommandLineProgram();
            handleResult(program.instanceMain(args));
            return 0;
        } catch (final CommandLineException e) {
            if (program != null) {
                System.out.println(program.getUsage());
            }
            printDecoratedExceptionMessage(System.err, e, USER_ERROR_PREFIX);
            return COMMANDLINE_EXCEPTION_EXIT_VALUE;
        } catch (final UserException e) {
            handleUserException(e);
            return USER_EXCEPTION_EXIT_VALUE;
        } catch (final Exception e) {
            handleNonUserException(e);
            return ANY_OTHER_EXCEPTION_EXIT_VALUE;
        }
    }

    /**
     * The only place allowed to call {@link System#exit(int)}.
     */
    protected final void mainEntry(final String[] args) {
        final int exitValue = runAndGetExitValue(args);
        if (exitValue != 0) {
            System.exit(exitValue);
        }
    }

    /**
     * Prints the result of the tool, if any.
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    protected void handleUserException(final Exception e) {
        printDecoratedExceptionMessage(System.err, e, USER_ERROR_PREFIX);
        if (printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format("Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY, STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_ENV))
                || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)
                || ConfigFactory.getInstance().getLincerConfig().lincer_stacktrace_on_user_exception();
    }
}
