package org.broadinstitute.lincer.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String OUTPUT_DIRECTORY_LONG_NAME = "output-directory";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String COMPARATOR_EXECUTABLE_LONG_NAME = "comparator-executable";
    public static final String MERGER_EXECUTABLE_LONG_NAME = "merger-executable";
    public static final String MIN_TRANSCRIPT_LENGTH_LONG_NAME = "min-transcript-length";
    public static final String MIN_EXON_COUNT_LONG_NAME = "min-exon-count";
    public static final String MIN_COVERAGE_LONG_NAME = "min-coverage";
    public static final String NOVEL_CLASS_CODE_LONG_NAME = "novel-class-code";

    public static final String OUTPUT_DIRECTORY_SHORT_NAME = "O";

    /**
     * The option specifying a main configuration file.
     * This is used in {@link org.broadinstitute.lincer.Main} to control which config file is loaded.
     */
    public static final String LINCER_CONFIG_FILE_OPTION = "lincer-config-file";

    public static final String TMP_DIR_NAME = "tmp-dir";
    public static final String QUIET_NAME = "QUIET";
}
