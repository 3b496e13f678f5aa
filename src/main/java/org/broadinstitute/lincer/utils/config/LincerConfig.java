package org.broadinstitute.lincer.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

import java.util.List;

/**
 * Configuration file for lincer options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + LincerConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:LincerConfig.properties",
 *        3)   "classpath:org/broadinstitute/lincer/utils/config/LincerConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + LincerConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                // Variable for file loading
        "file:LincerConfig.properties",                                               // Default path
        "classpath:org/broadinstitute/lincer/utils/config/LincerConfig.properties"   // Class path
})
public interface LincerConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link LincerConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "LincerConfig.pathToLincerConfig";

    // ----------------------------------------------------------
    // System Options:
    // ----------------------------------------------------------

    @Key("lincer_stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean lincer_stacktrace_on_user_exception();

    // ----------------------------------------------------------
    // External tools:
    // ----------------------------------------------------------

    /** Transcript comparator, invoked as {@code <executable> -r <reference> <query>}. */
    @Key("comparator_executable")
    @DefaultValue("cuffcompare")
    String comparator_executable();

    /** Assembly merger, invoked with a manifest of per-sample assemblies. */
    @Key("merger_executable")
    @DefaultValue("cuffmerge")
    String merger_executable();

    // ----------------------------------------------------------
    // Novelty filter thresholds:
    // ----------------------------------------------------------

    @Key("min_transcript_length")
    @DefaultValue("200")
    int min_transcript_length();

    @Key("min_exon_count")
    @DefaultValue("2")
    int min_exon_count();

    @Key("min_coverage")
    @DefaultValue("3.0")
    double min_coverage();

    @Key("novel_class_codes")
    @DefaultValue("u,j,i,x")
    List<String> novel_class_codes();
}
