package org.broadinstitute.lincer.utils.config;

import org.broadinstitute.lincer.LincerBaseTest;
import org.broadinstitute.lincer.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.Arrays;

public final class ConfigFactoryUnitTest extends LincerBaseTest {

    private static final String CONFIG_OPTION = "--lincer-config-file";

    @DataProvider
    public Object[][] provideArgsWithConfigFile() {
        return new Object[][] {
                { new String[] {}, null },
                { new String[] {"samples.tsv", "ref.gtf", "lnc.gtf"}, null },
                { new String[] {CONFIG_OPTION, "my.properties", "samples.tsv"}, "my.properties" },
                { new String[] {"samples.tsv", "-O", "out", CONFIG_OPTION, "other.properties"}, "other.properties" },
        };
    }

    @Test(dataProvider = "provideArgsWithConfigFile")
    public void testGetConfigFilenameFromArgs(final String[] args, final String expected) {
        Assert.assertEquals(ConfigFactory.getConfigFilenameFromArgs(args, CONFIG_OPTION), expected);
    }

    @DataProvider
    public Object[][] provideArgsMissingConfigValue() {
        return new Object[][] {
                { new String[] {"samples.tsv", CONFIG_OPTION} },
                { new String[] {CONFIG_OPTION, "-O", "out"} },
        };
    }

    @Test(dataProvider = "provideArgsMissingConfigValue", expectedExceptions = UserException.BadInput.class)
    public void testGetConfigFilenameFromArgsWithoutValue(final String[] args) {
        ConfigFactory.getConfigFilenameFromArgs(args, CONFIG_OPTION);
    }

    @Test
    public void testDefaults() {
        final LincerConfig config = ConfigFactory.getInstance().createLincerConfig();

        Assert.assertFalse(config.lincer_stacktrace_on_user_exception());
        Assert.assertEquals(config.comparator_executable(), "cuffcompare");
        Assert.assertEquals(config.merger_executable(), "cuffmerge");
        Assert.assertEquals(config.min_transcript_length(), 200);
        Assert.assertEquals(config.min_exon_count(), 2);
        Assert.assertEquals(config.min_coverage(), 3.0);
        Assert.assertEquals(config.novel_class_codes(), Arrays.asList("u", "j", "i", "x"));
    }

    @Test
    public void testMutableConfig() {
        final LincerConfig config = ConfigFactory.getInstance().createLincerConfig();
        config.setProperty("min_exon_count", "3");
        Assert.assertEquals(config.min_exon_count(), 3);
        Assert.assertEquals(ConfigFactory.getInstance().createLincerConfig().min_exon_count(), 2);
    }

    @Test
    public void testUserConfigFileOverridesSomeValues() {
        final Path userConfig = createTempFileWithLines("user", ".properties", "min_exon_count = 3");
        org.aeonbits.owner.ConfigFactory.setProperty(LincerConfig.CONFIG_FILE_VARIABLE_FILE_NAME, userConfig.toString());
        try {
            final LincerConfig config = ConfigFactory.getInstance().createLincerConfig();
            Assert.assertEquals(config.min_exon_count(), 3);
            Assert.assertEquals(config.comparator_executable(), "cuffcompare");
            Assert.assertTrue(config.propertyNames().contains("min_exon_count"));
        } finally {
            org.aeonbits.owner.ConfigFactory.setProperty(LincerConfig.CONFIG_FILE_VARIABLE_FILE_NAME, ConfigFactory.NO_CONFIG_FILE);
        }
    }
}
