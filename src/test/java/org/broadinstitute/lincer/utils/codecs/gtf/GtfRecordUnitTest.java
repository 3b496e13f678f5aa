package org.broadinstitute.lincer.utils.codecs.gtf;

import org.broadinstitute.lincer.LincerBaseTest;
import org.broadinstitute.lincer.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.util.Arrays;

public final class GtfRecordUnitTest extends LincerBaseTest {

    private static final String EXON_LINE =
            "chr1\tCufflinks\texon\t1000\t1099\t1000\t+\t.\tgene_id \"CUFF.1\"; transcript_id \"CUFF.1.1\"; exon_number \"1\"; cov \"5.250000\";";

    @Test
    public void testDecodeExon() {
        final GtfRecord record = GtfRecord.decode(EXON_LINE, null, 1);
        Assert.assertEquals(record.getContig(), "chr1");
        Assert.assertEquals(record.getStart(), 1000);
        Assert.assertEquals(record.getEnd(), 1099);
        Assert.assertEquals(record.getLengthOnReference(), 100);
        Assert.assertEquals(record.getFeatureType(), GtfFeatureType.EXON);
        Assert.assertTrue(record.isExon());
        Assert.assertEquals(record.getStrand(), "+");
        Assert.assertEquals(record.getGeneId(), "CUFF.1");
        Assert.assertEquals(record.getTranscriptId(), "CUFF.1.1");
        Assert.assertEquals(record.getCoverage(), 5.25);
        Assert.assertEquals(record.getLine(), EXON_LINE);
        Assert.assertEquals(record.getLeadingColumns(),
                Arrays.asList("chr1", "Cufflinks", "exon", "1000", "1099", "1000", "+", "."));
    }

    @Test
    public void testFeatureTypes() {
        Assert.assertEquals(GtfFeatureType.fromFeatureName("exon"), GtfFeatureType.EXON);
        Assert.assertEquals(GtfFeatureType.fromFeatureName("transcript"), GtfFeatureType.TRANSCRIPT);
        Assert.assertEquals(GtfFeatureType.fromFeatureName("CDS"), GtfFeatureType.OTHER);
        Assert.assertEquals(GtfFeatureType.fromFeatureName("Exon"), GtfFeatureType.OTHER);
    }

    @Test
    public void testMissingOptionalAttribute() {
        final GtfRecord record = GtfRecord.decode(EXON_LINE, null, 1);
        Assert.assertNull(record.getAttribute(GtfRecord.GENE_NAME));
    }

    @DataProvider(name = "malformedLines")
    public Object[][] malformedLines() {
        return new Object[][] {
                {"chr1\tCufflinks\texon\t1000\t1099\t1000\t+\t."},
                {"chr1\tCufflinks\texon\tfirst\t1099\t1000\t+\t.\tgene_id \"G\"; transcript_id \"T\";"},
                {"chr1\tCufflinks\texon\t1000\t1099.5\t1000\t+\t.\tgene_id \"G\"; transcript_id \"T\";"},
                {"chr1\tCufflinks\texon\t1100\t1099\t1000\t+\t.\tgene_id \"G\"; transcript_id \"T\";"},
                {"chr1\tCufflinks\texon\t1000\t1099\t1000\t+\t.\tgene_id \"G; transcript_id \"T\";"},
        };
    }

    @Test(dataProvider = "malformedLines", expectedExceptions = UserException.MalformedFile.class)
    public void testMalformedLine(final String line) {
        GtfRecord.decode(line, Paths.get("assembly.gtf"), 3);
    }

    @Test
    public void testMissingTranscriptIdIsMalformed() {
        final GtfRecord record = GtfRecord.decode("chr1\tsrc\texon\t1\t10\t.\t+\t.\tgene_id \"G\";", Paths.get("assembly.gtf"), 7);
        try {
            record.getTranscriptId();
            Assert.fail("expected a malformed file exception");
        } catch (final UserException.MalformedFile e) {
            assertContains(e.getMessage(), "assembly.gtf");
            assertContains(e.getMessage(), "line 7");
            assertContains(e.getMessage(), GtfRecord.TRANSCRIPT_ID);
        }
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testNonNumericCoverage() {
        GtfRecord.decode("chr1\tsrc\texon\t1\t10\t.\t+\t.\tgene_id \"G\"; transcript_id \"T\"; cov \"high\";", null, 1).getCoverage();
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testMissingCoverage() {
        GtfRecord.decode("chr1\tsrc\texon\t1\t10\t.\t+\t.\tgene_id \"G\"; transcript_id \"T\";", null, 1).getCoverage();
    }

    @Test
    public void testSkippableLines() {
        Assert.assertTrue(GtfRecord.isSkippable(""));
        Assert.assertTrue(GtfRecord.isSkippable("   "));
        Assert.assertTrue(GtfRecord.isSkippable("#!genome-build GRCh38"));
        Assert.assertTrue(GtfRecord.isSkippable("##description: test"));
        Assert.assertFalse(GtfRecord.isSkippable(EXON_LINE));
    }
}
