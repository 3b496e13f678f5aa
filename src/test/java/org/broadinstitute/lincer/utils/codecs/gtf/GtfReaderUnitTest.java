package org.broadinstitute.lincer.utils.codecs.gtf;

import org.broadinstitute.lincer.LincerBaseTest;
import org.broadinstitute.lincer.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

public final class GtfReaderUnitTest extends LincerBaseTest {

    private static final String[] LINES = {
            "##description: test annotation",
            "chr1\tHAVANA\tgene\t1000\t1699\t.\t+\t.\tgene_id \"G1\"; gene_name \"LINC1\";",
            "chr1\tHAVANA\ttranscript\t1000\t1699\t.\t+\t.\tgene_id \"G1\"; transcript_id \"T1\"; gene_name \"LINC1\";",
            "chr1\tHAVANA\texon\t1000\t1199\t.\t+\t.\tgene_id \"G1\"; transcript_id \"T1\"; gene_name \"LINC1\";",
            "",
            "#chr1\tHAVANA\texon\t1300\t1399\t.\t+\t.\tgene_id \"G1\"; transcript_id \"T1\";",
            "chr1\tHAVANA\texon\t1500\t1699\t.\t+\t.\tgene_id \"G1\"; transcript_id \"T1\"; gene_name \"LINC1\";",
    };

    @Test
    public void testReadsRecordsInOrderSkippingCommentsAndBlankLines() {
        final Path gtf = createTempFileWithLines("reader", ".gtf", LINES);
        try (final GtfReader reader = new GtfReader(gtf)) {
            final List<GtfRecord> records = reader.stream().collect(Collectors.toList());
            Assert.assertEquals(records.size(), 4);
            Assert.assertEquals(records.get(0).getFeatureType(), GtfFeatureType.OTHER);
            Assert.assertEquals(records.get(1).getFeatureType(), GtfFeatureType.TRANSCRIPT);
            Assert.assertEquals(records.get(3).getStart(), 1500);
            Assert.assertEquals(records.get(3).getLineNumber(), 7);
            Assert.assertEquals(records.get(3).getSource(), gtf);
        }
    }

    @Test
    public void testReadExons() {
        final Path gtf = createTempFileWithLines("reader", ".gtf", LINES);
        final List<GtfRecord> exons = GtfReader.readExons(gtf);
        Assert.assertEquals(exons.stream().map(GtfRecord::getStart).collect(Collectors.toList()), java.util.Arrays.asList(1000, 1500));
    }

    @Test
    public void testReadRecordAndIteratorAgree() {
        final Path gtf = createTempFileWithLines("reader", ".gtf", LINES);
        try (final GtfReader reader = new GtfReader(gtf)) {
            Assert.assertEquals(reader.readRecord().getFeatureType(), GtfFeatureType.OTHER);
            Assert.assertTrue(reader.iterator().hasNext());
            Assert.assertEquals(reader.readRecord().getFeatureType(), GtfFeatureType.TRANSCRIPT);
            Assert.assertEquals(reader.stream().count(), 2);
            Assert.assertNull(reader.readRecord());
        }
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingFile() {
        new GtfReader(Paths.get(createTempDir("reader").getAbsolutePath(), "missing.gtf"));
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testMalformedLineIsReported() {
        final Path gtf = createTempFileWithLines("reader", ".gtf", LINES[3], "chr1\tHAVANA\texon\t1500");
        GtfReader.readExons(gtf);
    }
}
