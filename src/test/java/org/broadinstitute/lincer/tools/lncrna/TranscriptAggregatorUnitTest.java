package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.LincerBaseTest;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.codecs.gtf.GtfRecord;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class TranscriptAggregatorUnitTest extends LincerBaseTest {

    private static final Path SOURCE = Paths.get("assembly.gtf");

    static GtfRecord record(final String feature, final int start, final int end, final String transcriptId, final String coverage) {
        final String line = String.join("\t", "chr1", "Cufflinks", feature, String.valueOf(start), String.valueOf(end), ".", "+", ".",
                "gene_id \"CUFF.1\"; transcript_id \"" + transcriptId + "\"; cov \"" + coverage + "\";");
        return GtfRecord.decode(line, SOURCE, 1);
    }

    @Test
    public void testAggregate() {
        final List<GtfRecord> records = Arrays.asList(
                record("transcript", 100, 499, "T2", "9.0"),
                record("exon", 100, 199, "T2", "4.5"),
                record("exon", 1000, 1000, "T1", "1.0"),
                record("exon", 300, 499, "T2", "9.0"),
                record("exon", 600, 649, "T2", "2.0"));

        final Map<String, TranscriptSummary> summaries = TranscriptAggregator.aggregate(records);

        Assert.assertEquals(new ArrayList<>(summaries.keySet()), Arrays.asList("T2", "T1"));
        final TranscriptSummary t2 = summaries.get("T2");
        Assert.assertEquals(t2.getLength(), 100 + 200 + 50);
        Assert.assertEquals(t2.getExonCount(), 3);
        Assert.assertEquals(t2.getCoverage(), 9.0);
        final TranscriptSummary t1 = summaries.get("T1");
        Assert.assertEquals(t1.getLength(), 1);
        Assert.assertEquals(t1.getExonCount(), 1);
        Assert.assertEquals(t1.getCoverage(), 1.0);
    }

    @Test
    public void testTranscriptWithoutExonsHasNoSummary() {
        final Map<String, TranscriptSummary> summaries =
                TranscriptAggregator.aggregate(Collections.singletonList(record("transcript", 1, 10, "T1", "3")));
        Assert.assertTrue(summaries.isEmpty());
    }

    @Test
    public void testLengthIsSumOfExonLengths() {
        final List<GtfRecord> records = new ArrayList<>();
        long expectedLength = 0;
        for (int i = 0; i < 10; i++) {
            final int start = 1 + i * 1000;
            final int end = start + i * 7;
            records.add(record("exon", start, end, "T", String.valueOf(i)));
            expectedLength += end - start + 1;
        }
        final TranscriptSummary summary = TranscriptAggregator.aggregate(records).get("T");
        Assert.assertEquals(summary.getLength(), expectedLength);
        Assert.assertEquals(summary.getExonCount(), records.size());
        Assert.assertEquals(summary.getCoverage(), 9.0);
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testExonWithoutCoverage() {
        final String line = "chr1\tsrc\texon\t1\t10\t.\t+\t.\tgene_id \"G\"; transcript_id \"T\";";
        TranscriptAggregator.aggregate(Collections.singletonList(GtfRecord.decode(line, SOURCE, 3)));
    }
}
