package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.LincerBaseTest;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.runtime.ExternalToolException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SortedMap;

public final class TranscriptComparatorUnitTest extends LincerBaseTest {

    private static final String TMAP_HEADER = String.join("\t", "ref_gene_id", "ref_id", "class_code", "cuff_gene_id", "cuff_id",
            "FMI", "FPKM", "FPKM_conf_lo", "FPKM_conf_hi", "cov", "len", "major_iso_id", "ref_match_len");

    private static String tmapRow(final String refGeneId, final String refId, final String classCode, final String queryId) {
        return String.join("\t", refGeneId, refId, classCode, "CUFF.1", queryId,
                "100", "1.5", "0.5", "2.5", "4.2", "300", queryId, "-");
    }

    /**
     * Writes a comparator stand-in that checks its arguments, writes {@code tmapLines} as the table of its query,
     * and records its working directory in {@code workingDirectoryMarker}.
     */
    private static Path writeFakeComparator(final File directory, final Path workingDirectoryMarker, final String... tmapLines) {
        final List<String> body = new ArrayList<>(Arrays.asList(
                "test \"$1\" = \"-r\" || exit 9",
                "test -f \"$2\" || exit 8",
                "test -L \"$3\" || exit 7",
                "pwd > '" + workingDirectoryMarker + "'",
                "echo comparing > \"cuffcmp.loci\"",
                "cat > \"cuffcmp.$3.tmap\" <<'TMAP'"));
        body.addAll(Arrays.asList(tmapLines));
        body.add("TMAP");
        return writeShellScript(directory, "fake-cuffcompare", body.toArray(new String[0]));
    }

    @Test
    public void testTmapFileName() {
        Assert.assertEquals(TranscriptComparator.getTmapFileName("liver.gtf"), "cuffcmp.liver.gtf.tmap");
    }

    @Test
    public void testReadTmap() {
        final Path tmap = createTempFileWithLines("cuffcmp", ".tmap",
                TMAP_HEADER,
                tmapRow("GENE1", "ENST1", "j", "CUFF.1.2"),
                tmapRow("-", "-", "u", "CUFF.1.1"),
                tmapRow("GENE2", "ENST2", "=", "CUFF.1.2"));

        final SortedMap<String, ComparisonRecord> records = TranscriptComparator.readTmap(tmap);

        Assert.assertEquals(new ArrayList<>(records.keySet()), Arrays.asList("CUFF.1.1", "CUFF.1.2"));
        Assert.assertEquals(records.get("CUFF.1.1"), new ComparisonRecord("CUFF.1.1", ClassCode.INTERGENIC, null, null));
        Assert.assertEquals(records.get("CUFF.1.2"), new ComparisonRecord("CUFF.1.2", ClassCode.SPLICE_JUNCTION_MATCH, "ENST1", "GENE1"));
        Assert.assertEquals(TmapTableReader.formatRefId(null), "-");
        Assert.assertEquals(TmapTableReader.formatRefId("ENST1"), "ENST1");
    }

    @Test
    public void testReadTmapWithUnknownClassCode() {
        final Path tmap = createTempFileWithLines("cuffcmp", ".tmap", TMAP_HEADER,
                tmapRow("GENE1", "ENST1", "Q", "CUFF.1.1"),
                tmapRow("-", "-", "u", "CUFF.1.2"));

        final SortedMap<String, ComparisonRecord> records = TranscriptComparator.readTmap(tmap);

        Assert.assertEquals(records.size(), 2);
        Assert.assertEquals(records.get("CUFF.1.1").getClassCode(), ClassCode.UNKNOWN);
        Assert.assertEquals(records.get("CUFF.1.1").getClassCodeText(), "Q");
        Assert.assertEquals(NovelTranscriptClassifier.classify(records.get("CUFF.1.1"), null), TranscriptClass.NOT_A_LNCRNA);
        Assert.assertEquals(records.get("CUFF.1.2").getClassCode(), ClassCode.INTERGENIC);
    }

    @Test
    public void testReadTmapWithEmptyClassCode() {
        final Path tmap = createTempFileWithLines("cuffcmp", ".tmap", TMAP_HEADER, tmapRow("-", "-", " ", "CUFF.1.1"));
        try {
            TranscriptComparator.readTmap(tmap);
            Assert.fail("expected an empty class code to be rejected");
        } catch (final UserException.MalformedFile e) {
            assertContains(e.getMessage(), "line 2");
        }
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testReadTmapWithoutClassCodeColumn() {
        TranscriptComparator.readTmap(createTempFileWithLines("cuffcmp", ".tmap", "ref_gene_id\tref_id\tcuff_id", "-\t-\tCUFF.1.1"));
    }

    @Test
    public void testCompare() {
        final File scripts = createTempDir("scripts");
        final Path marker = scripts.toPath().resolve("cwd.txt");
        final Path script = writeFakeComparator(scripts, marker,
                TMAP_HEADER,
                tmapRow("GENE1", "ENST1", "x", "CUFF.2.1"),
                tmapRow("-", "-", "u", "CUFF.1.1"));
        final Path reference = createTempFileWithLines("reference", ".gtf", "# reference");
        final Path query = createTempFileWithLines("query", ".gtf", "# query");

        final TranscriptComparator comparator = new TranscriptComparator(script.toString());
        final SortedMap<String, ComparisonRecord> records = comparator.compare(reference, query);

        Assert.assertEquals(new ArrayList<>(records.keySet()), Arrays.asList("CUFF.1.1", "CUFF.2.1"));
        Assert.assertEquals(records.get("CUFF.2.1").getClassCode(), ClassCode.EXONIC_ANTISENSE);
        Assert.assertEquals(records.get("CUFF.2.1").getRefGeneId(), "GENE1");

        final Path workingDirectory = Paths.get(readLines(marker).get(0));
        Assert.assertFalse(Files.exists(workingDirectory), "comparator working directory was not deleted");
        Assert.assertTrue(Files.exists(query), "the query must survive the comparison");
        Assert.assertFalse(Files.exists(query.resolveSibling(TranscriptComparator.getTmapFileName(query.getFileName().toString()))));
        assertContains(comparator.getApproximateCommandLine(), query.toAbsolutePath().toString());
    }

    @Test
    public void testCompareWithoutTable() {
        final File scripts = createTempDir("scripts");
        final Path marker = scripts.toPath().resolve("cwd.txt");
        final Path script = writeShellScript(scripts, "silent-cuffcompare", "pwd > '" + marker + "'", "echo nothing to do");
        final Path reference = createTempFileWithLines("reference", ".gtf", "# reference");
        final Path query = createTempFileWithLines("query", ".gtf", "# query");

        try {
            new TranscriptComparator(script.toString()).compare(reference, query);
            Assert.fail("expected a missing table to fail");
        } catch (final ExternalToolException e) {
            assertContains(e.getMessage(), "was not written");
        }
        Assert.assertFalse(Files.exists(Paths.get(readLines(marker).get(0))));
    }

    @Test
    public void testCompareWithFailingTool() {
        final File scripts = createTempDir("scripts");
        final Path script = writeShellScript(scripts, "failing-cuffcompare", "echo 'cannot open reference' 1>&2", "exit 1");
        final Path reference = createTempFileWithLines("reference", ".gtf", "# reference");
        final Path query = createTempFileWithLines("query", ".gtf", "# query");

        try {
            new TranscriptComparator(script.toString()).compare(reference, query);
            Assert.fail("expected a failing comparator to raise");
        } catch (final ExternalToolException e) {
            assertContains(e.getMessage(), "exited with 1");
        }
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testCompareMissingQuery() {
        final File dir = createTempDir("compare");
        new TranscriptComparator("cuffcompare").compare(createTempFileWithLines("reference", ".gtf", "#"),
                dir.toPath().resolve("absent.gtf"));
    }
}
