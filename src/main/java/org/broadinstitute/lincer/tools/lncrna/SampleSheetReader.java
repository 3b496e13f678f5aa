package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.io.IOUtils;
import org.broadinstitute.lincer.utils.tsv.DataLine;
import org.broadinstitute.lincer.utils.tsv.TableColumnCollection;
import org.broadinstitute.lincer.utils.tsv.TableReader;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the sample sheet: a tab separated table without header, one sample per line, with the sample name
 * in the first column and the path of its assembly GTF in the second.
 */
public final class SampleSheetReader extends TableReader<Sample> {

    public static final String SAMPLE_NAME_COLUMN = "sample_name";
    public static final String GTF_PATH_COLUMN = "gtf_path";

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(SAMPLE_NAME_COLUMN, GTF_PATH_COLUMN);

    private Set<String> namesSeen;

    public SampleSheetReader(final Path path) throws IOException {
        super(path, COLUMNS);
    }

    /**
     * Reads all samples of a sample sheet, in file order.
     *
     * @throws UserException.MalformedFile if a line does not have two columns, or a sample name is repeated.
     * @throws UserException.BadInput if the sheet lists no sample.
     */
    public static List<Sample> readSamples(final Path path) {
        IOUtils.assertFileIsReadable(path);
        final List<Sample> samples;
        try (final SampleSheetReader reader = new SampleSheetReader(path)) {
            samples = reader.toList();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
        if (samples.isEmpty()) {
            throw new UserException.BadInput("the sample sheet " + path + " lists no sample");
        }
        return samples;
    }

    @Override
    protected Sample createRecord(final DataLine dataLine) {
        if (namesSeen == null) {
            namesSeen = new HashSet<>();
        }
        final String name = dataLine.get(SAMPLE_NAME_COLUMN).trim();
        final String gtfPath = dataLine.get(GTF_PATH_COLUMN).trim();
        if (name.isEmpty() || gtfPath.isEmpty()) {
            throw formatException("empty sample name or GTF path");
        }
        if (!namesSeen.add(name)) {
            throw formatException("sample name '" + name + "' is repeated");
        }
        return new Sample(name, Paths.get(gtfPath));
    }
}
