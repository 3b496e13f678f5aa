package org.broadinstitute.lincer.utils.codecs.gtf;

import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.Utils;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Reads the records of a GTF file in file order, skipping blank and comment lines.
 */
public final class GtfReader implements Closeable, Iterable<GtfRecord> {

    private final Path path;
    private final BufferedReader reader;
    private long lineNumber = 0;
    private GtfRecord nextRecord;

    public GtfReader(final Path path) {
        this.path = Utils.nonNull(path, "the GTF path cannot be null");
        try {
            this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Reads all records of {@code path} that pass {@code filter}.
     */
    public static List<GtfRecord> readRecords(final Path path, final Predicate<GtfRecord> filter) {
        Utils.nonNull(filter);
        try (final GtfReader reader = new GtfReader(path)) {
            final List<GtfRecord> records = new ArrayList<>();
            for (final GtfRecord record : reader) {
                if (filter.test(record)) {
                    records.add(record);
                }
            }
            return records;
        }
    }

    /**
     * Reads the exon records of {@code path}.
     */
    public static List<GtfRecord> readExons(final Path path) {
        return readRecords(path, GtfRecord::isExon);
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return the next record, or {@code null} at the end of the file.
     */
    public GtfRecord readRecord() {
        if (nextRecord != null) {
            final GtfRecord result = nextRecord;
            nextRecord = null;
            return result;
        }
        return fetchNextRecord();
    }

    private GtfRecord fetchNextRecord() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (!GtfRecord.isSkippable(line)) {
                    return GtfRecord.decode(line, path, lineNumber);
                }
            }
            return null;
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    @Override
    public Iterator<GtfRecord> iterator() {
        return new Iterator<GtfRecord>() {
            @Override
            public boolean hasNext() {
                if (nextRecord == null) {
                    nextRecord = fetchNextRecord();
                }
                return nextRecord != null;
            }

            @Override
            public GtfRecord next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("there are no more records in " + path);
                }
                return readRecord();
            }
        };
    }

    public Stream<GtfRecord> stream() {
        return Utils.stream(this);
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, "Error closing file", e);
        }
    }
}
