package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.io.IOUtils;

import java.io.BufferedWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes catalog entries as a headerless nine column GTF, one line per entry and with no quoting beyond the
 * attribute values.
 */
public final class CatalogGtfWriter {

    private CatalogGtfWriter() {}

    /**
     * Writes {@code entries} in list order, replacing {@code output} atomically.
     */
    public static Path write(final List<CatalogEntry> entries, final Path output) {
        Utils.nonNull(entries, "entries");
        Utils.nonNull(output, "output");
        return IOUtils.writeAtomically(output, tempPath -> {
            try (final BufferedWriter writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
                for (final CatalogEntry entry : entries) {
                    writer.write(entry.toGtfLine());
                    writer.write('\n');
                }
            }
        });
    }
}
