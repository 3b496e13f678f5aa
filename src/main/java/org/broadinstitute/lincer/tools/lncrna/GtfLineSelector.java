package org.broadinstitute.lincer.tools.lncrna;

import org.apache.commons.io.output.ByteArrayOutputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.codecs.gtf.GtfRecord;
import org.broadinstitute.lincer.utils.io.IOUtils;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Copies the lines of a GTF file whose {@code transcript_id} is in a given set, in input order.
 * <p>
 * Kept lines are copied byte for byte, with their own terminator: {@code \n}, {@code \r\n}, or none for an
 * unterminated last line. Only {@code \n} ends a line. Blank lines and comments are dropped.
 * </p>
 */
public final class GtfLineSelector {
    private static final Logger logger = LogManager.getLogger(GtfLineSelector.class);

    private GtfLineSelector() {}

    /**
     * @param input GTF to read; every record line must carry a {@code transcript_id}
     * @param output GTF to write, replaced atomically
     * @param transcriptIds ids of the transcripts to keep
     * @return number of lines written
     * @throws UserException.MalformedFile if a record line has no {@code transcript_id}
     */
    public static long select(final Path input, final Path output, final Set<String> transcriptIds) {
        Utils.nonNull(input, "input");
        Utils.nonNull(output, "output");
        Utils.nonNull(transcriptIds, "transcript ids");
        IOUtils.assertFileIsReadable(input);

        final long[] written = {0};
        IOUtils.writeAtomically(output, tempPath -> {
            try (final InputStream in = new BufferedInputStream(Files.newInputStream(input));
                 final OutputStream out = new BufferedOutputStream(Files.newOutputStream(tempPath))) {
                final ByteArrayOutputStream line = new ByteArrayOutputStream();
                long lineNumber = 0;
                int next;
                do {
                    next = in.read();
                    if (next != -1) {
                        line.write(next);
                    }
                    if ((next == '\n' || next == -1) && line.size() > 0) {
                        lineNumber++;
                        final byte[] raw = line.toByteArray();
                        line.reset();
                        if (isSelected(raw, input, lineNumber, transcriptIds)) {
                            out.write(raw);
                            written[0]++;
                        }
                    }
                } while (next != -1);
            }
        });
        logger.debug(String.format("Kept %d lines of %s in %s", written[0], input, output));
        return written[0];
    }

    private static boolean isSelected(final byte[] raw, final Path input, final long lineNumber,
                                      final Set<String> transcriptIds) {
        final String text = new String(raw, 0, contentLength(raw), StandardCharsets.UTF_8);
        return !GtfRecord.isSkippable(text)
                && transcriptIds.contains(GtfRecord.decode(text, input, lineNumber).getTranscriptId());
    }

    /**
     * @return the length of {@code raw} without its {@code \n} or {@code \r\n} terminator
     */
    static int contentLength(final byte[] raw) {
        int length = raw.length;
        if (length > 0 && raw[length - 1] == '\n') {
            length--;
            if (length > 0 && raw[length - 1] == '\r') {
                length--;
            }
        }
        return length;
    }
}
