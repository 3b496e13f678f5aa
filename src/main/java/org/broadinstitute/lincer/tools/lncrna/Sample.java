package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;

import java.nio.file.Path;

/**
 * A row of the sample sheet: a sample name and the de novo transcript assembly (GTF) of that sample.
 */
public final class Sample {
    private final String name;
    private final Path assembly;

    public Sample(final String name, final Path assembly) {
        this.name = Utils.nonEmpty(name, "sample name");
        this.assembly = Utils.nonNull(assembly, "assembly path");
    }

    public String getName() {
        return name;
    }

    public Path getAssembly() {
        return assembly;
    }

    /**
     * @return name of the pre-filter summary table of this sample
     */
    public String getSummaryFileName() {
        return name + ".summary.tsv";
    }

    /**
     * @return name of the GTF with the novel transcripts of this sample
     */
    public String getNovelGtfFileName() {
        return name + ".novel.gtf";
    }

    @Override
    public String toString() {
        return name + "\t" + assembly;
    }
}
