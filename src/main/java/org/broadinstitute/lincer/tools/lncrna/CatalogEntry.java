package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.codecs.gtf.GtfRecord;

/**
 * An exon of the lncRNA catalog: the first eight columns of its source line with new gene and transcript identity.
 */
public final class CatalogEntry {
    private final GtfRecord exon;
    private final String geneId;
    private final String transcriptId;
    private final String geneName;

    public CatalogEntry(final GtfRecord exon, final String geneId, final String transcriptId, final String geneName) {
        this.exon = Utils.nonNull(exon, "exon");
        this.geneId = Utils.nonNull(geneId, "gene id");
        this.transcriptId = Utils.nonNull(transcriptId, "transcript id");
        this.geneName = Utils.nonNull(geneName, "gene name");
    }

    public GtfRecord getExon() {
        return exon;
    }

    public String getContig() {
        return exon.getContig();
    }

    public int getStart() {
        return exon.getStart();
    }

    public String getGeneId() {
        return geneId;
    }

    public String getTranscriptId() {
        return transcriptId;
    }

    public String getGeneName() {
        return geneName;
    }

    /**
     * @return the attribute column of the entry: {@code gene_id "..."; transcript_id "..."; gene_name "...";}
     */
    public String getAttributeText() {
        return String.format("%s \"%s\"; %s \"%s\"; %s \"%s\";",
                GtfRecord.GENE_ID, geneId, GtfRecord.TRANSCRIPT_ID, transcriptId, GtfRecord.GENE_NAME, geneName);
    }

    /**
     * @return the GTF line of the entry, without line terminator
     */
    public String toGtfLine() {
        return String.join(String.valueOf(GtfRecord.FIELD_DELIMITER), exon.getLeadingColumns())
                + GtfRecord.FIELD_DELIMITER + getAttributeText();
    }

    @Override
    public String toString() {
        return toGtfLine();
    }
}
