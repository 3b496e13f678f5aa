package org.broadinstitute.lincer.tools.lncrna;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.codecs.gtf.GtfRecord;

import java.util.*;

/**
 * Builds the lncRNA catalog from the exons of the known lncRNAs and of the classified novel transcripts.
 * <ul>
 *     <li>Known lncRNA exons keep their gene id, transcript id and gene name. A known exon without
 *     {@code gene_name} is named after its gene id.</li>
 *     <li>Novel isoforms take the gene name of the known lncRNA gene they matched, and the first gene id that
 *     name has among the known exons. If the name is not found, or the isoform matched no gene, the assembly's
 *     own gene id is kept.</li>
 *     <li>Novel genes (intergenic, antisense and intronic transcripts) keep the assembly's gene id and are named
 *     after it.</li>
 *     <li>Other novel transcripts are left out.</li>
 * </ul>
 * Entries are sorted by contig, then the lowest start of their gene, then gene id, then transcript id;
 * ties keep the order above.
 */
public final class LncRnaCatalogBuilder {
    private static final Logger logger = LogManager.getLogger(LncRnaCatalogBuilder.class);

    public static final Comparator<CatalogEntry> CONTIG_ORDER = Comparator.comparing(CatalogEntry::getContig);

    private LncRnaCatalogBuilder() {}

    /**
     * @param knownExons exon lines of the known lncRNA annotation
     * @param novelExons exon lines of the merged novel transcripts
     * @param classifications classification of the novel transcripts by transcript id
     * @return the catalog entries in output order
     */
    public static List<CatalogEntry> build(final List<GtfRecord> knownExons, final List<GtfRecord> novelExons,
                                           final Map<String, ClassificationRecord> classifications) {
        Utils.nonNull(knownExons, "known exons");
        Utils.nonNull(novelExons, "novel exons");
        Utils.nonNull(classifications, "classifications");

        final List<CatalogEntry> entries = new ArrayList<>(knownExons.size() + novelExons.size());
        final Map<String, String> geneIdByName = new HashMap<>();
        for (final GtfRecord exon : knownExons) {
            final String geneId = exon.getGeneId();
            final String geneName = getKnownGeneName(exon);
            geneIdByName.putIfAbsent(geneName, geneId);
            entries.add(new CatalogEntry(exon, geneId, exon.getTranscriptId(), geneName));
        }

        final List<CatalogEntry> novelGeneEntries = new ArrayList<>();
        final Set<String> unresolvedTranscripts = new LinkedHashSet<>();
        for (final GtfRecord exon : novelExons) {
            final String transcriptId = exon.getTranscriptId();
            final ClassificationRecord classification = classifications.get(transcriptId);
            if (classification == null) {
                continue;
            }
            final String locusId = exon.getGeneId();
            final TranscriptClass transcriptClass = classification.getTranscriptClass();
            if (transcriptClass == TranscriptClass.NOVEL_ISOFORM) {
                final String geneName = classification.getKnownLncRnaGene();
                final String geneId = geneName == null ? null : geneIdByName.get(geneName);
                if (geneId == null) {
                    unresolvedTranscripts.add(transcriptId);
                    entries.add(new CatalogEntry(exon, locusId, transcriptId, geneName == null ? locusId : geneName));
                } else {
                    entries.add(new CatalogEntry(exon, geneId, transcriptId, geneName));
                }
            } else if (transcriptClass.isNovelGene()) {
                novelGeneEntries.add(new CatalogEntry(exon, locusId, transcriptId, locusId));
            }
        }
        entries.addAll(novelGeneEntries);

        for (final String transcriptId : unresolvedTranscripts) {
            final String geneName = classifications.get(transcriptId).getKnownLncRnaGene();
            if (geneName == null) {
                logger.warn(String.format("Novel isoform %s has no matched known lncRNA gene. Keeping its assembly gene id.", transcriptId));
            } else {
                logger.warn(String.format("Novel isoform %s matched known lncRNA gene '%s', which has no gene id among the known lncRNAs. Keeping its assembly gene id.",
                        transcriptId, geneName));
            }
        }

        sort(entries);
        return entries;
    }

    private static String getKnownGeneName(final GtfRecord exon) {
        final String geneName = exon.getAttribute(GtfRecord.GENE_NAME);
        return geneName == null ? exon.getGeneId() : geneName;
    }

    /**
     * Sorts entries in place by contig, lowest start of their gene, gene id and transcript id. The sort is stable.
     */
    public static void sort(final List<CatalogEntry> entries) {
        final Map<String, Integer> geneStarts = new HashMap<>();
        for (final CatalogEntry entry : entries) {
            geneStarts.merge(entry.getGeneId(), entry.getStart(), Math::min);
        }
        entries.sort(CONTIG_ORDER
                .thenComparing(e -> geneStarts.get(e.getGeneId()))
                .thenComparing(CatalogEntry::getGeneId)
                .thenComparing(CatalogEntry::getTranscriptId));
    }
}
