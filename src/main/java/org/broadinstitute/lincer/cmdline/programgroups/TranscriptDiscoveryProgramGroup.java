package org.broadinstitute.lincer.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.lincer.utils.help.HelpConstants;

/**
 * Tools that discover and classify novel transcripts (e.g. lncRNAs) from de novo transcript assemblies
 */
public class TranscriptDiscoveryProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return HelpConstants.DOC_CAT_TRANSCRIPT_DISCOVERY; }

    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_TRANSCRIPT_DISCOVERY_SUMMARY; }
}
