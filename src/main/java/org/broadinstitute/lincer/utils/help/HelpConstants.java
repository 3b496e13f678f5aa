package org.broadinstitute.lincer.utils.help;

public final class HelpConstants {

    private HelpConstants() {};

    /**
     * Definition of the group names / descriptions for documentation/help purposes.
     *
     */
    public final static String DOC_CAT_TRANSCRIPT_DISCOVERY = "Transcript Discovery";
    public final static String DOC_CAT_TRANSCRIPT_DISCOVERY_SUMMARY = "Tools that discover and classify novel transcripts from de novo assemblies";
}
