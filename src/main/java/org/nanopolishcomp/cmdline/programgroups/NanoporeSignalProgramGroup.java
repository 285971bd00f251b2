package org.nanopolishcomp.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that process nanopore signal-level alignments
 */
public class NanoporeSignalProgramGroup implements CommandLineProgramGroup {

    public static final String NAME = "Nanopore Signal";
    public static final String DESCRIPTION = "Tools that process nanopore signal-level alignments";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return DESCRIPTION;
    }
}
