package org.winslowlab.ultraseq.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that extract, cluster-merge and count dual-guide clonal barcodes
 */
public final class ClonalBarcodeProgramGroup implements CommandLineProgramGroup {

    public static final String NAME = "Clonal Barcodes";

    @Override
    public String getName() { return NAME; }

    @Override
    public String getDescription() { return "Tools that extract dual-guide clonal barcodes from paired reads and count them per sample"; }
}
