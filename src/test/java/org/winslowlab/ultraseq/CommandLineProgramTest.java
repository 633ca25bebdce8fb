package org.winslowlab.ultraseq;

import org.winslowlab.ultraseq.testutils.BaseTest;
import org.winslowlab.ultraseq.testutils.CommandLineProgramTester;

/**
 * Utility class for UltraSeq CommandLine Program testing.
 */
public abstract class CommandLineProgramTest extends BaseTest implements CommandLineProgramTester {

    @Override
    public String getTestedToolName() {
        return getTestedClassName();
    }
}
