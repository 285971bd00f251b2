package org.nanopolishcomp;

import org.nanopolishcomp.testutils.BaseTest;
import org.nanopolishcomp.testutils.CommandLineProgramTester;

/**
 * Utility class for CommandLine Program testing.
 */
public abstract class CommandLineProgramTest extends BaseTest implements CommandLineProgramTester {

    @Override
    public String getTestedToolName() {
        return getTestedClassName();
    }
}
