package org.nanopolishcomp.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.nanopolishcomp.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

public final class LoggingUtilsUnitTest extends BaseTest {

    @AfterMethod
    public void restoreVerbosity() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    @Test
    public void testLevelMappingRoundTrips() {
        for (final Log.LogLevel level : Log.LogLevel.values()) {
            final Level log4jLevel = LoggingUtils.levelToLog4jLevel(level);
            Assert.assertNotNull(log4jLevel, level.name());
            Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(log4jLevel), level);
        }
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(Log.LogLevel.WARNING), Level.WARN);
    }

    @Test
    public void testSetLoggingLevelPropagatesToLog4j() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.DEBUG);
        Assert.assertTrue(LogManager.getLogger(LoggingUtilsUnitTest.class).isDebugEnabled());
        Assert.assertTrue(Log.isEnabled(Log.LogLevel.DEBUG));

        LoggingUtils.setLoggingLevel(Log.LogLevel.ERROR);
        Assert.assertFalse(LogManager.getLogger(LoggingUtilsUnitTest.class).isWarnEnabled());
        Assert.assertFalse(Log.isEnabled(Log.LogLevel.WARNING));
    }
}
