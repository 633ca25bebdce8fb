package org.winslowlab.ultraseq.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.winslowlab.ultraseq.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class LoggingUtilsUnitTest extends BaseTest {

    @Test
    public void testLevelsMapBothWays() {
        for (final Log.LogLevel level : Log.LogLevel.values()) {
            Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(LoggingUtils.levelToLog4jLevel(level)), level);
        }
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(Log.LogLevel.WARNING), Level.WARN);
        Assert.assertNull(LoggingUtils.levelFromLog4jLevel(Level.TRACE));
    }

    @Test
    public void testSetLoggingLevel() {
        try {
            LoggingUtils.setLoggingLevel(Log.LogLevel.DEBUG);
            Assert.assertEquals(Log.getGlobalLogLevel(), Log.LogLevel.DEBUG);
        } finally {
            LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
        }
        Assert.assertEquals(Log.getGlobalLogLevel(), Log.LogLevel.WARNING);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullVerbosity() {
        LoggingUtils.setLoggingLevel(null);
    }
}
