package com.snooker.analysis.config;

import com.snooker.analysis.exception.ConfigurationException;
import com.snooker.analysis.processor.ProcessingMode;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SnookerAnalysisConfigTest {

    @Test
    public void defaultsAreValid() {
        SnookerAnalysisConfig config = new SnookerAnalysisConfig();
        assertSame(config, config.validate());
        assertEquals(0.2f, config.getConfidenceThreshold(), 1e-6);
        assertEquals(10, config.getMaxDisappearedFrames());
        assertEquals(ProcessingMode.BATCH, config.getProcessingMode());
        assertTrue(Double.isInfinite(config.getClassMismatchPenalty()));
        assertNull(config.getCameraId());
    }

    @Test
    public void classpathConfigurationLoads() {
        SnookerAnalysisConfig config = SnookerAnalysisConfig.loadConfig().validate();
        assertEquals(3.569, config.getTableLength(), 1e-9);
        assertEquals("snooker-frames", config.getKafkaFrameTopic());
    }

    @Test
    public void propertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty("processing.mode", "live");
        props.setProperty("processing.frame.budget.ms", "50");
        props.setProperty("tracking.max.distance", "80");
        props.setProperty("calibration.camera.id", "table-7");

        SnookerAnalysisConfig config = SnookerAnalysisConfig.fromProperties(props);
        assertEquals(ProcessingMode.LIVE, config.getProcessingMode());
        assertEquals(50, config.getFrameBudgetMs());
        assertEquals(80.0, config.getMaxTrackingDistance(), 1e-9);
        assertEquals("table-7", config.getCameraId());
        // 未设置的键保持默认
        assertEquals(3, config.getMinHitsToActivate());
    }

    @Test
    public void unparsableValuesAreCollected() {
        Properties props = new Properties();
        props.setProperty("detection.input.size", "big");
        props.setProperty("processing.mode", "turbo");
        try {
            SnookerAnalysisConfig.fromProperties(props);
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals(2, e.getViolations().size());
            assertEquals("configuration", e.getSubsystem());
        }
    }

    @Test
    public void outOfRangeValuesFailValidation() {
        SnookerAnalysisConfig config = new SnookerAnalysisConfig();
        config.setConfidenceThreshold(1.5f);
        config.setMaxDisappearedFrames(0);
        config.setTableWidth(5.0);
        try {
            config.validate();
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals(3, e.getViolations().size());
        }
    }

    @Test(expected = ConfigurationException.class)
    public void liveModeRequiresBudget() {
        SnookerAnalysisConfig config = new SnookerAnalysisConfig();
        config.setProcessingMode(ProcessingMode.LIVE);
        config.setFrameBudgetMs(0);
        config.validate();
    }

    @Test
    public void sessionLimitsAreConfigurable() {
        Properties props = new Properties();
        props.setProperty("processing.result.buffer.size", "64");
        props.setProperty("job.session.idle.timeout.ms", "1000");
        SnookerAnalysisConfig config = SnookerAnalysisConfig.fromProperties(props).validate();
        assertEquals(64, config.getResultBufferSize());
        assertEquals(1000, config.getSessionIdleTimeoutMs());

        config.setResultBufferSize(0);
        config.setSessionIdleTimeoutMs(-1);
        try {
            config.validate();
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals(2, e.getViolations().size());
        }
    }
}
