package com.snooker.analysis.calibration;

import com.snooker.analysis.TestFixtures;
import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.exception.CalibrationException;
import com.snooker.analysis.model.BoundingBox;
import com.snooker.analysis.model.CalibrationData;
import com.snooker.analysis.model.Point;
import com.snooker.analysis.util.ImageUtils;
import org.junit.Before;
import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TableCalibrationEngineTest {

    private static final List<Point> NOT_CONVEX = Arrays.asList(
            Point.of(100, 100), Point.of(1100, 600), Point.of(1100, 100), Point.of(100, 600));

    private SnookerAnalysisConfig config;
    private TableCalibrationEngine engine;

    @Before
    public void setUp() {
        config = new SnookerAnalysisConfig();
        engine = new TableCalibrationEngine(config, null);
    }

    @Test
    public void perfectRectangleCalibrates() {
        CalibrationData data = engine.calibrateFromCorners(TestFixtures.TABLE_CORNERS, 0);

        assertTrue(data.isValid());
        assertTrue(data.usable());
        assertEquals(0.0, data.getReprojectionError(), 1e-4);
        assertEquals(CalibrationState.CALIBRATED, engine.getState());
        assertEquals(6, data.getPocketRegions().size());
        assertEquals(3, data.getHomography().length);
        assertTrue(engine.isCalibrated());
    }

    @Test
    public void pocketRegionsSurroundTableCorners() {
        CalibrationData data = engine.calibrateFromCorners(TestFixtures.TABLE_CORNERS, 0);
        BoundingBox topLeft = data.getPocketRegions().get(0);
        assertTrue(topLeft.contains(Point.of(100, 100)));
        BoundingBox topMiddle = data.getPocketRegions().get(1);
        assertTrue(topMiddle.contains(Point.of(600, 100)));
    }

    @Test
    public void uncalibratedHasNoMatrix() {
        assertFalse(engine.isCalibrated());
        assertNull(engine.transformMatrix());
        assertEquals(CalibrationState.UNCALIBRATED, engine.getState());
        assertTrue(engine.needsCalibration(0));
    }

    @Test
    public void invalidCornersAreRejected() {
        try {
            engine.buildCalibration(NOT_CONVEX, 3);
            fail("expected CalibrationException");
        } catch (CalibrationException e) {
            assertEquals(3, e.getFrameNumber());
        }
        try {
            engine.buildCalibration(TestFixtures.TABLE_CORNERS.subList(0, 3), 3);
            fail("expected CalibrationException");
        } catch (CalibrationException e) {
            assertEquals("calibration", e.getSubsystem());
        }
    }

    @Test
    public void failedFirstCalibrationReturnsToUncalibrated() {
        CalibrationData data = engine.calibrateFromCorners(NOT_CONVEX, 0);
        assertFalse(data.usable());
        assertEquals(CalibrationState.UNCALIBRATED, engine.getState());
        assertEquals(1, engine.getConsecutiveFailures());
        assertEquals(1, engine.getTotalAttempts());
    }

    @Test
    public void recalibrationKeepsPriorUntilRetryBudgetExhausted() {
        CalibrationData good = engine.calibrateFromCorners(TestFixtures.TABLE_CORNERS, 0);
        engine.requestRecalibration();
        assertEquals(CalibrationState.RECALIBRATING, engine.getState());

        int budget = config.getCalibrationRetryBudget();
        for (int i = 1; i <= budget; i++) {
            CalibrationData current = engine.calibrateFromCorners(NOT_CONVEX, i);
            assertSame(good, current);
            assertTrue(engine.isCalibrated());
            assertEquals(CalibrationState.RECALIBRATING, engine.getState());
        }

        CalibrationData invalidated = engine.calibrateFromCorners(NOT_CONVEX, budget + 1);
        assertFalse(invalidated.isValid());
        assertFalse(engine.isCalibrated());
        assertEquals(CalibrationState.UNCALIBRATED, engine.getState());
        // 失效后保留原角点供诊断
        assertEquals(good.getTableCorners(), invalidated.getTableCorners());
    }

    @Test
    public void successfulRecalibrationReplacesData() {
        CalibrationData first = engine.calibrateFromCorners(TestFixtures.TABLE_CORNERS, 0);
        List<Point> moved = new ArrayList<>();
        for (Point p : TestFixtures.TABLE_CORNERS) {
            moved.add(Point.of(p.getX() + 20, p.getY() + 10));
        }
        engine.requestRecalibration();
        CalibrationData second = engine.calibrateFromCorners(moved, 150);
        assertTrue(second.usable());
        assertEquals(150, second.getFrameNumber());
        assertFalse(first == second);
        assertEquals(CalibrationState.CALIBRATED, engine.getState());
    }

    @Test
    public void scheduleFollowsInterval() {
        engine.calibrateFromCorners(TestFixtures.TABLE_CORNERS, 10);
        assertFalse(engine.needsCalibration(11));
        assertTrue(engine.needsCalibration(10 + config.getCalibrationInterval()));
        assertFalse(engine.isResidualCheckDue(20));
        assertTrue(engine.isResidualCheckDue(10 + config.getResidualCheckInterval()));
    }

    @Test
    public void residualDetectsCameraMovement() {
        engine.calibrateFromCorners(TestFixtures.TABLE_CORNERS, 0);
        assertEquals(0.0, engine.residualOf(TestFixtures.TABLE_CORNERS), 1e-4);

        List<Point> shifted = new ArrayList<>();
        for (Point p : TestFixtures.TABLE_CORNERS) {
            shifted.add(Point.of(p.getX() + 50, p.getY()));
        }
        assertTrue(engine.residualOf(shifted) > config.getResidualTolerance());
    }

    @Test
    public void detectsCornersOfDrawnTable() {
        ImageUtils.init();
        Mat frame = new Mat(720, 1280, CvType.CV_8UC3, new Scalar(20, 20, 20));
        try {
            Imgproc.rectangle(frame, new org.opencv.core.Point(200, 150), new org.opencv.core.Point(1080, 590),
                    new Scalar(40, 140, 40), -1);

            List<Point> corners = engine.detectTableCorners(frame);
            assertEquals(4, corners.size());
            assertNear(Point.of(200, 150), corners.get(0), 6);
            assertNear(Point.of(1080, 150), corners.get(1), 6);
            assertNear(Point.of(1080, 590), corners.get(2), 6);
            assertNear(Point.of(200, 590), corners.get(3), 6);

            CalibrationData data = engine.calibrate(frame, 0);
            assertTrue(data.usable());
            assertEquals(CalibrationState.CALIBRATED, engine.getState());

            // 同一画面残差接近零
            assertTrue(engine.checkResidual(frame, 25).getAsDouble() < config.getResidualTolerance());
            assertEquals(CalibrationState.CALIBRATED, engine.getState());
        } finally {
            frame.release();
        }
    }

    @Test
    public void blankFrameFailsCalibration() {
        ImageUtils.init();
        Mat frame = new Mat(480, 640, CvType.CV_8UC3, new Scalar(0, 0, 0));
        try {
            assertTrue(engine.detectTableCorners(frame).isEmpty());
            assertFalse(engine.calibrate(frame, 0).usable());
            assertEquals(1, engine.getTotalAttempts());
            assertEquals(CalibrationState.UNCALIBRATED, engine.getState());
        } finally {
            frame.release();
        }
    }

    @Test
    public void resetClearsCalibration() {
        engine.calibrateFromCorners(TestFixtures.TABLE_CORNERS, 0);
        engine.reset();
        assertFalse(engine.isCalibrated());
        assertEquals(CalibrationState.UNCALIBRATED, engine.getState());
    }

    private static void assertNear(Point expected, Point actual, double tolerance) {
        assertTrue("expected " + expected + " but was " + actual, expected.distanceTo(actual) <= tolerance);
    }
}
