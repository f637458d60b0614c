package com.snooker.analysis.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.snooker.analysis.TestFixtures;
import com.snooker.analysis.model.BallType;
import com.snooker.analysis.model.BoundingBox;
import com.snooker.analysis.model.CalibrationData;
import com.snooker.analysis.model.FrameAnalysis;
import com.snooker.analysis.model.Point;
import com.snooker.analysis.model.TrackEvent;
import com.snooker.analysis.model.TrackState;
import com.snooker.analysis.model.TrackedBall;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FrameAnalysisSerializerTest {

    private static FrameAnalysis sampleAnalysis() {
        CalibrationData calibration = CalibrationData.builder()
                .homography(new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}})
                .tableCorners(TestFixtures.TABLE_CORNERS)
                .tableLength(3.569)
                .tableWidth(1.778)
                .pocketRegion(new BoundingBox(80, 80, 120, 120))
                .reprojectionError(0.4)
                .frameNumber(12)
                .valid(true)
                .build();
        TrackedBall cue = TrackedBall.builder()
                .trackId(3)
                .ballType(BallType.CUE)
                .currentPosition(Point.of(400, 300))
                .velocity(Point.of(2, -1))
                .trajectoryPoint(Point.of(398, 301))
                .trajectoryPoint(Point.of(400, 300))
                .confidence(0.9)
                .confidence(0.95)
                .lastSeenFrame(42)
                .state(TrackState.ACTIVE)
                .tablePosition(Point.of(1.07, 0.71))
                .build();
        return FrameAnalysis.builder()
                .sessionId("match-1")
                .frameNumber(42)
                .timestamp(1680)
                .detection(TestFixtures.detection(BallType.CUE, 400, 300, 0.95))
                .detection(TestFixtures.detection(BallType.RED, 700, 400, 0.6))
                .trackedBall(cue)
                .event(TrackEvent.builder()
                        .type(TrackEvent.Type.ACTIVATED)
                        .trackId(3)
                        .ballType(BallType.CUE)
                        .frameNumber(42)
                        .position(Point.of(400, 300))
                        .build())
                .calibrationData(calibration)
                .tableCoordinatesValid(true)
                .processingTime(18)
                .build();
    }

    @Test
    public void analysisSurvivesJson() throws JsonProcessingException {
        FrameAnalysis original = sampleAnalysis();
        String json = FrameAnalysisSerializer.toJson(original);
        assertNotNull(json);

        FrameAnalysis parsed = FrameAnalysisSerializer.fromJson(json);
        assertEquals("match-1", parsed.getSessionId());
        assertEquals(42, parsed.getFrameNumber());
        assertEquals(2, parsed.getDetections().size());
        assertEquals(BallType.RED, parsed.getDetections().get(1).ballType());
        assertEquals(original.getTrackedBalls(), parsed.getTrackedBalls());
        assertEquals(original.getEvents(), parsed.getEvents());
        assertTrue(parsed.isTableCoordinatesValid());
        assertFalse(parsed.isCalibrationStale());

        CalibrationData calibration = parsed.getCalibrationData();
        assertTrue(calibration.usable());
        assertEquals(4, calibration.getTableCorners().size());
        assertEquals(1, calibration.getPocketRegions().size());
        assertEquals(1.0, calibration.getHomography()[2][2], 1e-12);
    }

    @Test
    public void derivedAccessorsAreNotWritten() {
        String json = FrameAnalysisSerializer.toJson(sampleAnalysis());
        assertFalse(json.contains("activeTracks"));
        assertFalse(json.contains("centroid"));
        assertFalse(json.contains("usable"));
    }

    @Test
    public void unknownFieldsAreIgnored() throws JsonProcessingException {
        FrameAnalysis parsed = FrameAnalysisSerializer.fromJson(
                "{\"sessionId\":\"s\",\"frameNumber\":7,\"producer\":\"edge-01\"}");
        assertEquals(7, parsed.getFrameNumber());
        assertTrue(parsed.getDetections().isEmpty());
        assertNull(parsed.getCalibrationData());
    }
}
