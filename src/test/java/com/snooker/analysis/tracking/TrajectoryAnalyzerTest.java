package com.snooker.analysis.tracking;

import com.snooker.analysis.model.BallType;
import com.snooker.analysis.model.Point;
import com.snooker.analysis.model.TrackState;
import com.snooker.analysis.model.TrackedBall;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TrajectoryAnalyzerTest {

    private final TrajectoryAnalyzer analyzer = new TrajectoryAnalyzer();

    @Test
    public void straightMovingBall() {
        TrackedBall ball = ball(1, BallType.RED, TrackState.ACTIVE, Point.of(10, 0),
                Point.of(0, 0), Point.of(10, 0), Point.of(20, 0), Point.of(30, 0));
        TrackSummary summary = analyzer.analyze(ball);

        assertEquals(TrackSummary.Motion.MOVING, summary.getMotion());
        assertEquals(30.0, summary.getPathLength(), 1e-9);
        assertEquals(10.0, summary.getAverageSpeed(), 1e-9);
        assertEquals(0, summary.getDirectionChanges());
        assertEquals(4, summary.getTrajectoryLength());
        assertFalse(summary.isSuddenTurn());
    }

    @Test
    public void rightAngleTurnIsCounted() {
        TrackedBall ball = ball(1, BallType.CUE, TrackState.ACTIVE, Point.of(0, 10),
                Point.of(0, 0), Point.of(10, 0), Point.of(20, 0), Point.of(20, 10), Point.of(20, 20));
        TrackSummary summary = analyzer.analyze(ball);
        assertEquals(1, summary.getDirectionChanges());
        assertTrue(summary.isSuddenTurn());
    }

    @Test
    public void motionClassification() {
        assertEquals(TrackSummary.Motion.STATIONARY, analyzer.analyze(
                ball(1, BallType.BLACK, TrackState.ACTIVE, Point.of(0.5, 0), Point.of(5, 5))).getMotion());
        assertEquals(TrackSummary.Motion.POTTED, analyzer.analyze(
                ball(2, BallType.PINK, TrackState.POTTED, Point.of(0, 0), Point.of(5, 5))).getMotion());
        assertEquals(TrackSummary.Motion.LOST, analyzer.analyze(
                ball(3, BallType.PINK, TrackState.OCCLUDED, Point.of(0, 0), Point.of(5, 5))).getMotion());
    }

    @Test
    public void summaryAggregatesLiveAndPotted() {
        List<TrackedBall> live = Arrays.asList(
                ball(1, BallType.CUE, TrackState.ACTIVE, Point.of(10, 0), Point.of(0, 0), Point.of(10, 0)),
                ball(2, BallType.RED, TrackState.ACTIVE, Point.of(0, 0), Point.of(50, 50)));
        List<TrackedBall> potted = Collections.singletonList(
                ball(3, BallType.RED, TrackState.POTTED, Point.of(0, 0), Point.of(90, 90), Point.of(93, 94)));

        TrajectorySummary summary = analyzer.summarize(live, potted);
        assertEquals(3, summary.getTotalBalls());
        assertEquals(2, summary.getLiveBalls());
        assertEquals(1, summary.getPottedBalls());
        assertEquals(Integer.valueOf(1), summary.getMotionCounts().get(TrackSummary.Motion.MOVING));
        assertEquals(Integer.valueOf(1), summary.getMotionCounts().get(TrackSummary.Motion.STATIONARY));
        assertEquals(Integer.valueOf(1), summary.getMotionCounts().get(TrackSummary.Motion.POTTED));
        assertEquals(Integer.valueOf(0), summary.getMotionCounts().get(TrackSummary.Motion.LOST));
        assertEquals(15.0, summary.getTotalDistance(), 1e-9);
        assertEquals(3, summary.getTracks().size());
    }

    @Test
    public void collisionNeedsProximityAndTurns() {
        TrackedBall cue = ball(1, BallType.CUE, TrackState.ACTIVE, Point.of(0, 10),
                Point.of(0, 0), Point.of(10, 0), Point.of(20, 0), Point.of(20, 10), Point.of(20, 20));
        TrackedBall red = ball(2, BallType.RED, TrackState.ACTIVE, Point.of(10, 0),
                Point.of(40, 40), Point.of(40, 30), Point.of(40, 20), Point.of(30, 20), Point.of(30, 30));
        List<CollisionEvent> events = analyzer.detectCollisions(Arrays.asList(cue, red), 42);
        assertEquals(1, events.size());
        assertEquals(1, events.get(0).getFirstTrackId());
        assertEquals(2, events.get(0).getSecondTrackId());
        assertEquals(42, events.get(0).getFrameNumber());

        TrackedBall farRed = ball(3, BallType.RED, TrackState.ACTIVE, Point.of(10, 0),
                Point.of(400, 400), Point.of(400, 390), Point.of(400, 380), Point.of(390, 380), Point.of(390, 390));
        assertTrue(analyzer.detectCollisions(Arrays.asList(cue, farRed), 42).isEmpty());
    }

    private static TrackedBall ball(long id, BallType type, TrackState state, Point velocity, Point... trajectory) {
        return TrackedBall.builder()
                .trackId(id)
                .ballType(type)
                .state(state)
                .velocity(velocity)
                .currentPosition(trajectory[trajectory.length - 1])
                .trajectory(Arrays.asList(trajectory))
                .build();
    }
}
