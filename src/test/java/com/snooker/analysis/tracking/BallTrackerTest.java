package com.snooker.analysis.tracking;

import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.model.BallType;
import com.snooker.analysis.model.BoundingBox;
import com.snooker.analysis.model.Detection;
import com.snooker.analysis.model.Point;
import com.snooker.analysis.model.TrackEvent;
import com.snooker.analysis.model.TrackState;
import com.snooker.analysis.model.TrackedBall;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.snooker.analysis.TestFixtures.detection;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BallTrackerTest {

    private SnookerAnalysisConfig config;
    private BallTracker tracker;

    @Before
    public void setUp() {
        config = new SnookerAnalysisConfig();
        tracker = new BallTracker(config);
    }

    @Test
    public void redBallBecomesActiveAfterThreeHits() {
        List<TrackedBall> frame1 = tracker.update(Collections.singletonList(detection(BallType.RED, 100, 100)), 1);
        assertEquals(1, frame1.size());
        assertEquals(TrackState.TENTATIVE, frame1.get(0).getState());

        tracker.update(Collections.singletonList(detection(BallType.RED, 110, 100)), 2);
        List<TrackedBall> frame3 = tracker.update(Collections.singletonList(detection(BallType.RED, 120, 100)), 3);

        assertEquals(1, frame3.size());
        TrackedBall ball = frame3.get(0);
        assertEquals(TrackState.ACTIVE, ball.getState());
        assertEquals(BallType.RED, ball.getBallType());
        assertEquals(Arrays.asList(Point.of(100, 100), Point.of(110, 100), Point.of(120, 100)), ball.getTrajectory());
        assertEquals(3, ball.getConfidenceHistory().size());
        assertEquals(3, ball.getLastSeenFrame());
        assertEquals(0, ball.getFramesSinceSeen());
        assertTrue(ball.getVelocity().getX() > 0);

        List<TrackEvent.Type> events = tracker.drainEvents().stream()
                .map(TrackEvent::getType).collect(Collectors.toList());
        assertEquals(Arrays.asList(TrackEvent.Type.CREATED, TrackEvent.Type.ACTIVATED), events);
        assertTrue(tracker.drainEvents().isEmpty());
    }

    @Test
    public void trackIsDeletedAfterExactlyMaxDisappearedFrames() {
        activeRed();
        int max = config.getMaxDisappearedFrames();
        long frame = 4;
        for (int i = 1; i < max; i++) {
            List<TrackedBall> balls = tracker.update(Collections.emptyList(), frame++);
            assertEquals(TrackState.OCCLUDED, balls.get(0).getState());
            assertEquals(i, balls.get(0).getFramesSinceSeen());
        }
        assertEquals(1, tracker.getLiveTracks().size());

        List<TrackedBall> last = tracker.update(Collections.emptyList(), frame);
        assertEquals(TrackState.DELETED, last.get(0).getState());
        assertTrue(tracker.getLiveTracks().isEmpty());
        assertTrue(tracker.getPottedBalls().isEmpty());
        assertEquals(1, tracker.getStats().getTracksDeleted());
    }

    @Test
    public void occludedTrackRecovers() {
        activeRed();
        tracker.update(Collections.emptyList(), 4);
        List<TrackedBall> balls = tracker.update(Collections.singletonList(detection(BallType.RED, 140, 100)), 5);
        assertEquals(1, balls.size());
        assertEquals(TrackState.ACTIVE, balls.get(0).getState());
        assertTrue(tracker.drainEvents().stream().anyMatch(e -> e.getType() == TrackEvent.Type.RECOVERED));
    }

    @Test
    public void disappearanceInPocketIsPotted() {
        tracker.updatePocketRegions(Collections.singletonList(new BoundingBox(90, 80, 140, 120)));
        activeRed();
        List<TrackedBall> last = disappear();

        assertEquals(TrackState.POTTED, last.get(0).getState());
        assertEquals(1, tracker.getPottedBalls().size());
        assertTrue(tracker.getLiveTracks().isEmpty());
        assertTrue(tracker.drainEvents().stream().anyMatch(e -> e.getType() == TrackEvent.Type.POTTED));
        assertTrue(tracker.getTrack(last.get(0).getTrackId()).isPresent());
    }

    @Test
    public void disappearanceMidTableIsDeleted() {
        tracker.updatePocketRegions(Collections.singletonList(new BoundingBox(0, 0, 20, 20)));
        activeRed();
        List<TrackedBall> last = disappear();

        assertEquals(TrackState.DELETED, last.get(0).getState());
        assertTrue(tracker.getPottedBalls().isEmpty());
    }

    @Test
    public void coastingIntoPocketIsNotPotted() {
        // 袋口只在滑行预测的路径上，消失位置在台面中部
        tracker.updatePocketRegions(Collections.singletonList(new BoundingBox(300, 80, 340, 120)));
        long frame = 1;
        for (int x = 100; x <= 160; x += 15) {
            tracker.update(Collections.singletonList(detection(BallType.RED, x, 100)), frame++);
        }
        List<TrackedBall> last = Collections.emptyList();
        for (int i = 0; i < config.getMaxDisappearedFrames(); i++) {
            last = tracker.update(Collections.emptyList(), frame++);
        }

        assertEquals(1, last.size());
        assertTrue(last.get(0).getCurrentPosition().getX() > 250);
        assertEquals(TrackState.DELETED, last.get(0).getState());
        assertTrue(tracker.getPottedBalls().isEmpty());
    }

    @Test
    public void invalidCostFallsBackToGreedyMatching() {
        config.setClassMismatchPenalty(Double.NaN);
        tracker = new BallTracker(config);
        tracker.update(Arrays.asList(detection(BallType.RED, 100, 100), detection(BallType.PINK, 130, 100)), 1);

        List<TrackedBall> balls = tracker.update(
                Arrays.asList(detection(BallType.RED, 104, 100), detection(BallType.PINK, 133, 100)), 2);

        assertEquals(1, tracker.getStats().getAssignmentFallbacks());
        assertEquals(2, balls.size());
        assertEquals(BallType.RED, balls.get(0).getBallType());
        assertEquals(104, balls.get(0).getCurrentPosition().getX(), 1e-9);
        assertEquals(BallType.PINK, balls.get(1).getBallType());
        assertEquals(133, balls.get(1).getCurrentPosition().getX(), 1e-9);
        assertEquals(2, tracker.getStats().getTracksCreated());
    }

    @Test
    public void tentativeTrackIsNeverPotted() {
        tracker.updatePocketRegions(Collections.singletonList(new BoundingBox(0, 0, 300, 300)));
        tracker.update(Collections.singletonList(detection(BallType.RED, 100, 100)), 1);
        List<TrackedBall> last = disappear();
        assertEquals(TrackState.DELETED, last.get(0).getState());
    }

    @Test
    public void onlyOneCueTrack() {
        List<TrackedBall> balls = tracker.update(Arrays.asList(
                detection(BallType.CUE, 100, 100, 0.95),
                detection(BallType.CUE, 400, 400, 0.6)), 1);
        assertEquals(1, balls.size());
        assertEquals(100, balls.get(0).getCurrentPosition().getX(), 1e-9);
        assertEquals(1, tracker.getStats().getDroppedDetections());
    }

    @Test
    public void uniqueBallIsReacquiredAfterJump() {
        tracker.update(Collections.singletonList(detection(BallType.CUE, 100, 100)), 1);
        // 超出匹配距离，仍归入同一条白球轨迹
        List<TrackedBall> balls = tracker.update(Collections.singletonList(detection(BallType.CUE, 500, 300)), 2);
        assertEquals(1, balls.size());
        assertEquals(1, balls.get(0).getTrackId());
        assertEquals(500, balls.get(0).getCurrentPosition().getX(), 1e-9);
    }

    @Test
    public void redCountIsCapped() {
        List<Detection> reds = new ArrayList<>();
        for (int i = 0; i < 17; i++) {
            reds.add(detection(BallType.RED, 50 + i * 60, 100, 0.5 + i * 0.01));
        }
        List<TrackedBall> balls = tracker.update(reds, 1);
        assertEquals(15, balls.size());
        assertEquals(2, tracker.getStats().getDroppedDetections());
    }

    @Test
    public void differentTypesDoNotMatch() {
        tracker.update(Collections.singletonList(detection(BallType.RED, 100, 100)), 1);
        List<TrackedBall> balls = tracker.update(Collections.singletonList(detection(BallType.PINK, 102, 100)), 2);
        assertEquals(2, balls.size());
        assertEquals(BallType.RED, balls.get(0).getBallType());
        assertEquals(1, balls.get(0).getFramesSinceSeen());
        assertEquals(BallType.PINK, balls.get(1).getBallType());
    }

    @Test
    public void twoRedsKeepTheirIdentities() {
        tracker.update(Arrays.asList(detection(BallType.RED, 100, 100), detection(BallType.RED, 300, 100)), 1);
        List<TrackedBall> balls = tracker.update(
                Arrays.asList(detection(BallType.RED, 305, 102), detection(BallType.RED, 104, 99)), 2);
        assertEquals(2, balls.size());
        assertEquals(1, balls.get(0).getTrackId());
        assertEquals(104, balls.get(0).getCurrentPosition().getX(), 1e-9);
        assertEquals(2, balls.get(1).getTrackId());
        assertEquals(305, balls.get(1).getCurrentPosition().getX(), 1e-9);
    }

    @Test
    public void trackIdsAreNeverReused() {
        Set<Long> ids = new HashSet<>();
        long frame = 1;
        for (int round = 0; round < 3; round++) {
            for (TrackedBall ball : tracker.update(Collections.singletonList(detection(BallType.BLUE, 200, 200)), frame++)) {
                ids.add(ball.getTrackId());
            }
            for (int i = 0; i < config.getMaxDisappearedFrames(); i++) {
                tracker.update(Collections.emptyList(), frame++);
            }
        }
        tracker.reset();
        for (TrackedBall ball : tracker.update(Collections.singletonList(detection(BallType.BLUE, 200, 200)), frame)) {
            ids.add(ball.getTrackId());
        }
        assertEquals(4, ids.size());
        assertEquals(4, tracker.getStats().getTracksCreated());
    }

    @Test
    public void emptyFramesAreHarmless() {
        for (long frame = 1; frame <= 10; frame++) {
            assertTrue(tracker.update(Collections.emptyList(), frame).isEmpty());
        }
        assertTrue(tracker.drainEvents().isEmpty());
        assertEquals(0, tracker.getStats().getTracksCreated());
    }

    @Test
    public void unknownClassIsIgnored() {
        Detection bogus = Detection.builder()
                .bbox(BoundingBox.around(Point.of(50, 50), 5, 5)).classId(42).confidence(0.9).build();
        assertTrue(tracker.update(Collections.singletonList(bogus), 1).isEmpty());
        assertEquals(1, tracker.getStats().getDroppedDetections());
    }

    @Test
    public void costGrowsWithDistance() {
        BallTracker.Track track = new BallTracker.Track(99, BallType.RED,
                new BallKalmanFilter(Point.of(100, 100), 0.1, 0.1));
        double near = tracker.cost(track, detection(BallType.RED, 105, 100));
        double far = tracker.cost(track, detection(BallType.RED, 130, 100));
        assertTrue(near < far);
        assertTrue(Double.isInfinite(tracker.cost(track, detection(BallType.RED, 200, 100))));
        assertTrue(Double.isInfinite(tracker.cost(track, detection(BallType.PINK, 105, 100))));
    }

    private void activeRed() {
        tracker.update(Collections.singletonList(detection(BallType.RED, 100, 100)), 1);
        tracker.update(Collections.singletonList(detection(BallType.RED, 110, 100)), 2);
        tracker.update(Collections.singletonList(detection(BallType.RED, 120, 100)), 3);
        tracker.drainEvents();
    }

    private List<TrackedBall> disappear() {
        List<TrackedBall> last = Collections.emptyList();
        long frame = 4;
        for (int i = 0; i < config.getMaxDisappearedFrames(); i++) {
            last = tracker.update(Collections.emptyList(), frame++);
        }
        return last;
    }
}
