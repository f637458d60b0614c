package com.snooker.analysis.tracking;

import com.snooker.analysis.model.Point;
import com.snooker.analysis.model.TrackState;
import com.snooker.analysis.model.TrackedBall;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 轨迹运动分析：路程、速度、转向次数、两球碰撞
 */
public class TrajectoryAnalyzer {

    // 像素/帧
    private static final double MOTION_THRESHOLD = 5.0;
    private static final double DIRECTION_CHANGE_ANGLE = Math.PI / 6;
    private static final double SUDDEN_TURN_ANGLE = Math.PI / 4;
    private static final int RECENT_WINDOW = 5;
    // 像素，约一个球的直径
    private static final double COLLISION_DISTANCE = 25.0;

    public TrackSummary analyze(TrackedBall ball) {
        List<Point> trajectory = ball.getTrajectory();
        double pathLength = pathLength(trajectory);
        int steps = trajectory.size() - 1;

        return TrackSummary.builder()
                .trackId(ball.getTrackId())
                .ballType(ball.getBallType())
                .trackState(ball.getState())
                .motion(motionOf(ball))
                .trajectoryLength(trajectory.size())
                .pathLength(pathLength)
                .averageSpeed(steps > 0 ? pathLength / steps : 0.0)
                .directionChanges(countDirectionChanges(trajectory, DIRECTION_CHANGE_ANGLE))
                .tablePathLength(pathLength(ball.getTableTrajectory()))
                .suddenTurn(hasSuddenTurn(trajectory))
                .build();
    }

    public TrajectorySummary summarize(List<TrackedBall> liveBalls, List<TrackedBall> pottedBalls) {
        List<TrackedBall> all = new ArrayList<>(liveBalls);
        all.addAll(pottedBalls);

        Map<TrackSummary.Motion, Integer> counts = new EnumMap<>(TrackSummary.Motion.class);
        for (TrackSummary.Motion motion : TrackSummary.Motion.values()) {
            counts.put(motion, 0);
        }

        TrajectorySummary.TrajectorySummaryBuilder builder = TrajectorySummary.builder();
        long totalPoints = 0;
        double totalDistance = 0;
        for (TrackedBall ball : all) {
            TrackSummary summary = analyze(ball);
            builder.track(summary);
            counts.merge(summary.getMotion(), 1, Integer::sum);
            totalPoints += summary.getTrajectoryLength();
            totalDistance += summary.getPathLength();
        }

        return builder
                .totalBalls(all.size())
                .liveBalls(liveBalls.size())
                .pottedBalls(pottedBalls.size())
                .motionCounts(counts)
                .averageTrajectoryLength(all.isEmpty() ? 0.0 : (double) totalPoints / all.size())
                .totalDistance(totalDistance)
                .build();
    }

    /**
     * 距离很近且双方最近都有急转的两球视为碰撞
     */
    public List<CollisionEvent> detectCollisions(List<TrackedBall> balls, long frameNumber) {
        List<CollisionEvent> events = new ArrayList<>();
        for (int i = 0; i < balls.size(); i++) {
            TrackedBall a = balls.get(i);
            if (!a.getState().isLive()) continue;
            for (int j = i + 1; j < balls.size(); j++) {
                TrackedBall b = balls.get(j);
                if (!b.getState().isLive()) continue;
                if (a.getCurrentPosition().distanceTo(b.getCurrentPosition()) > COLLISION_DISTANCE) {
                    continue;
                }
                if (hasSuddenTurn(a.getTrajectory()) && hasSuddenTurn(b.getTrajectory())) {
                    events.add(CollisionEvent.builder()
                            .firstTrackId(a.getTrackId())
                            .firstBallType(a.getBallType())
                            .secondTrackId(b.getTrackId())
                            .secondBallType(b.getBallType())
                            .position(new Point(
                                    (a.getCurrentPosition().getX() + b.getCurrentPosition().getX()) / 2,
                                    (a.getCurrentPosition().getY() + b.getCurrentPosition().getY()) / 2))
                            .frameNumber(frameNumber)
                            .build());
                }
            }
        }
        return events;
    }

    private TrackSummary.Motion motionOf(TrackedBall ball) {
        if (ball.getState() == TrackState.POTTED) {
            return TrackSummary.Motion.POTTED;
        }
        if (ball.getState() == TrackState.DELETED || ball.getState() == TrackState.OCCLUDED) {
            return TrackSummary.Motion.LOST;
        }
        Point v = ball.getVelocity();
        double speed = v == null ? 0 : Math.hypot(v.getX(), v.getY());
        return speed > MOTION_THRESHOLD ? TrackSummary.Motion.MOVING : TrackSummary.Motion.STATIONARY;
    }

    static double pathLength(List<Point> trajectory) {
        double total = 0;
        for (int i = 1; i < trajectory.size(); i++) {
            total += trajectory.get(i - 1).distanceTo(trajectory.get(i));
        }
        return total;
    }

    static int countDirectionChanges(List<Point> trajectory, double threshold) {
        int changes = 0;
        for (int i = 2; i < trajectory.size(); i++) {
            double angle = turnAngle(trajectory.get(i - 2), trajectory.get(i - 1), trajectory.get(i));
            if (angle > threshold) {
                changes++;
            }
        }
        return changes;
    }

    private static boolean hasSuddenTurn(List<Point> trajectory) {
        if (trajectory.size() < RECENT_WINDOW) {
            return false;
        }
        List<Point> recent = trajectory.subList(trajectory.size() - RECENT_WINDOW, trajectory.size());
        return countDirectionChanges(recent, SUDDEN_TURN_ANGLE) > 0;
    }

    /**
     * a->b 与 b->c 的夹角，任一段长度为零时返回 0
     */
    private static double turnAngle(Point a, Point b, Point c) {
        double dx1 = b.getX() - a.getX();
        double dy1 = b.getY() - a.getY();
        double dx2 = c.getX() - b.getX();
        double dy2 = c.getY() - b.getY();
        double n1 = Math.hypot(dx1, dy1);
        double n2 = Math.hypot(dx2, dy2);
        if (n1 < 1e-6 || n2 < 1e-6) {
            return 0;
        }
        double cos = (dx1 * dx2 + dy1 * dy2) / (n1 * n2);
        return Math.acos(Math.max(-1.0, Math.min(1.0, cos)));
    }
}
