package com.snooker.analysis.tracking;

import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.exception.TrackingException;
import com.snooker.analysis.model.BallType;
import com.snooker.analysis.model.BoundingBox;
import com.snooker.analysis.model.Detection;
import com.snooker.analysis.model.Point;
import com.snooker.analysis.model.TrackEvent;
import com.snooker.analysis.model.TrackState;
import com.snooker.analysis.model.TrackedBall;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 多球跟踪器
 *
 * 每帧：卡尔曼预测 -> 代价矩阵 -> 匈牙利匹配 -> 更新已匹配轨迹
 * -> 处理未匹配检测（新建/重捕获/丢弃）-> 处理未匹配轨迹（遮挡/入袋/删除）。
 * 轨迹ID在会话内唯一且不复用。
 */
public class BallTracker {

    private static final Logger LOG = LoggerFactory.getLogger(BallTracker.class);

    // 代价相同时优先匹配高置信度检测
    private static final double CONFIDENCE_TIE_BREAK = 1e-6;

    private final double maxTrackingDistance;
    private final int maxDisappearedFrames;
    private final int minHitsToActivate;
    private final double distanceWeight;
    private final double classMismatchPenalty;
    private final double processNoise;
    private final double measurementNoise;

    private final Map<Long, Track> liveTracks = new LinkedHashMap<>();
    private final Map<Long, TrackedBall> pottedBalls = new LinkedHashMap<>();
    private final List<TrackEvent> pendingEvents = new ArrayList<>();
    private List<BoundingBox> pocketRegions = Collections.emptyList();

    private long nextTrackId = 1;
    private long tracksCreated;
    private long tracksDeleted;
    private long assignmentFallbacks;
    private long droppedDetections;

    public BallTracker(SnookerAnalysisConfig config) {
        this.maxTrackingDistance = config.getMaxTrackingDistance();
        this.maxDisappearedFrames = config.getMaxDisappearedFrames();
        this.minHitsToActivate = config.getMinHitsToActivate();
        this.distanceWeight = config.getDistanceWeight();
        this.classMismatchPenalty = config.getClassMismatchPenalty();
        this.processNoise = config.getKalmanProcessNoise();
        this.measurementNoise = config.getKalmanMeasurementNoise();
    }

    /**
     * 用本帧检测更新所有轨迹
     *
     * @return 本帧全部轨迹快照（含本帧刚结束的轨迹），按ID排序
     */
    public synchronized List<TrackedBall> update(List<Detection> detections, long frameNumber) {
        List<Detection> usable = new ArrayList<>();
        for (Detection detection : detections) {
            if (BallType.fromClassId(detection.getClassId()).isPresent()
                    && detection.centroid().hasFiniteCoordinates()) {
                usable.add(detection);
            } else {
                droppedDetections++;
                LOG.debug("Ignoring unusable detection at frame={}: {}", frameNumber, detection);
            }
        }

        // 1. 预测
        List<Track> tracks = new ArrayList<>(liveTracks.values());
        for (Track track : tracks) {
            track.predicted = track.kalman.predict();
        }

        // 2-3. 代价矩阵与匹配
        int[] assignment = associate(tracks, usable, frameNumber);

        boolean[] trackMatched = new boolean[tracks.size()];
        boolean[] detectionUsed = new boolean[usable.size()];
        for (int i = 0; i < tracks.size(); i++) {
            int j = assignment[i];
            if (j != HungarianAssignment.UNASSIGNED) {
                trackMatched[i] = true;
                detectionUsed[j] = true;
                onMatched(tracks.get(i), usable.get(j), frameNumber);
            }
        }

        // 4. 未匹配检测：高置信度优先
        List<Integer> unmatched = new ArrayList<>();
        for (int j = 0; j < usable.size(); j++) {
            if (!detectionUsed[j]) {
                unmatched.add(j);
            }
        }
        unmatched.sort(Comparator.comparingDouble((Integer j) -> usable.get(j).getConfidence()).reversed());
        for (int j : unmatched) {
            handleUnmatchedDetection(usable.get(j), frameNumber);
        }

        // 5. 未匹配轨迹
        List<TrackedBall> snapshot = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            Track track = tracks.get(i);
            if (!trackMatched[i] && track.lastSeenFrame != frameNumber) {
                onMissed(track, frameNumber);
            }
        }

        for (Track track : new ArrayList<>(liveTracks.values())) {
            TrackedBall ball = track.snapshot();
            snapshot.add(ball);
            if (track.state.isTerminal()) {
                liveTracks.remove(track.id);
                if (track.state == TrackState.POTTED) {
                    pottedBalls.put(track.id, ball);
                } else {
                    tracksDeleted++;
                }
            }
        }
        snapshot.sort(Comparator.comparingLong(TrackedBall::getTrackId));
        return snapshot;
    }

    private int[] associate(List<Track> tracks, List<Detection> detections, long frameNumber) {
        double[][] cost = new double[tracks.size()][detections.size()];
        for (int i = 0; i < tracks.size(); i++) {
            Track track = tracks.get(i);
            for (int j = 0; j < detections.size(); j++) {
                cost[i][j] = cost(track, detections.get(j));
            }
        }

        try {
            return HungarianAssignment.solve(cost);
        } catch (TrackingException e) {
            assignmentFallbacks++;
            LOG.warn("Assignment failed at frame={} ({}), using greedy matching", frameNumber, e.getMessage());
            return HungarianAssignment.greedy(cost);
        }
    }

    double cost(Track track, Detection detection) {
        double distance = track.predicted.distanceTo(detection.centroid());
        if (distance > maxTrackingDistance) {
            return Double.POSITIVE_INFINITY;
        }
        double c = distanceWeight * distance;
        if (track.type != detection.ballType()) {
            c += classMismatchPenalty;
        }
        return c + CONFIDENCE_TIE_BREAK * (1 - detection.getConfidence());
    }

    private void onMatched(Track track, Detection detection, long frameNumber) {
        Point centroid = detection.centroid();
        track.kalman.correct(centroid);
        track.observe(centroid, detection.getConfidence(), frameNumber);

        if (track.state == TrackState.TENTATIVE && track.consecutiveHits >= minHitsToActivate) {
            track.state = TrackState.ACTIVE;
            emit(TrackEvent.Type.ACTIVATED, track, frameNumber);
        } else if (track.state == TrackState.OCCLUDED) {
            track.state = TrackState.ACTIVE;
            emit(TrackEvent.Type.RECOVERED, track, frameNumber);
        }
    }

    private void handleUnmatchedDetection(Detection detection, long frameNumber) {
        BallType type = detection.ballType();

        if (type.isUnique()) {
            Optional<Track> existing = liveTracks.values().stream()
                    .filter(t -> t.type == type)
                    .findFirst();
            if (existing.isPresent()) {
                Track track = existing.get();
                if (track.lastSeenFrame == frameNumber) {
                    droppedDetections++;
                    LOG.debug("Dropping duplicate {} detection at frame={}", type, frameNumber);
                } else {
                    reacquire(track, detection, frameNumber);
                }
                return;
            }
        } else {
            long live = liveTracks.values().stream().filter(t -> t.type == type).count();
            if (live >= type.getMaxCount()) {
                droppedDetections++;
                LOG.debug("Dropping {} detection at frame={}: {} live tracks already", type, frameNumber, live);
                return;
            }
        }

        createTrack(detection, frameNumber);
    }

    /**
     * 唯一球的轨迹跳变（超出匹配距离）时直接重置滤波器
     */
    private void reacquire(Track track, Detection detection, long frameNumber) {
        Point centroid = detection.centroid();
        LOG.debug("Re-acquiring track {} ({}) at frame={}", track.id, track.type, frameNumber);
        track.kalman.reinitialize(centroid);
        track.observe(centroid, detection.getConfidence(), frameNumber);

        if (track.state == TrackState.OCCLUDED) {
            track.state = TrackState.ACTIVE;
            emit(TrackEvent.Type.RECOVERED, track, frameNumber);
        } else if (track.state == TrackState.TENTATIVE && track.consecutiveHits >= minHitsToActivate) {
            track.state = TrackState.ACTIVE;
            emit(TrackEvent.Type.ACTIVATED, track, frameNumber);
        }
    }

    private void createTrack(Detection detection, long frameNumber) {
        Point centroid = detection.centroid();
        Track track = new Track(nextTrackId++, detection.ballType(),
                new BallKalmanFilter(centroid, processNoise, measurementNoise));
        track.observe(centroid, detection.getConfidence(), frameNumber);
        liveTracks.put(track.id, track);
        tracksCreated++;
        emit(TrackEvent.Type.CREATED, track, frameNumber);
        LOG.debug("Created new track {} for {} at frame={}", track.id, track.type, frameNumber);

        if (track.consecutiveHits >= minHitsToActivate) {
            track.state = TrackState.ACTIVE;
            emit(TrackEvent.Type.ACTIVATED, track, frameNumber);
        }
    }

    private void onMissed(Track track, long frameNumber) {
        track.framesSinceSeen++;
        track.consecutiveHits = 0;
        track.currentPosition = track.predicted;
        if (track.framesSinceSeen == 1) {
            track.predictedAtDisappearance = track.predicted;
        }

        if (track.state == TrackState.ACTIVE) {
            track.state = TrackState.OCCLUDED;
            emit(TrackEvent.Type.OCCLUDED, track, frameNumber);
        }

        if (track.framesSinceSeen >= maxDisappearedFrames) {
            if (track.state != TrackState.TENTATIVE && disappearedInPocket(track)) {
                track.state = TrackState.POTTED;
                emit(TrackEvent.Type.POTTED, track, frameNumber);
                LOG.info("{} ball (track {}) potted at frame={}", track.type, track.id, frameNumber);
            } else {
                track.state = TrackState.DELETED;
                emit(TrackEvent.Type.DELETED, track, frameNumber);
                LOG.debug("Lost track {} ({}) at frame={}", track.id, track.type, frameNumber);
            }
        }
    }

    /**
     * 只看消失那一帧的预测位置和最后一次观测；滑行多帧后的预测会漂移，不参与判断
     */
    private boolean disappearedInPocket(Track track) {
        for (BoundingBox pocket : pocketRegions) {
            if ((track.predictedAtDisappearance != null && pocket.contains(track.predictedAtDisappearance))
                    || pocket.contains(track.lastMeasured)) {
                return true;
            }
        }
        return false;
    }

    private void emit(TrackEvent.Type type, Track track, long frameNumber) {
        pendingEvents.add(TrackEvent.builder()
                .type(type)
                .trackId(track.id)
                .ballType(track.type)
                .frameNumber(frameNumber)
                .position(track.currentPosition)
                .build());
    }

    /**
     * 标定变化时更新袋口区域（像素坐标）
     */
    public synchronized void updatePocketRegions(List<BoundingBox> regions) {
        this.pocketRegions = regions == null ? Collections.emptyList() : new ArrayList<>(regions);
    }

    public synchronized Optional<TrackedBall> getTrack(long trackId) {
        Track track = liveTracks.get(trackId);
        if (track != null) {
            return Optional.of(track.snapshot());
        }
        return Optional.ofNullable(pottedBalls.get(trackId));
    }

    public synchronized List<TrackedBall> getLiveTracks() {
        return liveTracks.values().stream().map(Track::snapshot).collect(Collectors.toList());
    }

    public synchronized List<TrackedBall> getPottedBalls() {
        return new ArrayList<>(pottedBalls.values());
    }

    /**
     * 取出并清空自上次调用以来的事件
     */
    public synchronized List<TrackEvent> drainEvents() {
        List<TrackEvent> events = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        return events;
    }

    /**
     * 清空所有轨迹；ID计数不回退
     */
    public synchronized void reset() {
        liveTracks.clear();
        pottedBalls.clear();
        pendingEvents.clear();
        LOG.info("Tracking data reset");
    }

    public synchronized TrackingStats getStats() {
        return new TrackingStats(tracksCreated, liveTracks.size(), pottedBalls.size(),
                tracksDeleted, assignmentFallbacks, droppedDetections);
    }

    /**
     * 跟踪统计快照
     */
    @Value
    public static class TrackingStats {
        long tracksCreated;
        int liveTracks;
        int pottedBalls;
        long tracksDeleted;
        long assignmentFallbacks;
        long droppedDetections;
    }

    /**
     * 跟踪器内部的可变轨迹
     */
    static final class Track {
        final long id;
        final BallType type;
        final BallKalmanFilter kalman;
        final List<Point> trajectory = new ArrayList<>();
        final List<Double> confidenceHistory = new ArrayList<>();

        TrackState state = TrackState.TENTATIVE;
        Point currentPosition;
        Point lastMeasured;
        Point predicted;
        Point predictedAtDisappearance;
        long lastSeenFrame;
        int framesSinceSeen;
        int consecutiveHits;

        Track(long id, BallType type, BallKalmanFilter kalman) {
            this.id = id;
            this.type = type;
            this.kalman = kalman;
            this.predicted = kalman.predicted();
        }

        void observe(Point centroid, double confidence, long frameNumber) {
            trajectory.add(centroid);
            confidenceHistory.add(confidence);
            currentPosition = centroid;
            lastMeasured = centroid;
            predictedAtDisappearance = null;
            lastSeenFrame = frameNumber;
            framesSinceSeen = 0;
            consecutiveHits++;
        }

        TrackedBall snapshot() {
            return TrackedBall.builder()
                    .trackId(id)
                    .ballType(type)
                    .currentPosition(currentPosition)
                    .velocity(kalman.velocity())
                    .trajectory(trajectory)
                    .confidenceHistory(confidenceHistory)
                    .lastSeenFrame(lastSeenFrame)
                    .framesSinceSeen(framesSinceSeen)
                    .state(state)
                    .build();
        }
    }
}
