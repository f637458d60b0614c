package com.snooker.analysis.processor;

import com.snooker.analysis.calibration.CoordinateTransformer;
import com.snooker.analysis.calibration.TableCalibrationEngine;
import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.detection.BallDetectionEngine;
import com.snooker.analysis.exception.CalibrationException;
import com.snooker.analysis.exception.CoordinateException;
import com.snooker.analysis.exception.DetectionException;
import com.snooker.analysis.exception.TrackingException;
import com.snooker.analysis.model.CalibrationData;
import com.snooker.analysis.model.Detection;
import com.snooker.analysis.model.FrameAnalysis;
import com.snooker.analysis.model.Point;
import com.snooker.analysis.model.TrackEvent;
import com.snooker.analysis.model.TrackedBall;
import com.snooker.analysis.model.VideoFrame;
import com.snooker.analysis.tracking.BallTracker;
import com.snooker.analysis.util.ImageUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个会话的逐帧处理流水线
 * 检测 -> 标定 -> 坐标变换 -> 跟踪 -> 组装分析结果
 *
 * 同一会话内严格串行；帧号必须单调递增。
 * 标定失效时使用最近一次有效标定（结果标记为 stale）。
 */
public class FrameProcessor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FrameProcessor.class);

    private final String sessionId;
    private final ProcessingMode mode;
    private final long frameBudgetNanos;

    private final BallDetectionEngine detectionEngine;
    private final TableCalibrationEngine calibrationEngine;
    private final BallTracker tracker;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    // 标定缓存
    private CalibrationData transformerSource;
    private CalibrationData lastValidCalibration;
    private CoordinateTransformer transformer;

    private long lastFrameNumber = Long.MIN_VALUE;

    private final AtomicLong framesProcessed = new AtomicLong();
    private final AtomicLong framesDropped = new AtomicLong();
    private final AtomicLong framesRejected = new AtomicLong();
    private final AtomicLong detectionFailures = new AtomicLong();
    private final AtomicLong calibrationFailures = new AtomicLong();
    private final AtomicLong coordinateFailures = new AtomicLong();
    private final AtomicLong trackingFailures = new AtomicLong();
    private final AtomicLong totalDetections = new AtomicLong();
    private final AtomicLong totalProcessingMs = new AtomicLong();
    private final AtomicLong maxProcessingMs = new AtomicLong();

    public FrameProcessor(String sessionId, SnookerAnalysisConfig config, BallDetectionEngine detectionEngine) {
        this(sessionId, config, detectionEngine, new TableCalibrationEngine(config), new BallTracker(config));
    }

    public FrameProcessor(String sessionId, SnookerAnalysisConfig config, BallDetectionEngine detectionEngine,
                          TableCalibrationEngine calibrationEngine, BallTracker tracker) {
        this.sessionId = sessionId;
        this.mode = config.getProcessingMode();
        this.frameBudgetNanos = TimeUnit.MILLISECONDS.toNanos(config.getFrameBudgetMs());
        this.detectionEngine = detectionEngine;
        this.calibrationEngine = calibrationEngine;
        this.tracker = tracker;

        if (calibrationEngine.loadCached()) {
            LOG.info("Session {} starts with cached calibration", sessionId);
        }
        refreshTransformer(calibrationEngine.getCalibrationData());
    }

    /**
     * 处理一帧
     *
     * @return 分析结果；帧号非递增或会话已取消时为 empty
     */
    public synchronized Optional<FrameAnalysis> process(VideoFrame frame) {
        long start = System.nanoTime();
        long frameNumber = frame.getFrameNumber();

        if (cancelled.get()) {
            LOG.debug("Session {} cancelled, discarding frame={}", sessionId, frameNumber);
            return Optional.empty();
        }
        if (frameNumber <= lastFrameNumber) {
            framesRejected.incrementAndGet();
            LOG.warn("Session {} rejected out-of-order frame={} (last frame={})",
                    sessionId, frameNumber, lastFrameNumber);
            return Optional.empty();
        }
        lastFrameNumber = frameNumber;

        Mat image = null;
        try {
            image = ImageUtils.decodeImage(frame.getFrameData());

            // 1. 检测
            List<Detection> detections = detect(image, frame);

            // 2. 标定
            updateCalibration(image, frameNumber);
            CalibrationData calibration = calibrationEngine.getCalibrationData();
            boolean stale = !calibration.usable() && lastValidCalibration != null;

            // 3. 实时模式下超出预算则丢帧，不提交跟踪器
            if (mode == ProcessingMode.LIVE && System.nanoTime() - start > frameBudgetNanos) {
                framesDropped.incrementAndGet();
                LOG.warn("Session {} dropped frame={}: over budget of {} ms", sessionId, frameNumber,
                        TimeUnit.NANOSECONDS.toMillis(frameBudgetNanos));
                return Optional.of(FrameAnalysis.builder()
                        .sessionId(sessionId)
                        .frameNumber(frameNumber)
                        .timestamp(frame.getTimestamp())
                        .detections(detections)
                        .calibrationData(calibration)
                        .calibrationStale(stale)
                        .dropped(true)
                        .processingTime(elapsedMillis(start))
                        .build());
            }

            // 4. 坐标变换
            boolean tableValid = transformer != null && transformer.isReady();
            List<Detection> located = locateDetections(detections, frameNumber);

            if (cancelled.get()) {
                LOG.debug("Session {} cancelled before commit of frame={}", sessionId, frameNumber);
                return Optional.empty();
            }

            // 5. 跟踪
            List<TrackedBall> tracked;
            try {
                tracked = tracker.update(located, frameNumber);
            } catch (RuntimeException e) {
                trackingFailures.incrementAndGet();
                LOG.error(new TrackingException(frameNumber, "Tracker update failed for session "
                        + sessionId, e).diagnostic(), e);
                tracked = tracker.getLiveTracks();
            }
            List<TrackEvent> events = tracker.drainEvents();

            FrameAnalysis analysis = FrameAnalysis.builder()
                    .sessionId(sessionId)
                    .frameNumber(frameNumber)
                    .timestamp(frame.getTimestamp())
                    .detections(located)
                    .trackedBalls(locateTracks(tracked, frameNumber))
                    .events(events)
                    .calibrationData(calibration)
                    .tableCoordinatesValid(tableValid)
                    .calibrationStale(stale)
                    .processingTime(elapsedMillis(start))
                    .build();

            framesProcessed.incrementAndGet();
            totalDetections.addAndGet(located.size());
            recordTime(analysis.getProcessingTime());
            return Optional.of(analysis);
        } finally {
            ImageUtils.safeRelease(image);
        }
    }

    private List<Detection> detect(Mat image, VideoFrame frame) {
        if (image.empty()) {
            detectionFailures.incrementAndGet();
            LOG.warn("{} session={}", new DetectionException(frame.getFrameNumber(),
                    "Undecodable frame data").diagnostic(), sessionId);
            return Collections.emptyList();
        }
        try {
            return detectionEngine.detectStrict(image, frame.getFrameNumber(), frame.getTimestamp());
        } catch (DetectionException e) {
            detectionFailures.incrementAndGet();
            LOG.error("{} session={}", e.diagnostic(), sessionId, e);
            return Collections.emptyList();
        }
    }

    private void updateCalibration(Mat image, long frameNumber) {
        if (!image.empty()) {
            int failuresBefore = calibrationEngine.getConsecutiveFailures();
            try {
                if (calibrationEngine.needsCalibration(frameNumber)) {
                    calibrationEngine.calibrate(image, frameNumber);
                    if (calibrationEngine.getConsecutiveFailures() > failuresBefore) {
                        calibrationFailures.incrementAndGet();
                    }
                } else if (calibrationEngine.isResidualCheckDue(frameNumber)) {
                    calibrationEngine.checkResidual(image, frameNumber);
                }
            } catch (RuntimeException e) {
                calibrationFailures.incrementAndGet();
                LOG.error(new CalibrationException(frameNumber, "Calibration step failed for session "
                        + sessionId, e).diagnostic(), e);
            }
        }
        refreshTransformer(calibrationEngine.getCalibrationData());
    }

    /**
     * 标定变化时重建变换器；无效标定保留上一次的有效变换器
     */
    private void refreshTransformer(CalibrationData current) {
        if (current == transformerSource) {
            return;
        }
        transformerSource = current;
        if (current.usable()) {
            if (transformer != null) {
                transformer.close();
            }
            transformer = new CoordinateTransformer(current);
            lastValidCalibration = current;
            tracker.updatePocketRegions(current.getPocketRegions());
        } else if (lastValidCalibration != null) {
            LOG.warn("Session {} calibration invalidated, using cached prior from frame={}",
                    sessionId, lastValidCalibration.getFrameNumber());
        }
    }

    private List<Detection> locateDetections(List<Detection> detections, long frameNumber) {
        if (transformer == null) {
            return detections;
        }
        List<Detection> result = new ArrayList<>(detections.size());
        for (Detection detection : detections) {
            result.add(detection.toBuilder()
                    .tablePosition(toTable(detection.centroid(), frameNumber))
                    .build());
        }
        return result;
    }

    private List<TrackedBall> locateTracks(List<TrackedBall> tracks, long frameNumber) {
        if (transformer == null) {
            return tracks;
        }
        List<TrackedBall> result = new ArrayList<>(tracks.size());
        for (TrackedBall ball : tracks) {
            TrackedBall.TrackedBallBuilder builder = ball.toBuilder()
                    .tablePosition(toTable(ball.getCurrentPosition(), frameNumber));
            try {
                builder.clearTableTrajectory().tableTrajectory(transformer.transformTrajectory(ball.getTrajectory()));
            } catch (CoordinateException e) {
                coordinateFailures.incrementAndGet();
                LOG.debug("{} session={}", e.diagnostic(), sessionId);
            }
            result.add(builder.build());
        }
        return result;
    }

    private Point toTable(Point pixel, long frameNumber) {
        try {
            return transformer.pixelToTable(pixel);
        } catch (CoordinateException e) {
            coordinateFailures.incrementAndGet();
            LOG.debug("[frame={}] {} session={}", frameNumber, e.diagnostic(), sessionId);
            return null;
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private void recordTime(long millis) {
        totalProcessingMs.addAndGet(millis);
        maxProcessingMs.accumulateAndGet(millis, Math::max);
    }

    /**
     * 取消会话：正在处理的帧在提交跟踪器之前丢弃，之后的帧不再处理
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.info("Session {} cancelled", sessionId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getSessionId() {
        return sessionId;
    }

    public TableCalibrationEngine getCalibrationEngine() {
        return calibrationEngine;
    }

    public BallTracker getTracker() {
        return tracker;
    }

    /**
     * 最近一次有效标定（缓存的先验），从未标定成功时为 null
     */
    public synchronized CalibrationData getLastValidCalibration() {
        return lastValidCalibration;
    }

    public ProcessingStats getStats() {
        long processed = framesProcessed.get();
        BallTracker.TrackingStats trackingStats = tracker.getStats();
        return ProcessingStats.builder()
                .sessionId(sessionId)
                .framesProcessed(processed)
                .framesDropped(framesDropped.get())
                .framesRejected(framesRejected.get())
                .detectionFailures(detectionFailures.get())
                .calibrationFailures(calibrationFailures.get())
                .coordinateFailures(coordinateFailures.get())
                .trackingFailures(trackingFailures.get())
                .totalDetections(totalDetections.get())
                .averageProcessingMs(processed == 0 ? 0.0 : (double) totalProcessingMs.get() / processed)
                .maxProcessingMs(maxProcessingMs.get())
                .calibrationState(calibrationEngine.getState())
                .calibrationAttempts(calibrationEngine.getTotalAttempts())
                .liveTracks(trackingStats.getLiveTracks())
                .pottedBalls(trackingStats.getPottedBalls())
                .tracksCreated(trackingStats.getTracksCreated())
                .build();
    }

    @Override
    public synchronized void close() {
        if (transformer != null) {
            transformer.close();
            transformer = null;
        }
        LOG.info("Frame processor for session {} closed: {}", sessionId, getStats());
    }
}
