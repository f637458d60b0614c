package com.snooker.analysis.detection;

import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.exception.DetectionException;
import com.snooker.analysis.model.Detection;
import com.snooker.analysis.model.VideoFrame;
import com.snooker.analysis.util.ImageUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 球检测引擎
 * 解码 -> 模型推理 -> 校验/NMS/数量限制
 *
 * 单帧失败只返回空结果，不会中断流水线；推理在内部串行执行，
 * 因此同一个实例可以被多个会话共享。
 */
public class BallDetectionEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BallDetectionEngine.class);

    private final BallClassifier classifier;
    private final DetectionValidator validator;

    // 添加同步锁以确保线程安全
    private final Object lock = new Object();

    private final AtomicLong framesProcessed = new AtomicLong();
    private final AtomicLong failedFrames = new AtomicLong();
    private final AtomicLong totalDetections = new AtomicLong();
    private final AtomicLong inferenceCount = new AtomicLong();
    private final AtomicLong totalInferenceMs = new AtomicLong();

    /**
     * 按配置加载模型，专用模型失败时回退到通用模型
     */
    public BallDetectionEngine(SnookerAnalysisConfig config) {
        this(loadClassifier(config), config.getConfidenceThreshold(), config.getNmsThreshold());
    }

    public BallDetectionEngine(BallClassifier classifier, double confidenceThreshold, double nmsThreshold) {
        this.classifier = classifier;
        this.validator = new DetectionValidator(confidenceThreshold, nmsThreshold);
        if (classifier == null) {
            LOG.warn("No detection model available, detection will return empty results");
        } else {
            LOG.info("Ball detection engine ready with model {}", classifier.name());
        }
    }

    private static BallClassifier loadClassifier(SnookerAnalysisConfig config) {
        ImageUtils.init();
        try {
            return OnnxBallClassifier.forBallModel(config.getModelPath(), config.getInputSize(),
                    config.getIntraOpThreads(), config.getConfidenceThreshold());
        } catch (DetectionException e) {
            LOG.error("{}, falling back to generic model", e.diagnostic(), e);
        }

        String fallback = config.getFallbackModelPath();
        if (fallback == null || fallback.trim().isEmpty()) {
            return null;
        }
        try {
            return OnnxBallClassifier.forGenericModel(fallback, config.getInputSize(),
                    config.getIntraOpThreads(), config.getConfidenceThreshold(), new BallColorClassifier());
        } catch (DetectionException e) {
            LOG.error("{}, no detection model loaded", e.diagnostic(), e);
            return null;
        }
    }

    public List<Detection> detect(VideoFrame frame) {
        return detect(frame.getFrameData(), frame.getFrameNumber(), frame.getTimestamp());
    }

    /**
     * 检测编码后的图像，无法解码时返回空列表
     */
    public List<Detection> detect(byte[] imageData, long frameNumber, long timestamp) {
        Mat image = null;
        try {
            image = ImageUtils.decodeImage(imageData);
            if (image.empty()) {
                failedFrames.incrementAndGet();
                LOG.warn(new DetectionException(frameNumber, "Failed to decode image ("
                        + (imageData == null ? 0 : imageData.length) + " bytes)").diagnostic());
                return new ArrayList<>();
            }
            return detect(image, frameNumber, timestamp);
        } catch (RuntimeException e) {
            failedFrames.incrementAndGet();
            LOG.error("Error decoding frame={}", frameNumber, e);
            return new ArrayList<>();
        } finally {
            ImageUtils.safeRelease(image);
        }
    }

    /**
     * 检测已解码的BGR图像，调用方负责释放Mat；推理失败返回空列表
     */
    public List<Detection> detect(Mat image, long frameNumber, long timestamp) {
        try {
            return detectStrict(image, frameNumber, timestamp);
        } catch (DetectionException e) {
            LOG.error(e.diagnostic(), e.getCause());
            return new ArrayList<>();
        }
    }

    /**
     * 与 {@link #detect(Mat, long, long)} 相同，但推理失败时抛出
     *
     * @throws DetectionException 推理失败
     */
    public List<Detection> detectStrict(Mat image, long frameNumber, long timestamp) {
        framesProcessed.incrementAndGet();
        if (classifier == null || image == null || image.empty()) {
            return new ArrayList<>();
        }

        List<RawDetection> raw;
        long start = System.currentTimeMillis();
        try {
            synchronized (lock) {
                raw = classifier.classify(image);
            }
        } catch (RuntimeException e) {
            failedFrames.incrementAndGet();
            Throwable cause = e instanceof DetectionException && e.getCause() != null ? e.getCause() : e;
            throw new DetectionException(frameNumber, "Inference failed: " + e.getMessage(), cause);
        }
        long inferenceTime = System.currentTimeMillis() - start;
        inferenceCount.incrementAndGet();
        totalInferenceMs.addAndGet(inferenceTime);

        List<Detection> detections = validator.validate(raw, image.cols(), image.rows(), frameNumber, timestamp);
        totalDetections.addAndGet(detections.size());

        LOG.debug("Detected {} balls ({} candidates) at frame={} in {} ms",
                detections.size(), raw.size(), frameNumber, inferenceTime);
        return detections;
    }

    public boolean isModelLoaded() {
        return classifier != null;
    }

    public String getModelName() {
        return classifier == null ? "none" : classifier.name();
    }

    public DetectionValidator.ValidationStats getValidationStats() {
        return validator.getStats();
    }

    public long getFramesProcessed() {
        return framesProcessed.get();
    }

    public long getFailedFrames() {
        return failedFrames.get();
    }

    public long getTotalDetections() {
        return totalDetections.get();
    }

    public double getAverageInferenceMs() {
        long count = inferenceCount.get();
        return count == 0 ? 0.0 : (double) totalInferenceMs.get() / count;
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (classifier != null) {
                try {
                    classifier.close();
                } catch (Exception e) {
                    LOG.error("Error closing detection model", e);
                }
            }
            LOG.info("Ball detection engine closed");
        }
    }
}
