package com.snooker.analysis.config;

import com.snooker.analysis.exception.ConfigurationException;
import com.snooker.analysis.processor.ProcessingMode;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * 斯诺克分析配置类
 * 所有参数在会话启动时提供，非法值在 {@link #validate()} 中快速失败
 */
@Data
public class SnookerAnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SnookerAnalysisConfig.class);

    private static final String CONFIG_FILE = "application.properties";

    // 检测模型配置
    private String modelPath = "models/snooker-yolov8.onnx";
    private String fallbackModelPath = "models/yolov8n.onnx";
    private float confidenceThreshold = 0.2f;
    private float nmsThreshold = 0.5f;
    private int inputSize = 640;
    private int intraOpThreads = 2;

    // 球台尺寸（米）
    private double tableLength = 3.569;
    private double tableWidth = 1.778;
    private double pocketRadius = 0.09;

    // 跟踪配置
    private double maxTrackingDistance = 50.0;
    private int maxDisappearedFrames = 10;
    private int minHitsToActivate = 3;
    private double distanceWeight = 1.0;
    private double classMismatchPenalty = Double.POSITIVE_INFINITY;
    private double kalmanProcessNoise = 0.1;
    private double kalmanMeasurementNoise = 0.1;

    // 标定配置
    private int calibrationInterval = 100;
    private double reprojectionTolerance = 0.01;
    private double residualTolerance = 0.05;
    private int residualCheckInterval = 25;
    private int calibrationRetryBudget = 5;
    private String calibrationCacheDir = "cache/calibration";
    private String cameraId;
    private double calibrationCacheMaxAgeHours = 24;

    // 处理配置
    private ProcessingMode processingMode = ProcessingMode.BATCH;
    private long frameBudgetMs = 200;
    private boolean debugMode;
    private String debugOutputDir = "output/debug";
    // 未订阅或消费过慢时，结果流最多缓存的帧数
    private int resultBufferSize = 512;

    // Kafka / Flink 配置
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaFrameTopic = "snooker-frames";
    private String kafkaAnalysisTopic = "snooker-analysis";
    private String kafkaGroupId = "snooker-analysis-group";
    private int jobParallelism = 4;
    // 会话超过该时长没有新帧即释放其处理器
    private long sessionIdleTimeoutMs = 300_000;

    /**
     * 从类路径下的 application.properties 加载配置
     */
    public static SnookerAnalysisConfig loadConfig() {
        Properties props = new Properties();

        try (InputStream input = SnookerAnalysisConfig.class.getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (input == null) {
                LOG.warn("Configuration file '{}' not found in classpath, using defaults", CONFIG_FILE);
                return new SnookerAnalysisConfig();
            }
            props.load(input);
        } catch (IOException e) {
            LOG.error("Error loading configuration", e);
            throw new ConfigurationException("Failed to read " + CONFIG_FILE + ": " + e.getMessage());
        }

        SnookerAnalysisConfig config = fromProperties(props);
        LOG.info("Configuration loaded successfully");
        LOG.info("Model: {} (fallback {}), confidence: {}, nms: {}",
                config.getModelPath(), config.getFallbackModelPath(),
                config.getConfidenceThreshold(), config.getNmsThreshold());
        LOG.info("Table: {}m x {}m, tracking distance: {}px, max disappeared: {} frames",
                config.getTableLength(), config.getTableWidth(),
                config.getMaxTrackingDistance(), config.getMaxDisappearedFrames());
        LOG.info("Kafka: {} -> frames: {}, analysis: {}",
                config.getKafkaBootstrapServers(), config.getKafkaFrameTopic(), config.getKafkaAnalysisTopic());
        return config;
    }

    /**
     * 从任意 Properties 构建配置，缺省键使用默认值
     */
    public static SnookerAnalysisConfig fromProperties(Properties props) {
        SnookerAnalysisConfig config = new SnookerAnalysisConfig();
        List<String> errors = new ArrayList<>();
        PropertyReader reader = new PropertyReader(props, errors);

        // 加载检测配置
        config.setModelPath(props.getProperty("detection.model.path", config.getModelPath()));
        config.setFallbackModelPath(props.getProperty("detection.fallback.model.path", config.getFallbackModelPath()));
        config.setConfidenceThreshold(reader.getFloat("detection.confidence.threshold", config.getConfidenceThreshold()));
        config.setNmsThreshold(reader.getFloat("detection.nms.threshold", config.getNmsThreshold()));
        config.setInputSize(reader.getInt("detection.input.size", config.getInputSize()));
        config.setIntraOpThreads(reader.getInt("detection.intra.op.threads", config.getIntraOpThreads()));

        // 加载球台配置
        config.setTableLength(reader.getDouble("table.length", config.getTableLength()));
        config.setTableWidth(reader.getDouble("table.width", config.getTableWidth()));
        config.setPocketRadius(reader.getDouble("table.pocket.radius", config.getPocketRadius()));

        // 加载跟踪配置
        config.setMaxTrackingDistance(reader.getDouble("tracking.max.distance", config.getMaxTrackingDistance()));
        config.setMaxDisappearedFrames(reader.getInt("tracking.max.disappeared.frames", config.getMaxDisappearedFrames()));
        config.setMinHitsToActivate(reader.getInt("tracking.min.hits", config.getMinHitsToActivate()));
        config.setDistanceWeight(reader.getDouble("tracking.distance.weight", config.getDistanceWeight()));
        config.setClassMismatchPenalty(reader.getDouble("tracking.class.mismatch.penalty", config.getClassMismatchPenalty()));
        config.setKalmanProcessNoise(reader.getDouble("tracking.kalman.process.noise", config.getKalmanProcessNoise()));
        config.setKalmanMeasurementNoise(reader.getDouble("tracking.kalman.measurement.noise", config.getKalmanMeasurementNoise()));

        // 加载标定配置
        config.setCalibrationInterval(reader.getInt("calibration.interval", config.getCalibrationInterval()));
        config.setReprojectionTolerance(reader.getDouble("calibration.reprojection.tolerance", config.getReprojectionTolerance()));
        config.setResidualTolerance(reader.getDouble("calibration.residual.tolerance", config.getResidualTolerance()));
        config.setResidualCheckInterval(reader.getInt("calibration.residual.check.interval", config.getResidualCheckInterval()));
        config.setCalibrationRetryBudget(reader.getInt("calibration.retry.budget", config.getCalibrationRetryBudget()));
        config.setCalibrationCacheDir(props.getProperty("calibration.cache.dir", config.getCalibrationCacheDir()));
        config.setCameraId(props.getProperty("calibration.camera.id", config.getCameraId()));
        config.setCalibrationCacheMaxAgeHours(reader.getDouble("calibration.cache.max.age.hours", config.getCalibrationCacheMaxAgeHours()));

        // 加载处理配置
        String mode = props.getProperty("processing.mode");
        if (mode != null) {
            try {
                config.setProcessingMode(ProcessingMode.valueOf(mode.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                errors.add("processing.mode must be 'batch' or 'live', got '" + mode + "'");
            }
        }
        config.setFrameBudgetMs(reader.getLong("processing.frame.budget.ms", config.getFrameBudgetMs()));
        config.setDebugMode(Boolean.parseBoolean(props.getProperty("debug.mode", String.valueOf(config.isDebugMode()))));
        config.setDebugOutputDir(props.getProperty("debug.output.dir", config.getDebugOutputDir()));
        config.setResultBufferSize(reader.getInt("processing.result.buffer.size", config.getResultBufferSize()));

        // 加载 Kafka / Flink 配置
        config.setKafkaBootstrapServers(props.getProperty("kafka.bootstrap.servers", config.getKafkaBootstrapServers()));
        config.setKafkaFrameTopic(props.getProperty("kafka.frame.topic", config.getKafkaFrameTopic()));
        config.setKafkaAnalysisTopic(props.getProperty("kafka.analysis.topic", config.getKafkaAnalysisTopic()));
        config.setKafkaGroupId(props.getProperty("kafka.group.id", config.getKafkaGroupId()));
        config.setJobParallelism(reader.getInt("job.parallelism", config.getJobParallelism()));
        config.setSessionIdleTimeoutMs(reader.getLong("job.session.idle.timeout.ms", config.getSessionIdleTimeoutMs()));

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return config;
    }

    /**
     * 校验取值范围，任何违例都抛出 {@link ConfigurationException}
     */
    public SnookerAnalysisConfig validate() {
        List<String> errors = new ArrayList<>();

        if (modelPath == null || modelPath.trim().isEmpty()) {
            errors.add("detection.model.path is required");
        }
        requireRange(errors, "detection.confidence.threshold", confidenceThreshold, 0, 1);
        requireRange(errors, "detection.nms.threshold", nmsThreshold, 0, 1);
        requirePositive(errors, "detection.input.size", inputSize);
        requirePositive(errors, "detection.intra.op.threads", intraOpThreads);

        requirePositive(errors, "table.length", tableLength);
        requirePositive(errors, "table.width", tableWidth);
        requirePositive(errors, "table.pocket.radius", pocketRadius);
        if (tableWidth > tableLength) {
            errors.add("table.width must not exceed table.length");
        }

        requirePositive(errors, "tracking.max.distance", maxTrackingDistance);
        requirePositive(errors, "tracking.max.disappeared.frames", maxDisappearedFrames);
        requirePositive(errors, "tracking.min.hits", minHitsToActivate);
        requirePositive(errors, "tracking.distance.weight", distanceWeight);
        if (Double.isNaN(classMismatchPenalty) || classMismatchPenalty < 0) {
            errors.add("tracking.class.mismatch.penalty must be >= 0 (Infinity excludes mismatches)");
        }
        requirePositive(errors, "tracking.kalman.process.noise", kalmanProcessNoise);
        requirePositive(errors, "tracking.kalman.measurement.noise", kalmanMeasurementNoise);

        requirePositive(errors, "calibration.interval", calibrationInterval);
        requirePositive(errors, "calibration.reprojection.tolerance", reprojectionTolerance);
        requirePositive(errors, "calibration.residual.tolerance", residualTolerance);
        if (residualCheckInterval < 0) {
            errors.add("calibration.residual.check.interval must be >= 0");
        }
        if (calibrationRetryBudget < 0) {
            errors.add("calibration.retry.budget must be >= 0");
        }
        requirePositive(errors, "calibration.cache.max.age.hours", calibrationCacheMaxAgeHours);

        if (processingMode == null) {
            errors.add("processing.mode is required");
        }
        if (processingMode == ProcessingMode.LIVE && frameBudgetMs <= 0) {
            errors.add("processing.frame.budget.ms must be > 0 in live mode");
        }
        requirePositive(errors, "processing.result.buffer.size", resultBufferSize);
        requirePositive(errors, "job.session.idle.timeout.ms", sessionIdleTimeoutMs);

        if (!errors.isEmpty()) {
            LOG.error("Configuration rejected: {}", errors);
            throw new ConfigurationException(errors);
        }
        return this;
    }

    private static void requireRange(List<String> errors, String key, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            errors.add(String.format("%s must be in [%s, %s], got %s", key, min, max, value));
        }
    }

    private static void requirePositive(List<String> errors, String key, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0) {
            errors.add(String.format("%s must be > 0, got %s", key, value));
        }
    }

    /**
     * 数值解析，错误统一收集
     */
    private static final class PropertyReader {

        private final Properties props;
        private final List<String> errors;

        PropertyReader(Properties props, List<String> errors) {
            this.props = props;
            this.errors = errors;
        }

        int getInt(String key, int defaultValue) {
            String value = props.getProperty(key);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                errors.add(key + " is not an integer: '" + value + "'");
                return defaultValue;
            }
        }

        long getLong(String key, long defaultValue) {
            String value = props.getProperty(key);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                errors.add(key + " is not an integer: '" + value + "'");
                return defaultValue;
            }
        }

        float getFloat(String key, float defaultValue) {
            return (float) getDouble(key, defaultValue);
        }

        double getDouble(String key, double defaultValue) {
            String value = props.getProperty(key);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                errors.add(key + " is not a number: '" + value + "'");
                return defaultValue;
            }
        }
    }
}
