package com.snooker.analysis.detection;

import com.snooker.analysis.model.BallType;
import com.snooker.analysis.model.BoundingBox;
import com.snooker.analysis.model.Detection;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 检测结果校验与过滤
 *
 * 1. 类别、置信度、坐标合法性（框须完整落在画面内，面积大于100像素）
 * 2. 置信度阈值
 * 3. 同类别NMS
 * 4. 每种球的数量上限（红球15，其余1），保留置信度最高者
 */
public class DetectionValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionValidator.class);

    // 小于 10x10 的框视为噪声
    static final double MIN_BOX_AREA = 100.0;

    private final double confidenceThreshold;
    private final double nmsThreshold;

    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong filteredInvalid = new AtomicLong();
    private final AtomicLong filteredLowConfidence = new AtomicLong();
    private final AtomicLong filteredDuplicates = new AtomicLong();

    public DetectionValidator(double confidenceThreshold, double nmsThreshold) {
        this.confidenceThreshold = confidenceThreshold;
        this.nmsThreshold = nmsThreshold;
    }

    /**
     * 完整的过滤流程
     */
    public List<Detection> validate(List<RawDetection> raw, int frameWidth, int frameHeight,
                                    long frameNumber, long timestamp) {
        if (raw == null || raw.isEmpty()) {
            return new ArrayList<>();
        }
        totalProcessed.addAndGet(raw.size());

        List<Detection> confident = new ArrayList<>();
        for (RawDetection candidate : raw) {
            Optional<Detection> detection = toDetection(candidate, frameWidth, frameHeight, timestamp);
            if (!detection.isPresent()) {
                filteredInvalid.incrementAndGet();
                LOG.debug("Dropped invalid detection {} at frame={}", candidate, frameNumber);
                continue;
            }
            if (detection.get().getConfidence() < confidenceThreshold) {
                filteredLowConfidence.incrementAndGet();
                continue;
            }
            confident.add(detection.get());
        }

        List<Detection> result = enforceLimits(applyNms(confident));
        filteredDuplicates.addAndGet(confident.size() - result.size());
        return result;
    }

    /**
     * 校验单个候选，非法或超出画面时返回 empty
     */
    Optional<Detection> toDetection(RawDetection raw, int frameWidth, int frameHeight, long timestamp) {
        if (!BallType.fromClassId(raw.getClassId()).isPresent()) {
            return Optional.empty();
        }
        double confidence = raw.getConfidence();
        if (!Double.isFinite(confidence) || confidence < 0 || confidence > 1) {
            return Optional.empty();
        }
        double x1 = raw.getX1();
        double y1 = raw.getY1();
        double x2 = raw.getX2();
        double y2 = raw.getY2();
        if (!Double.isFinite(x1) || !Double.isFinite(y1) || !Double.isFinite(x2) || !Double.isFinite(y2)) {
            return Optional.empty();
        }
        if (x1 < 0 || y1 < 0 || x2 > frameWidth || y2 > frameHeight) {
            return Optional.empty();
        }
        if (x2 <= x1 || y2 <= y1 || (x2 - x1) * (y2 - y1) <= MIN_BOX_AREA) {
            return Optional.empty();
        }

        return Optional.of(Detection.builder()
                .bbox(new BoundingBox(x1, y1, x2, y2))
                .classId(raw.getClassId())
                .confidence(confidence)
                .timestamp(timestamp)
                .build());
    }

    List<Detection> applyNms(List<Detection> detections) {
        if (detections.isEmpty()) {
            return detections;
        }

        List<Detection> sorted = new ArrayList<>(detections);
        sorted.sort(Comparator.comparingDouble(Detection::getConfidence).reversed());

        List<Detection> result = new ArrayList<>();
        boolean[] suppressed = new boolean[sorted.size()];

        for (int i = 0; i < sorted.size(); i++) {
            if (suppressed[i]) continue;

            Detection detA = sorted.get(i);
            result.add(detA);

            for (int j = i + 1; j < sorted.size(); j++) {
                if (suppressed[j]) continue;

                Detection detB = sorted.get(j);
                if (detA.getClassId() != detB.getClassId()) {
                    continue;
                }
                if (detA.getBbox().iou(detB.getBbox()) > nmsThreshold) {
                    suppressed[j] = true;
                }
            }
        }

        return result;
    }

    /**
     * 输入按置信度降序
     */
    List<Detection> enforceLimits(List<Detection> detections) {
        Map<BallType, Integer> counts = new EnumMap<>(BallType.class);
        List<Detection> result = new ArrayList<>();
        for (Detection detection : detections) {
            BallType type = detection.ballType();
            int count = counts.getOrDefault(type, 0);
            if (count < type.getMaxCount()) {
                counts.put(type, count + 1);
                result.add(detection);
            }
        }
        return result;
    }

    public ValidationStats getStats() {
        return new ValidationStats(totalProcessed.get(), filteredInvalid.get(),
                filteredLowConfidence.get(), filteredDuplicates.get());
    }

    public void resetStats() {
        totalProcessed.set(0);
        filteredInvalid.set(0);
        filteredLowConfidence.set(0);
        filteredDuplicates.set(0);
    }

    /**
     * 过滤统计快照
     */
    @Value
    public static class ValidationStats {
        long totalProcessed;
        long filteredInvalid;
        long filteredLowConfidence;
        long filteredDuplicates;

        public double acceptanceRate() {
            if (totalProcessed == 0) {
                return 0.0;
            }
            long accepted = totalProcessed - filteredInvalid - filteredLowConfidence - filteredDuplicates;
            return (double) accepted / totalProcessed;
        }
    }
}
