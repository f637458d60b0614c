package com.snooker.analysis.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 单帧分析结果快照
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FrameAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    String sessionId;

    long frameNumber;

    /**
     * 帧时间戳（毫秒）
     */
    long timestamp;

    @Singular
    List<Detection> detections;

    @Singular
    List<TrackedBall> trackedBalls;

    @Singular
    List<TrackEvent> events;

    CalibrationData calibrationData;

    /**
     * 本帧球台坐标是否可信
     */
    boolean tableCoordinatesValid;

    /**
     * 本帧使用的是缓存的旧标定
     */
    boolean calibrationStale;

    /**
     * 超出实时处理预算而被丢弃
     */
    boolean dropped;

    /**
     * 处理耗时（毫秒）
     */
    long processingTime;

    public List<TrackedBall> activeTracks() {
        return trackedBalls.stream()
                .filter(ball -> ball.getState() == TrackState.ACTIVE)
                .collect(Collectors.toList());
    }
}
