package com.snooker.analysis.processor;

import com.snooker.analysis.calibration.CalibrationState;
import lombok.Builder;
import lombok.Value;

/**
 * 会话处理统计快照
 */
@Value
@Builder
public class ProcessingStats {

    String sessionId;

    long framesProcessed;
    long framesDropped;
    long framesRejected;

    // 各子系统失败次数
    long detectionFailures;
    long calibrationFailures;
    long coordinateFailures;
    long trackingFailures;

    long totalDetections;
    double averageProcessingMs;
    long maxProcessingMs;

    CalibrationState calibrationState;
    int calibrationAttempts;

    int liveTracks;
    int pottedBalls;
    long tracksCreated;
}
