package com.snooker.analysis.calibration;

/**
 * 标定状态机
 * UNCALIBRATED -> CALIBRATING -> CALIBRATED -> RECALIBRATING -> CALIBRATED
 * 连续失败超过重试预算时 CALIBRATED/RECALIBRATING -> UNCALIBRATED
 */
public enum CalibrationState {
    UNCALIBRATED,
    CALIBRATING,
    CALIBRATED,
    RECALIBRATING
}
