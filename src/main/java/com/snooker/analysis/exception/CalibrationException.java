package com.snooker.analysis.exception;

/**
 * 角点检测或单应矩阵计算失败
 */
public class CalibrationException extends SnookerAnalysisException {

    private static final long serialVersionUID = 1L;

    public CalibrationException(long frameNumber, String message) {
        super("calibration", frameNumber, message);
    }

    public CalibrationException(long frameNumber, String message, Throwable cause) {
        super("calibration", frameNumber, message, cause);
    }
}
