package com.snooker.analysis.exception;

/**
 * 在没有有效标定时进行坐标变换
 */
public class CoordinateException extends SnookerAnalysisException {

    private static final long serialVersionUID = 1L;

    public CoordinateException(long frameNumber, String message) {
        super("coordinate", frameNumber, message);
    }

    public CoordinateException(long frameNumber, String message, Throwable cause) {
        super("coordinate", frameNumber, message, cause);
    }
}
