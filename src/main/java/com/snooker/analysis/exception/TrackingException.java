package com.snooker.analysis.exception;

/**
 * 关联求解失败
 */
public class TrackingException extends SnookerAnalysisException {

    private static final long serialVersionUID = 1L;

    public TrackingException(long frameNumber, String message) {
        super("tracking", frameNumber, message);
    }

    public TrackingException(long frameNumber, String message, Throwable cause) {
        super("tracking", frameNumber, message, cause);
    }
}
