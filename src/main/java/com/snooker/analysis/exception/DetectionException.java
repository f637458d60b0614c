package com.snooker.analysis.exception;

/**
 * 模型加载或推理失败
 */
public class DetectionException extends SnookerAnalysisException {

    private static final long serialVersionUID = 1L;

    public DetectionException(long frameNumber, String message) {
        super("detection", frameNumber, message);
    }

    public DetectionException(long frameNumber, String message, Throwable cause) {
        super("detection", frameNumber, message, cause);
    }
}
