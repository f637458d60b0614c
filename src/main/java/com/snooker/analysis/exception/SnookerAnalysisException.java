package com.snooker.analysis.exception;

/**
 * 分析流水线异常基类，携带出错子系统和帧号
 */
public class SnookerAnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final long NO_FRAME = -1L;

    private final String subsystem;
    private final long frameNumber;

    public SnookerAnalysisException(String subsystem, long frameNumber, String message) {
        super(message);
        this.subsystem = subsystem;
        this.frameNumber = frameNumber;
    }

    public SnookerAnalysisException(String subsystem, long frameNumber, String message, Throwable cause) {
        super(message, cause);
        this.subsystem = subsystem;
        this.frameNumber = frameNumber;
    }

    public String getSubsystem() {
        return subsystem;
    }

    public long getFrameNumber() {
        return frameNumber;
    }

    /**
     * 日志用的诊断上下文
     */
    public String diagnostic() {
        return String.format("[subsystem=%s, frame=%s] %s", subsystem,
                frameNumber == NO_FRAME ? "-" : String.valueOf(frameNumber), getMessage());
    }
}
