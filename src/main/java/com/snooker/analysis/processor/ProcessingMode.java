package com.snooker.analysis.processor;

/**
 * 处理模式
 */
public enum ProcessingMode {

    /**
     * 录制视频：逐帧处理，不丢帧
     */
    BATCH,

    /**
     * 实时流：超出单帧预算的帧直接丢弃
     */
    LIVE
}
