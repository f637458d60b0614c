package com.snooker.analysis.function;

import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.detection.BallDetectionEngine;
import com.snooker.analysis.model.FrameAnalysis;
import com.snooker.analysis.model.VideoFrame;
import com.snooker.analysis.processor.FrameProcessor;
import com.snooker.analysis.serialization.FrameAnalysisSerializer;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 按会话ID分区的逐帧分析函数
 * 每个会话一个 {@link FrameProcessor}，同一并行实例内的会话共享检测引擎。
 * 会话超过空闲时长没有新帧时，由处理时间定时器关闭并移除其处理器。
 */
public class FrameAnalysisFunction extends KeyedProcessFunction<String, VideoFrame, String> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FrameAnalysisFunction.class);

    private final SnookerAnalysisConfig config;
    private final long idleTimeoutMs;

    // 处理组件
    private transient BallDetectionEngine detectionEngine;
    private transient Map<String, FrameProcessor> processors;

    // 会话最近一帧的处理时间，同时用作当前定时器的基准
    private transient ValueState<Long> lastActivityState;

    // 统计信息
    private transient AtomicLong totalFramesProcessed;
    private transient AtomicLong totalResultsEmitted;
    private transient AtomicLong sessionsExpired;

    public FrameAnalysisFunction(SnookerAnalysisConfig config) {
        this(config, null);
    }

    FrameAnalysisFunction(SnookerAnalysisConfig config, BallDetectionEngine detectionEngine) {
        this.config = config;
        this.idleTimeoutMs = config.getSessionIdleTimeoutMs();
        this.detectionEngine = detectionEngine;
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);

        if (detectionEngine == null) {
            detectionEngine = new BallDetectionEngine(config);
        }
        processors = new HashMap<>();

        ValueStateDescriptor<Long> descriptor = new ValueStateDescriptor<>("last-activity", Long.class);
        lastActivityState = getRuntimeContext().getState(descriptor);

        totalFramesProcessed = new AtomicLong(0);
        totalResultsEmitted = new AtomicLong(0);
        sessionsExpired = new AtomicLong(0);

        LOG.info("FrameAnalysisFunction opened, model loaded: {}, session idle timeout: {} ms",
                detectionEngine.isModelLoaded(), idleTimeoutMs);
    }

    @Override
    public void processElement(VideoFrame frame, Context ctx, Collector<String> out) throws Exception {
        String sessionId = ctx.getCurrentKey();
        long totalProcessed = totalFramesProcessed.incrementAndGet();

        FrameProcessor processor = processors.computeIfAbsent(sessionId, id -> {
            LOG.info("Creating frame processor for session {}", id);
            return new FrameProcessor(id, config, detectionEngine);
        });

        Optional<FrameAnalysis> analysis = processor.process(frame);
        if (analysis.isPresent()) {
            String json = FrameAnalysisSerializer.toJson(analysis.get());
            if (json != null) {
                out.collect(json);
                totalResultsEmitted.incrementAndGet();
            }
        }

        refreshIdleTimer(ctx);

        // 定期打印处理统计信息
        if (totalProcessed % 1000 == 0) {
            LOG.info("Sessions: {}, Total frames: {}, Results: {}, Expired sessions: {}, Avg inference: {} ms",
                    processors.size(), totalProcessed, totalResultsEmitted.get(), sessionsExpired.get(),
                    String.format("%.2f", detectionEngine.getAverageInferenceMs()));
        }
    }

    /**
     * 每个会话只保留一个定时器：先删旧的再注册新的
     */
    private void refreshIdleTimer(Context ctx) throws Exception {
        long now = ctx.timerService().currentProcessingTime();
        Long previous = lastActivityState.value();
        if (previous != null) {
            ctx.timerService().deleteProcessingTimeTimer(previous + idleTimeoutMs);
        }
        lastActivityState.update(now);
        ctx.timerService().registerProcessingTimeTimer(now + idleTimeoutMs);
    }

    @Override
    public void onTimer(long timestamp, OnTimerContext ctx, Collector<String> out) throws Exception {
        String sessionId = ctx.getCurrentKey();
        Long lastActivity = lastActivityState.value();
        if (lastActivity != null && timestamp < lastActivity + idleTimeoutMs) {
            return;
        }

        lastActivityState.clear();
        FrameProcessor processor = processors.remove(sessionId);
        if (processor != null) {
            sessionsExpired.incrementAndGet();
            LOG.info("Session {} idle for {} ms, releasing processor ({} frames processed)",
                    sessionId, idleTimeoutMs, processor.getStats().getFramesProcessed());
            processor.close();
        }
    }

    int getActiveSessions() {
        return processors == null ? 0 : processors.size();
    }

    @Override
    public void close() throws Exception {
        super.close();

        if (processors != null) {
            processors.values().forEach(FrameProcessor::close);
            processors.clear();
        }
        if (detectionEngine != null) {
            detectionEngine.close();
        }

        LOG.info("FrameAnalysisFunction closed. Total frames processed: {}, Results emitted: {}",
                totalFramesProcessed == null ? 0 : totalFramesProcessed.get(),
                totalResultsEmitted == null ? 0 : totalResultsEmitted.get());
    }
}
