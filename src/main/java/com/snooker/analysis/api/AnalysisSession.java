package com.snooker.analysis.api;

import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.model.CalibrationData;
import com.snooker.analysis.model.FrameAnalysis;
import com.snooker.analysis.model.VideoFrame;
import com.snooker.analysis.processor.FrameProcessor;
import com.snooker.analysis.processor.ProcessingStats;
import com.snooker.analysis.tracking.BallTracker;
import com.snooker.analysis.tracking.TrajectoryAnalyzer;
import com.snooker.analysis.tracking.TrajectorySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 一个分析会话：独立的标定、跟踪状态和结果流
 *
 * 最新结果通过 {@link AtomicReference} 整体替换发布，读者无需加锁。
 * 结果流按帧顺序输出，只允许订阅一次，会话结束后流终止。
 * 结果缓冲有上限，写满时丢弃最旧的结果。
 */
public class AnalysisSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisSession.class);

    // 流结束标记
    private static final FrameAnalysis END_OF_STREAM = FrameAnalysis.builder().frameNumber(-1).build();

    private final String sessionId;
    private final SnookerAnalysisConfig config;
    private final FrameProcessor processor;
    private final TrajectoryAnalyzer trajectoryAnalyzer = new TrajectoryAnalyzer();

    private final AtomicReference<FrameAnalysis> latest = new AtomicReference<>();
    private final BlockingQueue<FrameAnalysis> results;
    private final Object publishLock = new Object();
    private final AtomicBoolean subscribed = new AtomicBoolean(false);
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final AtomicLong evictedResults = new AtomicLong();

    private volatile Future<?> videoTask;

    AnalysisSession(String sessionId, SnookerAnalysisConfig config, FrameProcessor processor) {
        this.sessionId = sessionId;
        this.config = config;
        this.processor = processor;
        this.results = new LinkedBlockingQueue<>(config.getResultBufferSize());
    }

    /**
     * 处理一帧并发布结果；会话结束后提交的帧被忽略
     */
    public Optional<FrameAnalysis> submit(VideoFrame frame) {
        if (completed.get()) {
            LOG.debug("Session {} already completed, ignoring frame={}", sessionId, frame.getFrameNumber());
            return Optional.empty();
        }
        Optional<FrameAnalysis> analysis = processor.process(frame);
        analysis.ifPresent(this::publish);
        return analysis;
    }

    private void publish(FrameAnalysis analysis) {
        synchronized (publishLock) {
            if (completed.get()) {
                return;
            }
            latest.set(analysis);
            while (!results.offer(analysis)) {
                FrameAnalysis evicted = results.poll();
                if (evicted != null && evictedResults.incrementAndGet() % 1000 == 1) {
                    LOG.warn("Session {} result buffer full, dropped frame={} ({} dropped so far)",
                            sessionId, evicted.getFrameNumber(), evictedResults.get());
                }
            }
        }
    }

    public Optional<FrameAnalysis> latest() {
        return Optional.ofNullable(latest.get());
    }

    /**
     * 按帧顺序输出的结果流，阻塞等待新结果，会话结束时终止
     *
     * @throws IllegalStateException 重复订阅
     */
    public Stream<FrameAnalysis> stream() {
        if (!subscribed.compareAndSet(false, true)) {
            throw new IllegalStateException("Session " + sessionId + " already has a subscriber");
        }
        Iterator<FrameAnalysis> iterator = new Iterator<FrameAnalysis>() {
            private FrameAnalysis next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = results.take();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                }
                return next != END_OF_STREAM;
            }

            @Override
            public FrameAnalysis next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                FrameAnalysis current = next;
                next = null;
                return current;
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator,
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * 标记输入结束，结果流在输出剩余结果后终止
     */
    public void complete() {
        synchronized (publishLock) {
            if (!completed.compareAndSet(false, true)) {
                return;
            }
            while (!results.offer(END_OF_STREAM)) {
                results.poll();
                evictedResults.incrementAndGet();
            }
        }
        LOG.info("Session {} input completed", sessionId);
    }

    public void cancel() {
        processor.cancel();
        Future<?> task = videoTask;
        if (task != null) {
            task.cancel(true);
        }
        complete();
    }

    void attachVideoTask(Future<?> task) {
        this.videoTask = task;
    }

    /**
     * 因缓冲写满而被丢弃的结果数
     */
    public long getEvictedResults() {
        return evictedResults.get();
    }

    public boolean isCompleted() {
        return completed.get();
    }

    public boolean isCancelled() {
        return processor.isCancelled();
    }

    public String getSessionId() {
        return sessionId;
    }

    public SnookerAnalysisConfig getConfig() {
        return config;
    }

    FrameProcessor getProcessor() {
        return processor;
    }

    public CalibrationData getCalibration() {
        return processor.getCalibrationEngine().getCalibrationData();
    }

    public TrajectorySummary getTrajectorySummary() {
        BallTracker tracker = processor.getTracker();
        return trajectoryAnalyzer.summarize(tracker.getLiveTracks(), tracker.getPottedBalls());
    }

    public ProcessingStats getProcessingStats() {
        return processor.getStats();
    }

    @Override
    public void close() {
        complete();
        processor.close();
    }
}
