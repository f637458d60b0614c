package com.snooker.analysis.api;

import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.detection.BallDetectionEngine;
import com.snooker.analysis.model.CalibrationData;
import com.snooker.analysis.model.FrameAnalysis;
import com.snooker.analysis.model.VideoFrame;
import com.snooker.analysis.processor.FrameProcessor;
import com.snooker.analysis.processor.ProcessingStats;
import com.snooker.analysis.processor.VideoInputHandler;
import com.snooker.analysis.tracking.TrajectorySummary;
import com.snooker.analysis.visualization.DebugVisualizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * 斯诺克分析入口
 *
 * 每个会话拥有独立的标定引擎和跟踪器；检测引擎按模型路径在会话间共享。
 */
public class DetectionApi implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionApi.class);

    private final Map<String, AnalysisSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, BallDetectionEngine> engines = new ConcurrentHashMap<>();
    private final BallDetectionEngine sharedEngine;
    private final ExecutorService executor;

    public DetectionApi() {
        this(null);
    }

    /**
     * @param sharedEngine 所有会话共用的检测引擎，由调用方负责关闭；为 null 时按配置加载
     */
    public DetectionApi(BallDetectionEngine sharedEngine) {
        this.sharedEngine = sharedEngine;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "snooker-video-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 打开新会话，配置非法时抛出 {@link com.snooker.analysis.exception.ConfigurationException}
     */
    public AnalysisSession openSession(String sessionId, SnookerAnalysisConfig config) {
        if (sessionId == null || sessionId.trim().isEmpty()) {
            throw new IllegalArgumentException("Session id must not be empty");
        }
        config.validate();
        BallDetectionEngine engine = engineFor(config);
        AnalysisSession session = sessions.compute(sessionId, (id, existing) -> {
            if (existing != null) {
                throw new IllegalStateException("Session already open: " + id);
            }
            return new AnalysisSession(id, config, new FrameProcessor(id, config, engine));
        });
        LOG.info("Opened session {} (mode={}, model={})", sessionId, config.getProcessingMode(),
                engine.getModelName());
        return session;
    }

    public Optional<FrameAnalysis> submitFrame(String sessionId, VideoFrame frame) {
        return session(sessionId).submit(frame);
    }

    /**
     * 异步分析视频文件或流地址，读完后结束会话结果流
     */
    public CompletableFuture<ProcessingStats> analyzeVideo(String sessionId, String source) {
        AnalysisSession session = session(sessionId);
        CompletableFuture<ProcessingStats> future = CompletableFuture.supplyAsync(() -> {
            try (VideoInputHandler input = new VideoInputHandler(source, sessionId)) {
                input.open();
                Optional<VideoFrame> frame;
                while (!session.isCancelled() && (frame = input.nextFrame()).isPresent()) {
                    session.submit(frame.get());
                }
                LOG.info("Finished video {} for session {}: {} frames read",
                        source, sessionId, input.getFramesEmitted());
                return session.getProcessingStats();
            } catch (IOException e) {
                LOG.error("Video analysis failed for session {}: {}", sessionId, source, e);
                throw new UncheckedIOException(e);
            } finally {
                session.complete();
            }
        }, executor);
        session.attachVideoTask(future);
        return future;
    }

    public Optional<FrameAnalysis> getLatestFrameAnalysis(String sessionId) {
        return session(sessionId).latest();
    }

    public Stream<FrameAnalysis> streamFrameAnalyses(String sessionId) {
        return session(sessionId).stream();
    }

    public CalibrationData getCalibration(String sessionId) {
        return session(sessionId).getCalibration();
    }

    public TrajectorySummary getTrajectorySummary(String sessionId) {
        return session(sessionId).getTrajectorySummary();
    }

    public ProcessingStats getProcessingStats(String sessionId) {
        return session(sessionId).getProcessingStats();
    }

    /**
     * 导出帧的标注图，仅调试模式可用；帧必须是该会话最近处理的一帧
     */
    public Path exportAnnotatedFrame(String sessionId, VideoFrame frame) throws IOException {
        AnalysisSession session = session(sessionId);
        SnookerAnalysisConfig config = session.getConfig();
        if (!config.isDebugMode()) {
            throw new IllegalStateException("Annotated export requires debug mode (session " + sessionId + ")");
        }
        FrameAnalysis analysis = session.latest()
                .filter(a -> a.getFrameNumber() == frame.getFrameNumber())
                .orElseThrow(() -> new IllegalArgumentException(
                        "No analysis for frame " + frame.getFrameNumber() + " in session " + sessionId));
        return new DebugVisualizer(config.getDebugOutputDir()).export(frame.getFrameData(), analysis);
    }

    public void cancelSession(String sessionId) {
        AnalysisSession session = sessions.remove(sessionId);
        if (session != null) {
            session.cancel();
            session.close();
            LOG.info("Session {} cancelled", sessionId);
        }
    }

    public void closeSession(String sessionId) {
        AnalysisSession session = sessions.remove(sessionId);
        if (session != null) {
            session.close();
            LOG.info("Session {} closed", sessionId);
        }
    }

    public boolean hasSession(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    private AnalysisSession session(String sessionId) {
        AnalysisSession session = sessions.get(sessionId);
        if (session == null) {
            throw new IllegalArgumentException("Unknown session: " + sessionId);
        }
        return session;
    }

    private BallDetectionEngine engineFor(SnookerAnalysisConfig config) {
        if (sharedEngine != null) {
            return sharedEngine;
        }
        return engines.computeIfAbsent(config.getModelPath(), path -> new BallDetectionEngine(config));
    }

    @Override
    public void close() {
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            cancelSession(sessionId);
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Video analysis tasks did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        engines.values().forEach(BallDetectionEngine::close);
        engines.clear();
        LOG.info("Detection API closed");
    }
}
