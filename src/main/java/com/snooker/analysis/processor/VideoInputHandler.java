package com.snooker.analysis.processor;

import com.snooker.analysis.model.VideoFrame;
import com.snooker.analysis.util.ImageUtils;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * 视频输入：从文件或流地址逐帧读取，输出 JPEG 编码的 {@link VideoFrame}
 *
 * 帧号取自解码序号，严格递增；限帧时被跳过的帧号留空。
 * 读到流末尾时返回 {@code Optional.empty()}。
 */
@Slf4j
public class VideoInputHandler implements AutoCloseable {

    private static final int JPEG_QUALITY = 90;

    private final String source;
    private final String sessionId;
    private final double maxFps;

    private FFmpegFrameGrabber grabber;
    private long grabIndex = -1;
    private long lastEmittedTimestamp = Long.MIN_VALUE;
    private long framesEmitted;
    private boolean finished;

    public VideoInputHandler(String source, String sessionId) {
        this(source, sessionId, 0);
    }

    /**
     * @param maxFps 输出帧率上限，0 表示不限制
     */
    public VideoInputHandler(String source, String sessionId, double maxFps) {
        this.source = source;
        this.sessionId = sessionId;
        this.maxFps = maxFps;
    }

    public synchronized void open() throws IOException {
        if (grabber != null) {
            return;
        }
        ImageUtils.init();
        FFmpegFrameGrabber g = new FFmpegFrameGrabber(source);
        g.setPixelFormat(avutil.AV_PIX_FMT_BGR24);
        if (source.startsWith("rtsp://")) {
            g.setOption("rtsp_transport", "tcp");
        }
        try {
            g.start();
        } catch (FrameGrabber.Exception e) {
            releaseQuietly(g);
            throw new IOException("Failed to open video source: " + source, e);
        }
        grabber = g;
        log.info("Opened video source {} for session {}: {}x{} @ {} fps, {} frames",
                source, sessionId, g.getImageWidth(), g.getImageHeight(),
                String.format("%.2f", g.getFrameRate()), g.getLengthInFrames());
    }

    /**
     * 读取下一帧
     *
     * @return 下一帧；流结束时为 empty
     */
    public synchronized Optional<VideoFrame> nextFrame() throws IOException {
        if (finished) {
            return Optional.empty();
        }
        open();
        long minInterval = maxFps > 0 ? (long) (1000.0 / maxFps) : 0;

        while (true) {
            Frame frame;
            try {
                frame = grabber.grabImage();
            } catch (FrameGrabber.Exception e) {
                throw new IOException("Failed to grab frame from " + source, e);
            }
            if (frame == null) {
                finished = true;
                log.info("End of video source {} after {} frames", source, framesEmitted);
                return Optional.empty();
            }
            grabIndex++;

            long timestamp = grabber.getTimestamp() / 1000;
            // 时间戳不可靠时按帧率推算，保证递增
            if (timestamp <= lastEmittedTimestamp && lastEmittedTimestamp != Long.MIN_VALUE) {
                timestamp = lastEmittedTimestamp + Math.max(1, Math.round(1000.0 / fpsOrDefault()));
            }
            if (minInterval > 0 && lastEmittedTimestamp != Long.MIN_VALUE
                    && timestamp - lastEmittedTimestamp < minInterval) {
                continue;
            }

            byte[] jpeg = toJpeg(frame);
            if (jpeg.length == 0) {
                log.warn("Skipping undecodable frame {} from {}", grabIndex, source);
                continue;
            }
            lastEmittedTimestamp = timestamp;
            framesEmitted++;

            return Optional.of(VideoFrame.builder()
                    .sessionId(sessionId)
                    .frameNumber(grabIndex)
                    .timestamp(timestamp)
                    .frameData(jpeg)
                    .metadata(VideoFrame.FrameMetadata.builder()
                            .width(frame.imageWidth)
                            .height(frame.imageHeight)
                            .fps(fpsOrDefault())
                            .codec(grabber.getVideoCodecName())
                            .build())
                    .build());
        }
    }

    /**
     * BGR24 帧拷贝为 OpenCV Mat 后编码为 JPEG
     */
    private static byte[] toJpeg(Frame frame) {
        if (frame.image == null || frame.imageChannels != 3 || !(frame.image[0] instanceof ByteBuffer)) {
            return new byte[0];
        }
        ByteBuffer buffer = ((ByteBuffer) frame.image[0]).duplicate();
        int width = frame.imageWidth;
        int height = frame.imageHeight;
        byte[] row = new byte[width * 3];

        Mat mat = new Mat(height, width, CvType.CV_8UC3);
        try {
            for (int y = 0; y < height; y++) {
                buffer.position(y * frame.imageStride);
                buffer.get(row);
                mat.put(y, 0, row);
            }
            return ImageUtils.encodeJpeg(mat, JPEG_QUALITY);
        } finally {
            ImageUtils.safeRelease(mat);
        }
    }

    private double fpsOrDefault() {
        double fps = grabber == null ? 0 : grabber.getFrameRate();
        return fps > 0 ? fps : 25.0;
    }

    public synchronized double getFps() {
        return fpsOrDefault();
    }

    /**
     * 总帧数，直播流未知时为 0
     */
    public synchronized int getFrameCount() {
        return grabber == null ? 0 : Math.max(0, grabber.getLengthInFrames());
    }

    public synchronized long getFramesEmitted() {
        return framesEmitted;
    }

    public String getSource() {
        return source;
    }

    @Override
    public synchronized void close() {
        if (grabber != null) {
            releaseQuietly(grabber);
            grabber = null;
        }
        finished = true;
    }

    private static void releaseQuietly(FFmpegFrameGrabber g) {
        try {
            g.stop();
            g.release();
        } catch (Exception e) {
            log.error("Error stopping/releasing grabber", e);
        }
    }
}
