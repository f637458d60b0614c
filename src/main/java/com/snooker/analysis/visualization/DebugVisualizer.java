package com.snooker.analysis.visualization;

import com.snooker.analysis.model.BallType;
import com.snooker.analysis.model.BoundingBox;
import com.snooker.analysis.model.CalibrationData;
import com.snooker.analysis.model.Detection;
import com.snooker.analysis.model.FrameAnalysis;
import com.snooker.analysis.model.Point;
import com.snooker.analysis.model.TrackState;
import com.snooker.analysis.model.TrackedBall;
import com.snooker.analysis.util.ImageUtils;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 调试用标注图：检测框、球台边界、袋口、轨迹和帧信息
 */
public class DebugVisualizer {

    private static final Logger LOG = LoggerFactory.getLogger(DebugVisualizer.class);

    private static final Scalar TABLE_COLOR = new Scalar(0, 255, 0);
    private static final Scalar POCKET_COLOR = new Scalar(0, 0, 255);
    private static final Scalar TEXT_COLOR = new Scalar(255, 255, 255);
    private static final Scalar STALE_COLOR = new Scalar(0, 165, 255);
    private static final double FONT_SCALE = 0.5;

    private final Path outputDir;

    public DebugVisualizer(String outputDir) {
        ImageUtils.init();
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 在原图副本上绘制分析结果
     */
    public Mat annotate(Mat image, FrameAnalysis analysis) {
        Mat canvas = image.clone();
        drawCalibration(canvas, analysis.getCalibrationData(), analysis.isCalibrationStale());
        for (TrackedBall ball : analysis.getTrackedBalls()) {
            drawTrajectory(canvas, ball);
        }
        for (Detection detection : analysis.getDetections()) {
            drawDetection(canvas, detection);
        }
        drawFrameInfo(canvas, analysis);
        return canvas;
    }

    /**
     * 解码、标注并重新编码为 JPEG
     */
    public byte[] annotateJpeg(byte[] frameData, FrameAnalysis analysis) {
        Mat image = ImageUtils.decodeImage(frameData);
        Mat annotated = null;
        try {
            if (image.empty()) {
                throw new IllegalArgumentException("Frame data cannot be decoded");
            }
            annotated = annotate(image, analysis);
            return ImageUtils.encodeJpeg(annotated);
        } finally {
            ImageUtils.safeRelease(image);
            ImageUtils.safeRelease(annotated);
        }
    }

    /**
     * 写入 {@code <outputDir>/<sessionId>/frame_<n>.jpg}
     */
    public Path export(byte[] frameData, FrameAnalysis analysis) throws IOException {
        byte[] jpeg = annotateJpeg(frameData, analysis);
        Path dir = outputDir.resolve(analysis.getSessionId() == null ? "default" : analysis.getSessionId());
        Files.createDirectories(dir);
        Path file = dir.resolve(String.format("frame_%06d.jpg", analysis.getFrameNumber()));
        Files.write(file, jpeg);
        LOG.debug("Exported annotated frame {} to {}", analysis.getFrameNumber(), file);
        return file;
    }

    private void drawDetection(Mat canvas, Detection detection) {
        BoundingBox box = detection.getBbox();
        Scalar color = colorOf(detection.ballType());
        Imgproc.rectangle(canvas, cv(box.getX1(), box.getY1()), cv(box.getX2(), box.getY2()), color, 2);
        String label = String.format("%s %.2f", detection.ballType().getDisplayName(), detection.getConfidence());
        Imgproc.putText(canvas, label, cv(box.getX1(), Math.max(12, box.getY1() - 4)),
                Imgproc.FONT_HERSHEY_SIMPLEX, FONT_SCALE, color, 1);
    }

    private void drawCalibration(Mat canvas, CalibrationData calibration, boolean stale) {
        if (calibration == null || calibration.getTableCorners().size() != 4) {
            return;
        }
        Scalar tableColor = stale || !calibration.isValid() ? STALE_COLOR : TABLE_COLOR;
        List<org.opencv.core.Point> corners = new ArrayList<>();
        for (Point p : calibration.getTableCorners()) {
            corners.add(cv(p.getX(), p.getY()));
        }
        MatOfPoint polygon = new MatOfPoint();
        polygon.fromList(corners);
        try {
            Imgproc.polylines(canvas, Collections.singletonList(polygon), true, tableColor, 2);
        } finally {
            polygon.release();
        }
        for (BoundingBox pocket : calibration.getPocketRegions()) {
            Point c = pocket.center();
            Imgproc.circle(canvas, cv(c.getX(), c.getY()),
                    (int) Math.round(Math.min(pocket.width(), pocket.height()) / 2), POCKET_COLOR, 2);
        }
    }

    private void drawTrajectory(Mat canvas, TrackedBall ball) {
        if (ball.getState() == TrackState.DELETED) {
            return;
        }
        Scalar color = colorOf(ball.getBallType());
        List<Point> points = ball.getTrajectory();
        for (int i = 1; i < points.size(); i++) {
            Point a = points.get(i - 1);
            Point b = points.get(i);
            Imgproc.line(canvas, cv(a.getX(), a.getY()), cv(b.getX(), b.getY()), color, 1);
        }
        Point current = ball.getCurrentPosition();
        if (current != null) {
            Imgproc.putText(canvas, "#" + ball.getTrackId(), cv(current.getX() + 8, current.getY() + 4),
                    Imgproc.FONT_HERSHEY_SIMPLEX, FONT_SCALE * 0.8, TEXT_COLOR, 1);
        }
    }

    private void drawFrameInfo(Mat canvas, FrameAnalysis analysis) {
        String info = String.format("frame %d  balls %d  tracks %d  %d ms%s",
                analysis.getFrameNumber(),
                analysis.getDetections().size(),
                analysis.activeTracks().size(),
                analysis.getProcessingTime(),
                analysis.isCalibrationStale() ? "  [stale calibration]" : "");
        Imgproc.putText(canvas, info, cv(10, 20), Imgproc.FONT_HERSHEY_SIMPLEX, FONT_SCALE, TEXT_COLOR, 1);
    }

    private static Scalar colorOf(BallType type) {
        double[] bgr = type.bgr();
        return new Scalar(bgr[0], bgr[1], bgr[2]);
    }

    private static org.opencv.core.Point cv(double x, double y) {
        return new org.opencv.core.Point(x, y);
    }
}
