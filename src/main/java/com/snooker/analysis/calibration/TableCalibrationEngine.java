package com.snooker.analysis.calibration;

import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.exception.CalibrationException;
import com.snooker.analysis.model.BoundingBox;
import com.snooker.analysis.model.CalibrationData;
import com.snooker.analysis.model.Point;
import com.snooker.analysis.util.ImageUtils;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 球台标定引擎
 *
 * 边缘检测 + Hough直线找到台边，交点得到四个角点，
 * 再求解像素到球台坐标（米）的单应矩阵。
 * 新标定未通过校验前，旧标定始终有效。
 */
public class TableCalibrationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TableCalibrationEngine.class);

    private static final long NO_FRAME = -1L;

    // 边缘与直线检测参数
    private static final double CANNY_LOW = 50;
    private static final double CANNY_HIGH = 150;
    private static final int HOUGH_THRESHOLD = 100;
    private static final double ANGLE_TOLERANCE_DEG = 20;
    private static final double DUPLICATE_LINE_DISTANCE = 30;

    private final double tableLength;
    private final double tableWidth;
    private final double pocketRadius;
    private final int calibrationInterval;
    private final double reprojectionTolerance;
    private final double residualTolerance;
    private final int residualCheckInterval;
    private final int retryBudget;

    private final CalibrationPersistence persistence;
    private final String cameraId;

    private volatile CalibrationData calibrationData;
    private volatile CalibrationState state = CalibrationState.UNCALIBRATED;

    private long lastCalibrationFrame = NO_FRAME;
    private long lastResidualCheckFrame = NO_FRAME;
    private int consecutiveFailures;
    private int totalAttempts;

    public TableCalibrationEngine(SnookerAnalysisConfig config) {
        this(config, config.getCameraId() == null ? null
                : new CalibrationPersistence(config.getCalibrationCacheDir(), config.getCalibrationCacheMaxAgeHours()));
    }

    public TableCalibrationEngine(SnookerAnalysisConfig config, CalibrationPersistence persistence) {
        ImageUtils.init();
        this.tableLength = config.getTableLength();
        this.tableWidth = config.getTableWidth();
        this.pocketRadius = config.getPocketRadius();
        this.calibrationInterval = config.getCalibrationInterval();
        this.reprojectionTolerance = config.getReprojectionTolerance();
        this.residualTolerance = config.getResidualTolerance();
        this.residualCheckInterval = config.getResidualCheckInterval();
        this.retryBudget = config.getCalibrationRetryBudget();
        this.persistence = persistence;
        this.cameraId = config.getCameraId();
        this.calibrationData = CalibrationData.uncalibrated(tableLength, tableWidth);
    }

    /**
     * 对一帧图像尝试标定，返回当前生效的标定（可能仍是旧的）
     */
    public synchronized CalibrationData calibrate(Mat frame, long frameNumber) {
        List<Point> corners = detectTableCorners(frame);
        if (corners.size() != 4) {
            enterCalibration();
            recordFailure(new CalibrationException(frameNumber,
                    "Table boundary not found (" + corners.size() + " corners)"));
            return calibrationData;
        }
        return calibrateFromCorners(corners, frameNumber);
    }

    /**
     * 由已知四角点（左上、右上、右下、左下）直接标定
     */
    public synchronized CalibrationData calibrateFromCorners(List<Point> corners, long frameNumber) {
        enterCalibration();
        try {
            CalibrationData candidate = buildCalibration(corners, frameNumber);
            accept(candidate, frameNumber);
        } catch (CalibrationException e) {
            recordFailure(e);
        }
        return calibrationData;
    }

    /**
     * 将缓存的标定作为假设载入，重新校验通过后才采用
     */
    public synchronized boolean loadHypothesis(CalibrationData cached) {
        if (cached == null || cached.getTableCorners().size() != 4) {
            return false;
        }
        if (cached.getTableLength() != tableLength || cached.getTableWidth() != tableWidth) {
            LOG.info("Cached calibration is for a different table size, ignoring");
            return false;
        }
        try {
            CalibrationData verified = buildCalibration(cached.getTableCorners(), cached.getFrameNumber());
            calibrationData = verified;
            state = CalibrationState.CALIBRATED;
            consecutiveFailures = 0;
            // 下一帧立即做残差检查，确认摄像头没有移动
            lastCalibrationFrame = NO_FRAME;
            lastResidualCheckFrame = NO_FRAME;
            LOG.info("Adopted cached calibration hypothesis (error {})",
                    String.format("%.5f", verified.getReprojectionError()));
            return true;
        } catch (CalibrationException e) {
            LOG.warn("Cached calibration rejected: {}", e.diagnostic());
            return false;
        }
    }

    /**
     * 从持久化缓存加载
     */
    public boolean loadCached() {
        if (persistence == null) {
            return false;
        }
        Optional<CalibrationData> cached = persistence.load(cameraId);
        return cached.isPresent() && loadHypothesis(cached.get());
    }

    /**
     * 本帧是否需要进行（重新）标定
     */
    public synchronized boolean needsCalibration(long frameNumber) {
        if (state != CalibrationState.CALIBRATED) {
            return true;
        }
        return lastCalibrationFrame != NO_FRAME && frameNumber - lastCalibrationFrame >= calibrationInterval;
    }

    /**
     * 本帧是否应做摄像头移动检查
     */
    public synchronized boolean isResidualCheckDue(long frameNumber) {
        if (state != CalibrationState.CALIBRATED || residualCheckInterval <= 0) {
            return false;
        }
        return lastResidualCheckFrame == NO_FRAME || frameNumber - lastResidualCheckFrame >= residualCheckInterval;
    }

    /**
     * 用当前帧重新检测的角点计算残差，超限时请求重新标定
     */
    public synchronized OptionalDouble checkResidual(Mat frame, long frameNumber) {
        lastResidualCheckFrame = frameNumber;
        if (lastCalibrationFrame == NO_FRAME) {
            lastCalibrationFrame = frameNumber;
        }
        List<Point> corners = detectTableCorners(frame);
        if (corners.size() != 4) {
            LOG.debug("Residual check skipped at frame={}: corners not found", frameNumber);
            return OptionalDouble.empty();
        }
        double residual = residualOf(corners);
        if (residual > residualTolerance) {
            LOG.info("Camera movement suspected at frame={} (residual {} m), recalibrating",
                    frameNumber, String.format("%.4f", residual));
            requestRecalibration();
        }
        return OptionalDouble.of(residual);
    }

    /**
     * 角点经当前单应变换后与标准角点的平均距离（米）
     */
    public synchronized double residualOf(List<Point> corners) {
        if (!calibrationData.usable()) {
            return Double.POSITIVE_INFINITY;
        }
        Mat h = Homographies.toMat(calibrationData.getHomography());
        try {
            return Homographies.meanDistance(Homographies.transform(h, corners), canonicalCorners());
        } finally {
            h.release();
        }
    }

    public synchronized void requestRecalibration() {
        if (state == CalibrationState.CALIBRATED) {
            state = CalibrationState.RECALIBRATING;
        }
    }

    public synchronized void reset() {
        calibrationData = CalibrationData.uncalibrated(tableLength, tableWidth);
        state = CalibrationState.UNCALIBRATED;
        lastCalibrationFrame = NO_FRAME;
        lastResidualCheckFrame = NO_FRAME;
        consecutiveFailures = 0;
        LOG.info("Calibration data reset");
    }

    public boolean isCalibrated() {
        return calibrationData.usable();
    }

    public CalibrationData getCalibrationData() {
        return calibrationData;
    }

    public CalibrationState getState() {
        return state;
    }

    /**
     * 当前像素->球台单应矩阵，未标定时为 null
     */
    public double[][] transformMatrix() {
        CalibrationData data = calibrationData;
        return data.usable() ? data.getHomography() : null;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized int getTotalAttempts() {
        return totalAttempts;
    }

    private void enterCalibration() {
        totalAttempts++;
        if (state == CalibrationState.UNCALIBRATED) {
            state = CalibrationState.CALIBRATING;
        } else if (state == CalibrationState.CALIBRATED) {
            state = CalibrationState.RECALIBRATING;
        }
    }

    private void accept(CalibrationData candidate, long frameNumber) {
        calibrationData = candidate;
        state = CalibrationState.CALIBRATED;
        consecutiveFailures = 0;
        lastCalibrationFrame = frameNumber;
        lastResidualCheckFrame = frameNumber;
        LOG.info("Table calibration successful at frame={} (reprojection error {} m)",
                frameNumber, String.format("%.5f", candidate.getReprojectionError()));
        if (persistence != null) {
            persistence.save(cameraId, candidate);
        }
    }

    private void recordFailure(CalibrationException e) {
        consecutiveFailures++;
        LOG.warn("Calibration attempt failed: {}", e.diagnostic());

        if (state == CalibrationState.CALIBRATING) {
            state = CalibrationState.UNCALIBRATED;
        } else if (state == CalibrationState.RECALIBRATING && consecutiveFailures > retryBudget) {
            LOG.error("Recalibration failed {} times in a row, calibration invalidated", consecutiveFailures);
            calibrationData = calibrationData.invalidated();
            state = CalibrationState.UNCALIBRATED;
        }
    }

    /**
     * 几何标定与校验，失败抛出 {@link CalibrationException}
     */
    CalibrationData buildCalibration(List<Point> corners, long frameNumber) {
        if (corners == null || corners.size() != 4) {
            throw new CalibrationException(frameNumber, "Exactly 4 table corners are required");
        }
        for (Point corner : corners) {
            if (!corner.hasFiniteCoordinates()) {
                throw new CalibrationException(frameNumber, "Corner is not finite: " + corner);
            }
        }
        if (!isConvexQuad(corners)) {
            throw new CalibrationException(frameNumber, "Corners do not form a convex quadrilateral");
        }

        List<Point> canonical = canonicalCorners();
        MatOfPoint2f src = Homographies.toMatOfPoint2f(corners);
        MatOfPoint2f dst = Homographies.toMatOfPoint2f(canonical);
        Mat homography = null;
        Mat inverse = null;
        try {
            homography = Imgproc.getPerspectiveTransform(src, dst);
            if (!Homographies.isFiniteAndNonSingular(homography)) {
                throw new CalibrationException(frameNumber, "Homography is singular or not finite");
            }
            inverse = homography.inv();

            // 正向重投影误差与往返误差
            double forward = Homographies.meanDistance(Homographies.transform(homography, corners), canonical);
            List<Point> back = Homographies.transform(inverse, canonical);
            double roundTrip = Homographies.meanDistance(Homographies.transform(homography, back), canonical);
            double error = Math.max(forward, roundTrip);
            if (!(error <= reprojectionTolerance)) {
                throw new CalibrationException(frameNumber, String.format(
                        "Reprojection error %.5f m exceeds tolerance %.5f m", error, reprojectionTolerance));
            }

            return CalibrationData.builder()
                    .homography(Homographies.toArray(homography))
                    .tableCorners(corners)
                    .tableLength(tableLength)
                    .tableWidth(tableWidth)
                    .pocketRegions(pocketRegions(inverse))
                    .reprojectionError(error)
                    .timestamp(System.currentTimeMillis())
                    .frameNumber(frameNumber)
                    .valid(true)
                    .build();
        } catch (CalibrationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CalibrationException(frameNumber, "Homography calculation failed", e);
        } finally {
            src.release();
            dst.release();
            ImageUtils.safeRelease(homography);
            ImageUtils.safeRelease(inverse);
        }
    }

    /**
     * 球台标准角点（米）：(0,0),(L,0),(L,W),(0,W)
     */
    List<Point> canonicalCorners() {
        return Arrays.asList(
                new Point(0, 0),
                new Point(tableLength, 0),
                new Point(tableLength, tableWidth),
                new Point(0, tableWidth));
    }

    /**
     * 六个袋口中心（米）：四角及长边中点
     */
    List<Point> canonicalPockets() {
        return Arrays.asList(
                new Point(0, 0),
                new Point(tableLength / 2, 0),
                new Point(tableLength, 0),
                new Point(0, tableWidth),
                new Point(tableLength / 2, tableWidth),
                new Point(tableLength, tableWidth));
    }

    private List<BoundingBox> pocketRegions(Mat tableToPixel) {
        List<BoundingBox> regions = new ArrayList<>();
        for (Point pocket : canonicalPockets()) {
            List<Point> square = Arrays.asList(
                    new Point(pocket.getX() - pocketRadius, pocket.getY() - pocketRadius),
                    new Point(pocket.getX() + pocketRadius, pocket.getY() - pocketRadius),
                    new Point(pocket.getX() + pocketRadius, pocket.getY() + pocketRadius),
                    new Point(pocket.getX() - pocketRadius, pocket.getY() + pocketRadius));
            List<Point> pixels = Homographies.transform(tableToPixel, square);

            double minX = Double.POSITIVE_INFINITY;
            double minY = Double.POSITIVE_INFINITY;
            double maxX = Double.NEGATIVE_INFINITY;
            double maxY = Double.NEGATIVE_INFINITY;
            for (Point p : pixels) {
                minX = Math.min(minX, p.getX());
                minY = Math.min(minY, p.getY());
                maxX = Math.max(maxX, p.getX());
                maxY = Math.max(maxY, p.getY());
            }
            regions.add(new BoundingBox(minX, minY, maxX, maxY));
        }
        return regions;
    }

    private static boolean isConvexQuad(List<Point> corners) {
        int sign = 0;
        for (int i = 0; i < 4; i++) {
            Point a = corners.get(i);
            Point b = corners.get((i + 1) % 4);
            Point c = corners.get((i + 2) % 4);
            double cross = (b.getX() - a.getX()) * (c.getY() - b.getY())
                    - (b.getY() - a.getY()) * (c.getX() - b.getX());
            if (Math.abs(cross) < 1e-9) {
                return false;
            }
            int s = cross > 0 ? 1 : -1;
            if (sign == 0) {
                sign = s;
            } else if (s != sign) {
                return false;
            }
        }
        return true;
    }

    /**
     * 检测球台四角（左上、右上、右下、左下），失败返回空列表
     */
    public List<Point> detectTableCorners(Mat frame) {
        if (frame == null || frame.empty()) {
            return Collections.emptyList();
        }

        Mat gray = new Mat();
        Mat blurred = new Mat();
        Mat edges = new Mat();
        Mat kernel = Mat.ones(3, 3, CvType.CV_8U);
        Mat lines = new Mat();
        try {
            if (frame.channels() == 1) {
                frame.copyTo(gray);
            } else {
                Imgproc.cvtColor(frame, gray, Imgproc.COLOR_BGR2GRAY);
            }
            // 高斯模糊降噪
            Imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            Imgproc.Canny(blurred, edges, CANNY_LOW, CANNY_HIGH);
            // 闭运算连接断开的边缘
            Imgproc.morphologyEx(edges, edges, Imgproc.MORPH_CLOSE, kernel);
            Imgproc.HoughLines(edges, lines, 1, Math.PI / 180, HOUGH_THRESHOLD);

            if (lines.rows() < 4) {
                LOG.debug("Insufficient lines detected for table corner detection: {}", lines.rows());
                return Collections.emptyList();
            }
            return cornersFromLines(lines, frame.cols(), frame.rows());
        } catch (RuntimeException e) {
            LOG.error("Corner detection failed", e);
            return Collections.emptyList();
        } finally {
            gray.release();
            blurred.release();
            edges.release();
            kernel.release();
            lines.release();
        }
    }

    private List<Point> cornersFromLines(Mat lines, int width, int height) {
        double cx = width / 2.0;
        double cy = height / 2.0;
        List<double[]> horizontal = new ArrayList<>();
        List<double[]> vertical = new ArrayList<>();

        // HoughLines 按票数降序输出，同一位置附近只保留最强的一条
        for (int i = 0; i < lines.rows(); i++) {
            double[] line = lines.get(i, 0);
            double rho = line[0];
            double theta = line[1];
            double deg = Math.toDegrees(theta);

            if (Math.abs(deg - 90) < ANGLE_TOLERANCE_DEG) {
                double y = (rho - cx * Math.cos(theta)) / Math.sin(theta);
                addIfDistinct(horizontal, new double[]{rho, theta, y});
            } else if (deg < ANGLE_TOLERANCE_DEG || deg > 180 - ANGLE_TOLERANCE_DEG) {
                double x = (rho - cy * Math.sin(theta)) / Math.cos(theta);
                addIfDistinct(vertical, new double[]{rho, theta, x});
            }
        }

        if (horizontal.size() < 2 || vertical.size() < 2) {
            LOG.debug("Insufficient horizontal ({}) or vertical ({}) lines", horizontal.size(), vertical.size());
            return Collections.emptyList();
        }

        // 最外侧的两条水平线和两条竖直线即台边
        horizontal.sort((a, b) -> Double.compare(a[2], b[2]));
        vertical.sort((a, b) -> Double.compare(a[2], b[2]));
        double[] top = horizontal.get(0);
        double[] bottom = horizontal.get(horizontal.size() - 1);
        double[] left = vertical.get(0);
        double[] right = vertical.get(vertical.size() - 1);

        List<Point> corners = new ArrayList<>(4);
        for (double[][] pair : new double[][][]{{top, left}, {top, right}, {bottom, right}, {bottom, left}}) {
            Optional<Point> corner = intersect(pair[0], pair[1]);
            if (!corner.isPresent()) {
                return Collections.emptyList();
            }
            corners.add(corner.get());
        }
        return corners;
    }

    private static void addIfDistinct(List<double[]> group, double[] candidate) {
        for (double[] existing : group) {
            if (Math.abs(existing[2] - candidate[2]) < DUPLICATE_LINE_DISTANCE) {
                return;
            }
        }
        group.add(candidate);
    }

    /**
     * 极坐标形式两直线交点
     */
    private static Optional<Point> intersect(double[] a, double[] b) {
        double cos1 = Math.cos(a[1]);
        double sin1 = Math.sin(a[1]);
        double cos2 = Math.cos(b[1]);
        double sin2 = Math.sin(b[1]);
        double det = cos1 * sin2 - sin1 * cos2;
        if (Math.abs(det) < 1e-6) {
            return Optional.empty();
        }
        double x = (sin2 * a[0] - sin1 * b[0]) / det;
        double y = (cos1 * b[0] - cos2 * a[0]) / det;
        return Optional.of(new Point(x, y));
    }
}
