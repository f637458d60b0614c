package com.snooker.analysis.calibration;

import com.snooker.analysis.exception.CoordinateException;
import com.snooker.analysis.exception.SnookerAnalysisException;
import com.snooker.analysis.model.CalibrationData;
import com.snooker.analysis.model.Point;
import com.snooker.analysis.util.ImageUtils;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.List;

/**
 * 像素坐标与球台坐标（米）之间的互相转换
 * 只持有一份标定及其正/逆矩阵，标定变化时重新创建
 */
public class CoordinateTransformer implements AutoCloseable {

    private final CalibrationData calibration;
    private final Mat pixelToTable;
    private final Mat tableToPixel;

    public CoordinateTransformer(CalibrationData calibration) {
        ImageUtils.init();
        this.calibration = calibration;
        if (calibration != null && calibration.usable()) {
            this.pixelToTable = Homographies.toMat(calibration.getHomography());
            this.tableToPixel = pixelToTable.inv();
        } else {
            this.pixelToTable = null;
            this.tableToPixel = null;
        }
    }

    public CalibrationData getCalibration() {
        return calibration;
    }

    public boolean isReady() {
        return pixelToTable != null;
    }

    /**
     * 像素 -> 球台（米）
     *
     * @throws CoordinateException 标定缺失或无效
     */
    public Point pixelToTable(Point pixel) {
        return transformTrajectory(Collections.singletonList(pixel)).get(0);
    }

    /**
     * 球台（米） -> 像素
     */
    public Point tableToPixel(Point table) {
        requireCalibration();
        return Homographies.transform(tableToPixel, Collections.singletonList(table)).get(0);
    }

    /**
     * 将像素轨迹整体转换到球台坐标
     */
    public List<Point> transformTrajectory(List<Point> pixels) {
        requireCalibration();
        List<Point> result = Homographies.transform(pixelToTable, pixels);
        for (Point p : result) {
            if (!p.hasFiniteCoordinates()) {
                throw new CoordinateException(calibration.getFrameNumber(),
                        "Point maps to infinity under current homography");
            }
        }
        return result;
    }

    /**
     * 像素点是否落在球台台面内
     */
    public boolean isOnTable(Point pixel) {
        Point table = pixelToTable(pixel);
        return table.getX() >= 0 && table.getX() <= calibration.getTableLength()
                && table.getY() >= 0 && table.getY() <= calibration.getTableWidth();
    }

    private void requireCalibration() {
        if (pixelToTable == null) {
            throw new CoordinateException(SnookerAnalysisException.NO_FRAME,
                    calibration == null ? "No calibration available" : "Calibration is not valid");
        }
    }

    @Override
    public void close() {
        ImageUtils.safeRelease(pixelToTable);
        ImageUtils.safeRelease(tableToPixel);
    }
}
