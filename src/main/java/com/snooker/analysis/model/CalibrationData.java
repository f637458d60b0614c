package com.snooker.analysis.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.List;

/**
 * 球台标定结果
 * 重新标定时整体替换，不做原地修改
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CalibrationData implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 像素 -> 球台坐标 的单应矩阵，行优先 3x3
     */
    double[][] homography;

    /**
     * 球台四角像素坐标，顺序：左上、右上、右下、左下
     */
    @Singular
    List<Point> tableCorners;

    /**
     * 球台长度（米）
     */
    double tableLength;

    /**
     * 球台宽度（米）
     */
    double tableWidth;

    /**
     * 六个袋口区域（像素坐标）
     */
    @Singular
    List<BoundingBox> pocketRegions;

    /**
     * 四角重投影误差（米）
     */
    double reprojectionError;

    long timestamp;

    /**
     * 标定所用帧号
     */
    long frameNumber;

    boolean valid;

    /**
     * 尚未建立标定时的占位数据
     */
    public static CalibrationData uncalibrated(double tableLength, double tableWidth) {
        return CalibrationData.builder()
                .tableLength(tableLength)
                .tableWidth(tableWidth)
                .timestamp(System.currentTimeMillis())
                .valid(false)
                .build();
    }

    public double[][] getHomography() {
        if (homography == null) {
            return null;
        }
        double[][] copy = new double[homography.length][];
        for (int i = 0; i < homography.length; i++) {
            copy[i] = homography[i].clone();
        }
        return copy;
    }

    /**
     * 是否可以用于坐标变换
     */
    public boolean usable() {
        return valid && homography != null && tableCorners.size() == 4;
    }

    /**
     * 以失效状态复制当前数据
     */
    public CalibrationData invalidated() {
        return toBuilder().valid(false).build();
    }
}
