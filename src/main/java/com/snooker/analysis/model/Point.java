package com.snooker.analysis.model;

import lombok.Value;

import java.io.Serializable;

/**
 * 二维坐标点（像素坐标或球台坐标，单位由上下文决定）
 */
@Value
public class Point implements Serializable {

    private static final long serialVersionUID = 1L;

    double x;
    double y;

    public static Point of(double x, double y) {
        return new Point(x, y);
    }

    /**
     * 欧氏距离
     */
    public double distanceTo(Point other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public boolean hasFiniteCoordinates() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
