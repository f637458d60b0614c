package com.snooker.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.io.Serializable;

/**
 * 像素空间的轴对齐边界框
 * 约束：x2 >= x1, y2 >= y1
 */
@Value
public class BoundingBox implements Serializable {

    private static final long serialVersionUID = 1L;

    double x1;  // 左上角x
    double y1;  // 左上角y
    double x2;  // 右下角x
    double y2;  // 右下角y

    @JsonCreator
    public BoundingBox(@JsonProperty("x1") double x1,
                       @JsonProperty("y1") double y1,
                       @JsonProperty("x2") double x2,
                       @JsonProperty("y2") double y2) {
        if (x2 < x1 || y2 < y1) {
            throw new IllegalArgumentException(String.format(
                    "Malformed bounding box (%.1f, %.1f, %.1f, %.1f)", x1, y1, x2, y2));
        }
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    /**
     * 以中心点和半边长构造
     */
    public static BoundingBox around(Point center, double halfWidth, double halfHeight) {
        return new BoundingBox(center.getX() - halfWidth, center.getY() - halfHeight,
                center.getX() + halfWidth, center.getY() + halfHeight);
    }

    public Point center() {
        return new Point((x1 + x2) / 2, (y1 + y2) / 2);
    }

    public double width() {
        return x2 - x1;
    }

    public double height() {
        return y2 - y1;
    }

    public double area() {
        return width() * height();
    }

    public boolean contains(Point p) {
        return p.getX() >= x1 && p.getX() <= x2 && p.getY() >= y1 && p.getY() <= y2;
    }

    /**
     * 交并比
     */
    public double iou(BoundingBox other) {
        double ix1 = Math.max(x1, other.x1);
        double iy1 = Math.max(y1, other.y1);
        double ix2 = Math.min(x2, other.x2);
        double iy2 = Math.min(y2, other.y2);

        double intersection = Math.max(0, ix2 - ix1) * Math.max(0, iy2 - iy1);
        double union = area() + other.area() - intersection;
        return union > 0 ? intersection / union : 0;
    }
}
