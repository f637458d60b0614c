package com.snooker.analysis.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * 单帧中的一次球检测结果，创建后不可变
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Detection implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 边界框（像素坐标）
     */
    BoundingBox bbox;

    /**
     * 球类别ID，对应 {@link BallType}
     */
    int classId;

    /**
     * 置信度 (0-1)
     */
    double confidence;

    /**
     * 检测时间戳（毫秒）
     */
    long timestamp;

    /**
     * 球台坐标（米），无有效标定时为 null
     */
    Point tablePosition;

    public Point centroid() {
        return bbox.center();
    }

    public BallType ballType() {
        return BallType.fromClassId(classId)
                .orElseThrow(() -> new IllegalStateException("Unknown ball class id " + classId));
    }
}
