package com.snooker.analysis.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.List;

/**
 * 被跟踪球在某一帧的不可变快照
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrackedBall implements Serializable {

    private static final long serialVersionUID = 1L;

    long trackId;

    BallType ballType;

    /**
     * 当前像素位置（最近一次观测，未观测到时为预测位置）
     */
    Point currentPosition;

    /**
     * 像素/帧
     */
    Point velocity;

    /**
     * 观测到的像素中心点序列
     */
    @Singular("trajectoryPoint")
    List<Point> trajectory;

    @Singular("confidence")
    List<Double> confidenceHistory;

    long lastSeenFrame;

    int framesSinceSeen;

    TrackState state;

    /**
     * 球台坐标（米），标定无效时为 null
     */
    Point tablePosition;

    @Singular("tableTrajectoryPoint")
    List<Point> tableTrajectory;
}
