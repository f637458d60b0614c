package com.snooker.analysis.tracking;

import com.snooker.analysis.model.BallType;
import com.snooker.analysis.model.TrackState;
import lombok.Builder;
import lombok.Value;

/**
 * 单条轨迹的运动分析结果
 */
@Value
@Builder
public class TrackSummary {

    public enum Motion {
        STATIONARY,
        MOVING,
        POTTED,
        LOST
    }

    long trackId;
    BallType ballType;
    TrackState trackState;
    Motion motion;

    /**
     * 观测点数
     */
    int trajectoryLength;

    /**
     * 像素路程
     */
    double pathLength;

    /**
     * 像素/帧
     */
    double averageSpeed;

    int directionChanges;

    /**
     * 球台路程（米），无球台轨迹时为 0
     */
    double tablePathLength;

    /**
     * 最近几帧出现急转，可能发生了碰撞
     */
    boolean suddenTurn;
}
