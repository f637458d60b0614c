package com.snooker.analysis.tracking;

import com.snooker.analysis.model.BallType;
import com.snooker.analysis.model.Point;
import lombok.Builder;
import lombok.Value;

/**
 * 两球碰撞事件
 */
@Value
@Builder
public class CollisionEvent {
    long firstTrackId;
    BallType firstBallType;
    long secondTrackId;
    BallType secondBallType;
    Point position;
    long frameNumber;
}
