package com.snooker.analysis.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * 轨迹状态变化事件（入袋、丢失等）
 */
@Value
@Builder
@Jacksonized
public class TrackEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public enum Type {
        CREATED,
        ACTIVATED,
        OCCLUDED,
        RECOVERED,
        POTTED,
        DELETED
    }

    Type type;
    long trackId;
    BallType ballType;
    long frameNumber;
    Point position;
}
