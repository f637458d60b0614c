package com.snooker.analysis.tracking;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 会话内全部轨迹的汇总
 */
@Value
@Builder
public class TrajectorySummary {

    int totalBalls;
    int liveBalls;
    int pottedBalls;

    @Singular("motionCount")
    Map<TrackSummary.Motion, Integer> motionCounts;

    double averageTrajectoryLength;
    double totalDistance;

    @Singular
    List<TrackSummary> tracks;
}
