package com.snooker.analysis.model;

/**
 * 轨迹生命周期状态
 * TENTATIVE -> ACTIVE <-> OCCLUDED -> POTTED | DELETED
 */
public enum TrackState {
    TENTATIVE,
    ACTIVE,
    OCCLUDED,
    POTTED,
    DELETED;

    public boolean isLive() {
        return this == TENTATIVE || this == ACTIVE || this == OCCLUDED;
    }

    public boolean isTerminal() {
        return this == POTTED || this == DELETED;
    }
}
