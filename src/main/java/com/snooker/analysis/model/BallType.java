package com.snooker.analysis.model;

import java.util.Optional;

/**
 * 斯诺克球类型，classId 与检测模型输出的类别顺序一致
 */
public enum BallType {

    CUE(0, "cue_ball", 1, 255, 255, 255),
    YELLOW(1, "yellow_ball", 1, 0, 255, 255),
    RED(2, "red_ball", 15, 0, 0, 255),
    BROWN(3, "brown_ball", 1, 42, 42, 165),
    GREEN(4, "green_ball", 1, 0, 128, 0),
    PINK(5, "pink_ball", 1, 147, 20, 255),
    BLUE(6, "blue_ball", 1, 255, 0, 0),
    BLACK(7, "black_ball", 1, 0, 0, 0);

    private final int classId;
    private final String displayName;
    private final int maxCount;
    private final int blue;
    private final int green;
    private final int red;

    BallType(int classId, String displayName, int maxCount, int blue, int green, int red) {
        this.classId = classId;
        this.displayName = displayName;
        this.maxCount = maxCount;
        this.blue = blue;
        this.green = green;
        this.red = red;
    }

    public static Optional<BallType> fromClassId(int classId) {
        for (BallType type : values()) {
            if (type.classId == classId) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public int getClassId() {
        return classId;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 球台上该类型球的最大数量（红球15个，其余各1个）
     */
    public int getMaxCount() {
        return maxCount;
    }

    public boolean isUnique() {
        return maxCount == 1;
    }

    /**
     * 绘图颜色（BGR）
     */
    public double[] bgr() {
        return new double[]{blue, green, red};
    }
}
