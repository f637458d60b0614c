package com.snooker.analysis.detection;

import lombok.Builder;
import lombok.Value;

/**
 * 分类器输出的原始候选框，尚未校验
 * 坐标为原图像素，可能越界或退化
 */
@Value
@Builder
public class RawDetection {

    double x1;
    double y1;
    double x2;
    double y2;

    int classId;

    double confidence;
}
