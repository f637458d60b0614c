package com.snooker.analysis.detection;

import com.snooker.analysis.exception.DetectionException;
import org.opencv.core.Mat;

import java.util.List;

/**
 * 球检测模型的抽象，对引擎而言是一个黑盒
 */
public interface BallClassifier extends AutoCloseable {

    /**
     * 对一帧BGR图像做推理，返回原图坐标下的候选框
     *
     * @throws DetectionException 推理失败
     */
    List<RawDetection> classify(Mat image);

    /**
     * 日志中使用的模型描述
     */
    String name();

    @Override
    default void close() {
    }
}
