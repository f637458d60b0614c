package com.snooker.analysis.tracking;

import com.snooker.analysis.model.Point;
import com.snooker.analysis.util.ImageUtils;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.video.KalmanFilter;

/**
 * 匀速模型卡尔曼滤波，状态 [x, y, vx, vy]，观测 [x, y]，时间步长为一帧
 */
class BallKalmanFilter {

    // 初始协方差较大，前几次观测快速收敛
    private static final double INITIAL_UNCERTAINTY = 1000.0;

    private final KalmanFilter filter;
    private Point predicted;

    BallKalmanFilter(Point initial, double processNoise, double measurementNoise) {
        ImageUtils.init();
        this.filter = new KalmanFilter(4, 2, 0, CvType.CV_32F);

        Mat transition = Mat.eye(4, 4, CvType.CV_32F);
        Mat measurement = Mat.zeros(2, 4, CvType.CV_32F);
        Mat processCov = scaledIdentity(4, processNoise);
        Mat measurementCov = scaledIdentity(2, measurementNoise);
        try {
            transition.put(0, 2, 1.0);
            transition.put(1, 3, 1.0);
            filter.set_transitionMatrix(transition);

            measurement.put(0, 0, 1.0);
            measurement.put(1, 1, 1.0);
            filter.set_measurementMatrix(measurement);

            filter.set_processNoiseCov(processCov);
            filter.set_measurementNoiseCov(measurementCov);
        } finally {
            // 滤波器持有数据的引用计数，这里只释放Java侧的Mat头
            ImageUtils.safeRelease(transition);
            ImageUtils.safeRelease(measurement);
            ImageUtils.safeRelease(processCov);
            ImageUtils.safeRelease(measurementCov);
        }
        reinitialize(initial);
    }

    /**
     * 丢弃历史状态，从新位置重新开始（速度归零），复用同一个滤波器
     */
    void reinitialize(Point position) {
        Mat errorCov = scaledIdentity(4, INITIAL_UNCERTAINTY);
        Mat state = new Mat(4, 1, CvType.CV_32F);
        try {
            state.put(0, 0, position.getX(), position.getY(), 0.0, 0.0);
            filter.set_errorCovPost(errorCov);
            filter.set_statePost(state);
        } finally {
            ImageUtils.safeRelease(errorCov);
            ImageUtils.safeRelease(state);
        }
        this.predicted = position;
    }

    private static Mat scaledIdentity(int size, double scale) {
        Mat m = Mat.eye(size, size, CvType.CV_32F);
        for (int i = 0; i < size; i++) {
            m.put(i, i, scale);
        }
        return m;
    }

    /**
     * 预测下一帧位置
     */
    Point predict() {
        Mat state = filter.predict();
        try {
            predicted = new Point(state.get(0, 0)[0], state.get(1, 0)[0]);
            return predicted;
        } finally {
            ImageUtils.safeRelease(state);
        }
    }

    /**
     * 用观测修正状态，返回修正后的位置
     */
    Point correct(Point measurement) {
        Mat z = new Mat(2, 1, CvType.CV_32F);
        z.put(0, 0, measurement.getX(), measurement.getY());
        Mat state = null;
        try {
            state = filter.correct(z);
            return new Point(state.get(0, 0)[0], state.get(1, 0)[0]);
        } finally {
            ImageUtils.safeRelease(z);
            ImageUtils.safeRelease(state);
        }
    }

    /**
     * 最近一次预测位置
     */
    Point predicted() {
        return predicted;
    }

    Point velocity() {
        Mat state = filter.get_statePost();
        try {
            return new Point(state.get(2, 0)[0], state.get(3, 0)[0]);
        } finally {
            ImageUtils.safeRelease(state);
        }
    }
}
