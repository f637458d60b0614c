package com.snooker.analysis.detection;

import com.snooker.analysis.model.BallType;
import com.snooker.analysis.util.ImageUtils;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.Optional;

/**
 * 基于HSV均值的球颜色分类
 * 用于通用模型只能给出 "sports ball" 的情况
 */
public class BallColorClassifier {

    // 取边界框中心区域，避开台呢和阴影
    private static final double INNER_RATIO = 0.6;

    private static final double DARK_VALUE = 60;
    private static final double WHITE_SATURATION = 60;
    private static final double WHITE_VALUE = 170;

    public Optional<BallType> classify(Mat image, RawDetection box) {
        double w = box.getX2() - box.getX1();
        double h = box.getY2() - box.getY1();
        if (!(w > 0) || !(h > 0)) {
            return Optional.empty();
        }
        int rx = (int) Math.round(box.getX1() + w * (1 - INNER_RATIO) / 2);
        int ry = (int) Math.round(box.getY1() + h * (1 - INNER_RATIO) / 2);
        int rw = Math.max(1, (int) Math.round(w * INNER_RATIO));
        int rh = Math.max(1, (int) Math.round(h * INNER_RATIO));

        double[] hsv = ImageUtils.meanHsv(image, new Rect(rx, ry, rw, rh));
        if (hsv == null) {
            return Optional.empty();
        }
        return Optional.of(classifyHsv(hsv[0], hsv[1], hsv[2]));
    }

    /**
     * H: 0-180, S/V: 0-255 (OpenCV 约定)
     */
    public BallType classifyHsv(double hue, double saturation, double value) {
        if (value < DARK_VALUE) {
            return BallType.BLACK;
        }
        if (saturation < WHITE_SATURATION && value > WHITE_VALUE) {
            return BallType.CUE;
        }
        if (hue < 10 || hue >= 170) {
            // 粉球与红球同色相，饱和度更低
            return saturation < 150 ? BallType.PINK : BallType.RED;
        }
        if (hue < 22) {
            return value < 160 ? BallType.BROWN : BallType.YELLOW;
        }
        if (hue < 35) {
            return BallType.YELLOW;
        }
        if (hue < 85) {
            return BallType.GREEN;
        }
        if (hue < 130) {
            return BallType.BLUE;
        }
        return BallType.PINK;
    }
}
