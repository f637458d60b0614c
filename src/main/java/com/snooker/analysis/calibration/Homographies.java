package com.snooker.analysis.calibration;

import com.snooker.analysis.model.Point;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;

import java.util.ArrayList;
import java.util.List;

/**
 * 单应矩阵与OpenCV Mat之间的转换及点变换
 */
final class Homographies {

    private static final double SINGULAR_EPSILON = 1e-12;

    private Homographies() {
    }

    static Mat toMat(double[][] h) {
        Mat mat = new Mat(3, 3, CvType.CV_64F);
        for (int r = 0; r < 3; r++) {
            mat.put(r, 0, h[r]);
        }
        return mat;
    }

    static double[][] toArray(Mat mat) {
        Mat converted = new Mat();
        try {
            mat.convertTo(converted, CvType.CV_64F);
            double[][] h = new double[3][3];
            for (int r = 0; r < 3; r++) {
                converted.get(r, 0, h[r]);
            }
            return h;
        } finally {
            converted.release();
        }
    }

    static MatOfPoint2f toMatOfPoint2f(List<Point> points) {
        org.opencv.core.Point[] cvPoints = new org.opencv.core.Point[points.size()];
        for (int i = 0; i < points.size(); i++) {
            cvPoints[i] = new org.opencv.core.Point(points.get(i).getX(), points.get(i).getY());
        }
        return new MatOfPoint2f(cvPoints);
    }

    /**
     * 双精度透视变换
     */
    static List<Point> transform(Mat homography, List<Point> points) {
        List<Point> result = new ArrayList<>(points.size());
        if (points.isEmpty()) {
            return result;
        }

        Mat src = new Mat(points.size(), 1, CvType.CV_64FC2);
        Mat dst = new Mat();
        try {
            for (int i = 0; i < points.size(); i++) {
                src.put(i, 0, points.get(i).getX(), points.get(i).getY());
            }
            Core.perspectiveTransform(src, dst, homography);
            double[] xy = new double[2];
            for (int i = 0; i < points.size(); i++) {
                dst.get(i, 0, xy);
                result.add(new Point(xy[0], xy[1]));
            }
            return result;
        } finally {
            src.release();
            dst.release();
        }
    }

    /**
     * 矩阵元素有限且可逆
     */
    static boolean isFiniteAndNonSingular(Mat homography) {
        if (homography == null || homography.empty() || homography.rows() != 3 || homography.cols() != 3) {
            return false;
        }
        double[][] h = toArray(homography);
        for (double[] row : h) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    return false;
                }
            }
        }
        double det = Core.determinant(homography);
        return Double.isFinite(det) && Math.abs(det) > SINGULAR_EPSILON;
    }

    static double meanDistance(List<Point> a, List<Point> b) {
        double total = 0;
        for (int i = 0; i < a.size(); i++) {
            total += a.get(i).distanceTo(b.get(i));
        }
        return total / a.size();
    }
}
