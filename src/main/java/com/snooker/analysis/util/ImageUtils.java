package com.snooker.analysis.util;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 图像处理工具类
 */
public final class ImageUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ImageUtils.class);

    private static final int DEFAULT_JPEG_QUALITY = 90;

    static {
        // 加载OpenCV本地库
        try {
            nu.pattern.OpenCV.loadLocally();
            LOG.info("OpenCV loaded successfully");
        } catch (Throwable e) {
            LOG.error("Failed to load OpenCV", e);
        }
    }

    private ImageUtils() {
    }

    /**
     * 确保本地库已加载，调用即触发静态初始化
     */
    public static void init() {
        // 静态块完成加载
    }

    /**
     * 解码图像字节数组为Mat对象，无法解码时返回空Mat
     */
    public static Mat decodeImage(byte[] imageData) {
        if (imageData == null || imageData.length == 0) {
            return new Mat();
        }
        MatOfByte matOfByte = new MatOfByte(imageData);
        try {
            return Imgcodecs.imdecode(matOfByte, Imgcodecs.IMREAD_COLOR);
        } finally {
            matOfByte.release();
        }
    }

    public static byte[] encodeJpeg(Mat image) {
        return encodeJpeg(image, DEFAULT_JPEG_QUALITY);
    }

    /**
     * 编码为JPEG字节
     */
    public static byte[] encodeJpeg(Mat image, int quality) {
        MatOfByte buffer = new MatOfByte();
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, quality);
        try {
            if (!Imgcodecs.imencode(".jpg", image, buffer, params)) {
                throw new IllegalStateException("JPEG encoding failed");
            }
            return buffer.toArray();
        } finally {
            buffer.release();
            params.release();
        }
    }

    /**
     * 将Mat转换为float数组（用于模型输入）
     */
    public static float[] matToFloatArray(Mat mat) {
        // 转换为RGB
        Mat rgb = new Mat();
        Imgproc.cvtColor(mat, rgb, Imgproc.COLOR_BGR2RGB);

        // 归一化到[0,1]并转换为CHW格式
        int channels = rgb.channels();
        int height = rgb.rows();
        int width = rgb.cols();

        float[] result = new float[channels * height * width];
        byte[] data = new byte[(int) rgb.total() * channels];
        rgb.get(0, 0, data);

        for (int c = 0; c < channels; c++) {
            for (int h = 0; h < height; h++) {
                for (int w = 0; w < width; w++) {
                    int pixelIndex = (h * width + w) * channels + c;
                    int resultIndex = c * height * width + h * width + w;
                    result[resultIndex] = (data[pixelIndex] & 0xFF) / 255.0f;
                }
            }
        }

        rgb.release();
        return result;
    }

    /**
     * 计算矩形区域的HSV均值 (H 0-180, S 0-255, V 0-255)
     * 区域会被裁剪到图像范围内，裁剪后为空时返回 null
     */
    public static double[] meanHsv(Mat image, Rect region) {
        int x1 = Math.max(0, region.x);
        int y1 = Math.max(0, region.y);
        int x2 = Math.min(image.cols(), region.x + region.width);
        int y2 = Math.min(image.rows(), region.y + region.height);
        if (x2 <= x1 || y2 <= y1) {
            return null;
        }

        Mat roi = image.submat(new Rect(x1, y1, x2 - x1, y2 - y1));
        Mat hsv = new Mat();
        try {
            Imgproc.cvtColor(roi, hsv, Imgproc.COLOR_BGR2HSV);
            Scalar mean = Core.mean(hsv);
            return new double[]{mean.val[0], mean.val[1], mean.val[2]};
        } finally {
            hsv.release();
            roi.release();
        }
    }

    /**
     * 安全释放Mat
     */
    public static void safeRelease(Mat mat) {
        if (mat != null) {
            try {
                mat.release();
            } catch (Exception e) {
                LOG.error("Error releasing Mat", e);
            }
        }
    }
}
