package com.snooker.analysis.detection;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.snooker.analysis.exception.DetectionException;
import com.snooker.analysis.exception.SnookerAnalysisException;
import com.snooker.analysis.model.BallType;
import com.snooker.analysis.util.ImageUtils;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * YOLOv8 球检测器（使用ONNX Runtime）
 * 输出格式: [1, 4 + 类别数, 8400]
 *
 * 两种模式：
 * 1. 斯诺克专用模型，8个类别直接对应 {@link BallType}
 * 2. 通用COCO模型，仅保留 "sports ball" 并按颜色细分
 */
public class OnnxBallClassifier implements BallClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(OnnxBallClassifier.class);

    /**
     * COCO 中 "sports ball" 的类别索引
     */
    static final int COCO_SPORTS_BALL = 32;

    private final OrtEnvironment env;
    private final OrtSession session;
    private final String modelPath;
    private final String inputName;
    private final int inputSize;
    private final float candidateThreshold;
    private final BallColorClassifier colorClassifier;

    private OnnxBallClassifier(String modelPath, int inputSize, int intraOpThreads,
                               float candidateThreshold, BallColorClassifier colorClassifier) {
        this.modelPath = modelPath;
        this.inputSize = inputSize;
        this.candidateThreshold = candidateThreshold;
        this.colorClassifier = colorClassifier;
        try {
            env = OrtEnvironment.getEnvironment();
            OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
            opts.setIntraOpNumThreads(intraOpThreads);

            // 设置优化级别
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.BASIC_OPT);

            session = env.createSession(modelPath, opts);
            inputName = session.getInputNames().iterator().next();
            LOG.info("YOLO model loaded successfully from: {}", modelPath);
            LOG.info("Model inputs: {}", session.getInputNames());
            LOG.info("Model outputs: {}", session.getOutputNames());
        } catch (OrtException | RuntimeException e) {
            throw new DetectionException(SnookerAnalysisException.NO_FRAME,
                    "Failed to load model " + modelPath, e);
        }
    }

    /**
     * 加载斯诺克专用模型
     */
    public static OnnxBallClassifier forBallModel(String modelPath, int inputSize, int intraOpThreads,
                                                  float candidateThreshold) {
        return new OnnxBallClassifier(modelPath, inputSize, intraOpThreads, candidateThreshold, null);
    }

    /**
     * 加载通用预训练模型，球类型由颜色决定
     */
    public static OnnxBallClassifier forGenericModel(String modelPath, int inputSize, int intraOpThreads,
                                                     float candidateThreshold,
                                                     BallColorClassifier colorClassifier) {
        return new OnnxBallClassifier(modelPath, inputSize, intraOpThreads, candidateThreshold,
                colorClassifier);
    }

    @Override
    public String name() {
        return (colorClassifier == null ? "snooker:" : "generic:") + modelPath;
    }

    @Override
    public List<RawDetection> classify(Mat image) {
        Mat resized = null;
        OnnxTensor inputTensor = null;
        OrtSession.Result results = null;

        try {
            int originalWidth = image.cols();
            int originalHeight = image.rows();

            // 1. 预处理图像
            resized = new Mat();
            Imgproc.resize(image, resized, new Size(inputSize, inputSize));
            float[] inputData = ImageUtils.matToFloatArray(resized);

            // 2. 构建ONNX输入
            long[] shape = {1, 3, inputSize, inputSize};
            inputTensor = OnnxTensor.createTensor(env, FloatBuffer.wrap(inputData), shape);

            // 3. 执行推理
            long startTime = System.currentTimeMillis();
            results = session.run(Collections.singletonMap(inputName, inputTensor));
            long inferenceTime = System.currentTimeMillis() - startTime;

            // 4. 解析输出 - 在关闭resources之前完成所有数据提取
            OnnxTensor outputTensor = (OnnxTensor) results.get(0);
            LOG.debug("Output shape: {}, Inference time: {} ms",
                    Arrays.toString(outputTensor.getInfo().getShape()), inferenceTime);

            float[][] output = extractOutputData(outputTensor.getValue());
            if (output == null) {
                throw new DetectionException(SnookerAnalysisException.NO_FRAME,
                        "Unexpected model output from " + modelPath);
            }

            // 5. 后处理 - 使用已提取的数据
            return postProcess(output, image, originalWidth, originalHeight);

        } catch (OrtException e) {
            throw new DetectionException(SnookerAnalysisException.NO_FRAME, "Inference failed", e);
        } finally {
            // 正确的资源释放顺序：先释放引用，后释放容器
            ImageUtils.safeRelease(resized);
            safeClose(results, "results");
            safeClose(inputTensor, "inputTensor");
        }
    }

    /**
     * 提取输出数据到内存中
     */
    static float[][] extractOutputData(Object outputObj) {
        if (outputObj instanceof float[][][]) {
            float[][][] output3D = (float[][][]) outputObj;
            if (output3D.length > 0) {
                return deepCopy(output3D[0]);
            }
        } else if (outputObj instanceof float[][]) {
            return deepCopy((float[][]) outputObj);
        }
        LOG.error("Unexpected output type: {}",
                outputObj == null ? "null" : outputObj.getClass().getSimpleName());
        return null;
    }

    private static float[][] deepCopy(float[][] source) {
        // 深拷贝数据，避免引用ONNX内部内存
        float[][] result = new float[source.length][];
        for (int i = 0; i < source.length; i++) {
            result[i] = Arrays.copyOf(source[i], source[i].length);
        }
        return result;
    }

    private List<RawDetection> postProcess(float[][] output, Mat image, int originalWidth, int originalHeight) {
        List<RawDetection> detections = new ArrayList<>();

        int numClasses = output.length - 4;
        if (numClasses <= 0) {
            LOG.warn("Invalid output data: {} rows", output.length);
            return detections;
        }

        float scaleX = (float) originalWidth / inputSize;
        float scaleY = (float) originalHeight / inputSize;
        int numCandidates = output[0].length;

        for (int i = 0; i < numCandidates; i++) {
            float cx = output[0][i];
            float cy = output[1][i];
            float w = output[2][i];
            float h = output[3][i];

            int maxClassIdx = 0;
            float maxConfidence = output[4][i];
            for (int j = 5; j < output.length; j++) {
                if (output[j][i] > maxConfidence) {
                    maxConfidence = output[j][i];
                    maxClassIdx = j - 4;
                }
            }

            if (maxConfidence < candidateThreshold) {
                continue;
            }

            RawDetection candidate = RawDetection.builder()
                    .x1((cx - w / 2) * scaleX)
                    .y1((cy - h / 2) * scaleY)
                    .x2((cx + w / 2) * scaleX)
                    .y2((cy + h / 2) * scaleY)
                    .classId(maxClassIdx)
                    .confidence(maxConfidence)
                    .build();

            if (colorClassifier == null) {
                detections.add(candidate);
            } else if (maxClassIdx == COCO_SPORTS_BALL) {
                Optional<BallType> type = colorClassifier.classify(image, candidate);
                type.ifPresent(ballType -> detections.add(RawDetection.builder()
                        .x1(candidate.getX1()).y1(candidate.getY1())
                        .x2(candidate.getX2()).y2(candidate.getY2())
                        .classId(ballType.getClassId())
                        .confidence(candidate.getConfidence())
                        .build()));
            }
        }

        return detections;
    }

    /**
     * 安全关闭资源
     */
    private static void safeClose(AutoCloseable resource, String name) {
        if (resource != null) {
            try {
                resource.close();
            } catch (Exception e) {
                LOG.error("Error closing {}", name, e);
            }
        }
    }

    @Override
    public void close() {
        try {
            session.close();
            LOG.info("YOLO model {} closed", modelPath);
        } catch (OrtException e) {
            LOG.error("Error closing YOLO model {}", modelPath, e);
        }
    }
}
