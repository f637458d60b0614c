package com.snooker.analysis.detection;

import com.snooker.analysis.model.BallType;
import com.snooker.analysis.util.ImageUtils;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class BallColorClassifierTest {

    private final BallColorClassifier classifier = new BallColorClassifier();

    @BeforeClass
    public static void loadNatives() {
        ImageUtils.init();
    }

    @Test
    public void hsvRules() {
        assertEquals(BallType.BLACK, classifier.classifyHsv(0, 0, 30));
        assertEquals(BallType.CUE, classifier.classifyHsv(0, 20, 240));
        assertEquals(BallType.RED, classifier.classifyHsv(3, 220, 200));
        assertEquals(BallType.PINK, classifier.classifyHsv(175, 100, 220));
        assertEquals(BallType.BROWN, classifier.classifyHsv(15, 200, 120));
        assertEquals(BallType.YELLOW, classifier.classifyHsv(28, 200, 220));
        assertEquals(BallType.GREEN, classifier.classifyHsv(60, 200, 150));
        assertEquals(BallType.BLUE, classifier.classifyHsv(110, 200, 200));
    }

    @Test
    public void classifiesSolidPatches() {
        assertEquals(BallType.RED, classifyPatch(new Scalar(0, 0, 255)));
        assertEquals(BallType.CUE, classifyPatch(new Scalar(255, 255, 255)));
        assertEquals(BallType.BLACK, classifyPatch(new Scalar(0, 0, 0)));
        assertEquals(BallType.BLUE, classifyPatch(new Scalar(255, 0, 0)));
    }

    @Test
    public void boxOutsideImageIsUnclassified() {
        Mat image = new Mat(50, 50, CvType.CV_8UC3, new Scalar(0, 0, 255));
        try {
            RawDetection box = RawDetection.builder().x1(200).y1(200).x2(220).y2(220).classId(32).confidence(0.5).build();
            assertFalse(classifier.classify(image, box).isPresent());
        } finally {
            image.release();
        }
    }

    private BallType classifyPatch(Scalar bgr) {
        Mat image = new Mat(100, 100, CvType.CV_8UC3, bgr);
        try {
            RawDetection box = RawDetection.builder().x1(30).y1(30).x2(70).y2(70).classId(32).confidence(0.5).build();
            Optional<BallType> type = classifier.classify(image, box);
            return type.orElseThrow(AssertionError::new);
        } finally {
            image.release();
        }
    }
}
