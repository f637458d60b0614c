package com.snooker.analysis.model;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BoundingBoxTest {

    @Test
    public void centerAndSize() {
        BoundingBox box = new BoundingBox(10, 20, 30, 60);
        assertEquals(20, box.center().getX(), 1e-9);
        assertEquals(40, box.center().getY(), 1e-9);
        assertEquals(20, box.width(), 1e-9);
        assertEquals(40, box.height(), 1e-9);
        assertEquals(800, box.area(), 1e-9);
    }

    @Test
    public void iouOfIdenticalAndDisjointBoxes() {
        BoundingBox a = new BoundingBox(0, 0, 10, 10);
        assertEquals(1.0, a.iou(new BoundingBox(0, 0, 10, 10)), 1e-9);
        assertEquals(0.0, a.iou(new BoundingBox(20, 20, 30, 30)), 1e-9);
        // 重叠一半：交 50，并 150
        assertEquals(50.0 / 150.0, a.iou(new BoundingBox(5, 0, 15, 10)), 1e-9);
    }

    @Test
    public void containsIsInclusive() {
        BoundingBox box = BoundingBox.around(Point.of(100, 100), 20, 20);
        assertTrue(box.contains(Point.of(100, 100)));
        assertTrue(box.contains(Point.of(120, 80)));
        assertFalse(box.contains(Point.of(121, 100)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsInvertedCorners() {
        new BoundingBox(30, 0, 10, 10);
    }

    @Test
    public void ballTypeLookup() {
        assertEquals(BallType.RED, BallType.fromClassId(2).get());
        assertFalse(BallType.fromClassId(8).isPresent());
        assertEquals(15, BallType.RED.getMaxCount());
        assertTrue(BallType.CUE.isUnique());
    }
}
