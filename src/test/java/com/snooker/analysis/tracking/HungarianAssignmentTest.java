package com.snooker.analysis.tracking;

import com.snooker.analysis.exception.TrackingException;
import org.junit.Test;

import static com.snooker.analysis.tracking.HungarianAssignment.UNASSIGNED;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class HungarianAssignmentTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    @Test
    public void squareMatrixOptimum() {
        double[][] cost = {
                {4, 1, 3},
                {2, 0, 5},
                {3, 2, 2}
        };
        assertArrayEquals(new int[]{1, 0, 2}, HungarianAssignment.solve(cost));
    }

    @Test
    public void beatsGreedyWhenGreedyIsSuboptimal() {
        // 贪心先取 (0,0)=1，总代价 1+10；最优为 2+2
        double[][] cost = {
                {1, 2},
                {2, 10}
        };
        assertArrayEquals(new int[]{1, 0}, HungarianAssignment.solve(cost));
        assertArrayEquals(new int[]{0, 1}, HungarianAssignment.greedy(cost));
    }

    @Test
    public void moreColumnsThanRows() {
        double[][] cost = {
                {10, 1, 10},
                {1, 10, 10}
        };
        assertArrayEquals(new int[]{1, 0}, HungarianAssignment.solve(cost));
    }

    @Test
    public void moreRowsThanColumns() {
        double[][] cost = {
                {10, 1},
                {1, 10},
                {5, 5}
        };
        assertArrayEquals(new int[]{1, 0, UNASSIGNED}, HungarianAssignment.solve(cost));
    }

    @Test
    public void forbiddenPairsStayUnassigned() {
        double[][] cost = {
                {INF, 1},
                {INF, 2}
        };
        assertArrayEquals(new int[]{1, UNASSIGNED}, HungarianAssignment.solve(cost));

        double[][] allForbidden = {{INF, INF}};
        assertArrayEquals(new int[]{UNASSIGNED}, HungarianAssignment.solve(allForbidden));
    }

    @Test
    public void emptyInputs() {
        assertEquals(0, HungarianAssignment.solve(new double[0][0]).length);
        assertArrayEquals(new int[]{UNASSIGNED, UNASSIGNED}, HungarianAssignment.solve(new double[2][0]));
    }

    @Test(expected = TrackingException.class)
    public void nanIsRejected() {
        HungarianAssignment.solve(new double[][]{{1, Double.NaN}});
    }

    @Test(expected = TrackingException.class)
    public void negativeCostIsRejected() {
        HungarianAssignment.solve(new double[][]{{1, -1}});
    }

    @Test(expected = TrackingException.class)
    public void raggedMatrixIsRejected() {
        HungarianAssignment.solve(new double[][]{{1, 2}, {1}});
    }

    @Test
    public void greedySkipsNanAndInfinity() {
        double[][] cost = {
                {Double.NaN, 3},
                {INF, 1}
        };
        assertArrayEquals(new int[]{UNASSIGNED, 1}, HungarianAssignment.greedy(cost));
    }
}
