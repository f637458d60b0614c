package com.snooker.analysis.tracking;

import com.snooker.analysis.exception.SnookerAnalysisException;
import com.snooker.analysis.exception.TrackingException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 最小代价二分匹配（Kuhn-Munkres，带势函数的 O(n^2 m) 实现）
 *
 * 代价矩阵中的 {@code Double.POSITIVE_INFINITY} 表示禁止匹配，
 * 结果中对应行返回 -1。矩阵可以不是方阵。
 */
public final class HungarianAssignment {

    public static final int UNASSIGNED = -1;

    private HungarianAssignment() {
    }

    /**
     * @return 每一行匹配到的列下标，未匹配为 {@link #UNASSIGNED}
     * @throws TrackingException 代价中有 NaN 或求解未收敛
     */
    public static int[] solve(double[][] cost) {
        int rows = cost.length;
        int[] result = new int[rows];
        Arrays.fill(result, UNASSIGNED);
        if (rows == 0 || cost[0].length == 0) {
            return result;
        }
        int cols = cost[0].length;

        double maxFinite = 0;
        for (double[] row : cost) {
            if (row.length != cols) {
                throw new TrackingException(SnookerAnalysisException.NO_FRAME, "Cost matrix is not rectangular");
            }
            for (double c : row) {
                if (Double.isNaN(c)) {
                    throw new TrackingException(SnookerAnalysisException.NO_FRAME, "Cost matrix contains NaN");
                }
                if (c < 0) {
                    throw new TrackingException(SnookerAnalysisException.NO_FRAME, "Cost matrix contains negative cost");
                }
                if (c != Double.POSITIVE_INFINITY) {
                    maxFinite = Math.max(maxFinite, c);
                }
            }
        }
        // 禁止项替换为足够大的有限值，保证任何可行匹配都优于它
        double big = (maxFinite + 1) * (rows + cols + 1);

        boolean transposed = rows > cols;
        int n = transposed ? cols : rows;
        int m = transposed ? rows : cols;
        double[][] a = new double[n][m];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                double c = transposed ? cost[j][i] : cost[i][j];
                a[i][j] = c == Double.POSITIVE_INFINITY ? big : c;
            }
        }

        int[] match = solveMinRows(a, n, m);

        for (int i = 0; i < n; i++) {
            int j = match[i];
            if (j == UNASSIGNED) {
                continue;
            }
            int row = transposed ? j : i;
            int col = transposed ? i : j;
            if (cost[row][col] != Double.POSITIVE_INFINITY) {
                result[row] = col;
            }
        }
        return result;
    }

    /**
     * n <= m，每一行都会分配到一列
     */
    private static int[] solveMinRows(double[][] a, int n, int m) {
        double[] u = new double[n + 1];
        double[] v = new double[m + 1];
        int[] p = new int[m + 1];
        int[] way = new int[m + 1];

        for (int i = 1; i <= n; i++) {
            p[0] = i;
            int j0 = 0;
            double[] minv = new double[m + 1];
            Arrays.fill(minv, Double.POSITIVE_INFINITY);
            boolean[] used = new boolean[m + 1];
            int iterations = 0;

            do {
                if (++iterations > m + 1) {
                    throw new TrackingException(SnookerAnalysisException.NO_FRAME,
                            "Assignment did not converge");
                }
                used[j0] = true;
                int i0 = p[j0];
                double delta = Double.POSITIVE_INFINITY;
                int j1 = -1;
                for (int j = 1; j <= m; j++) {
                    if (used[j]) continue;
                    double cur = a[i0 - 1][j - 1] - u[i0] - v[j];
                    if (cur < minv[j]) {
                        minv[j] = cur;
                        way[j] = j0;
                    }
                    if (minv[j] < delta) {
                        delta = minv[j];
                        j1 = j;
                    }
                }
                if (j1 < 0 || Double.isNaN(delta)) {
                    throw new TrackingException(SnookerAnalysisException.NO_FRAME,
                            "Assignment did not converge");
                }
                for (int j = 0; j <= m; j++) {
                    if (used[j]) {
                        u[p[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minv[j] -= delta;
                    }
                }
                j0 = j1;
            } while (p[j0] != 0);

            do {
                int j1 = way[j0];
                p[j0] = p[j1];
                j0 = j1;
            } while (j0 != 0);
        }

        int[] match = new int[n];
        Arrays.fill(match, UNASSIGNED);
        for (int j = 1; j <= m; j++) {
            if (p[j] != 0) {
                match[p[j] - 1] = j - 1;
            }
        }
        return match;
    }

    /**
     * 贪心最近邻匹配，按代价从小到大依次分配；NaN 和无穷视为不可匹配
     */
    public static int[] greedy(double[][] cost) {
        int rows = cost.length;
        int[] result = new int[rows];
        Arrays.fill(result, UNASSIGNED);
        if (rows == 0) {
            return result;
        }

        List<int[]> pairs = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cost[i].length; j++) {
                double c = cost[i][j];
                if (!Double.isNaN(c) && c != Double.POSITIVE_INFINITY) {
                    pairs.add(new int[]{i, j});
                }
            }
        }
        pairs.sort(Comparator.comparingDouble(pair -> cost[pair[0]][pair[1]]));

        boolean[] colUsed = new boolean[cost[0].length];
        for (int[] pair : pairs) {
            if (result[pair[0]] == UNASSIGNED && !colUsed[pair[1]]) {
                result[pair[0]] = pair[1];
                colUsed[pair[1]] = true;
            }
        }
        return result;
    }
}
