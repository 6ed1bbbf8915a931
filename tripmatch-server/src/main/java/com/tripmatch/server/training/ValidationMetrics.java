package com.tripmatch.server.training;

import java.util.Arrays;
import java.util.Comparator;

/**
 * 验证集上的排序指标。
 */
final class ValidationMetrics {

    private ValidationMetrics() {
    }

    /**
     * ROC AUC（Mann-Whitney 秩统计，同分取平均秩）。
     *
     * @return 只有单一类别时返回 NaN
     */
    static double auc(double[] scores, boolean[] positives) {
        int n = scores.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));

        double positiveRankSum = 0D;
        long positiveCount = 0;
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            // 秩从 1 开始，[i, j] 同分取平均秩
            double averageRank = (i + j) / 2D + 1D;
            for (int t = i; t <= j; t++) {
                if (positives[order[t]]) {
                    positiveRankSum += averageRank;
                    positiveCount++;
                }
            }
            i = j + 1;
        }
        long negativeCount = n - positiveCount;
        if (positiveCount == 0 || negativeCount == 0) {
            return Double.NaN;
        }
        return (positiveRankSum - positiveCount * (positiveCount + 1) / 2D) / ((double) positiveCount * negativeCount);
    }
}
