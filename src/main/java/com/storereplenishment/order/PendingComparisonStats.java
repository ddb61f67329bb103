package com.storereplenishment.order;

import lombok.Getter;

/** Counters collected when both pending algorithms run side by side during one run. */
@Getter
public class PendingComparisonStats {

    private int total;
    private int matches;
    private int differences;
    private int aggregateHigher;
    private int simplifiedHigher;
    private int maxDifference;
    private long totalDifference;
    private int crossDateCases;

    synchronized void record(int aggregate, int simplified, boolean crossDate) {
        total++;
        int diff = aggregate - simplified;
        if (diff == 0) {
            matches++;
            return;
        }
        differences++;
        totalDifference += Math.abs(diff);
        maxDifference = Math.max(maxDifference, Math.abs(diff));
        if (diff > 0) {
            aggregateHigher++;
        } else {
            simplifiedHigher++;
        }
        if (crossDate) {
            crossDateCases++;
        }
    }

    public double matchRate() {
        return total == 0 ? 1.0 : (double) matches / total;
    }
}
