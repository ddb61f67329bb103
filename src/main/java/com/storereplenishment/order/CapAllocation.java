package com.storereplenishment.order;

import java.util.List;
import java.util.Set;

public record CapAllocation(
    int cap,
    double averageItemCount,
    String averageBasis,
    Set<String> selected,
    List<String> dropped,
    int provenSelected,
    int exploratorySelected,
    List<String> exploreFailed
) {
    public boolean isSelected(String itemId) {
        return selected.contains(itemId);
    }
}
