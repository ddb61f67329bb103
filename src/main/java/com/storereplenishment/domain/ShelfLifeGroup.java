package com.storereplenishment.domain;

public enum ShelfLifeGroup {
    ULTRA_SHORT(1, 3, 0.5),
    SHORT(4, 7, 0.7),
    MEDIUM(8, 30, 1.0),
    LONG(31, 90, 1.5),
    VERY_LONG(91, Integer.MAX_VALUE, 2.0);

    private final int minDays;
    private final int maxDays;
    private final double safetyDays;

    ShelfLifeGroup(int minDays, int maxDays, double safetyDays) {
        this.minDays = minDays;
        this.maxDays = maxDays;
        this.safetyDays = safetyDays;
    }

    public static ShelfLifeGroup of(int shelfLifeDays) {
        for (ShelfLifeGroup group : values()) {
            if (shelfLifeDays <= group.maxDays) {
                return group;
            }
        }
        return VERY_LONG;
    }

    /** Safety buffer in days of demand; a 4-day shelf life sits at the bottom of the short range. */
    public double safetyDays(int shelfLifeDays) {
        if (this == SHORT && shelfLifeDays <= minDays) {
            return 0.5;
        }
        return safetyDays;
    }
}
