package com.storereplenishment.domain;

public enum Decision {
    FORCE_ORDER,
    URGENT_ORDER,
    NORMAL_ORDER,
    PASS,
    SKIP;

    /** One step towards ordering; SKIP and FORCE_ORDER do not move. */
    public Decision upgrade() {
        if (this == PASS) {
            return NORMAL_ORDER;
        }
        if (this == NORMAL_ORDER) {
            return URGENT_ORDER;
        }
        if (this == URGENT_ORDER) {
            return FORCE_ORDER;
        }
        return this;
    }
}
