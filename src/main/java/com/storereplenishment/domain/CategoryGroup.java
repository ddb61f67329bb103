package com.storereplenishment.domain;

public enum CategoryGroup {
    BEER(false),
    SOJU(false),
    TOBACCO(false),
    RAMEN(false),
    FROZEN_ICE(false),
    BEVERAGE(false),
    SNACK(false),
    FOOD(true),
    ALCOHOL_GENERAL(false),
    PERISHABLE(false),
    INSTANT_MEAL(false),
    DESSERT(false),
    DAILY_NECESSITY(false),
    GENERAL_MERCHANDISE(false),
    GENERAL(false);

    private final boolean dailyCapped;

    CategoryGroup(boolean dailyCapped) {
        this.dailyCapped = dailyCapped;
    }

    public boolean isDailyCapped() {
        return dailyCapped;
    }

    public boolean isPerishable() {
        return this == FOOD || this == PERISHABLE;
    }
}
