package com.storereplenishment.order;

import java.time.LocalDate;

/** Number of distinct items of a category group ordered on one date. */
public record DailyOrderCount(LocalDate date, long itemCount) {}
