package com.storereplenishment.client;

import com.storereplenishment.domain.Decision;

public record OrderLine(String itemId, int qty, Decision decision) {}
