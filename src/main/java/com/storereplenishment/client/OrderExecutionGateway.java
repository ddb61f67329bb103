package com.storereplenishment.client;

import java.time.LocalDate;
import java.util.List;

/** Hands the final order list to whatever places orders with the supplier. */
public interface OrderExecutionGateway {

    /** @return number of lines the executor accepted */
    int submit(String storeId, LocalDate orderDate, List<OrderLine> lines, String requestId);
}
