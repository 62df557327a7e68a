package com.moneylens.api.dto;

import com.moneylens.domain.Bill;

import java.math.BigDecimal;
import java.time.LocalDate;

public record UnmatchedBillResponse(
        String id,
        String name,
        BigDecimal amount,
        LocalDate dueDate,
        String accountRef,
        String status
) {

    public static UnmatchedBillResponse from(Bill bill) {
        return new UnmatchedBillResponse(bill.getId(), bill.getName(), bill.getAmount(), bill.getDueDate(),
                bill.getAccountRef(), bill.getStatus() != null ? bill.getStatus().name() : null);
    }
}
