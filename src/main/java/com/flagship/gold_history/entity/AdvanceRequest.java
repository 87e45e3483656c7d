package com.flagship.gold_history.entity;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Salary-advance request.
 *
 * The request extract only carries ref, employeeRef and requestedAmount.
 * The settlement fields (paidAmount, paymentDate, paymentRef) are written
 * by the payment feed when a payment settles the request.
 */
@Value
@Builder(toBuilder = true)
public class AdvanceRequest {
    String ref;
    String employeeRef;
    BigDecimal requestedAmount;
    BigDecimal paidAmount;
    LocalDate paymentDate;
    String paymentRef;

    public boolean isSettled() {
        return paymentRef != null;
    }

    /**
     * Returns a copy settled by the given payment.
     */
    public AdvanceRequest settledBy(Payment payment) {
        return toBuilder()
            .paidAmount(payment.getPaidAmount())
            .paymentDate(payment.getPaymentDate())
            .paymentRef(payment.getRef())
            .build();
    }

    /**
     * Returns a copy with no settlement.
     */
    public AdvanceRequest withoutSettlement() {
        return toBuilder()
            .paidAmount(null)
            .paymentDate(null)
            .paymentRef(null)
            .build();
    }

    /**
     * Returns a copy carrying the settlement fields of another version.
     */
    public AdvanceRequest withSettlementOf(AdvanceRequest other) {
        return toBuilder()
            .paidAmount(other.getPaidAmount())
            .paymentDate(other.getPaymentDate())
            .paymentRef(other.getPaymentRef())
            .build();
    }
}
