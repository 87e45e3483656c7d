package com.flagship.gold_history.entity;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Payment of a salary advance, as delivered by the ERP payment extract.
 * {@code requestRef} names the advance request this payment settles.
 */
@Value
@Builder
public class Payment {
    String ref;
    String employeeRef;
    BigDecimal paidAmount;
    String employeeBankRef;
    LocalDate paymentDate;
    String requestRef;
}
