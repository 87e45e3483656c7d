package com.flagship.gold_history.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_history.entity.Payment;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRow {

    @NotBlank(message = "ref is required")
    @JsonProperty("ref")
    private String ref;

    @JsonProperty("employee_ref")
    private String employeeRef;

    @JsonProperty("paid_amount")
    private BigDecimal paidAmount;

    @JsonProperty("employee_bank_ref")
    private String employeeBankRef;

    @JsonProperty("payment_date")
    private LocalDate paymentDate;

    @JsonProperty("request_ref")
    private String requestRef;

    public Payment toEntity() {
        return Payment.builder()
            .ref(ref)
            .employeeRef(employeeRef)
            .paidAmount(paidAmount)
            .employeeBankRef(employeeBankRef)
            .paymentDate(paymentDate)
            .requestRef(requestRef)
            .build();
    }
}
