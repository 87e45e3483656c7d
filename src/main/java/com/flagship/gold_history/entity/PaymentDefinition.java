package com.flagship.gold_history.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * History of payments: gold.payment_history.
 */
public final class PaymentDefinition extends EntityDefinition<Payment> {

    public static final String DATASET = "payment";

    PaymentDefinition() {
        super(DATASET, "gold.payment_history", "ref", List.of(
            HistoryColumn.text("employee_ref"),
            HistoryColumn.decimal("paid_amount"),
            HistoryColumn.text("employee_bank_ref"),
            HistoryColumn.date("payment_date"),
            HistoryColumn.text("request_ref")
        ));
    }

    @Override
    public String naturalKey(Payment entity) {
        return entity.getRef();
    }

    @Override
    public Map<String, Object> toColumns(Payment entity) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("employee_ref", entity.getEmployeeRef());
        columns.put("paid_amount", entity.getPaidAmount());
        columns.put("employee_bank_ref", entity.getEmployeeBankRef());
        columns.put("payment_date", entity.getPaymentDate());
        columns.put("request_ref", entity.getRequestRef());
        return columns;
    }

    @Override
    public Payment fromColumns(String naturalKey, Map<String, Object> columns) {
        return Payment.builder()
            .ref(naturalKey)
            .employeeRef((String) columns.get("employee_ref"))
            .paidAmount((BigDecimal) columns.get("paid_amount"))
            .employeeBankRef((String) columns.get("employee_bank_ref"))
            .paymentDate((LocalDate) columns.get("payment_date"))
            .requestRef((String) columns.get("request_ref"))
            .build();
    }
}
