package com.flagship.gold_history.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * History of salary-advance requests: gold.advance_request_history.
 *
 * The request extract does not carry settlement columns, so an incoming
 * row inherits them from the current version. Without this, every request
 * snapshot following a payment would look like a change and wipe the
 * settlement.
 */
public final class AdvanceRequestDefinition extends EntityDefinition<AdvanceRequest> {

    public static final String DATASET = "advance_request";

    AdvanceRequestDefinition() {
        super(DATASET, "gold.advance_request_history", "ref", List.of(
            HistoryColumn.text("employee_ref"),
            HistoryColumn.decimal("requested_amount"),
            HistoryColumn.decimal("paid_amount"),
            HistoryColumn.date("payment_date"),
            HistoryColumn.text("payment_ref")
        ));
    }

    @Override
    public String naturalKey(AdvanceRequest entity) {
        return entity.getRef();
    }

    @Override
    public Map<String, Object> toColumns(AdvanceRequest entity) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("employee_ref", entity.getEmployeeRef());
        columns.put("requested_amount", entity.getRequestedAmount());
        columns.put("paid_amount", entity.getPaidAmount());
        columns.put("payment_date", entity.getPaymentDate());
        columns.put("payment_ref", entity.getPaymentRef());
        return columns;
    }

    @Override
    public AdvanceRequest fromColumns(String naturalKey, Map<String, Object> columns) {
        return AdvanceRequest.builder()
            .ref(naturalKey)
            .employeeRef((String) columns.get("employee_ref"))
            .requestedAmount((BigDecimal) columns.get("requested_amount"))
            .paidAmount((BigDecimal) columns.get("paid_amount"))
            .paymentDate((LocalDate) columns.get("payment_date"))
            .paymentRef((String) columns.get("payment_ref"))
            .build();
    }

    @Override
    public AdvanceRequest carryForward(AdvanceRequest current, AdvanceRequest incoming) {
        if (current == null || !current.isSettled() || incoming.isSettled()) {
            return incoming;
        }
        return incoming.withSettlementOf(current);
    }
}
