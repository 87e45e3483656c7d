package com.flagship.gold_history.entity;

import java.util.List;
import java.util.Optional;

/**
 * The historized entities.
 */
public final class EntityDefinitions {

    public static final EmployeeDefinition EMPLOYEE = new EmployeeDefinition();
    public static final AdvanceRequestDefinition ADVANCE_REQUEST = new AdvanceRequestDefinition();
    public static final PaymentDefinition PAYMENT = new PaymentDefinition();

    private static final List<EntityDefinition<?>> ALL = List.of(EMPLOYEE, ADVANCE_REQUEST, PAYMENT);

    private EntityDefinitions() {
        // Utility class
    }

    public static List<EntityDefinition<?>> all() {
        return ALL;
    }

    public static Optional<EntityDefinition<?>> byDataset(String dataset) {
        return ALL.stream()
            .filter(definition -> definition.getDataset().equals(dataset))
            .findFirst();
    }
}
