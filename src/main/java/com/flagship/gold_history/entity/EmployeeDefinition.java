package com.flagship.gold_history.entity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * History of employees: gold.employee_history.
 */
public final class EmployeeDefinition extends EntityDefinition<Employee> {

    public static final String DATASET = "employee";

    EmployeeDefinition() {
        super(DATASET, "gold.employee_history", "ref", List.of(
            HistoryColumn.text("national_id"),
            HistoryColumn.text("last_name"),
            HistoryColumn.text("first_name")
        ));
    }

    @Override
    public String naturalKey(Employee entity) {
        return entity.getRef();
    }

    @Override
    public Map<String, Object> toColumns(Employee entity) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("national_id", entity.getNationalId());
        columns.put("last_name", entity.getLastName());
        columns.put("first_name", entity.getFirstName());
        return columns;
    }

    @Override
    public Employee fromColumns(String naturalKey, Map<String, Object> columns) {
        return Employee.builder()
            .ref(naturalKey)
            .nationalId((String) columns.get("national_id"))
            .lastName((String) columns.get("last_name"))
            .firstName((String) columns.get("first_name"))
            .build();
    }
}
