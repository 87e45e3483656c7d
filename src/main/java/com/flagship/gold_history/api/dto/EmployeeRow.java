package com.flagship.gold_history.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_history.entity.Employee;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeRow {

    @NotBlank(message = "ref is required")
    @JsonProperty("ref")
    private String ref;

    @JsonProperty("national_id")
    private String nationalId;

    @JsonProperty("last_name")
    private String lastName;

    @JsonProperty("first_name")
    private String firstName;

    public Employee toEntity() {
        return Employee.builder()
            .ref(ref)
            .nationalId(nationalId)
            .lastName(lastName)
            .firstName(firstName)
            .build();
    }
}
