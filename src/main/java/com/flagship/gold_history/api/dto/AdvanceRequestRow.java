package com.flagship.gold_history.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_history.entity.AdvanceRequest;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A row of the request extract. Settlement columns are owned by the
 * payment feed and are not accepted here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdvanceRequestRow {

    @NotBlank(message = "ref is required")
    @JsonProperty("ref")
    private String ref;

    @JsonProperty("employee_ref")
    private String employeeRef;

    @JsonProperty("requested_amount")
    private BigDecimal requestedAmount;

    public AdvanceRequest toEntity() {
        return AdvanceRequest.builder()
            .ref(ref)
            .employeeRef(employeeRef)
            .requestedAmount(requestedAmount)
            .build();
    }
}
