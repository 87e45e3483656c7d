package com.flagship.gold_history.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Request body of the snapshot endpoints.
 *
 * @param <R> row type of the dataset
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotRequest<R> {

    @NotNull(message = "as_of is required")
    @JsonProperty("as_of")
    private LocalDate asOf;

    @JsonProperty("source_name")
    private String sourceName;

    @JsonProperty("checksum")
    private String checksum;

    @NotNull(message = "rows is required, send an empty list for an empty snapshot")
    @Valid
    @JsonProperty("rows")
    private List<R> rows;
}
