package com.flagship.gold_history.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_history.entity.EntityDefinition;
import com.flagship.gold_history.history.HistoryRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * One history version as returned by the API.
 */
@Value
@Builder
public class HistoryRecordResponse {

    @JsonProperty("ref")
    String ref;

    @JsonProperty("attributes")
    Map<String, Object> attributes;

    @JsonProperty("valid_from")
    LocalDate validFrom;

    @JsonProperty("valid_to")
    LocalDate validTo;

    @JsonProperty("is_current")
    boolean current;

    @JsonProperty("is_deleted")
    boolean deleted;

    @JsonProperty("record_hash")
    String recordHash;

    @JsonProperty("batch_id")
    Long batchId;

    @JsonProperty("ingested_at")
    Instant ingestedAt;

    /**
     * The record must come from the store of the given definition.
     */
    @SuppressWarnings("unchecked")
    public static <T> HistoryRecordResponse from(EntityDefinition<T> definition, HistoryRecord<?> record) {
        HistoryRecord<T> typed = (HistoryRecord<T>) record;
        return HistoryRecordResponse.builder()
            .ref(typed.getNaturalKey())
            .attributes(definition.toColumns(typed.getAttributes()))
            .validFrom(typed.getValidFrom())
            .validTo(typed.getValidTo())
            .current(typed.isCurrent())
            .deleted(typed.isDeleted())
            .recordHash(typed.getRecordHash())
            .batchId(typed.getBatchId())
            .ingestedAt(typed.getIngestedAt())
            .build();
    }
}
