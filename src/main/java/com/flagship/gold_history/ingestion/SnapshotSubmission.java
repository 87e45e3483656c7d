package com.flagship.gold_history.ingestion;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * A full snapshot of one entity, as delivered by the source extract.
 *
 * @param <T> the entity value type
 */
@Value
@Builder
public class SnapshotSubmission<T> {

    LocalDate asOf;

    /**
     * Source label recorded on the ledger; the ledger defaults it to "erp".
     */
    String sourceName;

    /**
     * Checksum of the source file. When absent, a checksum of the rows is
     * computed so that the same content maps to the same ledger entry.
     */
    String checksum;

    @Singular
    List<T> rows;
}
