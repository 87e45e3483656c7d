package com.flagship.gold_history.history;

import com.flagship.gold_history.batch.BatchRun;
import com.flagship.gold_history.entity.AdvanceRequest;
import com.flagship.gold_history.entity.AdvanceRequestDefinition;
import com.flagship.gold_history.entity.EntityDefinitions;
import com.flagship.gold_history.entity.Payment;
import com.flagship.gold_history.hashing.RecordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Annotates advance requests with the payment that settles them.
 *
 * For each payment, the open version of the referenced request is replaced
 * by a version carrying the request's own attributes plus paid_amount,
 * payment_date and payment_ref. The request's key lifecycle is untouched:
 * no request is created or deleted here.
 *
 * A payment whose request has no open version is reported as a
 * DANGLING_REFERENCE diagnostic and skipped; the other payments proceed.
 * When several payments settle the same request, the latest (payment date,
 * then payment ref) wins and the others are reported as DUPLICATE_SETTLEMENT.
 *
 * The payment snapshot is complete: a live request still carrying a
 * settlement that no payment of the snapshot provides any more gets a new
 * version with the settlement columns cleared. Tombstones keep their last
 * settlement.
 *
 * Must run after the request merge of the same or an earlier as-of date
 * has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestSettlementEnricher {

    private static final Comparator<Payment> SETTLEMENT_ORDER = Comparator
        .comparing(Payment::getPaymentDate, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Payment::getRef, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final HistoryStore historyStore;
    private final RecordHasher recordHasher;
    private final IntervalPlanner intervalPlanner;

    @Transactional
    public MergeResult enrich(LocalDate asOf, Collection<Payment> payments, BatchRun batch) {
        Scd2Merger.requireRunning(batch);
        if (payments == null) {
            throw new InvalidSnapshotException("Payment snapshot cannot be null");
        }
        long batchId = batch.getId();
        AdvanceRequestDefinition requests = EntityDefinitions.ADVANCE_REQUEST;
        Map<String, HistoryRecord<AdvanceRequest>> current = historyStore.findCurrent(requests);

        ChangeTally<AdvanceRequest> tally = new ChangeTally<>();
        Set<String> settledRefs = new HashSet<>();

        for (Map.Entry<String, List<Payment>> entry : groupByRequest(payments, tally).entrySet()) {
            String requestRef = entry.getKey();
            List<Payment> settling = entry.getValue();
            HistoryRecord<AdvanceRequest> open = current.get(requestRef);

            if (open == null || open.isDeleted()) {
                for (Payment payment : settling) {
                    tally.anomaly(payment.getRef(), HistoryErrorCode.DANGLING_REFERENCE,
                        String.format("Payment %s references request %s which has no open version",
                            payment.getRef(), requestRef));
                }
                continue;
            }

            settledRefs.add(requestRef);
            Payment settlement = settling.get(settling.size() - 1);
            for (Payment superseded : settling.subList(0, settling.size() - 1)) {
                tally.anomaly(superseded.getRef(), HistoryErrorCode.DUPLICATE_SETTLEMENT,
                    String.format("Payment %s ignored: request %s is settled by payment %s",
                        superseded.getRef(), requestRef, settlement.getRef()));
            }

            AdvanceRequest enriched = open.getAttributes().settledBy(settlement);
            String hash = recordHasher.digest(requests, enriched, false);
            if (hash.equals(open.getRecordHash())) {
                tally.unchanged();
                continue;
            }
            tally.record(ChangeKind.ENRICHED,
                intervalPlanner.supersede(open, enriched, false, hash, asOf, batchId));
        }

        for (HistoryRecord<AdvanceRequest> open : new TreeMap<>(current).values()) {
            if (open.isDeleted() || !open.getAttributes().isSettled()
                    || settledRefs.contains(open.getNaturalKey())) {
                continue;
            }
            AdvanceRequest cleared = open.getAttributes().withoutSettlement();
            String hash = recordHasher.digest(requests, cleared, false);
            log.debug("Request {} lost its settling payment {}", open.getNaturalKey(),
                    open.getAttributes().getPaymentRef());
            tally.record(ChangeKind.UNSETTLED,
                intervalPlanner.supersede(open, cleared, false, hash, asOf, batchId));
        }

        historyStore.apply(requests, tally.writes());

        MergeResult result = tally.toResult(requests.getDataset(), asOf, batchId);
        if (!result.getDiagnostics().isEmpty()) {
            log.warn("Settlement of requests under batch {} reported {} anomalies",
                    batchId, result.getDiagnostics().size());
        }
        log.info("Enriched {} from payments under batch {}: {}", requests.getTable(), batchId, result);
        return result;
    }

    private Map<String, List<Payment>> groupByRequest(Collection<Payment> payments,
                                                      ChangeTally<AdvanceRequest> tally) {
        Map<String, List<Payment>> byRequest = new TreeMap<>();
        for (Payment payment : payments) {
            if (payment.getRequestRef() == null || payment.getRequestRef().isBlank()) {
                tally.anomaly(payment.getRef(), HistoryErrorCode.DANGLING_REFERENCE,
                    "Payment " + payment.getRef() + " does not reference a request");
                continue;
            }
            byRequest.computeIfAbsent(payment.getRequestRef(), ref -> new ArrayList<>()).add(payment);
        }
        byRequest.values().forEach(settling -> settling.sort(SETTLEMENT_ORDER));
        return byRequest;
    }
}
