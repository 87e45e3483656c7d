package com.flagship.gold_history.history;

import lombok.Value;

/**
 * A non-fatal anomaly reported for one snapshot row.
 */
@Value
public class RowDiagnostic {
    String naturalKey;
    HistoryErrorCode code;
    String message;
}
