package com.flagship.gold_history.history;

/**
 * What a merge did to one natural key.
 */
public enum ChangeKind {
    /** First version of a new key. */
    INSERTED,
    /** Attributes changed: current version closed, successor opened. */
    UPDATED,
    /** Same-day change: current version overwritten in place. */
    CORRECTED,
    /** Key absent from the snapshot: tombstone opened. */
    DELETED,
    /** Key back after a tombstone. */
    RESURRECTED,
    /** Request version patched with settlement attributes. */
    ENRICHED,
    /** Settlement withdrawn: no payment of the snapshot settles the request any more. */
    UNSETTLED,
    UNCHANGED
}
