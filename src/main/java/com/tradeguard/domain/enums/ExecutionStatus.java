package com.tradeguard.domain.enums;

/**
 * Outcome of a single {@code ExecutionDispatcher.execute} call.
 */
public enum ExecutionStatus {

    /** Risk checks passed in DRY_RUN mode. Nothing was placed. */
    DRY_RUN_APPROVED,

    /** The venue acknowledged the order; fills arrive asynchronously. */
    SUBMITTED,

    /** A paper order was partially filled by the simulator. */
    PARTIALLY_FILLED,

    /** A paper order was completely filled by the simulator. */
    FILLED,

    /** Risk policies or the venue rejected the decision. */
    REJECTED,

    /**
     * The venue did not answer within the acknowledgement timeout. The order may or may not
     * exist; it must be resolved by a status query before anything else is done with its client id.
     */
    INDETERMINATE
}
