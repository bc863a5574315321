package com.tradeguard.domain.enums;

/**
 * How the dispatcher turns an approved decision into an order.
 *
 * <ul>
 *   <li>DRY_RUN: risk validation only, nothing is placed or tracked</li>
 *   <li>PAPER: fills are simulated locally and applied through the tracker like live fills</li>
 *   <li>LIVE: orders go to the venue</li>
 * </ul>
 */
public enum ExecutionMode {
    DRY_RUN,
    PAPER,
    LIVE
}
