package com.tradeguard.domain.enums;

/**
 * Abstract trade direction carried by a decision. EXIT closes whatever net position exists.
 */
public enum Direction {
    LONG,
    SHORT,
    EXIT
}
