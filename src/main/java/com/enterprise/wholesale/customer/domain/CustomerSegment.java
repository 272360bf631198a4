package com.enterprise.wholesale.customer.domain;

/**
 * Revenue tier of a wholesale account, ordered from largest to smallest.
 */
public enum CustomerSegment {
    MAJOR,
    MID,
    SMALL
}
