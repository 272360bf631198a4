package com.enterprise.wholesale.forecast.domain;

/** Revenue channel with its own seasonality and target. */
public enum Channel {
    B2B,
    CORPORATE
}
