package com.enterprise.wholesale.customer.domain;

public enum LifespanBucket {
    UNDER_ONE_YEAR("<1yr"),
    ONE_TO_TWO_YEARS("1-2yr"),
    TWO_TO_THREE_YEARS("2-3yr"),
    THREE_PLUS_YEARS("3+yr");

    private final String label;

    LifespanBucket(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Missing lifespans fall into the first bucket. */
    public static LifespanBucket of(Integer months) {
        if (months == null || months < 12) {
            return UNDER_ONE_YEAR;
        }
        if (months < 24) {
            return ONE_TO_TWO_YEARS;
        }
        if (months < 36) {
            return TWO_TO_THREE_YEARS;
        }
        return THREE_PLUS_YEARS;
    }
}
