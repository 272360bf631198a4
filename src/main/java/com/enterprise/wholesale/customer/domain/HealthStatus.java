package com.enterprise.wholesale.customer.domain;

/**
 * Lifecycle status assigned by the health classifier.
 *
 * <p>{@link #HEALTHY} and {@link #HEALTHY_DECLINING} share the active funnel
 * bucket. {@link #NO_HISTORY} and {@link #EXCLUDED} never enter the funnel.
 */
public enum HealthStatus {
    NO_HISTORY,
    EXCLUDED,
    HEALTHY,
    HEALTHY_DECLINING,
    AT_RISK,
    CHURNING,
    CHURNED;

    public boolean isActive() {
        return this == HEALTHY || this == HEALTHY_DECLINING;
    }

    public boolean inFunnel() {
        return this != NO_HISTORY && this != EXCLUDED;
    }
}
