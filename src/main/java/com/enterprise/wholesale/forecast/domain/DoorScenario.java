package com.enterprise.wholesale.forecast.domain;

/**
 * One what-if variation of a forecast and its projection.
 */
public record DoorScenario(
    String name,
    String description,
    ForecastDrivers drivers,
    ForecastProjection projection
) {}
