package com.enterprise.wholesale.forecast.domain;

/**
 * A stored forecast: its key plus the drivers it was saved with.
 */
public record WholesaleForecast(Long forecastId, ForecastDrivers drivers) {}
