package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.forecast.domain.ForecastDrivers;

/**
 * Door count measured at the start of a forecast job execution.
 */
public class ForecastRunContext {

    private volatile Integer currentDoorCount;

    public void setCurrentDoorCount(int count) {
        this.currentDoorCount = count;
    }

    public int currentDoorCount() {
        if (currentDoorCount == null) {
            throw new IllegalStateException("current door count has not been measured for this run");
        }
        return currentDoorCount;
    }

    /** Planned starting doors when set on the forecast, otherwise today's active doors. */
    public int startingDoors(ForecastDrivers drivers) {
        return drivers.existingDoorsStart() != null ? drivers.existingDoorsStart() : currentDoorCount();
    }
}
