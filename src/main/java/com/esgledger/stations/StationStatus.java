package com.esgledger.stations;

/**
 * Lifecycle states for a charging station.
 */
public enum StationStatus {
    /**
     * Station accepts revenue transactions.
     */
    ACTIVE,

    /**
     * Station is deactivated. Recorded revenue can still be settled.
     */
    INACTIVE
}
