package com.esgledger.common.exception;

/**
 * Thrown when recording revenue against a deactivated station.
 */
public class StationInactiveException extends EsgLedgerException {

    public StationInactiveException(String stationId) {
        super(ErrorKind.STATION_INACTIVE, "Station is not active: " + stationId);
    }
}
