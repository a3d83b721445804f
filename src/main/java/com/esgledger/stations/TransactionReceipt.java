package com.esgledger.stations;

import lombok.Value;

/**
 * Fee split of a recorded transaction, returned for reconciliation.
 */
@Value
public class TransactionReceipt {
    String stationId;
    long grossAmount;
    long fee;
    long net;
}
