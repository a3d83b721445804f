package com.esgledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the ESG Ledger.
 *
 * ESG Ledger is the value-exchange core of an agricultural ESG rewards economy:
 * a fungible credit ledger, carbon-reduction reward accrual, charging station
 * revenue settlement and a dispute-capable enterprise escrow, with a committee
 * governance workflow gating the privileged ledger operations.
 */
@SpringBootApplication
public class EsgLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EsgLedgerApplication.class, args);
    }
}
