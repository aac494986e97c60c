package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.ledger.LedgerTransaction;
import lombok.Value;

import java.util.List;

/**
 * Output of the builder: the transaction with its lines, plus the rate-cache updates
 * the caller applies after persisting it.
 */
@Value
public class BuildResult {
    LedgerTransaction transaction;
    List<RateUpdate> rateUpdates;
}
