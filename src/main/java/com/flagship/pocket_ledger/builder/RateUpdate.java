package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

/**
 * Exchange-rate cache update implied by a built transaction.
 */
@Value
public class RateUpdate {
    long currencyId;
    FixedAmount rate;
}
