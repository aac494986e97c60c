package com.flagship.pocket_ledger.ledger;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

import java.time.Instant;

/**
 * Latest known value of one unit of a currency in the reference currency.
 */
@Value
public class ExchangeRate {
    long currencyId;
    FixedAmount rate;
    Instant updatedAt;
}
