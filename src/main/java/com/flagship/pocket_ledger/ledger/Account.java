package com.flagship.pocket_ledger.ledger;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

/**
 * An account holds one currency inside a wallet.
 *
 * Invariant: balance = initialBalance + sum of signed line amounts referencing this account.
 * The balance is maintained incrementally by the store, never recomputed on the hot path.
 */
@Value
public class Account {
    long id;
    long walletId;
    long currencyId;
    FixedAmount initialBalance;
    FixedAmount balance;
    boolean walletDefault;
}
