package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.ledger.Account;
import com.flagship.pocket_ledger.ledger.Currency;
import com.flagship.pocket_ledger.ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Reference data the builder reads. Loaded by the caller so the builder itself stays pure.
 */
@Value
@Builder
public class BuildContext {
    String transactionId;
    long referenceCurrencyId;
    @Singular
    Map<Long, Account> accounts;
    @Singular
    Map<Long, Currency> currencies;
    @Singular
    Map<Long, FixedAmount> rates;
    /**
     * Same-wallet account in the category currency of a mixed-currency expense.
     */
    Account shadowAccount;

    public Account requireAccount(Long accountId, String field) {
        if (accountId == null) {
            throw new ValidationException(field, "Account is required");
        }
        Account account = accounts.get(accountId);
        if (account == null) {
            throw new ValidationException(field, "Unknown account: " + accountId);
        }
        return account;
    }

    public Currency requireCurrency(long currencyId) {
        Currency currency = currencies.get(currencyId);
        if (currency == null) {
            throw new ValidationException("currency", "Unknown currency: " + currencyId);
        }
        return currency;
    }

    public boolean isReference(long currencyId) {
        return currencyId == referenceCurrencyId;
    }

    /**
     * Rate snapshot for a currency: 1 for the reference currency, otherwise the cached
     * rate, or 1 when no rate has been observed yet.
     */
    public FixedAmount rateFor(long currencyId) {
        if (isReference(currencyId)) {
            return FixedAmount.ONE;
        }
        return rates.getOrDefault(currencyId, FixedAmount.ONE);
    }
}
