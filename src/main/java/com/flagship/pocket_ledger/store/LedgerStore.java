package com.flagship.pocket_ledger.store;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.ledger.Account;
import com.flagship.pocket_ledger.ledger.Budget;
import com.flagship.pocket_ledger.ledger.Counterparty;
import com.flagship.pocket_ledger.ledger.Currency;
import com.flagship.pocket_ledger.ledger.DatedLine;
import com.flagship.pocket_ledger.ledger.ExchangeRate;
import com.flagship.pocket_ledger.ledger.LedgerTransaction;
import com.flagship.pocket_ledger.ledger.Line;
import com.flagship.pocket_ledger.ledger.Tag;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence the ledger engine reads from and writes through.
 *
 * Every line write applies its balance delta to the line's account in the same database
 * transaction, exactly once. Ranges are half-open: {@code [from, to)}.
 */
public interface LedgerStore {

    Optional<Account> getAccount(long accountId);

    Optional<Currency> getCurrency(long currencyId);

    Optional<Tag> getTag(long tagId);

    List<Tag> getTags();

    Optional<LedgerTransaction> getTransaction(String transactionId);

    List<Line> getLinesForTransaction(String transactionId);

    List<DatedLine> getLinesForAccountInRange(long accountId, Instant from, Instant to);

    List<DatedLine> getLinesInRange(Instant from, Instant to);

    void insertTransaction(LedgerTransaction transaction);

    /**
     * Replaces the header and the full line set of an existing transaction.
     */
    void replaceLines(LedgerTransaction transaction);

    /**
     * @return false when no transaction with this id exists
     */
    boolean deleteTransaction(String transactionId);

    void applyLineDelta(long accountId, FixedAmount delta);

    Account findOrCreateShadowAccount(long walletId, long currencyId);

    Optional<ExchangeRate> latestRate(long currencyId);

    void setLatestRate(long currencyId, FixedAmount rate);

    long referenceCurrencyId();

    Tag createTag(String name, Set<Long> parentIds);

    /**
     * Raises the decimal places of a currency; never narrows.
     *
     * @return true when the currency was widened
     */
    boolean widenDecimalPlaces(long currencyId, int decimalPlaces);

    Optional<Budget> getBudget(String budgetId);

    List<Budget> findBudgets(long tagId);

    Budget createBudget(long tagId, Instant start, Instant end, FixedAmount target);

    long createWallet(String name);

    Account createAccount(long walletId, long currencyId, FixedAmount initialBalance, boolean walletDefault);

    long createCounterparty(String name);

    Optional<Counterparty> getCounterparty(long counterpartyId);

    /**
     * Adds tags to the counterparty's affinity set; tags already present are ignored.
     */
    void addCounterpartyAffinity(long counterpartyId, Set<Long> tagIds);

    /**
     * Balance recomputed from scratch as initial balance plus all signed line amounts.
     * Audit only; the stored balance is what the ledger reads.
     */
    FixedAmount computeBalanceFromLines(long accountId);
}
