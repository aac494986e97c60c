package com.flagship.pocket_ledger.ledger;

import com.flagship.pocket_ledger.builder.BuildContext;
import com.flagship.pocket_ledger.builder.BuildResult;
import com.flagship.pocket_ledger.builder.ExchangeIntent;
import com.flagship.pocket_ledger.builder.ExpenseIntent;
import com.flagship.pocket_ledger.builder.IncomeIntent;
import com.flagship.pocket_ledger.builder.RateUpdate;
import com.flagship.pocket_ledger.builder.TransactionBuilder;
import com.flagship.pocket_ledger.builder.TransactionIntent;
import com.flagship.pocket_ledger.builder.TransferIntent;
import com.flagship.pocket_ledger.classifier.Classification;
import com.flagship.pocket_ledger.classifier.EditableTransaction;
import com.flagship.pocket_ledger.classifier.TransactionClassifier;
import com.flagship.pocket_ledger.ledger.exception.InvariantViolationException;
import com.flagship.pocket_ledger.ledger.exception.ReadOnlyTransactionException;
import com.flagship.pocket_ledger.ledger.exception.TransactionNotFoundException;
import com.flagship.pocket_ledger.ledger.exception.ValidationException;
import com.flagship.pocket_ledger.observability.CorrelationContext;
import com.flagship.pocket_ledger.observability.LedgerMetrics;
import com.flagship.pocket_ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Records, edits and deletes transactions.
 *
 * Each write runs in one database transaction: tag creation, shadow-account creation,
 * line writes with their balance deltas, rate-cache updates and currency widening either
 * all commit or none do.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerStore store;
    private final TransactionBuilder builder;
    private final TransactionClassifier classifier;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @Transactional
    public LedgerTransaction record(TransactionIntent intent) {
        long start = System.nanoTime();
        String transactionId = TransactionIds.random();
        CorrelationContext.setTransactionId(transactionId);
        try {
            BuildResult result = build(transactionId, intent, clock.instant());
            store.insertTransaction(result.getTransaction());
            afterWrite(result);

            Classification classification = classifier.classify(result.getTransaction().getLines());
            metrics.recordTransaction(classification.getMode().name(), "recorded");
            log.info("Recorded {} transaction {} with {} lines",
                classification.getMode(), transactionId, result.getTransaction().getLines().size());
            return result.getTransaction();
        } catch (ValidationException e) {
            metrics.recordTransaction(intentType(intent), "rejected");
            log.warn("Rejected {} intent: {}", intentType(intent), e.getMessage());
            throw e;
        } finally {
            CorrelationContext.clearTransactionId();
            metrics.recordLatency("record", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Replaces the line set of an existing transaction with the lines of a new intent.
     */
    @Transactional
    public LedgerTransaction edit(String transactionId, TransactionIntent intent) {
        long start = System.nanoTime();
        CorrelationContext.setTransactionId(transactionId);
        try {
            LedgerTransaction existing = requireWritable(transactionId);
            BuildResult result = build(transactionId, intent, existing.getTimestamp());
            store.replaceLines(result.getTransaction());
            afterWrite(result);

            Classification classification = classifier.classify(result.getTransaction().getLines());
            metrics.recordTransaction(classification.getMode().name(), "edited");
            log.info("Edited transaction {}: {} lines replaced by {} ({})", transactionId,
                existing.getLines().size(), result.getTransaction().getLines().size(), classification.getMode());
            return result.getTransaction();
        } catch (ValidationException e) {
            metrics.recordTransaction(intentType(intent), "rejected");
            log.warn("Rejected edit of {}: {}", transactionId, e.getMessage());
            throw e;
        } finally {
            CorrelationContext.clearTransactionId();
            metrics.recordLatency("edit", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Transactional
    public void delete(String transactionId) {
        long start = System.nanoTime();
        CorrelationContext.setTransactionId(transactionId);
        try {
            LedgerTransaction existing = requireWritable(transactionId);
            store.deleteTransaction(transactionId);

            Classification classification = classifier.classify(existing.getLines());
            metrics.recordTransaction(classification.getMode().name(), "deleted");
            log.info("Deleted {} transaction {}", classification.getMode(), transactionId);
        } finally {
            CorrelationContext.clearTransactionId();
            metrics.recordLatency("delete", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Loads a transaction and decomposes it into its editable intent.
     */
    @Transactional(readOnly = true)
    public EditableTransaction open(String transactionId) {
        LedgerTransaction transaction = store.getTransaction(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        EditableTransaction editable = classifier.decompose(transaction,
            accountId -> store.getAccount(accountId).orElse(null));
        if (editable.getClassification().isFallback()) {
            metrics.incrementClassificationFallbacks();
        }
        return editable;
    }

    @Transactional(readOnly = true)
    public Classification classify(String transactionId) {
        LedgerTransaction transaction = store.getTransaction(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        Classification classification = classifier.classify(transaction.getLines());
        if (classification.isFallback()) {
            metrics.incrementClassificationFallbacks();
        }
        return classification;
    }

    private LedgerTransaction requireWritable(String transactionId) {
        LedgerTransaction existing = store.getTransaction(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        Classification classification = classifier.classify(existing.getLines());
        if (classification.isReadOnly()) {
            throw new ReadOnlyTransactionException(transactionId, classification.getMode().name());
        }
        return existing;
    }

    /**
     * A missing timestamp falls back to {@code defaultTimestamp}: the clock for new
     * transactions, the stored timestamp for edits.
     */
    private BuildResult build(String transactionId, TransactionIntent intent, Instant defaultTimestamp) {
        if (intent == null) {
            throw new ValidationException("type", "Transaction intent is required");
        }
        TransactionIntent resolved = intent.getTimestamp() == null ? intent.withTimestamp(defaultTimestamp) : intent;
        if (resolved instanceof IncomeIntent income && income.getTagId() == null && income.getNewCategory() != null) {
            resolved = income.withCategory(createCategory(income).getId());
        }
        return builder.build(resolved, loadContext(transactionId, resolved));
    }

    private Tag createCategory(IncomeIntent income) {
        String name = income.getNewCategory().getName();
        if (name == null || name.isBlank()) {
            throw new ValidationException("newCategory.name", "Category name is required");
        }
        if (income.getNewCategory().getType() == null) {
            throw new ValidationException("newCategory.type", "Category type is required");
        }
        Set<Long> parents = income.getNewCategory().getType().parents().stream()
            .map(SystemTag::id)
            .collect(Collectors.toSet());
        return store.createTag(name.trim(), parents);
    }

    private BuildContext loadContext(String transactionId, TransactionIntent intent) {
        if (intent.getCounterpartyId() != null && store.getCounterparty(intent.getCounterpartyId()).isEmpty()) {
            throw new ValidationException("counterpartyId", "Unknown counterparty: " + intent.getCounterpartyId());
        }
        long referenceCurrencyId = store.referenceCurrencyId();
        BuildContext.BuildContextBuilder context = BuildContext.builder()
            .transactionId(transactionId)
            .referenceCurrencyId(referenceCurrencyId);

        Map<Long, Account> accounts = new HashMap<>();
        for (Long accountId : intent.referencedAccountIds()) {
            store.getAccount(accountId).ifPresent(account -> accounts.put(accountId, account));
        }

        if (intent instanceof ExpenseIntent expense && expense.getAccountId() != null) {
            Account paying = accounts.get(expense.getAccountId());
            if (paying != null && expense.isMixedCurrency(paying.getCurrencyId())) {
                if (store.getCurrency(expense.getCategoryCurrencyId()).isEmpty()) {
                    throw new ValidationException("categoryCurrencyId",
                        "Unknown currency: " + expense.getCategoryCurrencyId());
                }
                Account shadow = store.findOrCreateShadowAccount(paying.getWalletId(), expense.getCategoryCurrencyId());
                accounts.put(shadow.getId(), shadow);
                context.shadowAccount(shadow);
            }
        }

        accounts.forEach(context::account);
        accounts.values().stream()
            .map(Account::getCurrencyId)
            .distinct()
            .forEach(currencyId -> {
                store.getCurrency(currencyId).ifPresent(currency -> context.currency(currencyId, currency));
                store.latestRate(currencyId).ifPresent(rate -> context.rate(currencyId, rate.getRate()));
            });
        return context.build();
    }

    private void afterWrite(BuildResult result) {
        for (RateUpdate update : result.getRateUpdates()) {
            store.setLatestRate(update.getCurrencyId(), update.getRate());
            metrics.incrementRateUpdates();
            log.debug("Rate of currency {} set to {}", update.getCurrencyId(), update.getRate());
        }

        Map<Long, Integer> requiredPlaces = new HashMap<>();
        for (Line line : result.getTransaction().getLines()) {
            Account account = store.getAccount(line.getAccountId())
                .orElseThrow(() -> new InvariantViolationException("Line written for missing account " + line.getAccountId()));
            requiredPlaces.merge(account.getCurrencyId(), line.getAmount().requiredDecimalPlaces(), Math::max);
        }
        requiredPlaces.forEach((currencyId, places) -> {
            if (store.widenDecimalPlaces(currencyId, places)) {
                log.info("Widened currency {} to {} decimal places", currencyId, places);
            }
        });

        LedgerTransaction transaction = result.getTransaction();
        if (transaction.getCounterpartyId() != null) {
            Set<Long> categories = transaction.getLines().stream()
                .filter(line -> !line.isCommon() && !SystemTag.isSystemTag(line.getTagId()))
                .map(Line::getTagId)
                .collect(Collectors.toSet());
            store.addCounterpartyAffinity(transaction.getCounterpartyId(), categories);
        }
    }

    private static String intentType(TransactionIntent intent) {
        if (intent instanceof IncomeIntent) {
            return "INCOME";
        } else if (intent instanceof ExpenseIntent) {
            return "EXPENSE";
        } else if (intent instanceof TransferIntent) {
            return "TRANSFER";
        } else if (intent instanceof ExchangeIntent) {
            return "EXCHANGE";
        }
        return "UNKNOWN";
    }
}
