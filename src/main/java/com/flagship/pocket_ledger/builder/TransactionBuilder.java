package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.amount.Sign;
import com.flagship.pocket_ledger.ledger.Account;
import com.flagship.pocket_ledger.ledger.Currency;
import com.flagship.pocket_ledger.ledger.LedgerTransaction;
import com.flagship.pocket_ledger.ledger.Line;
import com.flagship.pocket_ledger.ledger.SystemTag;
import com.flagship.pocket_ledger.ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a transaction intent into its canonical line set.
 *
 * The builder is pure and deterministic: the same intent and context always give the
 * same lines. Persisting the lines and applying rate-cache updates are left to the caller.
 *
 * Line shapes:
 * <ul>
 *   <li>Income: one {@code +} line under the category.</li>
 *   <li>Expense: one {@code -} line per category entry plus one line per add-on
 *       ({@code +} for DISCOUNT, {@code -} otherwise). A purchase priced in another currency
 *       adds two EXCHANGE legs and books the category lines on the shadow account.</li>
 *   <li>Transfer: {@code -}/{@code +} TRANSFER lines of equal magnitude, optional FEE on the source.</li>
 *   <li>Exchange: {@code -}/{@code +} EXCHANGE lines with independent amounts, optional FEE on the source.</li>
 * </ul>
 *
 * Any failed precondition raises {@link ValidationException} before a single line is returned.
 */
@Component
@Slf4j
public class TransactionBuilder {

    /**
     * Upper bound for percentage add-ons (10 = 1000%).
     */
    static final BigDecimal MAX_PERCENTAGE = BigDecimal.TEN;

    public BuildResult build(TransactionIntent intent, BuildContext context) {
        if (intent == null) {
            throw new ValidationException("type", "Transaction intent is required");
        }
        if (intent.getTimestamp() == null) {
            throw new ValidationException("timestamp", "Timestamp is required");
        }

        List<RateUpdate> rateUpdates = new ArrayList<>();
        List<Line> lines;
        if (intent instanceof IncomeIntent income) {
            lines = buildIncome(income, context);
        } else if (intent instanceof ExpenseIntent expense) {
            lines = buildExpense(expense, context, rateUpdates);
        } else if (intent instanceof TransferIntent transfer) {
            lines = buildTransfer(transfer, context);
        } else if (intent instanceof ExchangeIntent exchange) {
            lines = buildExchange(exchange, context, rateUpdates);
        } else {
            throw new ValidationException("type", "Unsupported intent: " + intent.getClass().getSimpleName());
        }

        log.debug("Built {} lines for transaction {} ({})",
            lines.size(), context.getTransactionId(), intent.getClass().getSimpleName());

        LedgerTransaction transaction = new LedgerTransaction(
            context.getTransactionId(),
            intent.getTimestamp(),
            intent.getNote(),
            intent.getCounterpartyId(),
            lines
        );
        return new BuildResult(transaction, List.copyOf(rateUpdates));
    }

    private List<Line> buildIncome(IncomeIntent intent, BuildContext context) {
        Account account = context.requireAccount(intent.getAccountId(), "accountId");
        long tagId = requireCategory(intent.getTagId(), "tagId");
        requirePositive(intent.getAmount(), "amount");

        return List.of(line(context, account, tagId, Sign.PLUS, intent.getAmount(),
            context.rateFor(account.getCurrencyId()), null, false));
    }

    private List<Line> buildExpense(ExpenseIntent intent, BuildContext context, List<RateUpdate> rateUpdates) {
        Account account = context.requireAccount(intent.getAccountId(), "accountId");
        if (intent.getEntries() == null || intent.getEntries().isEmpty()) {
            throw new ValidationException("entries", "At least one category is required");
        }
        for (int i = 0; i < intent.getEntries().size(); i++) {
            CategoryEntry entry = intent.getEntries().get(i);
            requireCategory(entry.getTagId(), "entries[" + i + "].tagId");
            requirePositive(entry.getAmount(), "entries[" + i + "].amount");
        }

        boolean mixed = intent.isMixedCurrency(account.getCurrencyId());
        Account categoryAccount = mixed ? requireShadowAccount(intent, account, context) : account;
        if (!mixed && intent.getPaidAmount() != null) {
            throw new ValidationException("paidAmount", "Paid amount only applies when the category currency differs");
        }
        Currency categoryCurrency = context.requireCurrency(categoryAccount.getCurrencyId());

        FixedAmount base = intent.baseAmount();
        List<Line> addOnLines = new ArrayList<>();
        FixedAmount net = base;
        List<AddOn> addOns = intent.getAddOns() == null ? List.of() : intent.getAddOns();
        for (int i = 0; i < addOns.size(); i++) {
            AddOn addOn = addOns.get(i);
            if (addOn.getAmount() != null && addOn.getPercentage() != null) {
                throw new ValidationException("addOns[" + i + "]", "Set either an amount or a percentage, not both");
            }
            if (addOn.isCleared()) {
                continue;
            }
            long tagId = requireAddOnTag(addOn.getTagId(), "addOns[" + i + "].tagId");
            FixedAmount amount = resolveAddOnAmount(addOn, base, categoryCurrency, "addOns[" + i + "]");
            if (amount.isZero()) {
                continue;
            }
            Sign sign = SystemTag.DISCOUNT.is(tagId) ? Sign.PLUS : Sign.MINUS;
            net = sign == Sign.PLUS ? net.subtract(amount) : net.add(amount);
            addOnLines.add(Line.builder()
                .transactionId(context.getTransactionId())
                .accountId(categoryAccount.getId())
                .tagId(tagId)
                .sign(sign)
                .amount(amount)
                .pctValue(addOn.getPercentage())
                .common(true)
                .build());
        }

        FixedAmount categoryRate = context.rateFor(categoryAccount.getCurrencyId());
        FixedAmount payingRate = context.rateFor(account.getCurrencyId());
        List<Line> lines = new ArrayList<>();
        if (mixed) {
            requirePositive(intent.getPaidAmount(), "paidAmount");
            if (!net.isPositive()) {
                throw new ValidationException("addOns", "Discounts exceed the purchase amount");
            }
            if (context.isReference(account.getCurrencyId())) {
                categoryRate = intent.getPaidAmount().divide(net);
                rateUpdates.add(new RateUpdate(categoryAccount.getCurrencyId(), categoryRate));
            } else if (context.isReference(categoryAccount.getCurrencyId())) {
                payingRate = net.divide(intent.getPaidAmount());
                rateUpdates.add(new RateUpdate(account.getCurrencyId(), payingRate));
            }
            lines.add(line(context, account, SystemTag.EXCHANGE.id(), Sign.MINUS, intent.getPaidAmount(),
                payingRate, null, false));
            lines.add(line(context, categoryAccount, SystemTag.EXCHANGE.id(), Sign.PLUS, net,
                categoryRate, null, false));
        }

        for (CategoryEntry entry : intent.getEntries()) {
            lines.add(line(context, categoryAccount, entry.getTagId(), Sign.MINUS, entry.getAmount(),
                categoryRate, null, false));
        }
        for (Line addOnLine : addOnLines) {
            lines.add(addOnLine.toBuilder().rate(categoryRate).build());
        }
        return lines;
    }

    private List<Line> buildTransfer(TransferIntent intent, BuildContext context) {
        Account from = context.requireAccount(intent.getFromAccountId(), "fromAccountId");
        Account to = requireDestination(intent.getToAccountId(), from, context);
        if (from.getCurrencyId() != to.getCurrencyId()) {
            throw new ValidationException("toAccountId", "Transfer requires accounts of the same currency");
        }
        requirePositive(intent.getAmount(), "amount");

        FixedAmount rate = context.rateFor(from.getCurrencyId());
        List<Line> lines = new ArrayList<>();
        lines.add(line(context, from, SystemTag.TRANSFER.id(), Sign.MINUS, intent.getAmount(), rate, null, false));
        lines.add(line(context, to, SystemTag.TRANSFER.id(), Sign.PLUS, intent.getAmount(), rate, null, false));
        addFee(lines, intent.getFee(), from, rate, context);
        return lines;
    }

    private List<Line> buildExchange(ExchangeIntent intent, BuildContext context, List<RateUpdate> rateUpdates) {
        Account from = context.requireAccount(intent.getFromAccountId(), "fromAccountId");
        Account to = requireDestination(intent.getToAccountId(), from, context);
        if (from.getCurrencyId() == to.getCurrencyId()) {
            throw new ValidationException("toAccountId", "Exchange requires accounts of different currencies");
        }
        requirePositive(intent.getAmount(), "amount");
        if (intent.getToAmount() == null || !intent.getToAmount().isPositive()) {
            throw new ValidationException("toAmount", "Destination amount must be positive");
        }

        FixedAmount fromRate = context.rateFor(from.getCurrencyId());
        FixedAmount toRate = context.rateFor(to.getCurrencyId());
        if (context.isReference(from.getCurrencyId())) {
            toRate = intent.getAmount().divide(intent.getToAmount());
            rateUpdates.add(new RateUpdate(to.getCurrencyId(), toRate));
        } else if (context.isReference(to.getCurrencyId())) {
            fromRate = intent.getToAmount().divide(intent.getAmount());
            rateUpdates.add(new RateUpdate(from.getCurrencyId(), fromRate));
        }

        List<Line> lines = new ArrayList<>();
        lines.add(line(context, from, SystemTag.EXCHANGE.id(), Sign.MINUS, intent.getAmount(), fromRate, null, false));
        lines.add(line(context, to, SystemTag.EXCHANGE.id(), Sign.PLUS, intent.getToAmount(), toRate, null, false));
        addFee(lines, intent.getFee(), from, fromRate, context);
        return lines;
    }

    private void addFee(List<Line> lines, FixedAmount fee, Account source, FixedAmount rate, BuildContext context) {
        // A cleared fee leaves no line and no tag association behind.
        if (fee == null || fee.isZero()) {
            return;
        }
        if (fee.isNegative()) {
            throw new ValidationException("fee", "Fee cannot be negative");
        }
        lines.add(line(context, source, SystemTag.FEE.id(), Sign.MINUS, fee, rate, null, true));
    }

    private FixedAmount resolveAddOnAmount(AddOn addOn, FixedAmount base, Currency currency, String field) {
        if (addOn.isPercentage()) {
            BigDecimal percentage = addOn.getPercentage();
            if (percentage.signum() < 0 || percentage.compareTo(MAX_PERCENTAGE) > 0) {
                throw new ValidationException(field + ".percentage", "Percentage must be between 0 and 1000%");
            }
            return base.multiply(percentage).roundTo(currency.getDecimalPlaces());
        }
        if (addOn.getAmount().isNegative()) {
            throw new ValidationException(field + ".amount", "Amount must be positive");
        }
        return addOn.getAmount();
    }

    private Account requireShadowAccount(ExpenseIntent intent, Account paying, BuildContext context) {
        Account shadow = context.getShadowAccount();
        if (shadow == null
                || shadow.getWalletId() != paying.getWalletId()
                || shadow.getCurrencyId() != intent.getCategoryCurrencyId()) {
            throw new ValidationException("categoryCurrencyId",
                "No account in the paying wallet holds currency " + intent.getCategoryCurrencyId());
        }
        return shadow;
    }

    private Account requireDestination(Long toAccountId, Account from, BuildContext context) {
        if (toAccountId == null) {
            throw new ValidationException("toAccountId", "Destination account is required");
        }
        if (toAccountId == from.getId()) {
            throw new ValidationException("toAccountId", "Destination account must differ from the source");
        }
        return context.requireAccount(toAccountId, "toAccountId");
    }

    private long requireCategory(Long tagId, String field) {
        long id = requireTag(tagId, field);
        SystemTag.fromId(id).ifPresent(tag -> {
            throw new ValidationException(field, "System tag " + tag + " cannot be used as a category");
        });
        return id;
    }

    private long requireAddOnTag(Long tagId, String field) {
        long id = requireTag(tagId, field);
        SystemTag.fromId(id)
            .filter(tag -> tag != SystemTag.FEE && tag != SystemTag.DISCOUNT)
            .ifPresent(tag -> {
                throw new ValidationException(field, "System tag " + tag + " cannot be used as an add-on");
            });
        return id;
    }

    private long requireTag(Long tagId, String field) {
        if (tagId == null) {
            throw new ValidationException(field, "Category is required");
        }
        return tagId;
    }

    private void requirePositive(FixedAmount amount, String field) {
        if (amount == null || !amount.isPositive()) {
            throw new ValidationException(field, "Amount must be positive");
        }
    }

    private Line line(BuildContext context, Account account, long tagId, Sign sign, FixedAmount amount,
                      FixedAmount rate, BigDecimal pctValue, boolean common) {
        return Line.builder()
            .transactionId(context.getTransactionId())
            .accountId(account.getId())
            .tagId(tagId)
            .sign(sign)
            .amount(amount)
            .rate(rate)
            .pctValue(pctValue)
            .common(common)
            .build();
    }
}
