package com.flagship.pocket_ledger.classifier;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.amount.Sign;
import com.flagship.pocket_ledger.builder.AddOn;
import com.flagship.pocket_ledger.builder.CategoryEntry;
import com.flagship.pocket_ledger.builder.ExchangeIntent;
import com.flagship.pocket_ledger.builder.ExpenseIntent;
import com.flagship.pocket_ledger.builder.IncomeIntent;
import com.flagship.pocket_ledger.builder.TransactionIntent;
import com.flagship.pocket_ledger.builder.TransferIntent;
import com.flagship.pocket_ledger.ledger.Account;
import com.flagship.pocket_ledger.ledger.LedgerTransaction;
import com.flagship.pocket_ledger.ledger.Line;
import com.flagship.pocket_ledger.ledger.SystemTag;
import com.flagship.pocket_ledger.ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.LongFunction;

/**
 * Infers the transaction mode from a line set and turns persisted lines back into the
 * intent that would build them.
 *
 * Rules, first match wins:
 * <ol>
 *   <li>an INITIAL or ADJUSTMENT line: read-only system entry</li>
 *   <li>exactly two EXCHANGE lines plus a {@code -} category line: multi-currency expense</li>
 *   <li>any EXCHANGE line: exchange</li>
 *   <li>any TRANSFER line: transfer</li>
 *   <li>income when the first line is {@code +}, expense otherwise</li>
 * </ol>
 * Rule 5 looks at lines in {@link #CANONICAL_ORDER} so the result does not depend on the
 * order the store returned them in.
 */
@Component
@Slf4j
public class TransactionClassifier {

    static final Comparator<Line> CANONICAL_ORDER = Comparator
        .comparing(Line::isCommon)
        .thenComparingLong(Line::getTagId)
        .thenComparingLong(Line::getAccountId)
        .thenComparing(Line::getSign)
        .thenComparing(Line::getAmount);

    public Classification classify(Collection<Line> lines) {
        if (lines.stream().anyMatch(line -> line.isTagged(SystemTag.INITIAL))) {
            return Classification.of(TransactionMode.INITIAL_BALANCE);
        }
        if (lines.stream().anyMatch(line -> line.isTagged(SystemTag.ADJUSTMENT))) {
            return Classification.of(TransactionMode.ADJUSTMENT);
        }

        long exchangeLines = lines.stream().filter(line -> line.isTagged(SystemTag.EXCHANGE)).count();
        if (exchangeLines == 2 && lines.stream().anyMatch(TransactionClassifier::isCategoryDebit)) {
            return new Classification(TransactionMode.EXPENSE, true, false);
        }
        if (exchangeLines > 0) {
            return Classification.of(TransactionMode.EXCHANGE);
        }
        if (lines.stream().anyMatch(line -> line.isTagged(SystemTag.TRANSFER))) {
            return Classification.of(TransactionMode.TRANSFER);
        }
        return classifyBySign(lines);
    }

    /**
     * Rebuilds the editable intent of a persisted transaction.
     *
     * @param accounts resolves account ids found on the lines; needed to recover the
     *                 category currency of a multi-currency expense
     */
    public EditableTransaction decompose(LedgerTransaction transaction, LongFunction<Account> accounts) {
        List<Line> lines = transaction.getLines();
        Classification classification = classify(lines);

        TransactionIntent intent = switch (classification.getMode()) {
            case INITIAL_BALANCE, ADJUSTMENT -> null;
            case INCOME -> decomposeIncome(transaction);
            case EXPENSE -> decomposeExpense(transaction, classification.isMultiCurrency(), accounts);
            case TRANSFER -> decomposeTransfer(transaction);
            case EXCHANGE -> decomposeExchange(transaction);
        };

        boolean simpleView = intent instanceof ExpenseIntent expense
            && expense.getEntries().size() == 1
            && expense.getAddOns().stream().allMatch(AddOn::isPercentage);

        return new EditableTransaction(transaction.getId(), classification, intent, simpleView, lines);
    }

    private Classification classifyBySign(Collection<Line> lines) {
        List<Line> ordered = lines.stream().sorted(CANONICAL_ORDER).toList();
        if (ordered.isEmpty()) {
            log.warn("Classifying a transaction without lines, defaulting to expense");
            return new Classification(TransactionMode.EXPENSE, false, true);
        }
        Line first = ordered.stream().filter(line -> !line.isCommon()).findFirst().orElse(ordered.get(0));
        TransactionMode mode = first.getSign() == Sign.PLUS ? TransactionMode.INCOME : TransactionMode.EXPENSE;

        boolean recognized = mode == TransactionMode.INCOME
            ? ordered.size() == 1 && !first.isCommon()
            : !first.isCommon()
                && ordered.stream().filter(line -> !line.isCommon()).allMatch(line -> line.getSign() == Sign.MINUS);
        if (!recognized) {
            log.warn("Line set of transaction {} matches no known shape, classified as {} by sign",
                first.getTransactionId(), mode);
        }
        return new Classification(mode, false, !recognized);
    }

    private IncomeIntent decomposeIncome(LedgerTransaction transaction) {
        Line line = transaction.getLines().stream()
            .filter(candidate -> !candidate.isCommon() && candidate.getSign() == Sign.PLUS)
            .findFirst()
            .orElse(transaction.getLines().get(0));
        return IncomeIntent.builder()
            .accountId(line.getAccountId())
            .tagId(line.getTagId())
            .amount(line.getAmount())
            .timestamp(transaction.getTimestamp())
            .note(transaction.getNote())
            .counterpartyId(transaction.getCounterpartyId())
            .build();
    }

    private ExpenseIntent decomposeExpense(LedgerTransaction transaction, boolean multiCurrency,
                                           LongFunction<Account> accounts) {
        List<CategoryEntry> entries = new ArrayList<>();
        List<AddOn> addOns = new ArrayList<>();
        Line exchangeOut = null;
        Line exchangeIn = null;
        for (Line line : transaction.getLines()) {
            if (line.isTagged(SystemTag.EXCHANGE)) {
                if (line.getSign() == Sign.MINUS) {
                    exchangeOut = line;
                } else {
                    exchangeIn = line;
                }
            } else if (line.isCommon()) {
                addOns.add(line.isPercentage()
                    ? AddOn.percentage(line.getTagId(), line.getPctValue())
                    : AddOn.absolute(line.getTagId(), line.getAmount()));
            } else if (line.getSign() == Sign.MINUS) {
                entries.add(new CategoryEntry(line.getTagId(), line.getAmount()));
            }
        }

        ExpenseIntent.ExpenseIntentBuilder intent = ExpenseIntent.builder()
            .entries(entries)
            .addOns(addOns)
            .timestamp(transaction.getTimestamp())
            .note(transaction.getNote())
            .counterpartyId(transaction.getCounterpartyId());

        if (multiCurrency && exchangeOut != null && exchangeIn != null) {
            Account shadow = accounts.apply(exchangeIn.getAccountId());
            if (shadow == null) {
                throw new ValidationException("accountId", "Unknown account: " + exchangeIn.getAccountId());
            }
            return intent
                .accountId(exchangeOut.getAccountId())
                .paidAmount(exchangeOut.getAmount())
                .categoryCurrencyId(shadow.getCurrencyId())
                .build();
        }

        Long accountId = transaction.getLines().stream()
            .filter(line -> !line.isCommon())
            .map(Line::getAccountId)
            .findFirst()
            .orElse(transaction.getLines().isEmpty() ? null : transaction.getLines().get(0).getAccountId());
        return intent.accountId(accountId).build();
    }

    private TransferIntent decomposeTransfer(LedgerTransaction transaction) {
        Line out = leg(transaction, SystemTag.TRANSFER, Sign.MINUS);
        Line in = leg(transaction, SystemTag.TRANSFER, Sign.PLUS);
        return TransferIntent.builder()
            .fromAccountId(out != null ? out.getAccountId() : null)
            .toAccountId(in != null ? in.getAccountId() : null)
            .amount(out != null ? out.getAmount() : in.getAmount())
            .fee(fee(transaction))
            .timestamp(transaction.getTimestamp())
            .note(transaction.getNote())
            .counterpartyId(transaction.getCounterpartyId())
            .build();
    }

    private ExchangeIntent decomposeExchange(LedgerTransaction transaction) {
        Line out = leg(transaction, SystemTag.EXCHANGE, Sign.MINUS);
        Line in = leg(transaction, SystemTag.EXCHANGE, Sign.PLUS);
        return ExchangeIntent.builder()
            .fromAccountId(out != null ? out.getAccountId() : null)
            .toAccountId(in != null ? in.getAccountId() : null)
            .amount(out != null ? out.getAmount() : null)
            .toAmount(in != null ? in.getAmount() : null)
            .fee(fee(transaction))
            .timestamp(transaction.getTimestamp())
            .note(transaction.getNote())
            .counterpartyId(transaction.getCounterpartyId())
            .build();
    }

    private static Line leg(LedgerTransaction transaction, SystemTag tag, Sign sign) {
        return transaction.getLines().stream()
            .filter(line -> line.isTagged(tag) && line.getSign() == sign)
            .findFirst()
            .orElse(null);
    }

    private static FixedAmount fee(LedgerTransaction transaction) {
        return transaction.getLines().stream()
            .filter(line -> line.isTagged(SystemTag.FEE))
            .map(Line::getAmount)
            .reduce(FixedAmount::add)
            .orElse(null);
    }

    private static boolean isCategoryDebit(Line line) {
        return line.getSign() == Sign.MINUS
            && !line.isCommon()
            && !line.isTagged(SystemTag.EXCHANGE)
            && !line.isTagged(SystemTag.TRANSFER)
            && !line.isTagged(SystemTag.FEE);
    }
}
