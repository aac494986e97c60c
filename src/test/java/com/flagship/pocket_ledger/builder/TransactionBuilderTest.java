package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.amount.Sign;
import com.flagship.pocket_ledger.ledger.Account;
import com.flagship.pocket_ledger.ledger.Currency;
import com.flagship.pocket_ledger.ledger.Line;
import com.flagship.pocket_ledger.ledger.SystemTag;
import com.flagship.pocket_ledger.ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Expansion of intents into line sets, and rejection of invalid intents.
 */
class TransactionBuilderTest {

    static final String TRX_ID = "0123456789abcdef";
    static final Instant WHEN = Instant.parse("2024-03-15T10:00:00Z");

    static final long EUR = 1L;
    static final long USD = 2L;

    static final long EUR_CASH = 10L;
    static final long EUR_BANK = 11L;
    static final long USD_CARD = 20L;

    static final long FOOD = 100L;
    static final long HOUSEHOLD = 101L;
    static final long SALARY = 102L;
    static final long TIPS = 103L;

    private final TransactionBuilder builder = new TransactionBuilder();

    static BuildContext.BuildContextBuilder context() {
        return BuildContext.builder()
            .transactionId(TRX_ID)
            .referenceCurrencyId(EUR)
            .account(EUR_CASH, account(EUR_CASH, EUR))
            .account(EUR_BANK, account(EUR_BANK, EUR))
            .account(USD_CARD, account(USD_CARD, USD))
            .currency(EUR, new Currency(EUR, "EUR", "€", 2, true, false, true))
            .currency(USD, new Currency(USD, "USD", "$", 2, true, false, false))
            .rate(USD, FixedAmount.of("0.9"));
    }

    static Account account(long id, long currencyId) {
        return new Account(id, 1L, currencyId, FixedAmount.ZERO, FixedAmount.ZERO, false);
    }

    static FixedAmount amount(String value) {
        return FixedAmount.of(value);
    }

    @Nested
    @DisplayName("1. Expense")
    class Expense {

        @Test
        @DisplayName("1.1 Single-category expense is one - line")
        void singleCategoryExpense() {
            ExpenseIntent intent = ExpenseIntent.builder()
                .accountId(EUR_CASH)
                .entries(List.of(new CategoryEntry(FOOD, amount("12.50"))))
                .timestamp(WHEN)
                .build();

            BuildResult result = builder.build(intent, context().build());

            List<Line> lines = result.getTransaction().getLines();
            assertEquals(1, lines.size());
            Line line = lines.get(0);
            assertEquals(Sign.MINUS, line.getSign());
            assertEquals(amount("12.50"), line.getAmount());
            assertEquals(FOOD, line.getTagId());
            assertEquals(EUR_CASH, line.getAccountId());
            assertEquals(FixedAmount.ONE, line.getRate());
            assertFalse(line.isCommon());
            assertEquals(TRX_ID, line.getTransactionId());
            assertTrue(result.getRateUpdates().isEmpty());
        }

        @Test
        @DisplayName("1.2 Split expense with percentage tip and absolute discount")
        void splitWithAddOns() {
            ExpenseIntent intent = ExpenseIntent.builder()
                .accountId(EUR_CASH)
                .entries(List.of(
                    new CategoryEntry(FOOD, amount("30")),
                    new CategoryEntry(HOUSEHOLD, amount("20"))))
                .addOns(List.of(
                    AddOn.percentage(TIPS, new BigDecimal("0.15")),
                    AddOn.absolute(SystemTag.DISCOUNT.id(), amount("5"))))
                .timestamp(WHEN)
                .build();

            List<Line> lines = builder.build(intent, context().build()).getTransaction().getLines();

            assertEquals(4, lines.size());
            Line tip = lines.get(2);
            assertEquals(TIPS, tip.getTagId());
            assertEquals(Sign.MINUS, tip.getSign());
            assertEquals(amount("7.50"), tip.getAmount());
            assertEquals(0, new BigDecimal("0.15").compareTo(tip.getPctValue()));
            assertTrue(tip.isCommon());

            Line discount = lines.get(3);
            assertEquals(Sign.PLUS, discount.getSign());
            assertEquals(amount("5"), discount.getAmount());
            assertNull(discount.getPctValue());
            assertTrue(discount.isCommon());
        }

        @Test
        @DisplayName("1.3 A 15% tip on 40.00 is 6.00 and keeps its percentage")
        void tipKeepsPercentage() {
            ExpenseIntent intent = ExpenseIntent.builder()
                .accountId(EUR_CASH)
                .entries(List.of(new CategoryEntry(FOOD, amount("40.00"))))
                .addOns(List.of(AddOn.percentage(TIPS, new BigDecimal("0.15"))))
                .timestamp(WHEN)
                .build();

            Line tip = builder.build(intent, context().build()).getTransaction().getLines().get(1);

            assertEquals(amount("6.00"), tip.getAmount());
            assertEquals(new BigDecimal("0.15"), tip.getPctValue());
            assertTrue(tip.isPercentage());
        }

        @Test
        @DisplayName("1.4 Cleared add-ons leave no line behind")
        void clearedAddOnsDropped() {
            ExpenseIntent intent = ExpenseIntent.builder()
                .accountId(EUR_CASH)
                .entries(List.of(new CategoryEntry(FOOD, amount("10"))))
                .addOns(List.of(
                    new AddOn(TIPS, null, null),
                    AddOn.percentage(SystemTag.FEE.id(), BigDecimal.ZERO),
                    AddOn.absolute(SystemTag.FEE.id(), FixedAmount.ZERO)))
                .timestamp(WHEN)
                .build();

            List<Line> lines = builder.build(intent, context().build()).getTransaction().getLines();

            assertEquals(1, lines.size());
        }

        @Test
        @DisplayName("1.5 Percentage rounds to the category currency's decimal places")
        void percentageRounding() {
            ExpenseIntent intent = ExpenseIntent.builder()
                .accountId(EUR_CASH)
                .entries(List.of(new CategoryEntry(FOOD, amount("33.33"))))
                .addOns(List.of(AddOn.percentage(TIPS, new BigDecimal("0.15"))))
                .timestamp(WHEN)
                .build();

            List<Line> lines = builder.build(intent, context().build()).getTransaction().getLines();

            assertEquals(amount("5.00"), lines.get(1).getAmount());
        }

        @Test
        @DisplayName("1.6 Mixed-currency expense books exchange legs and shadow-account category lines")
        void mixedCurrencyExpense() {
            Account shadow = account(EUR_BANK, EUR);
            ExpenseIntent intent = ExpenseIntent.builder()
                .accountId(USD_CARD)
                .entries(List.of(new CategoryEntry(FOOD, amount("18.50"))))
                .categoryCurrencyId(EUR)
                .paidAmount(amount("20.00"))
                .timestamp(WHEN)
                .build();

            BuildResult result = builder.build(intent, context().shadowAccount(shadow).build());

            List<Line> lines = result.getTransaction().getLines();
            assertEquals(3, lines.size());

            Line out = lines.get(0);
            assertTrue(out.isTagged(SystemTag.EXCHANGE));
            assertEquals(Sign.MINUS, out.getSign());
            assertEquals(USD_CARD, out.getAccountId());
            assertEquals(amount("20.00"), out.getAmount());
            assertEquals(amount("0.925"), out.getRate());

            Line in = lines.get(1);
            assertTrue(in.isTagged(SystemTag.EXCHANGE));
            assertEquals(Sign.PLUS, in.getSign());
            assertEquals(EUR_BANK, in.getAccountId());
            assertEquals(amount("18.50"), in.getAmount());

            Line category = lines.get(2);
            assertEquals(FOOD, category.getTagId());
            assertEquals(Sign.MINUS, category.getSign());
            assertEquals(EUR_BANK, category.getAccountId());
            assertEquals(amount("18.50"), category.getAmount());

            assertEquals(List.of(new RateUpdate(USD, amount("0.925"))), result.getRateUpdates());
        }

        @Test
        @DisplayName("1.7 Mixed-currency net includes add-ons on the landing leg")
        void mixedCurrencyWithTip() {
            ExpenseIntent intent = ExpenseIntent.builder()
                .accountId(USD_CARD)
                .entries(List.of(new CategoryEntry(FOOD, amount("20"))))
                .addOns(List.of(AddOn.percentage(TIPS, new BigDecimal("0.1"))))
                .categoryCurrencyId(EUR)
                .paidAmount(amount("24.20"))
                .timestamp(WHEN)
                .build();

            List<Line> lines = builder.build(intent, context().shadowAccount(account(EUR_BANK, EUR)).build())
                .getTransaction().getLines();

            assertEquals(amount("22"), lines.get(1).getAmount());
            assertEquals(EUR_BANK, lines.get(3).getAccountId());
            assertTrue(lines.get(3).isCommon());
        }

        @Test
        @DisplayName("1.8 Mixed-currency expense needs a positive paid amount and a shadow account")
        void mixedCurrencyPreconditions() {
            ExpenseIntent.ExpenseIntentBuilder intent = ExpenseIntent.builder()
                .accountId(USD_CARD)
                .entries(List.of(new CategoryEntry(FOOD, amount("18.50"))))
                .categoryCurrencyId(EUR)
                .timestamp(WHEN);

            ValidationException noPaid = assertThrows(ValidationException.class,
                () -> builder.build(intent.build(), context().shadowAccount(account(EUR_BANK, EUR)).build()));
            assertEquals("paidAmount", noPaid.getField());

            ValidationException noShadow = assertThrows(ValidationException.class,
                () -> builder.build(intent.paidAmount(amount("20")).build(), context().build()));
            assertEquals("categoryCurrencyId", noShadow.getField());
        }

        @Test
        @DisplayName("1.9 Invalid expenses are rejected field by field")
        void invalidExpenses() {
            ExpenseIntent noEntries = ExpenseIntent.builder().accountId(EUR_CASH).timestamp(WHEN).build();
            assertEquals("entries", assertThrows(ValidationException.class,
                () -> builder.build(noEntries, context().build())).getField());

            ExpenseIntent zeroAmount = ExpenseIntent.builder()
                .accountId(EUR_CASH)
                .entries(List.of(new CategoryEntry(FOOD, FixedAmount.ZERO)))
                .timestamp(WHEN)
                .build();
            assertEquals("entries[0].amount", assertThrows(ValidationException.class,
                () -> builder.build(zeroAmount, context().build())).getField());

            ExpenseIntent noCategory = ExpenseIntent.builder()
                .accountId(EUR_CASH)
                .entries(List.of(new CategoryEntry(null, amount("1"))))
                .timestamp(WHEN)
                .build();
            assertEquals("entries[0].tagId", assertThrows(ValidationException.class,
                () -> builder.build(noCategory, context().build())).getField());

            ExpenseIntent tooMuch = ExpenseIntent.builder()
                .accountId(EUR_CASH)
                .entries(List.of(new CategoryEntry(FOOD, amount("1"))))
                .addOns(List.of(AddOn.percentage(TIPS, new BigDecimal("10.01"))))
                .timestamp(WHEN)
                .build();
            assertEquals("addOns[0].percentage", assertThrows(ValidationException.class,
                () -> builder.build(tooMuch, context().build())).getField());

            ExpenseIntent amountAndZeroPercentage = ExpenseIntent.builder()
                .accountId(EUR_CASH)
                .entries(List.of(new CategoryEntry(FOOD, amount("40.00"))))
                .addOns(List.of(new AddOn(TIPS, amount("5"), BigDecimal.ZERO)))
                .timestamp(WHEN)
                .build();
            assertEquals("addOns[0]", assertThrows(ValidationException.class,
                () -> builder.build(amountAndZeroPercentage, context().build())).getField());

            ExpenseIntent unknownAccount = ExpenseIntent.builder()
                .accountId(999L)
                .entries(List.of(new CategoryEntry(FOOD, amount("1"))))
                .timestamp(WHEN)
                .build();
            assertEquals("accountId", assertThrows(ValidationException.class,
                () -> builder.build(unknownAccount, context().build())).getField());
        }
    }

    @Nested
    @DisplayName("2. Income")
    class Income {

        @Test
        @DisplayName("2.1 Income is one + line with the cached rate of its currency")
        void incomeLine() {
            IncomeIntent intent = IncomeIntent.builder()
                .accountId(USD_CARD)
                .tagId(SALARY)
                .amount(amount("1000"))
                .timestamp(WHEN)
                .build();

            List<Line> lines = builder.build(intent, context().build()).getTransaction().getLines();

            assertEquals(1, lines.size());
            assertEquals(Sign.PLUS, lines.get(0).getSign());
            assertEquals(amount("0.9"), lines.get(0).getRate());
        }

        @Test
        @DisplayName("2.2 System tags cannot be income categories")
        void systemTagRejected() {
            IncomeIntent intent = IncomeIntent.builder()
                .accountId(EUR_CASH)
                .tagId(SystemTag.TRANSFER.id())
                .amount(amount("1"))
                .timestamp(WHEN)
                .build();

            assertThrows(ValidationException.class, () -> builder.build(intent, context().build()));
        }

        @Test
        @DisplayName("2.3 Missing timestamp is rejected")
        void missingTimestamp() {
            IncomeIntent intent = IncomeIntent.builder().accountId(EUR_CASH).tagId(SALARY).amount(amount("1")).build();

            assertEquals("timestamp", assertThrows(ValidationException.class,
                () -> builder.build(intent, context().build())).getField());
        }
    }

    @Nested
    @DisplayName("3. Transfer")
    class Transfer {

        @Test
        @DisplayName("3.1 Transfer of 100.00 with a 1.50 fee gives three lines")
        void transferWithFee() {
            TransferIntent intent = TransferIntent.builder()
                .fromAccountId(EUR_CASH)
                .toAccountId(EUR_BANK)
                .amount(amount("100.00"))
                .fee(amount("1.50"))
                .timestamp(WHEN)
                .build();

            List<Line> lines = builder.build(intent, context().build()).getTransaction().getLines();

            assertEquals(3, lines.size());
            assertEquals(SystemTag.TRANSFER.id(), lines.get(0).getTagId());
            assertEquals(Sign.MINUS, lines.get(0).getSign());
            assertEquals(EUR_CASH, lines.get(0).getAccountId());
            assertEquals(Sign.PLUS, lines.get(1).getSign());
            assertEquals(EUR_BANK, lines.get(1).getAccountId());
            assertEquals(lines.get(0).getAmount(), lines.get(1).getAmount());

            Line fee = lines.get(2);
            assertTrue(fee.isTagged(SystemTag.FEE));
            assertEquals(Sign.MINUS, fee.getSign());
            assertEquals(EUR_CASH, fee.getAccountId());
            assertEquals(amount("1.50"), fee.getAmount());
        }

        @Test
        @DisplayName("3.2 Zero fee leaves no fee line")
        void zeroFee() {
            TransferIntent intent = TransferIntent.builder()
                .fromAccountId(EUR_CASH)
                .toAccountId(EUR_BANK)
                .amount(amount("5"))
                .fee(FixedAmount.ZERO)
                .timestamp(WHEN)
                .build();

            assertEquals(2, builder.build(intent, context().build()).getTransaction().getLines().size());
        }

        @Test
        @DisplayName("3.3 Invalid transfers are rejected")
        void invalidTransfers() {
            TransferIntent.TransferIntentBuilder base = TransferIntent.builder()
                .fromAccountId(EUR_CASH)
                .amount(amount("5"))
                .timestamp(WHEN);

            assertEquals("toAccountId", assertThrows(ValidationException.class,
                () -> builder.build(base.build(), context().build())).getField());
            assertEquals("toAccountId", assertThrows(ValidationException.class,
                () -> builder.build(base.toAccountId(EUR_CASH).build(), context().build())).getField());
            assertEquals("toAccountId", assertThrows(ValidationException.class,
                () -> builder.build(base.toAccountId(USD_CARD).build(), context().build())).getField());
            assertEquals("amount", assertThrows(ValidationException.class,
                () -> builder.build(base.toAccountId(EUR_BANK).amount(amount("-5")).build(), context().build()))
                .getField());
        }
    }

    @Nested
    @DisplayName("4. Exchange")
    class Exchange {

        @Test
        @DisplayName("4.1 Exchange of 50.00 EUR for 45.00 USD keeps both amounts and realizes the rate")
        void exchangeRealizesRate() {
            ExchangeIntent intent = ExchangeIntent.builder()
                .fromAccountId(EUR_CASH)
                .toAccountId(USD_CARD)
                .amount(amount("50.00"))
                .toAmount(amount("45.00"))
                .timestamp(WHEN)
                .build();

            BuildResult result = builder.build(intent, context().build());

            List<Line> lines = result.getTransaction().getLines();
            assertEquals(2, lines.size());
            assertTrue(lines.stream().allMatch(line -> line.isTagged(SystemTag.EXCHANGE)));
            assertEquals(amount("50.00"), lines.get(0).getAmount());
            assertEquals(amount("45.00"), lines.get(1).getAmount());
            assertEquals(FixedAmount.ONE, lines.get(0).getRate());

            FixedAmount realized = amount("50").divide(amount("45"));
            assertEquals(realized, lines.get(1).getRate());
            assertEquals(List.of(new RateUpdate(USD, realized)), result.getRateUpdates());
        }

        @Test
        @DisplayName("4.2 Invalid exchanges are rejected")
        void invalidExchanges() {
            ExchangeIntent sameCurrency = ExchangeIntent.builder()
                .fromAccountId(EUR_CASH)
                .toAccountId(EUR_BANK)
                .amount(amount("1"))
                .toAmount(amount("1"))
                .timestamp(WHEN)
                .build();
            assertEquals("toAccountId", assertThrows(ValidationException.class,
                () -> builder.build(sameCurrency, context().build())).getField());

            ExchangeIntent noDestinationAmount = ExchangeIntent.builder()
                .fromAccountId(EUR_CASH)
                .toAccountId(USD_CARD)
                .amount(amount("1"))
                .toAmount(FixedAmount.ZERO)
                .timestamp(WHEN)
                .build();
            assertEquals("toAmount", assertThrows(ValidationException.class,
                () -> builder.build(noDestinationAmount, context().build())).getField());
        }
    }

    @Test
    @DisplayName("Building the same intent twice gives the same lines")
    void deterministic() {
        ExpenseIntent intent = ExpenseIntent.builder()
            .accountId(EUR_CASH)
            .entries(List.of(new CategoryEntry(FOOD, amount("30")), new CategoryEntry(HOUSEHOLD, amount("20"))))
            .addOns(List.of(AddOn.percentage(TIPS, new BigDecimal("0.1"))))
            .timestamp(WHEN)
            .build();

        assertEquals(builder.build(intent, context().build()), builder.build(intent, context().build()));
    }
}
