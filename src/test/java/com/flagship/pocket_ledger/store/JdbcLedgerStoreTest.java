package com.flagship.pocket_ledger.store;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.amount.Sign;
import com.flagship.pocket_ledger.ledger.Account;
import com.flagship.pocket_ledger.ledger.Budget;
import com.flagship.pocket_ledger.ledger.DatedLine;
import com.flagship.pocket_ledger.ledger.LedgerTransaction;
import com.flagship.pocket_ledger.ledger.Line;
import com.flagship.pocket_ledger.ledger.SystemTag;
import com.flagship.pocket_ledger.ledger.Tag;
import com.flagship.pocket_ledger.ledger.TransactionIds;
import com.flagship.pocket_ledger.ledger.exception.InvariantViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behavior against a real PostgreSQL: line writes keep the stored balance equal to
 * the balance recomputed from lines.
 */
@SpringBootTest
@Testcontainers
class JdbcLedgerStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("pocket_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    static final long EUR = 1L;
    static final long USD = 2L;
    static final Instant WHEN = Instant.parse("2024-03-15T10:00:00Z");

    @Autowired
    private LedgerStore store;

    private Account cash;
    private Account bank;
    private long food;

    @BeforeEach
    void setUp() {
        cash = store.createAccount(store.createWallet("Cash"), EUR, FixedAmount.of("100"), true);
        bank = store.createAccount(store.createWallet("Bank"), EUR, FixedAmount.ZERO, true);
        food = store.createTag("Food", Set.of(SystemTag.DEFAULT.id(), SystemTag.EXPENSE.id())).getId();
    }

    private static Line line(long accountId, long tagId, Sign sign, String amount) {
        return Line.builder()
            .accountId(accountId)
            .tagId(tagId)
            .sign(sign)
            .amount(FixedAmount.of(amount))
            .build();
    }

    private FixedAmount balance(Account account) {
        return store.getAccount(account.getId()).orElseThrow().getBalance();
    }

    private void assertBalanceMatchesLines(Account account) {
        assertEquals(store.computeBalanceFromLines(account.getId()), balance(account),
            "Stored balance must equal initial balance plus signed lines for account " + account.getId());
    }

    @Nested
    @DisplayName("1. Balance maintenance")
    class BalanceMaintenance {

        @Test
        @DisplayName("1.1 Insert applies each line once")
        void insert() {
            // Given: a transfer of 40 from cash to bank
            String id = TransactionIds.random();
            LedgerTransaction transfer = new LedgerTransaction(id, WHEN, "rent share", null, List.of(
                line(cash.getId(), SystemTag.TRANSFER.id(), Sign.MINUS, "40"),
                line(bank.getId(), SystemTag.TRANSFER.id(), Sign.PLUS, "40")));

            // When
            store.insertTransaction(transfer);

            // Then
            assertEquals(FixedAmount.of("60"), balance(cash));
            assertEquals(FixedAmount.of("40"), balance(bank));
            assertBalanceMatchesLines(cash);
            assertBalanceMatchesLines(bank);

            LedgerTransaction stored = store.getTransaction(id).orElseThrow();
            assertEquals("rent share", stored.getNote());
            assertEquals(WHEN, stored.getTimestamp());
            assertEquals(2, stored.getLines().size());
            assertEquals(Sign.MINUS, stored.getLines().get(0).getSign());
        }

        @Test
        @DisplayName("1.2 Replace updates in place, moves accounts and drops surplus lines")
        void replace() {
            // Given: an expense of 30 with a 5 fee from cash
            String id = TransactionIds.random();
            store.insertTransaction(new LedgerTransaction(id, WHEN, null, null, List.of(
                line(cash.getId(), food, Sign.MINUS, "30"),
                line(cash.getId(), SystemTag.FEE.id(), Sign.MINUS, "5"))));
            assertEquals(FixedAmount.of("65"), balance(cash));

            // When: the expense grows to 45 and the fee disappears
            store.replaceLines(new LedgerTransaction(id, WHEN, null, null, List.of(
                line(cash.getId(), food, Sign.MINUS, "45"))));

            // Then
            assertEquals(FixedAmount.of("55"), balance(cash));
            assertBalanceMatchesLines(cash);

            // When: it is paid from the bank instead, with a sign flip to a refund
            store.replaceLines(new LedgerTransaction(id, WHEN, null, null, List.of(
                line(bank.getId(), food, Sign.PLUS, "12.34"))));

            // Then
            assertEquals(FixedAmount.of("100"), balance(cash));
            assertEquals(FixedAmount.of("12.34"), balance(bank));
            assertBalanceMatchesLines(cash);
            assertBalanceMatchesLines(bank);
        }

        @Test
        @DisplayName("1.3 Delete reverses every line")
        void delete() {
            String id = TransactionIds.random();
            store.insertTransaction(new LedgerTransaction(id, WHEN, null, null, List.of(
                line(cash.getId(), food, Sign.MINUS, "0.000000000000000001"),
                line(cash.getId(), food, Sign.MINUS, "19.999999999999999999"))));

            assertTrue(store.deleteTransaction(id));

            assertEquals(FixedAmount.of("100"), balance(cash));
            assertBalanceMatchesLines(cash);
            assertTrue(store.getTransaction(id).isEmpty());
            assertFalse(store.deleteTransaction(id));
        }

        @Test
        @DisplayName("1.4 Replacing a missing transaction violates an invariant")
        void replaceMissing() {
            LedgerTransaction missing = new LedgerTransaction(TransactionIds.random(), WHEN, null, null, List.of(
                line(cash.getId(), food, Sign.MINUS, "1")));

            assertThrows(InvariantViolationException.class, () -> store.replaceLines(missing));
        }

        @Test
        @DisplayName("1.5 Delta for an unknown account violates an invariant")
        void unknownAccount() {
            assertThrows(InvariantViolationException.class, () -> store.applyLineDelta(-1L, FixedAmount.ONE));
        }
    }

    @Nested
    @DisplayName("2. Reads")
    class Reads {

        @Test
        @DisplayName("2.1 Ranges are half-open")
        void halfOpenRange() {
            Instant start = Instant.parse("2031-01-01T00:00:00Z");
            Instant end = Instant.parse("2031-02-01T00:00:00Z");
            long counterparty = store.createCounterparty("Bakery");
            store.insertTransaction(new LedgerTransaction(TransactionIds.random(), start, null, counterparty,
                List.of(line(cash.getId(), food, Sign.MINUS, "1"))));
            store.insertTransaction(new LedgerTransaction(TransactionIds.random(), end, null, null,
                List.of(line(cash.getId(), food, Sign.MINUS, "2"))));

            List<DatedLine> january = store.getLinesForAccountInRange(cash.getId(), start, end);

            assertEquals(1, january.size());
            assertEquals(FixedAmount.ONE, january.get(0).getLine().getAmount());
            assertEquals(counterparty, january.get(0).getCounterpartyId());
            assertEquals(1, store.getLinesInRange(start, end).size());
        }

        @Test
        @DisplayName("2.2 Percentage add-ons keep their percentage")
        void percentageAddOn() {
            String id = TransactionIds.random();
            store.insertTransaction(new LedgerTransaction(id, WHEN, null, null, List.of(
                line(cash.getId(), food, Sign.MINUS, "20"),
                line(cash.getId(), SystemTag.FEE.id(), Sign.MINUS, "3").toBuilder()
                    .pctValue(new BigDecimal("0.15"))
                    .common(true)
                    .build())));

            Line addOn = store.getLinesForTransaction(id).get(1);

            assertTrue(addOn.isCommon());
            assertEquals(0, new BigDecimal("0.15").compareTo(addOn.getPctValue()));
        }

        @Test
        @DisplayName("2.3 Created tags are read back with their parents")
        void tags() {
            Tag tag = store.getTag(food).orElseThrow();

            assertEquals("Food", tag.getName());
            assertTrue(tag.hasParent(SystemTag.EXPENSE));
            assertFalse(SystemTag.isSystemTag(tag.getId()));
            assertTrue(store.getTag(SystemTag.FEE.id()).orElseThrow().isCommon());
        }
    }

    @Nested
    @DisplayName("3. Reference data")
    class ReferenceData {

        @Test
        @DisplayName("3.1 Shadow account is created once per wallet and currency")
        void shadowAccount() {
            Account first = store.findOrCreateShadowAccount(cash.getWalletId(), USD);
            Account second = store.findOrCreateShadowAccount(cash.getWalletId(), USD);

            assertEquals(first.getId(), second.getId());
            assertEquals(USD, first.getCurrencyId());
            assertEquals(FixedAmount.ZERO, first.getBalance());
            assertEquals(cash.getId(), store.findOrCreateShadowAccount(cash.getWalletId(), EUR).getId());
        }

        @Test
        @DisplayName("3.2 Latest rate is overwritten")
        void latestRate() {
            store.setLatestRate(3L, FixedAmount.of("1.17"));
            store.setLatestRate(3L, FixedAmount.of("1.16"));

            assertEquals(FixedAmount.of("1.16"), store.latestRate(3L).orElseThrow().getRate());
            assertEquals(EUR, store.referenceCurrencyId());
        }

        @Test
        @DisplayName("3.3 Decimal places are widened, never narrowed")
        void widen() {
            assertTrue(store.widenDecimalPlaces(4L, 2));
            assertFalse(store.widenDecimalPlaces(4L, 1));
            assertEquals(2, store.getCurrency(4L).orElseThrow().getDecimalPlaces());
        }

        @Test
        @DisplayName("3.4 Budgets are stored per tag")
        void budgets() {
            Budget budget = store.createBudget(food, Instant.parse("2024-03-01T00:00:00Z"),
                Instant.parse("2024-04-01T00:00:00Z"), FixedAmount.of("250"));

            assertEquals(budget, store.getBudget(budget.getId()).orElseThrow());
            assertEquals(List.of(budget), store.findBudgets(food));
            assertTrue(budget.covers(Instant.parse("2024-03-31T23:59:59Z")));
            assertFalse(budget.covers(Instant.parse("2024-04-01T00:00:00Z")));
        }
    }
}
