package com.flagship.pocket_ledger.store;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.amount.Sign;
import com.flagship.pocket_ledger.config.LedgerProperties;
import com.flagship.pocket_ledger.ledger.Account;
import com.flagship.pocket_ledger.ledger.BalanceDelta;
import com.flagship.pocket_ledger.ledger.Budget;
import com.flagship.pocket_ledger.ledger.Counterparty;
import com.flagship.pocket_ledger.ledger.Currency;
import com.flagship.pocket_ledger.ledger.DatedLine;
import com.flagship.pocket_ledger.ledger.ExchangeRate;
import com.flagship.pocket_ledger.ledger.LedgerTransaction;
import com.flagship.pocket_ledger.ledger.Line;
import com.flagship.pocket_ledger.ledger.Tag;
import com.flagship.pocket_ledger.ledger.exception.InvariantViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * PostgreSQL implementation of {@link LedgerStore} on plain JDBC.
 *
 * Amounts are stored as {@code (int, frac)} column pairs. Lines keep their position inside
 * the transaction so an edited transaction reads back in the order it was built.
 *
 * Balance maintenance: every INSERT, UPDATE and DELETE of a line is followed by exactly one
 * {@link #applyLineDelta} for its account inside the same {@code @Transactional} boundary,
 * so either both commit or neither does.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String LINE_COLUMNS =
        "l.trx_id, l.account_id, l.tag_id, l.sign, l.amount_int, l.amount_frac, " +
        "l.rate_int, l.rate_frac, l.pct_value, l.is_common";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;

    @Override
    public Optional<Account> getAccount(long accountId) {
        return jdbcTemplate.query(
            "SELECT id, wallet_id, currency_id, initial_balance_int, initial_balance_frac, " +
            "balance_int, balance_frac, is_default FROM account WHERE id = ?",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    @Override
    public Optional<Currency> getCurrency(long currencyId) {
        return jdbcTemplate.query(
            "SELECT id, code, symbol, decimal_places, is_fiat, is_crypto, is_payment_default " +
            "FROM currency WHERE id = ?",
            currencyRowMapper(),
            currencyId
        ).stream().findFirst();
    }

    @Override
    public Optional<Tag> getTag(long tagId) {
        return loadTags("WHERE t.id = ?", tagId).stream().findFirst();
    }

    @Override
    public List<Tag> getTags() {
        return loadTags("");
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> getTransaction(String transactionId) {
        List<LedgerTransaction> headers = jdbcTemplate.query(
            "SELECT id, ts, note, counterparty_id FROM trx WHERE id = ?",
            (rs, rowNum) -> new LedgerTransaction(
                rs.getString("id"),
                rs.getTimestamp("ts").toInstant(),
                rs.getString("note"),
                nullableLong(rs, "counterparty_id"),
                List.of()
            ),
            transactionId
        );
        if (headers.isEmpty()) {
            return Optional.empty();
        }
        LedgerTransaction header = headers.get(0);
        return Optional.of(new LedgerTransaction(header.getId(), header.getTimestamp(), header.getNote(),
            header.getCounterpartyId(), getLinesForTransaction(transactionId)));
    }

    @Override
    public List<Line> getLinesForTransaction(String transactionId) {
        return jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS + " FROM trx_line l WHERE l.trx_id = ? ORDER BY l.position",
            lineRowMapper(),
            transactionId
        );
    }

    @Override
    public List<DatedLine> getLinesForAccountInRange(long accountId, Instant from, Instant to) {
        return jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS + ", t.ts, t.counterparty_id " +
            "FROM trx_line l JOIN trx t ON t.id = l.trx_id " +
            "WHERE l.account_id = ? AND t.ts >= ? AND t.ts < ? " +
            "ORDER BY t.ts, t.id, l.position",
            datedLineRowMapper(),
            accountId,
            Timestamp.from(from),
            Timestamp.from(to)
        );
    }

    @Override
    public List<DatedLine> getLinesInRange(Instant from, Instant to) {
        return jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS + ", t.ts, t.counterparty_id " +
            "FROM trx_line l JOIN trx t ON t.id = l.trx_id " +
            "WHERE t.ts >= ? AND t.ts < ? " +
            "ORDER BY t.ts, t.id, l.position",
            datedLineRowMapper(),
            Timestamp.from(from),
            Timestamp.from(to)
        );
    }

    @Override
    @Transactional
    public void insertTransaction(LedgerTransaction transaction) {
        jdbcTemplate.update(
            "INSERT INTO trx (id, ts, note, counterparty_id) VALUES (?, ?, ?, ?)",
            transaction.getId(),
            Timestamp.from(transaction.getTimestamp()),
            transaction.getNote(),
            transaction.getCounterpartyId()
        );

        List<Line> lines = transaction.getLines();
        for (int position = 0; position < lines.size(); position++) {
            insertLine(transaction.getId(), position, lines.get(position));
        }
        log.debug("Inserted transaction {} with {} lines", transaction.getId(), lines.size());
    }

    @Override
    @Transactional
    public void replaceLines(LedgerTransaction transaction) {
        int updated = jdbcTemplate.update(
            "UPDATE trx SET ts = ?, note = ?, counterparty_id = ? WHERE id = ?",
            Timestamp.from(transaction.getTimestamp()),
            transaction.getNote(),
            transaction.getCounterpartyId(),
            transaction.getId()
        );
        if (updated == 0) {
            throw new InvariantViolationException("Cannot replace lines of missing transaction " + transaction.getId());
        }

        List<Line> before = getLinesForTransaction(transaction.getId());
        List<Line> after = transaction.getLines();
        int paired = Math.min(before.size(), after.size());

        for (int position = 0; position < paired; position++) {
            Line previous = before.get(position);
            Line next = after.get(position);
            if (previous.getAccountId() == next.getAccountId()) {
                updateLine(transaction.getId(), position, previous, next);
            } else {
                deleteLine(transaction.getId(), position, previous);
                insertLine(transaction.getId(), position, next);
            }
        }
        for (int position = paired; position < before.size(); position++) {
            deleteLine(transaction.getId(), position, before.get(position));
        }
        for (int position = paired; position < after.size(); position++) {
            insertLine(transaction.getId(), position, after.get(position));
        }
        log.debug("Replaced {} lines with {} for transaction {}", before.size(), after.size(), transaction.getId());
    }

    @Override
    @Transactional
    public boolean deleteTransaction(String transactionId) {
        List<Line> lines = getLinesForTransaction(transactionId);
        for (int position = 0; position < lines.size(); position++) {
            deleteLine(transactionId, position, lines.get(position));
        }
        int deleted = jdbcTemplate.update("DELETE FROM trx WHERE id = ?", transactionId);
        return deleted > 0;
    }

    @Override
    @Transactional
    public void applyLineDelta(long accountId, FixedAmount delta) {
        List<FixedAmount> balances = jdbcTemplate.query(
            "SELECT balance_int, balance_frac FROM account WHERE id = ? FOR UPDATE",
            (rs, rowNum) -> FixedAmount.of(rs.getLong("balance_int"), rs.getLong("balance_frac")),
            accountId
        );
        if (balances.isEmpty()) {
            throw new InvariantViolationException("Balance delta for unknown account " + accountId);
        }
        FixedAmount balance = balances.get(0).add(delta);
        jdbcTemplate.update(
            "UPDATE account SET balance_int = ?, balance_frac = ? WHERE id = ?",
            balance.getIntPart(),
            balance.getFrac(),
            accountId
        );
    }

    @Override
    @Transactional
    public Account findOrCreateShadowAccount(long walletId, long currencyId) {
        Optional<Account> existing = findAccount(walletId, currencyId);
        if (existing.isPresent()) {
            return existing.get();
        }
        jdbcTemplate.update(
            "INSERT INTO account (wallet_id, currency_id) VALUES (?, ?) " +
            "ON CONFLICT (wallet_id, currency_id) DO NOTHING",
            walletId,
            currencyId
        );
        Account created = findAccount(walletId, currencyId)
            .orElseThrow(() -> new IllegalStateException(
                "Shadow account for wallet " + walletId + " and currency " + currencyId + " was not created"));
        log.info("Created shadow account {} in wallet {} for currency {}", created.getId(), walletId, currencyId);
        return created;
    }

    @Override
    public Optional<ExchangeRate> latestRate(long currencyId) {
        return jdbcTemplate.query(
            "SELECT currency_id, rate_int, rate_frac, updated_at FROM exchange_rate WHERE currency_id = ?",
            (rs, rowNum) -> new ExchangeRate(
                rs.getLong("currency_id"),
                FixedAmount.of(rs.getLong("rate_int"), rs.getLong("rate_frac")),
                rs.getTimestamp("updated_at").toInstant()
            ),
            currencyId
        ).stream().findFirst();
    }

    @Override
    public void setLatestRate(long currencyId, FixedAmount rate) {
        jdbcTemplate.update(
            "INSERT INTO exchange_rate (currency_id, rate_int, rate_frac, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (currency_id) DO UPDATE SET rate_int = EXCLUDED.rate_int, " +
            "rate_frac = EXCLUDED.rate_frac, updated_at = EXCLUDED.updated_at",
            currencyId,
            rate.getIntPart(),
            rate.getFrac()
        );
    }

    @Override
    public long referenceCurrencyId() {
        String code = properties.getReferenceCurrencyCode();
        List<Long> ids = jdbcTemplate.queryForList("SELECT id FROM currency WHERE code = ?", Long.class, code);
        if (ids.isEmpty()) {
            throw new IllegalStateException("Reference currency " + code + " is not configured");
        }
        return ids.get(0);
    }

    @Override
    @Transactional
    public Tag createTag(String name, Set<Long> parentIds) {
        Long tagId = jdbcTemplate.queryForObject(
            "INSERT INTO tag (name, is_common) VALUES (?, FALSE) RETURNING id",
            Long.class,
            name
        );
        for (Long parentId : parentIds) {
            jdbcTemplate.update("INSERT INTO tag_to_tag (child_id, parent_id) VALUES (?, ?)", tagId, parentId);
        }
        log.info("Created tag {} '{}' under {}", tagId, name, parentIds);
        return new Tag(tagId, name, Set.copyOf(parentIds), false);
    }

    @Override
    public boolean widenDecimalPlaces(long currencyId, int decimalPlaces) {
        int updated = jdbcTemplate.update(
            "UPDATE currency SET decimal_places = ? WHERE id = ? AND decimal_places < ?",
            decimalPlaces,
            currencyId,
            decimalPlaces
        );
        return updated > 0;
    }

    @Override
    public Optional<Budget> getBudget(String budgetId) {
        return jdbcTemplate.query(
            "SELECT id, tag_id, start_ts, end_ts, target_int, target_frac FROM budget WHERE id = ?",
            budgetRowMapper(),
            budgetId
        ).stream().findFirst();
    }

    @Override
    public List<Budget> findBudgets(long tagId) {
        return jdbcTemplate.query(
            "SELECT id, tag_id, start_ts, end_ts, target_int, target_frac FROM budget " +
            "WHERE tag_id = ? ORDER BY start_ts",
            budgetRowMapper(),
            tagId
        );
    }

    @Override
    public Budget createBudget(long tagId, Instant start, Instant end, FixedAmount target) {
        Budget budget = new Budget(UUID.randomUUID().toString(), tagId, start, end, target);
        jdbcTemplate.update(
            "INSERT INTO budget (id, tag_id, start_ts, end_ts, target_int, target_frac) VALUES (?, ?, ?, ?, ?, ?)",
            budget.getId(),
            tagId,
            Timestamp.from(start),
            Timestamp.from(end),
            target.getIntPart(),
            target.getFrac()
        );
        return budget;
    }

    @Override
    public long createWallet(String name) {
        Long walletId = jdbcTemplate.queryForObject(
            "INSERT INTO wallet (name) VALUES (?) RETURNING id", Long.class, name);
        return walletId;
    }

    @Override
    public Account createAccount(long walletId, long currencyId, FixedAmount initialBalance, boolean walletDefault) {
        Long accountId = jdbcTemplate.queryForObject(
            "INSERT INTO account (wallet_id, currency_id, initial_balance_int, initial_balance_frac, " +
            "balance_int, balance_frac, is_default) VALUES (?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            walletId,
            currencyId,
            initialBalance.getIntPart(),
            initialBalance.getFrac(),
            initialBalance.getIntPart(),
            initialBalance.getFrac(),
            walletDefault
        );
        return new Account(accountId, walletId, currencyId, initialBalance, initialBalance, walletDefault);
    }

    @Override
    public long createCounterparty(String name) {
        Long counterpartyId = jdbcTemplate.queryForObject(
            "INSERT INTO counterparty (name) VALUES (?) RETURNING id", Long.class, name);
        return counterpartyId;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Counterparty> getCounterparty(long counterpartyId) {
        List<String> names = jdbcTemplate.queryForList(
            "SELECT name FROM counterparty WHERE id = ?", String.class, counterpartyId);
        if (names.isEmpty()) {
            return Optional.empty();
        }
        List<Long> tagIds = jdbcTemplate.queryForList(
            "SELECT tag_id FROM counterparty_to_tags WHERE counterparty_id = ?", Long.class, counterpartyId);
        return Optional.of(new Counterparty(counterpartyId, names.get(0), Set.copyOf(tagIds)));
    }

    @Override
    public void addCounterpartyAffinity(long counterpartyId, Set<Long> tagIds) {
        for (Long tagId : tagIds) {
            jdbcTemplate.update(
                "INSERT INTO counterparty_to_tags (counterparty_id, tag_id) VALUES (?, ?) ON CONFLICT DO NOTHING",
                counterpartyId,
                tagId
            );
        }
    }

    @Override
    @Transactional(readOnly = true)
    public FixedAmount computeBalanceFromLines(long accountId) {
        Account account = getAccount(accountId)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));

        // SUM over BIGINT yields NUMERIC, so fractions cannot overflow here.
        BigDecimal net = jdbcTemplate.query(
            "SELECT sign, SUM(amount_int) AS int_sum, SUM(amount_frac) AS frac_sum " +
            "FROM trx_line WHERE account_id = ? GROUP BY sign",
            rs -> {
                BigDecimal total = BigDecimal.ZERO;
                while (rs.next()) {
                    BigDecimal magnitude = rs.getBigDecimal("int_sum")
                        .add(rs.getBigDecimal("frac_sum").movePointLeft(FixedAmount.SCALE_DIGITS));
                    Sign sign = Sign.fromSymbol(rs.getString("sign"));
                    total = sign == Sign.PLUS ? total.add(magnitude) : total.subtract(magnitude);
                }
                return total;
            },
            accountId
        );
        return account.getInitialBalance().add(FixedAmount.of(net));
    }

    private void insertLine(String transactionId, int position, Line line) {
        jdbcTemplate.update(
            "INSERT INTO trx_line (trx_id, position, account_id, tag_id, sign, amount_int, amount_frac, " +
            "rate_int, rate_frac, pct_value, is_common) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            transactionId,
            position,
            line.getAccountId(),
            line.getTagId(),
            String.valueOf(line.getSign().symbol()),
            line.getAmount().getIntPart(),
            line.getAmount().getFrac(),
            line.getRate().getIntPart(),
            line.getRate().getFrac(),
            line.getPctValue(),
            line.isCommon()
        );
        applyLineDelta(line.getAccountId(), BalanceDelta.between(null, line));
    }

    private void updateLine(String transactionId, int position, Line before, Line after) {
        int updated = jdbcTemplate.update(
            "UPDATE trx_line SET tag_id = ?, sign = ?, amount_int = ?, amount_frac = ?, rate_int = ?, " +
            "rate_frac = ?, pct_value = ?, is_common = ? WHERE trx_id = ? AND position = ?",
            after.getTagId(),
            String.valueOf(after.getSign().symbol()),
            after.getAmount().getIntPart(),
            after.getAmount().getFrac(),
            after.getRate().getIntPart(),
            after.getRate().getFrac(),
            after.getPctValue(),
            after.isCommon(),
            transactionId,
            position
        );
        if (updated != 1) {
            throw new InvariantViolationException(String.format(
                "Expected one line at position %d of transaction %s, updated %d", position, transactionId, updated));
        }
        applyLineDelta(after.getAccountId(), BalanceDelta.between(before, after));
    }

    private void deleteLine(String transactionId, int position, Line line) {
        int deleted = jdbcTemplate.update(
            "DELETE FROM trx_line WHERE trx_id = ? AND position = ?", transactionId, position);
        if (deleted != 1) {
            throw new InvariantViolationException(String.format(
                "Expected one line at position %d of transaction %s, deleted %d", position, transactionId, deleted));
        }
        applyLineDelta(line.getAccountId(), BalanceDelta.between(line, null));
    }

    private Optional<Account> findAccount(long walletId, long currencyId) {
        return jdbcTemplate.query(
            "SELECT id, wallet_id, currency_id, initial_balance_int, initial_balance_frac, " +
            "balance_int, balance_frac, is_default FROM account WHERE wallet_id = ? AND currency_id = ?",
            accountRowMapper(),
            walletId,
            currencyId
        ).stream().findFirst();
    }

    private List<Tag> loadTags(String where, Object... args) {
        Map<Long, String> names = new LinkedHashMap<>();
        Map<Long, Boolean> common = new LinkedHashMap<>();
        Map<Long, Set<Long>> parents = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT t.id, t.name, t.is_common, p.parent_id FROM tag t " +
            "LEFT JOIN tag_to_tag p ON p.child_id = t.id " + where + " ORDER BY t.id",
            rs -> {
                long id = rs.getLong("id");
                names.put(id, rs.getString("name"));
                common.put(id, rs.getBoolean("is_common"));
                Set<Long> tagParents = parents.computeIfAbsent(id, key -> new HashSet<>());
                Long parentId = nullableLong(rs, "parent_id");
                if (parentId != null) {
                    tagParents.add(parentId);
                }
            },
            args
        );

        List<Tag> tags = new ArrayList<>();
        names.forEach((id, name) -> tags.add(new Tag(id, name, Set.copyOf(parents.get(id)), common.get(id))));
        return tags;
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getLong("id"),
            rs.getLong("wallet_id"),
            rs.getLong("currency_id"),
            FixedAmount.of(rs.getLong("initial_balance_int"), rs.getLong("initial_balance_frac")),
            FixedAmount.of(rs.getLong("balance_int"), rs.getLong("balance_frac")),
            rs.getBoolean("is_default")
        );
    }

    private RowMapper<Currency> currencyRowMapper() {
        return (rs, rowNum) -> new Currency(
            rs.getLong("id"),
            rs.getString("code"),
            rs.getString("symbol"),
            rs.getInt("decimal_places"),
            rs.getBoolean("is_fiat"),
            rs.getBoolean("is_crypto"),
            rs.getBoolean("is_payment_default")
        );
    }

    private RowMapper<Budget> budgetRowMapper() {
        return (rs, rowNum) -> new Budget(
            rs.getString("id"),
            rs.getLong("tag_id"),
            rs.getTimestamp("start_ts").toInstant(),
            rs.getTimestamp("end_ts").toInstant(),
            FixedAmount.of(rs.getLong("target_int"), rs.getLong("target_frac"))
        );
    }

    private RowMapper<Line> lineRowMapper() {
        return (rs, rowNum) -> mapLine(rs);
    }

    private RowMapper<DatedLine> datedLineRowMapper() {
        return (rs, rowNum) -> new DatedLine(
            mapLine(rs),
            rs.getTimestamp("ts").toInstant(),
            nullableLong(rs, "counterparty_id")
        );
    }

    private static Line mapLine(ResultSet rs) throws SQLException {
        return Line.builder()
            .transactionId(rs.getString("trx_id"))
            .accountId(rs.getLong("account_id"))
            .tagId(rs.getLong("tag_id"))
            .sign(Sign.fromSymbol(rs.getString("sign")))
            .amount(FixedAmount.of(rs.getLong("amount_int"), rs.getLong("amount_frac")))
            .rate(FixedAmount.of(rs.getLong("rate_int"), rs.getLong("rate_frac")))
            .pctValue(rs.getBigDecimal("pct_value"))
            .common(rs.getBoolean("is_common"))
            .build();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
