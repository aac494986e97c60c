package com.flagship.pocket_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A transaction and its unordered set of lines. The transaction type is never stored;
 * it is derived from the lines by the classifier.
 */
@Value
public class LedgerTransaction {
    String id;
    Instant timestamp;
    String note;
    Long counterpartyId;
    List<Line> lines;

    public LedgerTransaction(String id, Instant timestamp, String note, Long counterpartyId, List<Line> lines) {
        this.id = id;
        this.timestamp = timestamp;
        this.note = note;
        this.counterpartyId = counterpartyId;
        this.lines = List.copyOf(lines);
    }
}
