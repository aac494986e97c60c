package com.flagship.pocket_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * A line joined with the timestamp and counterparty of its transaction, as read by aggregation queries.
 */
@Value
public class DatedLine {
    Line line;
    Instant timestamp;
    Long counterpartyId;
}
