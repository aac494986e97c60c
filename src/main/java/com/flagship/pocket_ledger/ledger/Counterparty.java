package com.flagship.pocket_ledger.ledger;

import lombok.Value;

import java.util.Set;

/**
 * Counterparty of a transaction. The tag affinity only biases category suggestions.
 */
@Value
public class Counterparty {
    long id;
    String name;
    Set<Long> tagAffinity;
}
