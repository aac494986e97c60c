package com.flagship.pocket_ledger.ledger;

import lombok.Value;

/**
 * Currency reference data.
 * Decimal places may be widened when recorded amounts need more precision, never narrowed.
 */
@Value
public class Currency {
    long id;
    String code;
    String symbol;
    int decimalPlaces;
    boolean fiat;
    boolean crypto;
    boolean paymentDefault;
}
