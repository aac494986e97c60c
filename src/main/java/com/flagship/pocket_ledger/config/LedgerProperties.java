package com.flagship.pocket_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * Ledger settings from {@code application.yml}.
 */
@Component
public class LedgerProperties {

    @Value("${ledger.reference-currency-code:EUR}")
    private String referenceCurrencyCode;

    @Value("${ledger.zone-id:UTC}")
    private String zoneId;

    /**
     * Currency all summaries are reported in. Rates are the value of one unit of a
     * currency in this currency.
     */
    public String getReferenceCurrencyCode() {
        return referenceCurrencyCode;
    }

    /**
     * Zone that decides which calendar day and month a transaction falls in.
     */
    public ZoneId getZoneId() {
        return ZoneId.of(zoneId);
    }
}
