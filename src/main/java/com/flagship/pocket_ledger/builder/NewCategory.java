package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.ledger.CategoryType;
import lombok.Value;

/**
 * A category tag to be created together with an income.
 */
@Value
public class NewCategory {
    String name;
    CategoryType type;
}
