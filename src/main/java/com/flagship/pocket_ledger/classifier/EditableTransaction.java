package com.flagship.pocket_ledger.classifier;

import com.flagship.pocket_ledger.builder.TransactionIntent;
import com.flagship.pocket_ledger.ledger.Line;
import lombok.Value;

import java.util.List;

/**
 * A persisted transaction turned back into an editable intent.
 *
 * {@code intent} is null for read-only system entries. {@code simpleView} tells the UI
 * it can show a single amount field: one category entry and only percentage add-ons.
 */
@Value
public class EditableTransaction {
    String transactionId;
    Classification classification;
    TransactionIntent intent;
    boolean simpleView;
    List<Line> lines;

    public boolean isReadOnly() {
        return classification.isReadOnly();
    }
}
