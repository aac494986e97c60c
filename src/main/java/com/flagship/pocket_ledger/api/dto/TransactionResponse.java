package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.classifier.EditableTransaction;
import com.flagship.pocket_ledger.classifier.TransactionMode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A transaction as the editor sees it: the derived mode, the intent that rebuilds it
 * (absent for read-only entries) and the raw lines.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("mode")
    TransactionMode mode;

    @JsonProperty("multi_currency")
    boolean multiCurrency;

    @JsonProperty("read_only")
    boolean readOnly;

    @JsonProperty("simple_view")
    boolean simpleView;

    @JsonProperty("intent")
    TransactionRequest intent;

    @JsonProperty("lines")
    List<LineResponse> lines;

    public static TransactionResponse from(EditableTransaction editable) {
        return TransactionResponse.builder()
            .id(editable.getTransactionId())
            .mode(editable.getClassification().getMode())
            .multiCurrency(editable.getClassification().isMultiCurrency())
            .readOnly(editable.isReadOnly())
            .simpleView(editable.isSimpleView())
            .intent(TransactionRequest.fromIntent(editable.getIntent()))
            .lines(editable.getLines().stream().map(LineResponse::from).toList())
            .build();
    }
}
