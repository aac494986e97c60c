package com.flagship.pocket_ledger.api;

import com.flagship.pocket_ledger.api.dto.TransactionRequest;
import com.flagship.pocket_ledger.api.dto.TransactionResponse;
import com.flagship.pocket_ledger.ledger.LedgerService;
import com.flagship.pocket_ledger.ledger.LedgerTransaction;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for recording, editing, deleting and opening transactions.
 *
 * Every response carries the decomposed view of the stored lines, so a client can
 * re-open exactly what was persisted.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<TransactionResponse> record(@Valid @RequestBody TransactionRequest request) {
        log.info("Received {} request", request.getClass().getSimpleName());
        LedgerTransaction recorded = ledgerService.record(request.toIntent());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TransactionResponse.from(ledgerService.open(recorded.getId())));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TransactionResponse> edit(@PathVariable String id,
                                                    @Valid @RequestBody TransactionRequest request) {
        log.info("Received edit of transaction {}", id);
        ledgerService.edit(id, request.toIntent());
        return ResponseEntity.ok(TransactionResponse.from(ledgerService.open(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        ledgerService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> open(@PathVariable String id) {
        return ResponseEntity.ok(TransactionResponse.from(ledgerService.open(id)));
    }
}
