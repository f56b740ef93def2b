package com.snuffles.lotledger.web.controller;

import com.snuffles.lotledger.service.LedgerQueryService;
import com.snuffles.lotledger.service.TransactionIngestionService;
import com.snuffles.lotledger.web.dto.BatchResultDto;
import com.snuffles.lotledger.web.dto.SaleAllocationDto;
import com.snuffles.lotledger.web.dto.TransactionDto;
import com.snuffles.lotledger.web.dto.TransactionRequest;
import com.snuffles.lotledger.web.dto.TransactionResultDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/accounts/{accountId}/transactions")
@RequiredArgsConstructor
@Tag(name = "Transactions", description = "Record BUY/SELL transactions and inspect their allocations")
public class TransactionController {

    private final TransactionIngestionService ingestionService;
    private final LedgerQueryService queryService;

    @PostMapping
    @Operation(summary = "Record a transaction", description = "Validates and books a transaction. Resubmitting a known external id returns the stored result.")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Transaction applied", content = @Content(schema = @Schema(implementation = TransactionResultDto.class))),
        @ApiResponse(responseCode = "200", description = "External id already applied with the same payload", content = @Content(schema = @Schema(implementation = TransactionResultDto.class))),
        @ApiResponse(responseCode = "400", description = "Validation error", content = @Content),
        @ApiResponse(responseCode = "409", description = "External id already used with a different payload", content = @Content),
        @ApiResponse(responseCode = "422", description = "Not enough open lots for the sale", content = @Content)
    })
    public ResponseEntity<TransactionResultDto> recordTransaction(
        @PathVariable String accountId,
        @Valid @RequestBody TransactionRequest request
    ) {
        TransactionResultDto result = ingestionService.recordTransaction(accountId, request);
        HttpStatus status = result.getStatus() == TransactionResultDto.Status.APPLIED ? HttpStatus.CREATED : HttpStatus.OK;
        return new ResponseEntity<>(result, status);
    }

    @PostMapping("/batch")
    @Operation(summary = "Record transactions in bulk", description = "Books each transaction in order and reports a status per item. Rejected items do not stop the batch.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Batch processed", content = @Content(schema = @Schema(implementation = BatchResultDto.class))),
        @ApiResponse(responseCode = "400", description = "Malformed batch", content = @Content)
    })
    public ResponseEntity<BatchResultDto> recordBatch(
        @PathVariable String accountId,
        @RequestBody List<TransactionRequest> requests
    ) {
        return ResponseEntity.ok(ingestionService.recordBatch(accountId, requests));
    }

    @GetMapping
    @Operation(summary = "List transactions", description = "Returns the account's transactions ordered by date, optionally filtered by symbol and date range.")
    @ApiResponse(responseCode = "200", description = "Transactions fetched", content = @Content(schema = @Schema(implementation = TransactionDto.class)))
    public ResponseEntity<List<TransactionDto>> getTransactions(
        @PathVariable String accountId,
        @RequestParam(required = false) String symbol,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(queryService.getTransactions(accountId, symbol, from, to));
    }

    @GetMapping("/{transactionId}/allocations")
    @Operation(summary = "Allocations of a sale", description = "Returns the lot slices a SELL consumed. Empty for a BUY.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Allocations fetched", content = @Content(schema = @Schema(implementation = SaleAllocationDto.class))),
        @ApiResponse(responseCode = "404", description = "Transaction not found", content = @Content)
    })
    public ResponseEntity<List<SaleAllocationDto>> getAllocations(@PathVariable String accountId, @PathVariable Long transactionId) {
        return ResponseEntity.ok(queryService.getAllocations(accountId, transactionId));
    }
}
