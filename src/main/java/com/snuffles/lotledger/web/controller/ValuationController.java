package com.snuffles.lotledger.web.controller;

import com.snuffles.lotledger.service.ValuationService;
import com.snuffles.lotledger.web.dto.DailyPnlSnapshotDto;
import com.snuffles.lotledger.web.dto.ValuationRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/accounts/{accountId}/valuations")
@RequiredArgsConstructor
@Tag(name = "Valuations", description = "Daily mark-to-market P&L snapshots")
public class ValuationController {

    private final ValuationService valuationService;

    @PostMapping
    @Operation(summary = "Snapshot with an explicit price", description = "Values one position at the given price and upserts the day's snapshot.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Snapshot stored", content = @Content(schema = @Schema(implementation = DailyPnlSnapshotDto.class))),
        @ApiResponse(responseCode = "400", description = "Validation error", content = @Content),
        @ApiResponse(responseCode = "404", description = "No position for the symbol", content = @Content)
    })
    public ResponseEntity<DailyPnlSnapshotDto> snapshot(@PathVariable String accountId, @Valid @RequestBody ValuationRequest request) {
        return ResponseEntity.ok(valuationService.snapshot(
            accountId,
            request.getSymbol(),
            request.getValuationDate(),
            request.getMarketPrice(),
            request.getPriceDate()
        ));
    }

    @PostMapping("/backfill")
    @Operation(summary = "Backfill snapshots", description = "Values every held symbol for each day in the range using recorded closing prices. By default days without a close of their own are skipped.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Snapshots stored", content = @Content(schema = @Schema(implementation = DailyPnlSnapshotDto.class))),
        @ApiResponse(responseCode = "400", description = "Missing, inverted or too long date range", content = @Content)
    })
    public ResponseEntity<List<DailyPnlSnapshotDto>> backfill(
        @PathVariable String accountId,
        @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
        @RequestParam(defaultValue = "true") boolean tradingDaysOnly
    ) {
        return ResponseEntity.ok(valuationService.snapshotRange(accountId, from, to, tradingDaysOnly));
    }

    @PostMapping("/{valuationDate}")
    @Operation(summary = "Snapshot from stored prices", description = "Values one symbol, or every active position when no symbol is given, using recorded closing prices.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Snapshots stored", content = @Content(schema = @Schema(implementation = DailyPnlSnapshotDto.class))),
        @ApiResponse(responseCode = "404", description = "No position or no price for the symbol", content = @Content)
    })
    public ResponseEntity<List<DailyPnlSnapshotDto>> snapshotFromFeed(
        @PathVariable String accountId,
        @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate valuationDate,
        @RequestParam(required = false) String symbol
    ) {
        if (symbol == null || symbol.isBlank()) {
            return ResponseEntity.ok(valuationService.snapshotAccount(accountId, valuationDate));
        }
        return ResponseEntity.ok(List.of(valuationService.snapshotFromFeed(accountId, symbol, valuationDate)));
    }

    @GetMapping
    @Operation(summary = "List snapshots", description = "Returns stored snapshots in date order, optionally filtered by symbol and date range.")
    @ApiResponse(responseCode = "200", description = "Snapshots fetched", content = @Content(schema = @Schema(implementation = DailyPnlSnapshotDto.class)))
    public ResponseEntity<List<DailyPnlSnapshotDto>> getSnapshots(
        @PathVariable String accountId,
        @RequestParam(required = false) String symbol,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(valuationService.getSnapshots(accountId, symbol, from, to));
    }
}
