package com.snuffles.lotledger.web.controller;

import com.snuffles.lotledger.service.LedgerConsistencyService;
import com.snuffles.lotledger.service.LedgerQueryService;
import com.snuffles.lotledger.service.PositionService;
import com.snuffles.lotledger.web.dto.ConsistencyReportDto;
import com.snuffles.lotledger.web.dto.PositionDto;
import com.snuffles.lotledger.web.dto.PositionLotDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/accounts/{accountId}")
@RequiredArgsConstructor
@Tag(name = "Positions", description = "Positions, their lots and ledger consistency")
public class PositionController {

    private final PositionService positionService;
    private final LedgerQueryService queryService;
    private final LedgerConsistencyService consistencyService;

    @GetMapping("/positions")
    @Operation(summary = "List positions", description = "Returns the account's positions by symbol. Flat positions are included unless activeOnly is set.")
    @ApiResponse(responseCode = "200", description = "Positions fetched", content = @Content(schema = @Schema(implementation = PositionDto.class)))
    public ResponseEntity<List<PositionDto>> getPositions(
        @PathVariable String accountId,
        @RequestParam(defaultValue = "false") boolean activeOnly
    ) {
        return ResponseEntity.ok(positionService.getPositions(accountId, activeOnly));
    }

    @GetMapping("/positions/{symbol}")
    @Operation(summary = "Get a position", description = "Returns quantity, average cost and total cost for one symbol.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Position fetched", content = @Content(schema = @Schema(implementation = PositionDto.class))),
        @ApiResponse(responseCode = "404", description = "No position for the symbol", content = @Content)
    })
    public ResponseEntity<PositionDto> getPosition(@PathVariable String accountId, @PathVariable String symbol) {
        return ResponseEntity.ok(positionService.getPosition(accountId, symbol));
    }

    @GetMapping("/positions/{symbol}/lots")
    @Operation(summary = "List lots", description = "Returns the symbol's lots in FIFO order.")
    @ApiResponse(responseCode = "200", description = "Lots fetched", content = @Content(schema = @Schema(implementation = PositionLotDto.class)))
    public ResponseEntity<List<PositionLotDto>> getLots(
        @PathVariable String accountId,
        @PathVariable String symbol,
        @RequestParam(defaultValue = "false") boolean openOnly
    ) {
        return ResponseEntity.ok(queryService.getLots(accountId, symbol, openOnly));
    }

    @PostMapping("/positions/{symbol}/rebuild")
    @Operation(summary = "Rebuild a position", description = "Recomputes the position from its lots and transaction history.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Position rebuilt", content = @Content(schema = @Schema(implementation = PositionDto.class))),
        @ApiResponse(responseCode = "404", description = "No transactions for the symbol", content = @Content)
    })
    public ResponseEntity<PositionDto> rebuild(@PathVariable String accountId, @PathVariable String symbol) {
        return ResponseEntity.ok(positionService.rebuild(accountId, symbol));
    }

    @GetMapping("/consistency")
    @Operation(summary = "Check ledger consistency", description = "Cross-checks transactions, lots, allocations and positions and lists any mismatch.")
    @ApiResponse(responseCode = "200", description = "Report produced", content = @Content(schema = @Schema(implementation = ConsistencyReportDto.class)))
    public ResponseEntity<ConsistencyReportDto> checkConsistency(@PathVariable String accountId) {
        return ResponseEntity.ok(consistencyService.check(accountId));
    }
}
