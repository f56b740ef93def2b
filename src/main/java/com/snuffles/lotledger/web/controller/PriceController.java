package com.snuffles.lotledger.web.controller;

import com.snuffles.lotledger.service.ClosingPriceService;
import com.snuffles.lotledger.web.dto.ClosingPriceDto;
import com.snuffles.lotledger.web.dto.ClosingPriceRequest;
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

@RestController
@RequestMapping("/api/prices")
@RequiredArgsConstructor
@Tag(name = "Prices", description = "Closing prices used for valuation")
public class PriceController {

    private final ClosingPriceService closingPriceService;

    @PutMapping("/{symbol}/{priceDate}")
    @Operation(summary = "Record a closing price", description = "Stores or replaces the close for a symbol on a date.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Close stored", content = @Content(schema = @Schema(implementation = ClosingPriceDto.class))),
        @ApiResponse(responseCode = "400", description = "Validation error", content = @Content)
    })
    public ResponseEntity<ClosingPriceDto> recordClose(
        @PathVariable String symbol,
        @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate priceDate,
        @Valid @RequestBody ClosingPriceRequest request
    ) {
        return ResponseEntity.ok(closingPriceService.recordClose(symbol, priceDate, request));
    }
}
