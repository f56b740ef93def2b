package com.snuffles.lotledger.service.allocation;

import com.snuffles.lotledger.domain.PositionLot;

import java.math.BigDecimal;

/**
 * Planned draw-down of a single lot by a sale.
 */
public record LotSlice(
    PositionLot lot,
    BigDecimal quantity,
    BigDecimal commissionShare,
    BigDecimal realizedPnl
) {
}
