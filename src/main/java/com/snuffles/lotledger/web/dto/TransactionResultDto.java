package com.snuffles.lotledger.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of submitting one transaction: what was stored, which lots it touched and the
 * position after it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResultDto {

    private Status status;
    private TransactionDto transaction;
    private PositionDto position;
    @Builder.Default
    private List<PositionLotDto> lotsTouched = List.of();
    @Builder.Default
    private List<SaleAllocationDto> allocations = List.of();
    private String rejectionReason;

    public enum Status {
        APPLIED,
        ALREADY_APPLIED,
        REJECTED
    }

    public static TransactionResultDto rejected(String reason) {
        return TransactionResultDto.builder()
            .status(Status.REJECTED)
            .rejectionReason(reason)
            .build();
    }
}
