package com.snuffles.lotledger.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class BatchResultDto {

    private int applied;
    private int alreadyApplied;
    private int rejected;
    private List<TransactionResultDto> results;

    public static BatchResultDto of(List<TransactionResultDto> results) {
        int applied = 0;
        int alreadyApplied = 0;
        int rejected = 0;
        for (TransactionResultDto result : results) {
            switch (result.getStatus()) {
                case APPLIED -> applied++;
                case ALREADY_APPLIED -> alreadyApplied++;
                case REJECTED -> rejected++;
            }
        }
        return new BatchResultDto(applied, alreadyApplied, rejected, results);
    }
}
