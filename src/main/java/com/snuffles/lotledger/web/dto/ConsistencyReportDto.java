package com.snuffles.lotledger.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
public class ConsistencyReportDto {

    private String accountId;
    private int symbolsChecked;
    private List<IssueDto> issues;
    private Map<String, SymbolStatisticsDto> statistics;

    public boolean isConsistent() {
        return issues.isEmpty();
    }

    @Data
    @AllArgsConstructor
    public static class IssueDto {
        private String type;
        private String symbol;
        private Long referenceId;
        private String description;
    }

    @Data
    @AllArgsConstructor
    public static class SymbolStatisticsDto {
        private int buyTransactions;
        private int sellTransactions;
        private int openLots;
        private int closedLots;
    }
}
