package com.snuffles.lotledger.repository;

import com.snuffles.lotledger.domain.DailyPnlSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyPnlSnapshotRepository extends JpaRepository<DailyPnlSnapshot, Long> {

    Optional<DailyPnlSnapshot> findByAccountIdAndSymbolAndValuationDate(String accountId, String symbol, LocalDate valuationDate);

    List<DailyPnlSnapshot> findByAccountIdAndSymbolAndValuationDateBetweenOrderByValuationDateAsc(
        String accountId, String symbol, LocalDate from, LocalDate to);

    List<DailyPnlSnapshot> findByAccountIdAndValuationDateBetweenOrderByValuationDateAscSymbolAsc(
        String accountId, LocalDate from, LocalDate to);
}
