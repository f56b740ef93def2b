package com.snuffles.lotledger.repository;

import com.snuffles.lotledger.domain.SaleAllocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Repository
public interface SaleAllocationRepository extends JpaRepository<SaleAllocation, Long> {

    List<SaleAllocation> findBySaleTransactionIdOrderByIdAsc(Long saleTransactionId);

    @Query("""
        select a.lotId as lotId, sum(a.quantitySold) as quantitySold from SaleAllocation a, LedgerTransaction t
        where a.saleTransactionId = t.id
          and t.accountId = :accountId and t.symbol = :symbol and t.transactionDate <= :asOf
        group by a.lotId
        """)
    List<LotSoldQuantity> sumSoldByLot(
        @Param("accountId") String accountId,
        @Param("symbol") String symbol,
        @Param("asOf") LocalDate asOf
    );

    @Query("""
        select coalesce(sum(a.realizedPnl), 0) from SaleAllocation a, LedgerTransaction t
        where a.saleTransactionId = t.id
          and t.accountId = :accountId and t.symbol = :symbol and t.transactionDate <= :asOf
        """)
    BigDecimal sumRealizedPnl(
        @Param("accountId") String accountId,
        @Param("symbol") String symbol,
        @Param("asOf") LocalDate asOf
    );

    @Query("""
        select coalesce(sum(a.costBasis * a.quantitySold), 0) from SaleAllocation a, LedgerTransaction t
        where a.saleTransactionId = t.id
          and t.accountId = :accountId and t.symbol = :symbol and t.transactionDate <= :asOf
        """)
    BigDecimal sumSoldCost(
        @Param("accountId") String accountId,
        @Param("symbol") String symbol,
        @Param("asOf") LocalDate asOf
    );

    interface LotSoldQuantity {

        Long getLotId();

        BigDecimal getQuantitySold();
    }
}
