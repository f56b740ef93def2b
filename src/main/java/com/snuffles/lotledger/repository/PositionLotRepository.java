package com.snuffles.lotledger.repository;

import com.snuffles.lotledger.domain.PositionLot;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PositionLotRepository extends JpaRepository<PositionLot, Long> {

    List<PositionLot> findByAccountIdAndSymbolOrderByPurchaseDateAscIdAsc(String accountId, String symbol);

    List<PositionLot> findByAccountIdAndSymbolAndClosedFalseOrderByPurchaseDateAscIdAsc(String accountId, String symbol);

    List<PositionLot> findByAccountIdAndSymbolAndPurchaseDateLessThanEqualOrderByPurchaseDateAscIdAsc(
        String accountId, String symbol, LocalDate purchaseDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select l from PositionLot l
        where l.accountId = :accountId and l.symbol = :symbol and l.closed = false
        order by l.purchaseDate asc, l.id asc
        """)
    List<PositionLot> findOpenLotsForUpdate(@Param("accountId") String accountId, @Param("symbol") String symbol);

    Optional<PositionLot> findByTransactionId(Long transactionId);

    List<PositionLot> findByIdIn(Collection<Long> ids);
}
