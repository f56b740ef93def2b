package com.snuffles.lotledger.repository;

import com.snuffles.lotledger.domain.LedgerTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {

    Optional<LedgerTransaction> findByAccountIdAndExternalId(String accountId, String externalId);

    Optional<LedgerTransaction> findByIdAndAccountId(Long id, String accountId);

    List<LedgerTransaction> findByAccountIdAndSymbolAndTransactionTypeOrderByIdAsc(
        String accountId, String symbol, LedgerTransaction.TransactionType transactionType);

    List<LedgerTransaction> findByAccountIdAndTransactionDateBetweenOrderByTransactionDateAscIdAsc(
        String accountId, LocalDate from, LocalDate to);

    List<LedgerTransaction> findByAccountIdAndSymbolAndTransactionDateBetweenOrderByTransactionDateAscIdAsc(
        String accountId, String symbol, LocalDate from, LocalDate to);

    @Query("select max(t.transactionDate) from LedgerTransaction t where t.accountId = :accountId and t.symbol = :symbol")
    Optional<LocalDate> findLastTransactionDate(@Param("accountId") String accountId, @Param("symbol") String symbol);

    @Query("""
        select max(t.transactionDate) from LedgerTransaction t
        where t.accountId = :accountId and t.symbol = :symbol and t.transactionDate <= :asOf
        """)
    Optional<LocalDate> findLastTransactionDateAsOf(
        @Param("accountId") String accountId,
        @Param("symbol") String symbol,
        @Param("asOf") LocalDate asOf
    );

    @Query("select distinct t.symbol from LedgerTransaction t where t.accountId = :accountId order by t.symbol")
    List<String> findSymbolsByAccountId(@Param("accountId") String accountId);
}
