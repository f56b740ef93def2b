package com.snuffles.lotledger.repository;

import com.snuffles.lotledger.domain.Position;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PositionRepository extends JpaRepository<Position, Long> {

    Optional<Position> findByAccountIdAndSymbol(String accountId, String symbol);

    List<Position> findByAccountIdOrderBySymbolAsc(String accountId);

    List<Position> findByAccountIdAndActiveTrueOrderBySymbolAsc(String accountId);
}
