package com.snuffles.lotledger.service.allocation;

import com.snuffles.lotledger.domain.PositionLot;

import java.util.List;

/**
 * Decides the order in which a sale draws down open lots. The engine walks the returned list
 * front to back; the order must be total so that replays allocate identically.
 */
public interface LotSelectionPolicy {

    String name();

    List<PositionLot> order(List<PositionLot> openLots);
}
