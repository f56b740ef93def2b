package com.snuffles.lotledger.service;

import com.snuffles.lotledger.domain.ClosingPrice;
import com.snuffles.lotledger.repository.ClosingPriceRepository;
import com.snuffles.lotledger.service.exception.ValidationException;
import com.snuffles.lotledger.web.dto.ClosingPriceDto;
import com.snuffles.lotledger.web.dto.ClosingPriceRequest;
import com.snuffles.lotledger.web.mapper.ClosingPriceMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

import static com.snuffles.lotledger.service.allocation.LotAllocationEngine.MONEY_SCALE;
import static com.snuffles.lotledger.service.allocation.LotAllocationEngine.ROUNDING;

@Service
@RequiredArgsConstructor
@Slf4j
public class ClosingPriceService {

    private final ClosingPriceRepository closingPriceRepository;
    private final ClosingPriceMapper closingPriceMapper;

    @Transactional
    public ClosingPriceDto recordClose(String symbol, LocalDate priceDate, ClosingPriceRequest request) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("Symbol is required");
        }
        if (priceDate == null) {
            throw new ValidationException("Price date is required");
        }
        if (request.getClosePrice() == null || request.getClosePrice().signum() <= 0) {
            throw new ValidationException("Close price must be positive");
        }

        String normalizedSymbol = PositionService.normalize(symbol);
        ClosingPrice close = closingPriceRepository.findBySymbolAndPriceDate(normalizedSymbol, priceDate)
            .orElseGet(() -> {
                ClosingPrice created = new ClosingPrice();
                created.setSymbol(normalizedSymbol);
                created.setPriceDate(priceDate);
                return created;
            });
        boolean replaced = close.getId() != null;
        close.setClosePrice(request.getClosePrice().setScale(MONEY_SCALE, ROUNDING));
        close.setSource(request.getSource());

        ClosingPrice saved = closingPriceRepository.save(close);
        log.info("{} close for {} on {}: {}", replaced ? "Replaced" : "Recorded", normalizedSymbol, priceDate, saved.getClosePrice());
        return closingPriceMapper.toDto(saved);
    }
}
