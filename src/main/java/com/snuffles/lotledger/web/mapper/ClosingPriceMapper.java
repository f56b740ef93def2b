package com.snuffles.lotledger.web.mapper;

import com.snuffles.lotledger.domain.ClosingPrice;
import com.snuffles.lotledger.web.dto.ClosingPriceDto;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface ClosingPriceMapper {
    ClosingPriceDto toDto(ClosingPrice closingPrice);
}
