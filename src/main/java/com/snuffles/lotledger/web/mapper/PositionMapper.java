package com.snuffles.lotledger.web.mapper;

import com.snuffles.lotledger.domain.Position;
import com.snuffles.lotledger.web.dto.PositionDto;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface PositionMapper {
    PositionDto toDto(Position position);
}
