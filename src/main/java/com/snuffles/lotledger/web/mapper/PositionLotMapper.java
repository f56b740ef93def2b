package com.snuffles.lotledger.web.mapper;

import com.snuffles.lotledger.domain.PositionLot;
import com.snuffles.lotledger.web.dto.PositionLotDto;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface PositionLotMapper {

    PositionLotDto toDto(PositionLot lot);

    List<PositionLotDto> toDtos(List<PositionLot> lots);
}
