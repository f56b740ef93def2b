package com.snuffles.lotledger.web.mapper;

import com.snuffles.lotledger.domain.DailyPnlSnapshot;
import com.snuffles.lotledger.web.dto.DailyPnlSnapshotDto;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface DailyPnlSnapshotMapper {
    DailyPnlSnapshotDto toDto(DailyPnlSnapshot snapshot);
}
