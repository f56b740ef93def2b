package com.snuffles.lotledger.web.mapper;

import com.snuffles.lotledger.domain.SaleAllocation;
import com.snuffles.lotledger.web.dto.SaleAllocationDto;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface SaleAllocationMapper {

    SaleAllocationDto toDto(SaleAllocation allocation);

    List<SaleAllocationDto> toDtos(List<SaleAllocation> allocations);
}
