package com.snuffles.lotledger.web.mapper;

import com.snuffles.lotledger.domain.LedgerTransaction;
import com.snuffles.lotledger.web.dto.TransactionDto;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface TransactionMapper {
    TransactionDto toDto(LedgerTransaction transaction);
}
