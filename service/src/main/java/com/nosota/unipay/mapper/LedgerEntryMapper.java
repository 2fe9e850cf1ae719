package com.nosota.unipay.mapper;

import com.nosota.unipay.api.dto.LedgerEntryDTO;
import com.nosota.unipay.model.LedgerEntry;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface LedgerEntryMapper {

    LedgerEntryMapper INSTANCE = Mappers.getMapper(LedgerEntryMapper.class);

    LedgerEntryDTO toDTO(LedgerEntry entry);

    List<LedgerEntryDTO> toDTOList(List<LedgerEntry> entries);
}
