package com.nosota.unipay.mapper;

import com.nosota.unipay.api.dto.EscrowOrderDTO;
import com.nosota.unipay.model.EscrowOrder;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

@Mapper
public interface EscrowOrderMapper {

    EscrowOrderMapper INSTANCE = Mappers.getMapper(EscrowOrderMapper.class);

    EscrowOrderDTO toDTO(EscrowOrder order);
}
