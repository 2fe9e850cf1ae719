package com.nosota.unipay.mapper;

import com.nosota.unipay.api.dto.ObligationDTO;
import com.nosota.unipay.api.dto.SubscriptionDTO;
import com.nosota.unipay.model.ScheduledObligation;
import com.nosota.unipay.model.Subscription;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for subscriptions and their scheduled obligations.
 */
@Mapper
public interface SubscriptionMapper {

    SubscriptionMapper INSTANCE = Mappers.getMapper(SubscriptionMapper.class);

    SubscriptionDTO toDTO(Subscription subscription);

    ObligationDTO toDTO(ScheduledObligation obligation);

    List<ObligationDTO> toObligationDTOList(List<ScheduledObligation> obligations);
}
