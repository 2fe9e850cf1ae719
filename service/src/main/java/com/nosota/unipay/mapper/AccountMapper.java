package com.nosota.unipay.mapper;

import com.nosota.unipay.api.dto.AccountDTO;
import com.nosota.unipay.api.response.BalanceResponse;
import com.nosota.unipay.model.Account;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for Account entity conversions.
 */
@Mapper
public interface AccountMapper {

    AccountMapper INSTANCE = Mappers.getMapper(AccountMapper.class);

    AccountDTO toDTO(Account account);

    List<AccountDTO> toDTOList(List<Account> accounts);

    @Mapping(target = "accountId", source = "id")
    BalanceResponse toBalance(Account account);
}
