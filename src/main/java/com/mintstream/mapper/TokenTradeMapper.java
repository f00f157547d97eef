package com.mintstream.mapper;

import com.mintstream.domain.model.TokenTrade;
import com.mintstream.entity.TokenTradeEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface TokenTradeMapper {

    @Mapping(target = "id", ignore = true)
    TokenTradeEntity toEntity(TokenTrade tokenTrade);
}
