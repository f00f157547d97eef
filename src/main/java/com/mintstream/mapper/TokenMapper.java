package com.mintstream.mapper;

import com.mintstream.domain.model.TokenCreation;
import com.mintstream.entity.TokenEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between TokenCreation domain model and TokenEntity.
 */
@Mapper
public interface TokenMapper {

    @Mapping(target = "id", ignore = true)
    TokenEntity toEntity(TokenCreation tokenCreation);
}
