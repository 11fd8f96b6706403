package com.pricestream.mapper;

import com.pricestream.domain.model.Alert;
import com.pricestream.entity.AlertEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between the {@link Alert} domain model and {@link AlertEntity}.
 * Field names match on both sides.
 */
@Mapper
public interface AlertMapper {

    Alert toDomain(AlertEntity entity);

    AlertEntity toEntity(Alert domain);

    List<Alert> toDomainList(List<AlertEntity> entities);
}
