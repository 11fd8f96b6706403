package com.pricestream.mapper;

import com.pricestream.api.dto.response.AlertResponse;
import com.pricestream.domain.model.Alert;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper from the {@link Alert} domain model to its REST response. */
@Mapper
public interface AlertDtoMapper {

    AlertResponse toResponse(Alert alert);

    List<AlertResponse> toResponseList(List<Alert> alerts);
}
