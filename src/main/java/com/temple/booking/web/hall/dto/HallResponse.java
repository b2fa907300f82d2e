package com.temple.booking.web.hall.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temple.booking.domain.hall.Hall;

import java.util.List;

public record HallResponse(
        @JsonProperty("hall_id") int hallId,
        String name,
        String description,
        List<String> images
) {

    public static HallResponse from(Hall hall) {
        return new HallResponse(hall.id(), hall.name(), hall.description(), hall.images());
    }
}
