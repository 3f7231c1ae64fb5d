package com.skillswap.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

// 範囲チェックは GeoService.validateCoordinates で行い、フィールド名付きで返す
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateLocationRequest(@NotNull Double latitude, @NotNull Double longitude) {}
