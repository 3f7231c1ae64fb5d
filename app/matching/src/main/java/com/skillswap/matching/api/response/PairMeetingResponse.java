package com.skillswap.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** ペアにミーティングが無い場合、meeting は null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PairMeetingResponse(String pairId, MeetingResponse meeting) {}
