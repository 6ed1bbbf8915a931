package com.tripmatch.pojo.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

/**
 * 某次出团（trip occurrence）的只读快照，由库存侧提供，推荐核心只在一次打分调用内借用。
 */
@Value
@Builder
public class TripCandidate {

    long tripId;

    Set<Long> themeIds;

    Long tripTypeId;

    Integer difficulty;

    int durationDays;

    BigDecimal price;

    Long countryId;

    Continent continent;

    TripStatus status;

    LocalDate departureDate;
}
