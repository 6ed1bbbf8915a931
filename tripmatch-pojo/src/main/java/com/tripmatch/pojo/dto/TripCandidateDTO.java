package com.tripmatch.pojo.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 调用方直接提交候选池时使用的行程快照。
 */
@Data
public class TripCandidateDTO {

    private Long tripId;

    private List<Long> themeIds;

    private Long tripTypeId;

    private Integer difficulty;

    private Integer durationDays;

    private BigDecimal price;

    private Long countryId;

    private String continent;

    private String status;

    private LocalDate departureDate;
}
