package com.tripmatch.pojo.dto;

import lombok.Data;

import java.util.List;

@Data
public class RankRequestDTO {

    private RawPreferencesDTO preferences;

    private List<TripCandidateDTO> candidates;

    /** 为空时使用默认 k */
    private Integer k;
}
