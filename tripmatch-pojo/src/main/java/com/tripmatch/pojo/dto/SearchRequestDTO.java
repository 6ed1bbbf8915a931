package com.tripmatch.pojo.dto;

import lombok.Data;

/**
 * 由库存侧按偏好拉取候选的搜索请求。
 */
@Data
public class SearchRequestDTO {

    private RawPreferencesDTO preferences;

    private Integer k;
}
