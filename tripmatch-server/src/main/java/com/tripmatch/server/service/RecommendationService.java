package com.tripmatch.server.service;

import com.tripmatch.pojo.dto.RankRequestDTO;
import com.tripmatch.pojo.dto.SearchRequestDTO;
import com.tripmatch.pojo.vo.RankResultVO;

public interface RecommendationService {

    /**
     * 对调用方提交的候选池做个性化排序，返回 Top-K。
     */
    RankResultVO rank(RankRequestDTO request);

    /**
     * 按偏好从库存拉取候选（硬过滤）后排序，返回 Top-K。
     */
    RankResultVO search(SearchRequestDTO request);
}
