package com.tripmatch.server.controller.user;

import com.tripmatch.common.result.Result;
import com.tripmatch.pojo.dto.RankRequestDTO;
import com.tripmatch.pojo.dto.SearchRequestDTO;
import com.tripmatch.pojo.vo.RankResultVO;
import com.tripmatch.server.service.RecommendationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/user/recommendation")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationService recommendationService;

    /**
     * 对调用方给出的候选池排序。
     */
    @PostMapping("/rank")
    public Result<RankResultVO> rank(@RequestBody RankRequestDTO request) {
        return Result.success(recommendationService.rank(request));
    }

    /**
     * 按偏好搜索库存并排序。
     */
    @PostMapping("/search")
    public Result<RankResultVO> search(@RequestBody SearchRequestDTO request) {
        return Result.success(recommendationService.search(request));
    }
}
