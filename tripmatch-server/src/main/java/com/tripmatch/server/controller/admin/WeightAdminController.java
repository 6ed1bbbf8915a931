package com.tripmatch.server.controller.admin;

import com.tripmatch.common.result.Result;
import com.tripmatch.pojo.vo.TrainingRunVO;
import com.tripmatch.pojo.vo.WeightVersionVO;
import com.tripmatch.server.service.WeightAdminService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class WeightAdminController {

    private final WeightAdminService weightAdminService;

    @GetMapping("/weights/active")
    public Result<WeightVersionVO> active() {
        return Result.success(weightAdminService.getActive());
    }

    @GetMapping("/weights/history")
    public Result<List<WeightVersionVO>> history(@RequestParam(defaultValue = "20") int limit) {
        return Result.success(weightAdminService.history(limit));
    }

    /**
     * 回滚到历史版本；版本不存在或超过保留期时返回对应错误码。
     */
    @PostMapping("/weights/rollback/{version}")
    public Result<WeightVersionVO> rollback(@PathVariable("version") Long version) {
        return Result.success(weightAdminService.rollback(version));
    }

    @PostMapping("/training/trigger")
    public Result<TrainingRunVO> triggerTraining() {
        return Result.success(weightAdminService.triggerTraining());
    }

    @GetMapping("/training/last")
    public Result<TrainingRunVO> lastTrainingRun() {
        return Result.success(weightAdminService.lastTrainingRun());
    }
}
