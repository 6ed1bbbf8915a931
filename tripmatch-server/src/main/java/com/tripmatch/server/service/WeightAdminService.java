package com.tripmatch.server.service;

import com.tripmatch.pojo.vo.TrainingRunVO;
import com.tripmatch.pojo.vo.WeightVersionVO;

import java.util.List;

/**
 * 权重与训练任务的运维操作。
 */
public interface WeightAdminService {

    WeightVersionVO getActive();

    /**
     * @return 最近 limit 个版本，新版本在前
     */
    List<WeightVersionVO> history(int limit);

    WeightVersionVO rollback(long version);

    /**
     * 同步执行一次训练并返回报告；已有任务运行时抛出 TRAINING_ALREADY_RUNNING。
     */
    TrainingRunVO triggerTraining();

    TrainingRunVO lastTrainingRun();
}
