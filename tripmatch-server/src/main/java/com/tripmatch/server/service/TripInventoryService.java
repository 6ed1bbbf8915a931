package com.tripmatch.server.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.tripmatch.pojo.entity.TripOccurrence;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.pojo.model.TripCandidate;

import java.util.List;
import java.util.Set;

public interface TripInventoryService extends IService<TripOccurrence> {

    /**
     * 按偏好做硬过滤，返回可参与打分的候选：
     * - 只取上架、未取消 / 未满员、仍有余位、在展示时间范围内出发的团期；
     * - 目标年月、目的地（国家或大洲）、难度容差、预算倍数、时长容差；
     * - 数量受配置上限约束，按出发日期升序截断。
     */
    List<TripCandidate> findCandidates(SearchPreferences preferences);

    /**
     * 放宽条件再查一次，用于主结果过少时补充：
     * - 不限团型，目的地扩展到所选国家所在的大洲；
     * - 难度、预算、时长、出发年月使用放宽后的容差；
     * - 排除 excludedTripIds 中已经参与过主排序的团期。
     */
    List<TripCandidate> findRelaxedCandidates(SearchPreferences preferences, Set<Long> excludedTripIds);
}
