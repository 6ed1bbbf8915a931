package com.tripmatch.server.service.impl;

import com.tripmatch.common.context.BaseContext;
import com.tripmatch.common.exception.BaseException;
import com.tripmatch.common.properties.RecommendationProperties;
import com.tripmatch.common.result.ErrorCode;
import com.tripmatch.pojo.dto.RankRequestDTO;
import com.tripmatch.pojo.dto.SearchRequestDTO;
import com.tripmatch.pojo.dto.TripCandidateDTO;
import com.tripmatch.pojo.model.Continent;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.ScoredTrip;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.pojo.model.TripCandidate;
import com.tripmatch.pojo.model.TripStatus;
import com.tripmatch.pojo.model.WeightVector;
import com.tripmatch.pojo.vo.RankResultVO;
import com.tripmatch.pojo.vo.ScoredTripVO;
import com.tripmatch.server.recommend.CandidateSelector;
import com.tripmatch.server.recommend.PreferenceNormalizer;
import com.tripmatch.server.recommend.ScoringEngine;
import com.tripmatch.server.service.RecommendationService;
import com.tripmatch.server.service.TripInventoryService;
import com.tripmatch.server.weights.WeightStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationServiceImpl implements RecommendationService {

    static final double HIGH_MATCH_SCORE = 70D;
    static final double MID_MATCH_SCORE = 50D;
    static final String RELAXED_PENALTY = "RELAXED_PENALTY";

    private final PreferenceNormalizer preferenceNormalizer;
    private final CandidateSelector candidateSelector;
    private final ScoringEngine scoringEngine;
    private final WeightStore weightStore;
    private final TripInventoryService tripInventoryService;
    private final RecommendationProperties properties;

    @Override
    public RankResultVO rank(RankRequestDTO request) {
        int k = resolveK(request.getK());
        SearchPreferences preferences = preferenceNormalizer.normalize(request.getPreferences());
        List<TripCandidate> candidates = toCandidates(request.getCandidates());
        WeightVector weights = weightStore.getActive();
        RankResultVO vo = select(candidates, preferences, k, weights);
        vo.setRelaxedTrips(Collections.emptyList());
        return vo;
    }

    @Override
    public RankResultVO search(SearchRequestDTO request) {
        int k = resolveK(request.getK());
        SearchPreferences preferences = preferenceNormalizer.normalize(request.getPreferences());
        List<TripCandidate> candidates = tripInventoryService.findCandidates(preferences);
        // 一次请求只读取一次线上权重，主结果和放宽结果使用同一个快照
        WeightVector weights = weightStore.getActive();
        RankResultVO vo = select(candidates, preferences, k, weights);
        vo.setRelaxedTrips(relax(candidates, vo.getTrips().size(), preferences, k, weights));
        return vo;
    }

    /**
     * 主结果不超过 relaxedMinResults 条时，放宽条件补足到 k 条，每条扣 relaxedPenalty 分。
     * 参与过主排序的候选不会再出现在补充结果里。
     */
    private List<ScoredTripVO> relax(List<TripCandidate> primary, int returned, SearchPreferences preferences,
                                     int k, WeightVector weights) {
        int needed = k - returned;
        if (!properties.isRelaxedEnabled() || returned > properties.getRelaxedMinResults() || needed <= 0) {
            return Collections.emptyList();
        }
        Set<Long> excluded = new HashSet<>();
        for (TripCandidate candidate : primary) {
            excluded.add(candidate.getTripId());
        }
        List<TripCandidate> relaxed = tripInventoryService.findRelaxedCandidates(preferences, excluded);
        List<ScoredTrip> top = candidateSelector.selectTopK(relaxed, preferences, needed, weights);

        double penalty = properties.getRelaxedPenalty();
        List<ScoredTripVO> trips = new ArrayList<>(top.size());
        // 名次接在主结果之后
        int rank = returned + 1;
        for (ScoredTrip scored : top) {
            ScoredTripVO vo = toVO(scored, rank++, weights);
            vo.setScore(scored.getScore() + penalty);
            vo.setMatchLevel(matchLevel(vo.getScore()));
            vo.getContributions().put(RELAXED_PENALTY, penalty);
            vo.setRelaxed(true);
            trips.add(vo);
        }
        log.info("放宽条件补充完成: fingerprint={}, primary={}, relaxedCandidates={}, returned={}",
                preferences.getFingerprint(), returned, relaxed.size(), trips.size());
        return trips;
    }

    private RankResultVO select(List<TripCandidate> candidates, SearchPreferences preferences, int k,
                                WeightVector weights) {
        List<ScoredTrip> top = candidateSelector.selectTopK(candidates, preferences, k, weights);

        List<ScoredTripVO> trips = new ArrayList<>(top.size());
        int rank = 1;
        for (ScoredTrip scored : top) {
            trips.add(toVO(scored, rank++, weights));
        }
        RankResultVO vo = new RankResultVO();
        vo.setWeightVersion(weights.getVersion());
        vo.setPreferenceFingerprint(preferences.getFingerprint());
        vo.setCandidateCount(candidates.size());
        vo.setTrips(trips);
        log.info("推荐排序完成: sessionId={}, fingerprint={}, candidates={}, k={}, returned={}, weightVersion={}",
                BaseContext.getCurrentSessionId(), preferences.getFingerprint(), candidates.size(), k,
                trips.size(), weights.getVersion());
        return vo;
    }

    /**
     * k 为空取默认值；非正数或超过上限直接拒绝。
     */
    int resolveK(Integer requested) {
        if (requested == null) {
            return properties.getDefaultK();
        }
        if (requested <= 0 || requested > properties.getMaxK()) {
            throw new BaseException(ErrorCode.INVALID_K,
                    "k must be between 1 and " + properties.getMaxK() + ": " + requested);
        }
        return requested;
    }

    private ScoredTripVO toVO(ScoredTrip scored, int rank, WeightVector weights) {
        TripCandidate trip = scored.getTrip();
        ScoredTripVO vo = new ScoredTripVO();
        vo.setRank(rank);
        vo.setTripId(trip.getTripId());
        vo.setScore(scored.getScore());
        vo.setMatchLevel(matchLevel(scored.getScore()));
        vo.setWeightVersion(scored.getWeightVersion());
        vo.setPrice(trip.getPrice());
        vo.setDepartureDate(trip.getDepartureDate());
        vo.setStatus(trip.getStatus() == null ? null : trip.getStatus().getLabel());
        vo.setRelaxed(false);

        Map<String, Double> contributions = new LinkedHashMap<>();
        for (Map.Entry<FeatureKey, Double> e : scoringEngine.contributions(scored.getFeatures(), weights).entrySet()) {
            contributions.put(e.getKey().name(), e.getValue());
        }
        vo.setContributions(contributions);
        return vo;
    }

    static String matchLevel(double score) {
        if (score >= HIGH_MATCH_SCORE) {
            return "HIGH";
        }
        if (score >= MID_MATCH_SCORE) {
            return "MID";
        }
        return "LOW";
    }

    /**
     * 调用方候选 -> 打分候选。缺少 tripId 的条目与不可推荐状态（Cancelled / Full）的条目直接跳过。
     */
    static List<TripCandidate> toCandidates(List<TripCandidateDTO> dtos) {
        if (dtos == null || dtos.isEmpty()) {
            return Collections.emptyList();
        }
        List<TripCandidate> candidates = new ArrayList<>(dtos.size());
        for (TripCandidateDTO dto : dtos) {
            if (dto == null || dto.getTripId() == null) {
                log.warn("忽略缺少 tripId 的候选");
                continue;
            }
            TripStatus status = TripStatus.fromLabel(dto.getStatus());
            if (status == null) {
                log.debug("忽略不可推荐状态的候选: tripId={}, status={}", dto.getTripId(), dto.getStatus());
                continue;
            }
            candidates.add(TripCandidate.builder()
                    .tripId(dto.getTripId())
                    .themeIds(dto.getThemeIds() == null
                            ? Collections.emptySet()
                            : Collections.unmodifiableSet(new HashSet<>(dto.getThemeIds())))
                    .tripTypeId(dto.getTripTypeId())
                    .difficulty(dto.getDifficulty())
                    .durationDays(dto.getDurationDays() == null ? 0 : dto.getDurationDays())
                    .price(dto.getPrice())
                    .countryId(dto.getCountryId())
                    .continent(Continent.fromLabel(dto.getContinent()))
                    .status(status)
                    .departureDate(dto.getDepartureDate())
                    .build());
        }
        return candidates;
    }
}
