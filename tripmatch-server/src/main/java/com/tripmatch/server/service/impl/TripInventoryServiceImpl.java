package com.tripmatch.server.service.impl;

import com.baomidou.mybatisplus.extension.conditions.query.LambdaQueryChainWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.tripmatch.common.properties.RecommendationProperties;
import com.tripmatch.pojo.entity.TripOccurrence;
import com.tripmatch.pojo.model.Continent;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.pojo.model.TripCandidate;
import com.tripmatch.pojo.model.TripStatus;
import com.tripmatch.server.mapper.TripOccurrenceMapper;
import com.tripmatch.server.service.TripInventoryService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class TripInventoryServiceImpl extends ServiceImpl<TripOccurrenceMapper, TripOccurrence>
        implements TripInventoryService {

    static final List<String> EXCLUDED_STATUSES = Arrays.asList("Cancelled", "Full");

    private final RecommendationProperties properties;
    private final Clock clock;

    @Override
    public List<TripCandidate> findCandidates(SearchPreferences preferences) {
        DateWindow window = primaryWindow(preferences, LocalDate.now(clock), properties.getMaxYearsAhead());
        if (window.isEmpty()) {
            log.debug("目标出发时间不在可展示范围内: year={}, month={}", preferences.getYear(), preferences.getMonth());
            return Collections.emptyList();
        }
        List<String> continentNames = preferences.getContinents().stream()
                .map(Enum::name)
                .collect(Collectors.toList());

        List<TripOccurrence> rows = filteredQuery(window, preferences,
                properties.getDurationHardFilterDays(), properties.getDifficultyTolerance(),
                properties.getBudgetMaxMultiplier())
                .and(preferences.hasGeography(), w -> w
                        .in(!preferences.getCountryIds().isEmpty(), TripOccurrence::getPrimaryCountryId,
                                preferences.getCountryIds())
                        .or(!preferences.getCountryIds().isEmpty() && !continentNames.isEmpty())
                        .in(!continentNames.isEmpty(), TripOccurrence::getContinent, continentNames))
                .orderByAsc(TripOccurrence::getStartDate)
                .orderByAsc(TripOccurrence::getId)
                .last("limit " + properties.getMaxInventoryCandidates())
                .list();

        List<TripCandidate> candidates = toCandidates(rows);
        log.debug("库存硬过滤完成: rows={}, candidates={}, window=[{}, {}]",
                rows.size(), candidates.size(), window.getFrom(), window.getTo());
        return candidates;
    }

    @Override
    public List<TripCandidate> findRelaxedCandidates(SearchPreferences preferences, Set<Long> excludedTripIds) {
        DateWindow window = relaxedWindow(preferences, LocalDate.now(clock), properties.getMaxYearsAhead(),
                properties.getRelaxedDateWindowMonths());
        if (window.isEmpty()) {
            return Collections.emptyList();
        }
        // 选了国家时扩展到这些国家所在的大洲
        Set<String> continentNames = new TreeSet<>();
        preferences.getContinents().forEach(c -> continentNames.add(c.name()));
        continentsOf(preferences.getCountryIds()).forEach(c -> continentNames.add(c.name()));

        List<TripOccurrence> rows = filteredQuery(window, preferences,
                properties.getRelaxedDurationDays(), properties.getRelaxedDifficultyTolerance(),
                properties.getRelaxedBudgetMultiplier())
                .and(preferences.hasGeography(), w -> w
                        .in(!preferences.getCountryIds().isEmpty(), TripOccurrence::getPrimaryCountryId,
                                preferences.getCountryIds())
                        .or(!preferences.getCountryIds().isEmpty() && !continentNames.isEmpty())
                        .in(!continentNames.isEmpty(), TripOccurrence::getContinent, continentNames))
                .notIn(excludedTripIds != null && !excludedTripIds.isEmpty(), TripOccurrence::getId, excludedTripIds)
                .orderByAsc(TripOccurrence::getStartDate)
                .orderByAsc(TripOccurrence::getId)
                .last("limit " + properties.getMaxInventoryCandidates())
                .list();

        List<TripCandidate> candidates = toCandidates(rows);
        log.debug("放宽条件查询完成: rows={}, candidates={}, continents={}, window=[{}, {}]",
                rows.size(), candidates.size(), continentNames, window.getFrom(), window.getTo());
        return candidates;
    }

    /**
     * 两种查询共用的条件：上架、状态、余位、出发时间窗口、时长 / 难度 / 预算容差。
     */
    private LambdaQueryChainWrapper<TripOccurrence> filteredQuery(DateWindow window, SearchPreferences preferences,
                                                                 int durationDays, int difficultyTolerance,
                                                                 double budgetMultiplier) {
        int minDuration = Math.max(1, preferences.getMinDuration() - durationDays);
        int maxDuration = preferences.getMaxDuration() + durationDays;
        Integer difficulty = preferences.getDifficulty();
        Double budget = preferences.getBudget();
        return lambdaQuery()
                .eq(TripOccurrence::getIsActive, true)
                .notIn(TripOccurrence::getStatus, EXCLUDED_STATUSES)
                .gt(TripOccurrence::getSpotsLeft, 0)
                .between(TripOccurrence::getStartDate, window.getFrom(), window.getTo())
                .between(TripOccurrence::getDurationDays, minDuration, maxDuration)
                .between(difficulty != null, TripOccurrence::getDifficultyLevel,
                        difficulty == null ? null : difficulty - difficultyTolerance,
                        difficulty == null ? null : difficulty + difficultyTolerance)
                .le(budget != null, TripOccurrence::getEffectivePrice,
                        budget == null ? null : BigDecimal.valueOf(budget * budgetMultiplier));
    }

    /**
     * @return 库存中这些国家的团期所属的大洲
     */
    @SuppressWarnings("unchecked")
    Set<Continent> continentsOf(Set<Long> countryIds) {
        if (countryIds == null || countryIds.isEmpty()) {
            return Collections.emptySet();
        }
        List<TripOccurrence> rows = lambdaQuery()
                .select(TripOccurrence::getContinent)
                .in(TripOccurrence::getPrimaryCountryId, countryIds)
                .isNotNull(TripOccurrence::getContinent)
                .groupBy(TripOccurrence::getContinent)
                .list();
        Set<Continent> continents = new TreeSet<>();
        for (TripOccurrence row : rows) {
            Continent continent = Continent.fromLabel(row.getContinent());
            if (continent != null) {
                continents.add(continent);
            }
        }
        return continents;
    }

    private static List<TripCandidate> toCandidates(List<TripOccurrence> rows) {
        List<TripCandidate> candidates = new ArrayList<>(rows.size());
        for (TripOccurrence row : rows) {
            TripCandidate candidate = toCandidate(row);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    /**
     * 主查询的出发时间窗口：今天到 当前年 + maxYearsAhead 年底，有目标年 / 年月时收窄到该年 / 该月。
     */
    static DateWindow primaryWindow(SearchPreferences preferences, LocalDate today, int maxYearsAhead) {
        return relaxedWindow(preferences, today, maxYearsAhead, 0);
    }

    /**
     * 放宽后的出发时间窗口：目标年 / 年月前后各扩展 months 个月，仍不早于今天、不晚于可展示范围。
     */
    static DateWindow relaxedWindow(SearchPreferences preferences, LocalDate today, int maxYearsAhead, int months) {
        LocalDate to = LocalDate.of(today.getYear() + maxYearsAhead, 12, 31);
        if (preferences.getYear() == null) {
            return new DateWindow(today, to);
        }
        LocalDate targetStart;
        LocalDate targetEnd;
        if (preferences.getMonth() == null) {
            targetStart = LocalDate.of(preferences.getYear(), 1, 1);
            targetEnd = LocalDate.of(preferences.getYear(), 12, 31);
        } else {
            YearMonth ym = YearMonth.of(preferences.getYear(), preferences.getMonth());
            targetStart = ym.atDay(1);
            targetEnd = ym.atEndOfMonth();
        }
        return new DateWindow(max(today, targetStart.minusMonths(months)), min(to, targetEnd.plusMonths(months)));
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }

    /**
     * 出发日期闭区间。
     */
    @Value
    static class DateWindow {

        LocalDate from;

        LocalDate to;

        boolean isEmpty() {
            return from.isAfter(to);
        }
    }

    /**
     * 库存行 -> 打分候选。缺少 id / 时长，或状态不可推荐的行返回 null。
     */
    static TripCandidate toCandidate(TripOccurrence row) {
        if (row == null || row.getId() == null || row.getDurationDays() == null) {
            return null;
        }
        TripStatus status = TripStatus.fromLabel(row.getStatus());
        if (status == null) {
            return null;
        }
        return TripCandidate.builder()
                .tripId(row.getId())
                .themeIds(parseIds(row.getThemeTagIds()))
                .tripTypeId(row.getTripTypeId())
                .difficulty(row.getDifficultyLevel())
                .durationDays(row.getDurationDays())
                .price(row.getEffectivePrice())
                .countryId(row.getPrimaryCountryId())
                .continent(Continent.fromLabel(row.getContinent()))
                .status(status)
                .departureDate(row.getStartDate())
                .build();
    }

    static Set<Long> parseIds(String csv) {
        if (!StringUtils.hasText(csv)) {
            return Collections.emptySet();
        }
        Set<Long> ids = new HashSet<>();
        for (String part : csv.split(",")) {
            String s = part.trim();
            if (s.isEmpty()) {
                continue;
            }
            try {
                ids.add(Long.parseLong(s));
            } catch (NumberFormatException e) {
                log.warn("忽略无法解析的主题 id: {}", s);
            }
        }
        return Collections.unmodifiableSet(ids);
    }
}
