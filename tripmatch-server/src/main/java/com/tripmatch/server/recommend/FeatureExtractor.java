package com.tripmatch.server.recommend;

import com.tripmatch.common.exception.SchemaMismatchException;
import com.tripmatch.pojo.model.Continent;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.FeatureVector;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.pojo.model.TripCandidate;
import com.tripmatch.pojo.model.WeightVector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 特征提取：(行程, 偏好) -> 固定 Schema 的特征向量。
 *
 * <p>纯函数、无 IO。"今天"来自注入的 Clock，同一天内相同输入得到相同输出。
 * 每个特征值都会被截断到 {@link FeatureKey} 声明的取值范围内，{@link #upperBound} 依赖这一点。</p>
 */
@Component
@RequiredArgsConstructor
public class FeatureExtractor {

    private static final double DAYS_PER_YEAR = 365D;

    private final Clock clock;

    public FeatureVector extract(TripCandidate trip, SearchPreferences preferences) {
        LocalDate today = LocalDate.now(clock);
        Map<FeatureKey, Double> values = new EnumMap<>(FeatureKey.class);

        values.put(FeatureKey.BASE_SCORE, 1D);

        // 主题：命中 2 个及以上为满分等级；选了主题却一个没中单独记一个惩罚特征
        Set<Long> preferredThemes = preferences.getThemeIds();
        int themeMatches = 0;
        if (!preferredThemes.isEmpty() && trip.getThemeIds() != null) {
            for (Long themeId : trip.getThemeIds()) {
                if (preferredThemes.contains(themeId)) {
                    themeMatches++;
                }
            }
        }
        values.put(FeatureKey.THEME_MATCH_LEVEL, (double) Math.min(themeMatches, 2));
        values.put(FeatureKey.THEME_MISMATCH, !preferredThemes.isEmpty() && themeMatches == 0 ? 1D : 0D);

        boolean typeMatch = preferences.getTripTypeId() != null
                && preferences.getTripTypeId().equals(trip.getTripTypeId());
        values.put(FeatureKey.TRIP_TYPE_MATCH, typeMatch ? 1D : 0D);

        double difficultyDelta = 0D;
        if (preferences.getDifficulty() != null && trip.getDifficulty() != null) {
            difficultyDelta = Math.abs(trip.getDifficulty() - preferences.getDifficulty());
        }
        values.put(FeatureKey.DIFFICULTY_DELTA, difficultyDelta);

        int duration = trip.getDurationDays();
        double durationDelta = 0D;
        if (duration < preferences.getMinDuration()) {
            durationDelta = preferences.getMinDuration() - duration;
        } else if (duration > preferences.getMaxDuration()) {
            durationDelta = duration - preferences.getMaxDuration();
        }
        values.put(FeatureKey.DURATION_DELTA, durationDelta);

        double budgetRatio = 0D;
        Double budget = preferences.getBudget();
        if (budget != null && budget > 0D && trip.getPrice() != null) {
            budgetRatio = trip.getPrice().doubleValue() / budget;
        }
        values.put(FeatureKey.BUDGET_RATIO, budgetRatio);

        values.put(FeatureKey.STATUS_CODE, statusValue(trip));

        double departure = 0D;
        if (trip.getDepartureDate() != null) {
            long days = ChronoUnit.DAYS.between(today, trip.getDepartureDate());
            departure = Math.max(0L, Math.min(365L, days)) / DAYS_PER_YEAR;
        }
        values.put(FeatureKey.DAYS_UNTIL_DEPARTURE, departure);

        values.put(FeatureKey.GEO_MATCH_LEVEL, geoLevel(trip, preferences));
        values.put(FeatureKey.DATE_MATCH_LEVEL, dateLevel(trip, preferences));

        values.replaceAll(FeatureKey::clamp);
        return FeatureVector.of(values);
    }

    /**
     * 快速估算该行程在给定权重下能拿到的最高分，只用到无需计算的字段。
     * <p>BASE_SCORE 与 STATUS_CODE 使用精确值，其余 key 取 {@code max(w*下界, w*上界)}；
     * 逐项不小于真实贡献且按相同顺序累加，因此结果永远不小于 {@code ScoringEngine} 算出的真实得分。</p>
     */
    public double upperBound(TripCandidate trip, WeightVector weights) {
        double bound = 0D;
        for (FeatureKey key : FeatureKey.values()) {
            double w = weights.get(key);
            if (key == FeatureKey.BASE_SCORE) {
                bound += w * 1D;
            } else if (key == FeatureKey.STATUS_CODE) {
                bound += w * statusValue(trip);
            } else {
                bound += Math.max(w * key.getLowerBound(), w * key.getUpperBound());
            }
        }
        return bound;
    }

    /**
     * 校验权重向量与当前提取器的特征 Schema 是否一致。
     *
     * @throws SchemaMismatchException Schema 版本或 key 集合不一致
     */
    public void checkSchema(WeightVector weights) {
        if (weights.getSchemaVersion() != FeatureKey.SCHEMA_VERSION
                || !weights.keySet().equals(FeatureKey.schema())) {
            throw new SchemaMismatchException(String.format(
                    "extractor schema v%d, weight v%d schema v%d keys=%s",
                    FeatureKey.SCHEMA_VERSION, weights.getVersion(), weights.getSchemaVersion(), weights.keySet()));
        }
    }

    private static double statusValue(TripCandidate trip) {
        return trip.getStatus() == null ? 0D : trip.getStatus().getCode();
    }

    private static double geoLevel(TripCandidate trip, SearchPreferences preferences) {
        if (!preferences.hasGeography()) {
            return 0D;
        }
        if (trip.getCountryId() != null && preferences.getCountryIds().contains(trip.getCountryId())) {
            return 2D;
        }
        Continent continent = trip.getContinent();
        if (continent == null || !preferences.getContinents().contains(continent)) {
            return 0D;
        }
        // 南极洲只有一个"国家"，选择大洲等同于直接命中国家
        return continent == Continent.ANTARCTICA ? 2D : 1D;
    }

    private static double dateLevel(TripCandidate trip, SearchPreferences preferences) {
        if (preferences.getYear() == null || trip.getDepartureDate() == null) {
            return 0D;
        }
        if (trip.getDepartureDate().getYear() != preferences.getYear()) {
            return 0D;
        }
        Integer month = preferences.getMonth();
        return month != null && trip.getDepartureDate().getMonthValue() == month ? 2D : 1D;
    }
}
