package com.tripmatch.server.recommend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmatch.common.exception.InvalidPreferencesException;
import com.tripmatch.pojo.dto.RawPreferencesDTO;
import com.tripmatch.pojo.model.Continent;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.server.cache.RecommendationCache;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 原始偏好 -> 归一化 SearchPreferences。
 *
 * <p>归一化结果先查"归一化偏好缓存"（key 为原始载荷的指纹），未命中再计算。
 * 相同原始输入永远得到逐字节一致的 canonicalForm 与指纹。</p>
 */
@Component
@RequiredArgsConstructor
public class PreferenceNormalizer {

    static final int DEFAULT_MIN_DURATION = 1;
    static final int DEFAULT_MAX_DURATION = 365;
    private static final String ALL = "all";

    private final ObjectMapper objectMapper;
    private final RecommendationCache recommendationCache;

    /**
     * @throws InvalidPreferencesException 偏好自相矛盾或取值非法
     */
    public SearchPreferences normalize(RawPreferencesDTO raw) {
        RawPreferencesDTO payload = raw == null ? new RawPreferencesDTO() : raw;
        return recommendationCache.normalizedPreferences(rawFingerprint(payload), () -> doNormalize(payload));
    }

    String rawFingerprint(RawPreferencesDTO raw) {
        try {
            // 转成 TreeMap 再序列化，字段顺序与 Jackson 的属性发现顺序无关
            TreeMap<String, Object> sorted = objectMapper.convertValue(raw, new TypeReference<TreeMap<String, Object>>() {
            });
            String json = objectMapper.writeValueAsString(sorted);
            return DigestUtils.md5DigestAsHex(json.getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidPreferencesException("preferences payload is not serializable", e);
        }
    }

    SearchPreferences doNormalize(RawPreferencesDTO raw) {
        SortedSet<Long> countries = positiveIds("selectedCountries", raw.getSelectedCountries());
        SortedSet<Long> themes = positiveIds("preferredThemeIds", raw.getPreferredThemeIds());

        SortedSet<Continent> continents = new TreeSet<>();
        if (raw.getSelectedContinents() != null) {
            for (String label : raw.getSelectedContinents()) {
                if (!StringUtils.hasText(label)) {
                    continue;
                }
                Continent c = Continent.fromLabel(label);
                if (c == null) {
                    throw new InvalidPreferencesException("unknown continent: " + label);
                }
                continents.add(c);
            }
        }

        Long typeId = raw.getPreferredTypeId();
        if (typeId != null && typeId <= 0) {
            throw new InvalidPreferencesException("preferredTypeId must be positive: " + typeId);
        }

        int minDuration = durationOrDefault("minDuration", raw.getMinDuration(), DEFAULT_MIN_DURATION);
        int maxDuration = durationOrDefault("maxDuration", raw.getMaxDuration(), DEFAULT_MAX_DURATION);
        if (minDuration > maxDuration) {
            throw new InvalidPreferencesException(
                    "minDuration(" + minDuration + ") > maxDuration(" + maxDuration + ")");
        }

        Double budget = null;
        BigDecimal rawBudget = raw.getBudget();
        if (rawBudget != null) {
            if (rawBudget.signum() < 0) {
                throw new InvalidPreferencesException("budget must not be negative: " + rawBudget);
            }
            // 预算为 0 视为不限
            budget = rawBudget.signum() == 0 ? null : rawBudget.doubleValue();
        }

        Integer difficulty = raw.getDifficulty();
        if (difficulty != null && (difficulty < 1 || difficulty > 5)) {
            throw new InvalidPreferencesException("difficulty must be within 1..5: " + difficulty);
        }

        Integer year = parseOptional("year", raw.getYear(), 2000, 2100);
        // 没有年份时月份没有意义，直接忽略
        Integer month = year == null ? null : parseOptional("month", raw.getMonth(), 1, 12);

        SearchPreferences draft = SearchPreferences.builder()
                .countryIds(Collections.unmodifiableSortedSet(countries))
                .continents(Collections.unmodifiableSortedSet(continents))
                .tripTypeId(typeId)
                .themeIds(Collections.unmodifiableSortedSet(themes))
                .budget(budget)
                .minDuration(minDuration)
                .maxDuration(maxDuration)
                .difficulty(difficulty)
                .year(year)
                .month(month)
                .build();
        String fingerprint = DigestUtils.md5DigestAsHex(draft.canonicalForm().getBytes(StandardCharsets.UTF_8));
        return draft.toBuilder().fingerprint(fingerprint).build();
    }

    private static SortedSet<Long> positiveIds(String field, List<Long> ids) {
        SortedSet<Long> result = new TreeSet<>();
        if (ids == null) {
            return result;
        }
        for (Long id : ids) {
            if (id == null) {
                continue;
            }
            if (id <= 0) {
                throw new InvalidPreferencesException(field + " contains non-positive id: " + id);
            }
            result.add(id);
        }
        return result;
    }

    private static int durationOrDefault(String field, Integer value, int defaultValue) {
        if (value == null || value == 0) {
            return defaultValue;
        }
        if (value < 0) {
            throw new InvalidPreferencesException(field + " must not be negative: " + value);
        }
        return value;
    }

    private static Integer parseOptional(String field, String value, int min, int max) {
        if (!StringUtils.hasText(value) || ALL.equalsIgnoreCase(value.trim())) {
            return null;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidPreferencesException(field + " is not a number: " + value, e);
        }
        if (parsed < min || parsed > max) {
            throw new InvalidPreferencesException(field + " must be within " + min + ".." + max + ": " + parsed);
        }
        return parsed;
    }
}
