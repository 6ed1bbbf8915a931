package com.tripmatch.server.recommend;

import com.tripmatch.common.exception.SchemaMismatchException;
import com.tripmatch.pojo.model.Continent;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.FeatureVector;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.pojo.model.TripCandidate;
import com.tripmatch.pojo.model.TripStatus;
import com.tripmatch.pojo.model.WeightVector;
import com.tripmatch.server.weights.DefaultWeights;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.tripmatch.server.support.Fixtures.preferences;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * FeatureExtractor 单元测试：
 * - 各特征的取值规则与截断；
 * - 得分上界不小于真实得分；
 * - Schema 校验。
 */
class FeatureExtractorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

    private final Clock clock = Clock.fixed(TODAY.atStartOfDay(ZoneId.of("UTC")).toInstant(), ZoneId.of("UTC"));
    private final FeatureExtractor extractor = new FeatureExtractor(clock);
    private final ScoringEngine scoringEngine = new ScoringEngine();

    private TripCandidate.TripCandidateBuilder trip() {
        return TripCandidate.builder()
                .tripId(1L)
                .themeIds(Set.of())
                .durationDays(10)
                .status(TripStatus.AVAILABLE);
    }

    @Test
    void extract_shouldProduceFullSchema() {
        FeatureVector fv = extractor.extract(trip().build(), preferences().build());

        assertEquals(FeatureKey.schema(), fv.keySet());
        assertEquals(FeatureKey.SCHEMA_VERSION, fv.getSchemaVersion());
        assertEquals(1D, fv.get(FeatureKey.BASE_SCORE));
    }

    @Test
    void extract_themeLevels() {
        TripCandidate t = trip().themeIds(Set.of(1L, 2L, 3L)).build();

        FeatureVector two = extractor.extract(t, preferences().themeIds(new TreeSet<>(Set.of(1L, 2L))).build());
        assertEquals(2D, two.get(FeatureKey.THEME_MATCH_LEVEL));
        assertEquals(0D, two.get(FeatureKey.THEME_MISMATCH));

        FeatureVector one = extractor.extract(t, preferences().themeIds(new TreeSet<>(Set.of(3L, 9L))).build());
        assertEquals(1D, one.get(FeatureKey.THEME_MATCH_LEVEL));

        FeatureVector none = extractor.extract(t, preferences().themeIds(new TreeSet<>(Set.of(9L))).build());
        assertEquals(0D, none.get(FeatureKey.THEME_MATCH_LEVEL));
        assertEquals(1D, none.get(FeatureKey.THEME_MISMATCH));

        // 未选择主题时既没有匹配也没有惩罚
        FeatureVector unset = extractor.extract(t, preferences().build());
        assertEquals(0D, unset.get(FeatureKey.THEME_MATCH_LEVEL));
        assertEquals(0D, unset.get(FeatureKey.THEME_MISMATCH));
    }

    @Test
    void extract_durationDeltaIsClamped() {
        SearchPreferences prefs = preferences().minDuration(10).maxDuration(14).build();

        assertEquals(0D, extractor.extract(trip().durationDays(12).build(), prefs).get(FeatureKey.DURATION_DELTA));
        assertEquals(2D, extractor.extract(trip().durationDays(16).build(), prefs).get(FeatureKey.DURATION_DELTA));
        assertEquals(3D, extractor.extract(trip().durationDays(7).build(), prefs).get(FeatureKey.DURATION_DELTA));
        assertEquals(30D, extractor.extract(trip().durationDays(90).build(), prefs).get(FeatureKey.DURATION_DELTA));
    }

    @Test
    void extract_budgetRatio() {
        SearchPreferences withBudget = preferences().budget(2000D).build();

        assertEquals(1.5D, extractor.extract(trip().price(new BigDecimal("3000")).build(), withBudget)
                .get(FeatureKey.BUDGET_RATIO));
        assertEquals(3D, extractor.extract(trip().price(new BigDecimal("50000")).build(), withBudget)
                .get(FeatureKey.BUDGET_RATIO));
        assertEquals(0D, extractor.extract(trip().price(new BigDecimal("3000")).build(), preferences().build())
                .get(FeatureKey.BUDGET_RATIO));
    }

    @Test
    void extract_statusAndDifficulty() {
        SearchPreferences prefs = preferences().difficulty(2).build();
        FeatureVector fv = extractor.extract(trip().status(TripStatus.LAST_PLACES).difficulty(5).build(), prefs);

        assertEquals(2D, fv.get(FeatureKey.STATUS_CODE));
        assertEquals(3D, fv.get(FeatureKey.DIFFICULTY_DELTA));
    }

    @Test
    void extract_daysUntilDeparture() {
        SearchPreferences prefs = preferences().build();

        assertEquals(73D / 365D, extractor.extract(trip().departureDate(TODAY.plusDays(73)).build(), prefs)
                .get(FeatureKey.DAYS_UNTIL_DEPARTURE), 1e-12);
        assertEquals(0D, extractor.extract(trip().departureDate(TODAY.minusDays(3)).build(), prefs)
                .get(FeatureKey.DAYS_UNTIL_DEPARTURE));
        assertEquals(1D, extractor.extract(trip().departureDate(TODAY.plusDays(800)).build(), prefs)
                .get(FeatureKey.DAYS_UNTIL_DEPARTURE));
    }

    @Test
    void extract_geographyLevels() {
        SearchPreferences prefs = preferences()
                .countryIds(new TreeSet<>(Set.of(81L)))
                .continents(new TreeSet<>(Set.of(Continent.EUROPE, Continent.ANTARCTICA)))
                .build();

        assertEquals(2D, geo(trip().countryId(81L).continent(Continent.ASIA).build(), prefs));
        assertEquals(1D, geo(trip().countryId(33L).continent(Continent.EUROPE).build(), prefs));
        assertEquals(2D, geo(trip().countryId(999L).continent(Continent.ANTARCTICA).build(), prefs));
        assertEquals(0D, geo(trip().countryId(55L).continent(Continent.SOUTH_AMERICA).build(), prefs));
        assertEquals(0D, geo(trip().countryId(81L).build(), preferences().build()));
    }

    @Test
    void extract_dateLevels() {
        TripCandidate june = trip().departureDate(LocalDate.of(2026, 6, 15)).build();

        assertEquals(2D, extractor.extract(june, preferences().year(2026).month(6).build())
                .get(FeatureKey.DATE_MATCH_LEVEL));
        assertEquals(1D, extractor.extract(june, preferences().year(2026).month(7).build())
                .get(FeatureKey.DATE_MATCH_LEVEL));
        assertEquals(1D, extractor.extract(june, preferences().year(2026).build())
                .get(FeatureKey.DATE_MATCH_LEVEL));
        assertEquals(0D, extractor.extract(june, preferences().year(2027).build())
                .get(FeatureKey.DATE_MATCH_LEVEL));
    }

    @Test
    void extract_isDeterministic() {
        TripCandidate t = trip().themeIds(Set.of(4L)).price(new BigDecimal("1999")).countryId(81L)
                .departureDate(TODAY.plusDays(40)).build();
        SearchPreferences prefs = preferences().themeIds(new TreeSet<>(Set.of(4L))).budget(2500D).build();

        assertEquals(extractor.extract(t, prefs), extractor.extract(t, prefs));
    }

    @Test
    void upperBound_shouldNeverBeBelowActualScore() {
        WeightVector weights = DefaultWeights.initial();
        SearchPreferences prefs = preferences()
                .themeIds(new TreeSet<>(Set.of(1L, 2L)))
                .countryIds(new TreeSet<>(Set.of(81L)))
                .tripTypeId(3L)
                .budget(2000D)
                .difficulty(3)
                .minDuration(7)
                .maxDuration(10)
                .year(2026)
                .build();
        List<TripCandidate> trips = Arrays.asList(
                trip().themeIds(Set.of(1L, 2L)).countryId(81L).tripTypeId(3L).difficulty(3).durationDays(8)
                        .price(new BigDecimal("1500")).status(TripStatus.LAST_PLACES)
                        .departureDate(LocalDate.of(2026, 4, 1)).build(),
                trip().themeIds(Set.of(9L)).countryId(7L).difficulty(1).durationDays(30)
                        .price(new BigDecimal("9000")).status(TripStatus.GUARANTEED)
                        .departureDate(LocalDate.of(2027, 1, 1)).build(),
                trip().build());

        for (TripCandidate t : trips) {
            double actual = scoringEngine.score(extractor.extract(t, prefs), weights);
            assertTrue(extractor.upperBound(t, weights) >= actual, "upper bound below score for " + t);
        }
    }

    @Test
    void checkSchema_shouldRejectMissingKey() {
        Map<FeatureKey, Double> partial = new EnumMap<>(DefaultWeights.initial().asMap());
        partial.remove(FeatureKey.DATE_MATCH_LEVEL);

        assertThrows(SchemaMismatchException.class, () -> extractor.checkSchema(WeightVector.draft(partial)));
    }

    private double geo(TripCandidate trip, SearchPreferences prefs) {
        return extractor.extract(trip, prefs).get(FeatureKey.GEO_MATCH_LEVEL);
    }
}
