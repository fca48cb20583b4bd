package com.sqlpush.translator.rules;

import com.sqlpush.expression.AggregateExpression;
import com.sqlpush.expression.BinaryExpression;
import com.sqlpush.expression.ColumnReference;
import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.expression.Literal;
import com.sqlpush.format.TranspileObserver;
import com.sqlpush.test.TestBase;
import com.sqlpush.test.TestCategories;
import com.sqlpush.translator.ExpressionTranslator;
import com.sqlpush.translator.TranslationContext;
import com.sqlpush.types.DoubleType;
import com.sqlpush.types.IntegerType;
import com.sqlpush.types.LongType;
import com.sqlpush.types.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AggregateRule}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("AggregateRule Tests")
public class AggregateRuleTest extends TestBase {

    private final ExpressionTranslator translator = translator("7.0.0");

    private final ColumnReference x = new ColumnReference(1, "x", IntegerType.get());
    private final ColumnReference y = new ColumnReference(2, "y", IntegerType.get());
    private final Expression positive = BinaryExpression.greaterThan(y, Literal.of(0));

    private static ExpressionTranslator translator(String version) {
        return new ExpressionTranslator(TranslationContext.builder()
            .dialectVersion(version)
            .transpileObserver(TranspileObserver.NONE)
            .build());
    }

    private String sql(ExpressionTranslator translator, Expression expression) {
        String sql = translator.translate(expression).orElseThrow().sql();
        logData("SQL", sql);
        return sql;
    }

    private String sql(Expression expression) {
        return sql(translator, expression);
    }

    private static AggregateExpression count(List<Expression> args, boolean distinct, Expression filter) {
        return new AggregateExpression("count", args, distinct, filter, LongType.get());
    }

    @Nested
    @DisplayName("COUNT")
    class Count {

        @Test
        @DisplayName("COUNT without arguments counts rows")
        void testCountStar() {
            assertThat(sql(count(List.of(), false, null))).isEqualTo("COUNT(1)");
        }

        @Test
        @DisplayName("Filtered COUNT without arguments counts matching rows")
        void testCountStarFiltered() {
            assertThat(sql(count(List.of(), false, positive))).isEqualTo("COUNT(IF((`y` > 0), 1, NULL))");
        }

        @Test
        @DisplayName("Filtered COUNT nulls out non-matching values")
        void testCountFiltered() {
            assertThat(sql(count(List.of(x), false, positive))).isEqualTo("COUNT(IF((`y` > 0), `x`, NULL))");
        }

        @Test
        @DisplayName("COUNT DISTINCT")
        void testCountDistinct() {
            assertThat(sql(count(List.of(x), true, null))).isEqualTo("COUNT(DISTINCT `x`)");
        }

        @Test
        @DisplayName("Filtered COUNT DISTINCT is untranslatable")
        void testCountDistinctFiltered() {
            assertThat(translator.translate(count(List.of(x), true, positive))).isEmpty();
        }

        @Test
        @DisplayName("COUNT of several non-distinct values is untranslatable")
        void testCountSeveral() {
            assertThat(translator.translate(count(List.of(x, y), false, null))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Other Aggregates")
    class OtherAggregates {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "min, MIN",
            "max, MAX",
            "sum, SUM",
            "avg, AVG",
            "mean, AVG",
            "stddev, STDDEV_SAMP",
            "stddev_pop, STDDEV_POP",
            "variance, VAR_SAMP",
            "var_pop, VAR_POP"
        })
        @DisplayName("Aggregate maps to its remote name")
        void testAggregateNames(String function, String remote) {
            assertThat(sql(AggregateExpression.of(function, x, DoubleType.get()))).isEqualTo(remote + "(`x`)");
        }

        @Test
        @DisplayName("Filter is applied inside the aggregate")
        void testFilteredMax() {
            AggregateExpression max = AggregateExpression.of("max", x, IntegerType.get()).withFilter(positive);

            assertThat(sql(max)).isEqualTo("MAX(IF((`y` > 0), `x`, NULL))");
        }

        @Test
        @DisplayName("DISTINCT on other aggregates is untranslatable")
        void testDistinctSum() {
            assertThat(translator.translate(AggregateExpression.of("sum", x, LongType.get()).asDistinct())).isEmpty();
            assertThat(translator.translate(AggregateExpression.of("avg", x, DoubleType.get()).asDistinct())).isEmpty();
        }

        @ParameterizedTest(name = "{0}(DISTINCT x) -> {1}(x)")
        @CsvSource({
            "min, MIN",
            "max, MAX"
        })
        @DisplayName("MIN and MAX ignore DISTINCT")
        void testDistinctExtremes(String function, String remote) {
            AggregateExpression distinct = AggregateExpression.of(function, x, IntegerType.get()).asDistinct();

            assertThat(sql(distinct)).isEqualTo(remote + "(`x`)");
            assertThat(sql(distinct.withFilter(positive))).isEqualTo(remote + "(IF((`y` > 0), `x`, NULL))");
        }

        @Test
        @DisplayName("Untranslatable filter fails the aggregate")
        void testUntranslatableFilter() {
            Expression filter = FunctionCall.of("mystery_fn", IntegerType.get(), y);

            assertThat(translator.translate(AggregateExpression.of("sum", x, LongType.get()).withFilter(filter)))
                .isEmpty();
        }

        @Test
        @DisplayName("approx_count_distinct drops its accuracy argument")
        void testApproxCountDistinct() {
            AggregateExpression approx = new AggregateExpression("approx_count_distinct",
                List.of(x, Literal.of(0.05)), false, null, LongType.get());

            assertThat(sql(approx)).isEqualTo("APPROX_COUNT_DISTINCT(`x`)");
        }

        @Test
        @DisplayName("Unknown aggregate is untranslatable")
        void testUnknownAggregate() {
            assertThat(translator.translate(AggregateExpression.of("percentile", x, DoubleType.get()))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Version Gating")
    class VersionGating {

        @Test
        @DisplayName("Bit aggregates need 7.0.1")
        void testBitAggregates() {
            AggregateExpression bitAnd = AggregateExpression.of("bit_and", x, IntegerType.get());

            assertThat(translator.translate(bitAnd)).isEmpty();
            assertThat(sql(translator("7.0.1"), bitAnd)).isEqualTo("BIT_AND(`x`)");
            assertThat(sql(translator("7.5.0"), AggregateExpression.of("bit_xor", x, IntegerType.get())))
                .isEqualTo("BIT_XOR(`x`)");
        }

        @Test
        @DisplayName("uuid needs 7.5.0")
        void testUuid() {
            FunctionCall uuid = FunctionCall.of("uuid", StringType.get());

            assertThat(translator.translate(uuid)).isEmpty();
            assertThat(translator("7.1.0").translate(uuid)).isEmpty();
            assertThat(sql(translator("7.5.0"), uuid)).isEqualTo("UUID()");
        }
    }
}
