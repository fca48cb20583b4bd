package com.sqlpush.rewrite;

import com.sqlpush.exception.TranslationException;
import com.sqlpush.expression.BinaryExpression;
import com.sqlpush.expression.ColumnReference;
import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.expression.Literal;
import com.sqlpush.expression.UnaryExpression;
import com.sqlpush.test.TestBase;
import com.sqlpush.test.TestCategories;
import com.sqlpush.types.BooleanType;
import com.sqlpush.types.IntegerType;
import com.sqlpush.types.LongType;
import com.sqlpush.types.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TemporalRewrites}.
 */
@TestCategories.Tier2
@TestCategories.Unit
@DisplayName("TemporalRewrites Tests")
public class TemporalRewritesTest extends TestBase {

    private final ColumnReference ts = new ColumnReference(1, "ts", LongType.get());
    private final ColumnReference tz = new ColumnReference(2, "tz", StringType.get());
    private final ColumnReference a = new ColumnReference(3, "a", StringType.get());
    private final ColumnReference b = new ColumnReference(4, "b", StringType.get());

    @Test
    @DisplayName("Case-insensitive compare lowers both sides")
    void testStringCompareCi() {
        FunctionCall call = FunctionCall.of("string_compare_ci", BooleanType.get(), a, b);

        Optional<Expression> rewritten = TemporalRewrites.rewrite(call);

        assertThat(rewritten).contains(BinaryExpression.equal(
            FunctionCall.of("lower", StringType.get(), a),
            FunctionCall.of("lower", StringType.get(), b)));
    }

    @Test
    @DisplayName("Negated compare wraps the compare in NOT")
    void testStringCompareNeqCi() {
        FunctionCall call = FunctionCall.of("string_compare_neq_ci", BooleanType.get(), a, b);

        assertThat(TemporalRewrites.rewrite(call)).contains(UnaryExpression.not(
            FunctionCall.of("string_compare_ci", BooleanType.get(), a, b)));
    }

    @Test
    @DisplayName("date_to_string becomes date_format")
    void testDateToString() {
        FunctionCall call = FunctionCall.of("date_to_string", StringType.get(),
            ts, Literal.of("yyyy-MM-dd"), tz);

        Expression rewritten = TemporalRewrites.rewrite(call).orElseThrow();

        assertThat(rewritten).isInstanceOf(FunctionCall.class);
        assertThat(((FunctionCall) rewritten).normalizedName()).isEqualTo("date_format");
        assertThat(((FunctionCall) rewritten).argument(1)).isEqualTo(Literal.of("yyyy-MM-dd"));
    }

    @Test
    @DisplayName("Non-literal format is not rewritten")
    void testNonLiteralFormat() {
        FunctionCall call = FunctionCall.of("from_unix_time_tz", StringType.get(), ts, a, tz);

        assertThat(TemporalRewrites.rewrite(call)).isEmpty();
    }

    @Test
    @DisplayName("day_of_the_week decodes the weekday number to a name")
    void testDayOfTheWeek() {
        FunctionCall call = FunctionCall.of("day_of_the_week", StringType.get(), ts, tz);

        FunctionCall decode = (FunctionCall) TemporalRewrites.rewrite(call).orElseThrow();

        assertThat(decode.normalizedName()).isEqualTo("decode");
        assertThat(decode.argumentCount()).isEqualTo(16);
        assertThat(decode.argument(2)).isEqualTo(Literal.of("monday"));
        assertThat(decode.argument(14)).isEqualTo(Literal.of("sunday"));
        assertThat(decode.argument(15)).isEqualTo(Literal.nullValue());
    }

    @Test
    @DisplayName("week_diff subtracts the weeks since epoch of both sides")
    void testWeekDiff() {
        FunctionCall call = FunctionCall.of("week_diff", LongType.get(), ts, ts, Literal.of("MON"), tz);

        Expression rewritten = TemporalRewrites.rewrite(call).orElseThrow();

        assertThat(rewritten).isInstanceOf(BinaryExpression.class);
        assertThat(((BinaryExpression) rewritten).operator()).isEqualTo(BinaryExpression.Operator.SUBTRACT);
    }

    @Test
    @DisplayName("week_diff needs a literal start day")
    void testWeekDiffNonLiteral() {
        FunctionCall call = FunctionCall.of("week_diff", LongType.get(), ts, ts, a, tz);

        assertThat(TemporalRewrites.rewrite(call)).isEmpty();
    }

    @Test
    @DisplayName("week_diff with an unknown day fails translation")
    void testWeekDiffUnknownDay() {
        FunctionCall call = FunctionCall.of("week_diff", LongType.get(), ts, ts, Literal.of("NOTADAY"), tz);

        assertThatThrownBy(() -> TemporalRewrites.rewrite(call))
            .isInstanceOf(TranslationException.class)
            .hasMessageContaining("NOTADAY");
    }

    @Test
    @DisplayName("Other functions and arities are not rewritten")
    void testOtherFunctions() {
        assertThat(TemporalRewrites.rewrite(FunctionCall.of("upper", StringType.get(), a))).isEmpty();
        assertThat(TemporalRewrites.rewrite(FunctionCall.of("day_diff", IntegerType.get(), ts, ts))).isEmpty();
    }
}
