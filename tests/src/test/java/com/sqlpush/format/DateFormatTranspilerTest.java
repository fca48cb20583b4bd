package com.sqlpush.format;

import com.sqlpush.test.TestBase;
import com.sqlpush.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DateFormatTranspiler}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("DateFormatTranspiler Tests")
public class DateFormatTranspilerTest extends TestBase {

    private final DateFormatTranspiler transpiler = new DateFormatTranspiler(TranspileObserver.NONE);

    @Nested
    @DisplayName("Symbol Mode")
    class SymbolMode {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "'yyyy-MM-dd HH:mm:ss', '%Y-%m-%d %T'",
            "'hh:mm:ss a',          '%r'",
            "'dd/MM/yyyy',          '%d/%m/%Y'",
            "'yyyy-M-d',            '%Y-%c-%e'",
            "'HH:mm',               '%H:%i'",
            "'h:mm a',              '%l:%i %p'",
            "'yy',                  '%y'",
            "'DDD',                 '%j'",
            "'MMMM',                '%M'",
            "'MMM',                 '%b'",
            "'M',                   '%c'",
            "'d',                   '%e'",
            "'H',                   '%k'",
            "'h',                   '%l'",
            "'ss',                  '%s'",
            "'SSS',                 '%f'",
            "'ww',                  '%v'",
            "'EEEE',                '%W'",
            "'EEE',                 '%a'"
        })
        @DisplayName("Host pattern maps to percent symbols")
        void testToSymbols(String pattern, String expected) {
            String result = transpiler.toSymbols(pattern);
            logData("Symbols", result);

            assertThat(result).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "'MMmm',     '%m%i'",
            "'yyyyMMmm', '%Y%m%i'",
            "'MMMMmm',   '%M%i'",
            "'HHhh',     '%H%h'",
            "'ddMM',     '%d%m'"
        })
        @DisplayName("Adjacent fields never rewrite symbols already emitted")
        void testAdjacentFields(String pattern, String expected) {
            assertThat(transpiler.toSymbols(pattern)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Literal text between fields is kept")
        void testLiteralTextKept() {
            assertThat(transpiler.toSymbols("yyyy/MM")).isEqualTo("%Y/%m");
        }
    }

    @Nested
    @DisplayName("Specifier Mode")
    class SpecifierMode {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "'yyyy-MM-dd',  'YYYY-MM-DD'",
            "'yy',          'YY'",
            "'MMMM',        'MONTH'",
            "'MMMM yyyy',   'MONTH YYYY'",
            "'MMM dd',      'MON DD'",
            "'EEE',         'DY'",
            "'d',           'DD'",
            "'HH:mm:ss',    'HH24:MI:SS'",
            "'hh:mm a',     'HH12:MI AM'"
        })
        @DisplayName("Host pattern maps to specifiers")
        void testToSpecifiers(String pattern, String expected) {
            String result = transpiler.toSpecifiers(pattern);
            logData("Specifiers", result);

            assertThat(result).isEqualTo(expected);
        }

        @Test
        @DisplayName("Emitted text is not rescanned")
        void testEmittedTextNotRescanned() {
            // MONTH contains an H that the hour rule would otherwise rewrite
            assertThat(transpiler.toSpecifiers("MMMM")).doesNotContain("HH24");
        }
    }

    @Nested
    @DisplayName("Observer")
    class Observer {

        @Test
        @DisplayName("Observer receives mode, input and output")
        void testObserverNotified() {
            List<String> events = new ArrayList<>();
            DateFormatTranspiler recording = new DateFormatTranspiler(
                (mode, input, output) -> events.add(mode + ":" + input + ":" + output));

            recording.transpile("yyyy", FormatMode.SYMBOLS);
            recording.transpile("yyyy", FormatMode.SPECIFIERS);

            assertThat(events).containsExactly("SYMBOLS:yyyy:%Y", "SPECIFIERS:yyyy:YYYY");
        }

        @Test
        @DisplayName("Default transpiler logs and returns the result")
        void testDefaultTranspiler() {
            assertThat(new DateFormatTranspiler().toSymbols("yyyy")).isEqualTo("%Y");
        }

        @Test
        @DisplayName("Null observer is rejected")
        void testNullObserver() {
            assertThatThrownBy(() -> new DateFormatTranspiler(null))
                .isInstanceOf(NullPointerException.class);
        }
    }
}
