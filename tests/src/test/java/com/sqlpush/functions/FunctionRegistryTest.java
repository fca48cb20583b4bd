package com.sqlpush.functions;

import com.sqlpush.fragment.Fragment;
import com.sqlpush.test.TestBase;
import com.sqlpush.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FunctionRegistry}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FunctionRegistry Tests")
public class FunctionRegistryTest extends TestBase {

    private static String render(String name, int arity, String... args) {
        FunctionTranslator translator = FunctionRegistry.lookup(name, arity).orElseThrow();
        List<Fragment> fragments = Arrays.stream(args).map(Fragment::raw).toList();
        return translator.translate(fragments).sql();
    }

    @Nested
    @DisplayName("Direct Mappings")
    class DirectMappings {

        @ParameterizedTest(name = "{0}/{1} -> {2}")
        @CsvSource({
            "upper,       1, UPPER",
            "UCASE,       1, UPPER",
            "length,      1, CHAR_LENGTH",
            "octet_length, 1, LENGTH",
            "ceiling,     1, CEIL",
            "ln,          1, LOG",
            "signum,      1, SIGN",
            "dayofmonth,  1, DAY",
            "sha,         1, SHA1",
            "pow,         2, POWER",
            "date_add,    2, ADDDATE",
            "date_sub,    2, SUBDATE",
            "ifnull,      2, COALESCE",
            "substring,   3, SUBSTR"
        })
        @DisplayName("Host name maps to remote name")
        void testDirectMapping(String name, int arity, String remote) {
            logStep("Looking up " + name + "/" + arity);

            assertThat(FunctionRegistry.getDialectFunction(name, arity)).contains(remote);
            assertThat(FunctionRegistry.isSupported(name, arity)).isTrue();
        }

        @Test
        @DisplayName("Direct mapping renders a plain call")
        void testDirectRender() {
            assertThat(render("substr", 3, "s", "1", "2")).isEqualTo("SUBSTR(s, 1, 2)");
        }

        @Test
        @DisplayName("Lookup distinguishes arity")
        void testArity() {
            assertThat(FunctionRegistry.isSupported("log", 1)).isTrue();
            assertThat(FunctionRegistry.isSupported("log", 2)).isTrue();
            assertThat(FunctionRegistry.isSupported("log", 3)).isFalse();
            assertThat(FunctionRegistry.isSupported("upper", 2)).isFalse();
        }
    }

    @Nested
    @DisplayName("Custom Translators")
    class CustomTranslators {

        @Test
        @DisplayName("Custom translators have no direct name")
        void testCustomHasNoDirectName() {
            assertThat(FunctionRegistry.isSupported("hypot", 2)).isTrue();
            assertThat(FunctionRegistry.getDialectFunction("hypot", 2)).isEmpty();
        }

        @Test
        @DisplayName("bit_length multiplies the byte length")
        void testBitLength() {
            assertThat(render("bit_length", 1, "s")).isEqualTo("(LENGTH(s) * 8)");
        }

        @Test
        @DisplayName("chr guards NULL input")
        void testChr() {
            assertThat(render("chr", 1, "n")).isEqualTo("IF(ISNULL(n), NULL, CHAR(n))");
            assertThat(render("char", 1, "n")).isEqualTo("IF(ISNULL(n), NULL, CHAR(n))");
        }

        @Test
        @DisplayName("repeat pads with the string itself")
        void testRepeat() {
            assertThat(render("repeat", 2, "s", "n"))
                .isEqualTo("LPAD(?, (IF((n < 0), 0, n) * CHAR_LENGTH(s)), s)");
        }

        @Test
        @DisplayName("Date helpers")
        void testDateHelpers() {
            assertThat(render("unix_millis", 1, "ts")).isEqualTo("FLOOR((UNIX_TIMESTAMP(ts) * 1000))");
            assertThat(render("date_from_unix_date", 1, "n")).isEqualTo("ADDDATE(DATE('1970-01-01'), n)");
            assertThat(render("from_utc_timestamp", 2, "ts", "tz")).isEqualTo("CONVERT_TZ(ts, ?, tz)");
        }

        @Test
        @DisplayName("ifNegative wraps a sign check")
        void testIfNegative() {
            Fragment fragment = FunctionRegistry.ifNegative(Fragment.raw("n"), Fragment.raw("0"), Fragment.raw("n"));

            assertThat(fragment.sql()).isEqualTo("IF((n < 0), 0, n)");
        }
    }

    @Test
    @DisplayName("Unknown and empty names are not supported")
    void testUnknown() {
        assertThat(FunctionRegistry.lookup("mystery_fn", 1)).isEmpty();
        assertThat(FunctionRegistry.lookup("", 1)).isEmpty();
        assertThat(FunctionRegistry.lookup(null, 1)).isEmpty();
    }

    @Test
    @DisplayName("Registry holds the full catalog")
    void testCount() {
        int count = FunctionRegistry.registeredFunctionCount();
        logData("Registered functions", count);

        assertThat(count).isGreaterThan(80);
    }
}
