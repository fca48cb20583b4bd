package com.sqlpush.translator;

import com.sqlpush.test.TestBase;
import com.sqlpush.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DialectVersion}.
 */
@TestCategories.Unit
@DisplayName("DialectVersion Tests")
public class DialectVersionTest extends TestBase {

    @Test
    @DisplayName("Full version is parsed")
    void testParseFull() {
        assertThat(DialectVersion.parse("7.5.2")).isEqualTo(new DialectVersion(7, 5, 2));
    }

    @Test
    @DisplayName("Missing components default to zero")
    void testParsePartial() {
        assertThat(DialectVersion.parse("7.5")).isEqualTo(new DialectVersion(7, 5, 0));
        assertThat(DialectVersion.parse(" 8 ")).isEqualTo(new DialectVersion(8, 0, 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "abc", "7.x.0", "1.2.3.4", "-1.0.0"})
    @DisplayName("Malformed versions are rejected")
    void testParseMalformed(String value) {
        assertThatThrownBy(() -> DialectVersion.parse(value))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Null version is rejected")
    void testParseNull() {
        assertThatThrownBy(() -> DialectVersion.parse(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Versions compare component by component")
    void testOrdering() {
        DialectVersion v700 = DialectVersion.parse("7.0.0");
        DialectVersion v701 = DialectVersion.parse("7.0.1");
        DialectVersion v710 = DialectVersion.parse("7.1.0");

        assertThat(v700).isLessThan(v701);
        assertThat(v701).isLessThan(v710);
        assertThat(v710.atLeast(v701)).isTrue();
        assertThat(v700.atLeast(v701)).isFalse();
        assertThat(v701.atLeast(v701)).isTrue();
    }

    @Test
    @DisplayName("toString prints all three components")
    void testToString() {
        assertThat(DialectVersion.parse("7.5")).hasToString("7.5.0");
    }
}
