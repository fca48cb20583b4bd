package com.sqlpush.translator;

import com.sqlpush.test.TestBase;
import com.sqlpush.test.TestCategories;
import com.sqlpush.types.BinaryType;
import com.sqlpush.types.BooleanType;
import com.sqlpush.types.ByteType;
import com.sqlpush.types.CalendarIntervalType;
import com.sqlpush.types.DateType;
import com.sqlpush.types.DecimalType;
import com.sqlpush.types.FloatType;
import com.sqlpush.types.IntegerType;
import com.sqlpush.types.NullType;
import com.sqlpush.types.StringType;
import com.sqlpush.types.TimestampType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TranslationContext} and {@link TypeMapper}.
 */
@TestCategories.Unit
@DisplayName("TranslationContext Tests")
public class TranslationContextTest extends TestBase {

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Defaults target the oldest supported version")
        void testDefaults() {
            TranslationContext context = TranslationContext.defaults();

            assertThat(context.dialectVersion()).isEqualTo(DialectLimits.DEFAULT_VERSION);
            assertThat(context.supports(DialectLimits.BIT_AGGREGATES_SINCE)).isFalse();
        }

        @Test
        @DisplayName("Version is read from properties")
        void testFromProperties() {
            Properties properties = new Properties();
            properties.setProperty(TranslationContext.DIALECT_VERSION_PROPERTY, "7.5.0");

            TranslationContext context = TranslationContext.fromProperties(properties);

            assertThat(context.dialectVersion()).isEqualTo(new DialectVersion(7, 5, 0));
            assertThat(context.supports(DialectLimits.UUID_SINCE)).isTrue();
        }

        @Test
        @DisplayName("Missing property falls back to the default version")
        void testFromEmptyProperties() {
            assertThat(TranslationContext.fromProperties(new Properties()).dialectVersion())
                .isEqualTo(DialectLimits.DEFAULT_VERSION);
        }

        @Test
        @DisplayName("Malformed property is rejected")
        void testFromMalformedProperties() {
            Properties properties = new Properties();
            properties.setProperty(TranslationContext.DIALECT_VERSION_PROPERTY, "seven");

            assertThatThrownBy(() -> TranslationContext.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seven");
        }

        @Test
        @DisplayName("Builder rejects null collaborators")
        void testBuilderRejectsNull() {
            assertThatThrownBy(() -> TranslationContext.builder().columnResolver(null))
                .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> TranslationContext.builder().transpileObserver(null))
                .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("Cast Targets")
    class CastTargets {

        @Test
        @DisplayName("Host types map to remote CAST targets")
        void testCastTargets() {
            assertThat(TypeMapper.toCastTarget(ByteType.get())).contains("SIGNED");
            assertThat(TypeMapper.toCastTarget(IntegerType.get())).contains("SIGNED");
            assertThat(TypeMapper.toCastTarget(FloatType.get())).contains("DOUBLE");
            assertThat(TypeMapper.toCastTarget(new DecimalType(10, 2))).contains("DECIMAL(10, 2)");
            assertThat(TypeMapper.toCastTarget(StringType.get())).contains("CHAR");
            assertThat(TypeMapper.toCastTarget(DateType.get())).contains("DATE");
            assertThat(TypeMapper.toCastTarget(TimestampType.get())).contains("DATETIME(6)");
            assertThat(TypeMapper.toCastTarget(BinaryType.get())).contains("BINARY");
        }

        @Test
        @DisplayName("Types without a CAST form")
        void testNoCastTarget() {
            assertThat(TypeMapper.toCastTarget(BooleanType.get())).isEmpty();
            assertThat(TypeMapper.toCastTarget(NullType.get())).isEmpty();
            assertThat(TypeMapper.toCastTarget(CalendarIntervalType.get())).isEmpty();
        }

        @Test
        @DisplayName("Null type is rejected")
        void testNullType() {
            assertThatThrownBy(() -> TypeMapper.toCastTarget(null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
