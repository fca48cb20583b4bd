package com.sqlpush.translator;

import com.sqlpush.literal.LiteralEncoder;
import com.sqlpush.types.BinaryType;
import com.sqlpush.types.DataType;
import com.sqlpush.types.DateType;
import com.sqlpush.types.DecimalType;
import com.sqlpush.types.DoubleType;
import com.sqlpush.types.FloatType;
import com.sqlpush.types.StringType;
import com.sqlpush.types.TimestampType;

import java.util.Optional;

/**
 * Maps host types to the target types of the remote {@code CAST}.
 *
 * <p>Examples:
 * <pre>
 *   IntegerType        → SIGNED
 *   StringType         → CHAR
 *   DecimalType(70,40) → DECIMAL(65, 30)
 *   TimestampType      → DATETIME(6)
 * </pre>
 *
 * <p>Boolean, null and interval targets have no remote CAST form.
 */
public final class TypeMapper {

    private TypeMapper() {
    }

    /**
     * Returns the CAST target for a host type.
     *
     * @param type the host type
     * @return the remote type text, or empty if there is none
     */
    public static Optional<String> toCastTarget(DataType type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (type.isIntegral()) {
            return Optional.of("SIGNED");
        }
        if (type instanceof FloatType || type instanceof DoubleType) {
            return Optional.of("DOUBLE");
        }
        if (type instanceof DecimalType decimal) {
            DecimalType clamped = LiteralEncoder.clamp(decimal);
            return Optional.of("DECIMAL(" + clamped.precision() + ", " + clamped.scale() + ")");
        }
        if (type instanceof StringType) {
            return Optional.of("CHAR");
        }
        if (type instanceof DateType) {
            return Optional.of("DATE");
        }
        if (type instanceof TimestampType) {
            return Optional.of("DATETIME(6)");
        }
        if (type instanceof BinaryType) {
            return Optional.of("BINARY");
        }
        return Optional.empty();
    }
}
