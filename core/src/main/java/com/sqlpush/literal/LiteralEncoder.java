package com.sqlpush.literal;

import com.sqlpush.expression.Literal;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.translator.DialectLimits;
import com.sqlpush.types.CalendarIntervalType;
import com.sqlpush.types.DataType;
import com.sqlpush.types.DecimalType;
import com.sqlpush.types.NullType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Turns constant values into fragments.
 *
 * <p>Numbers and booleans have a fixed canonical text and are emitted as raw
 * SQL. Everything else (strings, dates, timestamps, binary) is bound as a
 * parameter so no user data ever reaches the statement text.
 *
 * <p>Encoding rules, first match wins:
 * <ol>
 *   <li>null: bound null of the literal's type</li>
 *   <li>interval: not encodable</li>
 *   <li>boolean: {@code TRUE} / {@code FALSE}</li>
 *   <li>integral: decimal digits</li>
 *   <li>decimal: {@code CAST(v AS DECIMAL(p, s))}, clamped to the dialect maximum</li>
 *   <li>floating point: digits when finite; NaN and infinities are not encodable</li>
 *   <li>anything else: bound</li>
 * </ol>
 */
public final class LiteralEncoder {

    private LiteralEncoder() {
    }

    public static Optional<Fragment> encode(Literal literal) {
        return encode(literal.value(), literal.dataType());
    }

    /**
     * Encodes one value.
     *
     * @param value the value (may be null)
     * @param dataType the value's type, or null if unknown
     * @return the fragment, or empty if the value has no remote representation
     */
    public static Optional<Fragment> encode(Object value, DataType dataType) {
        DataType type = dataType == null ? NullType.get() : dataType;

        if (value == null) {
            return Optional.of(Fragment.bound(null, type));
        }
        if (type instanceof CalendarIntervalType) {
            return Optional.empty();
        }
        if (value instanceof Boolean b) {
            return Optional.of(Fragment.raw(b ? "TRUE" : "FALSE"));
        }
        if (value instanceof Byte || value instanceof Short
                || value instanceof Integer || value instanceof Long
                || value instanceof BigInteger) {
            return Optional.of(Fragment.raw(value.toString()));
        }
        if (value instanceof BigDecimal decimal) {
            return Optional.of(encodeDecimal(decimal, type));
        }
        if (value instanceof Double d) {
            return finite(d) ? Optional.of(Fragment.raw(d.toString())) : Optional.empty();
        }
        if (value instanceof Float f) {
            return finite(f) ? Optional.of(Fragment.raw(f.toString())) : Optional.empty();
        }
        return Optional.of(Fragment.bound(value, type));
    }

    /**
     * Encodes a collection of same-typed values as a comma-separated list.
     *
     * @param values the values
     * @param elementType the element type
     * @return the joined fragment, or empty if the collection is empty or any element fails
     */
    public static Optional<Fragment> encodeAll(Collection<?> values, DataType elementType) {
        if (values.isEmpty()) {
            return Optional.empty();
        }
        List<Fragment> encoded = new ArrayList<>(values.size());
        for (Object value : values) {
            Optional<Fragment> fragment = encode(value, elementType);
            if (fragment.isEmpty()) {
                return Optional.empty();
            }
            encoded.add(fragment.get());
        }
        return Optional.of(Fragment.join(encoded, ", "));
    }

    /**
     * Clamps a decimal type to the remote maximum precision and scale.
     *
     * @param type the host decimal type
     * @return the clamped type
     */
    public static DecimalType clamp(DecimalType type) {
        return type.clampTo(DialectLimits.MAX_DECIMAL_PRECISION, DialectLimits.MAX_DECIMAL_SCALE);
    }

    private static Fragment encodeDecimal(BigDecimal value, DataType type) {
        DecimalType declared;
        if (type instanceof DecimalType decimalType) {
            declared = decimalType;
        } else {
            BigDecimal normalized = value.scale() < 0 ? value.setScale(0) : value;
            declared = new DecimalType(
                Math.max(1, Math.max(normalized.scale(), normalized.precision())), normalized.scale());
        }
        DecimalType target = clamp(declared);
        return Fragment.raw("CAST(" + value.toPlainString() +
                            " AS DECIMAL(" + target.precision() + ", " + target.scale() + "))");
    }

    private static boolean finite(double d) {
        return !Double.isNaN(d) && !Double.isInfinite(d);
    }
}
