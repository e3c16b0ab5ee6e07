package io.github.cyfko.filterable.core.utils;

import java.lang.reflect.Constructor;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Converts request operands to the Java type of the attribute they are compared with.
 * <p>
 * Request operands are usually strings ({@code "18"}, {@code "2024-01-31"}, {@code "ACTIVE"}),
 * while storage attributes are typed. Backends call {@link #convertValue(Class, Object)} before
 * binding an operand.
 * </p>
 *
 * <p><strong>Supported targets:</strong></p>
 * <ul>
 *   <li>numeric primitives and wrappers, {@link BigDecimal}, {@link BigInteger}</li>
 *   <li>enums, matched by name ignoring case</li>
 *   <li>{@code Boolean}: {@code true}, {@code 1}, {@code yes}, {@code on} (ignoring case) are true</li>
 *   <li>{@link LocalDate}, {@link LocalDateTime}, {@link LocalTime}, {@link Instant},
 *       {@link OffsetDateTime}, {@link ZonedDateTime} from ISO-8601 text</li>
 *   <li>{@link UUID}, {@link String}</li>
 *   <li>any type with a public {@code String} constructor</li>
 * </ul>
 *
 * <p>This class is designed to be used statically and cannot be instantiated.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeConversionUtils {

    private TypeConversionUtils() {
        throw new UnsupportedOperationException("TypeConversionUtils is a utility class and cannot be instantiated");
    }

    /**
     * Converts a value to the target type.
     *
     * <pre>{@code
     * convertValue(Integer.class, "18");           // 18
     * convertValue(LocalDate.class, "2024-01-31"); // 2024-01-31
     * convertValue(Status.class, "active");        // Status.ACTIVE
     * }</pre>
     *
     * @param targetType the target class to convert to
     * @param value the value to convert, may be {@code null}
     * @return the converted value, {@code null} for {@code null}
     * @throws IllegalArgumentException if conversion is not possible
     */
    public static Object convertValue(Class<?> targetType, Object value) {
        if (value == null || targetType == null) {
            return value;
        }

        if (wrapperOf(targetType).isInstance(value)) {
            return value;
        }

        try {
            if (targetType == BigDecimal.class) return new BigDecimal(value.toString().trim());
            if (targetType == BigInteger.class) return new BigInteger(value.toString().trim());

            if (Number.class.isAssignableFrom(targetType) || isNumericPrimitive(targetType)) {
                return convertToNumeric(targetType, value);
            }

            if (targetType.isEnum()) {
                return convertToEnum(targetType, value);
            }

            if (targetType == Boolean.class || targetType == boolean.class) {
                return convertToBoolean(value);
            }

            String text = value.toString().trim();
            if (targetType == LocalDate.class) return LocalDate.parse(text);
            if (targetType == LocalDateTime.class) return LocalDateTime.parse(text);
            if (targetType == LocalTime.class) return LocalTime.parse(text);
            if (targetType == Instant.class) return Instant.parse(text);
            if (targetType == OffsetDateTime.class) return OffsetDateTime.parse(text);
            if (targetType == ZonedDateTime.class) return ZonedDateTime.parse(text);
            if (targetType == UUID.class) return UUID.fromString(text);
            if (targetType == String.class) return value.toString();

            try {
                Constructor<?> constructor = targetType.getConstructor(String.class);
                return constructor.newInstance(value.toString());
            } catch (NoSuchMethodException e) {
                throw new IllegalArgumentException(
                        String.format("Cannot convert value '%s' (type: %s) to target type %s",
                                value, value.getClass().getName(), targetType.getName()), e);
            }
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format("Error converting value '%s' to type %s: %s",
                            value, targetType.getName(), e.getMessage()), e);
        }
    }

    private static boolean isNumericPrimitive(Class<?> type) {
        return type == int.class || type == long.class || type == double.class
                || type == float.class || type == short.class || type == byte.class;
    }

    private static Class<?> wrapperOf(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        return type;
    }

    /**
     * Converts a value to a numeric type (primitive or wrapper) from a Number or its text.
     */
    private static Object convertToNumeric(Class<?> targetType, Object value) {
        if (value instanceof Number num) {
            if (targetType == Integer.class || targetType == int.class) return num.intValue();
            if (targetType == Long.class || targetType == long.class) return num.longValue();
            if (targetType == Double.class || targetType == double.class) return num.doubleValue();
            if (targetType == Float.class || targetType == float.class) return num.floatValue();
            if (targetType == Short.class || targetType == short.class) return num.shortValue();
            if (targetType == Byte.class || targetType == byte.class) return num.byteValue();
        }

        String str = value.toString().trim();
        if (targetType == Integer.class || targetType == int.class) return Integer.valueOf(str);
        if (targetType == Long.class || targetType == long.class) return Long.valueOf(str);
        if (targetType == Double.class || targetType == double.class) return Double.valueOf(str);
        if (targetType == Float.class || targetType == float.class) return Float.valueOf(str);
        if (targetType == Short.class || targetType == short.class) return Short.valueOf(str);
        if (targetType == Byte.class || targetType == byte.class) return Byte.valueOf(str);

        throw new IllegalArgumentException("Unsupported numeric type: " + targetType);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convertToEnum(Class<?> targetType, Object value) {
        String name = value.toString().trim();
        for (Object constant : targetType.getEnumConstants()) {
            if (((Enum) constant).name().equalsIgnoreCase(name)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                String.format("Invalid value '%s' for enum %s", name, targetType.getSimpleName()));
    }

    private static Boolean convertToBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof Number num) return num.intValue() != 0;

        String normalized = value.toString().toLowerCase(Locale.ROOT).trim();
        return "true".equals(normalized) || "1".equals(normalized)
                || "yes".equals(normalized) || "on".equals(normalized);
    }
}
