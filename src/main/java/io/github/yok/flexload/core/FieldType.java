package io.github.yok.flexload.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.Getter;
import org.apache.poi.ss.usermodel.DateUtil;

/**
 * Closed set of destination field types.
 *
 * <p>
 * Each constant owns its coercion rule, its SQL column type and its JDBC binding, so adding a type
 * means implementing every abstract method of this enum.
 * </p>
 *
 * <ul>
 * <li>{@link #STRING}: {@code TEXT}, values are {@link String}</li>
 * <li>{@link #NUMBER}: {@code NUMERIC}, values are {@link BigDecimal}</li>
 * <li>{@link #TIMESTAMP}: {@code TIMESTAMP}, values are {@link Instant} stored as UTC wall
 * time</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum FieldType {

    STRING("string", "TEXT", Types.VARCHAR) {
        @Override
        Object coerce(Object raw, ZoneId zone) {
            if (raw instanceof Number) {
                return plainNumber((Number) raw).toPlainString();
            }
            if (raw instanceof LocalDateTime) {
                return formatDateTime((LocalDateTime) raw);
            }
            return String.valueOf(raw);
        }

        @Override
        void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
            ps.setString(index, (String) value);
        }
    },

    NUMBER("number", "NUMERIC", Types.NUMERIC) {
        @Override
        Object coerce(Object raw, ZoneId zone) {
            if (raw instanceof Number) {
                return plainNumber((Number) raw);
            }
            if (raw instanceof LocalDateTime) {
                throw new IllegalArgumentException("Date cell cannot be stored as a number");
            }
            return new BigDecimal(String.valueOf(raw));
        }

        @Override
        void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
            ps.setBigDecimal(index, (BigDecimal) value);
        }
    },

    TIMESTAMP("timestamp", "TIMESTAMP", Types.TIMESTAMP) {
        @Override
        Object coerce(Object raw, ZoneId zone) {
            LocalDateTime local;
            if (raw instanceof LocalDateTime) {
                local = ((LocalDateTime) raw).truncatedTo(ChronoUnit.MINUTES);
            } else if (raw instanceof Number) {
                double serial = ((Number) raw).doubleValue();
                if (!DateUtil.isValidExcelDate(serial)) {
                    throw new IllegalArgumentException("Invalid spreadsheet date serial: " + raw);
                }
                local = DateUtil.getLocalDateTime(serial, false, true)
                        .truncatedTo(ChronoUnit.MINUTES);
            } else {
                String text = String.valueOf(raw);
                if (text.length() > 10 && text.charAt(10) == 'T') {
                    text = text.substring(0, 10) + ' ' + text.substring(11);
                }
                local = LocalDateTime.parse(text, TEXT_TIMESTAMP);
            }
            return local.atZone(zone).toInstant();
        }

        @Override
        void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
            ps.setObject(index, LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
        }
    };

    // yyyy-MM-dd HH:mm, with optional seconds; a bare date means midnight
    private static final DateTimeFormatter TEXT_TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd").optionalStart().appendLiteral(' ')
            .appendPattern("HH:mm").optionalStart().appendPattern(":ss").optionalEnd()
            .optionalEnd().parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0).toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter DATE_ONLY =
            DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT);

    private static final DateTimeFormatter DATE_MINUTES =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm", Locale.ROOT);

    private static final DateTimeFormatter DATE_SECONDS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT);

    // Name used in the column configuration JSON
    private final String value;

    // SQL column type used for CREATE TABLE
    private final String sqlType;

    // java.sql.Types code used for NULL binding
    private final int jdbcType;

    FieldType(String value, String sqlType, int jdbcType) {
        this.value = value;
        this.sqlType = sqlType;
        this.jdbcType = jdbcType;
    }

    /**
     * Converts a non-null, non-sentinel raw value into this type.
     *
     * @param raw raw value ({@link String}, spreadsheet {@link Number} or spreadsheet
     *        {@link LocalDateTime})
     * @param zone zone in which local date/times are interpreted
     * @return typed value
     * @throws IllegalArgumentException if the value cannot be represented in this type
     * @throws java.time.DateTimeException if a date/time value is invalid
     */
    abstract Object coerce(Object raw, ZoneId zone);

    abstract void bindValue(PreparedStatement ps, int index, Object value) throws SQLException;

    /**
     * Binds a typed value (or SQL NULL) to a statement parameter.
     *
     * @param ps statement
     * @param index one-based parameter index
     * @param value value produced by {@link #coerce(Object, ZoneId)}, or {@code null}
     * @throws SQLException if binding fails
     */
    public void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, jdbcType);
        } else {
            bindValue(ps, index, value);
        }
    }

    /**
     * Resolves a type from its configuration name (case-insensitive).
     *
     * @param value configuration name; {@code null} means {@link #STRING}
     * @return field type
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static FieldType fromValue(String value) {
        if (value == null) {
            return STRING;
        }
        for (FieldType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown fieldType: " + value + " (expected one of "
                + Arrays.stream(values()).map(FieldType::getValue).collect(Collectors.joining(", "))
                + ")");
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    // Midnight prints as a bare date, zero seconds are omitted
    private static String formatDateTime(LocalDateTime dateTime) {
        if (dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            return dateTime.format(DATE_ONLY);
        }
        if (dateTime.getSecond() == 0) {
            return dateTime.format(DATE_MINUTES);
        }
        return dateTime.format(DATE_SECONDS);
    }

    private static BigDecimal plainNumber(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        BigDecimal decimal = BigDecimal.valueOf(number.doubleValue()).stripTrailingZeros();
        return decimal.scale() < 0 ? decimal.setScale(0) : decimal;
    }
}
