package com.visaeligibility.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed scalar fact or literal value. Numbers are held as {@link BigDecimal},
 * dates as {@link LocalDate}.
 */
public record FactValue(FactType type, Object value) {

    public FactValue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    public static FactValue of(Object raw) {
        if (raw instanceof FactValue factValue) {
            return factValue;
        }
        if (raw instanceof BigDecimal decimal) {
            return new FactValue(FactType.NUMBER, decimal);
        }
        if (raw instanceof Number number) {
            return new FactValue(FactType.NUMBER, new BigDecimal(number.toString()));
        }
        if (raw instanceof Boolean bool) {
            return new FactValue(FactType.BOOLEAN, bool);
        }
        if (raw instanceof LocalDate date) {
            return new FactValue(FactType.DATE, date);
        }
        if (raw instanceof String text) {
            return new FactValue(FactType.STRING, text);
        }
        throw new IllegalArgumentException("Unsupported fact value: " + raw);
    }

    public static FactValue number(String text) {
        return new FactValue(FactType.NUMBER, new BigDecimal(text));
    }

    public static FactValue date(String isoDate) {
        return new FactValue(FactType.DATE, LocalDate.parse(isoDate));
    }

    public Optional<BigDecimal> asNumber() {
        if (type == FactType.NUMBER) {
            return Optional.of((BigDecimal) value);
        }
        if (type == FactType.STRING) {
            try {
                return Optional.of(new BigDecimal(((String) value).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<LocalDate> asDate() {
        if (type == FactType.DATE) {
            return Optional.of((LocalDate) value);
        }
        if (type == FactType.STRING) {
            try {
                return Optional.of(LocalDate.parse(((String) value).trim()));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Boolean> asBoolean() {
        if (type == FactType.BOOLEAN) {
            return Optional.of((Boolean) value);
        }
        if (type == FactType.STRING) {
            String text = ((String) value).trim().toLowerCase(Locale.ROOT);
            if (text.equals("true") || text.equals("false")) {
                return Optional.of(Boolean.parseBoolean(text));
            }
        }
        return Optional.empty();
    }

    @JsonValue
    public String asText() {
        if (type == FactType.NUMBER) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return asText();
    }
}
