package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.expression.domain.Value;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;
import java.util.Optional;

/**
 * Parses raw attribute text into values according to the declared type.
 *
 * <p>Typed attributes: {@code number}, {@code boolean}, {@code json} and
 * {@code string}. Untyped text is read as JSON when it parses, otherwise
 * it is taken as a string with surrounding quotes removed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AttributeValues {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private AttributeValues() {
    }

    /**
     * Parses a raw attribute value.
     *
     * @param type the declared type, may be null
     * @param raw the raw text, may be null
     * @return the value, {@link Value#NULL} for null text
     */
    public static Value parse(final String type, final String raw) {
        if (raw == null) {
            return Value.NULL;
        }
        final String declared = type == null
                ? "" : type.trim().toLowerCase(Locale.ROOT);
        switch (declared) {
            case "number":
                final Double number = Value.of(stripQuotes(raw)).numericValue();
                return number == null ? Value.of(stripQuotes(raw))
                        : Value.of(number);
            case "boolean":
                return Value.of(Boolean.parseBoolean(stripQuotes(raw).trim()));
            case "string":
                return Value.of(stripQuotes(raw));
            case "json":
                return readJson(raw).orElse(Value.of(raw));
            default:
                return readJson(raw).orElse(Value.of(stripQuotes(raw)));
        }
    }

    /**
     * Removes one pair of surrounding single or double quotes.
     *
     * @param text the text
     * @return the text without its quotes
     */
    public static String stripQuotes(final String text) {
        final String trimmed = text.trim();
        if (trimmed.length() >= 2) {
            final char first = trimmed.charAt(0);
            final char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    private static Optional<Value> readJson(final String raw) {
        if (raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Value.fromJson(MAPPER.readTree(raw)));
        } catch (final JsonProcessingException e) {
            return Optional.empty();
        }
    }

}
