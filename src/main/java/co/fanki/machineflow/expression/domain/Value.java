package co.fanki.machineflow.expression.domain;

import co.fanki.machineflow.shared.ValueObject;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Closed tagged value used for node attributes, variable contexts and
 * expression results.
 *
 * <p>A value is one of {@link Kind#STRING}, {@link Kind#NUMBER},
 * {@link Kind#BOOLEAN}, {@link Kind#LIST}, {@link Kind#MAP} or
 * {@link Kind#NULL}. {@link Kind#UNDEFINED} only appears while evaluating
 * expressions, as the result of resolving a variable that does not
 * exist.</p>
 *
 * <p>Numbers are doubles. Lists and maps are immutable and keep their
 * insertion order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Value implements ValueObject {

    private static final long serialVersionUID = 1L;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern NUMERIC = Pattern.compile(
            "[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    /** The value variants. */
    public enum Kind {
        /** Text. */
        STRING,
        /** Double precision number. */
        NUMBER,
        /** True or false. */
        BOOLEAN,
        /** Ordered list of values. */
        LIST,
        /** Structured value, string keys in insertion order. */
        MAP,
        /** Explicit null. */
        NULL,
        /** Result of resolving an unknown variable. */
        UNDEFINED
    }

    /** The null value. */
    public static final Value NULL = new Value(Kind.NULL, null);

    /** The undefined sentinel. */
    public static final Value UNDEFINED = new Value(Kind.UNDEFINED, null);

    /** Boolean true. */
    public static final Value TRUE = new Value(Kind.BOOLEAN, Boolean.TRUE);

    /** Boolean false. */
    public static final Value FALSE = new Value(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;

    private final Object payload;

    private Value(final Kind theKind, final Object thePayload) {
        this.kind = theKind;
        this.payload = thePayload;
    }

    /**
     * Creates a string value.
     *
     * @param text the text, null yields {@link #NULL}
     * @return the value
     */
    public static Value of(final String text) {
        if (text == null) {
            return NULL;
        }
        return new Value(Kind.STRING, text);
    }

    /**
     * Creates a number value.
     *
     * @param number the number
     * @return the value
     */
    public static Value of(final double number) {
        return new Value(Kind.NUMBER, number);
    }

    /**
     * Creates a boolean value.
     *
     * @param flag the flag
     * @return {@link #TRUE} or {@link #FALSE}
     */
    public static Value of(final boolean flag) {
        return flag ? TRUE : FALSE;
    }

    /**
     * Creates a list value.
     *
     * @param items the items, copied
     * @return the value
     */
    public static Value list(final List<Value> items) {
        return new Value(Kind.LIST,
                Collections.unmodifiableList(new ArrayList<>(items)));
    }

    /**
     * Creates a structured value.
     *
     * @param entries the entries, copied in iteration order
     * @return the value
     */
    public static Value map(final Map<String, Value> entries) {
        return new Value(Kind.MAP,
                Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    /**
     * Converts a plain Java object into a value.
     *
     * <p>Accepts strings, numbers, booleans, lists, maps with string keys,
     * other values and null. Anything else is converted through its
     * {@code toString()}.</p>
     *
     * @param object the object to convert
     * @return the value
     */
    public static Value fromJava(final Object object) {
        if (object == null) {
            return NULL;
        }
        if (object instanceof Value) {
            return (Value) object;
        }
        if (object instanceof String) {
            return of((String) object);
        }
        if (object instanceof Number) {
            return of(((Number) object).doubleValue());
        }
        if (object instanceof Boolean) {
            return of(((Boolean) object).booleanValue());
        }
        if (object instanceof List<?>) {
            final List<Value> items = new ArrayList<>();
            for (final Object item : (List<?>) object) {
                items.add(fromJava(item));
            }
            return list(items);
        }
        if (object instanceof Map<?, ?>) {
            final Map<String, Value> entries = new LinkedHashMap<>();
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) object).entrySet()) {
                entries.put(String.valueOf(entry.getKey()),
                        fromJava(entry.getValue()));
            }
            return map(entries);
        }
        return of(object.toString());
    }

    /**
     * Converts a Jackson tree into a value.
     *
     * @param node the JSON node, null or missing yields {@link #NULL}
     * @return the value
     */
    public static Value fromJson(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isTextual()) {
            return of(node.asText());
        }
        if (node.isNumber()) {
            return of(node.asDouble());
        }
        if (node.isBoolean()) {
            return of(node.asBoolean());
        }
        if (node.isArray()) {
            final List<Value> items = new ArrayList<>();
            for (final JsonNode item : node) {
                items.add(fromJson(item));
            }
            return list(items);
        }
        if (node.isObject()) {
            final Map<String, Value> entries = new LinkedHashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromJson(field.getValue()));
            }
            return map(entries);
        }
        return of(node.asText());
    }

    /**
     * Returns the kind of this value.
     *
     * @return the kind
     */
    public Kind kind() {
        return kind;
    }

    public boolean isUndefined() {
        return kind == Kind.UNDEFINED;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isList() {
        return kind == Kind.LIST;
    }

    public boolean isMap() {
        return kind == Kind.MAP;
    }

    /**
     * Returns the text of a string value.
     *
     * @return the text
     * @throws IllegalStateException if this is not a string
     */
    public String asString() {
        requireKind(Kind.STRING);
        return (String) payload;
    }

    /**
     * Returns the number of a number value.
     *
     * @return the number
     * @throws IllegalStateException if this is not a number
     */
    public double asNumber() {
        requireKind(Kind.NUMBER);
        return (Double) payload;
    }

    /**
     * Returns the flag of a boolean value.
     *
     * @return the flag
     * @throws IllegalStateException if this is not a boolean
     */
    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) payload;
    }

    /**
     * Returns the items of a list value.
     *
     * @return the unmodifiable items
     * @throws IllegalStateException if this is not a list
     */
    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        requireKind(Kind.LIST);
        return (List<Value>) payload;
    }

    /**
     * Returns the entries of a structured value.
     *
     * @return the unmodifiable entries
     * @throws IllegalStateException if this is not a map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Value> asMap() {
        requireKind(Kind.MAP);
        return (Map<String, Value>) payload;
    }

    /**
     * Returns the member with the given key of a structured value.
     *
     * @param key the member key
     * @return the member, or {@link #UNDEFINED} when this is not a map or
     *         the key is absent
     */
    public Value member(final String key) {
        if (kind != Kind.MAP) {
            return UNDEFINED;
        }
        final Value member = asMap().get(key);
        return member == null ? UNDEFINED : member;
    }

    /**
     * Returns this value as a number if it is one, or if it is a string
     * that looks numeric.
     *
     * @return the number, or null when no numeric reading exists
     */
    public Double numericValue() {
        if (kind == Kind.NUMBER) {
            return (Double) payload;
        }
        if (kind == Kind.STRING) {
            final String text = ((String) payload).trim();
            if (NUMERIC.matcher(text).matches()) {
                return Double.parseDouble(text);
            }
        }
        return null;
    }

    /**
     * Returns the truthiness of this value.
     *
     * <p>Booleans are themselves, numbers are true when non-zero, strings
     * when non-empty, lists and maps always; null and undefined are
     * false.</p>
     *
     * @return the truthiness
     */
    public boolean truthy() {
        switch (kind) {
            case BOOLEAN:
                return (Boolean) payload;
            case NUMBER:
                final double number = (Double) payload;
                return number != 0 && !Double.isNaN(number);
            case STRING:
                return !((String) payload).isEmpty();
            case LIST:
            case MAP:
                return true;
            default:
                return false;
        }
    }

    /**
     * Renders this value as text.
     *
     * <p>Strings render raw, integral numbers without a fraction, booleans
     * and null literally, lists and maps as canonical JSON. Undefined
     * renders as {@code undefined}.</p>
     *
     * @return the text
     */
    public String render() {
        switch (kind) {
            case STRING:
                return (String) payload;
            case NUMBER:
                return renderNumber((Double) payload);
            case BOOLEAN:
                return payload.toString();
            case NULL:
                return "null";
            case UNDEFINED:
                return "undefined";
            default:
                try {
                    return MAPPER.writeValueAsString(toJava());
                } catch (final JsonProcessingException e) {
                    throw new IllegalStateException(
                            "Failed to render structured value", e);
                }
        }
    }

    /**
     * Converts this value into plain Java objects: String, Long or Double,
     * Boolean, List, Map or null.
     *
     * @return the Java representation
     */
    @JsonValue
    public Object toJava() {
        switch (kind) {
            case STRING:
            case BOOLEAN:
                return payload;
            case NUMBER:
                final double number = (Double) payload;
                if (isIntegral(number)) {
                    return (long) number;
                }
                return number;
            case LIST:
                final List<Object> items = new ArrayList<>();
                for (final Value item : asList()) {
                    items.add(item.toJava());
                }
                return items;
            case MAP:
                final Map<String, Object> entries = new LinkedHashMap<>();
                for (final Map.Entry<String, Value> entry : asMap().entrySet()) {
                    entries.put(entry.getKey(), entry.getValue().toJava());
                }
                return entries;
            default:
                return null;
        }
    }

    private static String renderNumber(final double number) {
        if (isIntegral(number)) {
            return Long.toString((long) number);
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return Double.toString(number);
        }
        return BigDecimal.valueOf(number).toPlainString();
    }

    private static boolean isIntegral(final double number) {
        return !Double.isInfinite(number) && number == Math.rint(number)
                && Math.abs(number) < 1e15;
    }

    private void requireKind(final Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException(
                    "Expected " + expected + " but was " + kind);
        }
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Value)) {
            return false;
        }
        final Value that = (Value) other;
        return kind == that.kind && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        if (kind == Kind.STRING) {
            return "'" + payload + "'";
        }
        return render();
    }

}
