package com.contact.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Custom fields of a contact.
 *
 * <p>Values for {@link CustomFieldKey recognized keys} are typed (string or boolean).
 * Anything else is kept untouched as a Jackson {@link JsonNode} in the residual map.
 * A field name appears in at most one of the two parts.</p>
 */
public final class CustomFields {

    private static final CustomFields EMPTY = new CustomFields(new EnumMap<>(CustomFieldKey.class), new TreeMap<>());

    private final Map<CustomFieldKey, Object> recognized;
    private final Map<String, JsonNode> residual;

    private CustomFields(Map<CustomFieldKey, Object> recognized, Map<String, JsonNode> residual) {
        this.recognized = Collections.unmodifiableMap(recognized);
        this.residual = Collections.unmodifiableMap(residual);
    }

    public static CustomFields empty() {
        return EMPTY;
    }

    public Optional<String> getString(CustomFieldKey key) {
        Object value = recognized.get(key);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public Optional<Boolean> getFlag(CustomFieldKey key) {
        Object value = recognized.get(key);
        return value instanceof Boolean b ? Optional.of(b) : Optional.empty();
    }

    /**
     * A copy of the residual value; changing it does not affect these fields.
     */
    public Optional<JsonNode> getResidual(String fieldName) {
        return Optional.ofNullable(residual.get(fieldName)).map(JsonNode::deepCopy);
    }

    /**
     * Copies of all residual values, keyed by field name.
     */
    public Map<String, JsonNode> residual() {
        Map<String, JsonNode> copy = new TreeMap<>();
        residual.forEach((name, value) -> copy.put(name, value.deepCopy()));
        return Collections.unmodifiableMap(copy);
    }

    public int size() {
        return recognized.size() + residual.size();
    }

    public boolean isEmpty() {
        return recognized.isEmpty() && residual.isEmpty();
    }

    /**
     * Shallow key-wise merge. Fields present on both sides keep this instance's value,
     * fields only present in {@code other} are copied in.
     */
    public CustomFields mergedWith(CustomFields other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Builder builder = builder(other);
        recognized.forEach(builder::putRecognized);
        residual.forEach(builder::put);
        return builder.build();
    }

    /**
     * Flat JSON object holding both recognized and residual fields.
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        recognized.forEach((key, value) -> {
            if (value instanceof Boolean b) {
                node.put(key.fieldName(), b);
            } else {
                node.put(key.fieldName(), (String) value);
            }
        });
        residual.forEach((name, value) -> node.set(name, value.deepCopy()));
        return node;
    }

    /**
     * Reads a flat JSON object. Null, missing or non-object input yields empty fields.
     */
    public static CustomFields fromJson(JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.put(field.getKey(), field.getValue());
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CustomFields that = (CustomFields) o;
        return recognized.equals(that.recognized) && residual.equals(that.residual);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recognized, residual);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CustomFields fields) {
        Builder builder = new Builder();
        builder.recognized.putAll(fields.recognized);
        builder.residual.putAll(fields.residual);
        return builder;
    }

    public static class Builder {
        private final Map<CustomFieldKey, Object> recognized = new EnumMap<>(CustomFieldKey.class);
        private final Map<String, JsonNode> residual = new TreeMap<>();

        public Builder put(CustomFieldKey key, String value) {
            if (key.valueType() != CustomFieldKey.ValueType.STRING) {
                throw new IllegalArgumentException(key.fieldName() + " holds a boolean value");
            }
            return putRecognized(key, value);
        }

        public Builder put(CustomFieldKey key, boolean value) {
            if (key.valueType() != CustomFieldKey.ValueType.BOOLEAN) {
                throw new IllegalArgumentException(key.fieldName() + " holds a string value");
            }
            return putRecognized(key, value);
        }

        /**
         * Adds a field by name. A recognized key takes the value only if it already has the
         * key's JSON type (a boolean flag also accepts "true" or "false" text); any other value
         * is kept unchanged in the residual map.
         */
        public Builder put(String fieldName, JsonNode value) {
            Objects.requireNonNull(fieldName, "fieldName is required");
            if (value == null || value.isNull() || value.isMissingNode()) {
                remove(fieldName);
                return this;
            }
            Optional<CustomFieldKey> key = CustomFieldKey.fromFieldName(fieldName);
            if (key.isPresent()) {
                Object coerced = coerce(key.get(), value);
                if (coerced != null) {
                    residual.remove(fieldName);
                    recognized.put(key.get(), coerced);
                    return this;
                }
                recognized.remove(key.get());
            }
            residual.put(fieldName, value.deepCopy());
            return this;
        }

        public Builder remove(String fieldName) {
            CustomFieldKey.fromFieldName(fieldName).ifPresent(recognized::remove);
            residual.remove(fieldName);
            return this;
        }

        private Builder putRecognized(CustomFieldKey key, Object value) {
            if (value == null) {
                recognized.remove(key);
            } else {
                residual.remove(key.fieldName());
                recognized.put(key, value);
            }
            return this;
        }

        private static Object coerce(CustomFieldKey key, JsonNode value) {
            if (key.valueType() == CustomFieldKey.ValueType.BOOLEAN) {
                if (value.isBoolean()) {
                    return value.booleanValue();
                }
                if (value.isTextual() && ("true".equalsIgnoreCase(value.textValue())
                        || "false".equalsIgnoreCase(value.textValue()))) {
                    return Boolean.parseBoolean(value.textValue());
                }
                return null;
            }
            return value.isTextual() ? value.textValue() : null;
        }

        public CustomFields build() {
            if (recognized.isEmpty() && residual.isEmpty()) {
                return EMPTY;
            }
            return new CustomFields(new EnumMap<>(recognized), new TreeMap<>(residual));
        }
    }
}
