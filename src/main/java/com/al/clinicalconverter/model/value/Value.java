package com.al.clinicalconverter.model.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Normalized intermediate value produced by both parsers.
 *
 * <p>
 * A value is exactly one of:
 * <ul>
 * <li>{@link Primitive} - a plain string (HL7 field/component, XML leaf text)</li>
 * <li>{@link Composite} - an ordered list of values joined by an HL7
 * delimiter (components split on {@code ^}, sub-components on {@code &})</li>
 * <li>{@link Mapping} - an ordered map of child tags, each holding one or
 * more values (XML element content)</li>
 * </ul>
 * Callers switch on {@link #getKind()} instead of probing types.
 */
public abstract class Value {

    public enum Kind {
        PRIMITIVE,
        COMPOSITE,
        MAPPING
    }

    private Value() {
    }

    public abstract Kind getKind();

    /**
     * Scalar text of this value. Composites are re-joined with their
     * delimiter; mappings carry no scalar text and yield an empty string.
     */
    public abstract String asText();

    public static Primitive primitive(String value) {
        return new Primitive(value);
    }

    public static Composite composite(List<Value> parts, char delimiter) {
        return new Composite(parts, delimiter);
    }

    public static Mapping mapping(Map<String, Repeated<Value>> entries) {
        return new Mapping(entries);
    }

    public static Mapping emptyMapping() {
        return new Mapping(Collections.emptyMap());
    }

    public boolean isPrimitive() {
        return getKind() == Kind.PRIMITIVE;
    }

    public boolean isComposite() {
        return getKind() == Kind.COMPOSITE;
    }

    public boolean isMapping() {
        return getKind() == Kind.MAPPING;
    }

    public Optional<Composite> asComposite() {
        return isComposite() ? Optional.of((Composite) this) : Optional.empty();
    }

    public Optional<Mapping> asMapping() {
        return isMapping() ? Optional.of((Mapping) this) : Optional.empty();
    }

    /**
     * Component {@code index} of this value. A primitive is its own component
     * 0; mappings have no components.
     */
    public Optional<Value> component(int index) {
        switch (getKind()) {
            case PRIMITIVE:
                return index == 0 ? Optional.of(this) : Optional.empty();
            case COMPOSITE:
                List<Value> parts = ((Composite) this).getParts();
                return index >= 0 && index < parts.size() ? Optional.of(parts.get(index)) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    /**
     * Text of component {@code index}, descending into the first
     * sub-component when the component is itself composite.
     */
    public String componentText(int index) {
        return component(index).map(Value::leadingText).orElse("");
    }

    /**
     * Text of the first leaf reachable through component 0 at every level.
     */
    public String leadingText() {
        switch (getKind()) {
            case PRIMITIVE:
                return ((Primitive) this).getValue();
            case COMPOSITE:
                List<Value> parts = ((Composite) this).getParts();
                return parts.isEmpty() ? "" : parts.get(0).leadingText();
            default:
                return "";
        }
    }

    public static final class Primitive extends Value {

        private final String value;

        private Primitive(String value) {
            this.value = value == null ? "" : value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public Kind getKind() {
            return Kind.PRIMITIVE;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Primitive && value.equals(((Primitive) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Primitive(" + value + ")";
        }
    }

    public static final class Composite extends Value {

        private final List<Value> parts;
        private final char delimiter;

        private Composite(List<Value> parts, char delimiter) {
            this.parts = List.copyOf(parts);
            this.delimiter = delimiter;
        }

        public List<Value> getParts() {
            return parts;
        }

        public char getDelimiter() {
            return delimiter;
        }

        public int size() {
            return parts.size();
        }

        @Override
        public Kind getKind() {
            return Kind.COMPOSITE;
        }

        @Override
        public String asText() {
            return parts.stream().map(Value::asText).collect(Collectors.joining(String.valueOf(delimiter)));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Composite)) {
                return false;
            }
            Composite other = (Composite) o;
            return delimiter == other.delimiter && parts.equals(other.parts);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parts, delimiter);
        }

        @Override
        public String toString() {
            return "Composite" + parts;
        }
    }

    public static final class Mapping extends Value {

        private final Map<String, Repeated<Value>> entries;

        private Mapping(Map<String, Repeated<Value>> entries) {
            this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public Map<String, Repeated<Value>> getEntries() {
            return entries;
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public Optional<Repeated<Value>> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        /**
         * First value stored under {@code key}.
         */
        public Optional<Value> first(String key) {
            return get(key).map(Repeated::first);
        }

        /**
         * Scalar text under {@code key}; empty when absent or not scalar.
         */
        public String text(String key) {
            return first(key).map(Value::asText).map(String::trim).orElse("");
        }

        @Override
        public Kind getKind() {
            return Kind.MAPPING;
        }

        @Override
        public String asText() {
            return "";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Mapping && entries.equals(((Mapping) o).entries);
        }

        @Override
        public int hashCode() {
            return entries.hashCode();
        }

        @Override
        public String toString() {
            return "Mapping" + entries;
        }
    }
}
