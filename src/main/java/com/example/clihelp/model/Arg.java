package com.example.clihelp.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A positional argument or an option of a {@link Command}.
 * <p>
 * Instances are immutable. Use the static factories for the common shapes and
 * {@link #builder(String)} for everything else.
 */
public class Arg {

    public enum Property {
        TAKES_VALUE,
        TAKES_MULTIPLE_VALUES,
        REQUIRED
    }

    private final String name;
    private final Character shortName;
    private final String longName;
    private final String description;
    private final String valuePlaceholder;
    private final List<String> validValues;
    private final Set<Property> properties;

    private Arg(Builder b) {
        this.name = b.name;
        this.shortName = b.shortName;
        this.longName = b.longName;
        this.description = b.description;
        this.valuePlaceholder = b.valuePlaceholder;
        this.validValues = b.validValues == null ? null : Collections.unmodifiableList(List.copyOf(b.validValues));
        this.properties = b.properties.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.properties));
    }

    /** A positional argument. {@code multiple} lets it accept more than one value. */
    public static Arg positional(String name, String description, boolean multiple) {
        Builder b = builder(name).description(description).takesValue();
        if (multiple) b.takesMultipleValues();
        return b.build();
    }

    /** A flag such as {@code -v, --verbose}; long name is the arg's name. */
    public static Arg booleanOption(String name, Character shortName, String description) {
        return builder(name).shortName(shortName).longName(name).description(description).build();
    }

    public static Arg singleValueOption(String name, Character shortName, String description) {
        return builder(name).shortName(shortName).longName(name).description(description).takesValue().build();
    }

    public static Arg multiValuesOption(String name, Character shortName, String description) {
        return builder(name).shortName(shortName).longName(name).description(description)
                .takesValue().takesMultipleValues().build();
    }

    public static Arg singleValueOptionWithValidValues(String name, Character shortName, String description, List<String> values) {
        return builder(name).shortName(shortName).longName(name).description(description)
                .validValues(values).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() { return name; }
    public Character getShortName() { return shortName; }
    public String getLongName() { return longName; }
    public String getDescription() { return description; }
    public String getValuePlaceholder() { return valuePlaceholder; }
    public List<String> getValidValues() { return validValues; }

    public boolean hasProperty(Property property) {
        return properties.contains(property);
    }

    public boolean isRequired() {
        return hasProperty(Property.REQUIRED);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Arg arg = (Arg) o;
        return name.equals(arg.name)
                && Objects.equals(shortName, arg.shortName)
                && Objects.equals(longName, arg.longName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, shortName, longName);
    }

    @Override
    public String toString() {
        return "Arg{" +
            "name='" + name + '\'' +
            ", shortName=" + shortName +
            ", longName='" + longName + '\'' +
            ", properties=" + properties +
            '}';
    }

    public static class Builder {
        private final String name;
        private Character shortName;
        private String longName;
        private String description;
        private String valuePlaceholder;
        private List<String> validValues;
        private final Set<Property> properties = EnumSet.noneOf(Property.class);

        private Builder(String name) {
            Objects.requireNonNull(name, "Arg name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Arg name must not be blank");
            }
            this.name = name;
        }

        public Builder shortName(Character shortName) {
            if (shortName != null && Character.isWhitespace(shortName)) {
                throw new IllegalArgumentException("Short name of '" + name + "' must not be whitespace");
            }
            this.shortName = shortName;
            return this;
        }

        public Builder longName(String longName) {
            if (longName != null && longName.isBlank()) {
                throw new IllegalArgumentException("Long name of '" + name + "' must not be blank");
            }
            this.longName = longName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Name shown in {@code --opt=<PLACEHOLDER>}; implies the arg takes a value. */
        public Builder valuePlaceholder(String valuePlaceholder) {
            this.valuePlaceholder = valuePlaceholder;
            if (valuePlaceholder != null) properties.add(Property.TAKES_VALUE);
            return this;
        }

        /** Restricts the accepted values; implies the arg takes a value. */
        public Builder validValues(List<String> validValues) {
            if (validValues != null) {
                if (validValues.isEmpty()) {
                    throw new IllegalArgumentException("Valid values of '" + name + "' must not be empty");
                }
                properties.add(Property.TAKES_VALUE);
            }
            this.validValues = validValues;
            return this;
        }

        public Builder takesValue() {
            properties.add(Property.TAKES_VALUE);
            return this;
        }

        public Builder takesMultipleValues() {
            properties.add(Property.TAKES_VALUE);
            properties.add(Property.TAKES_MULTIPLE_VALUES);
            return this;
        }

        public Builder required() {
            properties.add(Property.REQUIRED);
            return this;
        }

        public Arg build() {
            return new Arg(this);
        }
    }
}
