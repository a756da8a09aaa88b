package com.example.clihelp.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Metadata of a command: what it is called, what it accepts and which
 * subcommands it has. Built once through {@link #builder(String)} and read-only
 * afterwards.
 */
public class Command {

    public enum Property {
        POSITIONAL_ARG_REQUIRED,
        SUBCOMMAND_REQUIRED
    }

    private final String name;
    private final String description;
    private final List<Arg> positionalArgs;
    private final List<Arg> options;
    private final List<Command> subcommands;
    private final Set<Property> properties;

    private Command(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.positionalArgs = Collections.unmodifiableList(new ArrayList<>(b.positionalArgs));
        this.options = Collections.unmodifiableList(new ArrayList<>(b.options));
        this.subcommands = Collections.unmodifiableList(new ArrayList<>(b.subcommands));
        this.properties = b.properties.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.properties));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<Arg> getPositionalArgs() { return positionalArgs; }
    public List<Arg> getOptions() { return options; }
    public List<Command> getSubcommands() { return subcommands; }

    public boolean hasProperty(Property property) {
        return properties.contains(property);
    }

    public int countPositionalArgs() { return positionalArgs.size(); }
    public int countOptions() { return options.size(); }
    public int countSubcommands() { return subcommands.size(); }

    /**
     * Returns the direct subcommand with the given name, or null if none.
     */
    public Command findSubcommand(String subcommandName) {
        if (subcommandName == null) return null;
        for (Command c : subcommands) {
            if (c.name.equals(subcommandName)) return c;
        }
        return null;
    }

    @Override
    public String toString() {
        return "Command{" +
            "name='" + name + '\'' +
            ", positionalArgs=" + positionalArgs.size() +
            ", options=" + options.size() +
            ", subcommands=" + subcommands.size() +
            ", properties=" + properties +
            '}';
    }

    public static class Builder {
        private final String name;
        private String description;
        private final List<Arg> positionalArgs = new ArrayList<>();
        private final List<Arg> options = new ArrayList<>();
        private final List<Command> subcommands = new ArrayList<>();
        private final Set<Property> properties = EnumSet.noneOf(Property.class);

        private Builder(String name) {
            Objects.requireNonNull(name, "Command name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Command name must not be blank");
            }
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder addArg(Arg arg) {
            Objects.requireNonNull(arg, "Arg must not be null");
            positionalArgs.add(arg);
            if (arg.isRequired()) properties.add(Property.POSITIONAL_ARG_REQUIRED);
            return this;
        }

        public Builder addOption(Arg option) {
            Objects.requireNonNull(option, "Option must not be null");
            if (option.getShortName() == null && option.getLongName() == null) {
                throw new IllegalArgumentException("Option '" + option.getName() + "' needs a short or long name");
            }
            for (Arg existing : options) {
                if (existing.getName().equals(option.getName())) {
                    throw new IllegalArgumentException("Duplicate option '" + option.getName() + "' in command '" + name + "'");
                }
            }
            options.add(option);
            return this;
        }

        public Builder addSubcommand(Command subcommand) {
            Objects.requireNonNull(subcommand, "Subcommand must not be null");
            for (Command existing : subcommands) {
                if (existing.getName().equals(subcommand.getName())) {
                    throw new IllegalArgumentException("Duplicate subcommand '" + subcommand.getName() + "' in command '" + name + "'");
                }
            }
            subcommands.add(subcommand);
            return this;
        }

        public Builder subcommandRequired(boolean required) {
            if (required) properties.add(Property.SUBCOMMAND_REQUIRED);
            else properties.remove(Property.SUBCOMMAND_REQUIRED);
            return this;
        }

        public Command build() {
            return new Command(this);
        }
    }
}
