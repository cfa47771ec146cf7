package com.forenx.sentinel.normalization.parsers;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declarative description of a log line format, loadable from YAML.
 *
 * Regex formats use named capture groups: {@code ip}, {@code user}, {@code timestamp},
 * {@code request} (or {@code method}/{@code endpoint}/{@code protocol}), {@code status},
 * {@code bytes}, {@code referrer}, {@code useragent}, {@code host}, {@code requesttime}.
 */
public class FormatDefinition {

    public enum Type {
        REGEX,
        JSON
    }

    public enum Mode {
        /** The whole line must match. */
        STRICT,
        /** A matching prefix is enough; trailing fields are ignored. */
        LOOSE
    }

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private Type type = Type.REGEX;

    @JsonProperty("pattern")
    private String pattern;

    @JsonProperty("priority")
    private int priority;

    @JsonProperty("mode")
    private Mode mode = Mode.STRICT;

    public FormatDefinition() {
    }

    public FormatDefinition(String name, Type type, String pattern, int priority, Mode mode) {
        this.name = name;
        this.type = type;
        this.pattern = pattern;
        this.priority = priority;
        this.mode = mode;
    }

    public static FormatDefinition regex(String name, String pattern, int priority, Mode mode) {
        return new FormatDefinition(name, Type.REGEX, pattern, priority, mode);
    }

    public static FormatDefinition json(String name, int priority) {
        return new FormatDefinition(name, Type.JSON, null, priority, Mode.STRICT);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }
}
