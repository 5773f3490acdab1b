package com.rodoc.ocr.service.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Regex extraction rule of one template field. Patterns are tried in order and the first capture group
 * of the first match is the candidate value.
 *
 * @param name       field name in the structured data
 * @param patterns   ordered patterns, each with one capture group
 * @param validator  check applied to the candidate, {@code null} to store it as is
 * @param required   whether the field is expected on every document of the type
 * @param personName whether name normalization applies to the value
 */
public record ExtractionField(
        String name,
        List<Pattern> patterns,
        FieldValidator validator,
        boolean required,
        boolean personName) {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE;

    public ExtractionField {
        Objects.requireNonNull(name, "name");
        patterns = List.copyOf(patterns);
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("Field " + name + " declares no pattern");
        }
    }

    static Builder field(String name) {
        return new Builder(name);
    }

    static final class Builder {

        private final String name;
        private final List<Pattern> patterns = new ArrayList<>();
        private FieldValidator validator;
        private boolean required;
        private boolean personName;

        private Builder(String name) {
            this.name = name;
        }

        Builder pattern(String regex) {
            patterns.add(Pattern.compile(regex, FLAGS));
            return this;
        }

        Builder validator(FieldValidator value) {
            this.validator = value;
            return this;
        }

        Builder required() {
            this.required = true;
            return this;
        }

        Builder personName() {
            this.personName = true;
            return this;
        }

        ExtractionField build() {
            return new ExtractionField(name, patterns, validator, required, personName);
        }
    }
}
