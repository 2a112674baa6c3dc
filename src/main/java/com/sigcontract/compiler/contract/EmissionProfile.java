package com.sigcontract.compiler.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sigcontract.compiler.util.JsonSupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes the target language idioms contract code is synthesized for.
 *
 * Loaded from JSON such as
 * <pre>{@code
 * {"namingStyle": "snake", "assertionStyle": "exception", "optionalRepresentation": "nullable"}
 * }</pre>
 * Unknown options are rejected.
 */
public final class EmissionProfile {

    public enum NamingStyle {
        @JsonProperty("snake") SNAKE,
        @JsonProperty("camel") CAMEL;

        /**
         * Converts an identifier written in either style to this style.
         */
        public String apply(String identifier) {
            List<String> words = splitWords(identifier);
            if (words.isEmpty()) {
                return identifier;
            }
            StringBuilder out = new StringBuilder();
            for (int i = 0; i < words.size(); i++) {
                String word = words.get(i).toLowerCase(Locale.ROOT);
                if (this == SNAKE) {
                    if (i > 0) out.append('_');
                    out.append(word);
                } else {
                    out.append(i == 0 ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1));
                }
            }
            return out.toString();
        }

        private static List<String> splitWords(String identifier) {
            List<String> words = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            for (int i = 0; i < identifier.length(); i++) {
                char c = identifier.charAt(i);
                if (c == '_' || c == '\'') {
                    flush(words, current);
                } else if (Character.isUpperCase(c) && current.length() > 0
                        && !Character.isUpperCase(current.charAt(current.length() - 1))) {
                    flush(words, current);
                    current.append(c);
                } else {
                    current.append(c);
                }
            }
            flush(words, current);
            return words;
        }

        private static void flush(List<String> words, StringBuilder current) {
            if (current.length() > 0) {
                words.add(current.toString());
                current.setLength(0);
            }
        }
    }

    public enum AssertionStyle {
        @JsonProperty("exception") EXCEPTION,
        @JsonProperty("return-result") RETURN_RESULT
    }

    public enum OptionalRepresentation {
        @JsonProperty("nullable") NULLABLE,
        @JsonProperty("tagged") TAGGED
    }

    private final NamingStyle namingStyle;
    private final AssertionStyle assertionStyle;
    private final OptionalRepresentation optionalRepresentation;
    private final boolean exhaustivenessChecking;

    @JsonCreator
    public EmissionProfile(@JsonProperty("namingStyle") NamingStyle namingStyle,
                           @JsonProperty("assertionStyle") AssertionStyle assertionStyle,
                           @JsonProperty("optionalRepresentation") OptionalRepresentation optionalRepresentation,
                           @JsonProperty("exhaustivenessChecking") Boolean exhaustivenessChecking) {
        this.namingStyle = namingStyle != null ? namingStyle : NamingStyle.CAMEL;
        this.assertionStyle = assertionStyle != null ? assertionStyle : AssertionStyle.EXCEPTION;
        this.optionalRepresentation = optionalRepresentation != null ? optionalRepresentation : OptionalRepresentation.NULLABLE;
        this.exhaustivenessChecking = exhaustivenessChecking != null && exhaustivenessChecking;
    }

    /**
     * Camel case, exceptions, nullable optionals, no exhaustiveness checking.
     */
    public static EmissionProfile defaults() {
        return new EmissionProfile(null, null, null, null);
    }

    /**
     * Reads a profile from a JSON file.
     *
     * @throws IOException if the file cannot be read or holds unknown options
     */
    public static EmissionProfile load(Path path) throws IOException {
        return JsonSupport.mapper().readValue(Files.readString(path), EmissionProfile.class);
    }

    public EmissionProfile withNamingStyle(NamingStyle style) {
        return new EmissionProfile(style, assertionStyle, optionalRepresentation, exhaustivenessChecking);
    }

    public EmissionProfile withAssertionStyle(AssertionStyle style) {
        return new EmissionProfile(namingStyle, style, optionalRepresentation, exhaustivenessChecking);
    }

    public EmissionProfile withOptionalRepresentation(OptionalRepresentation representation) {
        return new EmissionProfile(namingStyle, assertionStyle, representation, exhaustivenessChecking);
    }

    public EmissionProfile withExhaustivenessChecking(boolean enabled) {
        return new EmissionProfile(namingStyle, assertionStyle, optionalRepresentation, enabled);
    }

    public NamingStyle getNamingStyle() {
        return namingStyle;
    }

    public AssertionStyle getAssertionStyle() {
        return assertionStyle;
    }

    public OptionalRepresentation getOptionalRepresentation() {
        return optionalRepresentation;
    }

    public boolean isExhaustivenessChecking() {
        return exhaustivenessChecking;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmissionProfile)) return false;
        EmissionProfile that = (EmissionProfile) o;
        return exhaustivenessChecking == that.exhaustivenessChecking && namingStyle == that.namingStyle
                && assertionStyle == that.assertionStyle && optionalRepresentation == that.optionalRepresentation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(namingStyle, assertionStyle, optionalRepresentation, exhaustivenessChecking);
    }

    @Override
    public String toString() {
        return "EmissionProfile{" + namingStyle + ", " + assertionStyle + ", " + optionalRepresentation
                + (exhaustivenessChecking ? ", exhaustive" : "") + "}";
    }
}
