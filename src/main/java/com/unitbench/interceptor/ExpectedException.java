package com.unitbench.interceptor;

import com.unitbench.util.PatternValidator;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One {@code expectException} declaration.
 *
 *   ANY      any message is accepted
 *   EXACT    the message must equal the declared string
 *   PATTERN  the declared pattern must be found in the message
 *
 * Immutable; use the static factories.
 */
public class ExpectedException {

    public enum Kind { ANY, EXACT, PATTERN }

    private static final ExpectedException ANY = new ExpectedException(Kind.ANY, null, null);

    private final Kind    kind;
    private final String  text;
    private final Pattern pattern;

    private ExpectedException(Kind kind, String text, Pattern pattern) {
        this.kind    = kind;
        this.text    = text;
        this.pattern = pattern;
    }

    public static ExpectedException any() {
        return ANY;
    }

    public static ExpectedException exact(String message) {
        return new ExpectedException(Kind.EXACT, Objects.requireNonNull(message), null);
    }

    public static ExpectedException pattern(Pattern pattern) {
        return new ExpectedException(Kind.PATTERN, pattern.pattern(), pattern);
    }

    /** A pattern declaration when the validator recognises {@code message} as one, else exact. */
    public static ExpectedException of(String message, PatternValidator validator) {
        if (validator.isPattern(message)) {
            return new ExpectedException(Kind.PATTERN, message, validator.compile(message));
        }
        return exact(message);
    }

    public boolean matches(String message) {
        return switch (kind) {
            case ANY     -> true;
            case EXACT   -> text.equals(message);
            case PATTERN -> message != null && pattern.matcher(message).find();
        };
    }

    public Kind    getKind()    { return kind; }
    public String  getText()    { return text; }

    @Override
    public String toString() {
        return kind == Kind.ANY ? "ExpectedException{ANY}"
            : String.format("ExpectedException{%s '%s'}", kind, text);
    }
}
