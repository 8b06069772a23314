package com.unitbench.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recognises patterns written as {@code /body/flags}. The delimiter may also be
 * {@code #}, {@code ~} or {@code @}.
 *
 * Supported flags:
 *   i  CASE_INSENSITIVE
 *   m  MULTILINE
 *   s  DOTALL
 *   x  COMMENTS
 *   u  UNICODE_CASE
 */
public class SlashPatternValidator implements PatternValidator {

    private static final Pattern DELIMITED = Pattern.compile("^([/#~@])(.+)\\1([imsxu]*)$", Pattern.DOTALL);

    @Override
    public boolean isPattern(String value) {
        if (value == null) return false;
        Matcher m = DELIMITED.matcher(value);
        if (!m.matches()) return false;
        try {
            Pattern.compile(m.group(2), flags(m.group(3)));
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    @Override
    public Pattern compile(String value) {
        Matcher m = value != null ? DELIMITED.matcher(value) : null;
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("Not a delimited pattern: " + value);
        }
        try {
            return Pattern.compile(m.group(2), flags(m.group(3)));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern " + value + ": " + e.getDescription(), e);
        }
    }

    private static int flags(String modifiers) {
        int flags = 0;
        for (char c : modifiers.toCharArray()) {
            switch (c) {
                case 'i' -> flags |= Pattern.CASE_INSENSITIVE;
                case 'm' -> flags |= Pattern.MULTILINE;
                case 's' -> flags |= Pattern.DOTALL;
                case 'x' -> flags |= Pattern.COMMENTS;
                case 'u' -> flags |= Pattern.UNICODE_CASE;
                default  -> { }
            }
        }
        return flags;
    }
}
