package com.unitbench.markup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a declarative markup spec into {@link MatchRule}s and runs them against
 * an input string.
 *
 * <h3>Spec items</h3>
 * <ul>
 *   <li>{@code "/p"}: closing tag. <code>"*&#47;p"</code> first skips anything, non-greedily.
 *       The name is a regex fragment, so {@code "/h[1-6]"} closes any heading.</li>
 *   <li>{@code "preg:/My\\s+field/"}: a regex-literal rule.</li>
 *   <li>{@code "<p"}: an opening tag with no attribute constraints.</li>
 *   <li>any other string: literal text, metacharacters escaped.</li>
 *   <li>{@link TagSpec}, or {@code Map} of tag name to attribute spec: an open-tag
 *       rule, an attribute-block rule when there are constraints, and an end-of-tag
 *       rule accepting {@code >} or {@code />}.</li>
 * </ul>
 *
 * Items are numbered by their position in the spec list; every tag of a
 * multi-entry {@code Map} item shares that item's number.
 *
 * <h3>Attribute order</h3>
 * Input attribute order is not significant. A tag with N constraints compiles to
 * one rule with N! alternatives, one per ordering. The cost is O(N!) in both
 * compile time and worst-case match time, so N is capped by {@code maxAttributes}.
 *
 * <h3>Matching</h3>
 * Rules consume a prefix of the remaining input in declared order. Whitespace
 * before tags and newlines after them are absorbed. The first rule with no
 * matching alternative aborts the run.
 */
public class MarkupMatcher {

    private static final Logger log = LoggerFactory.getLogger(MarkupMatcher.class);

    public static final int DEFAULT_MAX_ATTRIBUTES = 8;

    private static final Pattern CLOSING = Pattern.compile("^\\*?/");
    private static final String  END_OF_TAG = "[\\s]*\\/?[\\s]*>[\\n\\r]*";

    private final int maxAttributes;

    public MarkupMatcher() {
        this(DEFAULT_MAX_ATTRIBUTES);
    }

    public MarkupMatcher(int maxAttributes) {
        if (maxAttributes < 1) {
            throw new IllegalArgumentException("maxAttributes must be at least 1, got " + maxAttributes);
        }
        this.maxAttributes = maxAttributes;
    }

    // ── Compile ───────────────────────────────────────────────────────────────

    /**
     * Compiles spec items into rules.
     *
     * @param spec ordered items: {@link TagSpec}, {@code String} or {@code Map<String, ?>}
     * @throws IllegalArgumentException for an unsupported item or too many attribute constraints
     */
    public List<MatchRule> compile(List<?> spec) {
        List<MatchRule> rules = new ArrayList<>();
        int item = 0;

        for (Object entry : spec) {
            item++;
            if (entry instanceof Map<?, ?> map) {
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    compileTag(TagSpec.fromMap(String.valueOf(e.getKey()), e.getValue()), item, rules);
                }
            } else if (entry instanceof TagSpec tag) {
                compileTag(tag, item, rules);
            } else if (entry instanceof String text) {
                compileString(text, item, rules);
            } else {
                throw new IllegalArgumentException("Unsupported markup spec item #" + item + ": "
                    + (entry == null ? "null" : entry.getClass().getName()));
            }
        }
        return rules;
    }

    private void compileString(String text, int item, List<MatchRule> rules) {
        if (text.startsWith("<")) {
            compileTag(TagSpec.tag(text.substring(1)), item, rules);
            return;
        }

        String trimmed = text.replaceAll("\\s+", "");
        Matcher closing = CLOSING.matcher(text);
        if (closing.find() && !"//".equals(trimmed)) {
            boolean anything = closing.group().equals("*/");
            String tag = text.substring(closing.end());
            String description = (anything ? "Anything, " : "") + "Close " + tag + " tag";
            String regex = (anything ? ".*?" : "") + "<[\\s]*\\/[\\s]*" + tag + "[\\s]*>[\\n\\r]*";
            rules.add(rule(description, List.of(regex), item));
            return;
        }

        Matcher preg = TagSpec.PREG.matcher(text);
        if (!text.isEmpty() && preg.matches()) {
            rules.add(rule("Regex matches \"" + preg.group(1) + "\"", List.of(preg.group(1)), item));
        } else {
            rules.add(rule("Text equals \"" + text + "\"", List.of(Pattern.quote(text)), item));
        }
    }

    private void compileTag(TagSpec tag, int item, List<MatchRule> rules) {
        String name = tag.getName();
        rules.add(rule("Open " + name + " tag", List.of("[\\s]*<" + Pattern.quote(name)), item));

        List<TagSpec.Attribute> attributes = tag.getAttributes();
        if (attributes.size() > maxAttributes) {
            throw new IllegalArgumentException(String.format(
                "Tag '%s' has %d attribute constraints; at most %d are allowed (%d! orderings)",
                name, attributes.size(), maxAttributes, attributes.size()));
        }

        if (!attributes.isEmpty()) {
            List<String> fragments = new ArrayList<>();
            List<String> explanations = new ArrayList<>();
            for (TagSpec.Attribute attribute : attributes) {
                fragments.add(fragment(attribute));
                explanations.add(explain(attribute));
            }

            List<String> alternatives = new ArrayList<>();
            for (List<String> ordering : Permutations.of(fragments)) {
                alternatives.add(String.join("", ordering));
            }
            log.debug("MarkupMatcher: tag '{}' compiled to {} attribute ordering(s)",
                name, Permutations.factorial(fragments.size()));
            rules.add(rule(String.join(", ", explanations), alternatives, item));
        }

        rules.add(rule("End " + name + " tag", List.of(END_OF_TAG), item));
    }

    private static String fragment(TagSpec.Attribute attribute) {
        String name = attribute.getName() != null ? Pattern.quote(attribute.getName()) : null;
        return switch (attribute.getKind()) {
            case PRESENT -> "[\\s]+" + name + "=\".+?\"";
            case EQUALS  -> "[\\s]+" + name + "=\"" + Pattern.quote(attribute.getValue()) + "\"";
            case MATCHES -> "[\\s]+" + name + "=\"?" + attribute.getValue() + "\"?";
            case RAW     -> attribute.getValue();
        };
    }

    private static String explain(TagSpec.Attribute attribute) {
        return switch (attribute.getKind()) {
            case PRESENT -> String.format("Attribute \"%s\" present", attribute.getName());
            case EQUALS  -> String.format("Attribute \"%s\" == \"%s\"", attribute.getName(), attribute.getValue());
            case MATCHES -> String.format("Attribute \"%s\" matches \"%s\"", attribute.getName(), attribute.getValue());
            case RAW     -> String.format("Regex \"%s\" matches", attribute.getValue());
        };
    }

    private static MatchRule rule(String description, List<String> expressions, int item) {
        List<Pattern> compiled = new ArrayList<>(expressions.size());
        for (String expression : expressions) {
            compiled.add(Pattern.compile(expression, Pattern.DOTALL));
        }
        return new MatchRule(description, compiled, item);
    }

    // ── Run ───────────────────────────────────────────────────────────────────

    /** Consumes {@code input} rule by rule; stops at the first rule that cannot match. */
    public MatchOutcome run(List<MatchRule> rules, String input) {
        String remaining = input != null ? input : "";

        for (int i = 0; i < rules.size(); i++) {
            MatchRule rule = rules.get(i);
            boolean matched = false;

            for (Pattern alternative : rule.getAlternatives()) {
                Matcher m = alternative.matcher(remaining);
                if (m.lookingAt()) {
                    remaining = remaining.substring(m.end());
                    matched = true;
                    break;
                }
            }

            if (!matched) {
                log.debug("MarkupMatcher: rule #{} failed ({}) at: {}", i, rule.getDescription(),
                    remaining.length() > 40 ? remaining.substring(0, 40) + "..." : remaining);
                return MatchOutcome.failure(rule, i, remaining);
            }
        }
        return MatchOutcome.success(remaining);
    }

    /** Compiles and runs in one call. */
    public MatchOutcome match(List<?> spec, String input) {
        return run(compile(spec), input);
    }
}
