package com.unitbench.markup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declarative description of one expected opening tag and its attribute constraints.
 *
 * <pre>
 *   // &lt;input name="..." id="my-input"&gt; with attributes in any order
 *   TagSpec.tag("input").present("name").equalTo("id", "my-input");
 *
 *   // id matching a pattern, quotes optional
 *   TagSpec.tag("input").matching("id", "FieldName\\d+");
 * </pre>
 *
 * Map-shaped specs ({@code {"input": {0: "name", "id": "my-input"}}}) are
 * normalised with {@link #fromMap}.
 */
public class TagSpec {

    /** {@code preg:/body/} marks a pattern wherever a literal would otherwise be expected. */
    static final Pattern PREG = Pattern.compile("^preg:/(.+)/$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public enum Kind {
        PRESENT,   // attribute present with any non-empty value
        EQUALS,    // attribute value equals a literal
        MATCHES,   // attribute value matches a pattern, quotes optional
        RAW        // a raw pattern matched against the attribute block
    }

    /** One attribute constraint. */
    public static final class Attribute {
        private final Kind   kind;
        private final String name;    // null for RAW
        private final String value;   // literal or pattern body; null for PRESENT

        private Attribute(Kind kind, String name, String value) {
            this.kind  = kind;
            this.name  = name;
            this.value = value;
        }

        public Kind   getKind()  { return kind; }
        public String getName()  { return name; }
        public String getValue() { return value; }
    }

    private final String          name;
    private final List<Attribute> attributes = new ArrayList<>();

    private TagSpec(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tag name is required");
        }
        this.name = name;
    }

    public static TagSpec tag(String name) {
        return new TagSpec(name);
    }

    // ── Fluent constraints ────────────────────────────────────────────────────

    public TagSpec present(String attribute) {
        attributes.add(new Attribute(Kind.PRESENT, Objects.requireNonNull(attribute), null));
        return this;
    }

    public TagSpec equalTo(String attribute, String value) {
        attributes.add(new Attribute(Kind.EQUALS, Objects.requireNonNull(attribute),
            value != null ? value : ""));
        return this;
    }

    public TagSpec matching(String attribute, String regex) {
        attributes.add(new Attribute(Kind.MATCHES, Objects.requireNonNull(attribute),
            Objects.requireNonNull(regex)));
        return this;
    }

    public TagSpec raw(String regex) {
        attributes.add(new Attribute(Kind.RAW, null, Objects.requireNonNull(regex)));
        return this;
    }

    public String          getName()       { return name; }
    public List<Attribute> getAttributes() { return List.copyOf(attributes); }

    // ── Normalisation of map-shaped specs ─────────────────────────────────────

    /**
     * Builds a TagSpec from the value side of a {@code {tagName: attributesSpec}} map.
     *
     * <ul>
     *   <li>{@code Boolean.TRUE} or {@code null}: no attribute constraints</li>
     *   <li>a {@code Collection}: every item is an attribute name (presence only),
     *       or a {@code preg:/…/} raw pattern</li>
     *   <li>a {@code Map}: numeric keys behave like collection items; string keys
     *       map to an exact value or a {@code preg:/…/} value pattern</li>
     * </ul>
     */
    public static TagSpec fromMap(String name, Object attributesSpec) {
        TagSpec spec = tag(name);
        if (attributesSpec == null || Boolean.TRUE.equals(attributesSpec)) {
            return spec;
        }
        if (attributesSpec instanceof Collection<?> items) {
            for (Object item : items) {
                spec.addPositional(String.valueOf(item));
            }
            return spec;
        }
        if (attributesSpec instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (e.getKey() instanceof Number) {
                    spec.addPositional(String.valueOf(e.getValue()));
                    continue;
                }
                String attribute = String.valueOf(e.getKey());
                String value = e.getValue() != null ? e.getValue().toString() : "";
                Matcher m = PREG.matcher(value);
                if (!value.isEmpty() && m.matches()) {
                    spec.matching(attribute, m.group(1));
                } else {
                    spec.equalTo(attribute, value);
                }
            }
            return spec;
        }
        throw new IllegalArgumentException("Unsupported attribute spec for tag '" + name + "': "
            + attributesSpec.getClass().getName());
    }

    private void addPositional(String value) {
        Matcher m = PREG.matcher(value);
        if (m.matches()) {
            raw(m.group(1));
        } else {
            present(value);
        }
    }

    @Override
    public String toString() {
        return "TagSpec{" + name + ", " + attributes.size() + " attribute constraint(s)}";
    }
}
