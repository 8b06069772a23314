package com.unitbench.util;

import java.util.Map;

/**
 * Replaces {@code {:key}} placeholders in a message template.
 *
 * <pre>
 *   MessageTemplates.insert("Skipped test {:class}::{:function}()",
 *       Map.of("class", "OrderTest", "function", "testRefund"));
 *   // "Skipped test OrderTest::testRefund()"
 * </pre>
 *
 * Placeholders without a value are left in place; null values render as "".
 */
public final class MessageTemplates {

    private MessageTemplates() {}

    public static String insert(String template, Map<String, ?> values) {
        if (template == null || values == null || values.isEmpty()) {
            return template;
        }
        String out = template;
        for (Map.Entry<String, ?> e : values.entrySet()) {
            Object value = e.getValue();
            out = out.replace("{:" + e.getKey() + "}", value != null ? value.toString() : "");
        }
        return out;
    }
}
