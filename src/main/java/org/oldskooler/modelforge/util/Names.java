package org.oldskooler.modelforge.util;

import java.util.Locale;

public final class Names {
    private Names() {}

    /** {@code placedAt} to {@code placed_at}; runs of capitals stay together ({@code userID} to {@code user_id}). */
    public static String toSnake(String camel) {
        StringBuilder b = new StringBuilder();
        for (int i = 0; i < camel.length(); i++) {
            char c = camel.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && !Character.isUpperCase(camel.charAt(i - 1)) && camel.charAt(i - 1) != '_') b.append('_');
                b.append(Character.toLowerCase(c));
            } else {
                b.append(c);
            }
        }
        return b.toString();
    }

    /**
     * Human readable title of a field or property name: {@code dynamicColumn} and
     * {@code dynamic_column} both become {@code Dynamic Column}.
     */
    public static String toTitle(String name) {
        String[] words = toSnake(name).split("_", -1);
        StringBuilder b = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) b.append(' ');
            String w = words[i];
            if (w.isEmpty()) continue;
            b.append(w.substring(0, 1).toUpperCase(Locale.ROOT)).append(w.substring(1).toLowerCase(Locale.ROOT));
        }
        return b.toString();
    }
}
