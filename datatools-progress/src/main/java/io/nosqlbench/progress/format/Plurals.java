/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.progress.format;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * English pluralization for item names. Only the last word of a multi-word name is
 * inflected ({@code record batch} becomes {@code record batches}), and a leading capital
 * on that word is preserved.
 *
 * <p>Pluralizing is comparatively expensive next to a counter increment, so callers compute
 * the plural once per item name and cache it.</p>
 */
public final class Plurals {

    private static final Map<String, String> IRREGULAR = Map.ofEntries(
        Map.entry("child", "children"),
        Map.entry("person", "people"),
        Map.entry("man", "men"),
        Map.entry("woman", "women"),
        Map.entry("mouse", "mice"),
        Map.entry("goose", "geese"),
        Map.entry("foot", "feet"),
        Map.entry("tooth", "teeth"),
        Map.entry("ox", "oxen"),
        Map.entry("index", "indices"),
        Map.entry("matrix", "matrices"),
        Map.entry("vertex", "vertices"),
        Map.entry("axis", "axes"),
        Map.entry("analysis", "analyses"),
        Map.entry("criterion", "criteria"),
        Map.entry("datum", "data"),
        Map.entry("leaf", "leaves"),
        Map.entry("knife", "knives"),
        Map.entry("life", "lives"),
        Map.entry("half", "halves"),
        Map.entry("shelf", "shelves"),
        Map.entry("potato", "potatoes"),
        Map.entry("tomato", "tomatoes"),
        Map.entry("hero", "heroes"),
        Map.entry("echo", "echoes")
    );

    private static final Set<String> UNCOUNTABLE = Set.of(
        "data", "metadata", "information", "equipment", "news", "series", "species",
        "sheep", "fish", "deer"
    );

    private Plurals() {
    }

    /**
     * Returns the plural form of a noun or noun phrase.
     *
     * @param noun the singular form
     * @return the plural form
     */
    public static String pluralize(String noun) {
        if (noun == null || noun.isBlank()) {
            return noun;
        }

        int split = noun.lastIndexOf(' ') + 1;
        String prefix = noun.substring(0, split);
        String word = noun.substring(split);
        String lower = word.toLowerCase(Locale.ROOT);

        if (UNCOUNTABLE.contains(lower)) {
            return noun;
        }
        String irregular = IRREGULAR.get(lower);
        if (irregular != null) {
            return prefix + matchCapital(word, irregular);
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
            || lower.endsWith("ch") || lower.endsWith("sh")) {
            return noun + "es";
        }
        if (lower.length() > 1 && lower.endsWith("y") && !isVowel(lower.charAt(lower.length() - 2))) {
            return noun.substring(0, noun.length() - 1) + "ies";
        }
        return noun + "s";
    }

    /**
     * Picks the singular or plural form for a count; only a count of exactly one is singular.
     *
     * @param singular the singular form
     * @param plural the plural form
     * @param count the number of items
     * @return the form agreeing with {@code count}
     */
    public static String forCount(String singular, String plural, long count) {
        return count == 1 ? singular : plural;
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }

    private static String matchCapital(String original, String replacement) {
        if (!original.isEmpty() && Character.isUpperCase(original.charAt(0))) {
            return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
        }
        return replacement;
    }
}
