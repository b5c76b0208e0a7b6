package com.example.kvdriver.driver;

import java.util.Locale;
import java.util.Set;

/**
 * Maps KV table names to the names of the underlying collections, tables or key spaces.
 */
public final class TableNaming {

    private static final Set<String> UNCOUNTABLE = Set.of(
            "advice", "data", "deer", "equipment", "fish", "information", "jeans", "json",
            "metadata", "money", "news", "police", "rice", "series", "sheep", "species");

    private final boolean pluralize;

    private TableNaming(boolean pluralize) {
        this.pluralize = pluralize;
    }

    public static TableNaming verbatim() {
        return new TableNaming(false);
    }

    public static TableNaming pluralized() {
        return new TableNaming(true);
    }

    public static TableNaming of(boolean pluralize) {
        return pluralize ? pluralized() : verbatim();
    }

    public boolean isPluralized() {
        return pluralize;
    }

    public String collectionName(String table) {
        requireTableName(table);
        return pluralize ? plural(table.toLowerCase(Locale.ROOT)) : table;
    }

    public static void requireTableName(String table) {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Table name must not be blank");
        }
    }

    static String plural(String name) {
        if (UNCOUNTABLE.contains(name) || name.endsWith("s")) {
            return name;
        }
        if (name.endsWith("x") || name.endsWith("z") || name.endsWith("ch") || name.endsWith("sh")) {
            return name + "es";
        }
        if (name.length() > 1 && name.endsWith("y") && !isVowel(name.charAt(name.length() - 2))) {
            return name.substring(0, name.length() - 1) + "ies";
        }
        return name + "s";
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
