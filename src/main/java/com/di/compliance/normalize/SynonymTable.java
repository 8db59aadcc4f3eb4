package com.di.compliance.normalize;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Case- and punctuation-insensitive lookup from free-text labels to one enumeration family.
 *
 * <pre>{@code
 * SynonymTable<NcrStatus> statuses = SynonymTable.builder("NCR status", NcrStatus.class)
 *         .map(NcrStatus.OPEN, "OPEN", "OPENED", "NEW")
 *         .build();
 * }</pre>
 */
public final class SynonymTable<E extends Enum<E>> {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-/]+");
    private static final Pattern NOISE = Pattern.compile("[^A-Z0-9_]");

    private final String family;
    private final Map<String, E> byKey;

    private SynonymTable(String family, Map<String, E> byKey) {
        this.family = family;
        this.byKey = Collections.unmodifiableMap(byKey);
    }

    public static <E extends Enum<E>> Builder<E> builder(String family, Class<E> type) {
        return new Builder<>(family, type);
    }

    public String getFamily() {
        return family;
    }

    /**
     * Maps a raw label to its canonical constant.
     *
     * @return the constant, or null when {@code raw} is blank
     * @throws NormalizationException when the label is not a known synonym
     */
    public E map(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        E value = byKey.get(key(raw));
        if (value == null) {
            throw NormalizationException.unknownEnumeration(family, raw.trim());
        }
        return value;
    }

    static String key(String raw) {
        String upper = SEPARATORS.matcher(raw.trim().toUpperCase(Locale.ROOT)).replaceAll("_");
        String cleaned = NOISE.matcher(upper).replaceAll("");
        int start = 0;
        int end = cleaned.length();
        while (start < end && cleaned.charAt(start) == '_') start++;
        while (end > start && cleaned.charAt(end - 1) == '_') end--;
        return cleaned.substring(start, end);
    }

    public static final class Builder<E extends Enum<E>> {
        private final String family;
        private final Class<E> type;
        private final Map<String, E> byKey = new HashMap<>();

        private Builder(String family, Class<E> type) {
            this.family = family;
            this.type = type;
        }

        public Builder<E> map(E canonical, String... synonyms) {
            byKey.put(key(canonical.name()), canonical);
            for (String synonym : synonyms) {
                E previous = byKey.put(key(synonym), canonical);
                if (previous != null && previous != canonical) {
                    throw new IllegalStateException(String.format(
                            "Synonym '%s' maps to both %s and %s in %s", synonym, previous, canonical, type.getSimpleName()));
                }
            }
            return this;
        }

        public SynonymTable<E> build() {
            return new SynonymTable<>(family, byKey);
        }
    }
}
