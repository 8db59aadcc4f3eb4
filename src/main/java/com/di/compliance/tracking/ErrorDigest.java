package com.di.compliance.tracking;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded summary of row failure reasons: the first {@code maxEntries} reasons joined by {@code "; "},
 * the remainder only counted, and the whole text capped at {@code maxLength} characters.
 */
public class ErrorDigest {

    private static final String SEPARATOR = "; ";
    private static final String ELLIPSIS = "...";

    private final int maxEntries;
    private final int maxLength;
    private final List<String> entries = new ArrayList<>();
    private int total;

    public ErrorDigest(int maxEntries, int maxLength) {
        if (maxEntries < 1 || maxLength < 16) {
            throw new IllegalArgumentException(
                    String.format("Invalid digest bounds maxEntries=%d maxLength=%d", maxEntries, maxLength));
        }
        this.maxEntries = maxEntries;
        this.maxLength = maxLength;
    }

    public void add(String reason) {
        total++;
        if (entries.size() < maxEntries) {
            entries.add(reason == null ? "unknown error" : reason);
        }
    }

    /** Puts a reason in front of the collected ones, e.g. the cause of a rollback. */
    public void addFirst(String reason) {
        total++;
        entries.add(0, reason == null ? "unknown error" : reason);
        if (entries.size() > maxEntries) {
            entries.remove(entries.size() - 1);
        }
    }

    public int getTotal() {
        return total;
    }

    public boolean isEmpty() {
        return total == 0;
    }

    /**
     * @return the digest text, or null when nothing was recorded
     */
    public String render() {
        if (total == 0) {
            return null;
        }
        String joined = String.join(SEPARATOR, entries);
        int omitted = total - entries.size();
        String suffix = omitted > 0 ? " (+" + omitted + " more)" : "";

        if (joined.length() + suffix.length() <= maxLength) {
            return joined + suffix;
        }
        int room = Math.max(0, maxLength - suffix.length() - ELLIPSIS.length());
        return joined.substring(0, Math.min(room, joined.length())) + ELLIPSIS + suffix;
    }

    @Override
    public String toString() {
        String text = render();
        return text == null ? "" : text;
    }
}
