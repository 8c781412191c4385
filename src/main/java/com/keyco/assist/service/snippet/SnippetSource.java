package com.keyco.assist.service.snippet;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Read-only view of the snippet container shared with the companion app.
 */
public interface SnippetSource {

    /**
     * All snippets in stored order.
     *
     * @throws com.keyco.assist.exception.SnippetSourceException if the container cannot be read
     */
    List<Snippet> all();

    /**
     * Case-insensitive containment search over title and text. Pinned snippets come first; otherwise
     * stored order is preserved. A blank query returns everything.
     */
    default List<Snippet> search(String query) {
        List<Snippet> snippets = all();
        String needle = query == null ? "" : query.strip().toLowerCase(Locale.ROOT);
        List<Snippet> matches = needle.isEmpty()
                ? snippets
                : snippets.stream()
                        .filter(s -> s.title().toLowerCase(Locale.ROOT).contains(needle)
                                || s.text().toLowerCase(Locale.ROOT).contains(needle))
                        .toList();
        // Stable partition keeps stored order within each group
        return Stream.concat(
                matches.stream().filter(Snippet::pinned),
                matches.stream().filter(s -> !s.pinned())).toList();
    }
}
