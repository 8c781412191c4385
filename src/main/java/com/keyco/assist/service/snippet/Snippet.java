package com.keyco.assist.service.snippet;

import java.util.Objects;

/**
 * A canned snippet from the shared container.
 *
 * @param id stable identifier assigned by the companion app
 * @param title short label
 * @param text body inserted into the host field
 * @param pinned pinned snippets rank before others
 */
public record Snippet(String id, String title, String text, boolean pinned) {

    public Snippet {
        Objects.requireNonNull(id, "id must not be null");
        title = title == null ? "" : title;
        text = text == null ? "" : text;
    }
}
