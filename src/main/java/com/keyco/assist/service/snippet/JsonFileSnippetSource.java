package com.keyco.assist.service.snippet;

import com.keyco.assist.exception.SnippetSourceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads snippets from a JSON array ({@code [{id,title,text,pinned}]}) written by the companion app.
 *
 * <p>The container is re-read whenever its modification time changes, since the companion app may
 * edit it while this process runs. Entries without an id are skipped.
 */
public class JsonFileSnippetSource implements SnippetSource {

    private static final Logger LOG = LogManager.getLogger(JsonFileSnippetSource.class);

    private final Resource resource;
    private final Object monitor = new Object();
    private List<Snippet> cached = List.of();
    private long cachedModified = Long.MIN_VALUE;

    public JsonFileSnippetSource(Resource resource) {
        this.resource = Objects.requireNonNull(resource, "resource");
    }

    @Override
    public List<Snippet> all() {
        synchronized (monitor) {
            if (!resource.exists()) {
                LOG.debug("Snippet container {} does not exist; treating as empty", resource.getDescription());
                return List.of();
            }
            long modified = lastModified();
            if (modified != cachedModified || modified == 0L) {
                cached = load();
                cachedModified = modified;
            }
            return cached;
        }
    }

    private long lastModified() {
        try {
            return resource.lastModified();
        } catch (IOException e) {
            // Classpath resources inside jars have no timestamp; reload every time
            return 0L;
        }
    }

    private List<Snippet> load() {
        try (InputStream in = resource.getInputStream()) {
            JSONArray array = new JSONArray(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            List<Snippet> snippets = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                JSONObject item = array.optJSONObject(i);
                if (item == null || item.optString("id", "").isBlank()) {
                    LOG.warn("Skipping malformed snippet at index {}", i);
                    continue;
                }
                snippets.add(new Snippet(
                        item.getString("id"),
                        item.optString("title", ""),
                        item.optString("text", ""),
                        item.optBoolean("pinned", false)));
            }
            LOG.info("Loaded {} snippets from {}", snippets.size(), resource.getDescription());
            return List.copyOf(snippets);
        } catch (IOException | JSONException e) {
            throw new SnippetSourceException(resource.getDescription(), e);
        }
    }
}
