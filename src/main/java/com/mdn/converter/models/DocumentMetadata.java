package com.mdn.converter.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Content of the HEADER block.
 * Required keys: source, version, created, sheets. Any other core key lands in
 * extras, and the optional context part is kept as an opaque mapping.
 */
public class DocumentMetadata {

    public static final List<String> REQUIRED_KEYS = List.of("source", "version", "created", "sheets");

    private final String source;
    private final String version;
    private final String created;
    private final List<String> sheets;
    private final Map<String, Object> extras;
    private final Map<String, Object> context;

    @JsonCreator
    public DocumentMetadata(@JsonProperty("source") String source,
                            @JsonProperty("version") String version,
                            @JsonProperty("created") String created,
                            @JsonProperty("sheets") List<String> sheets,
                            @JsonProperty("extras") Map<String, Object> extras,
                            @JsonProperty("context") Map<String, Object> context) {
        this.source = source;
        this.version = version;
        this.created = created;
        this.sheets = Collections.unmodifiableList(new ArrayList<>(sheets == null ? List.of() : sheets));
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras == null ? Map.of() : extras));
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context == null ? Map.of() : context));
    }

    public String getSource() {
        return source;
    }

    public String getVersion() {
        return version;
    }

    public String getCreated() {
        return created;
    }

    public List<String> getSheets() {
        return sheets;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Core fields as they are written to the YAML block, required keys first.
     */
    public Map<String, Object> toCoreMap() {
        Map<String, Object> core = new LinkedHashMap<>();
        core.put("source", source);
        core.put("version", version);
        core.put("created", created);
        core.put("sheets", sheets);
        core.putAll(extras);
        return core;
    }
}
