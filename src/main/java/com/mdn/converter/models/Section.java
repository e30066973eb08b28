package com.mdn.converter.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One delimited block of a document: the parsed open line plus its raw body.
 * The body is never interpreted here. The HEADER section may carry a second,
 * context part that was separated from the core fields by a close/reopen pair.
 */
public final class Section {

    private final String namespace;
    private final String kindToken;
    private final SectionKind kind;
    private final String format;
    private final Map<String, String> attributes;
    private final List<String> bodyLines;
    private final List<String> contextLines;
    private final int lineNumber;

    public Section(String namespace, String kindToken, SectionKind kind, String format, Map<String, String> attributes,
                   List<String> bodyLines, List<String> contextLines, int lineNumber) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.kindToken = Objects.requireNonNull(kindToken, "kindToken");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.format = format;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.bodyLines = Collections.unmodifiableList(new ArrayList<>(bodyLines));
        this.contextLines = Collections.unmodifiableList(new ArrayList<>(contextLines));
        this.lineNumber = lineNumber;
    }

    /**
     * Builds a section of a known kind with its default format token, for encoding.
     */
    public static Section of(String namespace, SectionKind kind, Map<String, String> attributes, String body) {
        return new Section(namespace, kind.name(), kind, kind.getDefaultFormat(), attributes,
                splitLines(body), Collections.emptyList(), 0);
    }

    public Section withContext(String context) {
        return new Section(namespace, kindToken, kind, format, attributes, bodyLines, splitLines(context), lineNumber);
    }

    public String getNamespace() {
        return namespace;
    }

    public String getKindToken() {
        return kindToken;
    }

    public SectionKind getKind() {
        return kind;
    }

    public String getFormat() {
        return format;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public List<String> getBodyLines() {
        return bodyLines;
    }

    public List<String> getContextLines() {
        return contextLines;
    }

    public boolean hasContext() {
        return !contextLines.isEmpty();
    }

    /**
     * 1-based line of the open delimiter in the parsed text, 0 for built sections.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getBody() {
        return String.join("\n", bodyLines);
    }

    public String getContextBody() {
        return String.join("\n", contextLines);
    }

    /**
     * The open delimiter line, e.g. "--- MDN:SHEET CSV name=Revenue".
     */
    public String openLine() {
        StringBuilder line = new StringBuilder("--- ").append(namespace).append(':').append(kindToken);
        if (format != null) {
            line.append(' ').append(format);
        }
        attributes.forEach((key, value) -> line.append(' ').append(key).append('=').append(value));
        return line.toString();
    }

    private static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> lines = new ArrayList<>(List.of(text.split("\n", -1)));
        // a trailing newline would otherwise become an empty body line
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Section)) {
            return false;
        }
        Section other = (Section) o;
        return namespace.equals(other.namespace) && kindToken.equals(other.kindToken)
                && Objects.equals(format, other.format) && attributes.equals(other.attributes)
                && bodyLines.equals(other.bodyLines) && contextLines.equals(other.contextLines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, kindToken, format, attributes, bodyLines, contextLines);
    }

    @Override
    public String toString() {
        return openLine() + " (" + bodyLines.size() + " lines)";
    }
}
