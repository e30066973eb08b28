package com.mdn.converter.services;

import com.mdn.converter.config.MdnProperties;
import com.mdn.converter.exceptions.MalformedSectionException;
import com.mdn.converter.exceptions.OrderViolationException;
import com.mdn.converter.models.Section;
import com.mdn.converter.models.SectionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a document into its delimited sections and writes them back.
 * Every line is classified by its shape alone (open delimiter, close delimiter,
 * end marker or body) in a single forward scan; bodies are never interpreted.
 */
@Service
public class SectionGrammar {

    private static final Logger logger = LoggerFactory.getLogger(SectionGrammar.class);

    public static final String CLOSE_DELIMITER = "---";
    public static final String END_MARKER = "END DOCUMENT";

    // "--- MDN:SHEET CSV name=Revenue": namespace, kind, then the rest of the line
    private static final Pattern OPEN_LINE = Pattern.compile("^--- ([A-Z][A-Z0-9_]*):([A-Z][A-Z0-9_]*)(.*)$");
    private static final Pattern FORMAT_TOKEN = Pattern.compile("[A-Z][A-Z0-9_]*");
    private static final Pattern ATTRIBUTE_TOKEN = Pattern.compile("([A-Za-z][A-Za-z0-9_-]*)=(\\S*)");

    private final MdnProperties properties;

    public SectionGrammar(MdnProperties properties) {
        this.properties = properties;
    }

    /**
     * Parses the text into sections in document order and checks their order.
     *
     * @throws MalformedSectionException if a section is never closed, a delimiter is
     *                                   misspelled or the END DOCUMENT marker is missing
     * @throws OrderViolationException   if required sections are missing, repeated or out of order
     */
    public List<Section> parse(String text) {
        LineScanner scanner = new LineScanner();
        String[] lines = (text == null ? "" : text).split("\\r?\\n", -1);
        for (int i = 0; i < lines.length; i++) {
            scanner.accept(lines[i], i + 1);
        }
        List<Section> sections = scanner.finish(lines.length);
        checkOrder(sections);
        logger.debug("Parsed {} sections", sections.size());
        return sections;
    }

    /**
     * Writes sections followed by the END DOCUMENT marker; the inverse of {@link #parse}.
     */
    public String serialize(List<Section> sections) {
        StringBuilder out = new StringBuilder();
        for (Section section : sections) {
            out.append(section.openLine()).append('\n');
            appendLines(out, section.getBodyLines());
            out.append(CLOSE_DELIMITER).append('\n');
            if (section.hasContext()) {
                appendLines(out, section.getContextLines());
                out.append(CLOSE_DELIMITER).append('\n');
            }
        }
        out.append(END_MARKER).append('\n');
        return out.toString();
    }

    /**
     * True for a body line the scanner would take as a delimiter or the end marker.
     */
    public static boolean isDelimiterLine(String line) {
        String trimmed = line.stripTrailing();
        return trimmed.startsWith(CLOSE_DELIMITER) || trimmed.equals(END_MARKER);
    }

    /**
     * HEADER first, then one or more SHEETs, one FORMULAS, at most one FORMAT and
     * at most one AI_PROMPT, in that order. Unknown kinds may appear anywhere after HEADER.
     */
    void checkOrder(List<Section> sections) {
        if (sections.isEmpty() || sections.get(0).getKind() != SectionKind.HEADER) {
            int line = sections.isEmpty() ? 0 : sections.get(0).getLineNumber();
            throw new OrderViolationException("The document must start with the HEADER section", line);
        }
        Map<SectionKind, Integer> seen = new EnumMap<>(SectionKind.class);
        Section last = null;
        for (Section section : sections) {
            SectionKind kind = section.getKind();
            if (kind == SectionKind.UNKNOWN) {
                continue;
            }
            if (last != null && kind.ordinal() < last.getKind().ordinal()) {
                throw new OrderViolationException(kind + " section appears after the "
                        + last.getKind() + " section", section.getLineNumber());
            }
            if (seen.containsKey(kind) && !kind.isRepeatable()) {
                throw new OrderViolationException("Duplicate " + kind + " section", section.getLineNumber());
            }
            seen.merge(kind, 1, Integer::sum);
            last = section;
        }
        for (SectionKind kind : SectionKind.values()) {
            if (kind.isRequired() && !seen.containsKey(kind)) {
                throw new OrderViolationException("Missing required " + kind + " section", 0);
            }
        }
    }

    private static void appendLines(StringBuilder out, List<String> lines) {
        for (String line : lines) {
            out.append(line).append('\n');
        }
    }

    private enum LineType {OPEN, CLOSE, END, BODY}

    private enum State {OUTSIDE, IN_SECTION, AFTER_HEADER, IN_CONTEXT, AFTER_END}

    /**
     * Single-pass state machine over the lines of one document.
     */
    private final class LineScanner {
        private final List<Section> sections = new ArrayList<>();
        private State state = State.OUTSIDE;

        private Matcher open;
        private int openLineNumber;
        private List<String> body;
        private List<String> context;
        private Section pendingHeader;

        void accept(String rawLine, int lineNumber) {
            String line = rawLine.stripTrailing();
            LineType type = classify(line, lineNumber);

            switch (state) {
                case OUTSIDE:
                    if (type == LineType.OPEN) {
                        begin(lineNumber);
                    } else if (type == LineType.END) {
                        state = State.AFTER_END;
                    } else if (type == LineType.CLOSE) {
                        throw new MalformedSectionException("Close delimiter without an open section", lineNumber);
                    } else if (!line.isEmpty()) {
                        throw new MalformedSectionException("Text outside of any section", lineNumber);
                    }
                    break;
                case IN_SECTION:
                    if (type == LineType.BODY) {
                        body.add(rawLine);
                    } else if (type == LineType.CLOSE) {
                        close();
                    } else {
                        throw unclosed(lineNumber);
                    }
                    break;
                case AFTER_HEADER:
                    // the HEADER may be reopened once for its optional context part
                    if (type == LineType.BODY) {
                        if (!line.isEmpty()) {
                            context = new ArrayList<>();
                            context.add(rawLine);
                            state = State.IN_CONTEXT;
                        }
                    } else {
                        sections.add(pendingHeader);
                        pendingHeader = null;
                        state = State.OUTSIDE;
                        accept(rawLine, lineNumber);
                    }
                    break;
                case IN_CONTEXT:
                    if (type == LineType.BODY) {
                        context.add(rawLine);
                    } else if (type == LineType.CLOSE) {
                        sections.add(new Section(pendingHeader.getNamespace(), pendingHeader.getKindToken(),
                                pendingHeader.getKind(), pendingHeader.getFormat(), pendingHeader.getAttributes(),
                                pendingHeader.getBodyLines(), context, pendingHeader.getLineNumber()));
                        pendingHeader = null;
                        state = State.OUTSIDE;
                    } else {
                        throw new MalformedSectionException("Context part of the HEADER section opened after line "
                                + pendingHeader.getLineNumber() + " is not closed", lineNumber);
                    }
                    break;
                case AFTER_END:
                    if (!line.isEmpty()) {
                        throw new MalformedSectionException("Content after the " + END_MARKER + " marker", lineNumber);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unexpected scanner state " + state);
            }
        }

        List<Section> finish(int lineCount) {
            if (state == State.IN_SECTION || state == State.IN_CONTEXT) {
                throw new MalformedSectionException("Section opened at line " + openLineNumber
                        + " is not closed before the end of input", lineCount);
            }
            if (state == State.AFTER_HEADER) {
                sections.add(pendingHeader);
            }
            if (state != State.AFTER_END) {
                throw new MalformedSectionException("Missing " + END_MARKER + " marker", lineCount);
            }
            return sections;
        }

        private LineType classify(String line, int lineNumber) {
            if (line.equals(CLOSE_DELIMITER)) {
                return LineType.CLOSE;
            }
            if (line.equals(END_MARKER)) {
                return LineType.END;
            }
            if (line.startsWith(CLOSE_DELIMITER)) {
                Matcher matcher = OPEN_LINE.matcher(line);
                if (!matcher.matches()) {
                    throw new MalformedSectionException("Misspelled section delimiter: " + line, lineNumber);
                }
                open = matcher;
                return LineType.OPEN;
            }
            return LineType.BODY;
        }

        private void begin(int lineNumber) {
            openLineNumber = lineNumber;
            body = new ArrayList<>();
            state = State.IN_SECTION;
        }

        private void close() {
            Section section = buildSection(open, body, openLineNumber);
            if (section.getKind() == SectionKind.HEADER) {
                pendingHeader = section;
                state = State.AFTER_HEADER;
            } else {
                sections.add(section);
                state = State.OUTSIDE;
            }
        }

        private MalformedSectionException unclosed(int lineNumber) {
            return new MalformedSectionException("Section opened at line " + openLineNumber
                    + " is not closed before line " + lineNumber, lineNumber);
        }
    }

    private Section buildSection(Matcher open, List<String> body, int lineNumber) {
        String namespace = open.group(1);
        String kindToken = open.group(2);
        SectionKind kind = namespace.equals(properties.getNamespace())
                ? SectionKind.fromToken(kindToken) : SectionKind.UNKNOWN;

        String format = null;
        Map<String, String> attributes = new LinkedHashMap<>();
        String rest = open.group(3);
        if (!rest.isEmpty() && !rest.startsWith(" ")) {
            throw new MalformedSectionException("Misspelled section kind: " + namespace + ":" + kindToken + rest, lineNumber);
        }
        for (String token : rest.trim().isEmpty() ? new String[0] : rest.trim().split("\\s+")) {
            Matcher attribute = ATTRIBUTE_TOKEN.matcher(token);
            if (attribute.matches()) {
                attributes.put(attribute.group(1), attribute.group(2));
            } else if (format == null && attributes.isEmpty() && FORMAT_TOKEN.matcher(token).matches()) {
                format = token;
            } else {
                throw new MalformedSectionException("Unexpected token '" + token + "' in section delimiter", lineNumber);
            }
        }

        if (kind != SectionKind.UNKNOWN && !Objects.equals(format, kind.getDefaultFormat())) {
            throw new MalformedSectionException(kind + " section must be written as "
                    + (kind.getDefaultFormat() == null ? "no format" : "format " + kind.getDefaultFormat())
                    + ", found " + format, lineNumber);
        }
        if (kind == SectionKind.SHEET && (attributes.get("name") == null || attributes.get("name").isEmpty())) {
            throw new MalformedSectionException("SHEET section is missing its name= attribute", lineNumber);
        }
        return new Section(namespace, kindToken, kind, format, attributes, body, Collections.emptyList(), lineNumber);
    }
}
