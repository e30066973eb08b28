package com.mdn.converter.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.mdn.converter.exceptions.MalformedSectionException;
import com.mdn.converter.models.Section;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Reads and writes the inner syntax of section bodies with Jackson:
 * YAML for the HEADER, CSV for SHEETs and JSON for FORMULAS and FORMAT.
 * Structured blocks are read with the YAML parser, which also accepts JSON.
 */
@Service
public class BlockCodec {

    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9][0-9]*)(\\.[0-9]+)?");
    private static final TypeReference<LinkedHashMap<String, Object>> MAPPING = new TypeReference<>() {
    };

    private final YAMLMapper yamlMapper;
    private final CsvMapper csvMapper;
    private final ObjectMapper jsonMapper;

    public BlockCodec() {
        this.yamlMapper = YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .build();
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
        this.jsonMapper = new ObjectMapper();
    }

    /**
     * Parses a YAML (or JSON) mapping body; an empty body is an empty mapping.
     *
     * @throws MalformedSectionException if the body is not a mapping
     */
    public Map<String, Object> readMapping(Section section, String body) {
        if (body == null || body.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> mapping = yamlMapper.readValue(body, MAPPING);
            return mapping == null ? new LinkedHashMap<>() : mapping;
        } catch (JsonProcessingException e) {
            throw new MalformedSectionException("Invalid " + section.getKindToken() + " block: "
                    + e.getOriginalMessage(), section.getLineNumber());
        }
    }

    /**
     * Parses a CSV body into raw rows of strings.
     */
    public List<String[]> readRows(Section section) {
        if (section.getBody().isBlank()) {
            return new ArrayList<>();
        }
        try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(section.getBody())) {
            return rows.readAll();
        } catch (IOException e) {
            throw new MalformedSectionException("Invalid CSV in sheet '" + section.getAttribute("name") + "': "
                    + e.getMessage(), section.getLineNumber());
        }
    }

    /**
     * CSV text to cell value: "" is blank, plain decimals are numbers, anything else stays text.
     */
    public Object parseScalar(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        if (NUMBER.matcher(text).matches()) {
            return new BigDecimal(text);
        }
        return text;
    }

    public String writeYaml(Map<String, Object> mapping) {
        try {
            return stripTrailingNewline(yamlMapper.writeValueAsString(mapping));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not write YAML block", e);
        }
    }

    public String writeJson(Map<String, ?> mapping) {
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(mapping);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not write JSON block", e);
        }
    }

    /**
     * Writes the header row and every data row, one CSV record per row.
     * A record that would be an empty line is written as "" so it is not skipped on reading.
     */
    public String writeRows(List<String> headers, List<List<Object>> rows) {
        if (headers.isEmpty()) {
            return "";
        }
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(false);
        for (int i = 0; i < headers.size(); i++) {
            schema.addColumn("c" + i);
        }
        ObjectWriter writer = csvMapper.writer(schema.build());

        List<String> lines = new ArrayList<>();
        lines.add(writeRecord(writer, new ArrayList<>(headers)));
        for (List<Object> row : rows) {
            lines.add(writeRecord(writer, row));
        }
        return String.join("\n", lines);
    }

    private String writeRecord(ObjectWriter writer, List<?> values) {
        Map<String, String> record = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            record.put("c" + i, formatScalar(values.get(i)));
        }
        try {
            String line = stripTrailingNewline(writer.writeValueAsString(record));
            if (line.isEmpty()) {
                return "\"\"";
            }
            // a record must never read as a section delimiter or the end marker
            if (SectionGrammar.isDelimiterLine(line)) {
                String first = record.get("c0");
                return "\"" + first.replace("\"", "\"\"") + "\"" + line.substring(first.length());
            }
            return line;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not write CSV record", e);
        }
    }

    private static String formatScalar(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }

    private static String stripTrailingNewline(String text) {
        String result = text;
        while (result.endsWith("\n") || result.endsWith("\r")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
