package com.mdn.converter.controllers;

import com.mdn.converter.AppApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = AppApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class DocumentControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    private static String load(String name) throws IOException {
        try (InputStream in = DocumentControllerIntegrationTest.class.getResourceAsStream("/documents/" + name)) {
            assertNotNull(in);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private HttpEntity<String> text(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        return new HttpEntity<>(body, headers);
    }

    private ResponseEntity<Map<String, Object>> postForMap(String url, HttpEntity<String> request) {
        return restTemplate.exchange(url, HttpMethod.POST, request, new ParameterizedTypeReference<Map<String, Object>>() {});
    }

    private HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    /**
     * Decodes the revenue document and checks the JSON shape of workbook and report.
     */
    @Test
    void testDecode() throws IOException {
        String url = "http://localhost:" + port + "/document/decode";
        ResponseEntity<Map<String, Object>> response = postForMap(url, text(load("revenue.mdn")));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> body = response.getBody();
        assertNotNull(body);

        Map<?, ?> report = (Map<?, ?>) body.get("report");
        assertEquals(true, report.get("valid"));

        Map<?, ?> workbook = (Map<?, ?>) body.get("workbook");
        Map<?, ?> revenue = (Map<?, ?>) ((List<?>) workbook.get("sheets")).get(0);
        assertEquals("Revenue", revenue.get("name"));
        Map<?, ?> formulas = (Map<?, ?>) revenue.get("formulas");
        assertEquals("=B2*(1+C2)", formulas.get("D2"));
        Map<?, ?> formats = (Map<?, ?>) revenue.get("formats");
        assertEquals(Map.of("numberFormat", "$#,##0"), formats.get("D3"));
    }

    /**
     * A missing END DOCUMENT marker is a 400 with the error code in the body.
     */
    @Test
    void testDecodeMalformedDocument() throws IOException {
        String url = "http://localhost:" + port + "/document/decode";
        String truncated = load("minimal.mdn").replace("END DOCUMENT", "");

        HttpClientErrorException error = assertThrows(HttpClientErrorException.class, () ->
                postForMap(url, text(truncated)));
        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        assertTrue(error.getResponseBodyAsString().contains("MALFORMED_SECTION"));
    }

    @Test
    void testEncode() {
        String url = "http://localhost:" + port + "/document/encode";
        String body = "{\n" +
                "  \"metadata\": {\"source\": \"scores.xlsx\", \"version\": \"1.0\", \"created\": \"2024-03-01T09:30:00Z\"},\n" +
                "  \"sheets\": [\n" +
                "    {\"name\": \"Data\", \"headers\": [\"Name\", \"Score\"], \"rows\": [[\"Ada\", 12], [\"Alan\", 15]],\n" +
                "     \"formats\": {\"B2\": {\"bold\": true}, \"B3\": {\"bold\": true}}}\n" +
                "  ],\n" +
                "  \"guidance\": \"Scores are out of 20.\"\n" +
                "}";

        ResponseEntity<String> response = restTemplate.postForEntity(url, json(body), String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        String document = response.getBody();
        assertNotNull(document);
        assertTrue(document.contains("source: scores.xlsx"));
        assertTrue(document.contains("--- MDN:SHEET CSV name=Data\nName,Score\nAda,12\nAlan,15\n---"));
        assertTrue(document.contains("\"Data!B2:B3\""));
        assertTrue(document.contains("--- MDN:AI_PROMPT\nScores are out of 20.\n---"));
        assertTrue(document.endsWith("END DOCUMENT\n"));
    }

    /**
     * A row wider than its header is rejected by the workbook binding.
     */
    @Test
    void testEncodeInvalidWorkbook() {
        String url = "http://localhost:" + port + "/document/encode";
        String body = "{\"sheets\": [{\"name\": \"Data\", \"headers\": [\"Name\"], \"rows\": [[\"Ada\", 12]]}]}";

        HttpClientErrorException error = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(url, json(body), String.class));
        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        assertTrue(error.getResponseBodyAsString().contains("INVALID_WORKBOOK"));
    }

    /**
     * Guidance with a line that would close its section cannot be encoded.
     */
    @Test
    void testEncodeDelimiterInGuidance() {
        String url = "http://localhost:" + port + "/document/encode";
        String body = "{\"sheets\": [{\"name\": \"Data\", \"headers\": [\"Name\"], \"rows\": [[\"Ada\"]]}],"
                + " \"guidance\": \"Intro\\n---\\nMore\"}";

        HttpClientErrorException error = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(url, json(body), String.class));
        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        assertTrue(error.getResponseBodyAsString().contains("INVALID_WORKBOOK"));
    }

    @Test
    void testValidate() throws IOException {
        String url = "http://localhost:" + port + "/document/validate";
        String document = load("minimal.mdn").replace("{}", "{\"Data!C9\": \"=1\"}");

        ResponseEntity<Map<String, Object>> response = postForMap(url, text(document));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> report = response.getBody();
        assertNotNull(report);
        assertEquals(false, report.get("valid"));
        Map<?, ?> firstError = (Map<?, ?>) ((List<?>) report.get("errors")).get(0);
        assertEquals("REFERENCE_OUT_OF_EXTENT", firstError.get("code"));
    }
}
