package com.mdn.converter.controllers;

import com.mdn.converter.models.DecodeResult;
import com.mdn.converter.models.ValidationReport;
import com.mdn.converter.models.Workbook;
import com.mdn.converter.services.DocumentService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST endpoints for converting documents.
 * "/document" is the base path.
 */
@RestController
@RequestMapping("/document")
public class DocumentController {

    @Autowired
    private DocumentService documentService;

    /**
     * POST /document/decode
     * Body: the document text.
     * Returns { "workbook": ..., "report": ... }. Structural errors become a 400.
     */
    @PostMapping(value = "/decode", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DecodeResult> decode(@RequestBody String text) {
        return ResponseEntity.ok(documentService.decode(text));
    }

    /**
     * POST /document/encode
     * Body: a workbook as JSON, formulas and formats keyed by cell ("D2").
     * Returns the document text.
     */
    @PostMapping(value = "/encode", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> encode(@RequestBody Workbook workbook) {
        return ResponseEntity.ok(documentService.encode(workbook));
    }

    @PostMapping(value = "/validate", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ValidationReport> validate(@RequestBody String text) {
        return ResponseEntity.ok(documentService.validate(text));
    }
}
