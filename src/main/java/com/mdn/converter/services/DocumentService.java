package com.mdn.converter.services;

import com.mdn.converter.models.DecodeResult;
import com.mdn.converter.models.ValidationReport;
import com.mdn.converter.models.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for conversions in both directions.
 * Every call is independent; nothing is kept between documents.
 */
@Service
public class DocumentService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    private final DocumentReader documentReader;
    private final DocumentWriter documentWriter;
    private final DocumentValidator documentValidator;

    public DocumentService(DocumentReader documentReader, DocumentWriter documentWriter,
                           DocumentValidator documentValidator) {
        this.documentReader = documentReader;
        this.documentWriter = documentWriter;
        this.documentValidator = documentValidator;
    }

    /**
     * Reads the document and attaches the validation report.
     * Structural and reference errors are thrown; everything else ends up in the report.
     */
    public DecodeResult decode(String text) {
        Workbook workbook = documentReader.read(text);
        ValidationReport report = documentValidator.validate(text);
        report.getWarnings().forEach(warning -> logger.debug("Validation warning: {}", warning));
        return new DecodeResult(workbook, report);
    }

    public String encode(Workbook workbook) {
        return documentWriter.encode(workbook);
    }

    public ValidationReport validate(String text) {
        return documentValidator.validate(text);
    }
}
