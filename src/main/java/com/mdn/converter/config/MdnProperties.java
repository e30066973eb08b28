package com.mdn.converter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the "mdn.*" keys of application.properties.
 */
@ConfigurationProperties(prefix = "mdn")
public class MdnProperties {

    // namespace token of every section open line: "--- MDN:SHEET CSV ..."
    private String namespace = "MDN";
    private String formatVersion = "1.0";
    private final Encode encode = new Encode();
    private final Validation validation = new Validation();

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getFormatVersion() {
        return formatVersion;
    }

    public void setFormatVersion(String formatVersion) {
        this.formatVersion = formatVersion;
    }

    public Encode getEncode() {
        return encode;
    }

    public Validation getValidation() {
        return validation;
    }

    public static class Encode {
        /**
         * When false, every formula is written under its own single-cell key.
         */
        private boolean coalesceFormulas = false;
        private String defaultSource = "workbook.xlsx";

        public boolean isCoalesceFormulas() {
            return coalesceFormulas;
        }

        public void setCoalesceFormulas(boolean coalesceFormulas) {
            this.coalesceFormulas = coalesceFormulas;
        }

        public String getDefaultSource() {
            return defaultSource;
        }

        public void setDefaultSource(String defaultSource) {
            this.defaultSource = defaultSource;
        }
    }

    public static class Validation {
        private int promptLengthLimit = 500;

        public int getPromptLengthLimit() {
            return promptLengthLimit;
        }

        public void setPromptLengthLimit(int promptLengthLimit) {
            this.promptLengthLimit = promptLengthLimit;
        }
    }
}
