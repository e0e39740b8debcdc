package com.seoautomation.report.output;

import com.seoautomation.report.exception.UnsupportedExportFormatException;

import java.util.Locale;

public enum ExportFormat {

    STRUCTURED_JSON("structured-json", "json", "application/json"),
    TABULAR_CSV("tabular-csv", "csv", "text/csv"),
    PORTABLE_DOCUMENT("portable-document", "pdf", "application/pdf");

    private final String value;
    private final String extension;
    private final String contentType;

    ExportFormat(String value, String extension, String contentType) {
        this.value = value;
        this.extension = extension;
        this.contentType = contentType;
    }

    public String value() {
        return value;
    }

    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }

    /** Accepts the format name or its file extension, case-insensitive. */
    public static ExportFormat fromValue(String format) {
        if (format != null) {
            String normalized = format.trim().toLowerCase(Locale.ROOT);
            for (ExportFormat f : values()) {
                if (f.value.equals(normalized) || f.extension.equals(normalized)) {
                    return f;
                }
            }
        }
        throw new UnsupportedExportFormatException(format);
    }
}
