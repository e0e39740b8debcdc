package com.seoautomation.report.output;

import com.seoautomation.report.exception.UnsupportedExportFormatException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportFormatTest {

    @ParameterizedTest
    @CsvSource({
            "structured-json,   STRUCTURED_JSON",
            "json,              STRUCTURED_JSON",
            "Tabular-CSV,       TABULAR_CSV",
            "csv,               TABULAR_CSV",
            "portable-document, PORTABLE_DOCUMENT",
            "' PDF ',           PORTABLE_DOCUMENT"
    })
    void shouldResolveNamesAndExtensions(String input, ExportFormat expected) {
        assertThat(ExportFormat.fromValue(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "xlsx", "html"})
    void shouldRejectUnknownFormats(String input) {
        assertThatThrownBy(() -> ExportFormat.fromValue(input))
                .isInstanceOf(UnsupportedExportFormatException.class);
    }
}
