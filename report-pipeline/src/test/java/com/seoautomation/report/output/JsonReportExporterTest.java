package com.seoautomation.report.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seoautomation.report.ReportFixtures;
import com.seoautomation.report.model.Report;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportExporterTest {

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private final JsonReportExporter exporter = new JsonReportExporter(objectMapper);

    @Test
    void shouldExportFullReportStructure() throws Exception {
        Report report = ReportFixtures.sampleReport();

        JsonNode json = objectMapper.readTree(exporter.export(report));

        assertThat(json.get("id").asText()).isEqualTo(report.getId());
        assertThat(json.get("periodStart").asText()).isEqualTo("2024-03-11");
        assertThat(json.get("overallScore").asInt()).isEqualTo(35);
        assertThat(json.get("categoryScores")).hasSize(5);
        assertThat(json.get("recommendations")).hasSize(4);
        assertThat(json.has("trend")).isTrue();
        assertThat(json.has("forecast")).isTrue();
        assertThat(json.has("narrative")).isTrue();
    }

    @Test
    void shouldExportSameBytesForSameReport() {
        Report report = ReportFixtures.sampleReport();

        assertThat(exporter.export(report)).isEqualTo(exporter.export(report));
    }
}
