package com.seoautomation.report.output;

/**
 * Rendered report bytes with what a caller needs to serve them as a download.
 */
public record ExportedReport(byte[] content, String contentType, String fileName) {}
