package com.seoautomation.report.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Issue {

    /** performance | seo | accessibility | security */
    String type;

    IssueSeverity severity;

    String message;

    String remediation;

    /** Estimated score impact, 0..100 */
    int impact;
}
