package com.eainde.extraction.validation;

import com.eainde.extraction.classify.DocumentType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Completeness verdict for a finished record. An invalid report is not an
 * error; it lists what a reviewer should check.
 */
public record ValidationReport(
        @JsonProperty("is_valid") boolean valid,
        @JsonProperty("missing_fields") List<String> missingFields,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("portal_type") DocumentType documentType,
        @JsonProperty("validation_summary") Summary summary) {

    public ValidationReport {
        missingFields = List.copyOf(missingFields);
        warnings = List.copyOf(warnings);
    }

    public static ValidationReport of(DocumentType documentType, List<String> missingFields, List<String> warnings) {
        Summary summary = new Summary(missingFields.size() + warnings.size(), missingFields.size(), warnings.size());
        return new ValidationReport(missingFields.isEmpty(), missingFields, warnings, documentType, summary);
    }

    public record Summary(
            @JsonProperty("total_issues") int totalIssues,
            @JsonProperty("missing_fields_count") int missingFieldsCount,
            @JsonProperty("warnings_count") int warningsCount) {
    }
}
