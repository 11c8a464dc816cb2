package com.eainde.extraction.validation;

import com.eainde.extraction.classify.DocumentType;
import com.eainde.extraction.model.CandidateRecord;
import com.eainde.extraction.model.FieldPath;
import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.model.Placeholders;
import com.eainde.extraction.model.TextValue;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a record against the fields each portal's tenders are expected to
 * carry, then runs a few cross-field checks that only produce warnings.
 */
@Slf4j
public class CompletenessValidator {

    private static final Map<DocumentType, List<String>> REQUIRED_FIELDS = new EnumMap<>(DocumentType.class);

    static {
        REQUIRED_FIELDS.put(DocumentType.GEM, List.of(
                "tender_meta.tender_id", "tender_meta.tender_title", "tender_meta.portal",
                "tender_meta.item_category", "tender_meta.total_quantity", "tender_meta.boq_title",
                "eligibility_snapshot.turnover_requirement", "eligibility_snapshot.oem_turnover_requirement",
                "eligibility_snapshot.experience_required",
                "financial_requirements.epbg_details",
                "additional_important_information.evaluation_method",
                "additional_important_information.bid_to_ra_enabled",
                "additional_important_information.technical_clarification_time",
                "additional_important_information.buyer_added_atc",
                "pre_qualification_requirement"));
        REQUIRED_FIELDS.put(DocumentType.CPPP, List.of(
                "tender_meta.tender_id", "tender_meta.tender_title", "tender_meta.portal",
                "key_dates.date_and_time_of_issue", "key_dates.due_date_and_time_of_submission",
                "documents_required.online_submission_documents",
                "documents_required.offline_submission_documents",
                "eligibility_snapshot.bidder_technical_infrastructure"));
        REQUIRED_FIELDS.put(DocumentType.GENERIC, List.of(
                "tender_meta.tender_id", "tender_meta.tender_title",
                "key_dates.bid_end", "financial_requirements.emd"));
    }

    public ValidationReport validate(CandidateRecord record, DocumentType documentType) {
        log.info("Validating {} extraction", documentType.label());
        List<String> missing = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (String path : REQUIRED_FIELDS.get(documentType)) {
            if (isMissing(record, path)) {
                missing.add(path);
                log.warn("{} validation: missing or empty field {}", documentType.label(), path);
            }
        }

        switch (documentType) {
            case GEM -> gemChecks(record, warnings);
            case CPPP -> cpppChecks(record, warnings);
            default -> { }
        }

        if (isMissing(record, "tender_meta.tender_id")) {
            warnings.add("Tender ID is missing - this is a critical field");
        }
        if (isMissing(record, "key_dates.bid_end")) {
            warnings.add("Bid end date is missing - this is critical for bidding timeline");
        }
        return ValidationReport.of(documentType, missing, warnings);
    }

    private void gemChecks(CandidateRecord record, List<String> warnings) {
        if (isMissing(record, "pre_qualification_requirement")) {
            warnings.add("pre_qualification_requirement is empty - GeM tenders MUST have this");
        } else if (!record.text("pre_qualification_requirement").contains("|")) {
            warnings.add("pre_qualification_requirement format may be incomplete (missing | separators)");
        }
        if (isMissing(record, "documents_required.documents_required")) {
            warnings.add("documents_required is empty - should contain pre-qual documents");
        }
    }

    private void cpppChecks(CandidateRecord record, List<String> warnings) {
        boolean noOnline = isMissing(record, "documents_required.online_submission_documents");
        boolean noOffline = isMissing(record, "documents_required.offline_submission_documents");
        if (noOnline) {
            warnings.add("online_submission_documents is empty - CPPP tenders must separate online docs");
        }
        if (noOffline) {
            warnings.add("offline_submission_documents is empty - check if physical submission is required");
        }
        if (isMissing(record, "key_dates.date_and_time_of_issue")
                || isMissing(record, "key_dates.due_date_and_time_of_submission")) {
            warnings.add("CPPP date fields should have specific labels - verify extraction");
        }
        if (noOnline && noOffline) {
            warnings.add("Neither online nor offline submission documents found - envelope structure may not be extracted");
        }
    }

    static boolean isMissing(CandidateRecord record, String path) {
        return record.get(FieldPath.parse(path))
                .map(CompletenessValidator::isBlank)
                .orElse(true);
    }

    private static boolean isBlank(FieldValue value) {
        if (value instanceof TextValue text) {
            return Placeholders.isCleanupToken(text.value());
        }
        return value.isEmpty();
    }
}
