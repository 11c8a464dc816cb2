package com.eainde.extraction.gap;

import com.eainde.extraction.model.FieldPath;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Section name to the field names that must be present for a record to be
 * considered complete. Read-only once built.
 */
public final class CriticalFieldRegistry {

    private static final CriticalFieldRegistry DEFAULT = new CriticalFieldRegistry(defaultTable());

    private final Map<String, Set<String>> fieldsBySection;

    public CriticalFieldRegistry(Map<String, Set<String>> fieldsBySection) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        fieldsBySection.forEach((section, fields) -> copy.put(section, Set.copyOf(fields)));
        this.fieldsBySection = Map.copyOf(copy);
    }

    public static CriticalFieldRegistry defaults() {
        return DEFAULT;
    }

    public boolean isCritical(String section, String field) {
        Set<String> fields = fieldsBySection.get(section);
        return fields != null && fields.contains(field);
    }

    public boolean isCritical(FieldPath path) {
        return isCritical(path.section(), path.field());
    }

    private static Map<String, Set<String>> defaultTable() {
        Map<String, Set<String>> table = new LinkedHashMap<>();
        table.put("key_dates", Set.of(
                "bid_end", "bid_start", "publication_date", "bid_validity",
                "pre_bid_meeting_date", "pre_bid_meeting_location",
                "technical_bid_opening", "financial_bid_opening",
                "contract_start", "project_duration",
                "date_and_time_of_issue", "due_date_and_time_of_submission"));
        table.put("financial_requirements", Set.of(
                "emd", "tender_fee", "performance_security",
                "payment_terms", "retention_money", "epbg_details"));
        table.put("tender_meta", Set.of(
                "tender_title", "portal", "department",
                "issuing_authority", "tender_id", "country", "state",
                "organization_address", "tender_document_date",
                "submission_instructions", "boq_title", "type_of_bid",
                "item_category", "total_quantity"));
        table.put("eligibility_snapshot", Set.of(
                "turnover_requirement", "experience_required",
                "who_can_bid", "consortium_or_jv_allowed",
                "international_bidders_allowed",
                "bidder_technical_infrastructure",
                "oem_turnover_requirement", "mse_relaxation", "startup_relaxation",
                "detailed_pre_qualification_criteria"));
        table.put("scope_of_work", Set.of(
                "description", "deliverables", "location",
                "duration", "technical_specifications"));
        table.put("legal_and_risk_clauses", Set.of(
                "rejection_of_bid", "splitting_of_work", "liquidated_damages",
                "blacklisting_clause", "warranty_period"));
        table.put("additional_important_information", Set.of(
                "detailed_evaluation_scoring_criteria",
                "evaluation_method", "bid_to_ra_enabled",
                "technical_clarification_time", "buyer_added_atc"));
        table.put("documents_required", Set.of(
                "documents_required", "online_submission_documents",
                "offline_submission_documents"));
        table.put(FieldPath.ROOT_SECTION, Set.of(
                "executive_summary", "pre_qualification_requirement"));
        return table;
    }
}
