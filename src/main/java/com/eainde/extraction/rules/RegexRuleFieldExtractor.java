package com.eainde.extraction.rules;

import com.eainde.extraction.classify.DocumentType;
import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.model.TextListValue;
import com.eainde.extraction.model.TextValue;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based {@link RuleFieldExtractor} for Indian public tenders.
 *
 * <p>Common fields (id, fees, dates, eligibility) are read from any text.
 * Portal-specific tables are read only when the text names that portal:
 * GeM bid documents carry a pre-qualification table and bid settings, CPPP
 * notices carry issue and due dates, envelope document lists and reservation
 * clauses. Portal-specific values replace common ones of the same name.</p>
 */
@Slf4j
public class RegexRuleFieldExtractor implements RuleFieldExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final int BLOCK_FLAGS = FLAGS | Pattern.DOTALL;

    private static final String AMOUNT = "\\s*[:\\-]?\\s*₹?\\s*(?:Rs\\.?)?\\s*([\\d,]+(?:\\.\\d{2})?)";
    private static final String DATE_TIME = "\\s*[:\\-]?\\s*(\\d{2}[-/.]\\d{2}[-/.]\\d{4}(?:\\s+\\d{2}:\\d{2}(?::\\d{2})?)?)";

    // ---- common ----
    private static final Pattern TENDER_ID_GEM = Pattern.compile("GEM/\\d{4}/[A-Z]/\\d+", FLAGS);
    private static final Pattern TENDER_ID_GENERIC = Pattern.compile(
            "(?:Tender\\s+(?:No|ID|Reference)|Ref(?:\\.?\\s*No)?|NIT\\s*(?:No|ID|Ref)?|Solicitation\\s+No)[\\s:]+\\s*([A-Z0-9\\-_/]{4,})", FLAGS);
    private static final Pattern PLAIN_DATE = Pattern.compile("^\\d{1,2}[-/.]\\d{1,2}[-/.]\\d{2,4}$");
    private static final Pattern EMD = Pattern.compile(
            "(?:EMD|Earnest\\s+Money(?:\\s+Deposit)?)" + AMOUNT + "\\s*(?:Lakhs?|Crores?|/-)?", FLAGS);
    private static final Pattern TENDER_FEE = Pattern.compile("(?:Tender\\s+(?:Fee|Document\\s+Fee))" + AMOUNT, FLAGS);
    private static final Pattern BID_START = Pattern.compile(
            "(?:Bid\\s+(?:Submission\\s+)?(?:Start|Opening|Open)\\s+Date(?:/Time)?)" + DATE_TIME, FLAGS);
    private static final Pattern BID_END = Pattern.compile(
            "(?:Bid\\s+(?:Submission\\s+)?(?:End|Closing)\\s+Date(?:/Time)?)" + DATE_TIME, FLAGS);
    private static final Pattern TECHNICAL_OPENING = Pattern.compile(
            "(?:Technical\\s+Bid\\s+Opening(?:/Time)?)" + DATE_TIME, FLAGS);
    private static final Pattern FINANCIAL_OPENING = Pattern.compile(
            "(?:Financial\\s+Bid\\s+Opening(?:/Time)?)" + DATE_TIME, FLAGS);
    private static final Pattern BID_VALIDITY = Pattern.compile(
            "(?:Bid\\s+(?:Offer\\s+)?Validity(?:\\s+\\(From\\s+End\\s+Date\\))?)\\s*[:\\-]?\\s*(\\d+)", FLAGS);
    private static final Pattern TURNOVER = Pattern.compile(
            "(?:Annual\\s+)?Turnover\\s*[:\\-]?\\s*(?:of\\s+)?₹?\\s*(?:Rs\\.?)?\\s*([\\d,]+(?:\\.\\d{2})?)\\s*(?:Lakhs?|Crores?)", FLAGS);
    private static final Pattern EXPERIENCE_YEARS = Pattern.compile(
            "(?:Experience\\s+of\\s+|Minimum\\s+)(\\d+)\\s+(?:years?|yrs)", FLAGS);
    private static final Pattern SIMILAR_PROJECTS = Pattern.compile(
            "(\\d+)\\s+similar\\s+(?:projects?|works?|contracts?)", FLAGS);
    private static final Pattern MSE_EXEMPTION = Pattern.compile(
            "MSMEs?\\s+(?:are\\s+)?exempt(?:ed)?|(?:EMD|Earnest\\s+Money)\\s+exemption\\s+for\\s+MSMEs?", FLAGS);
    private static final Pattern STARTUP_EXEMPTION = Pattern.compile(
            "Startups?\\s+(?:are\\s+)?exempt(?:ed)?|exemption\\s+for\\s+Startups?", FLAGS);

    static final Pattern PORTAL_GEM = Pattern.compile("Government\\s+e-?Marketplace|GeM\\s+Portal|gem\\.gov\\.in", FLAGS);
    static final Pattern PORTAL_CPPP = Pattern.compile("Central\\s+Public\\s+Procurement\\s+Portal|CPPP|eprocure\\.gov\\.in", FLAGS);

    // ---- GeM ----
    private static final Pattern GEM_TURNOVER = Pattern.compile(
            "Minimum\\s+Average\\s+Annual\\s+Turnover\\s+of\\s+the\\s+bidder.*?\\n\\s*([\\d,]+)", BLOCK_FLAGS);
    private static final Pattern GEM_OEM_TURNOVER = Pattern.compile(
            "OEM\\s+Average\\s+Turnover.*?\\n\\s*([\\d,]+)", BLOCK_FLAGS);
    private static final Pattern GEM_EXPERIENCE = Pattern.compile(
            "Years?\\s+of\\s+Past\\s+Experience\\s+Required.*?\\n\\s*(\\d+)\\s*Year", BLOCK_FLAGS);
    private static final Pattern GEM_MSE_RELAXATION = Pattern.compile(
            "MSE\\s+Relaxation\\s+for\\s+Years.*?\\n\\s*(Yes|No|Complete|Partial|Exempt)\\s*\\|\\s*(Complete|Partial|Exempt)?", BLOCK_FLAGS);
    private static final Pattern GEM_STARTUP_RELAXATION = Pattern.compile(
            "Startup\\s+Relaxation\\s+for\\s+Years.*?\\n\\s*(Yes|No|Complete|Partial|Exempt)\\s*\\|\\s*(Complete|Partial|Exempt)?", BLOCK_FLAGS);
    private static final Pattern GEM_SELLER_DOCUMENTS = Pattern.compile(
            "Document\\s+required\\s+from\\s+seller\\s*\\n\\s*(.*?)(?:\\n\\s*\\*|$)", BLOCK_FLAGS);
    private static final Pattern GEM_BOQ_TITLE = Pattern.compile(
            "(?:BOQ|Bill\\s+of\\s+Quantities)\\s*[:\\-]?\\s*(.+?)(?:\\n|$)", FLAGS);
    private static final Pattern GEM_ITEM_CATEGORY = Pattern.compile(
            "(?:Item\\s+Category|Product\\s+Category)\\s*[:\\-]?\\s*(.+?)(?:\\n|$)", FLAGS);
    private static final Pattern GEM_TOTAL_QUANTITY = Pattern.compile(
            "(?:Total\\s+Quantity|Total\\s+Qty\\.?)\\s*[:\\-]?\\s*(\\d+(?:[,.\\d]+)?)", FLAGS);
    private static final Pattern GEM_TYPE_OF_BID = Pattern.compile("(?:Single|Two)[\\s-]*(?:Packet|Part)\\s+Bid", FLAGS);
    private static final Pattern GEM_EPBG_PERCENTAGE = Pattern.compile("ePBG\\s*[:\\-]?\\s*(\\d+%)", FLAGS);
    private static final Pattern GEM_EPBG_DURATION = Pattern.compile(
            "ePBG.*?Duration\\s*[:\\-]?\\s*(\\d+\\s*(?:days?|weeks?|months?))", FLAGS);
    private static final Pattern GEM_EVALUATION_METHOD = Pattern.compile(
            "Evaluation.*?(?:Method|Basis)\\s*[:\\-]?\\s*(Item[- ]wise|Total)", FLAGS);
    private static final Pattern GEM_BID_TO_RA = Pattern.compile(
            "(?:Bid\\s+to\\s+(?:RA|Reverse\\s+Auction)|Reverse\\s+Auction)\\s*[:\\-]?\\s*(Yes|No|Enabled|Disabled)", FLAGS);
    private static final Pattern GEM_CLARIFICATION_TIME = Pattern.compile(
            "(?:Technical\\s+Clarification.*?Time|Clarification\\s+Response\\s+Time)\\s*[:\\-]?\\s*(\\d+\\s*(?:hours?|days?|minutes?))", FLAGS);
    private static final Pattern GEM_BUYER_ATC = Pattern.compile(
            "Buyer\\s+Added\\s+(?:Terms\\s+and\\s+Conditions|T\\s*&\\s*C|ATC)\\s*[:\\-]?\\s*(Yes|No|Present|Absent)", FLAGS);

    // ---- CPPP ----
    private static final Pattern CPPP_ISSUE_DATE = Pattern.compile(
            "Date\\s*&?\\s*Time\\s+of\\s+Issue\\s*[:\\-]?\\s*(.+?)(?:\\n|$)", FLAGS);
    private static final Pattern CPPP_DUE_DATE = Pattern.compile(
            "Due\\s+Date\\s*&?\\s*Time\\s+of\\s+Submission\\s*[:\\-]?\\s*(.+?)(?:\\n|$)", FLAGS);
    private static final Pattern CPPP_ENVELOPE_1 = Pattern.compile(
            "Envelope[\\s-]*(?:1|One|I)\\b.*?(?=Envelope[\\s-]*(?:2|Two|II)\\b|\\z)", BLOCK_FLAGS);
    private static final Pattern CPPP_ENVELOPE_2 = Pattern.compile(
            "Envelope[\\s-]*(?:2|Two|II)\\b.*?(?=Envelope[\\s-]*(?:3|Three|III)\\b|\\z)", BLOCK_FLAGS);
    private static final Pattern CPPP_OFFLINE = Pattern.compile(
            "(?:Offline\\s+Submission|Hardcopy|Physical\\s+Submission).*?(?:\\n\\n|\\z)", BLOCK_FLAGS);
    private static final Pattern CPPP_RIGHT_TO_REJECT = Pattern.compile(
            "Right\\s+to\\s+Reject\\s+Bids?\\s+(?:without\\s+)?(?:Reason|Assigning\\s+Reason)"
                    + "|(?:Tenders|Bids)\\s+(?:can|may)\\s+be\\s+rejected\\s+without\\s+assigning\\s+reason", FLAGS);
    private static final Pattern CPPP_SPLIT_WORK = Pattern.compile(
            "Right\\s+to\\s+Split\\s+(?:Tender|Work|Project)|Work\\s+may\\s+be\\s+split\\s+(?:among|between)"
                    + "|Splitting\\s+(?:of\\s+)?(?:Tender|Work)", FLAGS);
    private static final Pattern LIST_ITEM = Pattern.compile("^(?:[-•*]|\\d+[.)])\\s*(.+)$");

    @Override
    public RuleExtraction extract(String text) {
        if (text == null || text.isBlank()) {
            return RuleExtraction.EMPTY;
        }
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        extractCommon(text, fields);

        String portal = null;
        if (PORTAL_GEM.matcher(text).find()) {
            portal = DocumentType.GEM.label();
            extractGem(text, fields);
        } else if (PORTAL_CPPP.matcher(text).find()) {
            portal = DocumentType.CPPP.label();
            extractCppp(text, fields);
        }
        if (portal != null) {
            fields.put("portal", TextValue.of(portal));
        }

        log.debug("Rule extraction found {} fields: {}", fields.size(), fields.keySet());
        return new RuleExtraction(fields, portal);
    }

    private void extractCommon(String text, Map<String, FieldValue> fields) {
        first(TENDER_ID_GEM, text).or(() -> first(TENDER_ID_GENERIC, text))
                .filter(id -> !PLAIN_DATE.matcher(id).matches())
                .ifPresent(id -> put(fields, "tender_id", id));

        first(EMD, text).ifPresent(v -> put(fields, "emd", "₹" + v));
        first(TENDER_FEE, text).ifPresent(v -> put(fields, "tender_fee", "₹" + v));
        first(BID_START, text).ifPresent(v -> put(fields, "bid_start", v));
        first(BID_END, text).ifPresent(v -> put(fields, "bid_end", v));
        first(TECHNICAL_OPENING, text).ifPresent(v -> put(fields, "technical_bid_opening", v));
        first(FINANCIAL_OPENING, text).ifPresent(v -> put(fields, "financial_bid_opening", v));
        first(BID_VALIDITY, text).ifPresent(v -> put(fields, "bid_validity", v + " days"));
        first(TURNOVER, text).ifPresent(v -> put(fields, "turnover_requirement", "₹" + v));

        List<String> experience = new ArrayList<>();
        first(EXPERIENCE_YEARS, text).ifPresent(v -> experience.add(v + " years"));
        first(SIMILAR_PROJECTS, text).ifPresent(v -> experience.add(v + " projects"));
        if (!experience.isEmpty()) {
            put(fields, "experience_required", String.join(" / ", experience));
        }

        if (MSE_EXEMPTION.matcher(text).find()) put(fields, "mse_relaxation", "Yes");
        if (STARTUP_EXEMPTION.matcher(text).find()) put(fields, "startup_relaxation", "Yes");
    }

    private void extractGem(String text, Map<String, FieldValue> fields) {
        first(GEM_TURNOVER, text).ifPresent(v -> put(fields, "turnover_requirement", "₹" + v + " Lakh(s)"));
        first(GEM_OEM_TURNOVER, text).ifPresent(v -> put(fields, "oem_turnover_requirement", "₹" + v + " Lakh(s)"));
        first(GEM_EXPERIENCE, text).ifPresent(v -> put(fields, "experience_required", v + " Year(s)"));
        relaxation(GEM_MSE_RELAXATION, text).ifPresent(v -> put(fields, "mse_relaxation", v));
        relaxation(GEM_STARTUP_RELAXATION, text).ifPresent(v -> put(fields, "startup_relaxation", v));

        first(GEM_SELLER_DOCUMENTS, text).ifPresent(block -> {
            List<String> documents = new ArrayList<>();
            for (String item : block.split(",")) {
                String stripped = item.strip();
                if (stripped.length() > 2) documents.add(stripped);
            }
            if (!documents.isEmpty()) fields.put("documents_required", new TextListValue(documents));
        });

        first(GEM_BOQ_TITLE, text).ifPresent(v -> put(fields, "boq_title", v));
        first(GEM_ITEM_CATEGORY, text).ifPresent(v -> put(fields, "item_category", v));
        first(GEM_TOTAL_QUANTITY, text).ifPresent(v -> put(fields, "total_quantity", v));
        first(GEM_TYPE_OF_BID, text).ifPresent(v -> put(fields, "type_of_bid", v));

        List<String> epbg = new ArrayList<>();
        first(GEM_EPBG_PERCENTAGE, text).ifPresent(v -> epbg.add("Percentage: " + v));
        first(GEM_EPBG_DURATION, text).ifPresent(v -> epbg.add("Duration: " + v));
        if (!epbg.isEmpty()) put(fields, "epbg_details", String.join(" | ", epbg));

        first(GEM_EVALUATION_METHOD, text).ifPresent(v -> put(fields, "evaluation_method", v));
        first(GEM_BID_TO_RA, text).ifPresent(v -> put(fields, "bid_to_ra_enabled", v));
        first(GEM_CLARIFICATION_TIME, text).ifPresent(v -> put(fields, "technical_clarification_time", v));
        first(GEM_BUYER_ATC, text).ifPresent(v -> put(fields, "buyer_added_atc", v));
    }

    private void extractCppp(String text, Map<String, FieldValue> fields) {
        first(CPPP_ISSUE_DATE, text).ifPresent(v -> put(fields, "date_and_time_of_issue", v));
        first(CPPP_DUE_DATE, text).ifPresent(v -> put(fields, "due_date_and_time_of_submission", v));

        LinkedHashSet<String> online = new LinkedHashSet<>();
        whole(CPPP_ENVELOPE_1, text).ifPresent(block -> online.addAll(listItems(block)));
        whole(CPPP_ENVELOPE_2, text).ifPresent(block -> online.addAll(listItems(block)));
        if (!online.isEmpty()) {
            fields.put("online_submission_documents", new TextListValue(new ArrayList<>(online)));
        }
        whole(CPPP_OFFLINE, text).map(RegexRuleFieldExtractor::listItems)
                .filter(items -> !items.isEmpty())
                .ifPresent(items -> fields.put("offline_submission_documents",
                        new TextListValue(new ArrayList<>(new LinkedHashSet<>(items)))));

        if (CPPP_RIGHT_TO_REJECT.matcher(text).find()) put(fields, "rejection_of_bid", "Yes");
        if (CPPP_SPLIT_WORK.matcher(text).find()) put(fields, "splitting_of_work", "Yes");
    }

    /**
     * Bulleted or numbered lines of {@code block}, markers removed.
     */
    static List<String> listItems(String block) {
        List<String> items = new ArrayList<>();
        for (String line : block.split("\n")) {
            Matcher m = LIST_ITEM.matcher(line.strip());
            if (m.matches()) {
                String item = m.group(1).strip();
                if (item.length() > 3 && !item.equalsIgnoreCase("notes") && !item.equalsIgnoreCase("instructions")) {
                    items.add(item);
                }
            }
        }
        return items;
    }

    private static Optional<String> relaxation(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return Optional.empty();
        String second = m.group(2);
        return Optional.of(second == null ? m.group(1) : m.group(1) + " | " + second);
    }

    private static Optional<String> first(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return Optional.empty();
        String value = m.groupCount() > 0 && m.group(1) != null ? m.group(1) : m.group();
        value = value.strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static Optional<String> whole(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    private static void put(Map<String, FieldValue> fields, String name, String value) {
        fields.put(name, TextValue.of(value));
    }
}
