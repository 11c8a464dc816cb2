package com.eainde.extraction.gap;

import com.eainde.extraction.model.CandidateRecord;
import com.eainde.extraction.model.FieldPath;
import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.model.SectionValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds empty leaves in a record.
 *
 * <p>A leaf is empty when it is placeholder text (see
 * {@link com.eainde.extraction.model.Placeholders#GAP_TOKENS}) or a list with
 * no non-blank item. Sections are walked, never reported themselves.</p>
 */
public class GapAnalyzer {

    private final CriticalFieldRegistry registry;

    public GapAnalyzer(CriticalFieldRegistry registry) {
        this.registry = registry;
    }

    public List<MissingField> scanForGaps(CandidateRecord record) {
        List<MissingField> missing = new ArrayList<>();
        for (Map.Entry<String, FieldValue> entry : record.root().fields().entrySet()) {
            walk(FieldPath.of(entry.getKey()), entry.getValue(), missing);
        }
        return missing;
    }

    public List<MissingField> criticalGaps(CandidateRecord record) {
        return scanForGaps(record).stream().filter(MissingField::critical).toList();
    }

    public GapSummary summarize(CandidateRecord record) {
        List<MissingField> missing = scanForGaps(record);
        Map<String, Integer> bySection = new LinkedHashMap<>();
        int critical = 0;
        for (MissingField field : missing) {
            bySection.merge(field.section(), 1, Integer::sum);
            if (field.critical()) critical++;
        }
        return new GapSummary(missing.size(), critical, bySection);
    }

    private void walk(FieldPath path, FieldValue value, List<MissingField> missing) {
        if (value instanceof SectionValue section) {
            for (Map.Entry<String, FieldValue> child : section.fields().entrySet()) {
                walk(path.child(child.getKey()), child.getValue(), missing);
            }
        } else if (value.isEmpty()) {
            missing.add(new MissingField(path.section(), path.field(), path, registry.isCritical(path)));
        }
    }
}
