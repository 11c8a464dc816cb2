package com.eainde.extraction.gap;

import com.eainde.extraction.model.CandidateRecord;
import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.model.SectionValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Non-destructive deep merge.
 *
 * <ul>
 *   <li>section in both → merge recursively</li>
 *   <li>otherwise → take the update only if it is non-empty</li>
 * </ul>
 *
 * A non-empty base value is never replaced by an empty one.
 */
public final class RecordMerger {

    private RecordMerger() {
    }

    public static CandidateRecord deepMerge(CandidateRecord base, CandidateRecord updates) {
        SectionValue merged = deepMerge(base.root(), updates.root());
        return merged == base.root() ? base : new CandidateRecord(merged);
    }

    public static SectionValue deepMerge(SectionValue base, SectionValue updates) {
        if (updates.isEmpty()) {
            return base;
        }
        Map<String, FieldValue> merged = new LinkedHashMap<>(base.fields());
        for (Map.Entry<String, FieldValue> entry : updates.fields().entrySet()) {
            FieldValue current = merged.get(entry.getKey());
            FieldValue update = entry.getValue();
            if (current instanceof SectionValue currentSection && update instanceof SectionValue updateSection) {
                merged.put(entry.getKey(), deepMerge(currentSection, updateSection));
            } else if (!update.isEmpty()) {
                merged.put(entry.getKey(), update);
            }
        }
        return new SectionValue(merged);
    }
}
