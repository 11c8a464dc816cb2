package com.eainde.extraction.pipeline;

import com.eainde.extraction.model.CandidateRecord;
import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.model.Placeholders;
import com.eainde.extraction.model.SectionValue;
import com.eainde.extraction.model.TextListValue;
import com.eainde.extraction.model.TextValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the externally visible record: placeholder text, blank list items,
 * empty lists and empty sections are removed at every depth. The reserved
 * {@value ExtractionResult#METADATA_KEY} subtree is kept as is.
 */
public class RecordFinalizer {

    public CandidateRecord finalizeRecord(CandidateRecord record) {
        return new CandidateRecord(clean(record.root()));
    }

    private SectionValue clean(SectionValue section) {
        Map<String, FieldValue> kept = new LinkedHashMap<>();
        for (Map.Entry<String, FieldValue> entry : section.fields().entrySet()) {
            if (ExtractionResult.METADATA_KEY.equals(entry.getKey())) {
                kept.put(entry.getKey(), entry.getValue());
                continue;
            }
            FieldValue cleaned = clean(entry.getValue());
            if (!isDroppable(cleaned)) {
                kept.put(entry.getKey(), cleaned);
            }
        }
        return new SectionValue(kept);
    }

    private FieldValue clean(FieldValue value) {
        if (value instanceof SectionValue section) {
            return clean(section);
        }
        if (value instanceof TextListValue list) {
            List<String> items = list.values().stream()
                    .filter(item -> item != null && !item.isBlank())
                    .toList();
            return new TextListValue(items);
        }
        return value;
    }

    private static boolean isDroppable(FieldValue value) {
        if (value instanceof TextValue text) {
            return Placeholders.isCleanupToken(text.value());
        }
        return value.isEmpty();
    }
}
