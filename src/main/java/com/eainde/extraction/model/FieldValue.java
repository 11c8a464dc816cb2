package com.eainde.extraction.model;

/**
 * A node of the extracted record tree.
 *
 * <p>Only three shapes are allowed to enter a {@link CandidateRecord}:</p>
 * <ul>
 *   <li>{@link TextValue}: a string leaf</li>
 *   <li>{@link TextListValue}: a list-of-strings leaf</li>
 *   <li>{@link SectionValue}: a named group of further nodes</li>
 * </ul>
 *
 * <p>Raw JSON coming back from the extraction capability is never stored
 * directly; it passes through
 * {@link com.eainde.extraction.consolidate.RecordCoercer} first.</p>
 */
public sealed interface FieldValue permits TextValue, TextListValue, SectionValue {

    /**
     * @return true if this value carries no usable information
     *         (placeholder text, empty list, empty section)
     */
    boolean isEmpty();
}
