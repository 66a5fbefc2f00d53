package com.al.medreportz.service.extractor;

public interface FieldExtractor<T> {
    /**
     * Extracts one group of fields from normalized report text.
     * Implementations never throw for missing or malformed fields; they return
     * an empty / partially null result instead.
     *
     * @param text Normalized report text
     * @return Extracted fields, never null
     */
    T extract(String text);
}
