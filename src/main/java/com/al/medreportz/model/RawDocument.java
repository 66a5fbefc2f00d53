package com.al.medreportz.model;

import lombok.Value;

/**
 * Text produced by the document decoder for one uploaded file.
 */
@Value
public class RawDocument {
    String text;
    String fileName;
    /** Language tag from an upstream detector; may be null. */
    String language;
}
