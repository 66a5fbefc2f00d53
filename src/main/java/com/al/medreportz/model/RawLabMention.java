package com.al.medreportz.model;

import lombok.Value;

/**
 * A candidate lab finding before resolution: the label as printed, the first
 * numeric value on its line and the unit seen on that line ("Unknown" if none).
 */
@Value
public class RawLabMention {
    String label;
    double value;
    String unit;
}
