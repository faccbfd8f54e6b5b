package com.demointel.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row as read from a registration extract, before any coercion.
 * All values are kept as the raw strings found in the file.
 */
@Value
@Builder
public class RawRecord {

    String date;
    String state;
    String district;
    String pincode;

    /** Count of registrations aged 5 to 17. */
    String demoAge5To17;

    /** Count of registrations aged 17 and above. */
    String demoAge17Plus;

    /** File the row came from, for diagnostics only. */
    String sourceFile;
}
