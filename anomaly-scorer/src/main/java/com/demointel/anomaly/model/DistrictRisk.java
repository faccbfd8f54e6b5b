package com.demointel.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the district ranking: SEVERE records only.
 */
@Value
@Builder
public class DistrictRisk {

    String district;
    long severeCases;
    double avgImpact;

    /** Most frequent reason among the district's SEVERE records. */
    String dominantReason;
}
