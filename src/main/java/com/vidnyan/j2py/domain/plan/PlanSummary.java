package com.vidnyan.j2py.domain.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Unit-wide statistics, difficulty estimate and recommendations accompanying a plan.
 */
@Value
@Builder
public class PlanSummary {
    int totalClasses;
    int totalMethods;
    int totalFields;
    int totalImports;
    boolean inheritanceUsed;
    boolean interfacesUsed;
    boolean genericsUsed;
    Difficulty difficulty;
    @Singular
    List<String> recommendations;
}
