package com.colorcorrection.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Helpers shared by the request records.
 */
final class StageFlags {

    private StageFlags() {}

    static Set<CorrectionStage> toSet(boolean ffc, boolean gc, boolean wb, boolean cc) {
        EnumSet<CorrectionStage> stages = EnumSet.noneOf(CorrectionStage.class);
        if (ffc) stages.add(CorrectionStage.FFC);
        if (gc) stages.add(CorrectionStage.GC);
        if (wb) stages.add(CorrectionStage.WB);
        if (cc) stages.add(CorrectionStage.CC);
        return stages;
    }

    // WB has no request-level override
    static Map<CorrectionStage, Map<String, Object>> overrides(
            Map<String, Object> ffc, Map<String, Object> gc, Map<String, Object> cc) {
        Map<CorrectionStage, Map<String, Object>> overrides = new EnumMap<>(CorrectionStage.class);
        if (ffc != null) overrides.put(CorrectionStage.FFC, ffc);
        if (gc != null) overrides.put(CorrectionStage.GC, gc);
        if (cc != null) overrides.put(CorrectionStage.CC, cc);
        return overrides;
    }
}
