package com.lux032.songresolver.model;

/**
 * 单个文件的识别流程状态
 * LOOKED_UP -> AUTO_ACCEPTED | NEEDS_REVIEW
 * NEEDS_REVIEW -> SKIPPED | MANUALLY_CORRECTED
 */
public enum ResolutionState {
    LOOKED_UP,
    AUTO_ACCEPTED,
    NEEDS_REVIEW,
    SKIPPED,
    MANUALLY_CORRECTED;

    public boolean isTerminal() {
        return this == AUTO_ACCEPTED || this == SKIPPED || this == MANUALLY_CORRECTED;
    }
}
