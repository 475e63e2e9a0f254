package com.claude.patternlearning.store;

public enum StoreOutcome {
    /** History appended and the current pattern replaced. */
    PROMOTED,
    /** History appended only; the previous current pattern, if any, stays in place. */
    RETAINED_PREVIOUS
}
