package com.vcc.governance.model;

public enum WindowType {
    /** Counter per {@code floor(now / window)}. */
    FIXED,
    /** Current window plus the weighted remainder of the previous one. */
    SLIDING
}
