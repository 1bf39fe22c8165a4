package com.npssenti.crawler.output;

public enum StoreOutcome {
    WRITTEN,
    /** Id already in the index, or the content key was already seen in this run */
    DUPLICATE,
    /** Quality score below the threshold; decided before the writer is consulted */
    REJECTED
}
