package com.cbd.merge;

/** How an override value is applied to the base configuration. */
public enum MergePolicy {

    /** Replace the base value; always recorded, even when equal. Default for scalars and lists. */
    REPLACE,

    /** Merge field by field into the base group, creating it when absent. Default for objects. */
    MERGE_FIELDS,

    /** Replace the whole group in one step, recorded as a single change. */
    REPLACE_ATOMIC,

    /** Like {@link #REPLACE}, except an empty string leaves the base value alone. */
    REPLACE_UNLESS_EMPTY
}
