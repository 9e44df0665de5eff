package com.example.truingup.engine;

/** Flags the engine attaches to {@code metadata.flags}. */
public final class AuditFlags {

    public static final String HIGH_ANOMALY = "HIGH_ANOMALY_FLAG";
    public static final String UNVERIFIED_DATA = "UNVERIFIED_DATA_WARNING";
    public static final String ACTUAL_PENDING_EXTRACTION = "ACTUAL_PENDING_EXTRACTION";

    /** Strictly above this external anomaly score the record is flagged. */
    public static final double HIGH_ANOMALY_THRESHOLD = 0.8;

    private AuditFlags() {}
}
