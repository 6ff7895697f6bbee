package com.purchasingpower.compliancekb.model.sync;

public enum SyncMode {
    /** Every record of the collection. */
    FULL,
    /** Only records modified after the stored watermark. */
    INCREMENTAL
}
