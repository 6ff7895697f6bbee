package com.purchasingpower.compliancekb.api;

import com.purchasingpower.compliancekb.model.sync.SyncMode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    private String organizationId;

    /**
     * Defaults to INCREMENTAL.
     */
    private SyncMode mode;
}
