package com.purchasingpower.compliancekb.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

    private String organizationId;
    private String question;
}
