package com.purchasingpower.compliancekb.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Connection settings for the iTop REST endpoint ({@code webservices/rest.php}).
 */
@Data
public class ItopProperties {

    private String baseUrl;

    private String username;

    private String password;

    @NotBlank
    private String apiVersion = "1.3";

    @Min(1)
    private int timeoutSeconds = 120;

    /**
     * Zone of the timestamps iTop returns and expects in OQL ({@code yyyy-MM-dd HH:mm:ss}).
     */
    @NotBlank
    private String timeZone = "UTC";

    private HttpRetryProperties retry = new HttpRetryProperties();

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
