package com.purchasingpower.compliancekb.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Google Drive access for the document collection. A service account with read access to the
 * listed folders is used; files directly inside them are indexed.
 */
@Data
public class DriveProperties {

    @NotBlank
    private String baseUrl = "https://www.googleapis.com";

    /**
     * Path of the service account JSON key.
     */
    private String serviceAccountKeyPath;

    private List<String> folderIds = new ArrayList<>();

    @Min(1)
    private int timeoutSeconds = 120;

    /**
     * Larger files are reported as errors instead of being downloaded.
     */
    @Min(1)
    private long maxFileBytes = 50L * 1024 * 1024;

    private HttpRetryProperties retry = new HttpRetryProperties();

    public List<String> activeFolderIds() {
        return folderIds == null ? List.of() : folderIds.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
    }

    public boolean isConfigured() {
        return serviceAccountKeyPath != null && !serviceAccountKeyPath.isBlank() && !activeFolderIds().isEmpty();
    }
}
