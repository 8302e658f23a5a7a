package com.aec.DriveSrv.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Drive API endpoints, timeouts and the ceilings applied to scans and downloads.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "drive")
@Getter @Setter
public class DriveProperties {

    public static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";

    /** Root URL of the Drive REST API; the client appends {@code drive/v3/}. */
    @NotBlank
    private String rootUrl = "https://www.googleapis.com/";

    @Min(1)
    private int connectTimeoutMillis = 5_000;
    @Min(1)
    private int readTimeoutMillis = 60_000;
    /** Read timeout for content streams, longer than metadata calls. */
    @Min(1)
    private int downloadReadTimeoutMillis = 120_000;
    @Min(1)
    private int tokenConnectTimeoutMillis = 5_000;
    @Min(1)
    private int tokenReadTimeoutMillis = 30_000;

    @Min(0)
    private long maxEligibleFileSizeBytes = 52_428_800L;
    @Min(1)
    private int maxScanFolders = 1000;
    @Min(1)
    private int maxScanFiles = 5000;
    @Min(1)
    private int maxDownloadFiles = 20;

    @NotEmpty
    private List<String> eligibleMimeTypes = new ArrayList<>(List.of(
            "application/pdf",
            "application/epub+zip",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document"));

    /** Downloads land under {@code <storageRoot>/users/user_<id>/...}. */
    @NotBlank
    private String storageRoot = "storage";
}
