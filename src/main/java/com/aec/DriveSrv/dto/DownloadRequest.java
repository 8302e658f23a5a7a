package com.aec.DriveSrv.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record DownloadRequest(
        @JsonProperty("file_ids") @NotNull List<String> fileIds
) {
}
