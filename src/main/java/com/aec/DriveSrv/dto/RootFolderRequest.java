package com.aec.DriveSrv.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RootFolderRequest(
        @JsonProperty("folder_id") @NotBlank @Size(max = 255) String folderId
) {
}
