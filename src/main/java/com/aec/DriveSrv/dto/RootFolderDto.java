package com.aec.DriveSrv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RootFolderDto {
    private Boolean ok;
    @JsonProperty("folder_id")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String folderId;
}
