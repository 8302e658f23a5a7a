package com.aec.DriveSrv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DownloadResultDto {
    private List<String> downloaded; // basenames under drive/raw
    private String message;
}
