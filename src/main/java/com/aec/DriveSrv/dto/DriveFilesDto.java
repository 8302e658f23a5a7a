package com.aec.DriveSrv.dto;

import com.aec.DriveSrv.drive.DriveFile;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriveFilesDto {
    private List<DriveFile> files;
    private String message;
}
