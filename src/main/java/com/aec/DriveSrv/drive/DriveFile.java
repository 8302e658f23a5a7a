package com.aec.DriveSrv.drive;


import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Eligible file found by a scan. {@code size} is null when Drive did not declare one;
 * the real size is enforced while downloading.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DriveFile {
    private String id;
    private String name;
    private String mimeType;
    private Long size;
}
