package com.aec.DriveSrv.drive;

import com.aec.DriveSrv.config.DriveProperties;

/**
 * One child entry of a folder listing, file or folder.
 */
public record DriveItem(String id, String name, String mimeType, Long size) {

    public boolean isFolder() {
        return DriveProperties.FOLDER_MIME_TYPE.equals(mimeType);
    }
}
