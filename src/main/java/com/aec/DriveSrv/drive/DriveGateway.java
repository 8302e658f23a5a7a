package com.aec.DriveSrv.drive;

import java.io.InputStream;

/**
 * Read-only view of the Drive API used by the scanner and the download executor.
 * Every call takes the bearer token explicitly and fails with
 * {@link com.aec.DriveSrv.exception.DriveProviderException} on a provider error.
 */
public interface DriveGateway {

    /** One page of the non-trashed children of {@code folderId}; {@code pageToken} null for the first page. */
    DriveListPage listChildren(String accessToken, String folderId, String pageToken);

    /** True if the id names an existing folder the token can see, false on 404 or a non-folder. */
    boolean isFolder(String accessToken, String folderId);

    /** Raw content stream of a file; the caller closes it. */
    InputStream openContent(String accessToken, String fileId);
}
