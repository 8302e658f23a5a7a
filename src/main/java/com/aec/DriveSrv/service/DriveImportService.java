package com.aec.DriveSrv.service;

import com.aec.DriveSrv.config.DriveProperties;
import com.aec.DriveSrv.drive.DriveFile;
import com.aec.DriveSrv.drive.DriveGateway;
import com.aec.DriveSrv.exception.InvalidRequestException;
import com.aec.DriveSrv.model.UserAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root folder selection, eligible-file listing and batch download for one user.
 * Every Drive access goes through {@link DriveCallRunner} for the 401 retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriveImportService {

    static final String ROOT_FOLDER_REQUIRED = "Set a root folder first (POST /drive/root-folder)";

    private final DriveCallRunner calls;
    private final DriveGateway gateway;
    private final RecursiveDriveScanner scanner;
    private final DriveDownloadExecutor downloader;
    private final UserStorageService storage;
    private final UserAccountService users;
    private final DriveProperties props;

    public String setRootFolder(UserAccount user, String folderId) {
        String trimmed = folderId == null ? "" : folderId.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidRequestException("folder_id cannot be empty");
        }
        boolean valid = calls.run(user, token -> gateway.isFolder(token, trimmed));
        if (!valid) {
            throw new InvalidRequestException("Folder not found or not a folder; check the ID and your Drive access");
        }
        users.updateRootFolder(user, trimmed);
        log.info("Root folder set -> user={}, folder={}", user.getId(), trimmed);
        return trimmed;
    }

    /** Eligible files under the root folder; the user must have one set. */
    public List<DriveFile> listEligible(UserAccount user) {
        String root = user.getDriveRootFolderId();
        if (root == null) {
            throw new InvalidRequestException(ROOT_FOLDER_REQUIRED);
        }
        return calls.run(user, token -> scanner.scan(token, root));
    }

    /**
     * Downloads the requested files one at a time into {@code drive/raw}. Every id must
     * belong to a fresh scan of the root folder. The first failure aborts the rest.
     */
    public List<String> download(UserAccount user, List<String> fileIds) {
        if (fileIds.size() > props.getMaxDownloadFiles()) {
            throw new InvalidRequestException("At most " + props.getMaxDownloadFiles() + " files per request");
        }
        List<DriveFile> eligible = listEligible(user);

        Map<String, DriveFile> byId = new LinkedHashMap<>();
        for (DriveFile f : eligible) {
            byId.put(f.getId(), f);
        }
        for (String id : fileIds) {
            if (!byId.containsKey(id)) {
                throw new InvalidRequestException("File " + id + " is not an eligible file under your root folder");
            }
        }

        Path rawDir = storage.userDirectory(user.getId(), "drive", "raw");
        long ceiling = props.getMaxEligibleFileSizeBytes();
        List<String> downloaded = new ArrayList<>();
        for (String id : fileIds) {
            Path destination = rawDir.resolve(UserStorageService.safeFilename(byId.get(id).getName()));
            downloaded.add(calls.run(user, token -> downloader.download(token, id, destination, ceiling)));
        }
        log.info("Drive batch download OK -> user={}, files={}", user.getId(), downloaded.size());
        return downloaded;
    }
}
