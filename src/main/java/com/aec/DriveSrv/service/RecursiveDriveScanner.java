package com.aec.DriveSrv.service;

import com.aec.DriveSrv.config.DriveProperties;
import com.aec.DriveSrv.drive.DriveFile;
import com.aec.DriveSrv.drive.DriveGateway;
import com.aec.DriveSrv.drive.DriveItem;
import com.aec.DriveSrv.drive.DriveListPage;
import com.aec.DriveSrv.exception.ScanLimitExceededException;
import com.aec.DriveSrv.exception.ScanLimitExceededException.Ceiling;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks the folder graph under a root folder and collects eligible files.
 *
 * <p>Traversal uses an explicit stack and a visited set, so a folder reachable
 * through several parents (or through a cycle) is listed once. The folder ceiling
 * is checked before each listing, which bounds API calls; the file ceiling is
 * checked before each admission. Hitting either aborts the whole scan.
 * Result order follows discovery and is not stable across calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecursiveDriveScanner {

    private final DriveGateway gateway;
    private final DriveProperties props;

    public List<DriveFile> scan(String accessToken, String rootFolderId) {
        int maxFolders = props.getMaxScanFolders();
        int maxFiles = props.getMaxScanFiles();
        long maxBytes = props.getMaxEligibleFileSizeBytes();
        Set<String> eligibleTypes = Set.copyOf(props.getEligibleMimeTypes());

        List<DriveFile> result = new ArrayList<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        stack.push(rootFolderId);
        seen.add(rootFolderId);
        int foldersProcessed = 0;

        while (!stack.isEmpty()) {
            if (foldersProcessed >= maxFolders) {
                log.warn("Drive.scan aborted -> root={}, folder ceiling {} reached", rootFolderId, maxFolders);
                throw new ScanLimitExceededException(Ceiling.FOLDERS, maxFolders, foldersProcessed, result.size());
            }
            String folderId = stack.pop();
            foldersProcessed++;

            String pageToken = null;
            do {
                DriveListPage page = gateway.listChildren(accessToken, folderId, pageToken);
                for (DriveItem item : page.items()) {
                    if (item.id() == null || item.id().isBlank()) {
                        continue;
                    }
                    if (item.isFolder()) {
                        if (seen.add(item.id())) {
                            stack.push(item.id());
                        }
                        continue;
                    }
                    if (!eligibleTypes.contains(item.mimeType())) {
                        continue;
                    }
                    // unknown size passes here and is enforced on download
                    if (item.size() != null && item.size() > maxBytes) {
                        continue;
                    }
                    if (result.size() >= maxFiles) {
                        log.warn("Drive.scan aborted -> root={}, file ceiling {} reached", rootFolderId, maxFiles);
                        throw new ScanLimitExceededException(Ceiling.FILES, maxFiles, foldersProcessed, result.size());
                    }
                    String name = item.name() != null ? item.name() : "unknown";
                    result.add(new DriveFile(item.id(), name, item.mimeType(), item.size()));
                }
                pageToken = page.hasNextPage() ? page.nextPageToken() : null;
            } while (pageToken != null);
        }

        log.info("Drive.scan OK -> root={}, folders={}, eligibleFiles={}", rootFolderId, foldersProcessed, result.size());
        return result;
    }
}
