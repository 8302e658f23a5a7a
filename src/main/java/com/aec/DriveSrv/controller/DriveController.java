package com.aec.DriveSrv.controller;

import com.aec.DriveSrv.dto.DownloadRequest;
import com.aec.DriveSrv.dto.DownloadResultDto;
import com.aec.DriveSrv.dto.DriveFilesDto;
import com.aec.DriveSrv.dto.RootFolderDto;
import com.aec.DriveSrv.dto.RootFolderRequest;
import com.aec.DriveSrv.exception.InvalidRequestException;
import com.aec.DriveSrv.model.UserAccount;
import com.aec.DriveSrv.service.DriveImportService;
import com.aec.DriveSrv.service.UserAccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/drive")
@RequiredArgsConstructor
public class DriveController {

    private final DriveImportService drive;
    private final UserAccountService users;

    @PostMapping("/root-folder")
    public RootFolderDto setRootFolder(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody RootFolderRequest body) {
        UserAccount user = users.requireUser(jwt.getSubject());
        String folderId = drive.setRootFolder(user, body.folderId());
        return RootFolderDto.builder().ok(true).folderId(folderId).build();
    }

    @GetMapping("/root-folder")
    public RootFolderDto getRootFolder(@AuthenticationPrincipal Jwt jwt) {
        UserAccount user = users.requireUser(jwt.getSubject());
        return RootFolderDto.builder().folderId(user.getDriveRootFolderId()).build();
    }

    @GetMapping("/files")
    public DriveFilesDto listFiles(@AuthenticationPrincipal Jwt jwt) {
        UserAccount user = users.requireUser(jwt.getSubject());
        if (user.getDriveRootFolderId() == null) {
            return DriveFilesDto.builder()
                    .files(List.of())
                    .message("Set a root folder first (POST /drive/root-folder)")
                    .build();
        }
        return DriveFilesDto.builder().files(drive.listEligible(user)).build();
    }

    @PostMapping("/download")
    public DownloadResultDto download(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody DownloadRequest body) {
        UserAccount user = users.requireUser(jwt.getSubject());
        if (body.fileIds().isEmpty()) {
            return DownloadResultDto.builder().downloaded(List.of()).message("No file_ids provided").build();
        }
        if (user.getDriveRootFolderId() == null) {
            throw new InvalidRequestException("Set a root folder first (POST /drive/root-folder)");
        }
        return DownloadResultDto.builder().downloaded(drive.download(user, body.fileIds())).build();
    }
}
