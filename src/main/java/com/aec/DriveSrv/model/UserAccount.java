package com.aec.DriveSrv.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "users")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class UserAccount {
    // Google 'sub'
    @Id
    @Column(length = 255)
    private String id;

    @Column(nullable = false, unique = true)
    private String email;

    private String name;

    @Column(name = "encrypted_access_token", nullable = false, length = 2048)
    private String encryptedAccessToken;

    // Null when the provider did not grant offline access
    @Column(name = "encrypted_refresh_token", length = 2048)
    private String encryptedRefreshToken;

    @Column(name = "access_token_expires_at")
    private Instant accessTokenExpiresAt;

    /** Folder chosen by the user as the scan root; null until validated and set. */
    @Column(name = "drive_root_folder_id", length = 255)
    private String driveRootFolderId;
}
