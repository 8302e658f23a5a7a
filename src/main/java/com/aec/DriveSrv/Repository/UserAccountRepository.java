package com.aec.DriveSrv.Repository;

import com.aec.DriveSrv.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, String> {

    // column-scoped updates: a request holding an older copy of the row cannot overwrite other columns

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UserAccount u set u.encryptedAccessToken = :access, u.accessTokenExpiresAt = :expiresAt "
            + "where u.id = :id")
    int updateAccessToken(@Param("id") String id,
                          @Param("access") String encryptedAccessToken,
                          @Param("expiresAt") Instant expiresAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UserAccount u set u.encryptedAccessToken = :access, u.encryptedRefreshToken = :refresh, "
            + "u.accessTokenExpiresAt = :expiresAt where u.id = :id")
    int updateTokens(@Param("id") String id,
                     @Param("access") String encryptedAccessToken,
                     @Param("refresh") String encryptedRefreshToken,
                     @Param("expiresAt") Instant expiresAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UserAccount u set u.driveRootFolderId = :folderId where u.id = :id")
    int updateRootFolder(@Param("id") String id, @Param("folderId") String folderId);
}
