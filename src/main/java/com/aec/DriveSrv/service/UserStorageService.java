package com.aec.DriveSrv.service;

import com.aec.DriveSrv.config.DriveProperties;
import com.aec.DriveSrv.exception.StorageException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * Per-user filesystem namespace: {@code <storageRoot>/users/user_<id>/...}.
 */
@Service
@RequiredArgsConstructor
public class UserStorageService {

    static final int MAX_FILENAME_LENGTH = 200;
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[\\\\/:*?\"<>|\\s]+");

    private final DriveProperties props;

    /** Resolves and creates the directory on demand. */
    public Path userDirectory(String userId, String... parts) {
        Path dir = Paths.get(props.getStorageRoot(), "users", "user_" + safeFilename(userId));
        for (String part : parts) {
            dir = dir.resolve(part);
        }
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Could not create storage directory for user " + userId, e);
        }
    }

    /** Replaces path separators, reserved characters and whitespace with '_' and caps the length. */
    public static String safeFilename(String name) {
        if (name == null) {
            return "unnamed";
        }
        String safe = UNSAFE_CHARS.matcher(name).replaceAll("_");
        if (safe.length() > MAX_FILENAME_LENGTH) {
            safe = safe.substring(0, MAX_FILENAME_LENGTH);
        }
        if (safe.isEmpty() || safe.equals(".") || safe.equals("..")) {
            return "unnamed";
        }
        return safe;
    }
}
