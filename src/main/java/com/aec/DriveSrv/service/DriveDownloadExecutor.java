package com.aec.DriveSrv.service;

import com.aec.DriveSrv.drive.DriveGateway;
import com.aec.DriveSrv.exception.DriveProviderException;
import com.aec.DriveSrv.exception.SizeExceededException;
import com.aec.DriveSrv.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Streams one Drive file to local storage.
 *
 * <p>Bytes go to a hidden {@code .part} sibling and are counted after every chunk;
 * the file only appears under its final name once the whole stream is in. Passing
 * the byte ceiling or any read/write failure removes the partial file before the
 * error propagates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriveDownloadExecutor {

    static final int CHUNK_SIZE = 8192;
    static final int MAX_NAME_SUFFIX = 99;

    private final DriveGateway gateway;

    /**
     * @return basename actually written; differs from {@code destination} when that name was taken
     */
    public String download(String accessToken, String fileId, Path destination, long byteCeiling) {
        Path partial = createPartial(destination);

        long written;
        Path target;
        try {
            try (InputStream in = gateway.openContent(accessToken, fileId)) {
                written = copyWithCeiling(in, partial, byteCeiling);
            } catch (IOException e) {
                // closing the provider stream
                throw new DriveProviderException(DriveProviderException.NO_STATUS,
                        "Drive content stream failed for " + fileId, e);
            }
            target = moveIntoPlace(partial, destination);
        } catch (RuntimeException e) {
            discard(partial, e);
            if (e instanceof SizeExceededException) {
                log.warn("Drive.download aborted -> id={}, ceiling={} bytes", fileId, byteCeiling);
            }
            throw e;
        }

        log.info("Drive.download OK -> id={}, file={}, bytes={}", fileId, target.getFileName(), written);
        return target.getFileName().toString();
    }

    /**
     * Returns {@code destination} if free, else {@code base_N.ext} for the first free N below
     * {@value #MAX_NAME_SUFFIX}, else {@code base_99.ext}.
     */
    static Path resolveAvailablePath(Path destination) {
        if (Files.notExists(destination)) {
            return destination;
        }
        for (int i = 1; i < MAX_NAME_SUFFIX; i++) {
            Path candidate = suffixed(destination, i);
            if (Files.notExists(candidate)) {
                return candidate;
            }
        }
        return suffixed(destination, MAX_NAME_SUFFIX);
    }

    private static Path suffixed(Path destination, int n) {
        String name = destination.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        return destination.resolveSibling(base + "_" + n + ext);
    }

    private long copyWithCeiling(InputStream in, Path partial, long byteCeiling) {
        byte[] buffer = new byte[CHUNK_SIZE];
        long total = 0;
        try (OutputStream out = Files.newOutputStream(partial)) {
            int read;
            while ((read = readChunk(in, buffer)) != -1) {
                total += read;
                if (total > byteCeiling) {
                    throw new SizeExceededException(byteCeiling, total);
                }
                out.write(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new StorageException("Could not write " + partial.getFileName(), e);
        }
        return total;
    }

    private static int readChunk(InputStream in, byte[] buffer) {
        try {
            return in.read(buffer);
        } catch (IOException e) {
            throw new DriveProviderException(DriveProviderException.NO_STATUS, "Drive content stream interrupted", e);
        }
    }

    /** Unique per call, so concurrent downloads of the same name never share a partial file. */
    private static Path createPartial(Path destination) {
        try {
            return Files.createTempFile(destination.getParent(), "." + destination.getFileName() + ".", ".part");
        } catch (IOException e) {
            throw new StorageException("Could not create partial file for " + destination.getFileName(), e);
        }
    }

    /**
     * Moves the finished file to the first free name. The move never replaces an
     * existing file, except at the last-resort {@code _99} name; a name taken by a
     * concurrent download after it was chosen sends us to the next free one.
     */
    private Path moveIntoPlace(Path partial, Path destination) {
        Path lastResort = suffixed(destination, MAX_NAME_SUFFIX);
        try {
            while (true) {
                Path target = resolveAvailablePath(destination);
                if (target.equals(lastResort)) {
                    Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
                    return target;
                }
                try {
                    Files.move(partial, target);
                    return target;
                } catch (FileAlreadyExistsException e) {
                    log.info("Drive.download -> {} was taken meanwhile, picking another name", target.getFileName());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Could not move download into place: " + destination.getFileName(), e);
        }
    }

    private void discard(Path partial, RuntimeException cause) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warn("Could not remove partial download {}: {}", partial, e.getMessage());
            cause.addSuppressed(e);
        }
    }
}
