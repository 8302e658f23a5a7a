package com.aec.DriveSrv.drive;

import com.aec.DriveSrv.config.DriveProperties;
import com.aec.DriveSrv.exception.DriveProviderException;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;
import com.google.api.services.drive.model.FileList;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class GoogleDriveGateway implements DriveGateway {

    static final String APPLICATION_NAME = "AEC-DriveService";
    static final String LIST_FIELDS = "nextPageToken, files(id, name, mimeType, size)";

    private final HttpTransport transport;
    private final JsonFactory jsonFactory;
    private final DriveProperties props;
    private final Logger log = LoggerFactory.getLogger(GoogleDriveGateway.class);

    @Override
    public DriveListPage listChildren(String accessToken, String folderId, String pageToken) {
        String q = "'" + escapeQueryLiteral(folderId) + "' in parents and trashed = false";
        try {
            FileList result = drive(accessToken, props.getReadTimeoutMillis()).files().list()
                    .setQ(q)
                    .setFields(LIST_FIELDS)
                    .setPageToken(pageToken)
                    .execute();

            List<DriveItem> items = new ArrayList<>();
            if (result.getFiles() != null) {
                for (File f : result.getFiles()) {
                    items.add(new DriveItem(f.getId(), f.getName(), f.getMimeType(), f.getSize()));
                }
            }
            return new DriveListPage(items, result.getNextPageToken());
        } catch (IOException | IllegalArgumentException e) {
            throw providerError("Drive.list", folderId, e);
        }
    }

    @Override
    public boolean isFolder(String accessToken, String folderId) {
        try {
            File f = drive(accessToken, props.getReadTimeoutMillis()).files().get(folderId)
                    .setFields("id, mimeType")
                    .execute();
            return f != null && DriveProperties.FOLDER_MIME_TYPE.equals(f.getMimeType());
        } catch (HttpResponseException e) {
            if (e.getStatusCode() == 404) {
                log.info("Drive.get -> folder {} not found", folderId);
                return false;
            }
            throw providerError("Drive.get", folderId, e);
        } catch (IOException | IllegalArgumentException e) {
            throw providerError("Drive.get", folderId, e);
        }
    }

    @Override
    public InputStream openContent(String accessToken, String fileId) {
        try {
            return drive(accessToken, props.getDownloadReadTimeoutMillis()).files().get(fileId)
                    .executeMediaAsInputStream();
        } catch (IOException e) {
            throw providerError("Drive.media", fileId, e);
        }
    }

    /**
     * Client bound to one bearer token. Retries are disabled: the only recovery
     * for a failed call is the caller's single forced-refresh retry on 401.
     */
    private Drive drive(String accessToken, int readTimeoutMillis) {
        HttpRequestInitializer initializer = request -> {
            request.getHeaders().setAuthorization("Bearer " + accessToken);
            request.setConnectTimeout(props.getConnectTimeoutMillis());
            request.setReadTimeout(readTimeoutMillis);
            request.setNumberOfRetries(0);
        };

        return new Drive.Builder(transport, jsonFactory, initializer)
                .setRootUrl(props.getRootUrl())
                .setApplicationName(APPLICATION_NAME)
                .build();
    }

    private DriveProviderException providerError(String operation, String id, Exception e) {
        int status = (e instanceof HttpResponseException)
                ? ((HttpResponseException) e).getStatusCode()
                : DriveProviderException.NO_STATUS;
        if (status == 401) {
            log.info("{} -> 401 for id={}", operation, id);
        } else {
            log.error("{} ERROR id={}, status={}, message={}", operation, id, status, e.getMessage());
        }
        return new DriveProviderException(status, operation + " failed for " + id + " (status " + status + ")", e);
    }

    static String escapeQueryLiteral(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
