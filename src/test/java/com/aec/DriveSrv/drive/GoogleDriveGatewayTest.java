package com.aec.DriveSrv.drive;

import com.aec.DriveSrv.config.DriveProperties;
import com.aec.DriveSrv.exception.DriveProviderException;
import com.google.api.client.http.LowLevelHttpRequest;
import com.google.api.client.http.LowLevelHttpResponse;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoogleDriveGatewayTest {

    private final List<MockLowLevelHttpRequest> requests = new ArrayList<>();
    private Function<String, LowLevelHttpResponse> responder;
    private GoogleDriveGateway gateway;

    @BeforeEach
    void setUp() {
        DriveProperties props = new DriveProperties();
        props.setRootUrl("https://drive.test/");
        MockHttpTransport transport = new MockHttpTransport() {
            @Override
            public LowLevelHttpRequest buildRequest(String method, String url) {
                MockLowLevelHttpRequest request = new MockLowLevelHttpRequest(url) {
                    @Override
                    public LowLevelHttpResponse execute() throws IOException {
                        return responder.apply(getUrl());
                    }
                };
                requests.add(request);
                return request;
            }
        };
        gateway = new GoogleDriveGateway(transport, JacksonFactory.getDefaultInstance(), props);
    }

    @Test
    void listChildrenParsesPageAndSendsBearerToken() {
        responder = url -> json(200, "{\"nextPageToken\":\"p2\",\"files\":["
                + "{\"id\":\"a\",\"name\":\"a.pdf\",\"mimeType\":\"application/pdf\",\"size\":\"1024\"},"
                + "{\"id\":\"sub\",\"name\":\"sub\",\"mimeType\":\"application/vnd.google-apps.folder\"}]}");

        DriveListPage page = gateway.listChildren("access-1", "folder-1", null);

        assertThat(page.items()).containsExactly(
                new DriveItem("a", "a.pdf", "application/pdf", 1024L),
                new DriveItem("sub", "sub", DriveProperties.FOLDER_MIME_TYPE, null));
        assertThat(page.nextPageToken()).isEqualTo("p2");
        assertThat(page.hasNextPage()).isTrue();

        MockLowLevelHttpRequest request = requests.get(0);
        assertThat(request.getFirstHeaderValue("Authorization")).isEqualTo("Bearer access-1");
        String url = URLDecoder.decode(request.getUrl(), StandardCharsets.UTF_8);
        assertThat(url).startsWith("https://drive.test/drive/v3/files")
                .contains("'folder-1' in parents and trashed = false")
                .contains(GoogleDriveGateway.LIST_FIELDS);
    }

    @Test
    void listChildrenForwardsPageToken() {
        responder = url -> json(200, "{\"files\":[]}");

        DriveListPage page = gateway.listChildren("t", "folder-1", "p2");

        assertThat(page.items()).isEmpty();
        assertThat(page.hasNextPage()).isFalse();
        assertThat(requests.get(0).getUrl()).contains("pageToken=p2");
    }

    @Test
    void unauthorizedListIsFlagged() {
        responder = url -> json(401, "{\"error\":{\"code\":401,\"message\":\"Invalid Credentials\"}}");

        assertThatThrownBy(() -> gateway.listChildren("expired", "folder-1", null))
                .isInstanceOf(DriveProviderException.class)
                .satisfies(e -> assertThat(((DriveProviderException) e).isUnauthorized()).isTrue());
        assertThat(requests).hasSize(1);
    }

    @Test
    void serverErrorIsNotRetried() {
        responder = url -> json(503, "{\"error\":{\"code\":503,\"message\":\"Backend Error\"}}");

        assertThatThrownBy(() -> gateway.listChildren("t", "folder-1", null))
                .isInstanceOf(DriveProviderException.class)
                .satisfies(e -> assertThat(((DriveProviderException) e).getStatusCode()).isEqualTo(503));
        assertThat(requests).hasSize(1);
    }

    @Test
    void isFolderChecksMimeType() {
        responder = url -> url.contains("folder-1")
                ? json(200, "{\"id\":\"folder-1\",\"mimeType\":\"application/vnd.google-apps.folder\"}")
                : json(200, "{\"id\":\"doc-1\",\"mimeType\":\"application/pdf\"}");

        assertThat(gateway.isFolder("t", "folder-1")).isTrue();
        assertThat(gateway.isFolder("t", "doc-1")).isFalse();
    }

    @Test
    void missingFolderIsNotAFolder() {
        responder = url -> json(404, "{\"error\":{\"code\":404,\"message\":\"File not found\"}}");

        assertThat(gateway.isFolder("t", "gone")).isFalse();
    }

    @Test
    void unauthorizedFolderCheckPropagates() {
        responder = url -> json(401, "{\"error\":{\"code\":401,\"message\":\"Invalid Credentials\"}}");

        assertThatThrownBy(() -> gateway.isFolder("expired", "folder-1"))
                .isInstanceOf(DriveProviderException.class)
                .satisfies(e -> assertThat(((DriveProviderException) e).isUnauthorized()).isTrue());
    }

    @Test
    void openContentStreamsMediaBytes() throws IOException {
        byte[] body = "%PDF-1.7 body".getBytes(StandardCharsets.UTF_8);
        responder = url -> new MockLowLevelHttpResponse()
                .setStatusCode(200)
                .setContentType("application/pdf")
                .setContent(body);

        try (InputStream in = gateway.openContent("t", "file-1")) {
            assertThat(in.readAllBytes()).isEqualTo(body);
        }
        assertThat(requests.get(0).getUrl()).contains("/files/file-1").contains("alt=media");
    }

    @Test
    void transportFailureHasNoStatus() {
        MockHttpTransport failing = new MockHttpTransport() {
            @Override
            public LowLevelHttpRequest buildRequest(String method, String url) {
                return new MockLowLevelHttpRequest(url) {
                    @Override
                    public LowLevelHttpResponse execute() throws IOException {
                        throw new IOException("connection refused");
                    }
                };
            }
        };
        DriveProperties props = new DriveProperties();
        GoogleDriveGateway offline = new GoogleDriveGateway(failing, JacksonFactory.getDefaultInstance(), props);

        assertThatThrownBy(() -> offline.listChildren("t", "folder-1", null))
                .isInstanceOf(DriveProviderException.class)
                .satisfies(e -> assertThat(((DriveProviderException) e).getStatusCode())
                        .isEqualTo(DriveProviderException.NO_STATUS));
    }

    @Test
    void quotesInFolderIdAreEscaped() {
        assertThat(GoogleDriveGateway.escapeQueryLiteral("it's\\x")).isEqualTo("it\\'s\\\\x");
    }

    private static MockLowLevelHttpResponse json(int status, String body) {
        return new MockLowLevelHttpResponse()
                .setStatusCode(status)
                .setContentType("application/json; charset=UTF-8")
                .setContent(body);
    }
}
