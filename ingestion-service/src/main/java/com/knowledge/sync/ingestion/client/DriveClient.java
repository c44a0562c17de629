package com.knowledge.sync.ingestion.client;

import com.knowledge.sync.ingestion.model.ExternalFile;
import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google Drive REST v3: file listing and content download for one user's OAuth token.
 */
@Slf4j
@Component
public class DriveClient {

    static final String GOOGLE_APPS_PREFIX = "application/vnd.google-apps.";
    static final String FILE_FIELDS =
            "nextPageToken, files(id, name, mimeType, size, webViewLink, createdTime, modifiedTime)";

    private final RestClient restClient;
    private final int pageSize;

    public DriveClient(RestClient.Builder builder,
                       @Value(AppConstants.PROP_DRIVE_API_URL) String apiUrl,
                       @Value(AppConstants.PROP_DRIVE_PAGE_SIZE) int pageSize) {
        this.restClient = builder.baseUrl(apiUrl).build();
        this.pageSize = pageSize;
    }

    /**
     * Lists every non-trashed file, following {@code nextPageToken} until the last page.
     *
     * @param modifiedAfter only files modified strictly after this instant, or all files when {@code null}
     */
    public List<ExternalFile> listFiles(String accessToken, Instant modifiedAfter) {
        String query = modifiedAfter == null
                ? "trashed = false"
                : "trashed = false and modifiedTime > '" + modifiedAfter.truncatedTo(ChronoUnit.SECONDS) + "'";

        List<ExternalFile> files = new ArrayList<>();
        String pageToken = null;
        do {
            DriveFileList page = fetchPage(accessToken, query, pageToken);
            if (page == null) {
                break;
            }
            if (page.files() != null) {
                page.files().stream().map(DriveFile::toExternalFile).forEach(files::add);
            }
            pageToken = page.nextPageToken();
        } while (pageToken != null && !pageToken.isEmpty());

        log.info("Listed {} Drive file(s) modified after {}", files.size(), modifiedAfter);
        return files;
    }

    /**
     * Downloads the file bytes. Google Docs, Sheets and Slides have no binary form and are exported as plain text.
     */
    public byte[] download(String accessToken, ExternalFile file) {
        if (file.mimeType() != null && file.mimeType().startsWith(GOOGLE_APPS_PREFIX)) {
            return restClient.get()
                    .uri("/files/{id}/export?mimeType={mimeType}", file.id(), "text/plain")
                    .headers(headers -> headers.setBearerAuth(accessToken))
                    .retrieve()
                    .body(byte[].class);
        }
        return restClient.get()
                .uri("/files/{id}?alt=media", file.id())
                .headers(headers -> headers.setBearerAuth(accessToken))
                .retrieve()
                .body(byte[].class);
    }

    private DriveFileList fetchPage(String accessToken, String query, String pageToken) {
        String uri = pageToken == null
                ? "/files?q={q}&fields={fields}&pageSize={pageSize}"
                : "/files?q={q}&fields={fields}&pageSize={pageSize}&pageToken={pageToken}";
        Map<String, Object> variables = pageToken == null
                ? Map.of("q", query, "fields", FILE_FIELDS, "pageSize", pageSize)
                : Map.of("q", query, "fields", FILE_FIELDS, "pageSize", pageSize, "pageToken", pageToken);

        return restClient.get()
                .uri(uri, variables)
                .headers(headers -> headers.setBearerAuth(accessToken))
                .retrieve()
                .body(DriveFileList.class);
    }

    record DriveFileList(List<DriveFile> files, String nextPageToken) {
    }

    record DriveFile(String id, String name, String mimeType, Long size, String webViewLink,
                     Instant createdTime, Instant modifiedTime) {

        ExternalFile toExternalFile() {
            return new ExternalFile(id, name, mimeType, size, webViewLink, createdTime, modifiedTime);
        }
    }
}
