package io.fedfetch.http.download;

import io.fedfetch.http.config.DownloadClientConfig;
import io.fedfetch.http.util.CredentialRedactor;
import io.fedfetch.http.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Resolves a URL to a local file, downloading it when needed.
 * <ul>
 *   <li>{@code file://} URLs map to their local path without any I/O.</li>
 *   <li>HTTP(S) URLs are downloaded through the {@link AuthenticatedDownloader} into a file
 *       named after the SHA-256 of the URL. An existing file is reused.</li>
 *   <li>{@code s3://} URLs are fetched from the {@link BlobStore}, when one is configured.</li>
 * </ul>
 */
public class FileRetriever {

    private static final Logger log = LoggerFactory.getLogger(FileRetriever.class);

    private static final String PARTIAL_SUFFIX = ".part";

    private final AuthenticatedDownloader downloader;
    private final BlobStore blobStore;
    private final String localHostname;
    private final String userAgent;

    public FileRetriever(AuthenticatedDownloader downloader, DownloadClientConfig config, BlobStore blobStore) {
        this(downloader, blobStore, config.getLocalHostname(), UserAgents.build(config, null));
    }

    /**
     * @param blobStore store for {@code s3://} URLs, may be null
     * @param localHostname replacement for {@code localhost} in URLs, may be null
     * @param userAgent User-Agent header for HTTP(S) downloads, may be null
     */
    public FileRetriever(AuthenticatedDownloader downloader, BlobStore blobStore, String localHostname,
                         String userAgent) {
        this.downloader = Objects.requireNonNull(downloader, "downloader");
        this.blobStore = blobStore;
        this.localHostname = localHostname;
        this.userAgent = userAgent;
    }

    public Path retrieve(String url, Path destinationDir, String credential, String data) throws IOException {
        return retrieve(url, destinationDir, credential, data, DownloadContext.empty());
    }

    /**
     * @return the local file holding the resource
     * @throws IllegalArgumentException for an unsupported URL scheme
     * @throws io.fedfetch.http.error.DownloadException if the download fails
     */
    public Path retrieve(String url, Path destinationDir, String credential, String data,
                         DownloadContext context) throws IOException {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(destinationDir, "destinationDir");

        if (UrlUtils.isFileUrl(url)) {
            return Paths.get(URI.create(url));
        }

        String resolvedUrl = UrlUtils.localhostUrl(url, localHostname);
        Path destination = destinationDir.resolve(UrlUtils.hashedFilename(resolvedUrl));
        String safeUrl = CredentialRedactor.redactUrl(resolvedUrl);

        if (Files.exists(destination)) {
            log.debug("{} already retrieved to {}", safeUrl, destination);
            return destination;
        }

        if (UrlUtils.isS3Url(resolvedUrl)) {
            return retrieveFromBlobStore(resolvedUrl, destinationDir, destination);
        }
        if (!UrlUtils.isHttp(resolvedUrl)) {
            throw new IllegalArgumentException("Unsupported URL scheme: " + safeUrl);
        }

        Files.createDirectories(destinationDir);
        Path partial = Files.createTempFile(destinationDir, destination.getFileName().toString(), PARTIAL_SUFFIX);
        try {
            try (OutputStream out = Files.newOutputStream(partial)) {
                downloader.download(resolvedUrl, credential, data, DownloadSink.of(out), userAgent, context)
                    .orThrow();
            }
            Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            deletePartial(partial);
            throw e;
        }

        log.info("Retrieved {} to {}", safeUrl, destination);
        return destination;
    }

    private Path retrieveFromBlobStore(String url, Path destinationDir, Path destination) throws IOException {
        if (blobStore == null) {
            throw new IllegalArgumentException("No blob store configured to retrieve " + url);
        }

        String location = url.substring("s3://".length());
        int slash = location.indexOf('/');
        if (slash <= 0 || slash == location.length() - 1) {
            throw new IllegalArgumentException("Expected s3://<bucket>/<key> but got " + url);
        }
        String bucket = location.substring(0, slash);
        String key = location.substring(slash + 1);

        byte[] content = blobStore.getObject(bucket, key);
        Files.createDirectories(destinationDir);
        Files.write(destination, content);
        log.info("Retrieved s3://{}/{} ({} bytes) to {}", bucket, key, content.length, destination);
        return destination;
    }

    private static void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warn("Unable to delete partial download {}: {}", partial, e.getMessage());
        }
    }
}
