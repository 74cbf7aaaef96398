package io.fedfetch.http.download;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Destination of a download's bytes.
 */
@FunctionalInterface
public interface DownloadSink {

    void write(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Adapts an output stream. The stream is not closed by the downloader.
     */
    static DownloadSink of(OutputStream outputStream) {
        Objects.requireNonNull(outputStream, "outputStream");
        return outputStream::write;
    }
}
