package io.fedfetch.http.download;

import java.io.IOException;

/**
 * Object storage used for {@code s3://} URLs. Implementations live outside this library.
 */
public interface BlobStore {

    byte[] getObject(String bucket, String key) throws IOException;
}
