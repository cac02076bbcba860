package org.iceforge.s3handler.aws.s3;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Convenience operations on objects and bucket prefixes.
 * <p>
 * Failures of the underlying storage client are not translated; whatever the client throws reaches the caller.
 */
public interface S3Handler {

    // Read / write
    default String readFile(String bucket, String key) {
        return readFile(bucket, key, StandardCharsets.UTF_8);
    }
    String readFile(String bucket, String key, Charset charset);
    byte[] readBytes(String bucket, String key);

    default void writeFile(String bucket, String key, String content) {
        writeFile(bucket, key, content, StandardCharsets.UTF_8);
    }
    void writeFile(String bucket, String key, String content, Charset charset);
    void writeBytes(String bucket, String key, byte[] content);

    // Copy / delete
    void copyFile(String srcBucket, String srcKey, String trgBucket, String trgKey);
    void deleteFile(String bucket, String key);

    // Local files
    /** Missing parent directories of {@code localFile} are created first; an existing file is replaced. */
    void downloadFile(String bucket, String key, Path localFile) throws IOException;
    void uploadFile(String bucket, String key, Path localFile) throws IOException;

    // Metadata
    long getFileSize(String bucket, String key);
    List<String> listBuckets();

    // Iteration
    default Iterator<String> iterateDirs(String bucket) {
        return iterateDirs(bucket, "");
    }

    /**
     * Every "directory" (common prefix ending in '/') under {@code prefix}, at any depth,
     * depth-first in pre-order. Pages are fetched on demand.
     */
    Iterator<String> iterateDirs(String bucket, String prefix);

    default Iterator<String> iterateKeys(String bucket) {
        return iterateKeys(bucket, "");
    }

    /** Every key starting with {@code prefix}, in listing order. Pages are fetched on demand. */
    Iterator<String> iterateKeys(String bucket, String prefix);

    default Stream<String> streamDirs(String bucket, String prefix) {
        return lazyStream(iterateDirs(bucket, prefix));
    }

    default Stream<String> streamKeys(String bucket, String prefix) {
        return lazyStream(iterateKeys(bucket, prefix));
    }

    private static Stream<String> lazyStream(Iterator<String> it) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }
}
