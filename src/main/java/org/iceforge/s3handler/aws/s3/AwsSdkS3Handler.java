package org.iceforge.s3handler.aws.s3;

import org.iceforge.s3handler.s3.spi.S3ClientFactory;
import org.iceforge.s3handler.s3.spi.S3ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * {@link S3Handler} backed by the AWS SDK v2 {@link S3Client}.
 * <p>
 * An injected client is not owned: closing it is the caller's business. A client built by {@link #create()}
 * belongs to the handler and is closed by {@link #close()}. SDK exceptions
 * ({@link S3Exception}, {@link NoSuchKeyException}, {@code SdkClientException}) are not caught here.
 */
public class AwsSdkS3Handler implements S3Handler, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AwsSdkS3Handler.class);

    /** Larger than the service default of 1000, so fewer round trips on S3-compatible stores that honour it. */
    public static final int DEFAULT_KEYS_PER_PAGE = 10_000;

    private final S3Client s3;
    private final int keysPerPage;
    private final Integer dirsPerPage;
    private final boolean ownsClient;

    public AwsSdkS3Handler(S3Client s3) {
        this(s3, DEFAULT_KEYS_PER_PAGE, null);
    }

    /**
     * @param keysPerPage {@code MaxKeys} for key iteration
     * @param dirsPerPage {@code MaxKeys} for directory iteration, or null for the service default
     */
    public AwsSdkS3Handler(S3Client s3, int keysPerPage, Integer dirsPerPage) {
        this(s3, keysPerPage, dirsPerPage, false);
    }

    private AwsSdkS3Handler(S3Client s3, int keysPerPage, Integer dirsPerPage, boolean ownsClient) {
        if (keysPerPage < 1) throw new IllegalArgumentException("keysPerPage must be positive: " + keysPerPage);
        if (dirsPerPage != null && dirsPerPage < 1) {
            throw new IllegalArgumentException("dirsPerPage must be positive: " + dirsPerPage);
        }
        this.s3 = Objects.requireNonNull(s3, "s3");
        this.keysPerPage = keysPerPage;
        this.dirsPerPage = dirsPerPage;
        this.ownsClient = ownsClient;
    }

    /** Handler over a client from the providers found on the classpath, with SDK defaults for region and credentials. */
    public static AwsSdkS3Handler create() {
        return create(new S3ProviderConfig());
    }

    public static AwsSdkS3Handler create(S3ProviderConfig cfg) {
        return create(new S3ClientFactory(List.of()), cfg);
    }

    /** The returned handler owns the resolved client; close the handler when done. */
    public static AwsSdkS3Handler create(S3ClientFactory factory, S3ProviderConfig cfg) {
        S3ClientFactory.ResolvedS3 resolved = factory.resolve(cfg);
        return new AwsSdkS3Handler(resolved.s3(), DEFAULT_KEYS_PER_PAGE, null, true);
    }

    /** Closes the client only if this handler created it. */
    @Override
    public void close() {
        if (ownsClient) {
            logger.debug("Closing owned S3 client");
            s3.close();
        }
    }

    @Override
    public String readFile(String bucket, String key, Charset charset) {
        Objects.requireNonNull(charset, "charset");
        return new String(readBytes(bucket, key), charset);
    }

    @Override
    public byte[] readBytes(String bucket, String key) {
        logger.debug("GET s3://{}/{}", bucket, key);
        return s3.getObjectAsBytes(GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build()).asByteArray();
    }

    @Override
    public void writeFile(String bucket, String key, String content, Charset charset) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(charset, "charset");
        writeBytes(bucket, key, content.getBytes(charset));
    }

    @Override
    public void writeBytes(String bucket, String key, byte[] content) {
        Objects.requireNonNull(content, "content");
        logger.debug("PUT s3://{}/{} ({} bytes)", bucket, key, content.length);
        s3.putObject(PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build(), RequestBody.fromBytes(content));
    }

    @Override
    public void copyFile(String srcBucket, String srcKey, String trgBucket, String trgKey) {
        logger.debug("COPY s3://{}/{} -> s3://{}/{}", srcBucket, srcKey, trgBucket, trgKey);
        s3.copyObject(CopyObjectRequest.builder()
                .sourceBucket(srcBucket)
                .sourceKey(srcKey)
                .destinationBucket(trgBucket)
                .destinationKey(trgKey)
                .build());
    }

    @Override
    public void downloadFile(String bucket, String key, Path localFile) throws IOException {
        Objects.requireNonNull(localFile, "localFile");
        Path parent = localFile.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }
        logger.debug("GET s3://{}/{} -> {}", bucket, key, localFile);
        // body goes to a sibling temp file so a failed transfer leaves an existing target untouched
        Path tmp = Files.createTempFile(parent, ".s3handler-", ".part");
        try {
            try (ResponseInputStream<GetObjectResponse> in = s3.getObject(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build())) {
                Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.move(tmp, localFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public void uploadFile(String bucket, String key, Path localFile) throws IOException {
        Objects.requireNonNull(localFile, "localFile");
        long size = Files.size(localFile);
        logger.debug("PUT {} -> s3://{}/{} ({} bytes)", localFile, bucket, key, size);
        try (InputStream in = Files.newInputStream(localFile)) {
            s3.putObject(PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentLength(size)
                    .build(), RequestBody.fromInputStream(in, size));
        }
    }

    @Override
    public void deleteFile(String bucket, String key) {
        logger.debug("DELETE s3://{}/{}", bucket, key);
        s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
    }

    @Override
    public long getFileSize(String bucket, String key) {
        HeadObjectResponse r = s3.headObject(HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build());
        return r.contentLength();
    }

    @Override
    public List<String> listBuckets() {
        ListBucketsResponse r = s3.listBuckets(ListBucketsRequest.builder().build());
        List<String> out = new ArrayList<>();
        if (r.buckets() != null) {
            for (Bucket b : r.buckets()) {
                out.add(b.name());
            }
        }
        return out;
    }

    @Override
    public Iterator<String> iterateDirs(String bucket, String prefix) {
        return new DirectoryIterator(s3, bucket, prefix, dirsPerPage);
    }

    @Override
    public Iterator<String> iterateKeys(String bucket, String prefix) {
        return new KeyIterator(s3, bucket, prefix, keysPerPage);
    }
}
