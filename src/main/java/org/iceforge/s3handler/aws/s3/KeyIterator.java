package org.iceforge.s3handler.aws.s3;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Flat walk over all keys below a prefix, paged with {@code StartAfter} set to the last key of the previous page.
 * Iteration ends when a page reports {@code IsTruncated=false}, however many keys it carried.
 */
final class KeyIterator implements Iterator<String> {
    private static final Logger log = LoggerFactory.getLogger(KeyIterator.class);

    private final S3Client s3;
    private final String bucket;
    private final String prefix;
    private final int pageSize;
    private final Deque<String> pending = new ArrayDeque<>();
    private String startAfter;
    private boolean truncated = true;

    KeyIterator(S3Client s3, String bucket, String prefix, int pageSize) {
        if (pageSize < 1) throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        this.s3 = Objects.requireNonNull(s3);
        this.bucket = Objects.requireNonNull(bucket);
        this.prefix = prefix == null ? "" : prefix;
        this.pageSize = pageSize;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && truncated) {
            fetchPage();
        }
        return !pending.isEmpty();
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more keys under s3://" + bucket + "/" + prefix);
        }
        return pending.poll();
    }

    private void fetchPage() {
        ListObjectsV2Request.Builder req = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .maxKeys(pageSize);
        if (startAfter != null && !startAfter.isEmpty()) req = req.startAfter(startAfter);

        ListObjectsV2Response r = s3.listObjectsV2(req.build());

        String last = null;
        if (r.contents() != null) {
            for (S3Object o : r.contents()) {
                pending.add(o.key());
                last = o.key();
            }
        }
        truncated = Boolean.TRUE.equals(r.isTruncated());
        if (truncated) {
            if (last == null) {
                throw new IllegalStateException("Truncated listing without keys for s3://" + bucket + "/" + prefix
                        + " after '" + startAfter + "'");
            }
            startAfter = last;
        }

        log.debug("Listed {} keys under s3://{}/{} (truncated: {})", pending.size(), bucket, prefix, truncated);
    }
}
