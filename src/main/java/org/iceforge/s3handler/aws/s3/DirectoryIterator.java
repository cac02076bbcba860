package org.iceforge.s3handler.aws.s3;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Depth-first, pre-order walk over the common prefixes below a prefix.
 * <p>
 * Listing uses the '/' delimiter and continuation tokens. Each prefix being walked has a {@link Cursor}
 * on an explicit stack: a yielded prefix gets its own cursor pushed on top, so its whole subtree is produced
 * before the next sibling. A prefix has no more pages once a response comes back without a continuation token;
 * a page may be empty and still carry one.
 */
final class DirectoryIterator implements Iterator<String> {
    private static final Logger log = LoggerFactory.getLogger(DirectoryIterator.class);

    static final String DELIMITER = "/";

    private final S3Client s3;
    private final String bucket;
    private final Integer pageSize;
    private final Deque<Cursor> stack = new ArrayDeque<>();

    DirectoryIterator(S3Client s3, String bucket, String prefix, Integer pageSize) {
        this.s3 = Objects.requireNonNull(s3);
        this.bucket = Objects.requireNonNull(bucket);
        this.pageSize = pageSize;
        stack.push(new Cursor(prefix == null ? "" : prefix));
    }

    @Override
    public boolean hasNext() {
        while (!stack.isEmpty()) {
            Cursor top = stack.peek();
            if (!top.pending.isEmpty()) {
                return true;
            }
            if (top.hasMorePages()) {
                fetchPage(top);
            } else {
                stack.pop();
            }
        }
        return false;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more directories under s3://" + bucket);
        }
        String dir = stack.peek().pending.poll();
        stack.push(new Cursor(dir));
        return dir;
    }

    private void fetchPage(Cursor cursor) {
        ListObjectsV2Request.Builder req = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(cursor.prefix)
                .delimiter(DELIMITER);
        if (pageSize != null) req = req.maxKeys(pageSize);
        if (cursor.started) req = req.continuationToken(cursor.continuationToken);

        ListObjectsV2Response r = s3.listObjectsV2(req.build());

        if (r.commonPrefixes() != null) {
            for (CommonPrefix cp : r.commonPrefixes()) {
                cursor.pending.add(cp.prefix());
            }
        }
        cursor.started = true;
        cursor.continuationToken = r.nextContinuationToken();

        log.debug("Listed {} sub-prefixes under s3://{}/{} (more pages: {})",
                cursor.pending.size(), bucket, cursor.prefix, cursor.hasMorePages());
    }

    private static final class Cursor {
        private final String prefix;
        private final Deque<String> pending = new ArrayDeque<>();
        private boolean started;
        private String continuationToken;

        private Cursor(String prefix) {
            this.prefix = prefix;
        }

        private boolean hasMorePages() {
            return !started || (continuationToken != null && !continuationToken.isEmpty());
        }
    }
}
