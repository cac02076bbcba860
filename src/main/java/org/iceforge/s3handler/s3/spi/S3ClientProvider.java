package org.iceforge.s3handler.s3.spi;

import software.amazon.awssdk.services.s3.S3Client;

/**
 * Pluggable source of {@link S3Client} instances, so the handler never knows how credentials/roles/proxies
 * are obtained. It just asks: "give me an S3Client configured for this environment."
 * <br>
 * Implementations can be Spring beans or be listed in
 * <pre>
 * META-INF/services/org.iceforge.s3handler.s3.spi.S3ClientProvider
 * </pre>
 */
public interface S3ClientProvider {

    /** A stable ID for logging/diagnostics (e.g., "default", "minio", "corp-iam"). */
    String id();

    /** Return true if this provider should be used for the given context. */
    boolean supports(S3ClientContext context);

    /** Create or return an S3Client. Provider owns its caching/lifecycle strategy. */
    S3Client s3Client(S3ClientContext context);
}
