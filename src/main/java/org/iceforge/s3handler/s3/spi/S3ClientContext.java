package org.iceforge.s3handler.s3.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * What a provider needs to know to build a client, without the handler knowing how credentials,
 * proxies or private endpoints are obtained.
 * <br>
 * Providers may interpret {@code tags} any way they want (e.g. "profile"="prod-grid"); the handler doesn't.
 * @param region
 * @param endpointOverride
 * @param pathStyleAccess
 * @param tags
 * @param apiTimeout
 */
public record S3ClientContext(
        Optional<String> region,          // sometimes provided, sometimes not
        Optional<URI> endpointOverride,   // for S3-compatible or private endpoints
        boolean pathStyleAccess,
        Map<String, String> tags,         // arbitrary selectors (env, app, etc.)
        Optional<Duration> apiTimeout
) {}
