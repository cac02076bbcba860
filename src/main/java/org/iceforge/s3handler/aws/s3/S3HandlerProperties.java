package org.iceforge.s3handler.aws.s3;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Listing page sizes.
 * @param keysPerPage {@code MaxKeys} sent by key iteration
 * @param dirsPerPage {@code MaxKeys} sent by directory iteration; unset leaves it to the service (1000)
 */
@ConfigurationProperties(prefix = "s3handler.listing")
public record S3HandlerProperties(
        @DefaultValue("10000") int keysPerPage,
        Integer dirsPerPage
) {}
