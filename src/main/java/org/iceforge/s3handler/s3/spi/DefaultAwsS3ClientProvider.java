package org.iceforge.s3handler.s3.spi;

import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

/** Default provider.
 * <br>
 * Uses standard AWS SDK credential resolution (environment, profile, EC2/ECS roles, etc).
 */
public final class DefaultAwsS3ClientProvider implements S3ClientProvider {
    @Override public String id() { return "default"; }

    @Override
    public boolean supports(S3ClientContext context) {
        // default provider supports everything unless a more specific one claims it
        return true;
    }

    @Override
    public S3Client s3Client(S3ClientContext ctx) {
        var b = S3Client.builder()
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(ctx.pathStyleAccess())
                        .build());
        ctx.region().ifPresent(r -> b.region(Region.of(r)));
        ctx.endpointOverride().ifPresent(b::endpointOverride);
        ctx.apiTimeout().ifPresent(t -> b.overrideConfiguration(
                ClientOverrideConfiguration.builder().apiCallTimeout(t).build()));
        return b.build();
    }
}
