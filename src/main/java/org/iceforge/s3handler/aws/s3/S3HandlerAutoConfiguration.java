package org.iceforge.s3handler.aws.s3;

import org.iceforge.s3handler.s3.spi.S3ClientFactory;
import org.iceforge.s3handler.s3.spi.S3ClientProvider;
import org.iceforge.s3handler.s3.spi.S3ProviderConfig;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Wires an {@link S3Handler} from {@code s3handler.*} properties. Any bean defined by the application wins.
 */
@AutoConfiguration
@EnableConfigurationProperties({S3ProviderConfig.class, S3HandlerProperties.class})
public class S3HandlerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public S3ClientFactory s3ClientFactory(ObjectProvider<S3ClientProvider> providers) {
        return new S3ClientFactory(providers.orderedStream().toList());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public S3Client s3Client(S3ClientFactory factory, S3ProviderConfig cfg) {
        return factory.resolve(cfg).s3();
    }

    @Bean
    @ConditionalOnMissingBean
    public S3Handler s3Handler(S3Client s3Client, S3HandlerProperties props) {
        return new AwsSdkS3Handler(s3Client, props.keysPerPage(), props.dirsPerPage());
    }
}
