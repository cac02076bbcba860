package org.iceforge.s3handler.s3.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;

import java.util.*;

/**
 * Chooses an {@link S3ClientProvider} for a {@link S3ProviderConfig} and asks it for a client.
 */
public final class S3ClientFactory {
    private static final Logger log = LoggerFactory.getLogger(S3ClientFactory.class);

    private final List<S3ClientProvider> providers;

    public S3ClientFactory(Collection<S3ClientProvider> injectedProviders) {
        List<S3ClientProvider> injected = injectedProviders == null ? List.of() : List.copyOf(injectedProviders);

        List<S3ClientProvider> fromServiceLoader = ServiceLoader.load(S3ClientProvider.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        // Merge by id, injected wins if same id
        Map<String, S3ClientProvider> merged = new LinkedHashMap<>();
        for (S3ClientProvider p : fromServiceLoader) merged.put(p.id(), p);
        for (S3ClientProvider p : injected) merged.put(p.id(), p);

        this.providers = List.copyOf(merged.values());

        log.info("Discovered S3ClientProviders: {}", this.providers.stream().map(S3ClientProvider::id).toList());
    }

    public ResolvedS3 resolve(S3ProviderConfig cfg) {
        S3ClientContext ctx = new S3ClientContext(
                Optional.ofNullable(cfg.getRegion()),
                Optional.ofNullable(cfg.getEndpointOverride()),
                cfg.isPathStyleAccess(),
                cfg.getTags() == null ? Map.of() : Map.copyOf(cfg.getTags()),
                Optional.ofNullable(cfg.getApiTimeout())
        );

        String forced = cfg.getProvider();
        if (forced != null && !forced.isBlank()) {
            S3ClientProvider p = providers.stream()
                    .filter(x -> forced.equals(x.id()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException(
                            "Forced S3 provider '" + forced + "' not found. Available: " + ids()));

            log.info("Using forced S3 provider id='{}' with ctx={}", p.id(), safeCtx(ctx));
            return new ResolvedS3(p.id(), p.s3Client(ctx));
        }

        List<S3ClientProvider> matching = providers.stream()
                .filter(p -> p.supports(ctx))
                .toList();

        if (matching.isEmpty()) {
            throw new IllegalStateException("No S3ClientProvider supports ctx=" + safeCtx(ctx) + " providers=" + ids());
        }

        // Deterministic tie-break: if multiple support, pick lexicographically by id.
        S3ClientProvider chosen = matching.stream()
                .sorted(Comparator.comparing(S3ClientProvider::id))
                .findFirst()
                .orElseThrow();

        log.info("Using S3 provider id='{}' (matched {}) with ctx={}",
                chosen.id(), matching.stream().map(S3ClientProvider::id).toList(), safeCtx(ctx));

        return new ResolvedS3(chosen.id(), chosen.s3Client(ctx));
    }

    private List<String> ids() {
        return providers.stream().map(S3ClientProvider::id).sorted().toList();
    }

    private static String safeCtx(S3ClientContext ctx) {
        return "region=" + ctx.region().orElse("<default>")
                + ", endpointOverride=" + ctx.endpointOverride().map(Object::toString).orElse("<none>")
                + ", pathStyleAccess=" + ctx.pathStyleAccess()
                + ", tags=" + ctx.tags();
    }

    public record ResolvedS3(String providerId, S3Client s3) {}
}
