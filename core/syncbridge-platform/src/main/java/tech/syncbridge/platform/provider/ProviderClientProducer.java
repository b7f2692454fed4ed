package tech.syncbridge.platform.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.integration.ProviderType;

import java.net.http.HttpClient;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Builds the provider registry from configured endpoints.
 */
@ApplicationScoped
public class ProviderClientProducer {

    private static final Logger LOG = Logger.getLogger(ProviderClientProducer.class);

    @Inject
    ProviderConfig config;

    @Inject
    ObjectMapper objectMapper;

    private final ExecutorService httpExecutor = Executors.newFixedThreadPool(4, runnable -> {
        Thread thread = new Thread(runnable, "provider-http");
        thread.setDaemon(true);
        return thread;
    });

    @Produces
    @Singleton
    ProviderRateLimiters rateLimiters() {
        Map<ProviderType, ProviderRateLimiters.Limit> limits = new EnumMap<>(ProviderType.class);
        for (ProviderType type : ProviderType.values()) {
            ProviderRateLimiters.Limit fallback = ProviderRateLimiters.DEFAULT_LIMITS.get(type);
            ProviderConfig.Endpoint endpoint = config.endpoints().get(type.getValue());
            if (endpoint == null) {
                limits.put(type, fallback);
                continue;
            }
            limits.put(type, new ProviderRateLimiters.Limit(
                endpoint.rateLimit().orElse(fallback.limitForPeriod()),
                endpoint.ratePeriod().orElse(fallback.period())));
        }
        return new ProviderRateLimiters(limits);
    }

    @Produces
    @Singleton
    ProviderRegistry providerRegistry(ProviderRateLimiters rateLimiters) {
        HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(config.connectTimeout())
            .executor(httpExecutor)
            .build();

        Map<ProviderType, ProviderClient> clients = new EnumMap<>(ProviderType.class);
        config.endpoints().forEach((name, endpoint) -> {
            ProviderType type = ProviderType.fromValue(name);
            endpoint.baseUrl().ifPresentOrElse(
                url -> clients.put(type, new HttpProviderClient(
                    type, url, httpClient, objectMapper, rateLimiters, config.requestTimeout())),
                () -> LOG.warnf("Provider [%s] has no base-url configured, syncs for it will fail", name));
        });
        LOG.infof("Provider clients configured for %s", clients.keySet());
        return new ProviderRegistry(clients);
    }

    @PreDestroy
    void shutdown() {
        httpExecutor.shutdownNow();
    }
}
