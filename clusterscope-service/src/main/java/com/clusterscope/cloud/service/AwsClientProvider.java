package com.clusterscope.cloud.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.eks.EksClient;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Hands out region-scoped AWS clients that share one credentials provider.
 * <p>
 * Clients and their provider live in one {@link ClientCache} generation that is swapped as a whole.
 * An expired generation is retired and closed one refresh interval later, so calls still running on
 * its clients can finish. {@link #clearClientCache()} closes the old generation right away.
 */
@Service
public class AwsClientProvider {

    private static final Logger logger = LoggerFactory.getLogger(AwsClientProvider.class);

    private final String accessKeyId;
    private final String secretAccessKey;
    private final String sessionToken;
    private final String profile;
    private final Duration refreshInterval;
    private final Clock clock;

    private final AtomicReference<ClientCache> cache;
    private final Queue<ClientCache> retired = new ConcurrentLinkedQueue<>();

    public AwsClientProvider(@Value("${clusterscope.aws.access-key-id:}") String accessKeyId,
                             @Value("${clusterscope.aws.secret-access-key:}") String secretAccessKey,
                             @Value("${clusterscope.aws.session-token:}") String sessionToken,
                             @Value("${clusterscope.aws.profile:}") String profile,
                             @Value("${clusterscope.aws.credential-refresh-interval:5m}") Duration refreshInterval) {
        this(accessKeyId, secretAccessKey, sessionToken, profile, refreshInterval, Clock.systemUTC());
    }

    AwsClientProvider(String accessKeyId, String secretAccessKey, String sessionToken, String profile,
                      Duration refreshInterval, Clock clock) {
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
        this.sessionToken = sessionToken;
        this.profile = profile;
        this.refreshInterval = refreshInterval;
        this.clock = clock;
        this.cache = new AtomicReference<>(newCache());
        logger.info("AwsClientProvider initialized (static credentials: {}, profile: {})",
                hasStaticCredentials(), StringUtils.hasText(profile) ? profile : "default");
    }

    public Ec2Client getEc2Client(String region) {
        return getClient(Ec2Client.class, Ec2Client::builder, region);
    }

    public EksClient getEksClient(String region) {
        return getClient(EksClient.class, EksClient::builder, region);
    }

    public StsClient getStsClient(String region) {
        return getClient(StsClient.class, StsClient::builder, region);
    }

    /**
     * Starts a new client generation and closes the previous ones. SDK-level caches outside
     * these objects (for example an SSO token file) are not touched.
     */
    public void clearClientCache() {
        ClientCache previous = cache.getAndSet(newCache());
        logger.info("Clearing AWS client cache ({} clients)", previous.clients.size());
        previous.close();
        ClientCache old;
        while ((old = retired.poll()) != null) {
            old.close();
        }
    }

    int cachedClientCount() {
        return cache.get().clients.size();
    }

    int retiredCacheCount() {
        return retired.size();
    }

    AwsCredentialsProvider getCredentialsProvider() {
        return currentCache().credentialsProvider;
    }

    <BuilderT extends AwsClientBuilder<BuilderT, ClientT>, ClientT extends SdkClient> ClientT getClient(
            Class<ClientT> clientClass, Supplier<BuilderT> builder, String region) {
        String key = clientClass.getSimpleName() + "-" + region;
        while (true) {
            ClientCache current = currentCache();
            SdkClient client = current.clients.computeIfAbsent(key, k -> {
                logger.debug("Creating {} in region {}", clientClass.getSimpleName(), region);
                return builder.get()
                        .credentialsProvider(current.credentialsProvider)
                        .region(Region.of(region))
                        .build();
            });
            if (!current.closed) {
                return clientClass.cast(client);
            }
            // the generation was cleared while this client was being built
            if (current.clients.remove(key, client)) {
                closeQuietly(client);
            }
        }
    }

    private ClientCache currentCache() {
        ClientCache current = cache.get();
        Instant now = clock.instant();
        if (Duration.between(current.createdAt, now).compareTo(refreshInterval) <= 0) {
            return current;
        }
        ClientCache fresh = newCache();
        if (cache.compareAndSet(current, fresh)) {
            logger.debug("AWS client cache is older than {}, starting a new generation", refreshInterval);
            current.retiredAt = now;
            retired.add(current);
            closeRetiredBefore(now.minus(refreshInterval));
            return fresh;
        }
        fresh.close();
        return cache.get();
    }

    private void closeRetiredBefore(Instant cutoff) {
        Iterator<ClientCache> iterator = retired.iterator();
        while (iterator.hasNext()) {
            ClientCache old = iterator.next();
            if (old.retiredAt.isBefore(cutoff)) {
                iterator.remove();
                old.close();
            }
        }
    }

    private ClientCache newCache() {
        return new ClientCache(createCredentialsProvider(), clock.instant());
    }

    private AwsCredentialsProvider createCredentialsProvider() {
        if (hasStaticCredentials()) {
            AwsCredentials credentials = StringUtils.hasText(sessionToken)
                    ? AwsSessionCredentials.create(accessKeyId.trim(), secretAccessKey.trim(), sessionToken.trim())
                    : AwsBasicCredentials.create(accessKeyId.trim(), secretAccessKey.trim());
            return StaticCredentialsProvider.create(credentials);
        }
        DefaultCredentialsProvider.Builder builder = DefaultCredentialsProvider.builder();
        if (StringUtils.hasText(profile)) {
            builder.profileName(profile);
        }
        return builder.build();
    }

    private boolean hasStaticCredentials() {
        return StringUtils.hasText(accessKeyId) && StringUtils.hasText(secretAccessKey);
    }

    private static void closeQuietly(SdkAutoCloseable closeable) {
        try {
            closeable.close();
        } catch (RuntimeException e) {
            logger.warn("Failed to close {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
        }
    }

    private static final class ClientCache {

        private final AwsCredentialsProvider credentialsProvider;
        private final Map<String, SdkClient> clients = new ConcurrentHashMap<>();
        private final Instant createdAt;
        private volatile Instant retiredAt;
        private volatile boolean closed;

        private ClientCache(AwsCredentialsProvider credentialsProvider, Instant createdAt) {
            this.credentialsProvider = credentialsProvider;
            this.createdAt = createdAt;
        }

        private void close() {
            closed = true;
            clients.values().forEach(AwsClientProvider::closeQuietly);
            if (credentialsProvider instanceof SdkAutoCloseable) {
                closeQuietly((SdkAutoCloseable) credentialsProvider);
            }
        }
    }
}
