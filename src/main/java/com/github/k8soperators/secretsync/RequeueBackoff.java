package com.github.k8soperators.secretsync;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Exponential requeue delay per resource: {@code base * 2^(failures - 1)},
 * capped at {@code max}, reset by the next success and dropped once the
 * resource is deleted.
 */
@Singleton
public class RequeueBackoff {

    private static final Logger log = Logger.getLogger(RequeueBackoff.class);

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final ConcurrentMap<String, Integer> failures = new ConcurrentHashMap<>();

    @Inject
    public RequeueBackoff(
            @ConfigProperty(name = "secretsync.requeue.base-delay", defaultValue = "5s") Duration baseDelay,
            @ConfigProperty(name = "secretsync.requeue.max-delay", defaultValue = "5m") Duration maxDelay) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public Duration onFailure(HasMetadata resource) {
        int count = failures.merge(key(resource), 1, Integer::sum);
        return delay(count);
    }

    public void onSuccess(HasMetadata resource) {
        failures.remove(key(resource));
    }

    public void forget(HasMetadata resource) {
        if (failures.remove(key(resource)) != null) {
            log.tracef("%s: dropped failure count", key(resource));
        }
    }

    int size() {
        return failures.size();
    }

    Duration delay(int count) {
        if (count >= 31) {
            return maxDelay;
        }
        Duration delay = baseDelay.multipliedBy(1L << (count - 1));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    static String key(HasMetadata resource) {
        return resource.getKind() + "/" + ResourceID.fromResource(resource);
    }

    int failureCount(HasMetadata resource) {
        return failures.getOrDefault(key(resource), 0);
    }
}
