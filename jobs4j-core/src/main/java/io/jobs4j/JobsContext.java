package io.jobs4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.config.JobsProperties;
import io.jobs4j.spi.JobQueue;
import io.jobs4j.spi.JobStore;
import io.jobs4j.spi.LockProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Everything a jobs component needs from its surroundings: configuration, time source,
 * worker identity and collaborator handles. Created once per process and handed to each
 * component at construction.
 */
public record JobsContext(
        JobsProperties properties,
        Clock clock,
        String workerId,
        JobStore store,
        JobQueue queue,
        LockProvider locks,
        ObjectMapper objectMapper
) {
    private static final Logger log = LoggerFactory.getLogger(JobsContext.class);

    public JobsContext {
        Objects.requireNonNull(properties, "properties must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(locks, "locks must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        workerId = resolveWorkerId(workerId != null ? workerId : properties.getWorkerId());
    }

    static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "jobs4j";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local host name, using default msg={}", e.getMessage());
        }

        String pid = String.valueOf(ProcessHandle.current().pid());
        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
