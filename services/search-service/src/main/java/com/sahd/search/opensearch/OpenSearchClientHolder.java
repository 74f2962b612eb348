package com.sahd.search.opensearch;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Owns the shared index client. Callers read {@link #current()} freely; after a connectivity
 * failure they hand back the instance they used and at most one caller rebuilds it. Callers
 * racing the rebuild keep whichever handle they already hold.
 */
public class OpenSearchClientHolder {
    private static final Logger log = LoggerFactory.getLogger(OpenSearchClientHolder.class);

    private final Supplier<RestTemplate> factory;
    private final ReentrantLock reconnectLock = new ReentrantLock();
    private final AtomicLong generation = new AtomicLong(0L);
    private volatile RestTemplate current;

    public OpenSearchClientHolder(Supplier<RestTemplate> factory) {
        this.factory = factory;
        this.current = factory.get();
    }

    public RestTemplate current() {
        return current;
    }

    public long generation() {
        return generation.get();
    }

    public boolean reconnect(RestTemplate observed) {
        if (!reconnectLock.tryLock()) {
            return false;
        }
        try {
            if (observed != current) {
                return false;
            }
            current = factory.get();
            long next = generation.incrementAndGet();
            log.info("opensearch client rebuilt generation={}", next);
            return true;
        } finally {
            reconnectLock.unlock();
        }
    }
}
