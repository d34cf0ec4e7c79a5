package com.taskline.core.store;

import com.taskline.core.error.StorageException;
import com.taskline.core.metrics.TasklineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs idempotent store reads, retrying once on {@link StorageException}.
 * A second failure propagates. Writes must not go through here.
 */
@Component
public class StoreReads {

    private static final Logger log = LoggerFactory.getLogger(StoreReads.class);

    private final TasklineMetrics metrics;

    public StoreReads(TasklineMetrics metrics) {
        this.metrics = metrics;
    }

    public <T> T read(String what, Supplier<T> read) {
        try {
            return read.get();
        } catch (StorageException first) {
            log.warn("Store read '{}' failed, retrying once: {}", what, first.getMessage());
            metrics.recordStoreReadRetry();
            try {
                return read.get();
            } catch (StorageException second) {
                second.addSuppressed(first);
                throw second;
            }
        }
    }
}
