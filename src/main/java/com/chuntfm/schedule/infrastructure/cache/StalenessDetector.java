package com.chuntfm.schedule.infrastructure.cache;

import com.chuntfm.schedule.domain.model.StalenessMarker;
import com.chuntfm.schedule.domain.port.out.ScheduleReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Compares the storage fingerprint with the one recorded at the last rebuild.
 * Anything that cannot prove freshness counts as stale.
 */
@Component
public class StalenessDetector {

    private static final Logger logger = LoggerFactory.getLogger(StalenessDetector.class);

    private final ScheduleReader scheduleReader;

    public StalenessDetector(ScheduleReader scheduleReader) {
        this.scheduleReader = scheduleReader;
    }

    /**
     * Reads the current fingerprint; empty when the probe fails.
     */
    public Optional<StalenessMarker> probe() {
        try {
            return Optional.of(scheduleReader.fingerprint());
        } catch (RuntimeException e) {
            logger.warn("Staleness probe failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isStale(StalenessMarker lastObserved) {
        if (lastObserved == null) {
            logger.debug("No fingerprint recorded, treating cache as stale");
            return true;
        }

        return probe()
                .map(current -> {
                    boolean changed = !current.equals(lastObserved);
                    if (changed) {
                        logger.debug("Storage fingerprint changed from {} to {}", lastObserved, current);
                    }
                    return changed;
                })
                .orElse(true);
    }
}
