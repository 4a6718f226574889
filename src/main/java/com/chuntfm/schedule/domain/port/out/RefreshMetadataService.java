package com.chuntfm.schedule.domain.port.out;

import java.time.Instant;

public interface RefreshMetadataService {

    void recordRefresh(Instant takenAt, int entryCount);

    void recordFailure(Instant attemptedAt, String reason);
}
