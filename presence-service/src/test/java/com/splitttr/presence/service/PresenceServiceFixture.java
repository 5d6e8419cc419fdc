package com.splitttr.presence.service;

import com.splitttr.presence.repository.LeaseStore;

import java.time.Clock;

// Builds a PresenceService with the default lease settings, for tests outside this package.
public final class PresenceServiceFixture {

    private PresenceServiceFixture() {
    }

    public static PresenceService create(LeaseStore leases, Clock clock, boolean enabled) {
        PresenceService service = new PresenceService();
        service.leases = leases;
        service.clock = clock;
        service.enabled = enabled;
        service.leaseSeconds = 90;
        service.maxExtensionAheadSeconds = 120;
        service.heartbeatThrottleSeconds = 5;
        return service;
    }
}
