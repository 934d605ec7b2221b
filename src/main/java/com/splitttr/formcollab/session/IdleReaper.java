package com.splitttr.formcollab.session;

import com.splitttr.formcollab.config.CollabConfig;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class IdleReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleReaper.class);

    @Inject
    RoomRegistry roomRegistry;

    @Inject
    CollabConfig config;

    @Scheduled(every = "{collab.reaper-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        int evicted = roomRegistry.evictIdle();
        if (evicted > 0) {
            log.info("Evicted {} collaborators idle for more than {}, {} rooms active",
                evicted, config.idleThreshold(), roomRegistry.activeRoomCount());
        } else {
            log.debug("Idle sweep found nothing to evict ({} rooms active)", roomRegistry.activeRoomCount());
        }
    }
}
