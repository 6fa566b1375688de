package com.streambus.consumer;

import com.streambus.store.GroupAlreadyExistsException;
import com.streambus.store.LogStoreFacade;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Creates consumer groups idempotently, creating the stream when absent so
 * consumers can subscribe before anything was published.
 */
@ApplicationScoped
public class ConsumerGroupCoordinator {

    private static final Logger LOG = Logger.getLogger(ConsumerGroupCoordinator.class);

    @Inject
    LogStoreFacade logStore;

    /**
     * @return true if the group was created, false if it already existed
     */
    public boolean ensureGroup(String stream, String group, String startId) {
        try {
            logStore.createGroup(stream, group, startId);
            LOG.infof("Created consumer group %s on stream %s at %s", group, stream, startId);
            return true;
        } catch (GroupAlreadyExistsException e) {
            LOG.debugf("Consumer group %s already exists for stream %s", group, stream);
            return false;
        }
    }
}
