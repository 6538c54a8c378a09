package com.csd.codeagent.service.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Long-lived queues, one per backend id, shared by every request.
 */
public class BackendQueueRegistry {

    private final Map<String, BackendQueue> queues = new LinkedHashMap<>();

    public BackendQueueRegistry register(BackendQueue queue) {
        queues.put(queue.getName(), queue);
        return this;
    }

    public BackendQueue forBackend(String backendId) {
        BackendQueue queue = queues.get(backendId);
        if (queue == null) {
            throw new IllegalStateException("No queue registered for backend " + backendId);
        }
        return queue;
    }

    public Map<String, BackendQueue> all() {
        return Collections.unmodifiableMap(queues);
    }
}
