package com.keystone.core.worker;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.persistence.JsonDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workers by role: worker beans plus one {@link ProcessWorker} per {@code keystone.workers.<role>} entry.
 */
@Component
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Map<String, Worker> workers = new ConcurrentHashMap<>();

    public WorkerRegistry() {}

    @Autowired
    public WorkerRegistry(ObjectProvider<Worker> beans, KeystoneProperties properties, JsonDocumentStore documents) {
        beans.orderedStream().forEach(this::register);
        for (var entry : properties.getWorkers().entrySet()) {
            var config = entry.getValue();
            if (config.getCommand() == null || config.getCommand().isEmpty()) {
                log.warn("Worker '{}' has no command configured; skipping", entry.getKey());
                continue;
            }
            register(new ProcessWorker(entry.getKey(), config.getCommand(), config.getTimeoutSeconds(),
                    documents.mapper()));
        }
        log.info("Registered workers for roles {}", roles());
    }

    public void register(Worker worker) {
        workers.put(worker.role(), worker);
    }

    public Optional<Worker> find(String role) {
        return Optional.ofNullable(workers.get(role));
    }

    public boolean isAvailable(String role) {
        return workers.containsKey(role);
    }

    public Set<String> roles() {
        return new TreeSet<>(workers.keySet());
    }
}
