package com.keystone.core.worker;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.persistence.JsonDocumentStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkerRegistryTest {

    private static Worker worker(String role) {
        return new Worker() {
            @Override
            public String role() {
                return role;
            }

            @Override
            public WorkerResponse execute(WorkerRequest request) {
                return WorkerResponse.completed("{}");
            }
        };
    }

    @Test
    void registersByRole() {
        var registry = new WorkerRegistry();
        registry.register(worker("qa"));

        assertTrue(registry.isAvailable("qa"));
        assertFalse(registry.isAvailable("developer"));
        assertTrue(registry.find("developer").isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void combinesBeansWithConfiguredCommands() {
        ObjectProvider<Worker> beans = mock(ObjectProvider.class);
        when(beans.orderedStream()).thenReturn(Stream.of(worker("qa")));
        var properties = new KeystoneProperties();
        var dev = new KeystoneProperties.Worker();
        dev.setCommand(List.of("/usr/local/bin/dev-agent"));
        var empty = new KeystoneProperties.Worker();
        properties.getWorkers().put("developer", dev);
        properties.getWorkers().put("architect", empty);

        var registry = new WorkerRegistry(beans, properties, new JsonDocumentStore());

        assertEquals(Set.of("developer", "qa"), registry.roles());
        assertInstanceOf(ProcessWorker.class, registry.find("developer").orElseThrow());
    }
}
