package com.keystone.core.worker;

import com.keystone.core.persistence.JsonDocumentStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessWorkerTest {

    private static final WorkerRequest REQUEST = new WorkerRequest("WF-1", "STEP-001", "developer", "do it",
            List.of(), null, List.of(), List.of(), null);

    private static ProcessWorker worker(String script, long timeout) {
        return new ProcessWorker("developer", List.of("sh", "-c", script), timeout,
                JsonDocumentStore.createMapper());
    }

    @Test
    void readsTheResponseFromStdout() {
        WorkerResponse response = worker(
                "cat > /dev/null; echo '{\"status\":\"COMPLETED\",\"output\":\"{}\",\"tokensUsed\":42}'", 10)
                .execute(REQUEST);

        assertEquals(WorkerStatus.COMPLETED, response.status());
        assertEquals("{}", response.output());
        assertEquals(42, response.tokensUsed());
    }

    @Test
    void nonZeroExitAndEmptyOutputFail() {
        assertEquals(WorkerStatus.FAILED, worker("cat > /dev/null; exit 3", 10).execute(REQUEST).status());
        assertEquals("worker produced no response",
                worker("cat > /dev/null", 10).execute(REQUEST).message());
    }

    @Test
    void timesOut() {
        WorkerResponse response = worker("cat > /dev/null; sleep 5", 1).execute(REQUEST);

        assertEquals(WorkerStatus.FAILED, response.status());
        assertTrue(response.message().contains("timed out"));
    }

    @Test
    void missingCommandIsUnavailable() {
        var worker = new ProcessWorker("developer", List.of("/nonexistent/keystone-worker"), 5,
                JsonDocumentStore.createMapper());

        assertThrows(WorkerUnavailableException.class, () -> worker.execute(REQUEST));
    }
}
