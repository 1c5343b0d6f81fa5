package com.keystone.core.conflict;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.core.model.ConflictRecord;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.worker.ArtifactInput;
import com.keystone.core.worker.WorkerRegistry;
import com.keystone.core.worker.WorkerRequest;
import com.keystone.core.worker.WorkerResponse;
import com.keystone.core.worker.WorkerStatus;
import com.keystone.core.worker.WorkerUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ConflictArbiter} that asks the deciding role's worker. The candidates are passed as
 * inputs; the worker answers with {@code {"acceptedOutput": "...", "rationale": "..."}}.
 */
@Component
public class WorkerConflictArbiter implements ConflictArbiter {

    private static final Logger log = LoggerFactory.getLogger(WorkerConflictArbiter.class);

    private final WorkerRegistry workers;
    private final ObjectMapper mapper;

    public WorkerConflictArbiter(WorkerRegistry workers, JsonDocumentStore documents) {
        this.workers = workers;
        this.mapper = documents.mapper();
    }

    @Override
    public Optional<Vote> decide(String role, ConflictRecord record, Map<String, String> candidates) {
        var worker = workers.find(role);
        if (worker.isEmpty()) {
            log.warn("No worker for {} to arbitrate {}", role, record.conflictId());
            return Optional.empty();
        }
        var inputs = candidates.entrySet().stream()
                .map(e -> new ArtifactInput(e.getKey(), 0, null, e.getValue()))
                .toList();
        var request = new WorkerRequest(record.workflowId(), "conflict:" + record.conflictId(), role,
                "Conflict on '" + record.subject() + "' (" + record.severity() + ") between steps "
                        + record.stepIds() + ". Accept exactly one of: " + record.conflictingOutputs(),
                inputs, Map.of("acceptedOutput", "STRING", "rationale", "STRING"),
                List.of(), List.of(), null);
        WorkerResponse response;
        try {
            response = worker.get().execute(request);
        } catch (WorkerUnavailableException e) {
            log.warn("Arbiter {} unavailable for {}: {}", role, record.conflictId(), e.getMessage());
            return Optional.empty();
        }
        if (response.status() != WorkerStatus.COMPLETED || response.output() == null) {
            return Optional.empty();
        }
        try {
            JsonNode decision = mapper.readTree(response.output());
            String accepted = decision.path("acceptedOutput").asText(null);
            if (accepted == null) {
                return Optional.empty();
            }
            return Optional.of(new Vote(accepted, decision.path("rationale").asText("")));
        } catch (JsonProcessingException e) {
            log.warn("Arbiter {} returned unparseable decision for {}", role, record.conflictId());
            return Optional.empty();
        }
    }
}
