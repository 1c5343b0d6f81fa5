package com.keystone.core.conflict;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.artifact.ArtifactContentStore;
import com.keystone.core.model.ConflictRecord;
import com.keystone.core.model.ConflictSeverity;
import com.keystone.core.model.ConflictStatus;
import com.keystone.core.model.Resolution;
import com.keystone.core.roles.Domain;
import com.keystone.core.roles.RoleCatalog;
import com.keystone.core.routing.CrossCuttingTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Detects and resolves contradictory outputs of concurrently executed steps.
 * <p>
 * A conflict exists when two or more outputs of one wave touch the same artifact with different
 * content, or assert different values for the same requirement key. Conflicts whose roles all
 * belong to one domain go to that domain's authority role; cross-domain conflicts need every
 * involved role to vote for the same candidate within the consensus timeout. Anything else is
 * escalated to the operator, and every record and resolution is persisted.
 */
@Service
public class ConflictResolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    public static final String CONSENSUS = "consensus";
    public static final String OPERATOR = "operator";
    public static final String REQUIREMENT_PREFIX = "requirement:";

    private final RoleCatalog roles;
    private final ConflictArbiter arbiter;
    private final ConflictLedger ledger;
    private final Duration consensusTimeout;
    private final ExecutorService voters = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "conflict-vote");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ConflictResolver(RoleCatalog roles, ConflictArbiter arbiter, ConflictLedger ledger,
                            KeystoneProperties properties) {
        this(roles, arbiter, ledger, Duration.ofSeconds(properties.getConsensusTimeoutSeconds()));
    }

    public ConflictResolver(RoleCatalog roles, ConflictArbiter arbiter, ConflictLedger ledger,
                            Duration consensusTimeout) {
        this.roles = roles;
        this.arbiter = arbiter;
        this.ledger = ledger;
        this.consensusTimeout = consensusTimeout;
    }

    /**
     * Compares the outputs of one wave. Fewer than two outputs never conflict.
     *
     * @return persisted records, one per conflicting subject, ordered by subject
     */
    public List<ConflictRecord> detectConflicts(String workflowId, List<WorkerOutput> outputs) {
        if (outputs.size() < 2) {
            return List.of();
        }
        var ordered = outputs.stream().sorted(Comparator.comparing(WorkerOutput::stepId)).toList();
        var records = new ArrayList<ConflictRecord>();

        Map<String, Map<WorkerOutput, String>> byArtifact = new TreeMap<>();
        Map<String, Map<WorkerOutput, String>> byRequirement = new TreeMap<>();
        for (WorkerOutput output : ordered) {
            output.artifacts().forEach((name, content) ->
                    byArtifact.computeIfAbsent(name, k -> new LinkedHashMap<>()).put(output, content));
            output.requirementClaims().forEach((key, value) ->
                    byRequirement.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(output, value));
        }

        byArtifact.forEach((name, writers) -> {
            if (writers.size() < 2 || distinct(writers.values(), false) < 2) return;
            boolean whitespaceOnly = distinct(writers.values(), true) == 1;
            ConflictSeverity severity = whitespaceOnly ? ConflictSeverity.LOW
                    : writers.size() >= 3 ? ConflictSeverity.HIGH : ConflictSeverity.MEDIUM;
            records.add(record(workflowId, name, name, writers, severity));
        });
        byRequirement.forEach((key, claimants) -> {
            if (claimants.size() < 2 || distinct(claimants.values(), false) < 2) return;
            records.add(record(workflowId, REQUIREMENT_PREFIX + key, key, claimants, ConflictSeverity.HIGH));
        });
        return records;
    }

    private ConflictRecord record(String workflowId, String subject, String topic,
                                  Map<WorkerOutput, String> contents, ConflictSeverity base) {
        ConflictSeverity severity = base;
        if (CrossCuttingTrigger.SECURITY.matches(topic) || CrossCuttingTrigger.COMPLIANCE.matches(topic)) {
            severity = severity.max(ConflictSeverity.CRITICAL);
        }
        var outputIds = new ArrayList<String>();
        var stepIds = new ArrayList<String>();
        var involvedRoles = new ArrayList<String>();
        var candidates = new LinkedHashMap<String, String>();
        contents.forEach((output, content) -> {
            String id = output.outputId(subject);
            outputIds.add(id);
            stepIds.add(output.stepId());
            involvedRoles.add(output.role());
            candidates.put(id, content);
        });

        Set<Domain> domains = involvedRoles.stream().map(roles::domainOf).collect(Collectors.toSet());
        boolean domainSpecific = domains.size() == 1;
        String agent = domainSpecific
                ? roles.resolve(domains.iterator().next().authority()).roleName()
                : CONSENSUS;
        String conflictId = "CF-" + ArtifactContentStore.hash(workflowId + "|" + subject + "|" + outputIds)
                .substring(0, 10);

        Optional<ConflictRecord> existing = ledger.find(workflowId, conflictId);
        if (existing.isPresent()) {
            return existing.get();
        }
        var record = new ConflictRecord(conflictId, workflowId, subject, outputIds, stepIds, involvedRoles,
                severity, domainSpecific, agent, ConflictStatus.OPEN, null, Instant.now());
        ledger.saveCandidates(workflowId, conflictId, candidates);
        ledger.save(record);
        log.warn("Conflict {} on '{}' between {} ({}, {})", conflictId, subject, stepIds, severity,
                domainSpecific ? "authority " + agent : "cross-domain");
        return record;
    }

    /**
     * Resolves an open conflict and persists the outcome. An escalation is a valid result:
     * the record moves to ESCALATED and the involved steps must wait for the operator.
     */
    public Resolution resolve(ConflictRecord record) {
        if (record.status() != ConflictStatus.OPEN) {
            return record.resolution();
        }
        Map<String, String> candidates = ledger.candidates(record.workflowId(), record.conflictId());
        Resolution resolution = record.domainSpecific()
                ? byAuthority(record, candidates)
                : byConsensus(record, candidates);
        ledger.save(record.withResolution(resolution, record.resolutionAgent()));
        if (resolution.accepted()) {
            log.info("Conflict {} resolved by {}: accepted {}", record.conflictId(),
                    resolution.resolvedBy(), resolution.acceptedOutputId());
        } else {
            log.warn("Conflict {} escalated to operator review: {}", record.conflictId(), resolution.rationale());
        }
        return resolution;
    }

    /**
     * Closes a conflict from the operator surface.
     *
     * @throws IllegalArgumentException if the conflict or the output ID is unknown
     */
    public ConflictRecord resolveManually(String workflowId, String conflictId, String acceptedOutputId,
                                          String rationale) {
        ConflictRecord record = ledger.find(workflowId, conflictId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown conflict " + conflictId));
        int index = record.conflictingOutputs().indexOf(acceptedOutputId);
        if (index < 0) {
            throw new IllegalArgumentException(acceptedOutputId + " is not one of " + record.conflictingOutputs());
        }
        var resolution = Resolution.accepted(acceptedOutputId, record.stepIds().get(index), OPERATOR, rationale);
        var resolved = record.withResolution(resolution, OPERATOR);
        ledger.save(resolved);
        log.info("Conflict {} resolved by operator: accepted {}", conflictId, acceptedOutputId);
        return resolved;
    }

    public Map<String, String> candidates(ConflictRecord record) {
        return ledger.candidates(record.workflowId(), record.conflictId());
    }

    public List<ConflictRecord> list(String workflowId) {
        return ledger.list(workflowId);
    }

    public List<ConflictRecord> escalated(String workflowId) {
        return ledger.escalated(workflowId);
    }

    private Resolution byAuthority(ConflictRecord record, Map<String, String> candidates) {
        String authority = record.resolutionAgent();
        var votes = collectVotes(List.of(authority), record, candidates);
        var vote = votes.get(authority);
        if (vote == null) {
            return Resolution.escalated(authority, "authority " + authority + " reached no decision within "
                    + consensusTimeout.toSeconds() + "s");
        }
        return Resolution.accepted(vote.acceptedOutputId(), stepOf(record, vote.acceptedOutputId()),
                authority, vote.rationale());
    }

    private Resolution byConsensus(ConflictRecord record, Map<String, String> candidates) {
        var participants = record.roles().stream().distinct().toList();
        var votes = collectVotes(participants, record, candidates);
        if (votes.size() < participants.size()) {
            return Resolution.escalated(CONSENSUS, "consensus timed out after " + consensusTimeout.toSeconds()
                    + "s with " + votes.size() + "/" + participants.size() + " vote(s)");
        }
        var chosen = votes.values().stream().map(ConflictArbiter.Vote::acceptedOutputId).distinct().toList();
        if (chosen.size() != 1) {
            return Resolution.escalated(CONSENSUS, "no consensus: votes split across " + chosen);
        }
        String rationale = votes.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue().rationale())
                .collect(Collectors.joining("; "));
        return Resolution.accepted(chosen.get(0), stepOf(record, chosen.get(0)), CONSENSUS, rationale);
    }

    /** Votes that arrived in time and name a real candidate, keyed by role. */
    private Map<String, ConflictArbiter.Vote> collectVotes(List<String> voterRoles, ConflictRecord record,
                                                           Map<String, String> candidates) {
        var futures = new LinkedHashMap<String, CompletableFuture<Optional<ConflictArbiter.Vote>>>();
        for (String role : voterRoles) {
            futures.put(role, CompletableFuture.supplyAsync(() -> arbiter.decide(role, record, candidates), voters));
        }
        long deadline = System.nanoTime() + consensusTimeout.toNanos();
        var votes = new LinkedHashMap<String, ConflictArbiter.Vote>();
        for (var entry : futures.entrySet()) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                entry.getValue().get(remaining, TimeUnit.NANOSECONDS)
                        .filter(v -> candidates.containsKey(v.acceptedOutputId()))
                        .ifPresent(v -> votes.put(entry.getKey(), v));
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                log.warn("Vote of {} on {} timed out", entry.getKey(), record.conflictId());
            } catch (ExecutionException e) {
                log.warn("Vote of {} on {} failed: {}", entry.getKey(), record.conflictId(),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return votes;
    }

    private static String stepOf(ConflictRecord record, String outputId) {
        int index = record.conflictingOutputs().indexOf(outputId);
        return index >= 0 ? record.stepIds().get(index) : null;
    }

    private static long distinct(Collection<String> values, boolean ignoreWhitespace) {
        return values.stream()
                .map(v -> ignoreWhitespace ? v.replaceAll("\\s+", " ").strip() : v)
                .distinct()
                .count();
    }

    @Override
    public void close() {
        voters.shutdownNow();
    }
}
