package com.keystone.core.classifier;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.model.Complexity;
import com.keystone.core.model.RequiredGates;
import com.keystone.core.model.Task;
import com.keystone.core.model.TaskType;
import com.keystone.core.routing.CrossCuttingTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Maps a free-form request to a {@link Task} with a type and complexity tier.
 * <p>
 * Classification is a pure function of the request text and file context: every rule is
 * an explicit keyword table or numeric threshold, evaluated in a fixed order. Requests no
 * type rule recognizes fall back to IMPLEMENTATION with complexity raised to at least
 * MODERATE, preferring over-gating to under-gating.
 */
@Service
public class TaskClassifier {

    private static final Logger log = LoggerFactory.getLogger(TaskClassifier.class);

    private static final List<String> TRIVIAL_MARKERS = List.of(
            "typo", "spelling", "whitespace", "formatting", "comment", "bump version", "rename variable");

    /** Type keywords that routinely accompany a trivial edit without widening it. */
    private static final List<String> TRIVIAL_COMPANIONS = List.of(
            "fix", "add", "docs", "documentation", "readme", "changelog");

    private static final List<String> BROAD_SCOPE_KEYWORDS = List.of(
            "system-wide", "across all", "entire codebase", "migrate", "redesign", "architecture");

    private static final List<String> INCIDENT_KEYWORDS = List.of(
            "outage", "production incident", "data loss");

    private static final Map<TaskType, List<String>> TYPE_KEYWORDS = new EnumMap<>(TaskType.class);

    static {
        TYPE_KEYWORDS.put(TaskType.IMPLEMENTATION, List.of(
                "add", "implement", "build", "create", "feature", "support", "integrate", "introduce"));
        TYPE_KEYWORDS.put(TaskType.BUGFIX, List.of(
                "bug", "fix", "crash", "regression", "broken", "defect", "exception", "failing", "error"));
        TYPE_KEYWORDS.put(TaskType.REFACTOR, List.of(
                "refactor", "restructure", "clean up", "cleanup", "simplify", "extract", "decouple"));
        TYPE_KEYWORDS.put(TaskType.TESTING, List.of(
                "test", "tests", "coverage", "e2e", "unit test", "integration test"));
        TYPE_KEYWORDS.put(TaskType.DOCUMENTATION, List.of(
                "documentation", "docs", "document", "readme", "guide", "changelog", "tutorial"));
        TYPE_KEYWORDS.put(TaskType.SPECIFICATION, List.of(
                "specification", "spec", "requirements", "prd", "user story", "acceptance criteria"));
        TYPE_KEYWORDS.put(TaskType.ARCHITECTURE, List.of(
                "architecture", "microservice", "system design", "design doc", "adr"));
        TYPE_KEYWORDS.put(TaskType.INFRASTRUCTURE, List.of(
                "deploy", "pipeline", "ci", "docker", "kubernetes", "terraform", "infrastructure", "helm"));
        TYPE_KEYWORDS.put(TaskType.UI, List.of(
                "ui", "ux", "frontend", "screen", "layout", "css", "wireframe"));
        TYPE_KEYWORDS.put(TaskType.RESEARCH, List.of(
                "research", "investigate", "evaluate", "compare", "spike", "explore"));
    }

    private final KeystoneProperties.Classifier thresholds;

    @Autowired
    public TaskClassifier(KeystoneProperties properties) {
        this(properties.getClassifier());
    }

    public TaskClassifier(KeystoneProperties.Classifier thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public Task classify(String request) {
        return classify(request, List.of());
    }

    /**
     * Classifies a request.
     *
     * @param request     the free-form request text
     * @param fileContext files the request is known to touch; may be null or empty
     * @return the classified task
     */
    public Task classify(String request, List<String> fileContext) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("Request must not be blank");
        }
        List<String> files = fileContext == null ? List.of() : List.copyOf(fileContext);
        var reasons = new ArrayList<String>();

        TaskType type;
        Complexity complexity;
        boolean ambiguous = false;

        List<String> trivial = trivialMarkers(request, files, reasons);
        if (!trivial.isEmpty()) {
            type = TaskType.IMPLEMENTATION;
            complexity = Complexity.TRIVIAL;
            reasons.add("trivial-edit markers " + trivial + " -> IMPLEMENTATION/TRIVIAL");
        } else {
            type = bestTypeMatch(request, reasons);
            complexity = Complexity.SIMPLE;
            if (type == null) {
                type = TaskType.IMPLEMENTATION;
                ambiguous = true;
                complexity = Complexity.MODERATE;
                reasons.add("no type rule matched -> IMPLEMENTATION, complexity raised to MODERATE");
            }
        }

        complexity = applyFileThresholds(files, complexity, reasons);
        complexity = applyKeywordEscalations(request, complexity, reasons);

        var task = new Task(taskId(request, files), request.trim(), type, complexity,
                RequiredGates.forComplexity(complexity), files, ambiguous, reasons);
        log.info("Classified {} as {}/{}{}", task.id(), type, complexity, ambiguous ? " (ambiguous)" : "");
        return task;
    }

    /**
     * Explicitly escalates a task's complexity. De-escalation is rejected: complexity never
     * drops once classified.
     */
    public Task reclassify(Task task, Complexity complexity, String reason) {
        if (complexity.compareTo(task.complexity()) < 0) {
            throw new IllegalArgumentException("Complexity of " + task.id() + " cannot drop from "
                    + task.complexity() + " to " + complexity);
        }
        var reasons = new ArrayList<>(task.reasons());
        reasons.add("re-classified " + task.complexity() + " -> " + complexity + ": " + reason);
        log.info("Re-classified {} from {} to {}: {}", task.id(), task.complexity(), complexity, reason);
        return new Task(task.id(), task.description(), task.type(), complexity,
                RequiredGates.forComplexity(complexity), task.fileContext(), task.ambiguous(), reasons);
    }

    /**
     * Whole-word trivial markers, or none when the request also names substantive work or
     * touches more than one file.
     */
    private static List<String> trivialMarkers(String request, List<String> files, List<String> reasons) {
        List<String> markers = KeywordMatcher.matchesWords(request, TRIVIAL_MARKERS);
        if (markers.isEmpty()) {
            return markers;
        }
        if (files.size() > 1) {
            reasons.add("trivial-edit markers " + markers + " ignored: " + files.size() + " files touched");
            return List.of();
        }
        var substantive = new ArrayList<String>();
        for (List<String> keywords : TYPE_KEYWORDS.values()) {
            for (String keyword : KeywordMatcher.matches(request, keywords)) {
                if (!TRIVIAL_COMPANIONS.contains(keyword)) substantive.add(keyword);
            }
        }
        if (!substantive.isEmpty()) {
            reasons.add("trivial-edit markers " + markers + " ignored: request also names " + substantive);
            return List.of();
        }
        return markers;
    }

    private TaskType bestTypeMatch(String request, List<String> reasons) {
        TaskType best = null;
        List<String> bestMatches = List.of();
        for (var entry : TYPE_KEYWORDS.entrySet()) {
            List<String> matched = KeywordMatcher.matches(request, entry.getValue());
            // strict '>' keeps the earlier-declared type on ties
            if (matched.size() > bestMatches.size()) {
                best = entry.getKey();
                bestMatches = matched;
            }
        }
        if (best != null) {
            reasons.add("type " + best + " matched " + bestMatches);
        }
        return best;
    }

    private Complexity applyFileThresholds(List<String> files, Complexity current, List<String> reasons) {
        Complexity result = current;
        int fileCount = files.size();
        if (fileCount >= thresholds.getCriticalFileCount()) {
            result = escalate(result, Complexity.CRITICAL, fileCount + " files touched", reasons);
        } else if (fileCount >= thresholds.getComplexFileCount()) {
            result = escalate(result, Complexity.COMPLEX, fileCount + " files touched", reasons);
        } else if (fileCount >= thresholds.getModerateFileCount()) {
            result = escalate(result, Complexity.MODERATE, fileCount + " files touched", reasons);
        }

        int modules = moduleCount(files);
        if (modules >= thresholds.getComplexModuleCount()) {
            result = escalate(result, Complexity.COMPLEX, modules + " modules touched", reasons);
        } else if (modules >= thresholds.getModerateModuleCount()) {
            result = escalate(result, Complexity.MODERATE, modules + " modules touched", reasons);
        }
        return result;
    }

    private Complexity applyKeywordEscalations(String request, Complexity current, List<String> reasons) {
        Complexity result = current;
        boolean security = CrossCuttingTrigger.SECURITY.matches(request);
        boolean compliance = CrossCuttingTrigger.COMPLIANCE.matches(request);

        if (security && compliance) {
            result = escalate(result, Complexity.CRITICAL, "security and compliance keywords", reasons);
        } else if (compliance) {
            result = escalate(result, Complexity.COMPLEX, "compliance keywords "
                    + CrossCuttingTrigger.COMPLIANCE.matchedKeywords(request), reasons);
        } else if (security) {
            result = escalate(result, Complexity.MODERATE, "security keywords "
                    + CrossCuttingTrigger.SECURITY.matchedKeywords(request), reasons);
        }

        List<String> broad = KeywordMatcher.matches(request, BROAD_SCOPE_KEYWORDS);
        if (!broad.isEmpty()) {
            result = escalate(result, Complexity.COMPLEX, "broad-scope keywords " + broad, reasons);
        }
        List<String> incident = KeywordMatcher.matches(request, INCIDENT_KEYWORDS);
        if (!incident.isEmpty()) {
            result = escalate(result, Complexity.CRITICAL, "incident keywords " + incident, reasons);
        }
        return result;
    }

    private static Complexity escalate(Complexity current, Complexity floor, String why, List<String> reasons) {
        if (current.atLeast(floor)) {
            return current;
        }
        reasons.add(why + " -> " + floor);
        return floor;
    }

    static int moduleCount(List<String> files) {
        var modules = new TreeSet<String>();
        for (String file : files) {
            String normalized = file.replace('\\', '/');
            if (normalized.startsWith("./")) normalized = normalized.substring(2);
            if (normalized.startsWith("/")) normalized = normalized.substring(1);
            int slash = normalized.indexOf('/');
            modules.add(slash > 0 ? normalized.substring(0, slash) : "(root)");
        }
        return modules.size();
    }

    static String taskId(String request, List<String> files) {
        var canonical = new StringBuilder(KeywordMatcher.normalize(request));
        for (String f : new TreeSet<>(files)) {
            canonical.append('\n').append(f);
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
            return "TASK-" + HexFormat.of().formatHex(digest).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
