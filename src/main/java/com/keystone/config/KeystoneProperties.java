package com.keystone.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "keystone")
public class KeystoneProperties {

    private String workspace = ".keystone";
    private Classifier classifier = new Classifier();
    private Execution execution = new Execution();
    private Gate gate = new Gate();
    private Budget budget = new Budget();
    private Conflict conflict = new Conflict();
    private Map<String, Worker> workers = new LinkedHashMap<>();

    // -- Convenience accessors (delegate to nested) --
    public Path getWorkspacePath() { return Path.of(workspace); }
    public int getMaxParallel() { return execution.maxParallel; }
    public int getMaxStepsPerPhase() { return execution.maxStepsPerPhase; }
    public int getMaxGateAttempts() { return gate.maxAttempts; }
    public long getBudgetCeilingTokens() { return budget.ceilingTokens; }
    public double getBudgetWarnThreshold() { return budget.warnThreshold; }
    public double getBudgetHandoffThreshold() { return budget.handoffThreshold; }
    public int getConsensusTimeoutSeconds() { return conflict.consensusTimeoutSeconds; }

    public String getWorkspace() { return workspace; }
    public void setWorkspace(String workspace) { this.workspace = workspace; }
    public Classifier getClassifier() { return classifier; }
    public void setClassifier(Classifier classifier) { this.classifier = classifier; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Gate getGate() { return gate; }
    public void setGate(Gate gate) { this.gate = gate; }
    public Budget getBudget() { return budget; }
    public void setBudget(Budget budget) { this.budget = budget; }
    public Conflict getConflict() { return conflict; }
    public void setConflict(Conflict conflict) { this.conflict = conflict; }
    public Map<String, Worker> getWorkers() { return workers; }
    public void setWorkers(Map<String, Worker> workers) { this.workers = workers; }

    public static class Classifier {
        private int moderateFileCount = 3;
        private int complexFileCount = 10;
        private int criticalFileCount = 25;
        private int moderateModuleCount = 2;
        private int complexModuleCount = 4;

        public int getModerateFileCount() { return moderateFileCount; }
        public void setModerateFileCount(int moderateFileCount) { this.moderateFileCount = moderateFileCount; }
        public int getComplexFileCount() { return complexFileCount; }
        public void setComplexFileCount(int complexFileCount) { this.complexFileCount = complexFileCount; }
        public int getCriticalFileCount() { return criticalFileCount; }
        public void setCriticalFileCount(int criticalFileCount) { this.criticalFileCount = criticalFileCount; }
        public int getModerateModuleCount() { return moderateModuleCount; }
        public void setModerateModuleCount(int moderateModuleCount) { this.moderateModuleCount = moderateModuleCount; }
        public int getComplexModuleCount() { return complexModuleCount; }
        public void setComplexModuleCount(int complexModuleCount) { this.complexModuleCount = complexModuleCount; }
    }

    public static class Execution {
        private int maxParallel = 4;
        private int maxStepsPerPhase = 25;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getMaxStepsPerPhase() { return maxStepsPerPhase; }
        public void setMaxStepsPerPhase(int maxStepsPerPhase) { this.maxStepsPerPhase = maxStepsPerPhase; }
    }

    public static class Gate {
        private int maxAttempts = 3;
        private double passThreshold = 7.0;
        private double warnThreshold = 4.0;
        private Map<String, Double> weights = new LinkedHashMap<>();

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public double getPassThreshold() { return passThreshold; }
        public void setPassThreshold(double passThreshold) { this.passThreshold = passThreshold; }
        public double getWarnThreshold() { return warnThreshold; }
        public void setWarnThreshold(double warnThreshold) { this.warnThreshold = warnThreshold; }
        public Map<String, Double> getWeights() { return weights; }
        public void setWeights(Map<String, Double> weights) { this.weights = weights; }
    }

    public static class Budget {
        private long ceilingTokens = 200_000;
        private double warnThreshold = 0.75;
        private double handoffThreshold = 0.90;

        public long getCeilingTokens() { return ceilingTokens; }
        public void setCeilingTokens(long ceilingTokens) { this.ceilingTokens = ceilingTokens; }
        public double getWarnThreshold() { return warnThreshold; }
        public void setWarnThreshold(double warnThreshold) { this.warnThreshold = warnThreshold; }
        public double getHandoffThreshold() { return handoffThreshold; }
        public void setHandoffThreshold(double handoffThreshold) { this.handoffThreshold = handoffThreshold; }
    }

    public static class Conflict {
        private int consensusTimeoutSeconds = 30;

        public int getConsensusTimeoutSeconds() { return consensusTimeoutSeconds; }
        public void setConsensusTimeoutSeconds(int consensusTimeoutSeconds) { this.consensusTimeoutSeconds = consensusTimeoutSeconds; }
    }

    /**
     * External command that implements one worker role. The command reads a JSON
     * request on stdin and writes a JSON response on stdout.
     */
    public static class Worker {
        private List<String> command = List.of();
        private int timeoutSeconds = 600;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
