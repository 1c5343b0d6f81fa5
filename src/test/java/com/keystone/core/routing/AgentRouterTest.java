package com.keystone.core.routing;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.classifier.TaskClassifier;
import com.keystone.core.model.Complexity;
import com.keystone.core.model.ExecutionChain;
import com.keystone.core.model.RequiredGates;
import com.keystone.core.model.Task;
import com.keystone.core.model.TaskType;
import com.keystone.core.roles.RoleCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentRouterTest {

    private TaskClassifier classifier;
    private AgentRouter router;

    @BeforeEach
    void setUp() {
        classifier = new TaskClassifier(new KeystoneProperties.Classifier());
        router = new AgentRouter(new RoleCatalog());
    }

    private static Task task(TaskType type, Complexity complexity, String description) {
        return new Task("TASK-test", description, type, complexity,
                RequiredGates.forComplexity(complexity), List.of(), false, List.of());
    }

    @Test
    @DisplayName("trivial typo fix routes to the developer alone")
    void trivialChain() {
        ExecutionChain chain = router.route(classifier.classify("fix typo in README"));

        assertEquals(List.of("developer"), chain.orderedRoles());
        assertTrue(chain.requiredGates().none());
    }

    @Test
    @DisplayName("auth keyword injects the security architect and review is required")
    void oauthInjectsSecurity() {
        ExecutionChain chain = router.route(classifier.classify("add OAuth login to mobile app"));

        assertEquals("developer", chain.primaryRole());
        assertTrue(chain.crossCuttingRoles().contains("security-architect"));
        assertTrue(chain.requiredGates().review());
        assertEquals(List.of("code-reviewer"), chain.reviewRoles());
    }

    @Test
    @DisplayName("trigger keywords match whole words, not fragments of longer words")
    void triggersMatchWholeWords() {
        ExecutionChain author = router.route(classifier.classify("Add an author page to the blog"));
        ExecutionChain stable = router.route(task(TaskType.IMPLEMENTATION, Complexity.SIMPLE,
                "keep the notable releases list stable"));

        assertFalse(author.crossCuttingRoles().contains("security-architect"));
        assertFalse(stable.crossCuttingRoles().contains("database-architect"));
        assertTrue(router.route(task(TaskType.IMPLEMENTATION, Complexity.SIMPLE,
                "add authentication to the admin tables")).crossCuttingRoles()
                .containsAll(List.of("security-architect", "database-architect")));
    }

    @Test
    @DisplayName("complex work gets QA approval after review")
    void complexApproval() {
        ExecutionChain chain = router.route(task(TaskType.IMPLEMENTATION, Complexity.COMPLEX, "add export"));

        assertEquals(List.of("code-reviewer"), chain.reviewRoles());
        assertEquals(List.of("qa"), chain.approvalRoles());
    }

    @Test
    @DisplayName("a role appears in only one position")
    void noDuplicateRoles() {
        // BUGFIX supports with TESTING (qa), which is also the approval role at COMPLEX
        ExecutionChain chain = router.route(task(TaskType.BUGFIX, Complexity.CRITICAL,
                "fix the slow database query leaking the auth token"));

        var roles = chain.orderedRoles();
        assertEquals(roles.size(), new HashSet<>(roles).size(), "duplicates in " + roles);
        assertFalse(chain.supportingRoles().contains("qa"));
        assertEquals(List.of("qa"), chain.approvalRoles());
        assertTrue(chain.crossCuttingRoles().containsAll(
                List.of("security-architect", "performance-engineer", "database-architect")));
    }

    @Test
    @DisplayName("primary role keeps its position when it would also gate")
    void primaryWinsOverGating() {
        ExecutionChain chain = router.route(task(TaskType.TESTING, Complexity.COMPLEX, "add e2e tests"));

        assertEquals("qa", chain.primaryRole());
        assertFalse(chain.approvalRoles().contains("qa"));
    }

    @Test
    @DisplayName("chain records the trigger table version")
    void tableVersion() {
        ExecutionChain chain = router.route(task(TaskType.UI, Complexity.SIMPLE, "new settings screen"));

        assertEquals(CrossCuttingTrigger.TABLE_VERSION, chain.triggerTableVersion());
        assertEquals("ux-designer", chain.primaryRole());
        assertEquals(List.of("developer"), chain.supportingRoles());
    }

    @Test
    @DisplayName("routing is deterministic")
    void deterministic() {
        Task task = classifier.classify("add a GDPR audit log to the admin screen");

        assertEquals(router.route(task), router.route(task));
    }
}
