package com.enterprise.orchestration.monitoring;

import com.enterprise.orchestration.OrchestratorFactory;
import com.enterprise.orchestration.agent.DefaultAgents;
import com.enterprise.orchestration.config.OrchestratorConfig;
import com.enterprise.orchestration.core.Orchestrator;
import com.enterprise.orchestration.gateway.ScriptedGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.TimeUnit;

class HealthCheckerTest {

    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = OrchestratorFactory.create(OrchestratorConfig.builder().build(), new ScriptedGateway());
    }

    @AfterEach
    void tearDown() throws Exception {
        orchestrator.stop().get(10, TimeUnit.SECONDS);
    }

    @Test
    void testStoppedOrchestratorIsUnhealthy() throws Exception {
        HealthChecker.HealthStatus status = new HealthChecker(orchestrator).performHealthCheck().get(5, TimeUnit.SECONDS);

        assertFalse(status.isHealthy());
        assertTrue(status.getFailedChecks().contains("orchestrator.running"));
        assertTrue(status.getChecks().get("agents.reachable").isPassed());
    }

    @Test
    void testRunningOrchestrator() throws Exception {
        orchestrator.start();

        HealthChecker.HealthStatus status = orchestrator.checkHealth().get(5, TimeUnit.SECONDS);

        assertTrue(status.getChecks().get("orchestrator.running").isPassed());
        assertTrue(status.getChecks().get("orchestrator.uptime").isPassed());
        assertTrue(status.getChecks().get("queue.healthy").isPassed());
        assertTrue(status.getChecks().containsKey("system.memory"));
    }

    @Test
    void testAllAgentsOffline() throws Exception {
        orchestrator.start();
        orchestrator.setAgentOffline(DefaultAgents.PR_AGENT);
        orchestrator.setAgentOffline(DefaultAgents.REPORT_AGENT);
        orchestrator.setAgentOffline(DefaultAgents.BRANCH_AGENT);

        HealthChecker.HealthStatus status = orchestrator.checkHealth().get(5, TimeUnit.SECONDS);

        assertFalse(status.isHealthy());
        assertTrue(status.getFailedChecks().contains("agents.reachable"));
    }

    @Test
    void testQueueThreshold() throws Exception {
        orchestrator.createWorkflow("create_branch", null, 1);

        HealthChecker.HealthStatus status = new HealthChecker(orchestrator, 1).performHealthCheck().get(5, TimeUnit.SECONDS);

        assertTrue(status.getFailedChecks().contains("queue.healthy"));
    }
}
