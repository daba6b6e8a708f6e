package com.enterprise.orchestration;

import com.enterprise.orchestration.agent.AgentStatusReport;
import com.enterprise.orchestration.config.OrchestratorConfig;
import com.enterprise.orchestration.core.Orchestrator;
import com.enterprise.orchestration.gateway.ScriptedGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

class OrchestratorFactoryTest {

    @Test
    void testCreateDefault() throws Exception {
        Orchestrator orchestrator = OrchestratorFactory.createDefault();

        assertNotNull(orchestrator);
        assertFalse(orchestrator.isRunning());
        orchestrator.stop().get(5, TimeUnit.SECONDS);
    }

    @Test
    void testDefaultAgentsAreRegistered() throws Exception {
        Orchestrator orchestrator = OrchestratorFactory.create(OrchestratorConfig.builder().build(), new ScriptedGateway());

        AgentStatusReport agents = orchestrator.getAgentStatus();
        assertEquals(3, agents.getTotalAgents());
        assertEquals(3, agents.getAvailableAgents());
        assertEquals(0, orchestrator.getTaskQueueStatus().getTotal());
        orchestrator.stop().get(5, TimeUnit.SECONDS);
    }

    @Test
    void testCreateWithCustomConfig() throws Exception {
        OrchestratorConfig config = OrchestratorConfig.builder()
            .executorConfig(new OrchestratorConfig.ExecutorConfig(
                2, 8, Duration.ofMinutes(2), 500, Duration.ofSeconds(5)))
            .schedulerConfig(new OrchestratorConfig.SchedulerConfig(
                Duration.ofMillis(100), Duration.ofMillis(500), 4, 10))
            .monitoringConfig(new OrchestratorConfig.MonitoringConfig(false, false))
            .build();

        Orchestrator orchestrator = OrchestratorFactory.create(config, new ScriptedGateway(), new SimpleMeterRegistry());

        assertNotNull(orchestrator);
        assertTrue(orchestrator.checkHealth().get(5, TimeUnit.SECONDS).isHealthy());
        orchestrator.stop().get(5, TimeUnit.SECONDS);
    }

    @Test
    void testCreateWithInvalidConfig() {
        OrchestratorConfig invalidConfig = OrchestratorConfig.builder()
            .executorConfig(new OrchestratorConfig.ExecutorConfig(
                -1, 8, Duration.ofMinutes(2), 500, Duration.ofSeconds(60)))
            .build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> OrchestratorFactory.create(invalidConfig, new ScriptedGateway()));
        assertTrue(e.getMessage().contains("executor.corePoolSize"));
    }

    @Test
    void testInvalidGatewayUrlRejected() {
        OrchestratorConfig config = OrchestratorConfig.builder()
            .gatewayConfig(new OrchestratorConfig.GatewayConfig(
                "not a url", "/call", Duration.ofSeconds(1), Duration.ofSeconds(1)))
            .build();

        assertThrows(IllegalArgumentException.class, () -> OrchestratorFactory.create(config));
    }
}
