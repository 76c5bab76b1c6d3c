package it.unimib.datai.funcorch.controlplane.execution;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.model.LocalFunctionLocation;
import it.unimib.datai.funcorch.controlplane.config.RetryProperties;
import it.unimib.datai.funcorch.controlplane.invoke.HandlerRegistry;
import it.unimib.datai.funcorch.controlplane.invoke.LocalFunctionInvoker;
import it.unimib.datai.funcorch.controlplane.service.Metrics;
import it.unimib.datai.funcorch.examples.retrycheck.RetryCheckHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the retry-check example body through the real orchestrator and in-process invoker.
 */
class RetryCheckFlowTest {

    private static final FunctionDefinition RETRY_CHECK = new FunctionDefinition(
            new LocalFunctionLocation("retryCheck"), "retry check", Instant.EPOCH, "Examples");

    private AttemptTracker tracker;
    private ExecutionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        RetryProperties properties = RetryProperties.defaults();
        tracker = new AttemptTracker(properties, Clock.systemUTC());
        LocalFunctionInvoker invoker = new LocalFunctionInvoker(
                HandlerRegistry.of(Map.of("retryCheck", new RetryCheckHandler())));
        orchestrator = new ExecutionOrchestrator(invoker, tracker, ExecutionContextFactory.standard(),
                BackoffPolicy.none(), properties, new Metrics(new SimpleMeterRegistry()), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        tracker.shutdown();
    }

    @Test
    void retryCheck_succeedsOnSecondExecution() {
        InvocationOutcome outcome = orchestrator.execute(RETRY_CHECK, new InvocationRequest("go", Map.of()),
                "inv-1", false);

        assertThat(outcome.output()).isEqualTo("invocationCount: 2");
        assertThat(outcome.retryCount()).isEqualTo(1);
    }

    @Test
    void retryCheck_withReset_failsOnceAgain() {
        orchestrator.execute(RETRY_CHECK, new InvocationRequest("go", Map.of()), "inv-1", false);

        InvocationOutcome reset = orchestrator.execute(RETRY_CHECK, new InvocationRequest("go", Map.of()),
                "inv-1", true);

        assertThat(reset.output()).isEqualTo("invocationCount: 2");
        assertThat(tracker.get("inv-1").orElseThrow().retryCount()).isEqualTo(1);
    }
}
