package it.unimib.datai.funcorch.controlplane.service;

import it.unimib.datai.funcorch.common.model.ErrorInfo;
import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.model.InvocationResponse;
import it.unimib.datai.funcorch.common.model.InvocationStatus;
import it.unimib.datai.funcorch.common.runtime.RetryContextMismatchException;
import it.unimib.datai.funcorch.controlplane.config.RetryProperties;
import it.unimib.datai.funcorch.controlplane.execution.AttemptTracker;
import it.unimib.datai.funcorch.controlplane.execution.ExecutionOrchestrator;
import it.unimib.datai.funcorch.controlplane.execution.InvocationAttempt;
import it.unimib.datai.funcorch.controlplane.execution.InvocationCancelledException;
import it.unimib.datai.funcorch.controlplane.execution.InvocationOutcome;
import it.unimib.datai.funcorch.controlplane.execution.RetryExhaustedException;
import it.unimib.datai.funcorch.controlplane.heartbeat.HeartbeatTracker;
import it.unimib.datai.funcorch.controlplane.registry.FunctionNotFoundException;
import it.unimib.datai.funcorch.controlplane.registry.FunctionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
public class InvocationService {
    private static final Logger log = LoggerFactory.getLogger(InvocationService.class);

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_EXHAUSTED = "exhausted";
    public static final String STATUS_ERROR = "error";
    public static final String STATUS_CANCELLED = "cancelled";

    private final FunctionService functionService;
    private final ExecutionOrchestrator orchestrator;
    private final AttemptTracker attemptTracker;
    private final HeartbeatTracker heartbeatTracker;
    private final RetryProperties retryProperties;

    public InvocationService(FunctionService functionService,
                             ExecutionOrchestrator orchestrator,
                             AttemptTracker attemptTracker,
                             HeartbeatTracker heartbeatTracker,
                             RetryProperties retryProperties) {
        this.functionService = functionService;
        this.orchestrator = orchestrator;
        this.attemptTracker = attemptTracker;
        this.heartbeatTracker = heartbeatTracker;
        this.retryProperties = retryProperties;
    }

    /**
     * Runs a logical invocation off the event loop. Disposing the returned Mono cancels the
     * invocation before its next attempt.
     *
     * @param invocationId caller-supplied id, or null to start a new logical invocation
     * @throws FunctionNotFoundException if {@code functionId} is not registered
     */
    public Mono<InvocationResponse> invoke(String functionId, InvocationRequest request,
                                           String invocationId, boolean reset) {
        FunctionDefinition definition = functionService.get(functionId)
                .orElseThrow(() -> new FunctionNotFoundException(functionId));
        String id = invocationId == null || invocationId.isBlank() ? UUID.randomUUID().toString() : invocationId;
        return Mono.fromCallable(() -> run(definition, request, id, reset))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(() -> attemptTracker.cancel(id));
    }

    InvocationResponse run(FunctionDefinition definition, InvocationRequest request, String invocationId,
                           boolean reset) {
        boolean hostIsRunning = hostIsRunning(definition);
        int bound = retryProperties.maxRetryCount();
        try {
            InvocationOutcome outcome = orchestrator.execute(definition, request, invocationId, reset);
            return new InvocationResponse(invocationId, definition.id(), STATUS_SUCCESS, outcome.output(), null,
                    outcome.retryCount(), outcome.maxRetryCount(), hostIsRunning);
        } catch (RetryExhaustedException ex) {
            String cause = ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage();
            return new InvocationResponse(invocationId, definition.id(), STATUS_EXHAUSTED, null,
                    new ErrorInfo(ExecutionOrchestrator.RETRIES_EXHAUSTED, cause),
                    ex.retryCount(), ex.maxRetryCount(), hostIsRunning);
        } catch (RetryContextMismatchException ex) {
            return new InvocationResponse(invocationId, definition.id(), STATUS_ERROR, null,
                    new ErrorInfo(ExecutionOrchestrator.INTERNAL_CONSISTENCY, ex.getMessage()),
                    currentRetryCount(invocationId), bound, hostIsRunning);
        } catch (InvocationCancelledException ex) {
            return new InvocationResponse(invocationId, definition.id(), STATUS_CANCELLED, null,
                    new ErrorInfo(ExecutionOrchestrator.CANCELLED, ex.getMessage()),
                    ex.retryCount(), bound, hostIsRunning);
        }
    }

    public Optional<InvocationStatus> status(String invocationId) {
        return attemptTracker.get(invocationId)
                .map(InvocationAttempt::snapshot)
                .map(snapshot -> new InvocationStatus(
                        snapshot.invocationId(),
                        snapshot.functionId(),
                        snapshot.state().name().toLowerCase(Locale.ROOT),
                        snapshot.retryCount(),
                        snapshot.maxRetryCount(),
                        snapshot.startedAt(),
                        snapshot.finishedAt(),
                        snapshot.lastError()));
    }

    public boolean cancel(String invocationId) {
        boolean cancelled = attemptTracker.cancel(invocationId);
        if (!cancelled) {
            log.debug("Nothing to cancel for invocation {}", invocationId);
        }
        return cancelled;
    }

    private boolean hostIsRunning(FunctionDefinition definition) {
        String assembly = definition.assemblyFullName();
        return assembly != null && heartbeatTracker.isLive(assembly);
    }

    private int currentRetryCount(String invocationId) {
        return attemptTracker.get(invocationId).map(InvocationAttempt::retryCount).orElse(0);
    }
}
