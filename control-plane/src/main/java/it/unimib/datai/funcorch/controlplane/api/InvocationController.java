package it.unimib.datai.funcorch.controlplane.api;

import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.model.InvocationResponse;
import it.unimib.datai.funcorch.common.model.InvocationStatus;
import it.unimib.datai.funcorch.controlplane.execution.InvocationInProgressException;
import it.unimib.datai.funcorch.controlplane.registry.FunctionNotFoundException;
import it.unimib.datai.funcorch.controlplane.service.InvocationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/v1")
@Validated
public class InvocationController {
    public static final String INVOCATION_ID_HEADER = "X-Invocation-Id";

    private final InvocationService invocationService;

    public InvocationController(InvocationService invocationService) {
        this.invocationService = invocationService;
    }

    @PostMapping("/invocations")
    public Mono<ResponseEntity<InvocationResponse>> invoke(
            @RequestParam @NotBlank(message = "Function id is required") String functionId,
            @RequestParam(defaultValue = "false") boolean reset,
            @RequestBody @Valid InvocationRequest request,
            @RequestHeader(value = INVOCATION_ID_HEADER, required = false) String invocationId) {
        try {
            return invocationService.invoke(functionId, request, invocationId, reset)
                    .map(response -> ResponseEntity.status(statusOf(response))
                            .header(INVOCATION_ID_HEADER, response.invocationId())
                            .body(response))
                    .onErrorResume(InvocationInProgressException.class, ex ->
                            Mono.just(ResponseEntity.status(HttpStatus.CONFLICT)
                                    .header(INVOCATION_ID_HEADER, ex.invocationId())
                                    .build()));
        } catch (FunctionNotFoundException ex) {
            return Mono.just(ResponseEntity.notFound().build());
        }
    }

    @GetMapping("/invocations/{invocationId}")
    public ResponseEntity<InvocationStatus> status(
            @PathVariable @NotBlank(message = "Invocation ID is required") String invocationId) {
        return invocationService.status(invocationId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/invocations/{invocationId}:cancel")
    public ResponseEntity<Void> cancel(
            @PathVariable @NotBlank(message = "Invocation ID is required") String invocationId) {
        if (invocationService.cancel(invocationId)) {
            return ResponseEntity.accepted().build();
        }
        if (invocationService.status(invocationId).isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        return ResponseEntity.notFound().build();
    }

    static HttpStatus statusOf(InvocationResponse response) {
        return switch (response.status()) {
            case InvocationService.STATUS_SUCCESS -> HttpStatus.OK;
            case InvocationService.STATUS_CANCELLED -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
