package it.unimib.datai.funcorch.controlplane.api;

import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.FunctionListing;
import it.unimib.datai.funcorch.common.model.IndexOperation;
import it.unimib.datai.funcorch.common.model.IndexOperationResult;
import it.unimib.datai.funcorch.common.model.LocationKind;
import it.unimib.datai.funcorch.common.model.ScanRequest;
import it.unimib.datai.funcorch.common.model.UrlFunctionLocation;
import it.unimib.datai.funcorch.controlplane.registry.FunctionService;
import it.unimib.datai.funcorch.controlplane.scan.IndexingService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.concurrent.Callable;

@RestController
@RequestMapping("/v1")
@Validated
public class FunctionController {
    private final FunctionService functionService;
    private final IndexingService indexingService;

    public FunctionController(FunctionService functionService, IndexingService indexingService) {
        this.functionService = functionService;
        this.indexingService = indexingService;
    }

    @GetMapping("/functions")
    public FunctionListing list() {
        return functionService.listing();
    }

    @GetMapping("/functions/lookup")
    public ResponseEntity<FunctionDefinition> lookup(
            @RequestParam @NotBlank(message = "Function id is required") String id) {
        return functionService.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Registers a URL or local function. Blob-backed functions are only discovered by scanning.
     */
    @PostMapping("/functions")
    public ResponseEntity<FunctionDefinition> register(@RequestBody @Valid FunctionDefinition definition) {
        if (definition.location().kind() == LocationKind.REMOTE) {
            throw new IllegalArgumentException("Blob-backed functions are registered by scanning their container");
        }
        if (definition.location() instanceof UrlFunctionLocation url) {
            requireAbsoluteUrl(url.invokeUrl());
        }
        boolean created = functionService.register(definition);
        FunctionDefinition stored = functionService.get(definition.id()).orElse(definition);
        return ResponseEntity.status(created ? HttpStatus.CREATED : HttpStatus.OK).body(stored);
    }

    private static void requireAbsoluteUrl(String invokeUrl) {
        URI uri;
        try {
            uri = new URI(invokeUrl);
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid invokeUrl: " + ex.getMessage(), ex);
        }
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new IllegalArgumentException("invokeUrl must be an absolute URL with a host: " + invokeUrl);
        }
    }

    @DeleteMapping("/functions")
    public Map<String, Object> delete(@RequestParam @NotBlank(message = "Function id is required") String id) {
        return Map.of("id", id, "deleted", functionService.delete(id));
    }

    @PostMapping("/functions:scan")
    public Mono<IndexOperationResult> scan(@RequestBody @Valid ScanRequest request) {
        return blocking(() -> indexingService.process(request.toIndexOperation()));
    }

    @PostMapping("/functions:rescan")
    public Mono<IndexOperationResult> rescan(@RequestParam @NotBlank(message = "Function id is required") String id) {
        return blocking(() -> indexingService.rescan(id));
    }

    @PostMapping("/index-operations")
    public Mono<IndexOperationResult> process(@RequestBody @Valid IndexOperation operation) {
        return blocking(() -> indexingService.process(operation));
    }

    private static <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
