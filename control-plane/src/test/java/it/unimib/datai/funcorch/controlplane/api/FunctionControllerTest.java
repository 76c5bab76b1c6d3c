package it.unimib.datai.funcorch.controlplane.api;

import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.FunctionGroup;
import it.unimib.datai.funcorch.common.model.FunctionListing;
import it.unimib.datai.funcorch.common.model.FunctionSummary;
import it.unimib.datai.funcorch.common.model.IndexOperation;
import it.unimib.datai.funcorch.common.model.IndexOperationResult;
import it.unimib.datai.funcorch.common.model.LocalFunctionLocation;
import it.unimib.datai.funcorch.common.model.LocationKind;
import it.unimib.datai.funcorch.controlplane.registry.FunctionNotFoundException;
import it.unimib.datai.funcorch.controlplane.registry.FunctionService;
import it.unimib.datai.funcorch.controlplane.scan.IndexingService;
import it.unimib.datai.funcorch.controlplane.scan.UnknownAccountException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = FunctionController.class)
@Import(GlobalExceptionHandler.class)
class FunctionControllerTest {

    @Autowired
    private WebTestClient webClient;

    @MockitoBean
    private FunctionService functionService;

    @MockitoBean
    private IndexingService indexingService;

    @Test
    void list_returnsGroupsAndWarning() {
        FunctionSummary summary = new FunctionSummary("prodfuncs/functions/a.dll", "a.dll", LocationKind.REMOTE,
                "d", Instant.EPOCH, "A", false);
        when(functionService.listing()).thenReturn(new FunctionListing(
                List.of(new FunctionGroup("functions/a.dll", List.of(summary))), true));

        webClient.get()
                .uri("/v1/functions")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.hasWarning").isEqualTo(true)
                .jsonPath("$.groups[0].key").isEqualTo("functions/a.dll")
                .jsonPath("$.groups[0].functions[0].shortName").isEqualTo("a.dll")
                .jsonPath("$.groups[0].functions[0].hostIsRunning").isEqualTo(false);
    }

    @Test
    void lookup_found_returnsDefinition() {
        FunctionDefinition definition = new FunctionDefinition(
                new LocalFunctionLocation("retryCheck"), "d", Instant.EPOCH, "Examples");
        when(functionService.get("local:retryCheck")).thenReturn(Optional.of(definition));

        webClient.get()
                .uri(uri -> uri.path("/v1/functions/lookup").queryParam("id", "local:retryCheck").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.location.type").isEqualTo("local")
                .jsonPath("$.location.entryPoint").isEqualTo("retryCheck")
                .jsonPath("$.assemblyFullName").isEqualTo("Examples");
    }

    @Test
    void lookup_missing_returns404() {
        when(functionService.get("nope")).thenReturn(Optional.empty());

        webClient.get()
                .uri(uri -> uri.path("/v1/functions/lookup").queryParam("id", "nope").build())
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void register_localFunction_returns201() {
        when(functionService.register(any())).thenReturn(true);

        webClient.post()
                .uri("/v1/functions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"location\":{\"type\":\"local\",\"entryPoint\":\"retryCheck\"},\"description\":\"d\"}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.location.entryPoint").isEqualTo("retryCheck");
    }

    @Test
    void register_existingFunction_returns200() {
        when(functionService.register(any())).thenReturn(false);

        webClient.post()
                .uri("/v1/functions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"location\":{\"type\":\"url\",\"invokeUrl\":\"http://fn.example/echo\"}}")
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void register_blobFunction_isRejected() {
        webClient.post()
                .uri("/v1/functions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"location\":{\"type\":\"remote\",\"accountConnectionString\":\"AccountName=a;AccountKey=b\","
                        + "\"blob\":{\"container\":\"functions\",\"blobName\":\"a.dll\"},\"entryPoint\":\"a\"}}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("BAD_REQUEST");

        verify(functionService, never()).register(any());
    }

    @Test
    void register_malformedInvokeUrl_isRejected() {
        webClient.post()
                .uri("/v1/functions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"location\":{\"type\":\"url\",\"invokeUrl\":\"http://host/has space\"}}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("BAD_REQUEST");

        webClient.post()
                .uri("/v1/functions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"location\":{\"type\":\"url\",\"invokeUrl\":\"relative/path\"}}")
                .exchange()
                .expectStatus().isBadRequest();

        verify(functionService, never()).register(any());
    }

    @Test
    void register_missingLocation_returns400() {
        webClient.post()
                .uri("/v1/functions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"description\":\"d\"}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void delete_reportsOutcome() {
        when(functionService.delete("local:retryCheck")).thenReturn(true);

        webClient.delete()
                .uri(uri -> uri.path("/v1/functions").queryParam("id", "local:retryCheck").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deleted").isEqualTo(true);
    }

    @Test
    void scan_returnsCountScanned() {
        when(indexingService.process(any())).thenReturn(IndexOperationResult.scanned("prodfuncs/functions", 3));

        webClient.post()
                .uri("/v1/functions:scan")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("accountConnectionString", "AccountName=prodfuncs;AccountKey=a2V5",
                        "containerPath", "functions"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.countScanned").isEqualTo(3)
                .jsonPath("$.deleted").doesNotExist();

        verify(indexingService).process(new IndexOperation.Index(
                null, null, "AccountName=prodfuncs;AccountKey=a2V5", "functions"));
    }

    @Test
    void scan_unknownAccount_returns400() {
        when(indexingService.process(any())).thenThrow(new UnknownAccountException("No account ghost"));

        webClient.post()
                .uri("/v1/functions:scan")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("accountName", "ghost", "containerPath", "functions"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNKNOWN_ACCOUNT");
    }

    @Test
    void scan_missingContainer_returns400() {
        webClient.post()
                .uri("/v1/functions:scan")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("accountName", "ghost"))
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(indexingService);
    }

    @Test
    void rescan_unknownFunction_returns404() {
        when(indexingService.rescan("nope")).thenThrow(new FunctionNotFoundException("nope"));

        webClient.post()
                .uri(uri -> uri.path("/v1/functions:rescan").queryParam("id", "nope").build())
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("FUNCTION_NOT_FOUND");
    }

    @Test
    void indexOperation_delete_isDispatched() {
        when(indexingService.process(new IndexOperation.Delete("local:retryCheck")))
                .thenReturn(IndexOperationResult.deleted("local:retryCheck", false));

        webClient.post()
                .uri("/v1/index-operations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"delete\",\"functionId\":\"local:retryCheck\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.operation").isEqualTo("delete")
                .jsonPath("$.deleted").isEqualTo(false);
    }
}
