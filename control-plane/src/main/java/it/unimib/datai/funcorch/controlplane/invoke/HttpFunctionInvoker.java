package it.unimib.datai.funcorch.controlplane.invoke;

import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.model.UrlFunctionLocation;
import it.unimib.datai.funcorch.common.runtime.ExecutionContext;
import it.unimib.datai.funcorch.controlplane.config.HttpClientProperties;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * POSTs the invocation request to a URL-hosted function and blocks for the answer.
 */
@Component
public class HttpFunctionInvoker implements FunctionInvoker {
    public static final String INVOCATION_ID_HEADER = "X-Invocation-Id";
    public static final String RETRY_COUNT_HEADER = "X-Retry-Count";
    public static final String MAX_RETRY_COUNT_HEADER = "X-Max-Retry-Count";

    private static final Object EMPTY = new Object();

    private final WebClient webClient;
    private final Duration timeout;

    public HttpFunctionInvoker(WebClient webClient, HttpClientProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofMillis(properties.readTimeoutMs());
    }

    @Override
    public Object invoke(FunctionDefinition definition, InvocationRequest request, ExecutionContext context) {
        if (!(definition.location() instanceof UrlFunctionLocation location)) {
            throw new IllegalArgumentException("Function " + definition.id() + " has no invoke URL");
        }
        Object body = webClient.post()
                .uri(location.invokeUrl())
                .header(INVOCATION_ID_HEADER, context.invocationId())
                .header(RETRY_COUNT_HEADER, Integer.toString(context.retryCount()))
                .header(MAX_RETRY_COUNT_HEADER, Integer.toString(context.maxRetryCount()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        MediaType contentType = response.headers().contentType()
                                .orElse(MediaType.APPLICATION_JSON);
                        Mono<Object> payload = MediaType.TEXT_PLAIN.isCompatibleWith(contentType)
                                ? response.bodyToMono(String.class).cast(Object.class)
                                : response.bodyToMono(Object.class);
                        return payload.defaultIfEmpty(EMPTY);
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty(response.statusCode().toString())
                            .flatMap(msg -> Mono.error(
                                    new FunctionInvocationException(response.statusCode().value(), msg)));
                })
                .timeout(timeout)
                .block();
        return Optional.ofNullable(body).filter(value -> value != EMPTY).orElse(null);
    }
}
