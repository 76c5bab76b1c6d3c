package it.unimib.datai.funcorch.controlplane.invoke;

import it.unimib.datai.funcorch.common.model.BlobPath;
import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.model.LocalFunctionLocation;
import it.unimib.datai.funcorch.common.model.RemoteFunctionLocation;
import it.unimib.datai.funcorch.common.model.UrlFunctionLocation;
import it.unimib.datai.funcorch.common.runtime.ExecutionContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvokerRouterTest {

    private final InvocationRequest request = new InvocationRequest("in", Map.of());
    private final ExecutionContext context = new ExecutionContext("i", "f", 0, 2);

    @Mock
    private LocalFunctionInvoker localInvoker;

    @Mock
    private HttpFunctionInvoker httpInvoker;

    @InjectMocks
    private InvokerRouter router;

    @Test
    void urlLocation_goesOverHttp() throws Exception {
        FunctionDefinition definition = new FunctionDefinition(
                new UrlFunctionLocation("http://fn.example/echo", null, null), "d", Instant.EPOCH, null);
        when(httpInvoker.invoke(definition, request, context)).thenReturn("remote");

        assertThat(router.invoke(definition, request, context)).isEqualTo("remote");
        verifyNoInteractions(localInvoker);
    }

    @Test
    void blobAndLocalLocations_runInProcess() throws Exception {
        FunctionDefinition blob = new FunctionDefinition(new RemoteFunctionLocation(
                "AccountName=prodfuncs;AccountKey=a2V5", new BlobPath("functions", "a.dll"), "a"), "d", Instant.EPOCH, null);
        FunctionDefinition local = new FunctionDefinition(new LocalFunctionLocation("b"), "d", Instant.EPOCH, null);
        when(localInvoker.invoke(blob, request, context)).thenReturn("blob");
        when(localInvoker.invoke(local, request, context)).thenReturn("local");

        assertThat(router.invoke(blob, request, context)).isEqualTo("blob");
        assertThat(router.invoke(local, request, context)).isEqualTo("local");
        verifyNoInteractions(httpInvoker);
    }
}
