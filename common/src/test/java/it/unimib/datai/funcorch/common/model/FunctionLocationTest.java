package it.unimib.datai.funcorch.common.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FunctionLocationTest {

    @Test
    void remote_idCombinesAccountAndBlobPath() {
        RemoteFunctionLocation location = new RemoteFunctionLocation(
                "AccountName=prodfuncs;AccountKey=abc", new BlobPath("functions", "retry.dll"), "retryCheck");

        assertThat(location.kind()).isEqualTo(LocationKind.REMOTE);
        assertThat(location.id()).isEqualTo("prodfuncs/functions/retry.dll");
        assertThat(location.shortName()).isEqualTo("retry.dll");
        assertThat(location.account().name()).isEqualTo("prodfuncs");
    }

    @Test
    void url_idIsInvokeUrl_shortNameFallsBackToLastSegment() {
        UrlFunctionLocation location = new UrlFunctionLocation("http://fn.example/api/echo/", null, null);

        assertThat(location.kind()).isEqualTo(LocationKind.URL);
        assertThat(location.id()).isEqualTo("http://fn.example/api/echo/");
        assertThat(location.shortName()).isEqualTo("echo");
        assertThat(new UrlFunctionLocation("http://fn.example/api/echo", "echoFn", null).shortName())
                .isEqualTo("echoFn");
    }

    @Test
    void local_idIsPrefixedEntryPoint() {
        LocalFunctionLocation location = new LocalFunctionLocation("retryCheck");

        assertThat(location.kind()).isEqualTo(LocationKind.LOCAL);
        assertThat(location.id()).isEqualTo("local:retryCheck");
        assertThat(location.accountConnectionString()).isNull();
    }

    @Test
    void definition_withTimestamp_keepsIdentity() {
        FunctionDefinition definition = new FunctionDefinition(
                new LocalFunctionLocation("retryCheck"), "d", Instant.EPOCH, "Host, Version=1.0");

        FunctionDefinition refreshed = definition.withTimestamp(Instant.EPOCH.plusSeconds(5));

        assertThat(refreshed.id()).isEqualTo(definition.id());
        assertThat(refreshed.timestamp()).isEqualTo(Instant.EPOCH.plusSeconds(5));
        assertThat(refreshed.description()).isEqualTo("d");
    }
}
