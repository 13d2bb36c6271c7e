package com.vcc.traingateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.exception.InvalidCredentialException;
import com.vcc.traingateway.model.AccountCredential;
import com.vcc.traingateway.model.ApiKeyCredential;
import com.vcc.traingateway.model.OAuthCredential;
import com.vcc.traingateway.model.Provider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialImportServiceTest {

    @Mock
    private AccountService accountService;

    @TempDir
    Path directory;

    private GwProperties properties;
    private CredentialImportService importService;

    @BeforeEach
    void setUp() {
        properties = new GwProperties();
        importService = new CredentialImportService(accountService, new ObjectMapper(), properties);
    }

    private void write(String name, String json) throws IOException {
        Files.write(directory.resolve(name), json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void importDirectory_createsAndUpdatesByName() throws IOException {
        write("main.credentials.json", "{\"type\":\"api_key\",\"api_key\":\"sk-ant-api03-main-1111\"}");
        write("pro.credentials.json", "{\"type\":\"oauth\",\"accountId\":\"acc_pro\",\"oauth\":{"
                + "\"accessToken\":\"at-123456789\",\"refreshToken\":\"rt-123456789\","
                + "\"expiresAt\":1748779200000,\"scopes\":[\"user:inference\"],\"isMax\":true}}");
        write("notes.txt", "ignored");
        when(accountService.upsertByName(eq("main"), eq("acc_main"), any(), eq(Provider.ANTHROPIC), isNull()))
                .thenReturn(Mono.just(true));
        when(accountService.upsertByName(eq("pro"), eq("acc_pro"), any(), eq(Provider.ANTHROPIC), isNull()))
                .thenReturn(Mono.just(false));

        StepVerifier.create(importService.importDirectory(directory))
                .assertNext(result -> {
                    assertEquals(1, result.created());
                    assertEquals(1, result.updated());
                    assertTrue(result.failed().isEmpty());
                })
                .verifyComplete();

        ArgumentCaptor<AccountCredential> credential = ArgumentCaptor.forClass(AccountCredential.class);
        verify(accountService).upsertByName(eq("pro"), eq("acc_pro"), credential.capture(), any(), any());
        OAuthCredential oauth = (OAuthCredential) credential.getValue();
        assertEquals(1748779200000L, oauth.expiresAt());
        assertEquals(Set.of("user:inference"), oauth.scopes());
        assertTrue(oauth.tier());
    }

    @Test
    void importDirectory_badFileIsReportedAndOthersContinue() throws IOException {
        write("a.credentials.json", "{not json");
        write("b.credentials.json", "{\"type\":\"api_key\",\"api_key\":\"sk-ant-api03-bbbb-2222\","
                + "\"provider\":\"bedrock\",\"region\":\"eu-west-1\"}");
        when(accountService.upsertByName(eq("b"), eq("acc_b"), any(), eq(Provider.BEDROCK), eq("eu-west-1")))
                .thenReturn(Mono.just(true));

        StepVerifier.create(importService.importDirectory(directory))
                .assertNext(result -> {
                    assertEquals(1, result.created());
                    assertEquals(List.of("a.credentials.json"), result.failed());
                })
                .verifyComplete();
    }

    @Test
    void importDirectory_missingDirectory_isEmptyResult() {
        StepVerifier.create(importService.importDirectory(directory.resolve("absent")))
                .assertNext(result -> assertEquals(0, result.total()))
                .verifyComplete();
    }

    @Test
    void importConfigured_withoutDirectory_fails() {
        StepVerifier.create(importService.importConfigured())
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void toCredential_apiKeyFile() {
        AccountCredential credential = CredentialImportService.toCredential(new CredentialImportService.CredentialFile(
                "api_key", null, "sk-ant-api03-xyz-9999", null, null, null));

        assertTrue(credential instanceof ApiKeyCredential);
    }

    @Test
    void toCredential_unknownTypeOrMissingSection_rejected() {
        assertThrows(InvalidCredentialException.class, () -> CredentialImportService.toCredential(
                new CredentialImportService.CredentialFile("session", null, null, null, null, null)));
        assertThrows(InvalidCredentialException.class, () -> CredentialImportService.toCredential(
                new CredentialImportService.CredentialFile("oauth", null, null, null, null, null)));
    }
}
