package com.vcc.traingateway.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.dto.ImportResult;
import com.vcc.traingateway.exception.InvalidCredentialException;
import com.vcc.traingateway.model.AccountCredential;
import com.vcc.traingateway.model.ApiKeyCredential;
import com.vcc.traingateway.model.CredentialType;
import com.vcc.traingateway.model.OAuthCredential;
import com.vcc.traingateway.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Imports {@code <accountName>.credentials.json} files as account upserts keyed by name.
 * Runs once at startup when {@code gw.import.directory} is set, and on demand from the admin API.
 * A file that fails to parse or store is reported and skipped; the rest still import.
 */
@Service
public class CredentialImportService {
    private static final Logger log = LoggerFactory.getLogger(CredentialImportService.class);

    static final String FILE_SUFFIX = ".credentials.json";
    static final String IMPORTED_ID_PREFIX = "acc_";

    private final AccountService accountService;
    private final ObjectMapper objectMapper;
    private final GwProperties properties;

    public CredentialImportService(AccountService accountService, ObjectMapper objectMapper,
                                   GwProperties properties) {
        this.accountService = accountService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void importOnStartup() {
        String directory = properties.getImport().getDirectory();
        if (directory == null || directory.isBlank()) {
            return;
        }
        importDirectory(Paths.get(directory))
                .subscribe(
                        result -> log.info("Startup credential import from {}: {} created, {} updated, {} failed",
                                directory, result.created(), result.updated(), result.failed().size()),
                        e -> log.error("Startup credential import from {} failed: {}", directory, e.getMessage()));
    }

    /**
     * Import the configured directory.
     */
    public Mono<ImportResult> importConfigured() {
        String directory = properties.getImport().getDirectory();
        if (directory == null || directory.isBlank()) {
            return Mono.error(new IllegalStateException("gw.import.directory is not configured"));
        }
        return importDirectory(Paths.get(directory));
    }

    public Mono<ImportResult> importDirectory(Path directory) {
        AtomicInteger created = new AtomicInteger();
        AtomicInteger updated = new AtomicInteger();
        List<String> failed = Collections.synchronizedList(new ArrayList<>());

        return listCredentialFiles(directory)
                .concatMap(file -> importFile(file)
                        .doOnNext(isNew -> {
                            if (isNew) {
                                created.incrementAndGet();
                            } else {
                                updated.incrementAndGet();
                            }
                        })
                        .onErrorResume(e -> {
                            log.warn("Failed to import {}: {}", file.getFileName(), e.getMessage());
                            failed.add(file.getFileName().toString());
                            return Mono.empty();
                        }))
                .then(Mono.fromCallable(() -> new ImportResult(created.get(), updated.get(), List.copyOf(failed))));
    }

    private Flux<Path> listCredentialFiles(Path directory) {
        return Mono.fromCallable(() -> {
                    if (!Files.isDirectory(directory)) {
                        log.info("Credential import directory {} not found, skipping", directory);
                        return List.<Path>of();
                    }
                    try (Stream<Path> files = Files.list(directory)) {
                        return files
                                .filter(path -> path.getFileName().toString().endsWith(FILE_SUFFIX))
                                .sorted()
                                .collect(Collectors.toList());
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable);
    }

    /**
     * @return true when the account was created, false when an existing one was updated
     */
    Mono<Boolean> importFile(Path file) {
        String fileName = file.getFileName().toString();
        String accountName = fileName.substring(0, fileName.length() - FILE_SUFFIX.length());
        return Mono.fromCallable(() -> readFile(file))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(credentials -> {
                    String accountId = credentials.accountId() != null && !credentials.accountId().isBlank()
                            ? credentials.accountId()
                            : IMPORTED_ID_PREFIX + accountName;
                    return accountService.upsertByName(accountName, accountId, toCredential(credentials),
                            Provider.fromDb(credentials.provider()), credentials.region());
                });
    }

    private CredentialFile readFile(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), CredentialFile.class);
    }

    static AccountCredential toCredential(CredentialFile credentials) {
        CredentialType type;
        try {
            type = CredentialType.fromDb(credentials.type());
        } catch (IllegalArgumentException e) {
            throw new InvalidCredentialException("Unknown credential type: " + credentials.type());
        }
        if (type == CredentialType.API_KEY) {
            return new ApiKeyCredential(credentials.apiKey());
        }
        OAuthSection oauth = credentials.oauth();
        if (oauth == null) {
            throw new InvalidCredentialException("oauth credential file has no oauth section");
        }
        return new OAuthCredential(
                oauth.accessToken(),
                oauth.refreshToken(),
                oauth.expiresAt(),
                oauth.scopes() == null ? null : new LinkedHashSet<>(oauth.scopes()),
                Boolean.TRUE.equals(oauth.isMax())
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CredentialFile(
            String type,
            String accountId,
            @JsonProperty("api_key") String apiKey,
            OAuthSection oauth,
            String provider,
            String region
    ) {
        @Override
        public String toString() {
            return "CredentialFile{type=" + type + ", accountId=" + accountId + "}";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OAuthSection(
            String accessToken,
            String refreshToken,
            Long expiresAt,
            List<String> scopes,
            Boolean isMax
    ) {
        @Override
        public String toString() {
            return "OAuthSection{expiresAt=" + expiresAt + ", scopes=" + scopes + "}";
        }
    }
}
