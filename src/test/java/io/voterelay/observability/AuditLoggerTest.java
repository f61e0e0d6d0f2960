package io.voterelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.voterelay.model.DelegationEdge;
import io.voterelay.model.SignerId;
import io.voterelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class AuditLoggerTest {
    private static final DelegationEdge EDGE = DelegationEdge.create(7L, new SignerId("alice"), new SignerId("bob"), 40L, 12L);

    @Test
    void eventsAreChainedAndVerifiable() throws Exception {
        Path root = Files.createTempDirectory("voterelay-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "default", "");
            logger.onEvent(DelegationEvent.created(EDGE));
            logger.onEvent(DelegationEvent.expired(EDGE));

            List<String> rows = logger.tail(10);
            Assertions.assertEquals(2, rows.size());
            JsonNode first = Jsons.mapper().readTree(rows.get(0));
            JsonNode second = Jsons.mapper().readTree(rows.get(1));
            Assertions.assertEquals("delegation.created", first.path("action").asText());
            Assertions.assertEquals("alice", first.path("actor").asText());
            Assertions.assertEquals("delegation/7", first.path("resource").asText());
            Assertions.assertEquals("bob", first.path("details").path("delegate").asText());
            Assertions.assertEquals("", first.path("prev_hash").asText());
            Assertions.assertEquals(first.path("hash").asText(), second.path("prev_hash").asText());
            Assertions.assertEquals(40L, second.path("details").path("at").asLong());

            AuditLogger.IntegrityOutcome outcome = logger.verify();
            Assertions.assertTrue(outcome.ok());
            Assertions.assertEquals(2, outcome.checkedRows());
            Assertions.assertEquals(logger.currentHash(), outcome.tailHash());

            AuditLogger reopened = new AuditLogger(file, "default", "");
            Assertions.assertEquals(logger.currentHash(), reopened.currentHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperedRowIsDetected() throws Exception {
        Path root = Files.createTempDirectory("voterelay-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "default", "");
            logger.onEvent(DelegationEvent.created(EDGE));
            logger.onEvent(DelegationEvent.revoked(EDGE, 20L));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.set(0, lines.get(0).replace("\"bob\"", "\"mallory\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.IntegrityOutcome outcome = new AuditLogger(file, "default", "").verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertEquals(1, outcome.brokenLine());
            Assertions.assertEquals("hash_mismatch", outcome.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void signatureIsCheckedWhenSecretConfigured() throws Exception {
        Path root = Files.createTempDirectory("voterelay-test-audit-signature-");
        try {
            Path file = root.resolve("audit.log");
            new AuditLogger(file, "default", "s3cret").onEvent(DelegationEvent.created(EDGE));
            Assertions.assertTrue(new AuditLogger(file, "default", "s3cret").verify().ok());

            AuditLogger.IntegrityOutcome wrongKey = new AuditLogger(file, "default", "other").verify();
            Assertions.assertFalse(wrongKey.ok());
            Assertions.assertEquals("signature_mismatch", wrongKey.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tailNeverSeesAPartlyWrittenRow() throws Exception {
        Path root = Files.createTempDirectory("voterelay-test-audit-concurrent-tail-");
        try {
            AuditLogger logger = new AuditLogger(root.resolve("audit.log"), "default", "");
            ExecutorService writer = Executors.newSingleThreadExecutor();
            try {
                Future<?> writes = writer.submit(() -> {
                    for (int i = 0; i < 300; i++) {
                        logger.onEvent(DelegationEvent.created(EDGE));
                    }
                });
                while (!writes.isDone()) {
                    for (String row : logger.tail(5)) {
                        Assertions.assertTrue(Jsons.mapper().readTree(row).has("hash"), row);
                    }
                }
                writes.get(30, TimeUnit.SECONDS);
            } finally {
                writer.shutdownNow();
            }
            Assertions.assertEquals(300, logger.verify().checkedRows());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
