package io.voterelay.config;

import io.voterelay.model.SignerId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;

final class DelegationSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path dir = Files.createTempDirectory("voterelay-test-settings-missing-");
        try {
            DelegationSettings settings = DelegationSettings.load(dir.resolve(VoteRelayConfig.SETTINGS_FILE));
            Assertions.assertEquals(DelegationSettings.defaults(), settings);
            Assertions.assertEquals(3, settings.maxDepth());
            Assertions.assertTrue(settings.signers().isEmpty());
        } finally {
            Files.deleteIfExists(dir);
        }
    }

    @Test
    void fullFileIsLoaded() throws Exception {
        Path file = copyFixture("settings/full-settings.json");
        try {
            DelegationSettings settings = DelegationSettings.load(file);
            Assertions.assertEquals(4, settings.signers().size());
            Assertions.assertTrue(settings.signers().contains(new SignerId("carol")));
            Assertions.assertEquals(16, settings.historyCapacity());
            Assertions.assertEquals("", settings.auditSigningSecret());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void partialFileFallsBackToDefaultsAndTrimsIds() throws Exception {
        Path file = copyFixture("settings/partial-settings.json");
        try {
            DelegationSettings settings = DelegationSettings.load(file);
            Assertions.assertEquals(Set.of(new SignerId("alice"), new SignerId("bob")), settings.signers());
            Assertions.assertEquals(DelegationSettings.MAX_DEPTH, settings.maxDepth());
            Assertions.assertEquals(DelegationSettings.DEFAULT_HISTORY_CAPACITY, settings.historyCapacity());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void outOfRangeValuesAreRejected() throws Exception {
        Path file = Files.createTempFile("voterelay-test-settings-", ".json");
        try {
            Files.writeString(file, "{\"maxDepth\": 4}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> DelegationSettings.load(file));
            Files.writeString(file, "{\"historyCapacity\": 0}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> DelegationSettings.load(file));
            Files.writeString(file, "{\"signers\": [\"\"]}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> DelegationSettings.load(file));
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> DelegationSettings.load(file));
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void writtenSettingsLoadBack() throws Exception {
        Path file = Files.createTempFile("voterelay-test-settings-write-", ".json");
        try {
            DelegationSettings settings = new DelegationSettings(
                    Set.of(new SignerId("x"), new SignerId("y")), 2, 5, "secret");
            settings.write(file);
            Assertions.assertEquals(settings, DelegationSettings.load(file));
        } finally {
            Files.deleteIfExists(file);
        }
    }

    private static Path copyFixture(String resource) throws IOException {
        Path file = Files.createTempFile("voterelay-test-fixture-", ".json");
        try (InputStream in = DelegationSettingsTest.class.getClassLoader().getResourceAsStream(resource)) {
            Assertions.assertNotNull(in, "missing fixture " + resource);
            Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
        }
        return file;
    }
}
