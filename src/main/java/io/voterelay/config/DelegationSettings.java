package io.voterelay.config;

import io.voterelay.model.SignerId;
import io.voterelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tunables of the delegation engine. Loaded from {@value VoteRelayConfig#SETTINGS_FILE}
 * when present; every field falls back to its default when omitted.
 */
public record DelegationSettings(
        Set<SignerId> signers,
        int maxDepth,
        int historyCapacity,
        String auditSigningSecret
) {
    public static final int MAX_DEPTH = 3;
    public static final int DEFAULT_HISTORY_CAPACITY = 16;

    public DelegationSettings {
        signers = signers == null ? Set.of() : Set.copyOf(signers);
        if (maxDepth < 1 || maxDepth > MAX_DEPTH) {
            throw new IllegalArgumentException("maxDepth must be within [1, " + MAX_DEPTH + "], got " + maxDepth);
        }
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be positive, got " + historyCapacity);
        }
        auditSigningSecret = auditSigningSecret == null ? "" : auditSigningSecret.trim();
    }

    public static DelegationSettings defaults() {
        return new DelegationSettings(Set.of(), MAX_DEPTH, DEFAULT_HISTORY_CAPACITY, "");
    }

    public DelegationSettings withSigners(Set<SignerId> eligible) {
        return new DelegationSettings(eligible, maxDepth, historyCapacity, auditSigningSecret);
    }

    public static DelegationSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        SettingsFile raw;
        try {
            raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings: " + file, e);
        }
        if (raw == null) {
            return defaults();
        }
        DelegationSettings defaults = defaults();
        Set<SignerId> signers = new LinkedHashSet<>();
        if (raw.signers() != null) {
            for (String signer : raw.signers()) {
                signers.add(new SignerId(signer));
            }
        }
        return new DelegationSettings(
                signers,
                raw.maxDepth() == null ? defaults.maxDepth() : raw.maxDepth(),
                raw.historyCapacity() == null ? defaults.historyCapacity() : raw.historyCapacity(),
                raw.auditSigningSecret()
        );
    }

    public void write(Path file) {
        List<String> ids = new ArrayList<>();
        signers.stream().sorted().forEach(s -> ids.add(s.value()));
        SettingsFile raw = new SettingsFile(ids, maxDepth, historyCapacity,
                auditSigningSecret.isBlank() ? null : auditSigningSecret);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Jsons.mapper().writeValue(file.toFile(), raw);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write settings: " + file, e);
        }
    }

    record SettingsFile(
            List<String> signers,
            Integer maxDepth,
            Integer historyCapacity,
            String auditSigningSecret
    ) {
    }
}
