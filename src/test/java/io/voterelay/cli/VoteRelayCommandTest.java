package io.voterelay.cli;

import io.voterelay.config.VoteRelayConfig;
import io.voterelay.model.SignerId;
import io.voterelay.runtime.VoteRelayRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class VoteRelayCommandTest {

    @Test
    void delegateResolveAndRevokeThroughCli() throws Exception {
        Path root = Files.createTempDirectory("voterelay-test-cli-");
        try {
            String r = root.toString();
            Assertions.assertEquals(0, run("--root", r, "init", "--signer", "alice", "--signer", "bob", "--signer", "carol"));
            Assertions.assertEquals(0, run("--root", r, "delegate", "--from", "alice", "--to", "bob", "--now", "1"));
            Assertions.assertEquals(0, run("--root", r, "delegate", "--from", "bob", "--to", "carol", "--expiry", "50", "--now", "2"));
            Assertions.assertEquals(0, run("--root", r, "resolve", "--signer", "alice", "--now", "3"));

            VoteRelayRuntime runtime = new VoteRelayRuntime(VoteRelayConfig.fromRoot(r));
            runtime.init();
            Assertions.assertEquals(3, runtime.settings().signers().size());
            Assertions.assertEquals(new SignerId("carol"), runtime.resolveEffectiveVoter("alice", 3L));

            Assertions.assertEquals(VoteRelayCommand.EXIT_REJECTED,
                    run("--root", r, "delegate", "--from", "carol", "--to", "alice", "--now", "4"));
            Assertions.assertEquals(VoteRelayCommand.EXIT_REJECTED,
                    run("--root", r, "revoke", "--delegator", "alice", "--caller", "bob", "--now", "5"));
            Assertions.assertEquals(0, run("--root", r, "revoke", "--delegator", "alice", "--now", "5"));
            Assertions.assertEquals(VoteRelayCommand.EXIT_REJECTED, run("--root", r, "revoke", "--delegator", "alice", "--now", "6"));

            Assertions.assertEquals(0, run("--root", r, "active", "--delegator", "bob", "--now", "60"));
            Assertions.assertEquals(0, run("--root", r, "history", "--delegator", "bob", "--now", "60"));
            Assertions.assertEquals(1, runtime.getHistory("bob", 60L).size());
            Assertions.assertEquals(0, run("--root", r, "audit-tail", "--lines", "5"));
            Assertions.assertEquals(0, run("--root", r, "audit-verify"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingRequiredOptionIsUsageError() throws Exception {
        Path root = Files.createTempDirectory("voterelay-test-cli-usage-");
        try {
            Assertions.assertNotEquals(0, run("--root", root.toString(), "delegate", "--from", "alice", "--now", "1"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static int run(String... args) {
        return new CommandLine(new VoteRelayCommand()).execute(args);
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
