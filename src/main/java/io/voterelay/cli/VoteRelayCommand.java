package io.voterelay.cli;

import io.voterelay.config.DelegationSettings;
import io.voterelay.config.VoteRelayConfig;
import io.voterelay.lifecycle.DelegationException;
import io.voterelay.model.DelegationEdge;
import io.voterelay.model.HistoryEntry;
import io.voterelay.model.Resolution;
import io.voterelay.model.SignerId;
import io.voterelay.observability.AuditLogger;
import io.voterelay.runtime.VoteRelayRuntime;
import io.voterelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "voterelay",
        mixinStandardHelpOptions = true,
        description = "Treasury vote delegation CLI",
        subcommands = {
                VoteRelayCommand.InitCommand.class,
                VoteRelayCommand.DelegateCommand.class,
                VoteRelayCommand.RevokeCommand.class,
                VoteRelayCommand.ResolveCommand.class,
                VoteRelayCommand.ActiveCommand.class,
                VoteRelayCommand.HistoryCommand.class,
                VoteRelayCommand.AuditTailCommand.class,
                VoteRelayCommand.AuditVerifyCommand.class
        }
)
public final class VoteRelayCommand implements Runnable {
    static final int EXIT_REJECTED = 2;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (treasury scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | delegate | revoke | resolve | active | history | audit-tail | audit-verify");
    }

    VoteRelayConfig config() {
        return VoteRelayConfig.fromRoot(root, namespace);
    }

    VoteRelayRuntime runtime() {
        VoteRelayRuntime runtime = new VoteRelayRuntime(config());
        runtime.init();
        return runtime;
    }

    static int rejected(DelegationException e) {
        System.err.println("error: " + e.error() + " " + e.getMessage());
        return EXIT_REJECTED;
    }

    static Map<String, Object> edgeView(DelegationEdge edge) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("delegationId", edge.delegationId());
        out.put("delegator", edge.delegator().value());
        out.put("delegate", edge.delegate().value());
        out.put("expiry", edge.expiry());
        out.put("createdAt", edge.createdAt());
        out.put("permanent", edge.isPermanent());
        return out;
    }

    @Command(name = "init", description = "Initialize the SQLite schema and optionally register signers")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        VoteRelayCommand parent;

        @Option(names = {"--signer"}, description = "Eligible signer id (repeatable); replaces the configured set")
        List<String> signers;

        @Override
        public Integer call() {
            VoteRelayConfig config = parent.config();
            if (signers != null && !signers.isEmpty()) {
                Set<SignerId> ids = new LinkedHashSet<>();
                for (String signer : signers) {
                    ids.add(new SignerId(signer));
                }
                DelegationSettings.load(config.settingsFile()).withSigners(ids).write(config.settingsFile());
            }
            VoteRelayRuntime runtime = parent.runtime();
            System.out.println("Initialized VoteRelay at: " + config.rootDir()
                    + " (" + runtime.settings().signers().size() + " signers)");
            return 0;
        }
    }

    @Command(name = "delegate", description = "Delegate voting authority to another signer")
    static final class DelegateCommand implements Callable<Integer> {
        @ParentCommand
        VoteRelayCommand parent;

        @Option(names = {"--from"}, required = true, description = "Delegator signer id")
        String from;

        @Option(names = {"--to"}, required = true, description = "Delegate signer id")
        String to;

        @Option(names = {"--expiry"}, description = "Clock value at which the delegation ends; omit for permanent")
        Long expiry;

        @Option(names = {"--now"}, required = true, description = "Current host clock value")
        long now;

        @Override
        public Integer call() {
            VoteRelayRuntime runtime = parent.runtime();
            try {
                DelegationEdge edge = runtime.delegate(from, to, expiry, now);
                System.out.println(Jsons.toJson(edgeView(edge)));
                return 0;
            } catch (DelegationException e) {
                return rejected(e);
            }
        }
    }

    @Command(name = "revoke", description = "Revoke the active delegation of a delegator")
    static final class RevokeCommand implements Callable<Integer> {
        @ParentCommand
        VoteRelayCommand parent;

        @Option(names = {"--delegator"}, required = true, description = "Delegator signer id")
        String delegator;

        @Option(names = {"--caller"}, description = "Calling signer id (defaults to the delegator)")
        String caller;

        @Option(names = {"--now"}, required = true, description = "Current host clock value")
        long now;

        @Override
        public Integer call() {
            VoteRelayRuntime runtime = parent.runtime();
            try {
                HistoryEntry ended = runtime.revoke(delegator, caller == null || caller.isBlank() ? delegator : caller, now);
                System.out.println(Jsons.toJson(ended));
                return 0;
            } catch (DelegationException e) {
                return rejected(e);
            }
        }
    }

    @Command(name = "resolve", description = "Resolve the effective voter of a signer")
    static final class ResolveCommand implements Callable<Integer> {
        @ParentCommand
        VoteRelayCommand parent;

        @Option(names = {"--signer"}, required = true, description = "Signer id")
        String signer;

        @Option(names = {"--now"}, required = true, description = "Current host clock value")
        long now;

        @Override
        public Integer call() {
            Resolution resolution = parent.runtime().resolve(signer, now);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("signer", signer);
            out.put("effectiveVoter", resolution.effectiveVoter().value());
            out.put("hops", resolution.hops());
            out.put("path", resolution.path().stream().map(SignerId::value).toList());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "active", description = "Show the active delegation of a delegator")
    static final class ActiveCommand implements Callable<Integer> {
        @ParentCommand
        VoteRelayCommand parent;

        @Option(names = {"--delegator"}, required = true, description = "Delegator signer id")
        String delegator;

        @Option(names = {"--now"}, required = true, description = "Current host clock value")
        long now;

        @Override
        public Integer call() {
            Optional<DelegationEdge> edge = parent.runtime().getActiveDelegation(delegator, now);
            if (edge.isEmpty()) {
                System.out.println("No active delegation for " + delegator);
                return 0;
            }
            System.out.println(Jsons.toJson(edgeView(edge.get())));
            return 0;
        }
    }

    @Command(name = "history", description = "List past delegations of a delegator, most recent first")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        VoteRelayCommand parent;

        @Option(names = {"--delegator"}, required = true, description = "Delegator signer id")
        String delegator;

        @Option(names = {"--now"}, required = true, description = "Current host clock value")
        long now;

        @Override
        public Integer call() {
            List<HistoryEntry> entries = parent.runtime().getHistory(delegator, now);
            System.out.println(Jsons.toJson(entries));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        VoteRelayCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            for (String row : parent.runtime().auditTail(lines)) {
                System.out.println(row);
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        VoteRelayCommand parent;

        @Override
        public Integer call() {
            AuditLogger.IntegrityOutcome out = parent.runtime().verifyAudit();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }
}
