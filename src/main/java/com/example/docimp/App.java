package com.example.docimp;

import com.example.docimp.io.AtomicJsonWriter;
import com.example.docimp.io.StateJson;
import com.example.docimp.session.SessionRecord;
import com.example.docimp.session.SessionStore;
import com.example.docimp.session.SessionType;
import com.example.docimp.tracking.ChangeDetector;
import com.example.docimp.tracking.ChecksumSnapshotter;
import com.example.docimp.workflow.PrerequisiteResult;
import com.example.docimp.workflow.StageStatus;
import com.example.docimp.workflow.StalenessReport;
import com.example.docimp.workflow.StalenessValidator;
import com.example.docimp.workflow.WorkflowLedgerStore;
import com.example.docimp.workflow.WorkflowStage;
import com.example.docimp.workflow.WorkflowStatus;
import com.example.docimp.workflow.WorkflowStatusReporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar docimp-state.jar <config.json> "
            + "<status | check <audit|plan|improve> [--skip] | list-sessions <audit|improve> | delete-session <audit|improve> <id> "
            + "| history [limit] | prune-history | restore-history <snapshot-file>>";

    private static final String SKIP_FLAG = "--skip";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a JSON config file path followed by a command.
        if (args.length < 2) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
        EngineConfig config = new ConfigLoader().load(Path.of(args[0]));
        if (!run(config, args[1], List.of(args).subList(2, args.length))) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
    }

    /**
     * Executes one command; returns false when the command or its arguments are not
     * recognized.
     */
    static boolean run(EngineConfig config, String command, List<String> arguments) throws Exception {
        StateDirectory stateDirectory = new StateDirectory(config.stateDirectory());
        ObjectMapper mapper = StateJson.newMapper();
        AtomicJsonWriter writer = new AtomicJsonWriter(mapper);
        SessionStore sessionStore = new SessionStore(stateDirectory.sessionReportsDirectory(), mapper, writer);
        WorkflowLedgerStore ledgerStore = new WorkflowLedgerStore(
                stateDirectory.workflowStateFile(),
                stateDirectory.historyDirectory(),
                mapper,
                writer,
                Clock.systemUTC(),
                config.historyEnabled()
        );
        ChangeDetector changeDetector = new ChangeDetector(
                new ChecksumSnapshotter(config.projectRoot(), config.checksumThreads()));

        switch (command) {
            case "status":
                logStatus(new WorkflowStatusReporter(ledgerStore, changeDetector).report());
                return true;
            case "check":
                if (arguments.isEmpty() || arguments.size() > 2
                        || (arguments.size() == 2 && !SKIP_FLAG.equals(arguments.get(1)))) {
                    return false;
                }
                StalenessValidator validator = new StalenessValidator(ledgerStore, changeDetector, stateDirectory);
                logPrerequisites(validator.validatePrerequisites(WorkflowStage.fromValue(arguments.get(0)),
                        arguments.size() == 2));
                return true;
            case "list-sessions":
                if (arguments.size() != 1) {
                    return false;
                }
                listSessions(sessionStore, SessionType.fromValue(arguments.get(0)));
                return true;
            case "delete-session":
                if (arguments.size() != 2) {
                    return false;
                }
                sessionStore.delete(arguments.get(1), SessionType.fromValue(arguments.get(0)));
                LOGGER.info("Deleted {} session {}", arguments.get(0), arguments.get(1));
                return true;
            case "history":
                if (arguments.size() > 1) {
                    return false;
                }
                List<Path> snapshots = arguments.isEmpty()
                        ? ledgerStore.listHistory()
                        : ledgerStore.listHistory(Integer.parseInt(arguments.get(0)));
                if (snapshots.isEmpty()) {
                    LOGGER.info("No workflow history snapshots.");
                }
                snapshots.forEach(snapshot -> LOGGER.info("{}", snapshot.getFileName()));
                return true;
            case "prune-history":
                List<Path> deleted = ledgerStore.pruneHistory(config.historyMaxSnapshots(), config.historyMaxAgeDays());
                LOGGER.info("Deleted {} snapshot(s); keeping at most {} from the last {} days.",
                        deleted.size(), config.historyMaxSnapshots(), config.historyMaxAgeDays());
                return true;
            case "restore-history":
                if (arguments.size() != 1) {
                    return false;
                }
                Path snapshot = Path.of(arguments.get(0));
                if (!snapshot.isAbsolute() && snapshot.getParent() == null) {
                    snapshot = stateDirectory.historyDirectory().resolve(snapshot);
                }
                ledgerStore.restore(snapshot);
                return true;
            default:
                return false;
        }
    }

    private static void logStatus(WorkflowStatus status) {
        for (StageStatus stage : status.stages()) {
            if (!stage.ran()) {
                LOGGER.info("{}: not run", stage.stage());
            } else if (stage.changedFiles() > 0) {
                LOGGER.warn("{}: {} ({} items), {} file(s) changed since", stage.stage(), stage.timestamp(),
                        stage.itemCount(), stage.changedFiles());
            } else {
                LOGGER.info("{}: {} ({} items), up to date", stage.stage(), stage.timestamp(), stage.itemCount());
            }
        }
        status.suggestions().forEach(suggestion -> LOGGER.info("Next: {}", suggestion));
    }

    private static void logPrerequisites(PrerequisiteResult result) {
        StalenessReport staleness = result.staleness();
        if (result.hasStalenessWarning()) {
            LOGGER.warn("{} file(s) changed since the inputs of {} were produced: {}. Consider running '{}'.",
                    staleness.changedCount(), staleness.stage(), staleness.changedFiles(), staleness.suggestedCommand());
        }
        if (result.valid()) {
            LOGGER.info("{}: prerequisites satisfied", staleness.stage());
        } else {
            LOGGER.warn(result.error());
            LOGGER.warn(result.suggestion());
        }
    }

    private static void listSessions(SessionStore store, SessionType type) throws Exception {
        List<SessionRecord> sessions = store.list(type);
        if (sessions.isEmpty()) {
            LOGGER.info("No {} sessions.", type);
        }
        for (SessionRecord session : sessions) {
            LOGGER.info("{}  started {}  {}/{}  {}", session.getSessionId(), session.getStartedAt(), session.getCurrentIndex(),
                    session.getTotalItems(), session.isCompleted() ? "completed" : "in progress");
        }
    }
}
