package com.deepansh.desk.cli;

import com.deepansh.desk.config.DeskProperties;
import com.deepansh.desk.context.ContextBag;
import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.dispatch.DeskResponse;
import com.deepansh.desk.exception.SessionNotFoundException;
import com.deepansh.desk.session.SessionRegistry;
import com.deepansh.desk.session.SessionRuntime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Interactive read-eval loop over a single session.
 *
 * Recognized inputs: exit / quit (leave, session kept), reset (clear and
 * ask for identity again), empty line (ignored). Everything else goes to the
 * Dispatcher. {@code --resume=<sessionId>} continues a saved session.
 */
@Component
@ConditionalOnProperty(prefix = "desk.console", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ConsoleRunner implements CommandLineRunner {

    static final String RESUME_FLAG = "--resume=";

    private final SessionRegistry sessionRegistry;
    private final ConsoleIO console;
    private final DeskProperties properties;

    @Override
    public void run(String... args) {
        console.println("Expense application desk. Type 'exit' to leave, 'reset' to start over.");

        SessionRuntime runtime = resume(args);
        if (runtime == null) {
            String requester = askIdentity();
            if (requester == null) {
                return;
            }
            runtime = sessionRegistry.create(requester, properties.getSession().getIdPrefix());
        } else {
            if (runtime.getRecoveryNotice() != null) {
                console.println(runtime.getRecoveryNotice());
            }
            if (runtime.getSession().getRequesterId() == null && !reacquireIdentity(runtime)) {
                return;
            }
            DeskResponse resumed = sessionRegistry.execute(runtime.getSessionId(),
                    rt -> rt.getDispatcher().resume(contextOf(rt)));
            print(resumed);
        }
        console.println("Session: " + runtime.getSessionId());
        log.info("Console session {} started", runtime.getSessionId());

        while (true) {
            String line = console.readLine("> ");
            if (line == null) {
                break;
            }
            DeskResponse response = sessionRegistry.execute(runtime.getSessionId(),
                    rt -> rt.getDispatcher().handle(line, contextOf(rt)));
            print(response);

            if (response.getType() == DeskResponse.Type.EXIT) {
                break;
            }
            if (response.getType() == DeskResponse.Type.RESET
                    || response.getType() == DeskResponse.Type.IDENTITY_REQUIRED) {
                if (!reacquireIdentity(runtime)) {
                    break;
                }
            }
        }
        console.println("Session saved: " + runtime.getSessionId());
    }

    private SessionRuntime resume(String... args) {
        for (String arg : args) {
            if (arg.startsWith(RESUME_FLAG)) {
                String id = arg.substring(RESUME_FLAG.length()).trim();
                try {
                    return sessionRegistry.open(id);
                } catch (SessionNotFoundException | IllegalArgumentException e) {
                    console.println("Session " + id + " was not found; starting a new one.");
                    log.warn("Resume failed for {}: {}", id, e.getMessage());
                }
            }
        }
        return null;
    }

    private boolean reacquireIdentity(SessionRuntime runtime) {
        String requester = askIdentity();
        if (requester == null) {
            return false;
        }
        print(sessionRegistry.execute(runtime.getSessionId(), rt -> rt.getDispatcher().identify(requester)));
        return true;
    }

    /** Asks until a non-blank name is given; null at end of input. */
    private String askIdentity() {
        while (true) {
            String name = console.readLine("Your name: ");
            if (name == null) {
                return null;
            }
            if (!name.isBlank()) {
                return name.trim();
            }
            console.println("A name is required to file an application.");
        }
    }

    private static ContextBag contextOf(SessionRuntime runtime) {
        String requester = runtime.getSession().getRequesterId();
        return requester == null ? ContextBag.empty() : ContextBag.of(ContextKeys.REQUESTER_ID, requester);
    }

    private void print(DeskResponse response) {
        if (response.getType() == DeskResponse.Type.IGNORED) {
            return;
        }
        if (response.getMessage() != null && !response.getMessage().isBlank()) {
            console.println(response.getMessage());
        }
        switch (response.getType()) {
            case COMPLETED -> console.println("Report: " + response.getArtifactLocation());
            case AWAITING_APPROVAL -> console.println("Waiting for a decision on application "
                    + response.getActionId() + ". Resume later with " + RESUME_FLAG + response.getSessionId());
            default -> { }
        }
    }
}
