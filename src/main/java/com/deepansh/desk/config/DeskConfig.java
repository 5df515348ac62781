package com.deepansh.desk.config;

import com.deepansh.desk.approval.ConsoleDecisionProvider;
import com.deepansh.desk.approval.DeferredDecisionProvider;
import com.deepansh.desk.approval.HumanDecisionProvider;
import com.deepansh.desk.approval.PolicyDecisionProvider;
import com.deepansh.desk.cli.ConsoleIO;
import com.deepansh.desk.dispatch.DispatcherFactory;
import com.deepansh.desk.dispatch.IntentClassifier;
import com.deepansh.desk.dispatch.TurnErrorHandler;
import com.deepansh.desk.llm.LlmClient;
import com.deepansh.desk.render.DocumentRenderer;
import com.deepansh.desk.render.JsonReportRenderer;
import com.deepansh.desk.render.PdfReportRenderer;
import com.deepansh.desk.render.XlsxReportRenderer;
import com.deepansh.desk.session.FileSessionStore;
import com.deepansh.desk.session.SessionIdGenerator;
import com.deepansh.desk.session.SessionRegistry;
import com.deepansh.desk.session.SessionStore;
import com.deepansh.desk.validation.ExpenseRuleValidator;
import com.deepansh.desk.validation.FareTable;
import com.deepansh.desk.validation.FieldValidator;
import com.deepansh.desk.worker.WorkerRegistry;
import com.deepansh.desk.worker.WorkerServices;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the desk runtime. Everything created here is either immutable or
 * stateless; per-session state lives in SessionRegistry.
 */
@Configuration
@Slf4j
public class DeskConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public FieldValidator fieldValidator(DeskProperties properties, Clock clock) {
        return new ExpenseRuleValidator(properties.getRules(), clock);
    }

    @Bean
    public FareTable fareTable(ObjectMapper objectMapper, DeskProperties properties) {
        return FareTable.load(objectMapper, properties.getRules().getFareTable());
    }

    @Bean
    public DocumentRenderer documentRenderer(DeskProperties properties, Clock clock, ObjectMapper objectMapper) {
        DeskProperties.Render render = properties.getRender();
        Path output = Path.of(render.getOutputDirectory());
        log.info("Reports: format={}, directory={}", render.getFormat(), output.toAbsolutePath());
        return switch (render.getFormat().toLowerCase()) {
            case "json" -> new JsonReportRenderer(output, clock, objectMapper);
            case "pdf" -> new PdfReportRenderer(output, clock, render.getFontPaths().stream()
                    .filter(path -> path != null && !path.isBlank())
                    .map(Path::of)
                    .toList());
            case "xlsx" -> new XlsxReportRenderer(output, clock);
            default -> throw new IllegalStateException("Unknown desk.render.format: " + render.getFormat());
        };
    }

    @Bean
    public ConsoleIO consoleIO() {
        return new ConsoleIO(System.in, System.out);
    }

    @Bean
    public HumanDecisionProvider humanDecisionProvider(DeskProperties properties, ConsoleIO consoleIO) {
        DeskProperties.Approval approval = properties.getApproval();
        log.info("Approval mode: {} [gated={}]", approval.getMode(), approval.getGatedActions());
        return switch (approval.getMode().toLowerCase()) {
            case "console" -> new ConsoleDecisionProvider(consoleIO);
            case "policy" -> new PolicyDecisionProvider(approval.getPolicy().getAutoApproveLimit(),
                    properties.getConsole().isEnabled()
                            ? new ConsoleDecisionProvider(consoleIO)
                            : new DeferredDecisionProvider());
            case "deferred" -> new DeferredDecisionProvider();
            default -> throw new IllegalStateException("Unknown desk.approval.mode: " + approval.getMode());
        };
    }

    @Bean
    @ConditionalOnProperty(prefix = "desk.session", name = "store", havingValue = "file", matchIfMissing = true)
    public SessionStore fileSessionStore(DeskProperties properties, ObjectMapper objectMapper) {
        Path directory = Path.of(properties.getSession().getDirectory());
        log.info("Session store: file [{}]", directory.toAbsolutePath());
        return new FileSessionStore(directory, objectMapper);
    }

    @Bean
    public SessionIdGenerator sessionIdGenerator(Clock clock) {
        return new SessionIdGenerator(clock);
    }

    @Bean
    public WorkerServices workerServices(LlmClient llmClient, FieldValidator validator, DocumentRenderer renderer,
                                         FareTable fareTable, DeskProperties properties, Clock clock) {
        return new WorkerServices(llmClient, validator, renderer, fareTable, properties, clock);
    }

    @Bean
    public WorkerRegistry workerRegistry(WorkerServices services) {
        return new WorkerRegistry(services);
    }

    @Bean
    public IntentClassifier intentClassifier(LlmClient llmClient, WorkerRegistry workerRegistry) {
        return new IntentClassifier(llmClient, workerRegistry);
    }

    @Bean
    public TurnErrorHandler turnErrorHandler() {
        return new TurnErrorHandler();
    }

    @Bean
    public DispatcherFactory dispatcherFactory(WorkerRegistry workerRegistry, IntentClassifier classifier,
                                               HumanDecisionProvider decisionProvider, SessionStore store,
                                               TurnErrorHandler errorHandler, DeskProperties properties,
                                               Clock clock) {
        return new DispatcherFactory(workerRegistry, classifier, decisionProvider, store,
                errorHandler, properties, clock);
    }

    @Bean
    public SessionRegistry sessionRegistry(SessionStore store, DispatcherFactory dispatcherFactory,
                                           SessionIdGenerator idGenerator, DeskProperties properties,
                                           Clock clock) {
        DeskProperties.Session session = properties.getSession();
        return new SessionRegistry(store, dispatcherFactory, idGenerator, clock,
                Duration.ofMinutes(session.getMaxIdleMinutes()), session.getMaxLive());
    }
}
