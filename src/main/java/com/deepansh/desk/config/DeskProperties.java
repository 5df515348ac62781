package com.deepansh.desk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the desk runtime.
 * Bound from application.yml under the "desk" prefix; read-only after startup
 * and the only state shared between sessions.
 */
@Component
@ConfigurationProperties(prefix = "desk")
@Data
public class DeskProperties {

    private History history = new History();
    private Loop loop = new Loop();
    private Rules rules = new Rules();
    private Approval approval = new Approval();
    private Session session = new Session();
    private Render render = new Render();
    private Console console = new Console();

    @Data
    public static class History {
        /** Wider: the dispatcher keeps cross-handler context. */
        private int dispatcherWindow = 30;
        private int workerWindow = 15;
    }

    @Data
    public static class Loop {
        private int maxIterations = 10;
    }

    @Data
    public static class Rules {
        private long maxAmount = 30000;
        private long managerApprovalThreshold = 5000;
        private int dateWindowDays = 90;
        private int maxFutureDays = 0;
        private List<CommuterRoute> commuterRoutes = new ArrayList<>(List.of(
                new CommuterRoute("Ueno", "Toyosu"),
                new CommuterRoute("Meguro", "Toyosu"),
                new CommuterRoute("Kawasaki", "Toyosu")));
        private String fareTable = "fares/fares.json";
    }

    @Data
    public static class CommuterRoute {
        private String from;
        private String to;

        public CommuterRoute() {
        }

        public CommuterRoute(String from, String to) {
            this.from = from;
            this.to = to;
        }
    }

    @Data
    public static class Approval {
        /** console, policy or deferred */
        private String mode = "console";
        private List<String> gatedActions = new ArrayList<>(List.of(
                "travel_expense_report", "receipt_expense_report"));
        private int maxResubmissions = 3;
        private Policy policy = new Policy();

        @Data
        public static class Policy {
            private long autoApproveLimit = 5000;
        }
    }

    @Data
    public static class Session {
        /** file or redis */
        private String store = "file";
        private String directory = "./storage/sessions";
        private String idPrefix = "";
        private long redisTtlHours = 72;
        /** Live sessions are released from memory after this idle time; the store keeps them. */
        private long maxIdleMinutes = 30;
        private int maxLive = 500;
    }

    @Data
    public static class Render {
        /** pdf, xlsx or json */
        private String format = "pdf";
        private String outputDirectory = "./output";
        /** TrueType candidates for PDF text; blank entries are skipped. */
        private List<String> fontPaths = new ArrayList<>();
    }

    @Data
    public static class Console {
        private boolean enabled = true;
    }
}
