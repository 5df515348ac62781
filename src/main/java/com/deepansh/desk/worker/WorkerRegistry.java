package com.deepansh.desk.worker;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed mapping from worker type tag to constructor. The Dispatcher resolves
 * a classification result through this table; nothing is discovered at runtime.
 */
public class WorkerRegistry {

    private final Map<String, WorkerFactory> factories = new LinkedHashMap<>();
    private final Map<String, String> descriptions = new LinkedHashMap<>();
    private final WorkerServices services;

    public WorkerRegistry(WorkerServices services) {
        this.services = services;
        register(TravelExpenseWorker.TYPE, TravelExpenseWorker::new,
                "Transportation costs: train, bus, taxi or airplane trips between places");
        register(ReceiptExpenseWorker.TYPE, ReceiptExpenseWorker::new,
                "Purchases paid with a receipt: books, supplies, lodging, exam fees and similar");
    }

    private void register(String type, WorkerFactory factory, String description) {
        factories.put(type, factory);
        descriptions.put(type, description);
    }

    public boolean isKnown(String type) {
        return type != null && factories.containsKey(type);
    }

    public Set<String> types() {
        return factories.keySet();
    }

    /** Type tag to a one-line description, for the classifier prompt. */
    public Map<String, String> descriptions() {
        return descriptions;
    }

    /** Creates a Worker over a brand-new state. */
    public Worker create(String type) {
        int window = services.properties().getHistory().getWorkerWindow();
        WorkerState state = WorkerState.fresh(type, window, services.clock().instant());
        return restore(state);
    }

    /** Wraps an existing (possibly reloaded) state. */
    public Worker restore(WorkerState state) {
        WorkerFactory factory = factories.get(state.getWorkerType());
        if (factory == null) {
            throw new IllegalArgumentException("Unknown worker type: " + state.getWorkerType());
        }
        return factory.create(state, services);
    }

    public Clock clock() {
        return services.clock();
    }
}
