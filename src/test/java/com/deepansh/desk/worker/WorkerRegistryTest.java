package com.deepansh.desk.worker;

import com.deepansh.desk.support.CapturingRenderer;
import com.deepansh.desk.support.DeskFixtures;
import com.deepansh.desk.support.ScriptedLlmClient;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerRegistryTest {

    private final WorkerRegistry registry =
            new WorkerRegistry(DeskFixtures.services(new ScriptedLlmClient(), new CapturingRenderer()));

    @Test
    void create_knownType_usesWorkerWindow() {
        Worker worker = registry.create(TravelExpenseWorker.TYPE);

        assertThat(worker).isInstanceOf(TravelExpenseWorker.class);
        assertThat(worker.state().getHistory().getBound()).isEqualTo(15);
        assertThat(worker.state().getStatus()).isEqualTo(WorkerStatus.IDLE);
    }

    @Test
    void restore_wrapsExistingState() {
        WorkerState state = WorkerState.fresh(ReceiptExpenseWorker.TYPE, 5, DeskFixtures.CLOCK.instant());
        state.getFields().put("storeName", "Maruzen");

        Worker worker = registry.restore(state);

        assertThat(worker.state()).isSameAs(state);
        assertThat(worker.isInProgress()).isTrue();
    }

    @Test
    void restore_unknownType_isRejected() {
        WorkerState state = WorkerState.fresh("hotel_booking", 5, DeskFixtures.CLOCK.instant());

        assertThatThrownBy(() -> registry.restore(state)).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.isKnown("hotel_booking")).isFalse();
        assertThat(registry.types()).containsExactly(TravelExpenseWorker.TYPE, ReceiptExpenseWorker.TYPE);
    }
}
