package com.deepansh.desk.context;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextPropagatorTest {

    @Test
    void propagate_keepsParentKeysAndAddsNewOnes() {
        ContextBag parent = ContextBag.of(ContextKeys.REQUESTER_ID, "Sato");

        ContextBag child = ContextPropagator.propagate(parent, ContextKeys.SESSION_ID, "s-1");

        assertThat(child.get(ContextKeys.REQUESTER_ID)).contains("Sato");
        assertThat(child.get(ContextKeys.SESSION_ID)).contains("s-1");
    }

    @Test
    void propagate_doesNotModifyParent() {
        ContextBag parent = ContextBag.of(ContextKeys.REQUESTER_ID, "Sato");

        ContextPropagator.propagate(parent, Map.of(ContextKeys.REQUESTER_ID, "Suzuki", "extra", "1"));

        assertThat(parent.asMap()).containsExactly(Map.entry(ContextKeys.REQUESTER_ID, "Sato"));
    }

    @Test
    void propagate_additionOverridesParentValue() {
        ContextBag parent = ContextBag.of(ContextKeys.WORKER_TYPE, "receipt_expense");

        ContextBag child = ContextPropagator.propagate(parent, ContextKeys.WORKER_TYPE, "travel_expense");

        assertThat(child.get(ContextKeys.WORKER_TYPE)).contains("travel_expense");
    }

    @Test
    void propagate_nullValuesAreSkipped() {
        Map<String, String> additions = new HashMap<>();
        additions.put("missing", null);

        ContextBag child = ContextPropagator.propagate(ContextBag.empty(), additions);

        assertThat(child.contains("missing")).isFalse();
    }

    @Test
    void fillMissing_neverShadowsCallerValue() {
        ContextBag parent = ContextBag.of(ContextKeys.APPLICATION_DATE, "2026-10-01");
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(ContextKeys.APPLICATION_DATE, "2026-10-19");
        defaults.put(ContextKeys.SESSION_ID, "s-1");

        ContextBag child = ContextPropagator.fillMissing(parent, defaults);

        assertThat(child.get(ContextKeys.APPLICATION_DATE)).contains("2026-10-01");
        assertThat(child.get(ContextKeys.SESSION_ID)).contains("s-1");
    }

    @Test
    void valueOf_missingKeyOrBag_returnsDefault() {
        assertThat(ContextPropagator.valueOf(null, ContextKeys.REQUESTER_ID, "(none)")).isEqualTo("(none)");
        assertThat(ContextPropagator.valueOf(ContextBag.empty(), ContextKeys.REQUESTER_ID, "(none)"))
                .isEqualTo("(none)");
    }

    @Test
    void bag_isImmutable() {
        ContextBag bag = ContextBag.of(ContextKeys.REQUESTER_ID, "Sato");

        assertThatThrownBy(() -> bag.asMap().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toString_hidesValues() {
        ContextBag bag = ContextBag.of(ContextKeys.REQUESTER_ID, "Sato");

        assertThat(bag.toString()).contains(ContextKeys.REQUESTER_ID).doesNotContain("Sato");
    }
}
