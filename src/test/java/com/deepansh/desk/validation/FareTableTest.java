package com.deepansh.desk.validation;

import com.deepansh.desk.support.DeskFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FareTableTest {

    private final FareTable table = DeskFixtures.fareTable();

    @Test
    void lookup_trainFare_ignoresCaseAndWhitespace() {
        assertThat(table.lookup(" tokyo ", "YOKOHAMA", TransportType.TRAIN)).contains(490L);
    }

    @Test
    void lookup_unknownTrainRoute_isEmpty() {
        assertThat(table.lookup("Tokyo", "Sapporo", TransportType.TRAIN)).isEmpty();
    }

    @Test
    void lookup_fixedFares_ignoreStations() {
        assertThat(table.lookup("anywhere", "else", TransportType.BUS)).contains(220L);
        assertThat(table.lookup(null, null, TransportType.AIRPLANE)).contains(25000L);
    }

    @Test
    void load_missingResource_failsFast() {
        assertThatThrownBy(() -> FareTable.load(DeskFixtures.objectMapper(), "fares/missing.json"))
                .isInstanceOf(IllegalStateException.class);
    }
}
