package com.deepansh.desk.validation;

import com.deepansh.desk.config.DeskProperties;
import com.deepansh.desk.support.DeskFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExpenseRuleValidatorTest {

    private final ExpenseRuleValidator validator =
            new ExpenseRuleValidator(new DeskProperties().getRules(), DeskFixtures.CLOCK);

    @Test
    void date_today_isAccepted() {
        ValidationResult result = validator.validate("date", "2026-10-19");

        assertThat(result.valid()).isTrue();
        assertThat(result.value()).isEqualTo("2026-10-19");
    }

    @Test
    void date_inFuture_isRejected() {
        assertThat(validator.validate("date", "2026-10-20").error()).contains("future");
    }

    @Test
    void date_outsideWindow_isRejected() {
        assertThat(validator.validate("date", "2026-07-21").valid()).isTrue();
        assertThat(validator.validate("date", "2026-07-20").error()).contains("90 days");
    }

    @Test
    void date_unparseable_isRejected() {
        assertThat(validator.validate("date", "yesterday").error()).contains("YYYY-MM-DD");
    }

    @Test
    void amount_textWithCurrencyMarks_isNormalized() {
        assertThat(validator.validate("amount", "¥1,280").value()).isEqualTo(1280L);
        assertThat(validator.validate("cost", "490円").value()).isEqualTo(490L);
        assertThat(validator.validate("amount", 3000).value()).isEqualTo(3000L);
    }

    @Test
    void amount_nonPositiveOrFractional_isRejected() {
        assertThat(validator.validate("amount", "0").valid()).isFalse();
        assertThat(validator.validate("amount", -5).valid()).isFalse();
        assertThat(validator.validate("amount", 12.5).valid()).isFalse();
        assertThat(validator.validate("amount", "abc").valid()).isFalse();
    }

    @Test
    void amount_aboveMaximum_isRejected() {
        assertThat(validator.validate("amount", 30000).valid()).isTrue();
        assertThat(validator.validate("amount", 30001).error()).contains("exceeds");
    }

    @Test
    void transportType_aliases_mapToCode() {
        assertThat(validator.validate("transportType", "電車").value()).isEqualTo("train");
        assertThat(validator.validate("transportType", "Taxi").value()).isEqualTo("taxi");
        assertThat(validator.validate("transportType", "rocket").valid()).isFalse();
    }

    @Test
    void expenseCategory_label_mapsToEnumName() {
        assertThat(validator.validate("expenseCategory", "lodging").value()).isEqualTo("LODGING");
    }

    @Test
    void managerApproved_yesNo_mapsToBoolean() {
        assertThat(validator.validate("managerApproved", "yes").value()).isEqualTo(Boolean.TRUE);
        assertThat(validator.validate("managerApproved", "いいえ").value()).isEqualTo(Boolean.FALSE);
        assertThat(validator.validate("managerApproved", "maybe").valid()).isFalse();
    }

    @Test
    void items_list_isJoined() {
        assertThat(validator.validate("items", List.of("pen", " notebook ")).value()).isEqualTo("pen, notebook");
    }

    @Test
    void freeText_blank_isRejected() {
        assertThat(validator.validate("purpose", "  ").error()).isEqualTo("purpose is required.");
    }

    @Test
    void checkTotal_aboveThresholdWithoutApproval_isError() {
        assertThat(validator.checkTotal(5000, null)).isNull();
        assertThat(validator.checkTotal(6000, null)).isNull();
        assertThat(validator.checkTotal(6000, Boolean.TRUE)).isNull();
        assertThat(validator.checkTotal(6000, Boolean.FALSE)).contains("manager");
        assertThat(validator.checkTotal(30001, Boolean.TRUE)).contains("limit");
    }

    @Test
    void requiresManagerApproval_strictlyAboveThreshold() {
        assertThat(validator.requiresManagerApproval(5000)).isFalse();
        assertThat(validator.requiresManagerApproval(5001)).isTrue();
    }

    @Test
    void checkCommuterOverlap_matchesEitherDirectionForTrainOnly() {
        assertThat(validator.checkCommuterOverlap("Ueno", "Toyosu", "train")).contains("commuter pass");
        assertThat(validator.checkCommuterOverlap("toyosu", "ueno", "train")).isNotNull();
        assertThat(validator.checkCommuterOverlap("Ueno", "Toyosu", "taxi")).isNull();
        assertThat(validator.checkCommuterOverlap("Tokyo", "Toyosu", "train")).isNull();
    }
}
