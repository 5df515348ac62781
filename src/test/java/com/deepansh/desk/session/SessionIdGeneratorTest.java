package com.deepansh.desk.session;

import com.deepansh.desk.support.DeskFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionIdGeneratorTest {

    private final SessionIdGenerator generator = new SessionIdGenerator(DeskFixtures.CLOCK);

    @Test
    void generate_withoutPrefix_isTimestampAndRandomSuffix() {
        assertThat(generator.generate()).matches("20261019_100000_[0-9a-f]{8}");
    }

    @Test
    void generate_withPrefix_prependsIt() {
        assertThat(generator.generate("team-a")).matches("team-a_20261019_100000_[0-9a-f]{8}");
    }

    @Test
    void generate_twice_differs() {
        assertThat(generator.generate()).isNotEqualTo(generator.generate());
    }

    @Test
    void generate_unsafePrefix_isRejected() {
        assertThatThrownBy(() -> generator.generate("../x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generate("a_b")).isInstanceOf(IllegalArgumentException.class);
    }
}
