package com.example.clipscore_backend.scoring.moment;

import com.example.clipscore_backend.scoring.exception.MalformedTimestampException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampScannerTest {

    private final TimestampScanner scanner = new TimestampScanner();

    @Test
    void longestRunWinsForHourTimestamps() {
        List<TimestampMatch> found = scanner.scan("the best part is 1:02:15 for sure");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).text()).isEqualTo("1:02:15");
        assertThat(found.get(0).offsetSeconds()).isEqualTo(3735);
    }

    @Test
    void detectsAtPrefixWithoutIncludingIt() {
        List<TimestampMatch> found = scanner.scan("at 2:15 and again 3:07, flat 4:00");

        assertThat(found).extracting(TimestampMatch::text).containsExactly("2:15", "3:07", "4:00");
        assertThat(found).extracting(TimestampMatch::atPrefix).containsExactly(true, false, false);
        assertThat(found.get(0).start()).isEqualTo(3);
    }

    @Test
    void skipsMalformedRunsAndKeepsValidOnes() {
        List<TimestampMatch> found = scanner.scan("99:99 then 123:45 then 1:2:3 then 0:05");

        assertThat(found).extracting(TimestampMatch::text).containsExactly("0:05");
        assertThat(found.get(0).offsetSeconds()).isEqualTo(5);
    }

    @Test
    void ignoresRunsGluedToLettersAndBareNumbers() {
        assertThat(scanner.scan("v2:15 and version 3 and ends at 3:")).isEmpty();
        assertThat(scanner.scan("watch v2:15:30 now")).isEmpty();
        assertThat(scanner.scan("build7:05:45")).isEmpty();
        assertThat(scanner.scan("")).isEmpty();
        assertThat(scanner.scan(null)).isEmpty();
    }

    @Test
    void stopsClockAtTrailingLetters() {
        List<TimestampMatch> found = scanner.scan("12:30pm");

        assertThat(found).extracting(TimestampMatch::offsetSeconds).containsExactly(750L);
    }

    @Test
    void parseSecondsRejectsFieldsOutOfRange() {
        assertThat(TimestampScanner.parseSeconds("10:00")).isEqualTo(600);
        assertThatThrownBy(() -> TimestampScanner.parseSeconds("1:60"))
                .isInstanceOf(MalformedTimestampException.class)
                .hasMessageContaining("1:60");
        assertThatThrownBy(() -> TimestampScanner.parseSeconds("1:00:00:00"))
                .isInstanceOf(MalformedTimestampException.class);
    }
}
