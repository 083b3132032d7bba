package org.toiletmap.loo;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class TestOpeningTimes {

	private static List<List<String>> week(List<String> monday) {
		List<List<String>> week = new ArrayList<>();
		week.add(monday);
		for (int day = 1; day < OpeningTimes.DAYS; ++day) week.add(List.of("08:00", "20:00"));
		return week;
	}

	@Test
	void testValid() {
		assertThat(OpeningTimes.isValid(null)).isTrue();
		assertThat(OpeningTimes.isValid(week(List.of()))).isTrue();
		assertThat(OpeningTimes.isValid(week(List.of("00:00", "23:59")))).isTrue();
	}

	@Test
	void testInvalid() {
		assertThat(OpeningTimes.isValid(List.of())).isFalse();
		assertThat(OpeningTimes.isValid(week(List.of()).subList(0, 6))).isFalse();
		assertThat(OpeningTimes.isValid(week(null))).isFalse();
		assertThat(OpeningTimes.isValid(week(List.of("12:00", "12:00")))).isFalse();
		assertThat(OpeningTimes.isValid(week(List.of("13:00", "12:00")))).isFalse();
		assertThat(OpeningTimes.isValid(week(List.of("7:00", "12:00")))).isFalse();
		assertThat(OpeningTimes.isValid(week(List.of("07:00", "12:60")))).isFalse();
		assertThat(OpeningTimes.isValid(week(List.of("07:00")))).isFalse();
		assertThat(OpeningTimes.isValid(week(Arrays.asList("07:00", null)))).isFalse();
	}

}
