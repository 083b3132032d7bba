package org.toiletmap.loo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.toiletmap.global.exceptions.BadRequestException;

class TestSearchFlag {

	@Test
	void testLiterals() {
		assertThat(SearchFlag.parse("radar", null)).isEqualTo(SearchFlag.ANY);
		assertThat(SearchFlag.parse("radar", " ")).isEqualTo(SearchFlag.ANY);
		assertThat(SearchFlag.parse("radar", "Any")).isEqualTo(SearchFlag.ANY);
		assertThat(SearchFlag.parse("radar", "true")).isEqualTo(SearchFlag.TRUE);
		assertThat(SearchFlag.parse("radar", " FALSE ")).isEqualTo(SearchFlag.FALSE);
		assertThat(SearchFlag.parse("radar", "null")).isEqualTo(SearchFlag.UNKNOWN);
	}

	@Test
	void testBooleanFiltersHaveNoUnknown() {
		assertThat(SearchFlag.parseBoolean("verified", "true")).isEqualTo(SearchFlag.TRUE);
		assertThat(SearchFlag.parseBoolean("verified", "any")).isEqualTo(SearchFlag.ANY);
		assertThatThrownBy(() -> SearchFlag.parseBoolean("verified", "null"))
		.isInstanceOf(BadRequestException.class)
		.hasFieldOrPropertyWithValue("errorCode", "invalid-verified");
	}

	@Test
	void testAnythingElseIsRejected() {
		assertThatThrownBy(() -> SearchFlag.parse("active", "all"))
		.isInstanceOf(BadRequestException.class)
		.hasFieldOrPropertyWithValue("errorCode", "invalid-active")
		.hasMessage("active must be one of any, true, false, null");
		assertThatThrownBy(() -> SearchFlag.parse("accessible", "1")).isInstanceOf(BadRequestException.class);
	}

}
