package org.toiletmap.loo;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TestGeohash {

	@Test
	void testKnownValues() {
		assertThat(Geohash.encode(42.6, -5.6, 5)).isEqualTo("ezs42");
		assertThat(Geohash.encode(57.64911, 10.40744, 11)).isEqualTo("u4pruydqqvj");
	}

	@Test
	void testDefaultPrecision() {
		String hash = Geohash.encode(51.5007, -0.1246);
		assertThat(hash).hasSize(Geohash.PRECISION).startsWith("gcpuv");
		assertThat(Geohash.encode(51.5007, -0.1246, 5)).isEqualTo(hash.substring(0, 5));
	}

	@Test
	void testValidity() {
		assertThat(Geohash.isValid("gcpuv")).isTrue();
		assertThat(Geohash.isValid("gcpuvpk44kpr")).isTrue();
		assertThat(Geohash.isValid("gcpuvpk44kprx")).isFalse();
		assertThat(Geohash.isValid("")).isFalse();
		assertThat(Geohash.isValid(null)).isFalse();
		assertThat(Geohash.isValid("abc")).isFalse();
		assertThat(Geohash.isValid("GCP")).isFalse();
	}

}
