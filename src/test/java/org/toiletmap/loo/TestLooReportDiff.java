package org.toiletmap.loo;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.toiletmap.global.ToiletMapUtils;

import com.fasterxml.jackson.databind.JsonNode;

class TestLooReportDiff {

	private static JsonNode json(String s) throws Exception {
		return ToiletMapUtils.mapper.readTree(s);
	}

	@Test
	void testOnlyChangedAttributes() throws Exception {
		var diff = LooService.diff(
			json("{\"name\":\"A\",\"men\":null,\"radar\":true,\"location\":{\"lat\":1.0,\"lng\":2.0}}"),
			json("{\"name\":\"B\",\"men\":null,\"radar\":true,\"location\":{\"lat\":1.0,\"lng\":2.5},\"notes\":\"new\"}")
		);
		assertThat(diff).containsOnlyKeys("name", "location", "notes");
		assertThat(diff.get("name").getPrevious().asText()).isEqualTo("A");
		assertThat(diff.get("name").getCurrent().asText()).isEqualTo("B");
		assertThat(diff.get("notes").getPrevious()).isNull();
	}

	@Test
	void testNullAndMissingAreTheSame() throws Exception {
		assertThat(LooService.diff(json("{\"men\":null}"), json("{}"))).isEmpty();
		var diff = LooService.diff(json("{\"women\":false}"), json("{\"women\":null}"));
		assertThat(diff).containsOnlyKeys("women");
		assertThat(diff.get("women").getCurrent()).isNull();
	}

}
