package org.toiletmap.loo.dto;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One contribution to a loo, with the attributes it changed. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LooReport {

	private long id;
	private String contributor;
	private long createdAt;
	/** Attribute name to its values before and after the contribution. */
	private Map<String, Change> diff;

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class Change {
		private JsonNode previous;
		private JsonNode current;
	}

}
