package org.toiletmap.loo;

import lombok.RequiredArgsConstructor;

/**
 * Which loos a listing returns depending on their active flag.
 * Anything not understood falls back to active loos only.
 */
@RequiredArgsConstructor
public enum ActiveFilter {

	ONLY_ACTIVE(Boolean.TRUE),
	ONLY_INACTIVE(Boolean.FALSE),
	ANY(null);

	private final Boolean active;

	public static ActiveFilter parse(String value) {
		if (value == null) return ONLY_ACTIVE;
		switch (value.trim().toLowerCase()) {
			case "false": return ONLY_INACTIVE;
			case "any", "all": return ANY;
			default: return ONLY_ACTIVE;
		}
	}

	/** true, false, or null when no filter applies. */
	public Boolean toBoolean() {
		return active;
	}

}
