package org.toiletmap.loo;

import org.toiletmap.global.exceptions.BadRequestException;
import org.toiletmap.global.exceptions.ValidationUtils;

/**
 * Filter on a nullable attribute in a search: <code>any</code> (or nothing), <code>true</code>, <code>false</code>,
 * or <code>null</code> for loos where the attribute is unknown.
 */
public enum SearchFlag {

	ANY,
	TRUE,
	FALSE,
	UNKNOWN;

	/** Accepts any, true, false and null. */
	public static SearchFlag parse(String name, String value) {
		return parse(name, value, true);
	}

	/** Accepts any, true and false. */
	public static SearchFlag parseBoolean(String name, String value) {
		return parse(name, value, false);
	}

	private static SearchFlag parse(String name, String value, boolean unknownAllowed) {
		if (value == null) return ANY;
		switch (value.trim().toLowerCase()) {
			case "", "any": return ANY;
			case "true": return TRUE;
			case "false": return FALSE;
			case "null":
				if (unknownAllowed) return UNKNOWN;
				break;
			default: break;
		}
		throw new BadRequestException(
			ValidationUtils.INVALID_PREFIX + name,
			name + " must be one of any, true, false" + (unknownAllowed ? ", null" : "")
		);
	}

}
