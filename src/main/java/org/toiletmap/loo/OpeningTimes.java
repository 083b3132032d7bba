package org.toiletmap.loo;

import java.util.List;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Weekly opening hours: seven days from Monday, each either <code>[]</code> when closed
 * or <code>["HH:mm", "HH:mm"]</code> with the opening before the closing.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class OpeningTimes {

	public static final int DAYS = 7;

	private static final Pattern TIME = Pattern.compile("([0-1]\\d|2[0-3]):[0-5]\\d");

	/** Null, meaning unknown, is valid. */
	public static boolean isValid(List<List<String>> week) {
		if (week == null) return true;
		if (week.size() != DAYS) return false;
		for (List<String> day : week)
			if (!isValidDay(day)) return false;
		return true;
	}

	private static boolean isValidDay(List<String> day) {
		if (day == null) return false;
		if (day.isEmpty()) return true;
		if (day.size() != 2) return false;
		String open = day.get(0);
		String close = day.get(1);
		if (open == null || close == null || !TIME.matcher(open).matches() || !TIME.matcher(close).matches()) return false;
		return open.compareTo(close) < 0;
	}

}
