package org.toiletmap.loo;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Amenity flags carried by the compact dump, each one owning a fixed weight.
 * <p>
 * Weights are part of the wire format read by the map clients: never reuse or renumber one.
 * Amenities without a weight here (men, women, children, attended, urinal only) are not part of the mask.
 */
@Getter
@RequiredArgsConstructor
public enum FilterMask {

	NO_PAYMENT(1, Amenities::getNoPayment),
	ALL_GENDER(2, Amenities::getAllGender),
	AUTOMATIC(4, Amenities::getAutomatic),
	ACCESSIBLE(8, Amenities::getAccessible),
	BABY_CHANGE(16, Amenities::getBabyChange),
	RADAR(32, Amenities::getRadar);

	private final int weight;
	private final Function<Amenities, Boolean> flag;

	public boolean isSet(int mask) {
		return (mask & weight) != 0;
	}

	public static int encode(Amenities amenities) {
		int mask = 0;
		for (FilterMask f : values())
			if (Boolean.TRUE.equals(f.flag.apply(amenities))) mask |= f.weight;
		return mask;
	}

	public static int encode(Set<FilterMask> flags) {
		int mask = 0;
		for (FilterMask f : flags) mask |= f.weight;
		return mask;
	}

	public static Set<FilterMask> decode(int mask) {
		EnumSet<FilterMask> flags = EnumSet.noneOf(FilterMask.class);
		for (FilterMask f : values())
			if (f.isSet(mask)) flags.add(f);
		return flags;
	}

}
