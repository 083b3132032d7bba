package org.toiletmap.loo;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Geohash {

	public static final int PRECISION = 12;

	private static final String BASE32 = "0123456789bcdefghjkmnpqrstuvwxyz";

	public static String encode(double latitude, double longitude) {
		return encode(latitude, longitude, PRECISION);
	}

	/** Interleaves longitude and latitude bits, longitude first, 5 bits per character. */
	public static String encode(double latitude, double longitude, int precision) {
		double minLat = -90;
		double maxLat = 90;
		double minLng = -180;
		double maxLng = 180;
		StringBuilder hash = new StringBuilder(precision);
		boolean evenBit = true;
		int bit = 0;
		int ch = 0;
		while (hash.length() < precision) {
			if (evenBit) {
				double mid = (minLng + maxLng) / 2;
				if (longitude >= mid) {
					ch = (ch << 1) | 1;
					minLng = mid;
				} else {
					ch <<= 1;
					maxLng = mid;
				}
			} else {
				double mid = (minLat + maxLat) / 2;
				if (latitude >= mid) {
					ch = (ch << 1) | 1;
					minLat = mid;
				} else {
					ch <<= 1;
					maxLat = mid;
				}
			}
			evenBit = !evenBit;
			if (++bit == 5) {
				hash.append(BASE32.charAt(ch));
				bit = 0;
				ch = 0;
			}
		}
		return hash.toString();
	}

	/** A non empty geohash or geohash prefix, lower case. */
	public static boolean isValid(String hash) {
		if (hash == null || hash.isEmpty() || hash.length() > PRECISION) return false;
		for (int i = 0; i < hash.length(); ++i)
			if (BASE32.indexOf(hash.charAt(i)) < 0) return false;
		return true;
	}

}
