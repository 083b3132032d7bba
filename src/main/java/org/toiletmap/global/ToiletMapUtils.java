package org.toiletmap.global;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ToiletMapUtils {

	public static final ObjectMapper mapper = new ObjectMapper();

	public static final int LOO_ID_LENGTH = 24;
	public static final int MAX_PAGE_SIZE = 200;

	public static final String SERVICE_NAME = "toiletmap-server";

	/** 12 random bytes, hex encoded. */
	public static String generateLooId(SecureRandom random) {
		byte[] bytes = new byte[LOO_ID_LENGTH / 2];
		random.nextBytes(bytes);
		return Hex.encodeHexString(bytes);
	}

	public static boolean isLooId(String s) {
		return s != null && s.length() == LOO_ID_LENGTH;
	}

	/** Accepts repeated and comma separated values, drops blanks and duplicates while keeping order. */
	public static List<String> splitValues(Collection<String> values) {
		List<String> result = new ArrayList<>();
		if (values == null) return result;
		values.stream()
		.flatMap(v -> Arrays.stream(StringUtils.split(v, ',')))
		.map(String::trim)
		.filter(v -> !v.isEmpty() && !result.contains(v))
		.forEach(result::add);
		return result;
	}

}
