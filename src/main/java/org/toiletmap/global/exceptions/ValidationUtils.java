package org.toiletmap.global.exceptions;

import java.util.function.Predicate;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;

/**
 * Fluent checks on request parameters, each failure raising a {@link BadRequestException}
 * with code <code>invalid-&lt;name&gt;</code> or <code>missing-&lt;name&gt;</code>.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationUtils {

	public static final String INVALID_PREFIX = "invalid-";
	public static final String MISSING_PREFIX = "missing-";

	public static FieldString field(String name, String value) {
		return new FieldString(name, value);
	}

	public static FieldLong field(String name, Long value) {
		return new FieldLong(name, value);
	}

	@RequiredArgsConstructor
	@SuppressWarnings("unchecked")
	public abstract static class Field<T, S extends Field<T, S>> {

		protected final String name;
		protected final T value;

		public S notNull() {
			if (value == null) throw new BadRequestException(MISSING_PREFIX + name, name + " is required");
			return (S) this;
		}

		public S check(Predicate<T> predicate, String message) {
			if (value != null && !predicate.test(value)) throw new BadRequestException(INVALID_PREFIX + name, message);
			return (S) this;
		}

		public T get() {
			return value;
		}

	}

	public static class FieldString extends Field<String, FieldString> {

		public FieldString(String name, String value) {
			super(name, value);
		}

		public FieldString exactLength(int length) {
			return check(s -> s.length() == length, name + " must be exactly " + length + " characters");
		}

		public FieldString maxLength(int length) {
			return check(s -> s.length() <= length, name + " must be at most " + length + " characters");
		}

	}

	public static class FieldLong extends Field<Long, FieldLong> {

		public FieldLong(String name, Long value) {
			super(name, value);
		}

		public FieldLong min(long min) {
			return check(v -> v >= min, name + " must be at least " + min);
		}

	}

}
