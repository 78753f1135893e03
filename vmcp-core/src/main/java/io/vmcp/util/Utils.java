/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.util;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Walks the cause chain of {@code throwable} looking for an instance of
	 * {@code type}. Reactor wraps checked exceptions and retry exhaustion, so callers
	 * classifying failures need to look past those wrappers.
	 * @param throwable the failure to inspect, may be {@code null}
	 * @param type the type to look for
	 * @param <T> the type to look for
	 * @return the first matching cause or {@code null}
	 */
	@Nullable
	public static <T extends Throwable> T findCause(@Nullable Throwable throwable, Class<T> type) {
		Throwable current = throwable;
		int depth = 0;
		while (current != null && depth < 16) {
			if (type.isInstance(current)) {
				return type.cast(current);
			}
			if (current.getCause() == current) {
				return null;
			}
			current = current.getCause();
			depth++;
		}
		return null;
	}

}
