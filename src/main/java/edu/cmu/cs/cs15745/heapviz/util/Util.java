package edu.cmu.cs.cs15745.heapviz.util;

import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/** Joining helpers for labels and printed heap terms. */
public final class Util {
	private Util() { }

	/** The printed form of each item, separated by {@code delimiter}. */
	public static String join(CharSequence delimiter, Iterable<?> items) {
		return join(delimiter, items, String::valueOf);
	}

	/** What {@code format} makes of each item, separated by {@code delimiter}. */
	public static <T> String join(CharSequence delimiter, Iterable<? extends T> items,
			Function<? super T, String> format) {
		return StreamSupport.stream(items.spliterator(), false)
			.map(format)
			.collect(Collectors.joining(delimiter));
	}
}
