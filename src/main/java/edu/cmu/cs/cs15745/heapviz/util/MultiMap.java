package edu.cmu.cs.cs15745.heapviz.util;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Map from keys to insertion-ordered lists of values.
 */
public class MultiMap<K, V> extends AbstractMap<K, List<V>> {
	private final Map<K, List<V>> map = new LinkedHashMap<>();

	@Override
	public Set<Entry<K, List<V>>> entrySet() {
		return map.entrySet();
	}

	@Override
	public List<V> put(K key, List<V> value) {
		return map.put(key, value);
	}

	/**
	 * Return list that, adding to which, adds to the map.
	 */
	public List<V> getList(K key) {
		return map.computeIfAbsent(key, unused -> new ArrayList<>());
	}

	/** Unmodifiable view; empty if nothing was added for the key. */
	public List<V> values(K key) {
		return Collections.unmodifiableList(map.getOrDefault(key, Collections.emptyList()));
	}
}
