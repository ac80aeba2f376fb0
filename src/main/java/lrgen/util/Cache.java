package lrgen.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A simple thread safe lru cache
 */
public class Cache<K, V> {

	private final int maximumSize;

	private final LinkedHashMap<K, V> map;

	public Cache(int maximumSize) {
		if (maximumSize < 0){
			throw new IllegalArgumentException("Negative cache size " + maximumSize);
		}
		this.maximumSize = maximumSize;
		this.map = new LinkedHashMap<K, V>(16, 0.75f, true){
			@Override
			protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
				return size() > Cache.this.maximumSize;
			}
		};
	}

	public synchronized boolean isFull(){
		return map.size() == maximumSize;
	}

	public synchronized int size(){
		return map.size();
	}

	public synchronized V getIfPresent(K key){
		return map.get(key);
	}

	public synchronized void put(K key, V value){
		map.put(key, value);
	}
}
