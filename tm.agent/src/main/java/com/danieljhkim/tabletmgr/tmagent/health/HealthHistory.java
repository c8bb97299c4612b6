package com.danieljhkim.tabletmgr.tmagent.health;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded history of health check outcomes for status pages. Oldest entries are evicted first; a record that
 * duplicates the latest one replaces it instead of taking a new slot.
 */
public class HealthHistory {

	private final int capacity;
	private final Deque<HealthRecord> records;

	public HealthHistory(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be positive");
		}
		this.capacity = capacity;
		this.records = new ArrayDeque<>(capacity);
	}

	public synchronized void add(HealthRecord record) {
		HealthRecord latest = records.peekLast();
		if (record.isDuplicate(latest)) {
			records.pollLast();
		} else if (records.size() == capacity) {
			records.pollFirst();
		}
		records.addLast(record);
	}

	/**
	 * Returns the records, newest first.
	 */
	public synchronized List<HealthRecord> records() {
		List<HealthRecord> result = new ArrayList<>(records.size());
		Iterator<HealthRecord> it = records.descendingIterator();
		while (it.hasNext()) {
			result.add(it.next());
		}
		return result;
	}

	public synchronized int size() {
		return records.size();
	}

	public int capacity() {
		return capacity;
	}
}
