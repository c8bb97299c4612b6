package com.danieljhkim.tabletmgr.tmagent.health;

import java.util.HashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

/**
 * Registry of health stream subscribers and fan-out of health snapshots to them.
 *
 * <p>
 * Delivery is at most once and never blocks: a subscriber whose queue is full misses that reply, so a stalled
 * client cannot hold up the publisher or the other subscribers. Registration and broadcast share
 * {@code healthStreamMutex}, which is independent of the tablet state store's lock. Handles increase
 * monotonically and are never reused.
 */
@Slf4j
public class HealthStreamBroadcaster {

	private final Object healthStreamMutex = new Object();
	private final Map<Long, HealthStreamSubscription> subscribers = new HashMap<>();
	private final int bufferSize;
	private long nextHandle;
	private boolean closed;

	public HealthStreamBroadcaster(int bufferSize) {
		if (bufferSize <= 0) {
			throw new IllegalArgumentException("bufferSize must be positive");
		}
		this.bufferSize = bufferSize;
	}

	/**
	 * @throws IllegalStateException
	 *             once {@link #closeAll()} has run
	 */
	public HealthStreamSubscription subscribe() {
		synchronized (healthStreamMutex) {
			if (closed) {
				throw new IllegalStateException("health stream is closed");
			}
			HealthStreamSubscription subscription = new HealthStreamSubscription(nextHandle++, bufferSize);
			subscribers.put(subscription.getHandle(), subscription);
			log.debug("Registered health stream {} (total {})", subscription.getHandle(), subscribers.size());
			return subscription;
		}
	}

	/**
	 * Removes a subscriber. No broadcast started after this returns reaches it.
	 *
	 * @return false if the handle was not registered
	 */
	public boolean unsubscribe(long handle) {
		synchronized (healthStreamMutex) {
			HealthStreamSubscription removed = subscribers.remove(handle);
			if (removed == null) {
				return false;
			}
			removed.close();
			log.debug("Unregistered health stream {} (remaining {})", handle, subscribers.size());
			return true;
		}
	}

	/**
	 * Offers {@code reply} to every registered subscriber without waiting.
	 *
	 * @return the number of subscribers that accepted it
	 */
	public int broadcast(HealthStreamReply reply) {
		synchronized (healthStreamMutex) {
			int delivered = 0;
			for (HealthStreamSubscription subscription : subscribers.values()) {
				if (subscription.offer(reply)) {
					delivered++;
				}
			}
			if (delivered < subscribers.size()) {
				log.debug("Dropped health reply for {} of {} full subscribers", subscribers.size() - delivered,
						subscribers.size());
			}
			return delivered;
		}
	}

	public int size() {
		synchronized (healthStreamMutex) {
			return subscribers.size();
		}
	}

	/**
	 * Unregisters every subscriber and refuses new ones. Used when the agent stops.
	 */
	public void closeAll() {
		synchronized (healthStreamMutex) {
			closed = true;
			subscribers.values().forEach(HealthStreamSubscription::close);
			subscribers.clear();
		}
	}
}
