package com.danieljhkim.tabletmgr.tmagent.health;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Receiving end of one health stream subscriber: a bounded queue the broadcaster offers replies to.
 * When the queue is full, new replies are dropped for this subscriber.
 */
public class HealthStreamSubscription {

	private final long handle;
	private final BlockingQueue<HealthStreamReply> queue;
	private volatile boolean closed;

	HealthStreamSubscription(long handle, int capacity) {
		this.handle = handle;
		this.queue = new ArrayBlockingQueue<>(capacity);
	}

	public long getHandle() {
		return handle;
	}

	/**
	 * Waits up to the given time for the next reply.
	 *
	 * @return the reply, or null on timeout
	 */
	public HealthStreamReply poll(long timeout, TimeUnit unit) throws InterruptedException {
		return queue.poll(timeout, unit);
	}

	/** Returns the next reply without waiting, or null if none is queued. */
	public HealthStreamReply poll() {
		return queue.poll();
	}

	public int pending() {
		return queue.size();
	}

	/**
	 * True once the subscription was removed from the broadcaster. Replies queued before that can still be
	 * polled.
	 */
	public boolean isClosed() {
		return closed;
	}

	boolean offer(HealthStreamReply reply) {
		return queue.offer(reply);
	}

	void close() {
		closed = true;
	}
}
