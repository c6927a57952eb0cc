package com.leaprnd.reducer4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import static com.leaprnd.reducer4j.EventQueue.Outcome.ACCEPTED;
import static com.leaprnd.reducer4j.EventQueue.Outcome.REJECTED_CLOSED;
import static com.leaprnd.reducer4j.EventQueue.Outcome.REJECTED_FULL;
import static com.leaprnd.reducer4j.Exceptions.requirePositive;
import static java.util.Objects.requireNonNull;

/**
 * Bounded FIFO buffer between any number of producers and the single
 * {@link ReductionLoop} that consumes it. Submission never blocks.
 */
final class EventQueue<E> {

	enum Outcome {
		ACCEPTED,
		REJECTED_FULL,
		REJECTED_CLOSED
	}

	private final int capacity;
	private final BlockingQueue<E> events;
	private volatile boolean closed = false;

	EventQueue(int capacity) {
		this.capacity = requirePositive(capacity, "The capacity");
		this.events = new ArrayBlockingQueue<>(capacity);
	}

	public Outcome submit(E event) {
		requireNonNull(event);
		if (closed) {
			return REJECTED_CLOSED;
		}
		if (!events.offer(event)) {
			return REJECTED_FULL;
		}
		// Lost a race with close(), which may already have cleared the buffer.
		if (closed) {
			events.clear();
			return REJECTED_CLOSED;
		}
		return ACCEPTED;
	}

	public E poll() {
		return events.poll();
	}

	public boolean isEmpty() {
		return events.isEmpty();
	}

	public int size() {
		return events.size();
	}

	public int capacity() {
		return capacity;
	}

	public boolean isClosed() {
		return closed;
	}

	/**
	 * Rejects every later submission and discards the events that are still
	 * waiting.
	 */
	public void close() {
		closed = true;
		events.clear();
	}

}
