package com.leaprnd.reducer4j;

import org.slf4j.Logger;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import static com.leaprnd.reducer4j.Exceptions.unchecked;
import static com.leaprnd.reducer4j.ReductionLoop.Phase.FAILED;
import static com.leaprnd.reducer4j.ReductionLoop.Phase.RUNNING;
import static com.leaprnd.reducer4j.ReductionLoop.Phase.STOPPED;
import static com.leaprnd.reducer4j.ReductionLoop.Phase.WAITING;
import static java.util.concurrent.atomic.AtomicReferenceFieldUpdater.newUpdater;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * The sole consumer of an {@link EventQueue}. It is scheduled on its executor
 * whenever an event is accepted while it is idle and then drains the queue,
 * reducing and publishing one event at a time.
 */
final class ReductionLoop<S, E> implements Runnable {

	@SuppressWarnings("rawtypes")
	private static final AtomicReferenceFieldUpdater<ReductionLoop, Phase> PHASE_UPDATER;
	private static final Logger LOGGER = getLogger(ReductionLoop.class);

	static {
		PHASE_UPDATER = newUpdater(ReductionLoop.class, Phase.class, "phase");
	}

	enum Phase {
		WAITING,
		RUNNING,
		STOPPED,
		FAILED
	}

	private final EventQueue<E> queue;
	private final Reducer<S, E> reducer;
	private final StatePublisher<S> publisher;
	private final Executor executor;

	private volatile Phase phase = WAITING;
	private volatile Throwable failure;

	ReductionLoop(EventQueue<E> queue, Reducer<S, E> reducer, StatePublisher<S> publisher, Executor executor) {
		this.queue = queue;
		this.reducer = reducer;
		this.publisher = publisher;
		this.executor = executor;
	}

	/**
	 * Schedules this loop unless it is already running or has terminated. If the
	 * executor rejects it, the loop fails and its pending events are discarded.
	 */
	public void signal() {
		if (PHASE_UPDATER.compareAndSet(this, WAITING, RUNNING)) {
			try {
				executor.execute(this);
			} catch (RejectedExecutionException exception) {
				fail(exception);
				throw exception;
			}
		}
	}

	@Override
	public void run() {
		while (true) {
			try {
				drain();
			} catch (Throwable throwable) {
				fail(throwable);
				throw unchecked(throwable);
			}
			if (!PHASE_UPDATER.compareAndSet(this, RUNNING, WAITING)) {
				LOGGER.debug("Stopped reducing after the scope of {} was closed.", publisher);
				queue.close();
				return;
			}
			// An event accepted after the last poll may have found this loop still running.
			if (queue.isEmpty() || !PHASE_UPDATER.compareAndSet(this, WAITING, RUNNING)) {
				return;
			}
		}
	}

	private void drain() {
		while (phase == RUNNING) {
			final var event = queue.poll();
			if (event == null) {
				return;
			}
			final var oldState = publisher.current();
			final var newState = reducer.reduce(oldState, event);
			if (newState == null) {
				throw new NullPointerException("The reducer returned null for " + event + "!");
			}
			publisher.publish(newState);
		}
	}

	private void fail(Throwable throwable) {
		failure = throwable;
		PHASE_UPDATER.compareAndSet(this, RUNNING, FAILED);
		queue.close();
		LOGGER.error("Could not reduce the state of {}! No further events will be reduced.", publisher, throwable);
	}

	/**
	 * Prevents any reduction that has not started yet. A reduction that is in
	 * progress still runs to completion and is published.
	 *
	 * @return True if and only if this invocation stopped the loop.
	 */
	public boolean stop() {
		while (true) {
			final var oldPhase = phase;
			if (oldPhase == STOPPED || oldPhase == FAILED) {
				return false;
			}
			if (PHASE_UPDATER.compareAndSet(this, oldPhase, STOPPED)) {
				queue.close();
				return true;
			}
		}
	}

	public Phase phase() {
		return phase;
	}

	public Throwable failure() {
		return failure;
	}

}
