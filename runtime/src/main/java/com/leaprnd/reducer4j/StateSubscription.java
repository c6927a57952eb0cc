package com.leaprnd.reducer4j;

import org.slf4j.Logger;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import static org.slf4j.LoggerFactory.getLogger;

/**
 * Delivers committed states to one {@link StateListener}. Only the latest
 * undelivered state is kept, so a listener that falls behind skips the states
 * it missed. At most one delivery runs at a time, which keeps deliveries in
 * commit order.
 */
final class StateSubscription<S> implements Subscription, Runnable {

	private static final VarHandle ACTIVE_UPDATER;

	static {
		try {
			ACTIVE_UPDATER = MethodHandles.lookup().findVarHandle(StateSubscription.class, "active", boolean.class);
		} catch (ReflectiveOperationException exception) {
			throw new ExceptionInInitializerError(exception);
		}
	}

	@SuppressWarnings("rawtypes")
	private static final AtomicReferenceFieldUpdater<
		StateSubscription,
		Object
	> PENDING_UPDATER = AtomicReferenceFieldUpdater.newUpdater(StateSubscription.class, Object.class, "pending");
	@SuppressWarnings("rawtypes")
	private static final AtomicIntegerFieldUpdater<
		StateSubscription
	> DELIVERING = AtomicIntegerFieldUpdater.newUpdater(StateSubscription.class, "delivering");
	private static final Logger LOGGER = getLogger(StateSubscription.class);

	private final StatePublisher<S> publisher;
	private final Executor executor;
	private final StateListener<? super S> listener;

	private volatile Object pending = null;
	private volatile boolean active = true;
	private volatile int delivering = 0;

	StateSubscription(StatePublisher<S> publisher, Executor executor, StateListener<? super S> listener) {
		this.publisher = publisher;
		this.executor = executor;
		this.listener = listener;
	}

	/**
	 * Only invoked by the {@link StatePublisher} while it holds its lock, so
	 * offered states arrive here in commit order.
	 */
	void offer(S state) {
		if (!active) {
			return;
		}
		pending = state;
		scheduleDelivery();
	}

	/**
	 * Marks the initial replay as in progress. Only invoked by the
	 * {@link StatePublisher} while it holds its lock, before any later state
	 * can be offered.
	 */
	void beginReplay() {
		DELIVERING.set(this, 1);
	}

	/**
	 * Delivers the state that was current at subscription time on the calling
	 * thread, after {@link #beginReplay()}. States committed meanwhile, for
	 * example by events the listener itself submits, wait until this delivery
	 * has returned.
	 */
	void replay(S state) {
		try {
			listener.onState(state);
		} catch (Throwable throwable) {
			cancel();
			throw throwable;
		} finally {
			DELIVERING.set(this, 0);
			if (pending != null) {
				scheduleDelivery();
			}
		}
	}

	private void scheduleDelivery() {
		if (DELIVERING.compareAndSet(this, 0, 1)) {
			try {
				executor.execute(this);
			} catch (RejectedExecutionException exception) {
				DELIVERING.set(this, 0);
				LOGGER.error("Could not schedule delivery to {}! Cancelling the subscription.", listener, exception);
				cancel();
			}
		}
	}

	@Override
	public void run() {
		while (true) {
			@SuppressWarnings("unchecked")
			final var state = (S) PENDING_UPDATER.getAndSet(this, null);
			if (state == null) {
				DELIVERING.set(this, 0);
				if (pending == null || !DELIVERING.compareAndSet(this, 0, 1)) {
					return;
				}
				continue;
			}
			if (!active) {
				continue;
			}
			try {
				listener.onState(state);
			} catch (Throwable throwable) {
				LOGGER.error("Could not deliver {} to {}!", state, listener, throwable);
			}
		}
	}

	@Override
	public boolean cancel() {
		if (ACTIVE_UPDATER.compareAndSet(this, true, false)) {
			pending = null;
			publisher.remove(this);
			return true;
		}
		return false;
	}

	@Override
	public boolean isActive() {
		return active;
	}

	@Override
	public String toString() {
		return "StateSubscription[" + listener + "]";
	}

}
