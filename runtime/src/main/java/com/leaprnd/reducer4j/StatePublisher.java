package com.leaprnd.reducer4j;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.System.arraycopy;
import static java.util.Arrays.copyOf;
import static java.util.Objects.requireNonNull;

/**
 * Holds the latest committed state and hands every committed state to the
 * active subscriptions. Publishing and subscribing are serialized by a single
 * lock so that no state can be committed between reading the state replayed to
 * a new listener and registering it. The replay itself runs outside that lock.
 * Reading the current state takes no lock.
 */
final class StatePublisher<S> {

	@SuppressWarnings("rawtypes")
	private static final StateSubscription[] NO_SUBSCRIPTIONS = new StateSubscription[0];

	private final Lock lock = new ReentrantLock();
	private final boolean skipUnchangedStates;

	@NotNull
	private volatile S current;

	// Guarded by lock. Replaced, never mutated, so delivery can iterate a snapshot.
	private StateSubscription<S>[] subscriptions = noSubscriptions();
	private boolean closed = false;

	StatePublisher(S initialState, boolean skipUnchangedStates) {
		this.current = requireNonNull(initialState);
		this.skipUnchangedStates = skipUnchangedStates;
	}

	public S current() {
		return current;
	}

	/**
	 * Commits a new state. Only the {@link ReductionLoop} calls this method.
	 */
	public void publish(S newState) {
		requireNonNull(newState);
		lock.lock();
		try {
			final var oldState = current;
			current = newState;
			if (closed || skipUnchangedStates && newState.equals(oldState)) {
				return;
			}
			for (final var subscription : subscriptions) {
				subscription.offer(newState);
			}
		} finally {
			lock.unlock();
		}
	}

	public Subscription subscribe(Executor executor, StateListener<? super S> listener) {
		requireNonNull(executor);
		requireNonNull(listener);
		final var subscription = new StateSubscription<>(this, executor, listener);
		final S state;
		lock.lock();
		try {
			if (closed) {
				subscription.cancel();
			} else {
				subscriptions = with(subscriptions, subscription);
			}
			state = current;
			subscription.beginReplay();
		} finally {
			lock.unlock();
		}
		// States committed from here on wait in the subscription until the replay returns.
		subscription.replay(state);
		return subscription;
	}

	void remove(StateSubscription<S> subscription) {
		lock.lock();
		try {
			subscriptions = without(subscriptions, subscription);
		} finally {
			lock.unlock();
		}
	}

	public int numberOfSubscriptions() {
		lock.lock();
		try {
			return subscriptions.length;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Cancels every subscription. States committed afterwards still become
	 * {@link #current()} but are not delivered to anyone.
	 */
	public void close() {
		final StateSubscription<S>[] oldSubscriptions;
		lock.lock();
		try {
			closed = true;
			oldSubscriptions = subscriptions;
			subscriptions = noSubscriptions();
		} finally {
			lock.unlock();
		}
		for (final var subscription : oldSubscriptions) {
			subscription.cancel();
		}
	}

	@Override
	public String toString() {
		return "StatePublisher[" + current + "]";
	}

	@SuppressWarnings("unchecked")
	private static <S> StateSubscription<S>[] noSubscriptions() {
		return NO_SUBSCRIPTIONS;
	}

	private static <S> StateSubscription<S>[] with(StateSubscription<S>[] oldArray, StateSubscription<S> element) {
		final var newArray = copyOf(oldArray, oldArray.length + 1);
		newArray[oldArray.length] = element;
		return newArray;
	}

	private static <S> StateSubscription<S>[] without(StateSubscription<S>[] oldArray, StateSubscription<S> element) {
		var index = oldArray.length;
		while (--index >= 0) {
			if (oldArray[index] == element) {
				break;
			}
		}
		if (index < 0) {
			return oldArray;
		}
		final var newLength = oldArray.length - 1;
		if (newLength == 0) {
			return noSubscriptions();
		}
		final var newArray = copyOf(oldArray, newLength);
		arraycopy(oldArray, index + 1, newArray, index, newLength - index);
		return newArray;
	}

}
