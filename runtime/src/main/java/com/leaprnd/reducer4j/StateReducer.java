package com.leaprnd.reducer4j;

import org.jetbrains.annotations.NonBlocking;

import java.util.concurrent.Executor;

/**
 * Holds a state that only ever changes by reducing events, one at a time, in
 * the order they were accepted. Any thread may submit events and any number of
 * listeners may observe the state.
 *
 * Instances are bound to the {@link Scope} they were created with. Once that
 * scope is closed, no further events are reduced.
 */
public interface StateReducer<S, E> {

	/**
	 * @return The most recently committed state. Never blocks.
	 */
	S current();

	/**
	 * Registers a listener that is invoked on the thread committing each state.
	 * The current state is delivered synchronously, on the calling thread, before
	 * this method returns.
	 */
	Subscription subscribe(StateListener<? super S> listener);

	/**
	 * Registers a listener whose later notifications run on the provided
	 * {@link Executor}. The current state is still delivered synchronously, on
	 * the calling thread, before this method returns. A listener that falls
	 * behind is only handed the latest state, never an older one.
	 */
	Subscription subscribe(Executor executor, StateListener<? super S> listener);

	/**
	 * @return True if and only if this invocation cancelled the subscription.
	 */
	default boolean unsubscribe(Subscription subscription) {
		return subscription.cancel();
	}

	/**
	 * Queues an event for reduction and returns without waiting for it, unless
	 * the {@link Scope} runs tasks on the calling thread and no reduction is in
	 * progress, in which case the event is reduced before this method returns.
	 * Events submitted after the scope was closed are ignored.
	 *
	 * @throws EventOverflowException    If the event queue is full.
	 * @throws ReductionFailedException If an earlier reduction failed.
	 */
	@NonBlocking
	void handleEvent(E event);

	boolean isActive();

}
