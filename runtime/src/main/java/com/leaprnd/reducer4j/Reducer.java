package com.leaprnd.reducer4j;

/**
 * Computes the next state from the current state and a single event. A
 * {@link StateReducer} invokes its reducer exactly once per accepted event,
 * in acceptance order, and never concurrently with itself.
 *
 * Implementations must be fast and must not mutate the state they are given.
 * Slow work belongs outside of the reducer and should report back through a
 * later event.
 */
@FunctionalInterface
public interface Reducer<S, E> {
	S reduce(S state, E event);
}
