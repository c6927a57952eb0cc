package com.leaprnd.reducer4j;

import static com.leaprnd.reducer4j.Exceptions.requirePositive;
import static java.lang.Integer.getInteger;

/**
 * @param capacity            The number of accepted events that may wait for
 *                            reduction before further submissions overflow.
 * @param skipUnchangedStates Whether listeners are spared states that are
 *                            {@link Object#equals equal} to the previous one.
 *                            Such states are committed either way.
 */
public record StateReducerOptions(int capacity, boolean skipUnchangedStates) {

	public static final String CAPACITY_PROPERTY = "reducer4j.capacity";
	public static final int DEFAULT_CAPACITY = 64;

	public StateReducerOptions {
		requirePositive(capacity, "The capacity");
	}

	public static StateReducerOptions defaults() {
		return new StateReducerOptions(getInteger(CAPACITY_PROPERTY, DEFAULT_CAPACITY), true);
	}

	public StateReducerOptions withCapacity(int newCapacity) {
		return new StateReducerOptions(newCapacity, skipUnchangedStates);
	}

	public StateReducerOptions withSkipUnchangedStates(boolean newSkipUnchangedStates) {
		return new StateReducerOptions(capacity, newSkipUnchangedStates);
	}

}
