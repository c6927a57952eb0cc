package com.leaprnd.reducer4j;

/**
 * Thrown by {@link StateReducer#handleEvent} once the reducer of that
 * {@link StateReducer} has failed. The original failure is the cause.
 */
public class ReductionFailedException extends IllegalStateException {

	public ReductionFailedException(String message, Throwable cause) {
		super(message, cause);
	}

}
