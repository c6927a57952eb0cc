package com.leaprnd.reducer4j;

public interface Subscription extends AutoCloseable {

	/**
	 * Stops any further delivery to the subscribed {@link StateListener}. A state
	 * that is being delivered when this method is invoked may still arrive.
	 *
	 * @return True if and only if this invocation cancelled the subscription.
	 */
	boolean cancel();

	boolean isActive();

	@Override
	default void close() {
		cancel();
	}

}
