package com.leaprnd.reducer4j;

import org.jetbrains.annotations.NonBlocking;

@FunctionalInterface
public interface StateListener<S> {

	/**
	 * Called with the state that was current when this listener subscribed and
	 * then with every later committed state, in commit order. Listeners that
	 * subscribed with an {@link java.util.concurrent.Executor} may be handed only
	 * the latest state of a burst. Listeners that subscribed without one are
	 * invoked on the thread that committed the state, so implementations must not
	 * block.
	 */
	@NonBlocking
	void onState(S state);

}
