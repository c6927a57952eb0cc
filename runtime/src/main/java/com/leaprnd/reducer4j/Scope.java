package com.leaprnd.reducer4j;

import java.util.concurrent.Executor;

/**
 * The lifetime that a {@link StateReducer} is bound to.
 */
public interface Scope {

	/**
	 * @return The {@link Executor} that reductions, and work launched in this
	 *         scope, run on.
	 */
	Executor executor();

	boolean isActive();

	/**
	 * Runs the provided task on {@link #executor()} unless this scope has already
	 * been closed.
	 *
	 * @return True if and only if the task was handed to the executor.
	 */
	boolean launch(Runnable task);

	/**
	 * Registers a hook to run when this scope is closed. Hooks run in the reverse
	 * order of their registration. If this scope is already closed, the hook runs
	 * immediately.
	 */
	void onClose(Runnable hook);

}
