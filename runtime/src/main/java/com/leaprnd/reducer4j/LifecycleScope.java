package com.leaprnd.reducer4j;

import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.Executors.newSingleThreadExecutor;
import static org.slf4j.LoggerFactory.getLogger;

public class LifecycleScope implements Scope {

	public static final Executor DIRECT_EXECUTOR = Runnable::run;

	private static final Logger LOGGER = getLogger(LifecycleScope.class);

	private final Executor executor;
	private final Deque<Runnable> hooks = new ArrayDeque<>();
	private volatile boolean active = true;

	/**
	 * Creates a scope that runs reductions and launched work on whichever thread
	 * triggers them.
	 */
	public LifecycleScope() {
		this(DIRECT_EXECUTOR);
	}

	public LifecycleScope(Executor executor) {
		this.executor = requireNonNull(executor);
	}

	/**
	 * Creates a scope backed by its own daemon thread, which is shut down once the
	 * scope is closed and every other hook has run.
	 */
	public static LifecycleScope withDedicatedThread(String name) {
		requireNonNull(name);
		final ExecutorService executor = newSingleThreadExecutor(runnable -> {
			final var thread = new Thread(runnable);
			thread.setDaemon(true);
			thread.setName(name);
			return thread;
		});
		final var scope = new LifecycleScope(executor);
		scope.onClose(executor::shutdown);
		return scope;
	}

	@Override
	public final Executor executor() {
		return executor;
	}

	@Override
	public final boolean isActive() {
		return active;
	}

	@Override
	public final boolean launch(Runnable task) {
		requireNonNull(task);
		if (!active) {
			LOGGER.debug("Did not launch {} because {} is closed.", task, this);
			return false;
		}
		executor.execute(() -> {
			if (active) {
				task.run();
			}
		});
		return true;
	}

	@Override
	public final void onClose(Runnable hook) {
		requireNonNull(hook);
		synchronized (hooks) {
			if (active) {
				hooks.push(hook);
				return;
			}
		}
		runHook(hook);
	}

	/**
	 * @return True if and only if this invocation closed the scope.
	 */
	public boolean close() {
		synchronized (hooks) {
			if (!active) {
				return false;
			}
			active = false;
		}
		LOGGER.debug("Closing {}.", this);
		while (true) {
			final Runnable hook;
			synchronized (hooks) {
				hook = hooks.poll();
			}
			if (hook == null) {
				return true;
			}
			runHook(hook);
		}
	}

	private void runHook(Runnable hook) {
		try {
			hook.run();
		} catch (Throwable throwable) {
			LOGGER.error("Could not run close hook {} of {}!", hook, this, throwable);
		}
	}

}
