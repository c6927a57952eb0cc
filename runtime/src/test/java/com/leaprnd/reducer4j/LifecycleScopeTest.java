package com.leaprnd.reducer4j;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LifecycleScopeTest {

	@Test
	public void testHooksRunInReverseOrderOnce() {
		final var scope = new LifecycleScope();
		final var hooks = new ArrayList<String>();
		scope.onClose(() -> hooks.add("first"));
		scope.onClose(() -> hooks.add("second"));
		assertTrue(scope.close());
		assertFalse(scope.close());
		assertEquals(List.of("second", "first"), hooks);
		assertFalse(scope.isActive());
	}

	@Test
	public void testHookRegisteredAfterCloseRunsImmediately() {
		final var scope = new LifecycleScope();
		scope.close();
		final var hooks = new ArrayList<String>();
		scope.onClose(() -> hooks.add("late"));
		assertEquals(List.of("late"), hooks);
	}

	@Test
	public void testFailingHookDoesNotPreventOthers() {
		final var scope = new LifecycleScope();
		final var hooks = new ArrayList<String>();
		scope.onClose(() -> hooks.add("first"));
		scope.onClose(() -> {
			throw new IllegalStateException("Hook failure!");
		});
		assertTrue(scope.close());
		assertEquals(List.of("first"), hooks);
	}

	@Test
	public void testLaunchOnlyWhileActive() {
		final var scope = new LifecycleScope();
		final var launched = new ArrayList<String>();
		assertTrue(scope.launch(() -> launched.add("before")));
		scope.close();
		assertFalse(scope.launch(() -> launched.add("after")));
		assertEquals(List.of("before"), launched);
	}

	@Test
	public void testDedicatedThreadRunsReductions() throws InterruptedException {
		final var scope = LifecycleScope.withDedicatedThread("Reducer Test");
		final var threadNames = new ArrayList<String>();
		final var reducer = StateReducers.create(0, (Integer state, Integer event) -> {
			threadNames.add(Thread.currentThread().getName());
			return state + event;
		}, scope);
		final var latch = new CountDownLatch(1);
		reducer.subscribe(state -> {
			if (state == 2) {
				latch.countDown();
			}
		});
		reducer.handleEvent(1);
		reducer.handleEvent(1);
		assertTrue(latch.await(5, SECONDS), "The events were never reduced!");
		assertEquals(List.of("Reducer Test", "Reducer Test"), threadNames);
		scope.close();
	}

}
