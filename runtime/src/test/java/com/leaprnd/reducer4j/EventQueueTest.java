package com.leaprnd.reducer4j;

import org.junit.jupiter.api.Test;

import static com.leaprnd.reducer4j.EventQueue.Outcome.ACCEPTED;
import static com.leaprnd.reducer4j.EventQueue.Outcome.REJECTED_CLOSED;
import static com.leaprnd.reducer4j.EventQueue.Outcome.REJECTED_FULL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EventQueueTest {

	@Test
	public void testEventsArePolledInSubmissionOrder() {
		final var queue = new EventQueue<String>(3);
		assertEquals(ACCEPTED, queue.submit("a"));
		assertEquals(ACCEPTED, queue.submit("b"));
		assertEquals(ACCEPTED, queue.submit("c"));
		assertEquals("a", queue.poll());
		assertEquals("b", queue.poll());
		assertEquals("c", queue.poll());
		assertNull(queue.poll());
	}

	@Test
	public void testFullQueueRejectsWithoutLosingPendingEvents() {
		final var queue = new EventQueue<String>(2);
		queue.submit("a");
		queue.submit("b");
		assertEquals(REJECTED_FULL, queue.submit("c"));
		assertEquals(2, queue.size());
		assertEquals("a", queue.poll());
		assertEquals(ACCEPTED, queue.submit("c"));
		assertEquals("b", queue.poll());
		assertEquals("c", queue.poll());
	}

	@Test
	public void testClosedQueueDiscardsAndRejects() {
		final var queue = new EventQueue<String>(2);
		queue.submit("a");
		queue.close();
		assertTrue(queue.isClosed());
		assertTrue(queue.isEmpty());
		assertEquals(REJECTED_CLOSED, queue.submit("b"));
		assertNull(queue.poll());
	}

	@Test
	public void testCapacityMustBePositive() {
		assertThrows(IllegalArgumentException.class, () -> new EventQueue<String>(0));
	}

}
