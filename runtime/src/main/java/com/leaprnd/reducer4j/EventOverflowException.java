package com.leaprnd.reducer4j;

/**
 * Thrown to the submitter of an event when the event queue of a
 * {@link StateReducer} is full. Events are never dropped or retried, so this
 * always points at a producer that outpaces the reducer for longer than the
 * configured capacity allows.
 */
public class EventOverflowException extends IllegalStateException {

	private final transient Object event;
	private final int capacity;

	public EventOverflowException(Object event, int capacity) {
		super(
			"Missed event " + event + "! All " + capacity + " slots of the event queue are taken. " +
			"You are doing something wrong during state transformation."
		);
		this.event = event;
		this.capacity = capacity;
	}

	public Object getEvent() {
		return event;
	}

	public int getCapacity() {
		return capacity;
	}

}
