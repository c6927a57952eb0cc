package com.leaprnd.reducer4j;

import org.slf4j.Logger;

import java.util.concurrent.Executor;

import static com.leaprnd.reducer4j.LifecycleScope.DIRECT_EXECUTOR;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

final class DefaultStateReducer<S, E> implements StateReducer<S, E> {

	private static final Logger LOGGER = getLogger(DefaultStateReducer.class);

	private final EventQueue<E> queue;
	private final StatePublisher<S> publisher;
	private final ReductionLoop<S, E> loop;

	DefaultStateReducer(S initialState, Reducer<S, E> reducer, Scope scope, StateReducerOptions options) {
		requireNonNull(initialState);
		requireNonNull(reducer);
		requireNonNull(scope);
		requireNonNull(options);
		this.queue = new EventQueue<>(options.capacity());
		this.publisher = new StatePublisher<>(initialState, options.skipUnchangedStates());
		this.loop = new ReductionLoop<>(queue, reducer, publisher, scope.executor());
		scope.onClose(this::close);
	}

	@Override
	public S current() {
		return publisher.current();
	}

	@Override
	public Subscription subscribe(StateListener<? super S> listener) {
		return publisher.subscribe(DIRECT_EXECUTOR, listener);
	}

	@Override
	public Subscription subscribe(Executor executor, StateListener<? super S> listener) {
		return publisher.subscribe(executor, listener);
	}

	@Override
	public void handleEvent(E event) {
		requireNonNull(event);
		switch (queue.submit(event)) {
			case ACCEPTED -> loop.signal();
			case REJECTED_FULL -> throw new EventOverflowException(event, queue.capacity());
			case REJECTED_CLOSED -> {
				final var failure = loop.failure();
				if (failure != null) {
					throw new ReductionFailedException("Could not handle " + event + " after a reduction failed!", failure);
				}
				LOGGER.debug("Ignored {} because the scope of {} is closed.", event, this);
			}
		}
	}

	@Override
	public boolean isActive() {
		return !queue.isClosed();
	}

	private void close() {
		if (loop.stop()) {
			LOGGER.debug("Stopped {}.", this);
		}
		publisher.close();
	}

	@Override
	public String toString() {
		return "StateReducer[" + publisher.current() + "]";
	}

}
