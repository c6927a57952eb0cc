package com.leaprnd.reducer4j.sample;

import com.leaprnd.reducer4j.LifecycleScope;
import com.leaprnd.reducer4j.StateReducer;
import com.leaprnd.reducer4j.sample.MoviesListEvent.MovieClicked;
import com.leaprnd.reducer4j.sample.MoviesListEvent.MoviesLoadFailed;
import com.leaprnd.reducer4j.sample.MoviesListEvent.MoviesLoaded;
import com.leaprnd.reducer4j.sample.MoviesListEvent.RefreshClicked;
import com.leaprnd.reducer4j.sample.MoviesListEvent.ScreenStarted;
import com.leaprnd.reducer4j.sample.MoviesListEvent.ShuffleClicked;
import org.slf4j.Logger;

import java.util.Random;

import static com.leaprnd.reducer4j.StateReducers.create;
import static com.leaprnd.reducer4j.sample.Movies.copySelectionFrom;
import static com.leaprnd.reducer4j.sample.Movies.shuffled;
import static com.leaprnd.reducer4j.sample.Movies.toggleSelection;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Owns the state of the movie list screen for as long as its scope is open.
 */
public class MoviesListViewModel {

	private static final Logger LOGGER = getLogger(MoviesListViewModel.class);

	private final MovieFetcher fetcher;
	private final LifecycleScope scope;
	private final Random random;
	private final StateReducer<MoviesListState, MoviesListEvent> state;

	public MoviesListViewModel(MovieFetcher fetcher) {
		this(fetcher, new LifecycleScope(), new Random());
	}

	public MoviesListViewModel(MovieFetcher fetcher, LifecycleScope scope, Random random) {
		this.fetcher = requireNonNull(fetcher);
		this.scope = requireNonNull(scope);
		this.random = requireNonNull(random);
		this.state = create(MoviesListState.INITIAL, this::reduceState, scope);
	}

	public StateReducer<MoviesListState, MoviesListEvent> state() {
		return state;
	}

	private MoviesListState reduceState(MoviesListState currentState, MoviesListEvent event) {
		if (event instanceof ScreenStarted || event instanceof RefreshClicked) {
			refreshMovies();
			return currentState.withLoading(true);
		}
		if (event instanceof MovieClicked movieClicked) {
			final var clickedId = movieClicked.movie().id();
			return currentState.withMovies(toggleSelection(currentState.movies(), clickedId));
		}
		if (event instanceof ShuffleClicked) {
			return currentState.withMovies(shuffled(currentState.movies(), random));
		}
		if (event instanceof MoviesLoaded moviesLoaded) {
			final var updatedMovies = copySelectionFrom(moviesLoaded.movies(), currentState.movies());
			return currentState.withLoading(false).withMovies(updatedMovies);
		}
		if (event instanceof MoviesLoadFailed) {
			return currentState.withLoading(false);
		}
		throw new IllegalArgumentException("Unexpected event " + event + "!");
	}

	private void refreshMovies() {
		scope.launch(() -> fetcher.fetch().whenComplete((movies, exception) -> {
			if (exception == null) {
				state.handleEvent(new MoviesLoaded(movies));
			} else {
				LOGGER.error("Could not fetch movies!", exception);
				state.handleEvent(new MoviesLoadFailed(exception));
			}
		}));
	}

	public boolean close() {
		return scope.close();
	}

}
