package com.leaprnd.reducer4j.sample;

import java.util.List;

import static java.util.Objects.requireNonNull;

public sealed interface MoviesListEvent {

	MoviesListEvent SCREEN_STARTED = new ScreenStarted();
	MoviesListEvent REFRESH_CLICKED = new RefreshClicked();
	MoviesListEvent SHUFFLE_CLICKED = new ShuffleClicked();

	record ScreenStarted() implements MoviesListEvent {}

	record RefreshClicked() implements MoviesListEvent {}

	record ShuffleClicked() implements MoviesListEvent {}

	record MoviesLoaded(List<Movie> movies) implements MoviesListEvent {
		public MoviesLoaded {
			movies = List.copyOf(movies);
		}
	}

	record MoviesLoadFailed(Throwable cause) implements MoviesListEvent {
		public MoviesLoadFailed {
			requireNonNull(cause);
		}
	}

	record MovieClicked(Movie movie) implements MoviesListEvent {
		public MovieClicked {
			requireNonNull(movie);
		}
	}

}
