package com.leaprnd.reducer4j.sample;

import com.leaprnd.reducer4j.LifecycleScope;
import com.leaprnd.reducer4j.sample.MoviesListEvent.MovieClicked;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.Optional;
import java.util.Random;

import static com.leaprnd.reducer4j.sample.MoviesListEvent.REFRESH_CLICKED;
import static com.leaprnd.reducer4j.sample.MoviesListEvent.SCREEN_STARTED;
import static com.leaprnd.reducer4j.sample.MoviesListEvent.SHUFFLE_CLICKED;
import static com.leaprnd.reducer4j.sample.MoviesListRenderer.render;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.empty;
import static java.util.Optional.of;

/**
 * Renders the movie list to the console and turns typed commands into events:
 * a position toggles that movie, {@code r} refreshes, {@code s} shuffles and
 * {@code q} quits.
 */
public class MoviesListConsole {

	public static void main(String... arguments) throws IOException {
		final var scope = LifecycleScope.withDedicatedThread("Movies List");
		final var viewModel = new MoviesListViewModel(new BundledMovieFetcher(), scope, new Random());
		final var state = viewModel.state();
		final var out = System.out;
		state.subscribe(newState -> out.println(render(newState)));
		state.handleEvent(SCREEN_STARTED);
		final var reader = new BufferedReader(new InputStreamReader(System.in, UTF_8));
		try {
			String line;
			while ((line = reader.readLine()) != null) {
				final var command = line.trim();
				if (command.equals("q")) {
					break;
				}
				toEvent(command, state.current(), out).ifPresent(state::handleEvent);
			}
		} finally {
			viewModel.close();
		}
	}

	static Optional<MoviesListEvent> toEvent(String command, MoviesListState state, PrintStream out) {
		switch (command) {
			case "r":
				return of(REFRESH_CLICKED);
			case "s":
				return of(SHUFFLE_CLICKED);
			default:
				final int position;
				try {
					position = Integer.parseInt(command);
				} catch (NumberFormatException exception) {
					out.println("Unknown command " + command + "!");
					return empty();
				}
				final var movies = state.movies();
				if (position < 1 || position > movies.size()) {
					out.println("There is no movie at position " + position + "!");
					return empty();
				}
				return of(new MovieClicked(movies.get(position - 1)));
		}
	}

}
