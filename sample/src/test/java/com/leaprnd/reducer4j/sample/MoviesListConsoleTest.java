package com.leaprnd.reducer4j.sample;

import com.leaprnd.reducer4j.sample.MoviesListEvent.MovieClicked;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

import static com.leaprnd.reducer4j.sample.MoviesListConsole.toEvent;
import static com.leaprnd.reducer4j.sample.MoviesListEvent.REFRESH_CLICKED;
import static com.leaprnd.reducer4j.sample.MoviesListEvent.SHUFFLE_CLICKED;
import static com.leaprnd.reducer4j.sample.MoviesListRenderer.render;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MoviesListConsoleTest {

	private static final Movie ALIEN = new Movie(1, "Alien", "alien.jpg", true);
	private static final Movie ALIENS = new Movie(2, "Aliens", "aliens.jpg");
	private static final MoviesListState STATE = MoviesListState.INITIAL.withMovies(List.of(ALIEN, ALIENS));

	@Test
	public void testCommandsBecomeEvents() {
		final var bytes = new ByteArrayOutputStream();
		final var out = new PrintStream(bytes, true, UTF_8);
		assertEquals(Optional.of(REFRESH_CLICKED), toEvent("r", STATE, out));
		assertEquals(Optional.of(SHUFFLE_CLICKED), toEvent("s", STATE, out));
		assertEquals(Optional.of(new MovieClicked(ALIENS)), toEvent("2", STATE, out));
		assertEquals(Optional.empty(), toEvent("3", STATE, out));
		assertEquals(Optional.empty(), toEvent("x", STATE, out));
		final var output = bytes.toString(UTF_8);
		assertTrue(output.contains("There is no movie at position 3!"));
		assertTrue(output.contains("Unknown command x!"));
	}

	@Test
	public void testRendersSelectionAndLoading() {
		assertEquals(
			"IMDb\nTop 10 Movies\n(refreshing...)\n1. * Alien\n2.   Aliens\n",
			render(STATE.withLoading(true))
		);
	}

}
