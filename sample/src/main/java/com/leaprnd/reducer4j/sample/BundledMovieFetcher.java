package com.leaprnd.reducer4j.sample;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.CompletableFuture.delayedExecutor;
import static java.util.concurrent.CompletableFuture.supplyAsync;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Loads the movie catalogue that ships with this module, after a random delay
 * that stands in for network latency.
 */
public class BundledMovieFetcher implements MovieFetcher {

	public static final String CATALOGUE = "movies.json";
	public static final long DEFAULT_MINIMUM_DELAY_IN_MILLISECONDS = 300;
	public static final long DEFAULT_MAXIMUM_DELAY_IN_MILLISECONDS = 2000;

	private static final Logger LOGGER = getLogger(BundledMovieFetcher.class);
	private static final TypeToken<List<Movie>> MOVIES = new TypeToken<>() {};

	private final Gson gson = new Gson();
	private final Random random;
	private final Executor executor;
	private final long minimumDelayInMilliseconds;
	private final long maximumDelayInMilliseconds;

	public BundledMovieFetcher() {
		this(new Random(), ForkJoinPool.commonPool(), DEFAULT_MINIMUM_DELAY_IN_MILLISECONDS, DEFAULT_MAXIMUM_DELAY_IN_MILLISECONDS);
	}

	public BundledMovieFetcher(
		Random random,
		Executor executor,
		long minimumDelayInMilliseconds,
		long maximumDelayInMilliseconds
	) {
		if (minimumDelayInMilliseconds < 0 || maximumDelayInMilliseconds < minimumDelayInMilliseconds) {
			throw new IllegalArgumentException(
				"Invalid delay of " + minimumDelayInMilliseconds + " to " + maximumDelayInMilliseconds + " milliseconds!"
			);
		}
		this.random = random;
		this.executor = executor;
		this.minimumDelayInMilliseconds = minimumDelayInMilliseconds;
		this.maximumDelayInMilliseconds = maximumDelayInMilliseconds;
	}

	@Override
	public CompletableFuture<List<Movie>> fetch() {
		final var delay = nextDelayInMilliseconds();
		LOGGER.debug("Fetching movies in {} milliseconds.", delay);
		return supplyAsync(this::decodeCatalogue, delayedExecutor(delay, MILLISECONDS, executor));
	}

	private long nextDelayInMilliseconds() {
		if (minimumDelayInMilliseconds == maximumDelayInMilliseconds) {
			return minimumDelayInMilliseconds;
		}
		return random.longs(1, minimumDelayInMilliseconds, maximumDelayInMilliseconds).findFirst().orElseThrow();
	}

	List<Movie> decodeCatalogue() {
		final var stream = BundledMovieFetcher.class.getResourceAsStream(CATALOGUE);
		if (stream == null) {
			throw new IllegalStateException("Could not find " + CATALOGUE + "!");
		}
		try (final var reader = new InputStreamReader(stream, UTF_8)) {
			final var movies = gson.fromJson(reader, MOVIES);
			if (movies == null) {
				throw new JsonParseException(CATALOGUE + " is empty!");
			}
			return List.copyOf(movies);
		} catch (IOException exception) {
			throw new UncheckedIOException(exception);
		}
	}

}
