package org.javai.pgintrospect.joins;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.javai.pgintrospect.schema.MetadataProvider;
import org.javai.pgintrospect.schema.MetadataUnavailableException;
import org.javai.pgintrospect.schema.QualifiedName;
import org.javai.pgintrospect.schema.TableNotFoundException;
import org.javai.pgintrospect.schema.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proposes JOIN clauses that bring a new table into a query already using a set of
 * aliased tables.
 *
 * <p>For every existing table (in the given order, duplicates included) the engine looks up
 * the foreign-key edges of the pair, lets each {@link JoinRule} propose LEFT JOIN candidates
 * and adds an INNER JOIN variant for every candidate scored 90 or more. The candidates of
 * all pairs are then sorted by descending score (stable), deduplicated on the exact clause
 * text keeping the first, i.e. highest scored, occurrence, and returned.</p>
 *
 * <pre>{@code
 * JoinInferenceEngine engine = JoinInferenceEngine.builder(provider).build();
 * List<JoinSuggestion> joins = engine.suggestJoins(
 *     List.of(new TableRef("users", "u"), new TableRef("orders", "o")),
 *     new TableRef("order_items", "oi"));
 * }</pre>
 *
 * <p>No relationship is not an error: the result is then empty. A table identifier that does
 * not resolve raises {@link TableNotFoundException}; metadata failures propagate unchanged and
 * abort the whole request. The engine keeps no state between requests.</p>
 *
 * <p>With an executor configured, the per-pair lookups run concurrently and the request is
 * bounded by a timeout. A request that times out or is interrupted fails with
 * {@link JoinInferenceCancelledException}; a partial list is never returned.</p>
 */
public final class JoinInferenceEngine {

	private static final Logger logger = LoggerFactory.getLogger(JoinInferenceEngine.class);

	private final ForeignKeyGraphView graph;
	private final JoinClauseRenderer renderer;
	private final List<JoinRule> rules;
	private final boolean needsTableShapes;
	private final ExecutorService executor;
	private final Duration requestTimeout;

	private JoinInferenceEngine(Builder builder) {
		this.graph = new ForeignKeyGraphView(builder.provider, builder.defaultSchema);
		this.renderer = new JoinClauseRenderer(builder.defaultSchema);
		this.rules = List.copyOf(builder.rules);
		this.needsTableShapes = rules.stream().anyMatch(JoinRule::needsTableShapes);
		this.executor = builder.executor;
		this.requestTimeout = builder.requestTimeout;
	}

	public static Builder builder(MetadataProvider provider) {
		return new Builder(provider);
	}

	public List<JoinRule> rules() {
		return rules;
	}

	/**
	 * @param existingTables tables already in the query, in query order
	 * @param newTable the table to bring in
	 * @return suggestions ranked by descending score, no two with the same expression
	 */
	public List<JoinSuggestion> suggestJoins(List<TableRef> existingTables, TableRef newTable) {
		Objects.requireNonNull(existingTables, "existingTables must not be null");
		Objects.requireNonNull(newTable, "newTable must not be null");

		AliasedTable joined = graph.resolve(newTable);
		List<EdgePair> pairs = executor != null
				? lookupConcurrently(existingTables, joined)
				: lookupSequentially(existingTables, joined);

		List<JoinSuggestion> candidates = new ArrayList<>();
		for (EdgePair pair : pairs) {
			List<JoinSuggestion> pairCandidates = inferPair(pair);
			logger.debug("{} candidate(s) joining {} {} to {} {}", pairCandidates.size(),
					pair.right().name(), pair.right().alias(), pair.left().name(), pair.left().alias());
			candidates.addAll(pairCandidates);
		}

		List<JoinSuggestion> ranked = rank(candidates);
		logger.debug("Suggesting {} join(s) for {} from {} candidate(s)", ranked.size(), joined.name(),
				candidates.size());
		return ranked;
	}

	/**
	 * Candidates for one pair, LEFT JOIN variants each followed by their INNER JOIN variant.
	 */
	List<JoinSuggestion> inferPair(EdgePair pair) {
		List<JoinSuggestion> candidates = new ArrayList<>();
		for (JoinRule rule : rules) {
			for (JoinSuggestion candidate : rule.candidates(pair, renderer)) {
				candidates.add(candidate);
				if (candidate.qualifiesForInnerVariant()) {
					candidates.add(candidate.toInnerVariant());
				}
			}
		}
		return candidates;
	}

	/**
	 * Stable sort by descending score, then drop every later suggestion whose expression was
	 * already seen.
	 */
	static List<JoinSuggestion> rank(List<JoinSuggestion> candidates) {
		List<JoinSuggestion> sorted = new ArrayList<>(candidates);
		sorted.sort(Comparator.comparingInt(JoinSuggestion::score).reversed());
		Map<String, JoinSuggestion> unique = new LinkedHashMap<>();
		for (JoinSuggestion suggestion : sorted) {
			unique.putIfAbsent(suggestion.expression(), suggestion);
		}
		return List.copyOf(unique.values());
	}

	private EdgePair lookupPair(TableRef existing, AliasedTable joined) {
		AliasedTable left = graph.resolve(existing);
		return graph.edgesBetween(left, joined, needsTableShapes);
	}

	private List<EdgePair> lookupSequentially(List<TableRef> existingTables, AliasedTable joined) {
		List<EdgePair> pairs = new ArrayList<>(existingTables.size());
		for (TableRef existing : existingTables) {
			pairs.add(lookupPair(existing, joined));
		}
		return pairs;
	}

	private List<EdgePair> lookupConcurrently(List<TableRef> existingTables, AliasedTable joined) {
		List<Callable<EdgePair>> lookups = new ArrayList<>(existingTables.size());
		for (TableRef existing : existingTables) {
			lookups.add(() -> lookupPair(existing, joined));
		}

		List<Future<EdgePair>> futures;
		try {
			futures = executor.invokeAll(lookups, requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new JoinInferenceCancelledException("Join suggestion for " + joined.name() + " was interrupted", e);
		}

		List<EdgePair> pairs = new ArrayList<>(futures.size());
		try {
			for (Future<EdgePair> future : futures) {
				pairs.add(future.get());
			}
		}
		catch (CancellationException e) {
			throw new JoinInferenceCancelledException("Join suggestion for " + joined.name()
					+ " did not complete within " + requestTimeout.toMillis() + " ms", e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new JoinInferenceCancelledException("Join suggestion for " + joined.name() + " was interrupted", e);
		}
		catch (ExecutionException e) {
			throw propagate(e.getCause(), joined.name());
		}
		finally {
			futures.forEach(future -> future.cancel(true));
		}
		return pairs;
	}

	private static RuntimeException propagate(Throwable cause, QualifiedName joined) {
		if (cause instanceof RuntimeException runtime) {
			return runtime;
		}
		if (cause instanceof Error error) {
			throw error;
		}
		return new MetadataUnavailableException("Metadata lookup for " + joined + " failed", cause);
	}

	public static final class Builder {

		private final MetadataProvider provider;
		private final List<JoinRule> rules = new ArrayList<>(ForeignKeyJoinRule.standardRules());
		private String defaultSchema = QualifiedName.DEFAULT_SCHEMA;
		private ExecutorService executor;
		private Duration requestTimeout = Duration.ofSeconds(30);

		private Builder(MetadataProvider provider) {
			this.provider = Objects.requireNonNull(provider, "provider must not be null");
		}

		public Builder defaultSchema(String defaultSchema) {
			this.defaultSchema = Objects.requireNonNull(defaultSchema, "defaultSchema must not be null");
			return this;
		}

		/**
		 * Runs the per-pair lookups of a request on {@code executor}. The executor stays
		 * owned by the caller.
		 */
		public Builder executor(ExecutorService executor) {
			this.executor = executor;
			return this;
		}

		/**
		 * Upper bound on one request when lookups run on an executor.
		 */
		public Builder requestTimeout(Duration requestTimeout) {
			if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
				throw new IllegalArgumentException("requestTimeout must be positive");
			}
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder namingConventionHeuristic(boolean enabled) {
			rules.removeIf(NamingConventionRule.class::isInstance);
			if (enabled) {
				rules.add(new NamingConventionRule());
			}
			return this;
		}

		/**
		 * Adds a rule after the built-in ones.
		 */
		public Builder addRule(JoinRule rule) {
			rules.add(Objects.requireNonNull(rule, "rule must not be null"));
			return this;
		}

		public JoinInferenceEngine build() {
			return new JoinInferenceEngine(this);
		}
	}
}
