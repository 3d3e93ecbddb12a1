package edu.cmu.cs.cs15745.heapviz;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.heapviz.graph.HeapGraph;

/**
 * Knobs of a render call. Immutable; build with {@link #builder()} or read
 * them from {@value #RESOURCE} on the classpath with {@link #load()}.
 */
public final class RenderOptions {
	private static final Logger logger = LogManager.getLogger(RenderOptions.class);

	public static final String RESOURCE = "heapviz.properties";
	public static final String PRUNE_KEY = "heapviz.prune-spec-placeholders";
	public static final String STACK_KEY = "heapviz.show-stack";
	public static final String PRETTY_XML_KEY = "heapviz.pretty-xml";

	/** When the summary box of the pure part is drawn. */
	public enum StackDisplay {
		// Only for preconditions and postconditions.
		AUTO,
		ALWAYS,
		NEVER;

		boolean shows(HeapGraph.Kind kind) {
			switch (this) {
			case ALWAYS:
				return true;
			case NEVER:
				return false;
			default:
				return kind != HeapGraph.Kind.HEAP;
			}
		}
	}

	public static final RenderOptions DEFAULTS = builder().build();

	private final boolean pruneSpecPlaceholders;
	private final StackDisplay stackDisplay;
	private final boolean prettyXml;

	private RenderOptions(Builder builder) {
		this.pruneSpecPlaceholders = builder.pruneSpecPlaceholders;
		this.stackDisplay = builder.stackDisplay;
		this.prettyXml = builder.prettyXml;
	}

	public boolean pruneSpecPlaceholders() {
		return pruneSpecPlaceholders;
	}

	public StackDisplay stackDisplay() {
		return stackDisplay;
	}

	public boolean showStack(HeapGraph.Kind kind) {
		return stackDisplay.shows(kind);
	}

	/** Indented XML with a preamble, or everything on one line. */
	public boolean prettyXml() {
		return prettyXml;
	}

	public static Builder builder() {
		return new Builder();
	}

	/** Options from {@value #RESOURCE}; defaults when the resource is absent. */
	public static RenderOptions load() {
		try (InputStream in = RenderOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in == null) {
				logger.debug("No {} on the classpath, using defaults", RESOURCE);
				return DEFAULTS;
			}
			var properties = new Properties();
			properties.load(in);
			return fromProperties(properties);
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot read " + RESOURCE, e);
		}
	}

	public static RenderOptions fromProperties(Properties properties) {
		var builder = builder();
		String prune = properties.getProperty(PRUNE_KEY);
		if (prune != null) {
			builder.pruneSpecPlaceholders(Boolean.parseBoolean(prune.trim()));
		}
		String stack = properties.getProperty(STACK_KEY);
		if (stack != null) {
			try {
				builder.stackDisplay(StackDisplay.valueOf(stack.trim().toUpperCase(Locale.ROOT)));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException(String.format("Bad value for %s: %s", STACK_KEY, stack), e);
			}
		}
		String pretty = properties.getProperty(PRETTY_XML_KEY);
		if (pretty != null) {
			builder.prettyXml(Boolean.parseBoolean(pretty.trim()));
		}
		var options = builder.build();
		logger.debug("Loaded {}", options);
		return options;
	}

	@Override
	public String toString() {
		return String.format("RenderOptions[prune=%s, stack=%s, prettyXml=%s]", pruneSpecPlaceholders, stackDisplay,
				prettyXml);
	}

	public static final class Builder {
		private boolean pruneSpecPlaceholders = true;
		private StackDisplay stackDisplay = StackDisplay.AUTO;
		private boolean prettyXml = true;

		private Builder() { }

		public Builder pruneSpecPlaceholders(boolean prune) {
			this.pruneSpecPlaceholders = prune;
			return this;
		}

		public Builder stackDisplay(StackDisplay display) {
			this.stackDisplay = Objects.requireNonNull(display);
			return this;
		}

		public Builder prettyXml(boolean pretty) {
			this.prettyXml = pretty;
			return this;
		}

		public RenderOptions build() {
			return new RenderOptions(this);
		}
	}
}
