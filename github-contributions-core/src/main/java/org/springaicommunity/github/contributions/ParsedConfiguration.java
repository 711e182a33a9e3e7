package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	public static final String ANALYZE = "analyze";

	public static final String CACHED = "cached";

	public static final String ALL_TIME = "alltime";

	public String command = ANALYZE;

	// null = fall back to the caller's remembered subject
	@Nullable
	public String subject;

	public List<String> rangeArguments = new ArrayList<>();

	// null for alltime
	@Nullable
	public DateRange range;

	// Mode flags
	public boolean refresh = false;

	public boolean noCache = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	@Nullable
	public Path cacheDirectory;

	public Duration timeout;

	public int maxRetries;

	public ParsedConfiguration(ContributionProperties defaultProperties) {
		this.cacheDirectory = defaultProperties.getCacheDirectory();
		this.timeout = defaultProperties.getAnalysisTimeout();
		this.maxRetries = defaultProperties.getMaxRetries();
	}

	/**
	 * Copy the command-line overrides onto {@code properties}.
	 * @param properties properties to update
	 * @return the same properties
	 */
	public ContributionProperties applyTo(ContributionProperties properties) {
		properties.setCacheDirectory(noCache ? null : cacheDirectory);
		properties.setAnalysisTimeout(timeout);
		properties.setMaxRetries(maxRetries);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", subject='" + subject + '\'' + ", range="
				+ range + ", refresh=" + refresh + ", noCache=" + noCache + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + ", cacheDirectory=" + cacheDirectory + ", timeout=" + timeout
				+ ", maxRetries=" + maxRetries + '}';
	}

}
