package works.consoletree.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Raises the log level of all consoletree loggers for the {@code --verbose} option.
 */
final class VerboseLogging {
	static final String LOGGER_NAME = "works.consoletree";

	private VerboseLogging() {}

	static void enable() {
		// We'd like to use SLF4J's API here, but it has no way to change levels
		if (LoggerFactory.getLogger(LOGGER_NAME) instanceof Logger logger) {
			logger.setLevel(Level.DEBUG);
			LOGGER.debug("Verbose logging enabled");
		} else {
			LOGGER.warn("Logging backend is not Logback; ignoring --verbose");
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(VerboseLogging.class);
}
