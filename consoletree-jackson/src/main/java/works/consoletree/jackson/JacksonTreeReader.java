package works.consoletree.jackson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.consoletree.TreeValue;
import works.consoletree.exceptions.UnsupportedTypeException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads one JSON document and converts it to a {@link TreeValue}.
 * <p>
 * Objects keep their member order, and a JSON {@code null} comes through as a Java null,
 * to be rejected when the tree is rendered.
 */
public final class JacksonTreeReader {
	private final ObjectMapper mapper;

	public JacksonTreeReader() {
		this(JsonMapper.builder()
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			// Keeps the decimal digits as written: 0.0001 stays 0.0001 and 1.50 stays 1.50
			.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
			.build());
	}

	/**
	 * @param mapper must decode JSON objects to {@link java.util.Map}s that preserve member order,
	 * as Jackson does by default
	 */
	public JacksonTreeReader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * @param file UTF-8 text
	 * @throws TreeInputException if the file contents are not a single valid JSON document
	 * @throws IOException if the file can't be read
	 */
	public @Nullable TreeValue read(Path file) throws IOException {
		String json = Files.readString(file, UTF_8);
		LOGGER.debug("Read {} characters from {}", json.length(), file);
		return parse(json);
	}

	/**
	 * @throws TreeInputException if <code>json</code> is not a single valid JSON document
	 */
	public @Nullable TreeValue parse(String json) throws TreeInputException {
		Object decoded;
		try {
			decoded = mapper.readValue(json, Object.class);
		} catch (JacksonException e) {
			throw new TreeInputException(describe(e), e);
		}
		try {
			return TreeValues.from(decoded);
		} catch (UnsupportedTypeException e) {
			// A customized mapper produced something other than the usual untyped values
			throw new TreeInputException(e.getMessage(), e);
		}
	}

	// getMessage() puts the source location on a line of its own
	private static String describe(JacksonException e) {
		String message = String.valueOf(e.getOriginalMessage()).replaceAll("\\R+", " ").strip();
		var location = e.getLocation();
		if (location == null || location.getLineNr() < 0) {
			return message;
		}
		return message + " (line " + location.getLineNr() + ", column " + location.getColumnNr() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonTreeReader.class);
}
