package org.javai.springai.escalation.heal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes one JSON object per line to an append-only file.
 */
public class FileHealingAuditLog implements HealingAuditLog {

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

	private final Path path;

	public FileHealingAuditLog(Path path) {
		if (path == null) {
			throw new IllegalArgumentException("path must not be null");
		}
		this.path = path;
	}

	@Override
	public synchronized void append(HealingRecord record) throws IOException {
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		String line = JSON_MAPPER.writeValueAsString(record) + System.lineSeparator();
		Files.writeString(path, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
	}

	public Path path() {
		return path;
	}
}
