package org.javai.springai.escalation.heal;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * A configuration file on disk. Writes go to a sibling temporary file first and are then
 * moved over the original, so a reader never sees a half-written file.
 */
public class FileConfigurationArtifact implements ConfigurationArtifact {

	private final Path path;

	public FileConfigurationArtifact(Path path) {
		if (path == null) {
			throw new IllegalArgumentException("path must not be null");
		}
		this.path = path;
	}

	@Override
	public String read() throws IOException {
		return Files.readString(path, StandardCharsets.UTF_8);
	}

	@Override
	public void write(String text) throws IOException {
		Path directory = path.toAbsolutePath().getParent();
		Path temp = Files.createTempFile(directory, path.getFileName().toString(), ".heal");
		try {
			Files.writeString(temp, text, StandardCharsets.UTF_8);
			try {
				Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally {
			Files.deleteIfExists(temp);
		}
	}

	@Override
	public String location() {
		return path.toString();
	}
}
