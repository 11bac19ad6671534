package org.javai.springai.escalation.heal;

import java.io.IOException;

/**
 * The externally-owned configuration text the resolver may rewrite.
 */
public interface ConfigurationArtifact {

	String read() throws IOException;

	void write(String text) throws IOException;

	/**
	 * Where the artifact lives, for logs and the audit trail.
	 */
	String location();
}
