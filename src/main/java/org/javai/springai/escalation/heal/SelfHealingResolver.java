package org.javai.springai.escalation.heal;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last-resort corrective action for configuration conflicts.
 *
 * <p>Every diagnostic message from the host goes through {@link #observe(String)}. When a
 * rule's trigger has matched often enough within its window, the rule's transform is applied
 * to the configuration, the result is persisted, the host is asked to hot-reload, and the
 * rewrite is appended to the audit log. A configuration that is already neutral is not
 * written and not reloaded.</p>
 *
 * <p>Failures to read or write the configuration are logged and reported as an empty result;
 * they never reach the decision cycle.</p>
 */
public class SelfHealingResolver {

	private static final Logger logger = LoggerFactory.getLogger(SelfHealingResolver.class);

	private static final String LOG_PREFIX = "[self-heal] ";

	private final List<HealingRule> rules;
	private final ConfigurationArtifact artifact;
	private final HotReloadSignal reloadSignal;
	private final HealingAuditLog auditLog;
	private final Clock clock;
	private final DiagnosticSignalMonitor monitor = new DiagnosticSignalMonitor();

	public SelfHealingResolver(List<HealingRule> rules, ConfigurationArtifact artifact,
			HotReloadSignal reloadSignal, HealingAuditLog auditLog, Clock clock) {
		if (rules == null || artifact == null || reloadSignal == null || auditLog == null || clock == null) {
			throw new IllegalArgumentException("rules, artifact, reloadSignal, auditLog and clock must not be null");
		}
		this.rules = List.copyOf(rules);
		this.artifact = artifact;
		this.reloadSignal = reloadSignal;
		this.auditLog = auditLog;
		this.clock = clock;
	}

	/**
	 * Feed one diagnostic message.
	 *
	 * @return the rewrite performed because of this message, if any
	 */
	public Optional<HealingRecord> observe(String message) {
		if (message == null || message.isBlank()) {
			return Optional.empty();
		}
		Instant now = clock.instant();
		for (HealingRule rule : rules) {
			if (rule.matches(message) && monitor.recordMatch(rule, now)) {
				logger.warn(LOG_PREFIX + "Rule '{}' fired after {} occurrences: {}", rule.name(), rule.occurrences(), message);
				Optional<HealingRecord> record = heal(rule, message, now);
				if (record.isPresent()) {
					return record;
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Matches counted so far for a rule in its current window.
	 */
	public int pendingOccurrences(String ruleName) {
		return monitor.count(ruleName);
	}

	private Optional<HealingRecord> heal(HealingRule rule, String trigger, Instant now) {
		try {
			String original = artifact.read();
			TransformResult result = rule.transform().apply(original);
			if (!result.changed()) {
				logger.info(LOG_PREFIX + "Rule '{}' found nothing to disable in {}", rule.name(), artifact.location());
				return Optional.empty();
			}
			artifact.write(result.text());
			logger.warn(LOG_PREFIX + "Disabled {} in {} ({})", result.affectedDirectives(), artifact.location(), rule.reason());
			HealingRecord record = new HealingRecord(now, rule.name(), rule.reason(), trigger,
					result.affectedDirectives(), artifact.location());
			signalReload(rule);
			audit(record);
			return Optional.of(record);
		}
		catch (IOException e) {
			logger.error(LOG_PREFIX + "Rule '{}' could not rewrite {}", rule.name(), artifact.location(), e);
			return Optional.empty();
		}
	}

	private void signalReload(HealingRule rule) {
		try {
			reloadSignal.reload(rule.reason());
		}
		catch (RuntimeException e) {
			logger.error(LOG_PREFIX + "Hot reload after rule '{}' failed; change takes effect on next reload",
					rule.name(), e);
		}
	}

	private void audit(HealingRecord record) {
		try {
			auditLog.append(record);
		}
		catch (IOException | RuntimeException e) {
			logger.error(LOG_PREFIX + "Could not append audit record for rule '{}': {}", record.rule(), record, e);
		}
	}
}
