package org.javai.springai.escalation.config;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.springai.escalation.reflex.ReflexThresholds;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link EscalationConfig} from YAML.
 *
 * <p>Every section and key is optional; anything missing keeps its default. Durations are
 * ISO-8601 strings such as {@code PT60S} or plain numbers of milliseconds.</p>
 *
 * <pre>
 * breaker:
 *   failure_threshold: 3
 *   reset_timeout: PT60S
 * rate_limit:
 *   limit: 30
 *   window: PT60S
 *   emergency_pause: PT60S
 * region_settle: PT5S
 * </pre>
 */
public class EscalationConfigLoader {

	/**
	 * Classpath resource holding the documented defaults.
	 */
	public static final String DEFAULTS_RESOURCE = "escalation-defaults.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load a configuration from the classpath.
	 */
	public static EscalationConfig fromClasspath(String resource) {
		try (InputStream in = EscalationConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				throw new EscalationConfigException(resource + " not found on classpath");
			}
			return new EscalationConfigLoader().parse(in);
		}
		catch (EscalationConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new EscalationConfigException("Failed to load " + resource, e);
		}
	}

	public EscalationConfig parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			Map<String, Object> data = yaml.load(reader);
			return build(data);
		}
		catch (EscalationConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new EscalationConfigException("Failed to parse escalation config from path: " + path, e);
		}
	}

	public EscalationConfig parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return build(data);
		}
		catch (EscalationConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new EscalationConfigException("Failed to parse escalation config from input stream", e);
		}
	}

	public EscalationConfig parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return build(data);
		}
		catch (EscalationConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new EscalationConfigException("Failed to parse escalation config from string", e);
		}
	}

	private EscalationConfig build(Map<String, Object> data) {
		EscalationConfig defaults = EscalationConfig.defaults();
		if (data == null) {
			return defaults;
		}
		return EscalationConfig.builder()
				.breaker(buildBreaker(section(data, "breaker"), defaults.breaker()))
				.rateLimit(buildRateLimit(section(data, "rate_limit"), defaults.rateLimit()))
				.loop(buildLoop(section(data, "loop"), defaults.loop()))
				.regionSettle(duration(data, "region_settle", defaults.regionSettle()))
				.remote(buildRemote(section(data, "remote"), defaults.remote()))
				.reflex(buildReflex(section(data, "reflex")))
				.policyBudget(duration(data, "policy_budget", defaults.policyBudget()))
				.build();
	}

	private BreakerSettings buildBreaker(Map<String, Object> map, BreakerSettings defaults) {
		return new BreakerSettings(
				integer(map, "failure_threshold", defaults.failureThreshold()),
				duration(map, "reset_timeout", defaults.resetTimeout()));
	}

	private RateLimitSettings buildRateLimit(Map<String, Object> map, RateLimitSettings defaults) {
		return new RateLimitSettings(
				integer(map, "limit", defaults.limit()),
				duration(map, "window", defaults.window()),
				duration(map, "emergency_pause", defaults.emergencyPause()));
	}

	private LoopSettings buildLoop(Map<String, Object> map, LoopSettings defaults) {
		return new LoopSettings(
				integer(map, "threshold", defaults.threshold()),
				duration(map, "window", defaults.window()),
				duration(map, "cooldown", defaults.cooldown()));
	}

	private RemoteTierSettings buildRemote(Map<String, Object> map, RemoteTierSettings defaults) {
		return new RemoteTierSettings(
				duration(map, "pattern_deadline", defaults.patternDeadline()),
				duration(map, "planner_deadline", defaults.plannerDeadline()),
				duration(map, "planner_min_interval", defaults.plannerMinInterval()));
	}

	private ReflexThresholds buildReflex(Map<String, Object> map) {
		ReflexThresholds defaults = ReflexThresholds.defaults();
		return ReflexThresholds.builder()
				.criticalHealthRatio(decimal(map, "critical_health_ratio", defaults.criticalHealthRatio()))
				.lowHealthRatio(decimal(map, "low_health_ratio", defaults.lowHealthRatio()))
				.hostileContactDistance(decimal(map, "hostile_contact_distance", defaults.hostileContactDistance()))
				.overCapacityRatio(decimal(map, "over_capacity_ratio", defaults.overCapacityRatio()))
				.criticalStaminaRatio(decimal(map, "critical_stamina_ratio", defaults.criticalStaminaRatio()))
				.dangerousStatuses(strings(map, "dangerous_statuses", defaults.dangerousStatuses()))
				.fallbackHealthItem(string(map, "fallback_health_item", defaults.fallbackHealthItem()))
				.fallbackContactHealthItem(string(map, "fallback_contact_health_item", defaults.fallbackContactHealthItem()))
				.fallbackStatusCureItem(string(map, "fallback_status_cure_item", defaults.fallbackStatusCureItem()))
				.fallbackStaminaItem(string(map, "fallback_stamina_item", defaults.fallbackStaminaItem()))
				.unloadCommand(string(map, "unload_command", defaults.unloadCommand()))
				.build();
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new EscalationConfigException("Section '" + key + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static int integer(Map<String, Object> map, String key, int fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		throw new EscalationConfigException("'" + key + "' must be an integer but was: " + value);
	}

	private static double decimal(Map<String, Object> map, String key, double fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		throw new EscalationConfigException("'" + key + "' must be a number but was: " + value);
	}

	private static String string(Map<String, Object> map, String key, String fallback) {
		Object value = map.get(key);
		return value == null ? fallback : value.toString();
	}

	private static Set<String> strings(Map<String, Object> map, String key, Set<String> fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof List<?> list) {
			Set<String> result = new LinkedHashSet<>();
			list.forEach(item -> result.add(String.valueOf(item)));
			return result;
		}
		throw new EscalationConfigException("'" + key + "' must be a list but was: " + value);
	}

	private static Duration duration(Map<String, Object> map, String key, Duration fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return Duration.ofMillis(number.longValue());
		}
		try {
			return Duration.parse(value.toString().trim());
		}
		catch (RuntimeException e) {
			throw new EscalationConfigException("'" + key + "' is not a duration: " + value, e);
		}
	}
}
