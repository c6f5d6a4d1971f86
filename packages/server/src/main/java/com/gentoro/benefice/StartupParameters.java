package com.gentoro.benefice;

import com.gentoro.benefice.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Command line arguments of the form {@code --name value} or {@code --name=value}.
 *
 * <p>{@code --config-file} names an extra YAML file; every other parameter overrides the
 * configuration key of the same name.
 */
public final class StartupParameters {
  public static final String CONFIG_FILE = "config-file";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq > 0) {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(body, args[++i]);
      } else {
        // bare flag
        parameters.put(body, "true");
      }
    }
  }

  public String configFile() {
    return StringUtils.trimToNull(parameters.get(CONFIG_FILE));
  }

  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) return null;
    try {
      if (type == String.class) return type.cast(raw);
      if (type == Integer.class) return type.cast(Integer.valueOf(raw.trim()));
      if (type == Boolean.class) return type.cast(Boolean.valueOf(raw.trim()));
    } catch (NumberFormatException e) {
      throw new ConfigException("Parameter --%s is not a number: %s".formatted(name, raw), e);
    }
    throw new ConfigException("Unsupported parameter type " + type.getSimpleName());
  }

  /** Every parameter except {@code --config-file}, as configuration overrides. */
  public Map<String, String> overrides() {
    Map<String, String> out = new LinkedHashMap<>(parameters);
    out.remove(CONFIG_FILE);
    return Collections.unmodifiableMap(out);
  }
}
