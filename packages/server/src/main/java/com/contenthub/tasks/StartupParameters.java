package com.contenthub.tasks;

import com.contenthub.tasks.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Command line parameters. Accepts {@code --name value} and {@code --name=value}; a flag without a
 * value is recorded as {@code "true"}.
 *
 * <p>{@code config} (alias {@code config-file}) points at a YAML configuration file; any other name
 * is a configuration key whose value overrides the file.
 */
public final class StartupParameters {
  public static final String CONFIG = "config";
  private static final String CONFIG_ALIAS = "config-file";

  private final Map<String, String> parameters;

  public StartupParameters(String[] args) {
    this.parameters = Collections.unmodifiableMap(parse(args == null ? new String[0] : args));
  }

  private static Map<String, String> parse(String[] args) {
    Map<String, String> out = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      String name;
      String value;
      if (eq >= 0) {
        name = body.substring(0, eq);
        value = body.substring(eq + 1);
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        name = body;
        value = args[++i];
      } else {
        name = body;
        value = "true";
      }
      if (CONFIG_ALIAS.equals(name)) name = CONFIG;
      out.put(name, value);
    }
    return out;
  }

  /**
   * Every parameter except {@code config}, keyed by name. Names are configuration keys, so {@code
   * --http.port=9090} overrides {@code http.port} from the configuration file.
   */
  public Map<String, String> overrides() {
    Map<String, String> out = new LinkedHashMap<>(parameters);
    out.remove(CONFIG);
    return Collections.unmodifiableMap(out);
  }

  /** Configuration file given on the command line, or {@code null} for the bundled defaults. */
  public String configFile() {
    String value = parameters.get(CONFIG);
    return Objects.isNull(value) || value.isBlank() ? null : value.trim();
  }
}
