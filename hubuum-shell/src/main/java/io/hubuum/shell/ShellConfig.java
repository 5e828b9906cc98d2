package io.hubuum.shell;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Shell settings. Loads from {@code ~/.hubuum-shell/shell.properties} by default; missing keys
 * keep their defaults.
 *
 * @param padding spaces between the columns of option completion labels
 * @param apiCompletionDisabled whether autocomplete may query the server
 * @param httpTimeoutSeconds connect and request timeout for {@code http(s)://} option values
 * @param historyFile where line history is kept
 * @param prompt the prompt shown before each line
 */
public record ShellConfig(
    int padding,
    boolean apiCompletionDisabled,
    int httpTimeoutSeconds,
    Path historyFile,
    String prompt) {

  static final int DEFAULT_PADDING = 2;
  static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 30;
  static final String DEFAULT_PROMPT = "hubuum> ";

  /**
   * Creates the default configuration.
   *
   * @return default configuration
   */
  public static ShellConfig defaults() {
    return new ShellConfig(
        DEFAULT_PADDING,
        false,
        DEFAULT_HTTP_TIMEOUT_SECONDS,
        getConfigDir().resolve("history"),
        DEFAULT_PROMPT);
  }

  /**
   * Loads configuration from the default location.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static ShellConfig load() throws IOException {
    Path configPath = getConfigDir().resolve("shell.properties");
    if (!Files.exists(configPath)) {
      return defaults();
    }
    return load(configPath);
  }

  /**
   * Loads configuration from an explicit file, which must exist.
   *
   * @throws IOException if the file cannot be read
   */
  public static ShellConfig load(Path configPath) throws IOException {
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  static ShellConfig fromProperties(Properties props) {
    ShellConfig d = defaults();
    int padding = intProperty(props, "output.padding", d.padding());
    boolean apiDisabled =
        Boolean.parseBoolean(props.getProperty("completion.disableApi", "false").trim());
    int timeout = intProperty(props, "http.timeoutSeconds", d.httpTimeoutSeconds());
    String history = props.getProperty("history.file");
    Path historyFile = history == null ? d.historyFile() : Path.of(expandHome(history.trim()));
    String prompt = props.getProperty("prompt", d.prompt());
    return new ShellConfig(padding, apiDisabled, timeout, historyFile, prompt);
  }

  public ShellConfig withPadding(int padding) {
    return new ShellConfig(padding, apiCompletionDisabled, httpTimeoutSeconds, historyFile, prompt);
  }

  public ShellConfig withApiCompletionDisabled(boolean disabled) {
    return new ShellConfig(padding, disabled, httpTimeoutSeconds, historyFile, prompt);
  }

  private static int intProperty(Properties props, String key, int defaultValue) {
    String raw = props.getProperty(key);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
    }
  }

  private static String expandHome(String path) {
    if (path.equals("~") || path.startsWith("~/")) {
      return System.getProperty("user.home") + path.substring(1);
    }
    return path;
  }

  private static Path getConfigDir() {
    return Path.of(System.getProperty("user.home"), ".hubuum-shell");
  }
}
