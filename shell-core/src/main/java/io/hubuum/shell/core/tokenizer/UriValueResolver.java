package io.hubuum.shell.core.tokenizer;

import io.hubuum.shell.core.ShellException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces {@code http://} and {@code https://} values with the body fetched by a blocking GET,
 * and {@code file://} values with the contents of the named file. Trailing whitespace is removed
 * from the substituted text.
 *
 * <p>The path after {@code file://} is used as is, so {@code file:///etc/motd} is absolute and
 * {@code file://notes.txt} is relative to the working directory.
 */
public final class UriValueResolver implements ValueResolver {
  private static final Logger LOG = LoggerFactory.getLogger(UriValueResolver.class);

  private static final String FILE_PREFIX = "file://";

  private final HttpClient client;
  private final Duration timeout;

  public UriValueResolver(Duration timeout) {
    this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
  }

  public UriValueResolver(HttpClient client, Duration timeout) {
    this.client = client;
    this.timeout = timeout;
  }

  @Override
  public String resolve(String value) throws ShellException {
    if (value.startsWith("http://") || value.startsWith("https://")) {
      return fetch(value);
    }
    if (value.startsWith(FILE_PREFIX)) {
      return read(value.substring(FILE_PREFIX.length()));
    }
    return value;
  }

  private String fetch(String url) throws ShellException {
    LOG.debug("Fetching option value from {}", url);
    HttpRequest request;
    try {
      request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout).GET().build();
    } catch (IllegalArgumentException e) {
      throw ShellException.httpError(url, "malformed URL", e);
    }
    try {
      HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() / 100 != 2) {
        throw ShellException.httpError(url, "status " + response.statusCode(), null);
      }
      return response.body().stripTrailing();
    } catch (IOException e) {
      throw ShellException.httpError(url, String.valueOf(e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw ShellException.httpError(url, "interrupted", e);
    }
  }

  private String read(String path) throws ShellException {
    LOG.debug("Reading option value from {}", path);
    try {
      return Files.readString(Path.of(path)).stripTrailing();
    } catch (IOException | RuntimeException e) {
      throw ShellException.ioError(path, e);
    }
  }
}
