package io.hubuum.shell.core.tokenizer;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpServer;
import io.hubuum.shell.core.ShellException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UriValueResolverTest {

  @TempDir Path tmp;

  HttpServer server;
  String base;
  UriValueResolver resolver;

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/schema",
        exchange -> {
          byte[] body = "{\"type\": \"object\"}\n\n".getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(200, body.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
          }
        });
    server.createContext(
        "/missing",
        exchange -> {
          exchange.sendResponseHeaders(404, -1);
          exchange.close();
        });
    server.start();
    base = "http://127.0.0.1:" + server.getAddress().getPort();
    resolver = new UriValueResolver(Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void plainValueIsUnchanged() throws Exception {
    assertEquals("acme", resolver.resolve("acme"));
    assertEquals("", resolver.resolve(""));
  }

  @Test
  void httpValueIsReplacedByBody() throws Exception {
    assertEquals("{\"type\": \"object\"}", resolver.resolve(base + "/schema"));
  }

  @Test
  void httpErrorStatusFails() {
    ShellException e =
        assertThrows(ShellException.class, () -> resolver.resolve(base + "/missing"));
    assertEquals(ShellException.Kind.HTTP_ERROR, e.getKind());
    assertTrue(e.getMessage().contains("404"), e.getMessage());
  }

  @Test
  void fileValueIsReplacedByContents() throws Exception {
    Path file = tmp.resolve("description.txt");
    Files.writeString(file, "A long description\n  \n");
    assertEquals("A long description", resolver.resolve("file://" + file.toAbsolutePath()));
  }

  @Test
  void missingFileFails() {
    Path file = tmp.resolve("nope.txt");
    ShellException e =
        assertThrows(
            ShellException.class, () -> resolver.resolve("file://" + file.toAbsolutePath()));
    assertEquals(ShellException.Kind.IO_ERROR, e.getKind());
  }
}
