package com.gentoro.galleryup;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.galleryup.exception.ConfigException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesKeyValuesAndFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--config=/etc/galleryup.yaml", "--mode=drain", "--verbose"});

    assertEquals(Path.of("/etc/galleryup.yaml"), params.configFile());
    assertEquals(StartupParameters.MODE_DRAIN, params.mode());
    assertTrue(params.getParameter("verbose", Boolean.class));
    assertFalse(params.has("add"));
  }

  @Test
  void defaultsWhenNothingGiven() {
    StartupParameters params = new StartupParameters(null);
    assertNull(params.configFile());
    assertEquals(StartupParameters.MODE_SERVER, params.mode());
    assertEquals(List.of(), params.foldersToAdd());
  }

  @Test
  void splitsFoldersToAdd() {
    StartupParameters params = new StartupParameters(new String[] {"--add=/a, /b,,"});
    assertEquals(List.of(Path.of("/a"), Path.of("/b")), params.foldersToAdd());
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"config"}));
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"--"}));
    assertThrows(
        ConfigException.class, () -> new StartupParameters(new String[] {"--mode=turbo"}).mode());
    assertThrows(
        ConfigException.class,
        () ->
            new StartupParameters(new String[] {"--port=abc"}).getParameter("port", Integer.class));
    assertEquals(
        8081,
        new StartupParameters(new String[] {"--port=8081"}).getParameter("port", Integer.class));
  }
}
