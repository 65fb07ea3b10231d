package com.systemlogger;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.jar.Attributes;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ApplicationIdentifierTest {

  @TempDir Path tempDir;

  @Test
  void mainModule_takesPrecedence() {
    Properties properties = new Properties();
    properties.setProperty("jdk.module.main", "com.example.myapp");
    properties.setProperty("sun.java.command", "com.example.other.Main --flag");

    assertThat(ApplicationIdentifier.resolve(properties)).isEqualTo("com.example.myapp");
  }

  @Test
  void mainClass_resolvesToItsPackage() {
    Properties properties = new Properties();
    properties.setProperty("sun.java.command", "com.example.myapp.Main arg1 arg2");

    assertThat(ApplicationIdentifier.resolve(properties)).isEqualTo("com.example.myapp");
  }

  @Test
  void mainClassInUnnamedPackage_resolvesToClassName() {
    Properties properties = new Properties();
    properties.setProperty("sun.java.command", "Main");

    assertThat(ApplicationIdentifier.resolve(properties)).isEqualTo("Main");
  }

  @Test
  void jar_prefersAutomaticModuleName() throws IOException {
    Manifest manifest = new Manifest();
    manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
    manifest.getMainAttributes().put(new Attributes.Name("Automatic-Module-Name"), "com.example.app");
    manifest.getMainAttributes().put(Attributes.Name.MAIN_CLASS, "com.example.launcher.Main");
    Path jar = writeJar("app.jar", manifest);

    assertThat(ApplicationIdentifier.resolve(command(jar + " --port 8080")))
        .isEqualTo("com.example.app");
  }

  @Test
  void jar_fallsBackToMainClassPackage() throws IOException {
    Manifest manifest = new Manifest();
    manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
    manifest.getMainAttributes().put(Attributes.Name.MAIN_CLASS, "com.example.launcher.Main");
    Path jar = writeJar("launcher.jar", manifest);

    assertThat(ApplicationIdentifier.resolve(command(jar.toString())))
        .isEqualTo("com.example.launcher");
  }

  @Test
  void jarUnderPathWithSpaces_readsItsManifest() throws IOException {
    Manifest manifest = new Manifest();
    manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
    manifest.getMainAttributes().put(Attributes.Name.MAIN_CLASS, "com.example.desktop.Main");
    Path jar = writeJar(Files.createDirectory(tempDir.resolve("My App")).resolve("app.jar"), manifest);

    assertThat(ApplicationIdentifier.resolve(command(jar + " --port 8080")))
        .isEqualTo("com.example.desktop");
    assertThat(ApplicationIdentifier.resolve(command(jar.toString())))
        .isEqualTo("com.example.desktop");
  }

  @Test
  void missingJarUnderPathWithSpaces_fallsBack() {
    assertThat(ApplicationIdentifier.resolve(command("/opt/My App/app.jar --port 8080")))
        .isEqualTo(ApplicationIdentifier.FALLBACK);
  }

  @Test
  void mainClassWithJarArgument_resolvesToClassPackage() {
    assertThat(ApplicationIdentifier.resolve(command("com.example.tool.Main input.jar")))
        .isEqualTo("com.example.tool");
  }

  @Test
  void jarWithoutMainAttributes_fallsBack() throws IOException {
    Manifest manifest = new Manifest();
    manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
    Path jar = writeJar("plain.jar", manifest);

    assertThat(ApplicationIdentifier.resolve(command(jar.toString())))
        .isEqualTo(ApplicationIdentifier.FALLBACK);
  }

  @Test
  void unreadableJar_fallsBack() throws IOException {
    Path notAJar = Files.writeString(tempDir.resolve("broken.jar"), "not a zip archive");

    assertThat(ApplicationIdentifier.resolve(command(notAJar.toString())))
        .isEqualTo(ApplicationIdentifier.FALLBACK);
    assertThat(ApplicationIdentifier.resolve(command(tempDir.resolve("missing.jar").toString())))
        .isEqualTo(ApplicationIdentifier.FALLBACK);
  }

  @Test
  void noCommand_fallsBack() {
    assertThat(ApplicationIdentifier.resolve(new Properties()))
        .isEqualTo("com.systemlogger.default");
    assertThat(ApplicationIdentifier.resolve(command("   ")))
        .isEqualTo("com.systemlogger.default");
  }

  @Test
  void current_isStableAcrossCalls() {
    String first = ApplicationIdentifier.current();

    assertThat(first).isNotEmpty();
    assertThat(ApplicationIdentifier.current()).isSameAs(first);
  }

  private static Properties command(String command) {
    Properties properties = new Properties();
    properties.setProperty("sun.java.command", command);
    return properties;
  }

  private Path writeJar(String name, Manifest manifest) throws IOException {
    return writeJar(tempDir.resolve(name), manifest);
  }

  private static Path writeJar(Path jar, Manifest manifest) throws IOException {
    try (OutputStream out = Files.newOutputStream(jar);
        JarOutputStream ignored = new JarOutputStream(out, manifest)) {
      // Manifest only.
    }
    return jar;
  }
}
