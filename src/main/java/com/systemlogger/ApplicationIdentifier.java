package com.systemlogger;

import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import java.io.IOException;
import java.util.Properties;
import java.util.jar.Attributes;
import java.util.jar.JarFile;
import java.util.jar.Manifest;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.lang.model.SourceVersion;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves the identifier of the host application, used as the default subsystem.
 *
 * <p>In order: the main module name, the package of the launched main class, the {@code
 * Automatic-Module-Name} or the package of the {@code Main-Class} of the launched jar. Falls back to
 * {@link #FALLBACK} when none is available.
 */
final class ApplicationIdentifier {
  static final String FALLBACK = "com.systemlogger.default";

  private static final String MAIN_MODULE_PROPERTY = "jdk.module.main";
  private static final String COMMAND_PROPERTY = "sun.java.command";
  private static final String JAR_SUFFIX = ".jar";
  private static final Attributes.Name AUTOMATIC_MODULE_NAME =
      new Attributes.Name("Automatic-Module-Name");

  private static final Logger logger = Logger.getLogger(ApplicationIdentifier.class.getName());

  private static final Supplier<String> CURRENT =
      Suppliers.memoize(() -> resolve(System.getProperties()));

  private ApplicationIdentifier() {}

  /** Returns the identifier of this process, resolved once. */
  static String current() {
    return CURRENT.get();
  }

  @VisibleForTesting
  static String resolve(Properties properties) {
    String mainModule = properties.getProperty(MAIN_MODULE_PROPERTY);
    if (!isNullOrEmpty(mainModule)) {
      return mainModule;
    }
    String command = properties.getProperty(COMMAND_PROPERTY);
    if (command == null || command.isBlank()) {
      return FALLBACK;
    }
    String launched = Splitter.on(' ').omitEmptyStrings().split(command).iterator().next();
    String identifier;
    if (!launched.endsWith(JAR_SUFFIX) && SourceVersion.isName(launched)) {
      identifier = packageOf(launched);
    } else {
      String jarPath = jarPathOf(command);
      identifier = jarPath == null ? null : fromJar(jarPath);
    }
    return isNullOrEmpty(identifier) ? FALLBACK : identifier;
  }

  /**
   * Returns the launched jar path, which may contain spaces: the command up to the first {@code
   * .jar} followed by a space or the end of the command.
   */
  private static @Nullable String jarPathOf(String command) {
    String trimmed = command.strip();
    int from = 0;
    int index;
    while ((index = trimmed.indexOf(JAR_SUFFIX, from)) >= 0) {
      int end = index + JAR_SUFFIX.length();
      if (end == trimmed.length() || trimmed.charAt(end) == ' ') {
        return trimmed.substring(0, end);
      }
      from = index + 1;
    }
    return null;
  }

  private static @Nullable String fromJar(String path) {
    try (JarFile jar = new JarFile(path)) {
      Manifest manifest = jar.getManifest();
      if (manifest == null) {
        return null;
      }
      Attributes attributes = manifest.getMainAttributes();
      String moduleName = attributes.getValue(AUTOMATIC_MODULE_NAME);
      if (!isNullOrEmpty(moduleName)) {
        return moduleName;
      }
      String mainClass = attributes.getValue(Attributes.Name.MAIN_CLASS);
      return isNullOrEmpty(mainClass) ? null : packageOf(mainClass.trim());
    } catch (IOException | SecurityException e) {
      logger.log(Level.FINE, "Cannot read manifest of " + path, e);
      return null;
    }
  }

  private static String packageOf(String className) {
    int lastDot = className.lastIndexOf('.');
    return lastDot > 0 ? className.substring(0, lastDot) : className;
  }
}
