package edu.stanford.nlp.lpmln.common;

import com.typesafe.config.*;
import edu.stanford.nlp.io.IOUtils;
import edu.stanford.nlp.io.RuntimeIOException;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.Map;
import java.util.Properties;

/**
 * Loads translator options from Typesafe config files. The syntax of a file, and of every file it
 * includes, follows its extension, so .conf, .json and .properties files can include each other.
 */
public class ConfigUtils {

  /** The syntax a file name implies, or null if its extension is not a known one. */
  public static ConfigSyntax syntaxOf(String name) {
    if (name.endsWith(".conf")) {
      return ConfigSyntax.CONF;
    } else if (name.endsWith(".json")) {
      return ConfigSyntax.JSON;
    } else if (name.endsWith(".properties")) {
      return ConfigSyntax.PROPERTIES;
    }
    return null;
  }

  public static boolean isConfigFile(String name) {
    return syntaxOf(name) != null;
  }

  public static ConfigParseOptions getParseOptions(String name) {
    ConfigParseOptions options = ConfigParseOptions.defaults();
    ConfigSyntax syntax = syntaxOf(name);
    if (syntax != null) {
      options = options.setSyntax(syntax);
    }
    return options.setIncluder(new ExtensionIncluder(options.getIncluder()));
  }

  /**
   * Load a config from the file system, or failing that from the classpath.
   * @throws RuntimeIOException if the config cannot be found or read.
   */
  public static Config load(String path) {
    ConfigParseOptions options = getParseOptions(path);
    File file = new File(path);
    if (file.exists()) {
      try {
        return ConfigFactory.parseFile(file.getCanonicalFile(), options).resolve();
      } catch (IOException e) {
        throw new RuntimeIOException("Could not read config file: " + path, e);
      }
    }
    try (Reader reader = IOUtils.getBufferedReaderFromClasspathOrFileSystem(path)) {
      return ConfigFactory.parseReader(reader, options).resolve();
    } catch (IOException e) {
      throw new RuntimeIOException("Could not find config file: " + path, e);
    }
  }

  /** Flatten a config into properties, one entry per leaf path. */
  public static Properties toProperties(Config config) {
    Properties props = new Properties();
    for (Map.Entry<String, ConfigValue> entry : config.entrySet()) {
      Object value = entry.getValue().unwrapped();
      if (value != null) {
        props.setProperty(entry.getKey(), value.toString());
      }
    }
    return props;
  }

  /**
   * Parses an included file with the syntax of its extension, rather than
   * the syntax of the file including it.
   */
  public static class ExtensionIncluder implements ConfigIncluder {
    private final ConfigIncluder delegate;

    public ExtensionIncluder(ConfigIncluder delegate) {
      this.delegate = delegate;
    }

    @Override
    public ConfigIncluder withFallback(ConfigIncluder fallback) {
      return new ExtensionIncluder(fallback);
    }

    @Override
    public ConfigObject include(ConfigIncludeContext context, String name) {
      ConfigSyntax syntax = syntaxOf(name);
      if (syntax == null) {
        return delegate.include(context, name);
      }
      return delegate.include(new SyntaxIncludeContext(context, context.parseOptions().setSyntax(syntax)), name);
    }
  }

  /**
   * An include context whose relative names parse with its own options;
   * the default one hands out parseables carrying the options of the including file.
   */
  private static class SyntaxIncludeContext implements ConfigIncludeContext {
    private final ConfigIncludeContext context;
    private final ConfigParseOptions options;

    SyntaxIncludeContext(ConfigIncludeContext context, ConfigParseOptions options) {
      this.context = context;
      this.options = options;
    }

    @Override
    public ConfigParseable relativeTo(String name) {
      final ConfigParseable parseable = context.relativeTo(name);
      if (parseable == null) { return null; }
      return new ConfigParseable() {
        @Override
        public ConfigObject parse(ConfigParseOptions parseOptions) {
          return parseable.parse(parseOptions);
        }

        @Override
        public ConfigOrigin origin() {
          return parseable.origin();
        }

        @Override
        public ConfigParseOptions options() {
          return options;
        }
      };
    }

    @Override
    public ConfigParseOptions parseOptions() {
      return options;
    }

    public ConfigIncludeContext setParseOptions(ConfigParseOptions parseOptions) {
      return new SyntaxIncludeContext(context, parseOptions);
    }
  }
}
