package org.sfgen.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Locale;

/**
 * Generator settings, loaded from HOCON configuration.
 *
 * @param codeStyle Formatting options.
 * @param output Output file description.
 * @param kernelNamespace Name of the default kernel namespace.
 * @param castIndexingSymbols Whether field mappings cast extracted extents and strides.
 */
public record GeneratorConfig(
        CodeStyle codeStyle,
        OutputSpec output,
        String kernelNamespace,
        boolean castIndexingSymbols
) {

    private static final Logger LOG = LoggerFactory.getLogger(GeneratorConfig.class);
    private static final String ROOT = "sfgen";

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dsfgen.output.basename=foo)
     * 2. Default values (from reference.conf on the classpath)
     *
     * @return The generator configuration.
     */
    public static GeneratorConfig load() {
        return load(null);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java System Properties
     * 2. Configuration file, if given and present
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param configFile An optional HOCON file, may be {@code null}.
     * @return The generator configuration.
     */
    public static GeneratorConfig load(File configFile) {
        final Config sysConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null && configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading generator configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            if (configFile != null) {
                LOG.info("Configuration file '{}' not found or is a directory. Skipping it.", configFile.getPath());
            }
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return from(sysConfig.withFallback(fileConfig).withFallback(defaultConfig).resolve());
    }

    /**
     * Builds the generator configuration from the {@code sfgen} section of a resolved config.
     *
     * @param root The resolved root configuration.
     * @return The generator configuration.
     */
    public static GeneratorConfig from(Config root) {
        Config c = root.getConfig(ROOT);
        Config out = c.getConfig("output");
        OutputSpec spec = new OutputSpec(
                out.getString("basename"),
                out.getString("header-extension"),
                out.getString("impl-extension"),
                OutputMode.valueOf(out.getString("mode").toUpperCase(Locale.ROOT)),
                OutputSpec.IncludeGuard.valueOf(out.getString("include-guard").toUpperCase(Locale.ROOT)),
                out.getString("namespace"),
                out.getString("prelude"));
        return new GeneratorConfig(
                new CodeStyle(c.getInt("codestyle.indent-width")),
                spec,
                c.getString("kernels.namespace"),
                c.getBoolean("kernels.cast-indexing-symbols"));
    }

    public static GeneratorConfig defaults() {
        return from(ConfigFactory.parseResources("reference.conf").resolve());
    }
}
