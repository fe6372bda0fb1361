package org.rungforge.logic.frontend.parser;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Typed view of the {@code rungforge.parser} configuration block.
 *
 * @param healDegenerateBranches Whether single-arm branches are removed while parsing instead of being rejected.
 * @param maxHealPasses The maximum number of degenerate branches removed from one rung text.
 */
public record ParserSettings(boolean healDegenerateBranches, int maxHealPasses) {

    public static final String CONFIG_PATH = "rungforge.parser";
    private static final String HEAL_KEY = "heal-degenerate-branches";
    private static final String MAX_HEAL_PASSES_KEY = "max-heal-passes";

    private static final ParserSettings DEFAULTS = fromConfig(ConfigFactory.defaultReference());

    public ParserSettings {
        if (maxHealPasses < 0) {
            throw new IllegalArgumentException("max-heal-passes must not be negative: " + maxHealPasses);
        }
    }

    /**
     * Reads the settings from a resolved configuration. Missing keys fall back to the values
     * shipped in {@code reference.conf}.
     *
     * @param config The application configuration.
     * @return The parser settings.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     */
    public static ParserSettings fromConfig(Config config) {
        Config parser = config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH);
        return new ParserSettings(parser.getBoolean(HEAL_KEY), parser.getInt(MAX_HEAL_PASSES_KEY));
    }

    /**
     * @return The settings from {@code reference.conf}.
     */
    public static ParserSettings defaults() {
        return DEFAULTS;
    }
}
