package org.rungforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.rungforge.logic.tags.MapTagTable;
import org.rungforge.logic.tags.Tag;
import org.rungforge.logic.tags.TagEnvironment;
import org.rungforge.logic.tags.TagScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a {@link TagEnvironment} from HOCON.
 *
 * <pre>
 * program = "MainProgram"
 * add-on-instructions = ["VALVE_CTRL"]
 * controller-tags = [
 *   { name = "Conveyor" }
 *   { name = "StartPB", alias-for = "Local:1:I.Data.0" }
 * ]
 * program-tags = [
 *   { name = "Motor", alias-for = "Conveyor.Motor" }
 * ]
 * </pre>
 */
public final class TagEnvironmentLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TagEnvironmentLoader.class);

    private static final String PROGRAM_KEY = "program";
    private static final String AOI_KEY = "add-on-instructions";
    private static final String CONTROLLER_TAGS_KEY = "controller-tags";
    private static final String PROGRAM_TAGS_KEY = "program-tags";
    private static final String NAME_KEY = "name";
    private static final String ALIAS_KEY = "alias-for";

    private TagEnvironmentLoader() {
    }

    /**
     * Parses a tag environment file.
     *
     * @param file The HOCON file.
     * @return The environment.
     * @throws IllegalArgumentException if the file does not exist.
     * @throws ConfigException if the file is malformed.
     */
    public static TagEnvironment load(final File file) {
        if (!file.isFile()) {
            throw new IllegalArgumentException("Tag file not found: " + file.getAbsolutePath());
        }
        LOG.debug("Loading tags from {}", file.getAbsolutePath());
        return fromConfig(ConfigFactory.parseFile(file).resolve());
    }

    /**
     * Builds a tag environment from a configuration object. All keys are optional.
     *
     * @param config The configuration.
     * @return The environment.
     * @throws ConfigException if a tag entry has no name or a value has the wrong type.
     */
    public static TagEnvironment fromConfig(final Config config) {
        final String program = config.hasPath(PROGRAM_KEY) ? config.getString(PROGRAM_KEY) : null;
        final Set<String> addOnInstructions = config.hasPath(AOI_KEY)
                ? new LinkedHashSet<>(config.getStringList(AOI_KEY))
                : Set.of();
        final MapTagTable controllerTags = readTags(config, CONTROLLER_TAGS_KEY, TagScope.CONTROLLER);
        final MapTagTable programTags = readTags(config, PROGRAM_TAGS_KEY, TagScope.PROGRAM);

        LOG.debug("Loaded {} controller tags, {} program tags and {} add-on instructions",
                controllerTags.size(), programTags.size(), addOnInstructions.size());
        return new TagEnvironment(program, programTags, controllerTags, addOnInstructions);
    }

    private static MapTagTable readTags(final Config config, final String key, final TagScope scope) {
        final MapTagTable table = new MapTagTable();
        if (!config.hasPath(key)) {
            return table;
        }
        final List<? extends Config> entries = config.getConfigList(key);
        for (final Config entry : entries) {
            final String name = entry.getString(NAME_KEY);
            final String aliasFor = entry.hasPath(ALIAS_KEY) ? entry.getString(ALIAS_KEY) : null;
            if (table.lookup(name).isPresent()) {
                LOG.warn("Duplicate {} tag '{}' in tag file, keeping the last definition", scope, name);
            }
            table.add(new Tag(name, scope, aliasFor));
        }
        return table;
    }
}
