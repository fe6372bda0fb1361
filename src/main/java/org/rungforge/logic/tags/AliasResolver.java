package org.rungforge.logic.tags;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves tag names and alias chains against a {@link TagEnvironment}.
 * <p>
 * Names are looked up in the container's table first and in the controller table second. An alias
 * of a program tag is resolved the same way; an alias of a controller tag can only refer to
 * another controller tag.
 */
public class AliasResolver {

    private final TagEnvironment environment;

    /**
     * @param environment The environment to resolve against.
     */
    public AliasResolver(TagEnvironment environment) {
        this.environment = environment;
    }

    /**
     * Resolves the tag an operand names directly, before following any alias.
     * @param baseName The leftmost member segment of the operand.
     * @return The tag, or empty if neither table defines it.
     */
    public Optional<Tag> firstTag(String baseName) {
        Optional<Tag> local = environment.getLocalTags().lookup(baseName);
        if (local.isPresent()) {
            return local;
        }
        return environment.getControllerTags().lookup(baseName);
    }

    /**
     * Resolves the tag an alias points to.
     * @param tag The alias tag.
     * @return The aliased tag, or empty if the tag is not an alias or its target is unknown.
     */
    public Optional<Tag> parentOf(Tag tag) {
        Optional<String> targetName = tag.aliasForBaseName();
        if (targetName.isEmpty()) {
            return Optional.empty();
        }
        if (tag.scope() == TagScope.PROGRAM) {
            Optional<Tag> local = environment.getLocalTags().lookup(targetName.get());
            if (local.isPresent()) {
                return local;
            }
        }
        return environment.getControllerTags().lookup(targetName.get());
    }

    /**
     * Follows the alias chain of a tag until a tag without alias (or with an unknown target) is found.
     * @param tag The start of the chain.
     * @return The base tag owning the storage.
     * @throws TagResolutionException if the chain is cyclic.
     */
    public Tag baseTag(Tag tag) {
        Set<String> visited = new LinkedHashSet<>();
        Tag current = tag;
        while (current.isAlias()) {
            if (!visited.add(current.scope() + ":" + current.name())) {
                throw new TagResolutionException("Cyclic alias chain: " + String.join(" -> ", visited) + " -> " + current.name());
            }
            Optional<Tag> parent = parentOf(current);
            if (parent.isEmpty()) {
                return current;
            }
            current = parent.get();
        }
        return current;
    }

    /**
     * Builds the alias string of a tag: the alias target substituted for the aliased name, the
     * member path of each alias reference kept, and the given trailing member path appended, until a
     * tag without alias is reached.
     *
     * @param tag The tag to start from.
     * @param trailing The member path to append, including its leading '.', or an empty string.
     * @return The aliased reference.
     * @throws TagResolutionException if the chain is cyclic.
     */
    public String aliasString(Tag tag, String trailing) {
        Set<String> visited = new LinkedHashSet<>();
        Tag current = tag;
        String suffix = trailing == null ? "" : trailing;
        while (current.isAlias()) {
            if (!visited.add(current.scope() + ":" + current.name())) {
                throw new TagResolutionException("Cyclic alias chain: " + String.join(" -> ", visited) + " -> " + current.name());
            }
            Optional<Tag> parent = parentOf(current);
            if (parent.isEmpty()) {
                return current.aliasFor() + suffix;
            }
            suffix = current.aliasMemberPath() + suffix;
            current = parent.get();
        }
        return current.name() + suffix;
    }
}
