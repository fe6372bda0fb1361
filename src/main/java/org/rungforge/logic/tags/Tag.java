package org.rungforge.logic.tags;

import java.util.Objects;
import java.util.Optional;

/**
 * A named tag as seen by operand resolution.
 *
 * @param name The tag name.
 * @param scope Where the tag is visible.
 * @param aliasFor The reference this tag aliases, possibly with a trailing member path
 *                 (e.g. {@code Local:1:I.Data.3}), or {@code null} for a tag with its own storage.
 */
public record Tag(String name, TagScope scope, String aliasFor) {

    public Tag {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scope, "scope");
        if (aliasFor != null && aliasFor.isBlank()) {
            aliasFor = null;
        }
    }

    /**
     * Creates a tag with its own storage.
     * @param name The tag name.
     * @param scope The tag scope.
     * @return The tag.
     */
    public static Tag base(String name, TagScope scope) {
        return new Tag(name, scope, null);
    }

    /**
     * Creates an alias tag.
     * @param name The tag name.
     * @param scope The tag scope.
     * @param aliasFor The aliased reference.
     * @return The tag.
     */
    public static Tag alias(String name, TagScope scope, String aliasFor) {
        return new Tag(name, scope, Objects.requireNonNull(aliasFor, "aliasFor"));
    }

    public boolean isAlias() {
        return aliasFor != null;
    }

    /**
     * Gets the name of the tag this alias points to: the alias reference up to its first '.' and
     * its first ':' (module-style references such as {@code Local:1:I.Data} resolve to {@code Local}).
     *
     * @return The aliased tag's name, or empty if this tag is not an alias.
     */
    public Optional<String> aliasForBaseName() {
        if (aliasFor == null) {
            return Optional.empty();
        }
        String base = aliasFor.split("\\.", -1)[0];
        return Optional.of(base.split(":", -1)[0]);
    }

    /**
     * Gets the member path of the alias reference, starting at its first '.'.
     * @return The member path including the leading '.', or an empty string.
     */
    public String aliasMemberPath() {
        if (aliasFor == null) {
            return "";
        }
        int dot = aliasFor.indexOf('.');
        return dot < 0 ? "" : aliasFor.substring(dot);
    }
}
