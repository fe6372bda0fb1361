package org.rungforge.logic.tags;

import java.util.Optional;

/**
 * A table of tags visible in one container (a program, an add-on instruction or the controller).
 */
public interface TagTable {

    /**
     * Looks up a tag by its exact name.
     * @param name The tag name.
     * @return The tag, or empty if this table does not define it.
     */
    Optional<Tag> lookup(String name);

    /**
     * @return A table that defines no tags.
     */
    static TagTable empty() {
        return name -> Optional.empty();
    }
}
