package org.rungforge.logic.tags;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A mutable, insertion-ordered {@link TagTable} backed by a map.
 * <p>
 * Adding or removing tags does not notify anyone; owners of rungs that resolved operands against
 * this table must invalidate them afterwards.
 */
public class MapTagTable implements TagTable {

    private final Map<String, Tag> tags = new LinkedHashMap<>();

    public MapTagTable() {
    }

    public MapTagTable(Collection<Tag> initial) {
        initial.forEach(this::add);
    }

    /**
     * Adds a tag, replacing any tag with the same name.
     * @param tag The tag.
     * @return This table.
     */
    public MapTagTable add(Tag tag) {
        tags.put(tag.name(), tag);
        return this;
    }

    /**
     * Removes a tag.
     * @param name The tag name.
     * @return {@code true} if a tag was removed.
     */
    public boolean remove(String name) {
        return tags.remove(name) != null;
    }

    @Override
    public Optional<Tag> lookup(String name) {
        return Optional.ofNullable(tags.get(name));
    }

    public int size() {
        return tags.size();
    }
}
