package io.github.deco4j.processor;

import io.github.deco4j.model.GroupInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of route groups, keyed by group name.
 *
 * <p>The last registration of a name wins. Groups referenced by a {@code @Group} marker
 * that were never registered are created on first use, see {@link #resolve(String, String, String)}.
 */
public final class GroupRegistry {

    private static final Logger log = LoggerFactory.getLogger(GroupRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, GroupInfo> groups = new LinkedHashMap<>();

    public void register(GroupInfo group) {
        Objects.requireNonNull(group, "group");
        lock.lock();
        try {
            groups.put(group.name(), group);
        } finally {
            lock.unlock();
        }
        log.debug("Group registered: {} ({})", group.name(), group.prefix());
    }

    public Optional<GroupInfo> lookup(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(groups.get(name));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the group with the given name, creating and registering it if absent.
     *
     * <p>A created group uses {@code prefix} and {@code description} when they are non-empty,
     * otherwise {@code /<lower-case name>} and {@code Group <name>}.
     *
     * @param name        the group name
     * @param prefix      the path prefix for a new group, may be empty
     * @param description the description for a new group, may be empty
     * @return the existing or newly created group
     */
    public GroupInfo resolve(String name, String prefix, String description) {
        Objects.requireNonNull(name, "name");
        lock.lock();
        try {
            GroupInfo existing = groups.get(name);
            if (existing != null) {
                return existing;
            }
            GroupInfo created = new GroupInfo(name,
                    isEmpty(prefix) ? "/" + name.toLowerCase(Locale.ROOT) : prefix,
                    isEmpty(description) ? "Group " + name : description);
            groups.put(name, created);
            log.debug("Group created on first use: {} ({})", created.name(), created.prefix());
            return created;
        } finally {
            lock.unlock();
        }
    }

    public List<GroupInfo> all() {
        lock.lock();
        try {
            return List.copyOf(groups.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every group. Intended for test harnesses.
     */
    void reset() {
        lock.lock();
        try {
            groups.clear();
        } finally {
            lock.unlock();
        }
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
