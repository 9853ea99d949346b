package com.cred.freestyle.deadpool.infrastructure.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of an item held by the entity store.
 *
 * Attribute values are restricted to strings, numbers and booleans so that every
 * store implementation can round-trip them. The version starts at 1 on creation and
 * increases by one on every successful write; conditional writes compare against it.
 *
 * @author Deadpool Team
 */
public final class StoreItem {

    private final StoreKey key;
    private final Map<String, Object> attributes;
    private final long version;

    public StoreItem(StoreKey key, Map<String, Object> attributes, long version) {
        this.key = Objects.requireNonNull(key, "key");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.version = version;
    }

    public StoreKey getKey() {
        return key;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public long getVersion() {
        return version;
    }

    public boolean has(String name) {
        return attributes.get(name) != null;
    }

    public String getString(String name) {
        Object value = attributes.get(name);
        return value == null ? null : value.toString();
    }

    public Integer getInteger(String name) {
        Object value = attributes.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.valueOf(value.toString());
    }

    public boolean getBoolean(String name) {
        Object value = attributes.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoreItem)) {
            return false;
        }
        StoreItem that = (StoreItem) o;
        return version == that.version && key.equals(that.key) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, version, attributes);
    }

    @Override
    public String toString() {
        return "StoreItem{" + key + ", v" + version + ", " + attributes + "}";
    }
}
