/*
 *  Copyright Nomura Research Institute, Ltd.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package jp.openstandia.connector.scf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable attribute record of a SCF resource.
 * <p>
 * Every attribute known to the record is either set to a typed value or explicitly unset.
 * Unset is stored as a null value so that it can't be confused with an empty string or false.
 * Attributes which are not known at all (not even as unset) are also reported as unset.
 */
public final class ScfState {

    private static final ScfState EMPTY = new ScfState(null, Collections.emptyMap());

    private final ResourceHandle handle;
    private final Map<String, Object> values;

    private ScfState(ResourceHandle handle, Map<String, Object> values) {
        this.handle = handle;
        this.values = values;
    }

    public static ScfState empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.handle = handle;
        builder.values.putAll(values);
        return builder;
    }

    /**
     * @return the handle, or null before the resource has been created or imported
     */
    public ResourceHandle getHandle() {
        return handle;
    }

    public boolean isSet(String name) {
        return values.get(name) != null;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value == null ? null : value.toString();
    }

    public Boolean getBoolean(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.valueOf(value.toString());
    }

    /**
     * @return names of every attribute the record knows, set or unset, in insertion order
     */
    public Set<String> names() {
        return values.keySet();
    }

    /**
     * Overwrite the given attributes with the values of a partial record and keep everything else.
     *
     * @param partial the partial record, only its set attributes are taken over
     * @return the merged record
     */
    public ScfState merge(ScfState partial) {
        Builder builder = toBuilder();
        for (String name : partial.names()) {
            if (partial.isSet(name)) {
                builder.set(name, partial.get(name));
            }
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScfState that = (ScfState) o;
        return Objects.equals(handle, that.handle) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handle, values);
    }

    @Override
    public String toString() {
        return "ScfState{handle=" + handle + ", values=" + values + "}";
    }

    public static class Builder {
        private ResourceHandle handle;
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder handle(ResourceHandle handle) {
            this.handle = handle;
            return this;
        }

        /**
         * Set an attribute. A null value marks the attribute as unset.
         */
        public Builder set(String name, Object value) {
            values.put(name, value);
            return this;
        }

        public Builder unset(String name) {
            values.put(name, null);
            return this;
        }

        public ScfState build() {
            return new ScfState(handle, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
