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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Configuration table of one reconciled resource type: its fields, attribute groups,
 * identity policy and the remote calls behind each lifecycle step.
 * <p>
 * Descriptors are immutable and shared by every invocation of the generic engine.
 *
 * @param <R> remote response type
 */
public final class ResourceDescriptor<R> {

    @FunctionalInterface
    public interface Creator<R> {
        R create(String scopeId, ScfState desired);
    }

    @FunctionalInterface
    public interface Reader<R> {
        R get(ResourceHandle handle);
    }

    @FunctionalInterface
    public interface Deleter {
        void delete(ResourceHandle handle);
    }

    private final String type;
    private final String scopeAttribute;
    private final String handleAttribute;
    private final ScopeSource scopeSource;
    private final Map<String, FieldMapping<R>> fields;
    private final List<AttributeGroup<R>> groups;
    private final Set<String> createOnlyFields;
    private final Creator<R> creator;
    private final Reader<R> reader;
    private final Deleter deleter;
    private final boolean updatable;

    private ResourceDescriptor(Builder<R> builder) {
        this.type = builder.type;
        this.scopeAttribute = builder.scopeAttribute;
        this.handleAttribute = builder.handleAttribute;
        this.scopeSource = builder.scopeSource;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.groups = Collections.unmodifiableList(new ArrayList<>(builder.groups));
        this.createOnlyFields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.createOnlyFields));
        this.creator = builder.creator;
        this.reader = builder.reader;
        this.deleter = builder.deleter;
        // Without any group there is nothing an update could change
        this.updatable = builder.updatable && !builder.groups.isEmpty();
    }

    public static <R> Builder<R> builder(String type) {
        return new Builder<>(type);
    }

    public String getType() {
        return type;
    }

    /**
     * @return attribute holding the owning project id, the handle's scope fragment
     */
    public String getScopeAttribute() {
        return scopeAttribute;
    }

    /**
     * @return attribute holding the handle's resource fragment
     */
    public String getHandleAttribute() {
        return handleAttribute;
    }

    public ScopeSource getScopeSource() {
        return scopeSource;
    }

    /**
     * @return the field mapping table in declaration order
     */
    public Collection<FieldMapping<R>> getFields() {
        return fields.values();
    }

    public FieldMapping<R> getField(String name) {
        return fields.get(name);
    }

    public List<AttributeGroup<R>> getGroups() {
        return groups;
    }

    /**
     * @return fields the remote returns only in the create response, e.g. generated secrets
     */
    public Set<String> getCreateOnlyFields() {
        return createOnlyFields;
    }

    public Creator<R> getCreator() {
        return creator;
    }

    public Reader<R> getReader() {
        return reader;
    }

    public Deleter getDeleter() {
        return deleter;
    }

    public boolean isCreatable() {
        return creator != null;
    }

    public boolean isUpdatable() {
        return updatable;
    }

    public boolean isDeletable() {
        return deleter != null;
    }

    public static class Builder<R> {
        private final String type;
        private String scopeAttribute;
        private String handleAttribute;
        private ScopeSource scopeSource = ScopeSource.RESPONSE;
        private final Map<String, FieldMapping<R>> fields = new LinkedHashMap<>();
        private final List<AttributeGroup<R>> groups = new ArrayList<>();
        private final Set<String> createOnlyFields = new LinkedHashSet<>();
        private Creator<R> creator;
        private Reader<R> reader;
        private Deleter deleter;
        private boolean updatable = true;

        private Builder(String type) {
            this.type = type;
        }

        public Builder<R> scopeAttribute(String name) {
            this.scopeAttribute = name;
            return this;
        }

        public Builder<R> handleAttribute(String name) {
            this.handleAttribute = name;
            return this;
        }

        public Builder<R> scopeSource(ScopeSource scopeSource) {
            this.scopeSource = scopeSource;
            return this;
        }

        public Builder<R> field(String name, Class<?> valueType, Function<R, ?> extractor, String description) {
            return addField(new FieldMapping<>(name, valueType, extractor, false, description));
        }

        public Builder<R> requiredField(String name, Class<?> valueType, Function<R, ?> extractor, String description) {
            return addField(new FieldMapping<>(name, valueType, extractor, true, description));
        }

        private Builder<R> addField(FieldMapping<R> mapping) {
            if (fields.put(mapping.getName(), mapping) != null) {
                throw new IllegalArgumentException(String.format("Duplicate field '%s' in %s", mapping.getName(), type));
            }
            return this;
        }

        /**
         * Add an attribute group. Groups are reconciled in the order they are added.
         */
        public Builder<R> group(String name, List<String> groupFields, List<String> computedFields, AttributeGroup.Mutation<R> mutation) {
            groups.add(new AttributeGroup<>(name, groupFields, computedFields, mutation, false));
            return this;
        }

        /**
         * Add an attribute group which the create call doesn't cover, applied right after creation
         * when the desired state sets any of its fields.
         */
        public Builder<R> dependentGroup(String name, List<String> groupFields, List<String> computedFields, AttributeGroup.Mutation<R> mutation) {
            groups.add(new AttributeGroup<>(name, groupFields, computedFields, mutation, true));
            return this;
        }

        public Builder<R> createOnly(String... names) {
            createOnlyFields.addAll(Arrays.asList(names));
            return this;
        }

        public Builder<R> creator(Creator<R> creator) {
            this.creator = creator;
            return this;
        }

        public Builder<R> reader(Reader<R> reader) {
            this.reader = reader;
            return this;
        }

        public Builder<R> deleter(Deleter deleter) {
            this.deleter = deleter;
            return this;
        }

        public Builder<R> immutable() {
            this.updatable = false;
            return this;
        }

        public ResourceDescriptor<R> build() {
            if (reader == null) {
                throw new IllegalStateException("No reader for " + type);
            }
            requireDeclared(scopeAttribute, "scope attribute");
            requireDeclared(handleAttribute, "handle attribute");
            for (String name : createOnlyFields) {
                requireDeclared(name, "create-only field");
            }

            // Groups must be disjoint so that each one can be reconciled on its own
            Set<String> seen = new HashSet<>();
            for (AttributeGroup<R> group : groups) {
                for (String name : group.getMergeFields()) {
                    requireDeclared(name, "field of group " + group.getName());
                }
                for (String name : group.getFields()) {
                    if (!seen.add(name)) {
                        throw new IllegalStateException(String.format("Field '%s' of %s belongs to more than one group",
                                name, type));
                    }
                }
            }
            return new ResourceDescriptor<>(this);
        }

        private void requireDeclared(String name, String role) {
            if (name == null || !fields.containsKey(name)) {
                throw new IllegalStateException(String.format("Undeclared %s '%s' in %s", role, name, type));
            }
        }
    }
}
