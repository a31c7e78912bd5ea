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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Independently mutable subset of a resource's attributes, bound to one remote mutation endpoint.
 *
 * @param <R> remote response type
 */
public final class AttributeGroup<R> {

    @FunctionalInterface
    public interface Mutation<R> {
        /**
         * Apply the group's payload to the remote resource.
         *
         * @param handle  the resource
         * @param payload set attributes of the group keyed by attribute name
         * @return the response of the mutation
         */
        R apply(ResourceHandle handle, Map<String, Object> payload);
    }

    private final String name;
    private final List<String> fields;
    private final Set<String> mergeFields;
    private final Mutation<R> mutation;
    private final boolean applyOnCreate;

    AttributeGroup(String name, List<String> fields, List<String> computedFields, Mutation<R> mutation, boolean applyOnCreate) {
        this.name = name;
        this.fields = Collections.unmodifiableList(fields);
        Set<String> merge = new LinkedHashSet<>(fields);
        merge.addAll(computedFields);
        this.mergeFields = Collections.unmodifiableSet(merge);
        this.mutation = mutation;
        this.applyOnCreate = applyOnCreate;
    }

    public String getName() {
        return name;
    }

    public List<String> getFields() {
        return fields;
    }

    /**
     * @return fields taken over from the mutation response: the group's own fields
     * and the read-only fields the endpoint refreshes (e.g. updated_at)
     */
    public Set<String> getMergeFields() {
        return mergeFields;
    }

    public Mutation<R> getMutation() {
        return mutation;
    }

    /**
     * @return true if the group has no place in the create payload and is applied right after creation
     */
    public boolean isApplyOnCreate() {
        return applyOnCreate;
    }

    @Override
    public String toString() {
        return name + fields;
    }
}
