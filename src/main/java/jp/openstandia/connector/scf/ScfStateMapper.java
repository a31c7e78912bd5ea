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

import org.identityconnectors.common.StringUtil;
import org.identityconnectors.framework.common.exceptions.ConnectorIOException;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates between remote responses and {@link ScfState} records using a descriptor's field mapping table.
 *
 * @param <R> remote response type
 */
public class ScfStateMapper<R> {

    private final ResourceDescriptor<R> descriptor;

    public ScfStateMapper(ResourceDescriptor<R> descriptor) {
        this.descriptor = descriptor;
    }

    public ScfState toState(R response, String scopeIdHint) {
        return toState(response, scopeIdHint, null);
    }

    /**
     * Map a response onto a full state record and recompute the handle.
     *
     * @param response       the remote response
     * @param scopeIdHint    project id known locally
     * @param resourceIdHint resource fragment known locally, used only when the response omits an optional handle attribute
     * @return the state record
     * @throws MissingRequiredFieldException if a required field is absent
     * @throws ConnectorIOException         if a value doesn't have the field's declared type
     */
    public ScfState toState(R response, String scopeIdHint, String resourceIdHint) throws MissingRequiredFieldException {
        if (response == null) {
            throw new ConnectorIOException(String.format("Empty SCF %s response", descriptor.getType()));
        }

        ScfState.Builder builder = ScfState.builder();
        for (FieldMapping<R> field : descriptor.getFields()) {
            Object value = toStateValue(field.extract(response));
            if (value == null && field.isRequired()) {
                throw new MissingRequiredFieldException(descriptor.getType(), field.getName(), field.getDescription());
            }
            if (value != null && !field.getType().isInstance(value)) {
                throw new ConnectorIOException(String.format("Unexpected type of %s in SCF %s response. expected: %s, actual: %s",
                        field.getName(), descriptor.getType(), field.getType().getSimpleName(), value.getClass().getSimpleName()));
            }
            builder.set(field.getName(), value);
        }

        String scopeId = scopeIdHint;
        if (descriptor.getScopeSource() == ScopeSource.RESPONSE) {
            Object responseScope = toStateValue(descriptor.getField(descriptor.getScopeAttribute()).extract(response));
            if (responseScope != null) {
                scopeId = responseScope.toString();
            }
        }
        builder.set(descriptor.getScopeAttribute(), scopeId);

        FieldMapping<R> handleField = descriptor.getField(descriptor.getHandleAttribute());
        Object resourceId = toStateValue(handleField.extract(response));
        if (resourceId == null) {
            resourceId = StringUtil.isEmpty(resourceIdHint) ? null : resourceIdHint;
        }
        if (resourceId == null) {
            throw new MissingRequiredFieldException(descriptor.getType(), handleField.getName(), handleField.getDescription());
        }
        builder.set(handleField.getName(), resourceId);

        return builder.handle(ResourceHandle.build(scopeId, resourceId.toString())).build();
    }

    /**
     * Project only the given fields of a response. Fields the response doesn't carry are left out,
     * so the result can be merged without clearing anything.
     */
    public ScfState project(R response, Collection<String> names) {
        ScfState.Builder builder = ScfState.builder();
        if (response == null) {
            return builder.build();
        }
        for (String name : names) {
            Object value = toStateValue(descriptor.getField(name).extract(response));
            if (value != null) {
                builder.set(name, value);
            }
        }
        return builder.build();
    }

    /**
     * Build the payload of one attribute group. Unset attributes are omitted, which keeps them
     * untouched on the remote side.
     */
    public Map<String, Object> toMutationPayload(ScfState state, AttributeGroup<R> group) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (String name : group.getFields()) {
            if (state.isSet(name)) {
                payload.put(name, state.get(name));
            }
        }
        return payload;
    }

    /**
     * Carry create-only fields (values the remote never returns again) from an earlier record.
     */
    public ScfState retainCreateOnly(ScfState mapped, ScfState source) {
        if (source == null || descriptor.getCreateOnlyFields().isEmpty()) {
            return mapped;
        }
        ScfState.Builder builder = mapped.toBuilder();
        for (String name : descriptor.getCreateOnlyFields()) {
            if (!mapped.isSet(name) && source.isSet(name)) {
                builder.set(name, source.get(name));
            }
        }
        return builder.build();
    }

    static Object toStateValue(Object raw) {
        if (raw instanceof OffsetDateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((OffsetDateTime) raw);
        }
        return raw;
    }
}
