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
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.common.security.GuardedString;
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;
import org.identityconnectors.framework.common.exceptions.UnknownUidException;
import org.identityconnectors.framework.common.objects.*;

import java.util.Map;
import java.util.Set;

import static jp.openstandia.connector.scf.ScfUtils.createFullAttributesToGet;
import static jp.openstandia.connector.scf.ScfUtils.shouldReturn;

/**
 * Bridges ConnId operations of one object class to the lifecycle engine of its resource type.
 * <p>
 * {@code __UID__} and {@code __NAME__} both carry the resource handle.
 *
 * @param <R> remote response type
 */
public class ScfResourceHandler<R> implements ScfObjectHandler {

    private static final Log LOGGER = Log.getLog(ScfResourceHandler.class);

    private final ScfConfiguration configuration;
    private final ObjectClass objectClass;
    private final Map<String, AttributeInfo> schema;
    private final ScfLifecycle<R> lifecycle;

    public ScfResourceHandler(ScfConfiguration configuration, ObjectClass objectClass, Map<String, AttributeInfo> schema,
                              ScfLifecycle<R> lifecycle) {
        this.configuration = configuration;
        this.objectClass = objectClass;
        this.schema = schema;
        this.lifecycle = lifecycle;
    }

    /**
     * @param attributes
     * @return handle of the created resource. Don't include Name object in the Uid.
     */
    @Override
    public Uid create(Set<Attribute> attributes) {
        ScfState.Builder desired = ScfState.builder();

        for (Attribute attr : attributes) {
            AttributeInfo info = schema.get(attr.getName());
            if (info == null || !info.isCreateable()) {
                throw new InvalidAttributeValueException(String.format("SCF doesn't support to set '%s' attribute of %s",
                        attr.getName(), objectClass.getObjectClassValue()));
            }
            desired.set(attr.getName(), AttributeUtil.getSingleValue(attr));
        }

        String scopeAttribute = lifecycle.getDescriptor().getScopeAttribute();
        ScfState desiredState = desired.build();
        if (!desiredState.isSet(scopeAttribute) && StringUtil.isNotEmpty(configuration.getProjectId())) {
            desiredState = desiredState.toBuilder().set(scopeAttribute, configuration.getProjectId()).build();
        }

        LifecycleResult result = lifecycle.create(desiredState);

        return new Uid(result.getState().getHandle().toString());
    }

    /**
     * @param uid
     * @param modifications
     * @param options
     * @return always null, the handle never changes
     */
    @Override
    public Set<AttributeDelta> updateDelta(Uid uid, Set<AttributeDelta> modifications, OperationOptions options) {
        ResourceHandle handle = ResourceHandle.decode(uid.getUidValue());

        ScfState.Builder desired = ScfState.builder();
        for (AttributeDelta delta : modifications) {
            AttributeInfo info = schema.get(delta.getName());
            if (info == null || !info.isUpdateable()) {
                throw new InvalidAttributeValueException(String.format("SCF doesn't support to update '%s' attribute of %s",
                        delta.getName(), objectClass.getObjectClassValue()));
            }
            desired.set(delta.getName(), ScfUtils.toResourceValue(delta));
        }

        try {
            lifecycle.update(desired.build(), ScfState.builder().handle(handle).build());

        } catch (ScfLifecycleException e) {
            if (e.getCause() != null && lifecycle.isNotFound(e.getCause())) {
                throw new UnknownUidException(uid, objectClass);
            }
            throw e;
        }

        return null;
    }

    /**
     * Deleting an already deleted resource succeeds.
     *
     * @param uid
     * @param options
     */
    @Override
    public void delete(Uid uid, OperationOptions options) {
        lifecycle.delete(ResourceHandle.decode(uid.getUidValue()));
    }

    /**
     * Only lookups by {@code __UID__} or {@code __NAME__} are supported. The value is either a handle or
     * a bare resource id of the configured project.
     *
     * @param filter
     * @param resultsHandler
     * @param options
     */
    @Override
    public void query(ScfFilter filter, ResultsHandler resultsHandler, OperationOptions options) {
        if (filter == null || !(filter.isByUid() || filter.isByName())) {
            // The SCF API of this connector has no listing
            LOGGER.info("Skip query of {0} without __UID__ or __NAME__ filter", objectClass.getObjectClassValue());
            return;
        }

        // Create full attributesToGet by RETURN_DEFAULT_ATTRIBUTES + ATTRIBUTES_TO_GET
        Set<String> attributesToGet = createFullAttributesToGet(schema, options);

        ResourceHandle handle = ResourceHandle.resolveImport(filter.attributeValue, configuration.getProjectId());
        LifecycleResult result = lifecycle.read(handle);

        if (result.getKind() == LifecycleResult.Kind.PRESENT) {
            resultsHandler.handle(toConnectorObject(result.getState(), attributesToGet));
        }
    }

    ConnectorObject toConnectorObject(ScfState state, Set<String> attributesToGet) {
        String id = state.getHandle().toString();

        final ConnectorObjectBuilder builder = new ConnectorObjectBuilder()
                .setObjectClass(objectClass)
                // Need to set __UID__ and __NAME__ because it throws IllegalArgumentException
                .setUid(id)
                .setName(id);

        for (String name : state.names()) {
            AttributeInfo info = schema.get(name);
            if (info == null || !state.isSet(name) || !shouldReturn(attributesToGet, name)) {
                continue;
            }
            Object value = state.get(name);
            if (GuardedString.class.equals(info.getType())) {
                value = new GuardedString(value.toString().toCharArray());
            }
            builder.addAttribute(AttributeBuilder.build(name, value));
        }

        return builder.build();
    }
}
