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
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;

import java.util.Map;

/**
 * Generic lifecycle engine of one SCF resource type, configured by a {@link ResourceDescriptor}.
 * <p>
 * The engine keeps no state between invocations. Every operation receives what it needs,
 * returns the new state to the caller and never persists anything itself. Operations against
 * different handles may run concurrently; the caller serializes operations against the same handle.
 *
 * @param <R> remote response type
 */
public class ScfLifecycle<R> {

    private static final Log LOG = Log.getLog(ScfLifecycle.class);

    private final ResourceDescriptor<R> descriptor;
    private final ScfStateMapper<R> mapper;
    private final ScfDriftReconciler<R> reconciler;
    private final ScfErrorClassifier classifier;

    public ScfLifecycle(ResourceDescriptor<R> descriptor) {
        this(descriptor, new ScfErrorClassifier());
    }

    public ScfLifecycle(ResourceDescriptor<R> descriptor, ScfErrorClassifier classifier) {
        this.descriptor = descriptor;
        this.mapper = new ScfStateMapper<>(descriptor);
        this.reconciler = new ScfDriftReconciler<>(descriptor, mapper);
        this.classifier = classifier;
    }

    public ResourceDescriptor<R> getDescriptor() {
        return descriptor;
    }

    /**
     * Create the resource, apply the dependent groups the desired state sets and read the result back.
     *
     * @param desired desired attributes, must set the scope attribute
     * @return CREATED with the full state and handle
     * @throws ScfLifecycleException if any remote call or the mapping fails
     */
    public LifecycleResult create(ScfState desired) {
        final String op = "create";
        if (!descriptor.isCreatable()) {
            throw new ScfLifecycleException(op, descriptor.getType(), "create not supported");
        }
        String scopeId = desired.getString(descriptor.getScopeAttribute());
        if (StringUtil.isEmpty(scopeId)) {
            throw new InvalidAttributeValueException(String.format("Missing %s when creating scf %s",
                    descriptor.getScopeAttribute(), descriptor.getType()));
        }

        R response;
        try {
            response = descriptor.getCreator().create(scopeId, desired);
        } catch (InvalidAttributeValueException e) {
            // Rejected desired state, nothing was sent
            throw e;
        } catch (RuntimeException e) {
            throw new ScfLifecycleException(op, descriptor.getType(), null, e);
        }

        ScfState created;
        try {
            created = mapper.toState(response, scopeId, desired.getString(descriptor.getHandleAttribute()));
        } catch (RuntimeException e) {
            throw new ScfLifecycleException(op, descriptor.getType(), null, e);
        }
        ResourceHandle handle = created.getHandle();
        LOG.info("Created scf {0} {1}", descriptor.getType(), handle);

        for (AttributeGroup<R> group : descriptor.getGroups()) {
            if (!group.isApplyOnCreate()) {
                continue;
            }
            Map<String, Object> payload = mapper.toMutationPayload(desired, group);
            if (payload.isEmpty()) {
                continue;
            }
            try {
                group.getMutation().apply(handle, payload);
            } catch (RuntimeException e) {
                LOG.error("Created scf {0} {1} but failed to apply group {2}", descriptor.getType(), handle, group.getName());
                throw new ScfLifecycleException(op, descriptor.getType(), group.getName(), handle, created, e);
            }
            LOG.ok("Applied group {0} to created scf {1} {2}", group.getName(), descriptor.getType(), handle);
        }

        ScfState state;
        try {
            R current = descriptor.getReader().get(handle);
            state = mapper.toState(current, handle.getScopeId(), handle.getResourceId());
        } catch (RuntimeException e) {
            throw new ScfLifecycleException(op, descriptor.getType(), null, handle, created, e);
        }
        return LifecycleResult.created(mapper.retainCreateOnly(state, created));
    }

    public LifecycleResult read(ResourceHandle handle) {
        return read(handle, null, "read");
    }

    /**
     * Refresh a previously observed state. Create-only values of the prior state are kept.
     */
    public LifecycleResult read(ScfState prior) {
        return read(requireHandle(prior, "read"), prior, "read");
    }

    private LifecycleResult read(ResourceHandle handle, ScfState prior, String op) {
        R response;
        try {
            response = descriptor.getReader().get(handle);
        } catch (RuntimeException e) {
            if (classifier.isNotFound(e)) {
                LOG.warn("scf {0} {1} no longer exists", descriptor.getType(), handle);
                return LifecycleResult.removed();
            }
            throw new ScfLifecycleException(op, descriptor.getType(), null, e);
        }

        ScfState state;
        try {
            state = mapper.toState(response, handle.getScopeId(), handle.getResourceId());
        } catch (RuntimeException e) {
            throw new ScfLifecycleException(op, descriptor.getType(), null, e);
        }
        LOG.ok("Read scf {0} {1}", descriptor.getType(), state.getHandle());
        return LifecycleResult.present(mapper.retainCreateOnly(state, prior));
    }

    /**
     * Bring the remote resource in line with the desired state.
     *
     * @param desired  desired attributes, unset ones are not managed
     * @param observed last observed state, must carry the handle
     * @return UPDATED with the reconciled state
     */
    public LifecycleResult update(ScfState desired, ScfState observed) {
        final String op = ScfDriftReconciler.OPERATION;
        if (!descriptor.isUpdatable()) {
            // Mutation attempts of immutable resources are surfaced, not ignored
            throw new ScfLifecycleException(op, descriptor.getType(), "update not supported");
        }
        ResourceHandle handle = requireHandle(observed, op);

        ScfState state = reconciler.reconcile(handle, desired, observed);
        LOG.info("Updated scf {0} {1}", descriptor.getType(), handle);
        return LifecycleResult.updated(state);
    }

    /**
     * Delete the resource. Deleting a resource which is already gone succeeds.
     */
    public LifecycleResult delete(ResourceHandle handle) {
        final String op = "delete";
        if (!descriptor.isDeletable()) {
            throw new ScfLifecycleException(op, descriptor.getType(), "delete not supported");
        }
        try {
            descriptor.getDeleter().delete(handle);
            LOG.info("Deleted scf {0} {1}", descriptor.getType(), handle);
        } catch (RuntimeException e) {
            if (!classifier.isNotFound(e)) {
                throw new ScfLifecycleException(op, descriptor.getType(), null, e);
            }
            LOG.warn("scf {0} {1} was already deleted", descriptor.getType(), handle);
        }
        return LifecycleResult.deleted();
    }

    /**
     * Adopt an existing remote resource from an external identifier.
     *
     * @param identifier      "[project_id],[resource_id]" or the bare resource id
     * @param fallbackScopeId project id used for a bare resource id
     * @return PRESENT with the imported state
     * @throws InvalidImportFormatException if no project id can be determined
     * @throws ScfLifecycleException        if the resource doesn't exist or can't be read
     */
    public LifecycleResult importResource(String identifier, String fallbackScopeId) {
        final String op = "import";
        ResourceHandle handle = ResourceHandle.resolveImport(identifier, fallbackScopeId);

        LifecycleResult result = read(handle, null, op);
        if (result.getKind() == LifecycleResult.Kind.REMOVED) {
            throw new ScfLifecycleException(op, descriptor.getType(),
                    "cannot import non-existent remote object " + handle);
        }
        LOG.info("Imported scf {0} {1}", descriptor.getType(), handle);
        return result;
    }

    private ResourceHandle requireHandle(ScfState state, String op) {
        if (state == null || state.getHandle() == null) {
            throw new InvalidAttributeValueException(String.format("Missing handle for scf %s %s", descriptor.getType(), op));
        }
        return state.getHandle();
    }

    public boolean isNotFound(Throwable error) {
        return classifier.isNotFound(error);
    }
}
