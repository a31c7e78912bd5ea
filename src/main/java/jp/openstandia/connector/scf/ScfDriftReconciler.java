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

import org.identityconnectors.common.logging.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Update path of the engine: finds the attribute groups whose desired values differ from the
 * remote ones and applies each changed group with a single mutation call.
 * <p>
 * Groups are applied in descriptor order. A failing group stops the update; groups applied
 * before it are not rolled back because the remote API has no multi-resource transactions.
 * The exception of a failing group carries the state reached so far. Re-running the update
 * completes the remaining groups.
 *
 * @param <R> remote response type
 */
public class ScfDriftReconciler<R> {

    private static final Log LOG = Log.getLog(ScfDriftReconciler.class);

    static final String OPERATION = "update";

    private final ResourceDescriptor<R> descriptor;
    private final ScfStateMapper<R> mapper;

    public ScfDriftReconciler(ResourceDescriptor<R> descriptor, ScfStateMapper<R> mapper) {
        this.descriptor = descriptor;
        this.mapper = mapper;
    }

    /**
     * @param handle  the resource
     * @param desired desired attributes, unset ones are not managed
     * @param prior   last observed state, source of create-only values
     * @return the observed state after all changed groups were applied
     * @throws ScfLifecycleException if the guard read or a group mutation fails
     */
    public ScfState reconcile(ResourceHandle handle, ScfState desired, ScfState prior) throws ScfLifecycleException {
        ScfState observed;
        try {
            R current = descriptor.getReader().get(handle);
            observed = mapper.toState(current, handle.getScopeId(), handle.getResourceId());
        } catch (RuntimeException e) {
            throw new ScfLifecycleException(OPERATION, descriptor.getType(), null, e);
        }
        observed = mapper.retainCreateOnly(observed, prior);

        for (AttributeGroup<R> group : descriptor.getGroups()) {
            List<String> drifted = diff(group, desired, observed);
            if (drifted.isEmpty()) {
                LOG.ok("No drift in group {0} of scf {1} {2}", group.getName(), descriptor.getType(), handle);
                continue;
            }

            LOG.info("Detected drift of {0} in group {1} of scf {2} {3}", drifted, group.getName(), descriptor.getType(), handle);

            Map<String, Object> payload = mapper.toMutationPayload(desired, group);
            R response;
            try {
                response = group.getMutation().apply(handle, payload);
            } catch (RuntimeException e) {
                throw new ScfLifecycleException(OPERATION, descriptor.getType(), group.getName(), handle, observed, e);
            }
            observed = observed.merge(mapper.project(response, group.getMergeFields()));
        }

        return observed;
    }

    /**
     * @return the group's fields which the desired state sets to a value other than the observed one
     */
    List<String> diff(AttributeGroup<R> group, ScfState desired, ScfState observed) {
        List<String> drifted = new ArrayList<>();
        for (String name : group.getFields()) {
            if (!desired.isSet(name)) {
                continue;
            }
            if (!Objects.equals(desired.get(name), observed.get(name))) {
                drifted.add(name);
            }
        }
        return drifted;
    }
}
