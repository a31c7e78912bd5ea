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

import java.util.Objects;

/**
 * Composite local identifier of a SCF resource, structured as "scopeId,resourceId".
 * <p>
 * The scope is the owning STACKIT project, the resource id is the remote identifier
 * which addresses the resource inside that project. Instances are immutable and
 * always hold two non-empty fragments without the separator.
 */
public final class ResourceHandle {

    public static final String SEPARATOR = ",";

    private final String scopeId;
    private final String resourceId;

    private ResourceHandle(String scopeId, String resourceId) {
        this.scopeId = scopeId;
        this.resourceId = resourceId;
    }

    /**
     * Build a handle from its fragments.
     *
     * @param scopeId    owning project id
     * @param resourceId remote identifier
     * @return the handle
     * @throws InvalidFragmentException if a fragment is empty or contains the separator
     */
    public static ResourceHandle build(String scopeId, String resourceId) throws InvalidFragmentException {
        validateFragment("scopeId", scopeId);
        validateFragment("resourceId", resourceId);
        return new ResourceHandle(scopeId, resourceId);
    }

    /**
     * Split a handle string into its fragments.
     *
     * @param handle the handle string
     * @return the handle
     * @throws MalformedHandleException unless the string holds exactly two non-empty fragments
     */
    public static ResourceHandle decode(String handle) throws MalformedHandleException {
        if (handle == null) {
            throw new MalformedHandleException("null", "handle is null");
        }
        // -1 keeps trailing empty fragments so "a," is rejected
        String[] parts = handle.split(SEPARATOR, -1);
        if (parts.length != 2) {
            throw new MalformedHandleException(handle,
                    String.format("expected exactly one '%s' but found %d", SEPARATOR, parts.length - 1));
        }
        if (parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new MalformedHandleException(handle, "empty fragment");
        }
        return new ResourceHandle(parts[0], parts[1]);
    }

    /**
     * Recover the handle from an identifier supplied by an import.
     * The identifier is either a full handle or the bare resource id, in which case
     * the scope must be known out-of-band.
     *
     * @param identifier      raw external identifier
     * @param fallbackScopeId scope used when the identifier has no separator, may be null
     * @return the handle
     */
    public static ResourceHandle resolveImport(String identifier, String fallbackScopeId) {
        if (StringUtil.isEmpty(identifier)) {
            throw new InvalidImportFormatException(identifier, "identifier is empty");
        }
        if (isComposite(identifier)) {
            return decode(identifier);
        }
        if (StringUtil.isEmpty(fallbackScopeId)) {
            throw new InvalidImportFormatException(identifier,
                    "expected [project_id]" + SEPARATOR + "[resource_id] or a configured project id");
        }
        return build(fallbackScopeId, identifier);
    }

    public static boolean isComposite(String identifier) {
        return identifier != null && identifier.contains(SEPARATOR);
    }

    private static void validateFragment(String name, String value) {
        if (StringUtil.isEmpty(value)) {
            throw new InvalidFragmentException(name, value, "must not be empty");
        }
        if (value.contains(SEPARATOR)) {
            throw new InvalidFragmentException(name, value, "must not contain '" + SEPARATOR + "'");
        }
    }

    public String getScopeId() {
        return scopeId;
    }

    public String getResourceId() {
        return resourceId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceHandle that = (ResourceHandle) o;
        return scopeId.equals(that.scopeId) && resourceId.equals(that.resourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scopeId, resourceId);
    }

    @Override
    public String toString() {
        return scopeId + SEPARATOR + resourceId;
    }
}
