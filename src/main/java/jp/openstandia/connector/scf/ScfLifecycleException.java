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

import org.identityconnectors.framework.common.exceptions.ConnectorException;

/**
 * Fatal outcome of a lifecycle operation. The message always names the operation and the
 * resource type, the attribute group if one was being applied, the handle if the resource
 * exists remotely, and the underlying error text.
 * <p>
 * When the failure happens after the resource was created or after some groups were applied,
 * {@link #getHandle()} and {@link #getState()} carry what the remote side holds so the caller
 * can persist it and retry instead of creating a duplicate.
 */
public class ScfLifecycleException extends ConnectorException {

    private final String operation;
    private final String resourceType;
    private final String group;
    private final ResourceHandle handle;
    private final ScfState state;

    public ScfLifecycleException(String operation, String resourceType, String group, Throwable cause) {
        this(operation, resourceType, group, null, null, cause);
    }

    public ScfLifecycleException(String operation, String resourceType, String group,
                                 ResourceHandle handle, ScfState state, Throwable cause) {
        super(format(operation, resourceType, group, handle, cause.getMessage()), cause);
        this.operation = operation;
        this.resourceType = resourceType;
        this.group = group;
        this.handle = handle;
        this.state = state;
    }

    public ScfLifecycleException(String operation, String resourceType, String message) {
        super(format(operation, resourceType, null, null, message));
        this.operation = operation;
        this.resourceType = resourceType;
        this.group = null;
        this.handle = null;
        this.state = null;
    }

    private static String format(String operation, String resourceType, String group, ResourceHandle handle, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("SCF ").append(resourceType).append(' ').append(operation).append(" failed");
        if (group != null) {
            sb.append(" in group '").append(group).append('\'');
        }
        if (handle != null) {
            sb.append(" for ").append(handle);
        }
        return sb.append(": ").append(message).toString();
    }

    public String getOperation() {
        return operation;
    }

    public String getResourceType() {
        return resourceType;
    }

    /**
     * @return the attribute group being applied when the error happened, or null
     */
    public String getGroup() {
        return group;
    }

    /**
     * @return handle of the remote resource which exists despite the failure, or null
     */
    public ResourceHandle getHandle() {
        return handle;
    }

    /**
     * @return state reflecting the groups applied before the failure, or null
     */
    public ScfState getState() {
        return state;
    }
}
