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
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;
import org.identityconnectors.framework.common.objects.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static jp.openstandia.connector.scf.ScfClient.*;

/**
 * SCF organization: mutable name and suspension, quota assigned through its own endpoint.
 */
public final class ScfOrganizationType {

    public static final ObjectClass ORGANIZATION_OBJECT_CLASS = new ObjectClass("organization");

    private static final Log LOGGER = Log.getLog(ScfOrganizationType.class);

    // Identifiers
    public static final String ATTR_PROJECT_ID = "project_id";
    public static final String ATTR_ORG_ID = "org_id";

    // Attributes
    public static final String ATTR_NAME = "name";
    public static final String ATTR_SUSPENDED = "suspended";
    public static final String ATTR_PLATFORM_ID = "platform_id";
    public static final String ATTR_QUOTA_ID = "quota_id";

    // Readonly attributes
    public static final String ATTR_REGION = "region";
    public static final String ATTR_STATUS = "status";
    public static final String ATTR_CREATED_AT = "created_at";
    public static final String ATTR_UPDATED_AT = "updated_at";

    public static final String GROUP_CORE = "core";
    public static final String GROUP_QUOTA = "quota";

    private ScfOrganizationType() {
    }

    public static ObjectClassInfo createSchema() {
        ObjectClassInfoBuilder builder = new ObjectClassInfoBuilder();
        builder.setType(ORGANIZATION_OBJECT_CLASS.getObjectClassValue());

        // __UID__ and __NAME__ are the same
        // "project_id,org_id"
        builder.addAttributeInfo(
                AttributeInfoBuilder.define(Uid.NAME)
                        .setRequired(false)
                        .setCreateable(false)
                        .setUpdateable(false)
                        .setNativeName("id")
                        .build());
        builder.addAttributeInfo(
                AttributeInfoBuilder.define(Name.NAME)
                        .setRequired(false)
                        .setCreateable(false)
                        .setUpdateable(false)
                        .setNativeName("id")
                        .build());

        // Unchangeable after creation
        builder.addAttributeInfo(
                AttributeInfoBuilder.define(ATTR_PROJECT_ID)
                        .setRequired(false) // Defaults to the configured project
                        .setCreateable(true)
                        .setUpdateable(false)
                        .build());
        builder.addAttributeInfo(
                AttributeInfoBuilder.define(ATTR_PLATFORM_ID)
                        .setRequired(false)
                        .setCreateable(true)
                        .setUpdateable(false)
                        .build());

        // Attributes
        builder.addAttributeInfo(
                AttributeInfoBuilder.define(ATTR_NAME)
                        .setRequired(true)
                        .setCreateable(true)
                        .setUpdateable(true)
                        .build());
        builder.addAttributeInfo(
                AttributeInfoBuilder.define(ATTR_SUSPENDED, Boolean.class)
                        .setRequired(false)
                        .setCreateable(false)
                        .setUpdateable(true)
                        .build());
        builder.addAttributeInfo(
                AttributeInfoBuilder.define(ATTR_QUOTA_ID)
                        .setRequired(false)
                        .setCreateable(true)
                        .setUpdateable(true)
                        .build());

        // Readonly attributes
        for (String name : Arrays.asList(ATTR_ORG_ID, ATTR_REGION, ATTR_STATUS, ATTR_CREATED_AT, ATTR_UPDATED_AT)) {
            builder.addAttributeInfo(
                    AttributeInfoBuilder.define(name)
                            .setRequired(false)
                            .setCreateable(false)
                            .setUpdateable(false)
                            .build());
        }

        ObjectClassInfo schemaInfo = builder.build();

        LOGGER.ok("The constructed organization schema: {0}", schemaInfo);

        return schemaInfo;
    }

    public static ResourceDescriptor<ScfOrganizationRepresentation> descriptor(ScfConfiguration configuration, ScfClient client) {
        final String region = configuration.getRegion();

        return ResourceDescriptor.<ScfOrganizationRepresentation>builder(ORGANIZATION_OBJECT_CLASS.getObjectClassValue())
                .scopeAttribute(ATTR_PROJECT_ID)
                .handleAttribute(ATTR_ORG_ID)
                .scopeSource(ScopeSource.RESPONSE)
                .requiredField(ATTR_ORG_ID, String.class, r -> r.guid, "The globally unique identifier of the organization")
                .field(ATTR_PROJECT_ID, String.class, r -> r.projectId, "The ID of the project associated with the organization")
                .field(ATTR_NAME, String.class, r -> r.name, "The name of the organization")
                .field(ATTR_SUSPENDED, Boolean.class, r -> r.suspended, "A boolean indicating whether the organization is suspended")
                .field(ATTR_PLATFORM_ID, String.class, r -> r.platformId, "The ID of the platform associated with the organization")
                .field(ATTR_QUOTA_ID, String.class, r -> r.quotaId, "The ID of the quota associated with the organization")
                .field(ATTR_REGION, String.class, r -> r.region, "The region where the organization is located")
                .field(ATTR_STATUS, String.class, r -> r.status, "The status of the organization (e.g., deleting, delete_failed)")
                .field(ATTR_CREATED_AT, String.class, r -> r.createdAt, "The time when the organization was created")
                .field(ATTR_UPDATED_AT, String.class, r -> r.updatedAt, "The time when the organization was last updated")
                .creator((projectId, desired) -> {
                    ScfCreateOrganizationOperation op = new ScfCreateOrganizationOperation();
                    op.name = desired.getString(ATTR_NAME);
                    op.platformId = desired.getString(ATTR_PLATFORM_ID);
                    if (op.name == null) {
                        throw new InvalidAttributeValueException("Invalid organization due to no name when creating");
                    }
                    return client.createOrganization(projectId, region, op);
                })
                .reader(h -> client.getOrganization(h.getScopeId(), region, h.getResourceId()))
                .deleter(h -> client.deleteOrganization(h.getScopeId(), region, h.getResourceId()))
                .group(GROUP_CORE, Arrays.asList(ATTR_NAME, ATTR_SUSPENDED), Arrays.asList(ATTR_STATUS, ATTR_UPDATED_AT),
                        (h, payload) -> client.updateOrganization(h.getScopeId(), region, h.getResourceId(), toUpdateOperation(payload)))
                // Applied after the core group since the quota is assigned to an existing organization
                .dependentGroup(GROUP_QUOTA, Collections.singletonList(ATTR_QUOTA_ID), Collections.singletonList(ATTR_UPDATED_AT),
                        (h, payload) -> {
                            ScfApplyQuotaOperation op = new ScfApplyQuotaOperation();
                            op.quotaId = (String) payload.get(ATTR_QUOTA_ID);
                            return client.applyOrganizationQuota(h.getScopeId(), region, h.getResourceId(), op);
                        })
                .build();
    }

    static ScfUpdateOrganizationOperation toUpdateOperation(Map<String, Object> payload) {
        ScfUpdateOrganizationOperation op = new ScfUpdateOrganizationOperation();
        op.name = (String) payload.get(ATTR_NAME);
        op.suspended = (Boolean) payload.get(ATTR_SUSPENDED);
        return op;
    }
}
