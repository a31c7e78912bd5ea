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
import org.identityconnectors.framework.common.objects.*;

import java.util.Arrays;

import static jp.openstandia.connector.scf.ScfClient.ScfOrgManagerRepresentation;

/**
 * SCF organization manager: a technical user generated for an organization.
 * There is at most one per organization, so it is addressed by the organization id.
 * It can't be changed after creation and its password is only returned on creation.
 */
public final class ScfOrganizationManagerType {

    public static final ObjectClass ORG_MANAGER_OBJECT_CLASS = new ObjectClass("organizationManager");

    private static final Log LOGGER = Log.getLog(ScfOrganizationManagerType.class);

    // Identifiers
    public static final String ATTR_PROJECT_ID = "project_id";
    public static final String ATTR_ORG_ID = "org_id";
    public static final String ATTR_USER_ID = "user_id";

    // Readonly attributes
    public static final String ATTR_PLATFORM_ID = "platform_id";
    public static final String ATTR_REGION = "region";
    public static final String ATTR_USERNAME = "username";
    public static final String ATTR_PASSWORD = "password";
    public static final String ATTR_CREATED_AT = "created_at";
    public static final String ATTR_UPDATED_AT = "updated_at";

    private ScfOrganizationManagerType() {
    }

    public static ObjectClassInfo createSchema() {
        ObjectClassInfoBuilder builder = new ObjectClassInfoBuilder();
        builder.setType(ORG_MANAGER_OBJECT_CLASS.getObjectClassValue());

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

        builder.addAttributeInfo(
                AttributeInfoBuilder.define(ATTR_PROJECT_ID)
                        .setRequired(false) // Defaults to the configured project
                        .setCreateable(true)
                        .setUpdateable(false)
                        .build());
        builder.addAttributeInfo(
                AttributeInfoBuilder.define(ATTR_ORG_ID)
                        .setRequired(true)
                        .setCreateable(true)
                        .setUpdateable(false)
                        .build());

        // Readonly attributes
        for (String name : Arrays.asList(ATTR_USER_ID, ATTR_PLATFORM_ID, ATTR_REGION, ATTR_USERNAME, ATTR_CREATED_AT, ATTR_UPDATED_AT)) {
            builder.addAttributeInfo(
                    AttributeInfoBuilder.define(name)
                            .setRequired(false)
                            .setCreateable(false)
                            .setUpdateable(false)
                            .build());
        }
        builder.addAttributeInfo(
                AttributeInfoBuilder.define(ATTR_PASSWORD, GuardedString.class)
                        .setRequired(false)
                        .setCreateable(false)
                        .setUpdateable(false)
                        .setReturnedByDefault(false)
                        .build());

        ObjectClassInfo schemaInfo = builder.build();

        LOGGER.ok("The constructed organization manager schema: {0}", schemaInfo);

        return schemaInfo;
    }

    public static ResourceDescriptor<ScfOrgManagerRepresentation> descriptor(ScfConfiguration configuration, ScfClient client) {
        final String region = configuration.getRegion();

        return ResourceDescriptor.<ScfOrgManagerRepresentation>builder(ORG_MANAGER_OBJECT_CLASS.getObjectClassValue())
                .scopeAttribute(ATTR_PROJECT_ID)
                // The get response may omit the organization, it's then taken from the handle
                .handleAttribute(ATTR_ORG_ID)
                .scopeSource(ScopeSource.RESPONSE)
                .requiredField(ATTR_USER_ID, String.class, r -> r.guid, "The ID of the organization manager user")
                .field(ATTR_PROJECT_ID, String.class, r -> r.projectId, "The ID of the project associated with the organization of the organization manager")
                .field(ATTR_ORG_ID, String.class, r -> r.orgId, "The ID of the organization")
                .field(ATTR_PLATFORM_ID, String.class, r -> r.platformId, "The ID of the platform associated with the organization of the organization manager")
                .field(ATTR_REGION, String.class, r -> r.region, "The region where the organization of the organization manager is located")
                .field(ATTR_USERNAME, String.class, r -> r.username, "An auto-generated organization manager user name")
                .field(ATTR_PASSWORD, String.class, r -> r.password, "An auto-generated password")
                .field(ATTR_CREATED_AT, String.class, r -> r.createdAt, "The time when the organization manager was created")
                .field(ATTR_UPDATED_AT, String.class, r -> r.updatedAt, "The time when the organization manager was last updated")
                .createOnly(ATTR_PASSWORD)
                .creator((projectId, desired) -> {
                    String orgId = desired.getString(ATTR_ORG_ID);
                    if (StringUtil.isEmpty(orgId)) {
                        throw new InvalidAttributeValueException("Invalid organization manager due to no org_id when creating");
                    }
                    return client.createOrgManager(projectId, region, orgId);
                })
                .reader(h -> client.getOrgManager(h.getScopeId(), region, h.getResourceId()))
                .deleter(h -> client.deleteOrgManager(h.getScopeId(), region, h.getResourceId()))
                .immutable()
                .build();
    }
}
