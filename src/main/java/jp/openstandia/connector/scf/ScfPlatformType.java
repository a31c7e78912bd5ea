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
import org.identityconnectors.framework.common.objects.*;

import java.util.Arrays;

import static jp.openstandia.connector.scf.ScfClient.ScfPlatformRepresentation;

/**
 * SCF platform: read-only lookup of the Cloud Foundry platform an organization runs on.
 */
public final class ScfPlatformType {

    public static final ObjectClass PLATFORM_OBJECT_CLASS = new ObjectClass("platform");

    private static final Log LOGGER = Log.getLog(ScfPlatformType.class);

    public static final String ATTR_PROJECT_ID = "project_id";
    public static final String ATTR_GUID = "guid";
    public static final String ATTR_SYSTEM_ID = "system_id";
    public static final String ATTR_DISPLAY_NAME = "display_name";
    public static final String ATTR_REGION = "region";
    public static final String ATTR_API_URL = "api_url";
    public static final String ATTR_CONSOLE_URL = "console_url";

    private ScfPlatformType() {
    }

    public static ObjectClassInfo createSchema() {
        ObjectClassInfoBuilder builder = new ObjectClassInfoBuilder();
        builder.setType(PLATFORM_OBJECT_CLASS.getObjectClassValue());

        // __UID__ and __NAME__ are the same
        // "project_id,guid"
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

        // Readonly attributes
        for (String name : Arrays.asList(ATTR_PROJECT_ID, ATTR_GUID, ATTR_SYSTEM_ID, ATTR_DISPLAY_NAME, ATTR_REGION,
                ATTR_API_URL, ATTR_CONSOLE_URL)) {
            builder.addAttributeInfo(
                    AttributeInfoBuilder.define(name)
                            .setRequired(false)
                            .setCreateable(false)
                            .setUpdateable(false)
                            .build());
        }

        ObjectClassInfo schemaInfo = builder.build();

        LOGGER.ok("The constructed platform schema: {0}", schemaInfo);

        return schemaInfo;
    }

    public static ResourceDescriptor<ScfPlatformRepresentation> descriptor(ScfConfiguration configuration, ScfClient client) {
        final String region = configuration.getRegion();

        return ResourceDescriptor.<ScfPlatformRepresentation>builder(PLATFORM_OBJECT_CLASS.getObjectClassValue())
                .scopeAttribute(ATTR_PROJECT_ID)
                .handleAttribute(ATTR_GUID)
                // Platform responses don't carry the project
                .scopeSource(ScopeSource.STATE)
                .requiredField(ATTR_GUID, String.class, r -> r.guid, "The unique id of the platform")
                .field(ATTR_PROJECT_ID, String.class, r -> null, "The project ID associated with the platform")
                .field(ATTR_SYSTEM_ID, String.class, r -> r.systemId, "The ID of the platform System")
                .field(ATTR_DISPLAY_NAME, String.class, r -> r.displayName, "The name of the platform")
                .field(ATTR_REGION, String.class, r -> r.region, "The region where the platform is located")
                .field(ATTR_API_URL, String.class, r -> r.apiUrl, "The CF API Url of the platform")
                .field(ATTR_CONSOLE_URL, String.class, r -> r.consoleUrl, "The Stratos URL of the platform")
                .reader(h -> client.getPlatform(h.getScopeId(), region, h.getResourceId()))
                .build();
    }
}
