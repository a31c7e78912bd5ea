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

import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;
import org.identityconnectors.framework.common.objects.*;
import org.identityconnectors.framework.spi.operations.SearchOp;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Schema for SCF objects.
 */
public class ScfSchema {

    public final Schema schema;
    public final Map<String, AttributeInfo> organizationSchema;
    public final Map<String, AttributeInfo> orgManagerSchema;
    public final Map<String, AttributeInfo> platformSchema;

    public ScfSchema() {
        SchemaBuilder schemaBuilder = new SchemaBuilder(ScfConnector.class);

        ObjectClassInfo organizationSchemaInfo = ScfOrganizationType.createSchema();
        schemaBuilder.defineObjectClass(organizationSchemaInfo);

        ObjectClassInfo orgManagerSchemaInfo = ScfOrganizationManagerType.createSchema();
        schemaBuilder.defineObjectClass(orgManagerSchemaInfo);

        ObjectClassInfo platformSchemaInfo = ScfPlatformType.createSchema();
        schemaBuilder.defineObjectClass(platformSchemaInfo);

        schemaBuilder.defineOperationOption(OperationOptionInfoBuilder.buildAttributesToGet(), SearchOp.class);
        schemaBuilder.defineOperationOption(OperationOptionInfoBuilder.buildReturnDefaultAttributes(), SearchOp.class);

        schema = schemaBuilder.build();

        this.organizationSchema = toMap(organizationSchemaInfo);
        this.orgManagerSchema = toMap(orgManagerSchemaInfo);
        this.platformSchema = toMap(platformSchemaInfo);
    }

    private static Map<String, AttributeInfo> toMap(ObjectClassInfo info) {
        Map<String, AttributeInfo> map = new HashMap<>();
        for (AttributeInfo attr : info.getAttributeInfo()) {
            map.put(attr.getName(), attr);
        }
        return Collections.unmodifiableMap(map);
    }

    public Map<String, AttributeInfo> getSchema(ObjectClass objectClass) {
        if (objectClass.equals(ScfOrganizationType.ORGANIZATION_OBJECT_CLASS)) {
            return organizationSchema;
        }
        if (objectClass.equals(ScfOrganizationManagerType.ORG_MANAGER_OBJECT_CLASS)) {
            return orgManagerSchema;
        }
        if (objectClass.equals(ScfPlatformType.PLATFORM_OBJECT_CLASS)) {
            return platformSchema;
        }
        throw new InvalidAttributeValueException("Unsupported object class " + objectClass);
    }
}
