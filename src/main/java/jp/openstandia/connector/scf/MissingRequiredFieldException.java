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
 * A remote response lacks a field the state record can't be built without.
 */
public class MissingRequiredFieldException extends ConnectorException {

    private final String resourceType;
    private final String fieldName;

    public MissingRequiredFieldException(String resourceType, String fieldName, String description) {
        super(String.format("SCF %s %s not present in response (%s)", resourceType, fieldName, description));
        this.resourceType = resourceType;
        this.fieldName = fieldName;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getFieldName() {
        return fieldName;
    }
}
