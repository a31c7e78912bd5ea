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
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScfUtilsTest {

    private final Map<String, AttributeInfo> schema = new ScfSchema().orgManagerSchema;

    @Test
    void defaultAttributesToGet() {
        Set<String> attrs = ScfUtils.createFullAttributesToGet(schema, new OperationOptionsBuilder().build());

        assertTrue(attrs.contains(ScfOrganizationManagerType.ATTR_USERNAME));
        assertFalse(attrs.contains(ScfOrganizationManagerType.ATTR_PASSWORD));
    }

    @Test
    void explicitAttributesToGet() {
        OperationOptions options = new OperationOptionsBuilder()
                .setAttributesToGet(ScfOrganizationManagerType.ATTR_PASSWORD)
                .build();
        Set<String> attrs = ScfUtils.createFullAttributesToGet(schema, options);

        assertTrue(ScfUtils.shouldReturn(attrs, ScfOrganizationManagerType.ATTR_PASSWORD));
        assertFalse(ScfUtils.shouldReturn(attrs, ScfOrganizationManagerType.ATTR_USERNAME));

        options = new OperationOptionsBuilder()
                .setAttributesToGet(ScfOrganizationManagerType.ATTR_PASSWORD)
                .setReturnDefaultAttributes(true)
                .build();
        attrs = ScfUtils.createFullAttributesToGet(schema, options);

        assertTrue(ScfUtils.shouldReturn(attrs, ScfOrganizationManagerType.ATTR_PASSWORD));
        assertTrue(ScfUtils.shouldReturn(attrs, ScfOrganizationManagerType.ATTR_USERNAME));
    }

    @Test
    void toResourceValue() {
        assertEquals("acme", ScfUtils.toResourceValue(AttributeDeltaBuilder.build("name", "acme")));
        assertEquals(Boolean.TRUE, ScfUtils.toResourceValue(AttributeDeltaBuilder.build("suspended", true)));
    }

    @Test
    void toResourceValueRejectsUnsupportedDelta() {
        // Clear
        assertThrows(InvalidAttributeValueException.class,
                () -> ScfUtils.toResourceValue(AttributeDeltaBuilder.build("quota_id", Collections.emptyList())));
        // Multiple values
        assertThrows(InvalidAttributeValueException.class,
                () -> ScfUtils.toResourceValue(AttributeDeltaBuilder.build("name", "a", "b")));
        // Add/remove
        assertThrows(InvalidAttributeValueException.class,
                () -> ScfUtils.toResourceValue(AttributeDeltaBuilder.build("name", Collections.singletonList("a"), null)));
    }
}
