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

import jp.openstandia.connector.scf.testutil.AbstractTest;
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;
import org.identityconnectors.framework.common.exceptions.UnknownUidException;
import org.identityconnectors.framework.common.objects.*;
import org.identityconnectors.framework.common.objects.filter.FilterBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static jp.openstandia.connector.scf.ScfClient.ScfOrganizationRepresentation;
import static jp.openstandia.connector.scf.ScfOrganizationType.*;
import static org.junit.jupiter.api.Assertions.*;

class ScfOrganizationTest extends AbstractTest {

    private OperationOptions defaultGetOperation() {
        return new OperationOptionsBuilder()
                .setReturnDefaultAttributes(true)
                .build();
    }

    @Test
    void schema() {
        Schema schema = connector.schema();

        assertNotNull(schema.findObjectClassInfo(ORGANIZATION_OBJECT_CLASS.getObjectClassValue()));
        assertNotNull(schema.findObjectClassInfo(ScfOrganizationManagerType.ORG_MANAGER_OBJECT_CLASS.getObjectClassValue()));
        assertNotNull(schema.findObjectClassInfo(ScfPlatformType.PLATFORM_OBJECT_CLASS.getObjectClassValue()));
    }

    @Test
    void create() {
        Set<Attribute> attrs = new HashSet<>();
        attrs.add(AttributeBuilder.build(ATTR_NAME, "acme"));
        attrs.add(AttributeBuilder.build(ATTR_QUOTA_ID, "q1"));

        Uid uid = connector.create(ORGANIZATION_OBJECT_CLASS, attrs, new OperationOptionsBuilder().build());

        assertEquals("proj-1,org-1", uid.getUidValue());
        ScfOrganizationRepresentation org = mockClient.organizations.get("proj-1/org-1");
        assertEquals("acme", org.name);
        assertEquals("q1", org.quotaId);
        assertEquals(1, mockClient.calls("applyOrganizationQuota"));
    }

    @Test
    void createInOtherProject() {
        Set<Attribute> attrs = new HashSet<>();
        attrs.add(AttributeBuilder.build(ATTR_PROJECT_ID, "proj-2"));
        attrs.add(AttributeBuilder.build(ATTR_NAME, "acme"));
        attrs.add(AttributeBuilder.build(ATTR_PLATFORM_ID, "pf-2"));

        Uid uid = connector.create(ORGANIZATION_OBJECT_CLASS, attrs, new OperationOptionsBuilder().build());

        assertEquals("proj-2,org-1", uid.getUidValue());
        assertEquals("pf-2", mockClient.organizations.get("proj-2/org-1").platformId);
        assertEquals(0, mockClient.calls("applyOrganizationQuota"));
    }

    @Test
    void createWithReadOnlyAttribute() {
        Set<Attribute> attrs = new HashSet<>();
        attrs.add(AttributeBuilder.build(ATTR_NAME, "acme"));
        attrs.add(AttributeBuilder.build(ATTR_STATUS, "created"));

        assertThrows(InvalidAttributeValueException.class,
                () -> connector.create(ORGANIZATION_OBJECT_CLASS, attrs, new OperationOptionsBuilder().build()));
        assertEquals(0, mockClient.calls("createOrganization"));
    }

    @Test
    void getByHandle() {
        mockClient.addOrganization(PROJECT_ID, "org-9", "acme");

        ConnectorObject result = connector.getObject(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9"), defaultGetOperation());

        assertNotNull(result);
        assertEquals("proj-1,org-9", result.getUid().getUidValue());
        assertEquals("proj-1,org-9", result.getName().getNameValue());
        assertEquals("acme", AttributeUtil.getStringValue(result.getAttributeByName(ATTR_NAME)));
        assertEquals("org-9", AttributeUtil.getStringValue(result.getAttributeByName(ATTR_ORG_ID)));
        assertEquals(Boolean.FALSE, AttributeUtil.getBooleanValue(result.getAttributeByName(ATTR_SUSPENDED)));
        assertEquals("2024-01-01T00:00:01Z", AttributeUtil.getStringValue(result.getAttributeByName(ATTR_CREATED_AT)));
        // Unset attributes are not returned
        assertNull(result.getAttributeByName(ATTR_QUOTA_ID));
    }

    @Test
    void getByResourceId() {
        mockClient.addOrganization(PROJECT_ID, "org-9", "acme");

        ConnectorObject result = connector.getObject(ORGANIZATION_OBJECT_CLASS, new Uid("org-9"), defaultGetOperation());

        assertNotNull(result);
        assertEquals("proj-1,org-9", result.getUid().getUidValue());
    }

    @Test
    void getWithAttributesToGet() {
        mockClient.addOrganization(PROJECT_ID, "org-9", "acme");

        OperationOptions options = new OperationOptionsBuilder()
                .setAttributesToGet(ATTR_NAME)
                .build();
        ConnectorObject result = connector.getObject(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9"), options);

        assertNotNull(result.getAttributeByName(ATTR_NAME));
        assertNull(result.getAttributeByName(ATTR_STATUS));
    }

    @Test
    void getRemoved() {
        ConnectorObject result = connector.getObject(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9"), defaultGetOperation());

        assertNull(result);
    }

    @Test
    void searchByName() {
        mockClient.addOrganization(PROJECT_ID, "org-9", "acme");

        List<ConnectorObject> results = new ArrayList<>();
        ResultsHandler handler = connectorObject -> {
            results.add(connectorObject);
            return true;
        };
        connector.search(ORGANIZATION_OBJECT_CLASS, FilterBuilder.equalTo(new Name("proj-1,org-9")), handler, defaultGetOperation());

        assertEquals(1, results.size());
        assertEquals("acme", AttributeUtil.getStringValue(results.get(0).getAttributeByName(ATTR_NAME)));
    }

    @Test
    void searchWithoutFilter() {
        mockClient.addOrganization(PROJECT_ID, "org-9", "acme");

        List<ConnectorObject> results = new ArrayList<>();
        connector.search(ORGANIZATION_OBJECT_CLASS, null, connectorObject -> {
            results.add(connectorObject);
            return true;
        }, defaultGetOperation());

        assertTrue(results.isEmpty());
        assertEquals(0, mockClient.calls("getOrganization"));
    }

    @Test
    void searchWithMalformedHandle() {
        assertThrows(InvalidAttributeValueException.class,
                () -> connector.getObject(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9,x"), defaultGetOperation()));
    }

    @Test
    void update() {
        ScfOrganizationRepresentation org = mockClient.addOrganization(PROJECT_ID, "org-9", "acme");

        Set<AttributeDelta> modifications = new HashSet<>();
        modifications.add(AttributeDeltaBuilder.build(ATTR_NAME, "acme2"));
        modifications.add(AttributeDeltaBuilder.build(ATTR_SUSPENDED, true));
        modifications.add(AttributeDeltaBuilder.build(ATTR_QUOTA_ID, "q2"));

        Set<AttributeDelta> sideEffects = connector.updateDelta(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9"),
                modifications, new OperationOptionsBuilder().build());

        assertTrue(sideEffects == null || sideEffects.isEmpty());
        assertEquals("acme2", org.name);
        assertEquals(Boolean.TRUE, org.suspended);
        assertEquals("q2", org.quotaId);
        assertEquals(1, mockClient.calls("updateOrganization"));
        assertEquals(1, mockClient.calls("applyOrganizationQuota"));
    }

    @Test
    void updateWithoutDrift() {
        mockClient.addOrganization(PROJECT_ID, "org-9", "acme");

        connector.updateDelta(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9"),
                Collections.singleton(AttributeDeltaBuilder.build(ATTR_NAME, "acme")), new OperationOptionsBuilder().build());

        assertEquals(1, mockClient.calls("getOrganization"));
        assertEquals(0, mockClient.calls("updateOrganization"));
    }

    @Test
    void updateRemoved() {
        assertThrows(UnknownUidException.class, () -> connector.updateDelta(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9"),
                Collections.singleton(AttributeDeltaBuilder.build(ATTR_NAME, "acme2")), new OperationOptionsBuilder().build()));
    }

    @Test
    void updateCreateOnlyAttribute() {
        mockClient.addOrganization(PROJECT_ID, "org-9", "acme");

        assertThrows(InvalidAttributeValueException.class, () -> connector.updateDelta(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9"),
                Collections.singleton(AttributeDeltaBuilder.build(ATTR_PLATFORM_ID, "pf-2")), new OperationOptionsBuilder().build()));
        assertEquals(0, mockClient.calls("getOrganization"));
    }

    @Test
    void updateFailure() {
        mockClient.addOrganization(PROJECT_ID, "org-9", "acme");
        mockClient.failOn("updateOrganization", 500);

        ScfLifecycleException e = assertThrows(ScfLifecycleException.class, () -> connector.updateDelta(ORGANIZATION_OBJECT_CLASS,
                new Uid("proj-1,org-9"), Collections.singleton(AttributeDeltaBuilder.build(ATTR_NAME, "acme2")),
                new OperationOptionsBuilder().build()));
        assertEquals(GROUP_CORE, e.getGroup());
    }

    @Test
    void delete() {
        mockClient.addOrganization(PROJECT_ID, "org-9", "acme");

        connector.delete(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9"), new OperationOptionsBuilder().build());
        assertTrue(mockClient.organizations.isEmpty());

        // Already deleted
        connector.delete(ORGANIZATION_OBJECT_CLASS, new Uid("proj-1,org-9"), new OperationOptionsBuilder().build());
        assertEquals(2, mockClient.calls("deleteOrganization"));
    }
}
