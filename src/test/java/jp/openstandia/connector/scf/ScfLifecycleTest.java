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

import jp.openstandia.connector.scf.testutil.MockClient;
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static jp.openstandia.connector.scf.ScfClient.*;
import static jp.openstandia.connector.scf.ScfOrganizationType.*;
import static org.junit.jupiter.api.Assertions.*;

class ScfLifecycleTest {

    private MockClient client;
    private ScfConfiguration configuration;
    private ScfLifecycle<ScfOrganizationRepresentation> organizations;
    private ScfLifecycle<ScfOrgManagerRepresentation> managers;
    private ScfLifecycle<ScfPlatformRepresentation> platforms;

    @BeforeEach
    void setUp() {
        client = MockClient.instance();
        client.init();
        configuration = new ScfConfiguration();
        organizations = new ScfLifecycle<>(ScfOrganizationType.descriptor(configuration, client));
        managers = new ScfLifecycle<>(ScfOrganizationManagerType.descriptor(configuration, client));
        platforms = new ScfLifecycle<>(ScfPlatformType.descriptor(configuration, client));
    }

    @Test
    void createOrganizationWithQuota() {
        ScfState desired = ScfState.builder()
                .set(ATTR_PROJECT_ID, "proj-1")
                .set(ATTR_NAME, "acme")
                .set(ATTR_QUOTA_ID, "q1")
                .build();

        LifecycleResult result = organizations.create(desired);

        assertEquals(LifecycleResult.Kind.CREATED, result.getKind());
        ScfState state = result.getState();
        assertEquals("proj-1,org-1", state.getHandle().toString());
        assertEquals("acme", state.getString(ATTR_NAME));
        assertEquals("q1", state.getString(ATTR_QUOTA_ID));
        assertEquals("org-1", state.getString(ATTR_ORG_ID));
        assertEquals("created", state.getString(ATTR_STATUS));
        assertEquals(1, client.calls("createOrganization"));
        assertEquals(1, client.calls("applyOrganizationQuota"));
        assertEquals(0, client.calls("updateOrganization"));
    }

    @Test
    void createOrganizationWithoutQuota() {
        ScfState desired = ScfState.builder()
                .set(ATTR_PROJECT_ID, "proj-1")
                .set(ATTR_NAME, "acme")
                .build();

        LifecycleResult result = organizations.create(desired);

        assertFalse(result.getState().isSet(ATTR_QUOTA_ID));
        assertEquals(0, client.calls("applyOrganizationQuota"));
    }

    @Test
    void createOrganizationWithoutProject() {
        ScfState desired = ScfState.builder()
                .set(ATTR_NAME, "acme")
                .build();

        assertThrows(InvalidAttributeValueException.class, () -> organizations.create(desired));
        assertEquals(0, client.calls("createOrganization"));
    }

    @Test
    void createOrganizationWithoutName() {
        ScfState desired = ScfState.builder()
                .set(ATTR_PROJECT_ID, "proj-1")
                .build();

        assertThrows(InvalidAttributeValueException.class, () -> organizations.create(desired));
        assertEquals(0, client.calls("createOrganization"));
    }

    @Test
    void createOrganizationFailure() {
        client.failOn("createOrganization", 409);

        ScfLifecycleException e = assertThrows(ScfLifecycleException.class, () -> organizations.create(ScfState.builder()
                .set(ATTR_PROJECT_ID, "proj-1")
                .set(ATTR_NAME, "acme")
                .build()));

        assertEquals("create", e.getOperation());
        assertNull(e.getGroup());
    }

    @Test
    void dependentGroupFailureKeepsOrganization() {
        client.failOn("applyOrganizationQuota", 400);

        ScfLifecycleException e = assertThrows(ScfLifecycleException.class, () -> organizations.create(ScfState.builder()
                .set(ATTR_PROJECT_ID, "proj-1")
                .set(ATTR_NAME, "acme")
                .set(ATTR_QUOTA_ID, "unknown")
                .build()));

        assertEquals(GROUP_QUOTA, e.getGroup());
        assertEquals(1, client.organizations.size());
        // The orphan can be adopted instead of created twice
        assertEquals("proj-1,org-1", e.getHandle().toString());
        assertEquals("org-1", e.getState().getString(ATTR_ORG_ID));
        assertTrue(e.getMessage().contains("proj-1,org-1"));
        assertEquals(LifecycleResult.Kind.PRESENT, organizations.read(e.getHandle()).getKind());
    }

    @Test
    void readPresent() {
        client.addOrganization("proj-1", "org-9", "acme");

        LifecycleResult result = organizations.read(ResourceHandle.decode("proj-1,org-9"));

        assertEquals(LifecycleResult.Kind.PRESENT, result.getKind());
        assertEquals("acme", result.getState().getString(ATTR_NAME));
        assertEquals("eu01", result.getState().getString(ATTR_REGION));
    }

    @Test
    void readRemoved() {
        LifecycleResult result = organizations.read(ResourceHandle.decode("proj-1,org-9"));

        assertEquals(LifecycleResult.Kind.REMOVED, result.getKind());
        assertFalse(result.hasState());
    }

    @Test
    void readFailure() {
        client.addOrganization("proj-1", "org-9", "acme");
        client.failOn("getOrganization", 500);

        ScfLifecycleException e = assertThrows(ScfLifecycleException.class,
                () -> organizations.read(ResourceHandle.decode("proj-1,org-9")));
        assertEquals("read", e.getOperation());
    }

    @Test
    void readWithoutHandle() {
        assertThrows(InvalidAttributeValueException.class, () -> organizations.read(ScfState.empty()));
    }

    @Test
    void update() {
        client.addOrganization("proj-1", "org-9", "acme");
        ScfState observed = organizations.read(ResourceHandle.decode("proj-1,org-9")).getState();

        LifecycleResult result = organizations.update(observed.toBuilder().set(ATTR_NAME, "acme2").build(), observed);

        assertEquals(LifecycleResult.Kind.UPDATED, result.getKind());
        assertEquals("acme2", result.getState().getString(ATTR_NAME));
        assertEquals(1, client.calls("updateOrganization"));
    }

    @Test
    void updateWithoutHandle() {
        assertThrows(InvalidAttributeValueException.class,
                () -> organizations.update(ScfState.builder().set(ATTR_NAME, "acme").build(), ScfState.empty()));
    }

    @Test
    void deleteIsIdempotent() {
        client.addOrganization("proj-1", "org-9", "acme");
        ResourceHandle handle = ResourceHandle.decode("proj-1,org-9");

        assertEquals(LifecycleResult.Kind.DELETED, organizations.delete(handle).getKind());
        assertTrue(client.organizations.isEmpty());

        assertEquals(LifecycleResult.Kind.DELETED, organizations.delete(handle).getKind());
        assertEquals(2, client.calls("deleteOrganization"));
    }

    @Test
    void deleteFailure() {
        client.addOrganization("proj-1", "org-9", "acme");
        client.failOn("deleteOrganization", 500);

        assertThrows(ScfLifecycleException.class, () -> organizations.delete(ResourceHandle.decode("proj-1,org-9")));
    }

    @Test
    void importByHandle() {
        client.addOrganization("proj-1", "org-9", "acme");

        LifecycleResult result = organizations.importResource("proj-1,org-9", null);

        assertEquals(LifecycleResult.Kind.PRESENT, result.getKind());
        assertEquals("proj-1,org-9", result.getState().getHandle().toString());
    }

    @Test
    void importByResourceId() {
        client.addOrganization("proj-1", "org-9", "acme");

        LifecycleResult result = organizations.importResource("org-9", "proj-1");

        assertEquals("proj-1,org-9", result.getState().getHandle().toString());
        assertEquals("acme", result.getState().getString(ATTR_NAME));
    }

    @Test
    void importErrors() {
        assertThrows(InvalidImportFormatException.class, () -> organizations.importResource("org-9", null));
        assertThrows(MalformedHandleException.class, () -> organizations.importResource("proj-1,", null));

        ScfLifecycleException e = assertThrows(ScfLifecycleException.class,
                () -> organizations.importResource("proj-1,org-9", null));
        assertEquals("import", e.getOperation());
        assertTrue(e.getMessage().contains("non-existent"));
    }

    @Test
    void createManagerKeepsPassword() {
        client.addOrganization("proj-1", "org-9", "acme");

        LifecycleResult created = managers.create(ScfState.builder()
                .set(ScfOrganizationManagerType.ATTR_PROJECT_ID, "proj-1")
                .set(ScfOrganizationManagerType.ATTR_ORG_ID, "org-9")
                .build());

        ScfState state = created.getState();
        assertEquals("proj-1,org-9", state.getHandle().toString());
        assertEquals("manager-org-9", state.getString(ScfOrganizationManagerType.ATTR_USERNAME));
        assertEquals("generated-" + state.getString(ScfOrganizationManagerType.ATTR_USER_ID),
                state.getString(ScfOrganizationManagerType.ATTR_PASSWORD));

        // The password is never returned again
        LifecycleResult refreshed = managers.read(state);
        assertEquals(state.getString(ScfOrganizationManagerType.ATTR_PASSWORD),
                refreshed.getState().getString(ScfOrganizationManagerType.ATTR_PASSWORD));
        assertFalse(managers.read(state.getHandle()).getState().isSet(ScfOrganizationManagerType.ATTR_PASSWORD));
    }

    @Test
    void managerIsImmutable() {
        client.addOrganization("proj-1", "org-9", "acme");
        ScfState state = managers.create(ScfState.builder()
                .set(ScfOrganizationManagerType.ATTR_PROJECT_ID, "proj-1")
                .set(ScfOrganizationManagerType.ATTR_ORG_ID, "org-9")
                .build()).getState();

        ScfLifecycleException e = assertThrows(ScfLifecycleException.class,
                () -> managers.update(state.toBuilder().set(ScfOrganizationManagerType.ATTR_USERNAME, "other").build(), state));
        assertTrue(e.getMessage().contains("update not supported"));
        assertEquals(1, client.calls("getOrgManager"));
    }

    @Test
    void createManagerWithoutOrganization() {
        assertThrows(InvalidAttributeValueException.class, () -> managers.create(ScfState.builder()
                .set(ScfOrganizationManagerType.ATTR_PROJECT_ID, "proj-1")
                .build()));

        ScfLifecycleException e = assertThrows(ScfLifecycleException.class, () -> managers.create(ScfState.builder()
                .set(ScfOrganizationManagerType.ATTR_PROJECT_ID, "proj-1")
                .set(ScfOrganizationManagerType.ATTR_ORG_ID, "org-404")
                .build()));
        assertTrue(managers.isNotFound(e.getCause()));
    }

    @Test
    void platformIsReadOnly() {
        client.addPlatform("proj-1", "pf-1", "Cloud Foundry");
        ResourceHandle handle = ResourceHandle.decode("proj-1,pf-1");

        LifecycleResult result = platforms.read(handle);
        assertEquals("Cloud Foundry", result.getState().getString(ScfPlatformType.ATTR_DISPLAY_NAME));
        assertEquals("https://api.pf-1.example.com", result.getState().getString(ScfPlatformType.ATTR_API_URL));

        assertFalse(platforms.getDescriptor().isCreatable());
        assertFalse(platforms.getDescriptor().isUpdatable());
        assertFalse(platforms.getDescriptor().isDeletable());
        assertThrows(ScfLifecycleException.class,
                () -> platforms.create(ScfState.builder().set(ScfPlatformType.ATTR_PROJECT_ID, "proj-1").build()));
        assertThrows(ScfLifecycleException.class, () -> platforms.update(result.getState(), result.getState()));
        assertThrows(ScfLifecycleException.class, () -> platforms.delete(handle));
    }
}
