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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;

/**
 * Remote client of the STACKIT Cloud Foundry API.
 * <p>
 * Every call is blocking. Failures are reported as {@link ScfApiException}, whose status 404
 * means the addressed resource doesn't exist.
 */
public interface ScfClient {

    void test();

    void close();

    default String getOrganizationsEndpointURL(ScfConfiguration configuration, String projectId, String region) {
        String url = configuration.getScfURL();
        return String.format("%s/v1/projects/%s/regions/%s/organizations", url, projectId, region);
    }

    default String getOrganizationEndpointURL(ScfConfiguration configuration, String projectId, String region, String orgId) {
        return String.format("%s/%s", getOrganizationsEndpointURL(configuration, projectId, region), orgId);
    }

    default String getOrganizationQuotaEndpointURL(ScfConfiguration configuration, String projectId, String region, String orgId) {
        return String.format("%s/quota", getOrganizationEndpointURL(configuration, projectId, region, orgId));
    }

    default String getOrgManagerEndpointURL(ScfConfiguration configuration, String projectId, String region, String orgId) {
        return String.format("%s/manager", getOrganizationEndpointURL(configuration, projectId, region, orgId));
    }

    default String getPlatformEndpointURL(ScfConfiguration configuration, String projectId, String region, String platformId) {
        String url = configuration.getScfURL();
        return String.format("%s/v1/projects/%s/regions/%s/platforms/%s", url, projectId, region, platformId);
    }

    // Organization

    /**
     * @return the created organization, at least its guid
     */
    ScfOrganizationRepresentation createOrganization(String projectId, String region, ScfCreateOrganizationOperation operation);

    ScfOrganizationRepresentation getOrganization(String projectId, String region, String orgId);

    ScfOrganizationRepresentation updateOrganization(String projectId, String region, String orgId, ScfUpdateOrganizationOperation operation);

    ScfOrganizationRepresentation applyOrganizationQuota(String projectId, String region, String orgId, ScfApplyQuotaOperation operation);

    void deleteOrganization(String projectId, String region, String orgId);

    // Organization manager

    /**
     * @return the created manager including the generated password, which is never returned again
     */
    ScfOrgManagerRepresentation createOrgManager(String projectId, String region, String orgId);

    ScfOrgManagerRepresentation getOrgManager(String projectId, String region, String orgId);

    void deleteOrgManager(String projectId, String region, String orgId);

    // Platform

    ScfPlatformRepresentation getPlatform(String projectId, String region, String platformId);

    // JSON Representation

    @JsonInclude(JsonInclude.Include.NON_NULL)
    class ScfCreateOrganizationOperation {
        public String name;
        public String platformId;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    class ScfUpdateOrganizationOperation {
        public String name;
        public Boolean suspended;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    class ScfApplyQuotaOperation {
        public String quotaId;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    class ScfOrganizationRepresentation {
        public String guid;
        public String name;
        public String platformId;
        public String projectId;
        public String quotaId;
        public String region;
        public String status;
        public Boolean suspended;
        public OffsetDateTime createdAt;
        public OffsetDateTime updatedAt;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    class ScfOrgManagerRepresentation {
        public String guid;
        public String orgId;
        public String platformId;
        public String projectId;
        public String region;
        public String username;
        public String password;
        public OffsetDateTime createdAt;
        public OffsetDateTime updatedAt;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    class ScfPlatformRepresentation {
        public String guid;
        public String systemId;
        public String displayName;
        public String region;
        public String apiUrl;
        public String consoleUrl;
    }
}
