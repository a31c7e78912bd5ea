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
package jp.openstandia.connector.scf.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jp.openstandia.connector.scf.ScfApiException;
import jp.openstandia.connector.scf.ScfClient;
import jp.openstandia.connector.scf.ScfConfiguration;
import okhttp3.*;
import org.identityconnectors.common.StringUtil;
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.exceptions.ConnectionFailedException;
import org.identityconnectors.framework.common.exceptions.ConnectorIOException;

import java.io.IOException;

public class ScfRESTClient implements ScfClient {

    private static final Log LOG = Log.getLog(ScfRESTClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE, false);

    private static final MediaType JSON = MediaType.parse("application/json; charset=UTF-8");

    private final String instanceName;
    private final ScfConfiguration configuration;
    private final OkHttpClient httpClient;

    public ScfRESTClient(String instanceName, ScfConfiguration configuration, OkHttpClient httpClient) {
        this.instanceName = instanceName;
        this.configuration = configuration;
        this.httpClient = httpClient;
    }

    @Override
    public void test() {
        if (StringUtil.isEmpty(configuration.getProjectId())) {
            LOG.info("[{0}] No project configured, skip scf connection test", instanceName);
            return;
        }

        String url = getOrganizationsEndpointURL(configuration, configuration.getProjectId(), configuration.getRegion());
        try (Response response = get(url)) {
            if (response.code() != 200) {
                // Something wrong..
                throw new ConnectionFailedException(String.format("Unexpected scf API response. statusCode: %s, body: %s",
                        response.code(),
                        toBody(response)));
            }

            LOG.info("[{0}] SCF connector's connection test is OK", instanceName);

        } catch (IOException e) {
            throw new ConnectionFailedException("Cannot connect to scf REST API", e);
        }
    }

    @Override
    public void close() {
    }

    // Organization

    @Override
    public ScfOrganizationRepresentation createOrganization(String projectId, String region, ScfCreateOrganizationOperation operation) {
        String url = getOrganizationsEndpointURL(configuration, projectId, region);
        return call(newRequest(url).post(createJsonRequestBody(operation)).build(),
                ScfOrganizationRepresentation.class, "create scf organization " + operation.name);
    }

    @Override
    public ScfOrganizationRepresentation getOrganization(String projectId, String region, String orgId) {
        String url = getOrganizationEndpointURL(configuration, projectId, region, orgId);
        return call(newRequest(url).get().build(),
                ScfOrganizationRepresentation.class, "get scf organization " + orgId);
    }

    @Override
    public ScfOrganizationRepresentation updateOrganization(String projectId, String region, String orgId, ScfUpdateOrganizationOperation operation) {
        String url = getOrganizationEndpointURL(configuration, projectId, region, orgId);
        return call(newRequest(url).patch(createJsonRequestBody(operation)).build(),
                ScfOrganizationRepresentation.class, "update scf organization " + orgId);
    }

    @Override
    public ScfOrganizationRepresentation applyOrganizationQuota(String projectId, String region, String orgId, ScfApplyQuotaOperation operation) {
        String url = getOrganizationQuotaEndpointURL(configuration, projectId, region, orgId);
        return call(newRequest(url).put(createJsonRequestBody(operation)).build(),
                ScfOrganizationRepresentation.class, "apply quota " + operation.quotaId + " to scf organization " + orgId);
    }

    @Override
    public void deleteOrganization(String projectId, String region, String orgId) {
        String url = getOrganizationEndpointURL(configuration, projectId, region, orgId);
        call(newRequest(url).delete().build(), null, "delete scf organization " + orgId);
    }

    // Organization manager

    @Override
    public ScfOrgManagerRepresentation createOrgManager(String projectId, String region, String orgId) {
        String url = getOrgManagerEndpointURL(configuration, projectId, region, orgId);
        return call(newRequest(url).post(RequestBody.create("", JSON)).build(),
                ScfOrgManagerRepresentation.class, "create scf organization manager of " + orgId);
    }

    @Override
    public ScfOrgManagerRepresentation getOrgManager(String projectId, String region, String orgId) {
        String url = getOrgManagerEndpointURL(configuration, projectId, region, orgId);
        return call(newRequest(url).get().build(),
                ScfOrgManagerRepresentation.class, "get scf organization manager of " + orgId);
    }

    @Override
    public void deleteOrgManager(String projectId, String region, String orgId) {
        String url = getOrgManagerEndpointURL(configuration, projectId, region, orgId);
        call(newRequest(url).delete().build(), null, "delete scf organization manager of " + orgId);
    }

    // Platform

    @Override
    public ScfPlatformRepresentation getPlatform(String projectId, String region, String platformId) {
        String url = getPlatformEndpointURL(configuration, projectId, region, platformId);
        return call(newRequest(url).get().build(),
                ScfPlatformRepresentation.class, "get scf platform " + platformId);
    }

    // Utilities

    /**
     * Generic call method. Any 2xx status is a success, everything else is reported with its status code.
     *
     * @param request
     * @param responseType type of the JSON response body, or null to ignore the body
     * @param what         description of the call used in error messages
     * @return the parsed response body, or null
     */
    protected <T> T call(Request request, Class<T> responseType, String what) {
        try (Response response = execute(request)) {
            if (!response.isSuccessful()) {
                throw new ScfApiException("Failed to " + what, response.code(), toBody(response));
            }

            // Success
            if (responseType == null) {
                return null;
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new ConnectorIOException("Empty response body: " + what);
            }
            return MAPPER.readValue(body.byteStream(), responseType);

        } catch (IOException e) {
            throw new ScfApiException("Failed to " + what, e);
        }
    }

    private Request.Builder newRequest(String url) {
        return new Request.Builder().url(url);
    }

    private String toBody(Response response) {
        ResponseBody resBody = response.body();
        if (resBody == null) {
            return null;
        }
        try {
            return resBody.string();
        } catch (IOException e) {
            LOG.error(e, "Unexpected scf REST API response");
            return "<failed_to_parse_response>";
        }
    }

    private RequestBody createJsonRequestBody(Object body) {
        String bodyString;
        try {
            bodyString = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ConnectorIOException("Failed to write request json body", e);
        }

        return RequestBody.create(bodyString, JSON);
    }

    private void throwExceptionIfUnauthorized(Response response) throws ConnectorIOException {
        if (response.code() == 401 || response.code() == 403) {
            String message = response.message();
            response.close();
            throw new ConnectionFailedException("Cannot authenticate to the scf REST API: " + message);
        }
    }

    private Response get(String url) throws IOException {
        return execute(newRequest(url).get().build());
    }

    private Response execute(Request request) throws IOException {
        final Response response = httpClient.newCall(request).execute();

        throwExceptionIfUnauthorized(response);

        return response;
    }
}
