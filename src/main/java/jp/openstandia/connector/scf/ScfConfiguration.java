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
import org.identityconnectors.common.security.GuardedString;
import org.identityconnectors.framework.common.exceptions.ConfigurationException;
import org.identityconnectors.framework.spi.AbstractConfiguration;
import org.identityconnectors.framework.spi.ConfigurationProperty;

public class ScfConfiguration extends AbstractConfiguration {

    private GuardedString accessToken;
    private String projectId;
    private String region = "eu01";
    private String apiBaseURL = "https://scf.api.stackit.cloud";
    private int connectTimeoutInMilliseconds = 10000; // 10s
    private int readTimeoutInMilliseconds = 30000; // 30s
    private int writeTimeoutInMilliseconds = 30000; // 30s

    private String httpProxyHost;
    private int httpProxyPort;
    private String httpProxyUser;
    private GuardedString httpProxyPassword;

    /**
     * Return base API URL without trailing slash.
     *
     * @return
     */
    public String getScfURL() {
        if (apiBaseURL != null && apiBaseURL.endsWith("/")) {
            return apiBaseURL.substring(0, apiBaseURL.length() - 1);
        }
        return apiBaseURL;
    }

    @ConfigurationProperty(
            order = 1,
            displayMessageKey = "STACKIT Access Token",
            helpMessageKey = "Service account access token for the STACKIT Cloud Foundry API.",
            required = true,
            confidential = true)
    public GuardedString getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(GuardedString accessToken) {
        this.accessToken = accessToken;
    }

    @ConfigurationProperty(
            order = 2,
            displayMessageKey = "STACKIT Project ID",
            helpMessageKey = "Default project for created resources and for imports by a bare resource id.",
            required = false,
            confidential = false)
    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    @ConfigurationProperty(
            order = 3,
            displayMessageKey = "Region",
            helpMessageKey = "STACKIT region of the Cloud Foundry resources. (Default: eu01)",
            required = true,
            confidential = false)
    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    @ConfigurationProperty(
            order = 4,
            displayMessageKey = "API Base URL",
            helpMessageKey = "Base URL of the STACKIT Cloud Foundry API. (Default: https://scf.api.stackit.cloud)",
            required = false,
            confidential = false)
    public String getApiBaseURL() {
        return apiBaseURL;
    }

    public void setApiBaseURL(String apiBaseURL) {
        this.apiBaseURL = apiBaseURL;
    }

    @ConfigurationProperty(
            order = 5,
            displayMessageKey = "Connect Timeout (milliseconds)",
            helpMessageKey = "Connect timeout in milliseconds. (Default: 10000)",
            required = false,
            confidential = false)
    public int getConnectTimeoutInMilliseconds() {
        return connectTimeoutInMilliseconds;
    }

    public void setConnectTimeoutInMilliseconds(int connectTimeoutInMilliseconds) {
        this.connectTimeoutInMilliseconds = connectTimeoutInMilliseconds;
    }

    @ConfigurationProperty(
            order = 6,
            displayMessageKey = "Read Timeout (milliseconds)",
            helpMessageKey = "Read timeout in milliseconds. (Default: 30000)",
            required = false,
            confidential = false)
    public int getReadTimeoutInMilliseconds() {
        return readTimeoutInMilliseconds;
    }

    public void setReadTimeoutInMilliseconds(int readTimeoutInMilliseconds) {
        this.readTimeoutInMilliseconds = readTimeoutInMilliseconds;
    }

    @ConfigurationProperty(
            order = 7,
            displayMessageKey = "Write Timeout (milliseconds)",
            helpMessageKey = "Write timeout in milliseconds. (Default: 30000)",
            required = false,
            confidential = false)
    public int getWriteTimeoutInMilliseconds() {
        return writeTimeoutInMilliseconds;
    }

    public void setWriteTimeoutInMilliseconds(int writeTimeoutInMilliseconds) {
        this.writeTimeoutInMilliseconds = writeTimeoutInMilliseconds;
    }

    @ConfigurationProperty(
            order = 8,
            displayMessageKey = "HTTP Proxy Host",
            helpMessageKey = "Hostname for the HTTP Proxy",
            required = false,
            confidential = false)
    public String getHttpProxyHost() {
        return httpProxyHost;
    }

    public void setHttpProxyHost(String httpProxyHost) {
        this.httpProxyHost = httpProxyHost;
    }

    @ConfigurationProperty(
            order = 9,
            displayMessageKey = "HTTP Proxy Port",
            helpMessageKey = "Port for the HTTP Proxy",
            required = false,
            confidential = false)
    public int getHttpProxyPort() {
        return httpProxyPort;
    }

    public void setHttpProxyPort(int httpProxyPort) {
        this.httpProxyPort = httpProxyPort;
    }

    @ConfigurationProperty(
            order = 10,
            displayMessageKey = "HTTP Proxy User",
            helpMessageKey = "Username for the HTTP Proxy Authentication",
            required = false,
            confidential = false)
    public String getHttpProxyUser() {
        return httpProxyUser;
    }

    public void setHttpProxyUser(String httpProxyUser) {
        this.httpProxyUser = httpProxyUser;
    }

    @ConfigurationProperty(
            order = 11,
            displayMessageKey = "HTTP Proxy Password",
            helpMessageKey = "Password for the HTTP Proxy Authentication",
            required = false,
            confidential = true)
    public GuardedString getHttpProxyPassword() {
        return httpProxyPassword;
    }

    public void setHttpProxyPassword(GuardedString httpProxyPassword) {
        this.httpProxyPassword = httpProxyPassword;
    }

    @Override
    public void validate() {
        if (accessToken == null) {
            throw new ConfigurationException("Access token is required");
        }
        if (StringUtil.isBlank(region)) {
            throw new ConfigurationException("Region is required");
        }
        if (StringUtil.isBlank(apiBaseURL)) {
            throw new ConfigurationException("API base URL is required");
        }
        // The project id ends up in resource handles
        if (projectId != null && projectId.contains(ResourceHandle.SEPARATOR)) {
            throw new ConfigurationException("Project ID must not contain '" + ResourceHandle.SEPARATOR + "'");
        }
    }
}
