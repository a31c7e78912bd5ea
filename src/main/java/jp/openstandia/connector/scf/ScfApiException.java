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

import org.identityconnectors.framework.common.exceptions.ConnectorIOException;

/**
 * Failure of a SCF REST API call.
 * <p>
 * Carries the HTTP status of the response, or 0 when the call failed before a response arrived.
 */
public class ScfApiException extends ConnectorIOException {

    public static final int NO_RESPONSE = 0;

    private final int statusCode;
    private final String responseBody;

    public ScfApiException(String message, int statusCode, String responseBody) {
        super(responseBody == null ? String.format("%s, statusCode: %d", message, statusCode)
                : String.format("%s, statusCode: %d, response: %s", message, statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public ScfApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
