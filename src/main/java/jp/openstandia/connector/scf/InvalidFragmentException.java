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

/**
 * A handle fragment is empty or contains the handle separator.
 */
public class InvalidFragmentException extends InvalidAttributeValueException {

    private final String fragmentName;

    public InvalidFragmentException(String fragmentName, String value, String reason) {
        super(String.format("Invalid %s '%s': %s", fragmentName, value, reason));
        this.fragmentName = fragmentName;
    }

    public String getFragmentName() {
        return fragmentName;
    }
}
