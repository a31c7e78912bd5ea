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

/**
 * Where the scope fragment of the handle comes from when a response is mapped.
 */
public enum ScopeSource {
    /**
     * Always the scope already known locally, the response value is ignored.
     */
    STATE,
    /**
     * The scope reported by the response, or the locally known one when the response omits it.
     */
    RESPONSE
}
