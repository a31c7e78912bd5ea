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
 * Decides the lifecycle disposition of a failed remote call.
 */
public class ScfErrorClassifier {

    public enum Outcome {
        /**
         * The remote resource does not exist (anymore).
         */
        NOT_FOUND,
        /**
         * Reserved for transport collaborators which retry on their own.
         * The classifier never returns it because the engine doesn't retry.
         */
        TRANSIENT,
        FATAL
    }

    public Outcome classify(Throwable error) {
        if (error instanceof ScfApiException && ((ScfApiException) error).isNotFound()) {
            return Outcome.NOT_FOUND;
        }
        return Outcome.FATAL;
    }

    public boolean isNotFound(Throwable error) {
        return classify(error) == Outcome.NOT_FOUND;
    }
}
