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

import java.util.function.Function;

/**
 * One row of a resource type's field mapping table: a state attribute and how to read it from the response.
 *
 * @param <R> remote response type
 */
public final class FieldMapping<R> {

    private final String name;
    private final Class<?> type;
    private final Function<R, ?> extractor;
    private final boolean required;
    private final String description;

    FieldMapping(String name, Class<?> type, Function<R, ?> extractor, boolean required, String description) {
        this.name = name;
        this.type = type;
        this.extractor = extractor;
        this.required = required;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    /**
     * @return type of the state value, timestamps are held as String
     */
    public Class<?> getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }

    Object extract(R response) {
        return extractor.apply(response);
    }

    @Override
    public String toString() {
        return name;
    }
}
