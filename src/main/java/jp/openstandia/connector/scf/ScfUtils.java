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
import org.identityconnectors.framework.common.objects.AttributeDelta;
import org.identityconnectors.framework.common.objects.AttributeInfo;
import org.identityconnectors.framework.common.objects.OperationOptions;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ScfUtils {

    private ScfUtils() {
    }

    /**
     * Create full set of ATTRIBUTES_TO_GET which is composed by RETURN_DEFAULT_ATTRIBUTES + ATTRIBUTES_TO_GET.
     *
     * @param schema
     * @param options
     * @return
     */
    public static Set<String> createFullAttributesToGet(Map<String, AttributeInfo> schema, OperationOptions options) {
        Set<String> attributesToGet = new HashSet<>();
        if (shouldReturnDefaultAttributes(options)) {
            attributesToGet.addAll(toReturnedByDefaultAttributesSet(schema));
        }
        if (options != null && options.getAttributesToGet() != null) {
            attributesToGet.addAll(Arrays.asList(options.getAttributesToGet()));
        }
        return attributesToGet;
    }

    private static boolean shouldReturnDefaultAttributes(OperationOptions options) {
        if (options == null || options.getAttributesToGet() == null) {
            return true;
        }
        return Boolean.TRUE.equals(options.getReturnDefaultAttributes());
    }

    private static Set<String> toReturnedByDefaultAttributesSet(Map<String, AttributeInfo> schema) {
        Set<String> names = new HashSet<>();
        for (Map.Entry<String, AttributeInfo> entry : schema.entrySet()) {
            if (entry.getValue().isReturnedByDefault()) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    public static boolean shouldReturn(Set<String> attrsToGetSet, String attr) {
        return attrsToGetSet.contains(attr);
    }

    /**
     * Return the single replacement value of a delta.
     *
     * @param delta
     * @return
     * @throws InvalidAttributeValueException if the delta clears the attribute or isn't a single replacement
     */
    public static Object toResourceValue(AttributeDelta delta) {
        List<Object> values = delta.getValuesToReplace();
        if (values == null) {
            throw new InvalidAttributeValueException(String.format("Only replacement of '%s' is supported", delta.getName()));
        }
        if (values.isEmpty() || values.get(0) == null) {
            // Unset and cleared are different things to the SCF API
            throw new InvalidAttributeValueException(String.format("Clearing '%s' is not supported", delta.getName()));
        }
        if (values.size() > 1) {
            throw new InvalidAttributeValueException(String.format("'%s' is single-valued", delta.getName()));
        }
        return values.get(0);
    }
}
