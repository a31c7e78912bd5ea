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

import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.objects.*;
import org.identityconnectors.framework.common.objects.filter.AbstractFilterTranslator;
import org.identityconnectors.framework.common.objects.filter.EqualsFilter;

public class ScfFilterTranslator extends AbstractFilterTranslator<ScfFilter> {

    private static final Log LOG = Log.getLog(ScfFilterTranslator.class);

    private final ObjectClass objectClass;

    public ScfFilterTranslator(ObjectClass objectClass) {
        this.objectClass = objectClass;
    }

    @Override
    protected ScfFilter createEqualsExpression(EqualsFilter filter, boolean not) {
        if (not) { // no way (natively) to search for "NotEquals"
            return null;
        }
        Attribute attr = filter.getAttribute();

        if (attr instanceof Uid) {
            Uid uid = (Uid) attr;
            return new ScfFilter(uid.getName(),
                    ScfFilter.FilterType.EXACT_MATCH,
                    uid.getUidValue());
        }
        if (attr instanceof Name) {
            Name name = (Name) attr;
            return new ScfFilter(name.getName(),
                    ScfFilter.FilterType.EXACT_MATCH,
                    name.getNameValue());
        }

        // SCF doesn't support searching by other attributes
        LOG.ok("Unsupported filter attribute {0} of {1}", attr.getName(), objectClass);
        return null;
    }
}
