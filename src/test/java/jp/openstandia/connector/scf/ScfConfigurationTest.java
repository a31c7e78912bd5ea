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

import org.identityconnectors.common.security.GuardedString;
import org.identityconnectors.framework.common.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScfConfigurationTest {

    private ScfConfiguration newConfiguration() {
        ScfConfiguration conf = new ScfConfiguration();
        conf.setAccessToken(new GuardedString("dummy".toCharArray()));
        return conf;
    }

    @Test
    void defaults() {
        ScfConfiguration conf = newConfiguration();
        conf.validate();

        assertEquals("eu01", conf.getRegion());
        assertEquals("https://scf.api.stackit.cloud", conf.getScfURL());
    }

    @Test
    void trailingSlashIsRemoved() {
        ScfConfiguration conf = newConfiguration();
        conf.setApiBaseURL("https://scf.api.example.com/");

        assertEquals("https://scf.api.example.com", conf.getScfURL());
    }

    @Test
    void invalidConfiguration() {
        ScfConfiguration conf = new ScfConfiguration();
        assertThrows(ConfigurationException.class, conf::validate);

        ScfConfiguration noRegion = newConfiguration();
        noRegion.setRegion(" ");
        assertThrows(ConfigurationException.class, noRegion::validate);

        ScfConfiguration badProject = newConfiguration();
        badProject.setProjectId("proj,1");
        assertThrows(ConfigurationException.class, badProject::validate);
    }
}
