/*
 * This file is part of Bisq.
 *
 * Bisq is free software: you can redistribute it and/or modify it
 * under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or (at
 * your option) any later version.
 *
 * Bisq is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public
 * License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with Bisq. If not, see <http://www.gnu.org/licenses/>.
 */

package hkdp.core.app;

import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.ResourcePropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;

import java.util.HashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

/**
 * Property lookup in the order: explicit overrides, system properties, environment variables, then the bundled
 * dao.properties defaults.
 */
@Slf4j
public class DaoEnvironment extends StandardEnvironment {
    static final String DEFAULT_PROPERTIES_RESOURCE = "dao.properties";
    static final String OVERRIDES_PROPERTY_SOURCE_NAME = "daoOverrides";
    static final String DEFAULTS_PROPERTY_SOURCE_NAME = "daoDefaults";

    public DaoEnvironment() {
        this(new HashMap<>());
    }

    public DaoEnvironment(Map<String, ?> overrides) {
        MutablePropertySources propertySources = getPropertySources();
        propertySources.addFirst(new MapPropertySource(OVERRIDES_PROPERTY_SOURCE_NAME,
                new HashMap<String, Object>(overrides)));
        propertySources.addLast(getDefaultProperties());
    }

    private static ResourcePropertySource getDefaultProperties() {
        try {
            return new ResourcePropertySource(DEFAULTS_PROPERTY_SOURCE_NAME,
                    new ClassPathResource(DEFAULT_PROPERTIES_RESOURCE));
        } catch (IOException e) {
            log.error("Could not load {}", DEFAULT_PROPERTIES_RESOURCE, e);
            throw new UncheckedIOException(e);
        }
    }
}
