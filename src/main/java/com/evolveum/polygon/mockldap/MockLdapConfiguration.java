/*
 * Copyright (c) 2026 Evolveum
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.evolveum.polygon.mockldap;

import org.apache.commons.lang3.StringUtils;
import org.identityconnectors.framework.common.exceptions.ConfigurationException;
import org.identityconnectors.framework.spi.AbstractConfiguration;
import org.identityconnectors.framework.spi.ConfigurationProperty;

/**
 * Configuration of the emulated connection.
 * The defaults reproduce a plain OpenLDAP-style server, most tests never need to touch this.
 */
public class MockLdapConfiguration extends AbstractConfiguration {

    /**
     * Attribute holding credentials. Bind, compare and search filters verify this attribute through
     * the password schemes instead of comparing it literally.
     */
    private String passwordAttribute = MockLdapConstants.ATTRIBUTE_USER_PASSWORD_NAME;

    /**
     * Enables verification of <code>{CRYPT}</code> values. If disabled, such values never match,
     * which is what happens with a client platform that has no crypt(3).
     */
    private boolean cryptSchemeEnabled = true;

    /**
     * Filter used by searches that do not specify any.
     */
    private String defaultSearchFilter = MockLdapConstants.DEFAULT_SEARCH_FILTER;

    @ConfigurationProperty(order = 1)
    public String getPasswordAttribute() {
        return passwordAttribute;
    }

    public void setPasswordAttribute(String passwordAttribute) {
        this.passwordAttribute = passwordAttribute;
    }

    @ConfigurationProperty(order = 2)
    public boolean isCryptSchemeEnabled() {
        return cryptSchemeEnabled;
    }

    public void setCryptSchemeEnabled(boolean cryptSchemeEnabled) {
        this.cryptSchemeEnabled = cryptSchemeEnabled;
    }

    @ConfigurationProperty(order = 3)
    public String getDefaultSearchFilter() {
        return defaultSearchFilter;
    }

    public void setDefaultSearchFilter(String defaultSearchFilter) {
        this.defaultSearchFilter = defaultSearchFilter;
    }

    @Override
    public void validate() {
        if (StringUtils.isBlank(passwordAttribute)) {
            throw new ConfigurationException("Password attribute must not be blank");
        }
        if (StringUtils.isBlank(defaultSearchFilter)) {
            throw new ConfigurationException("Default search filter must not be blank");
        }
    }
}
