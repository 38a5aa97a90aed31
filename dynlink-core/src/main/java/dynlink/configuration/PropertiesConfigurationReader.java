/*
 * Copyright (c) 2026 The dynlink Authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package dynlink.configuration;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ConfigurationReader} that reads the configuration from properties files
 * and System properties.
 */
public class PropertiesConfigurationReader implements ConfigurationReader {

	private static final String FORMAT_RESOURCE_NAME = "/META-INF/dynlink/%s.properties";

	private static final String PROPERTY_PREFIX_DYNLINK = "dynlink.";

	private static final String PROPERTY_NAME_PROFILES_ACTIVE  = "dynlink.profiles.active";
	private static final String PROPERTY_NAME_PROFILES_DEFAULT = "dynlink.profiles.default";

	private final Logger logger = LoggerFactory.getLogger(getClass());

	private final String defaultProfileNameDefault;

	/**
	 * Creates a new {@code PropertiesConfigurationReader} that, by default, will load its
	 * configuration from {@code META-INF/dynlink/default.properties}.
	 */
	public PropertiesConfigurationReader() {
		this("default");
	}

	public PropertiesConfigurationReader(String defaultProfileNameDefault) {
		this.defaultProfileNameDefault = defaultProfileNameDefault;
	}

	@Override
	public DynlinkConfiguration read() {
		Properties configuration = new Properties();

		configuration.putAll(loadDefaultProfile());

		for (Properties activeProfile : loadActiveProfiles()) {
			configuration.putAll(activeProfile);
		}

		applySystemProperties(configuration);

		return new DynlinkConfiguration(configuration);
	}

	private Properties loadDefaultProfile() {
		String defaultProfileName = System.getProperty(PROPERTY_NAME_PROFILES_DEFAULT, defaultProfileNameDefault);
		return loadProfile(defaultProfileName);
	}

	private List<Properties> loadActiveProfiles() {
		List<Properties> activeProfiles = new ArrayList<Properties>();
		String active = System.getProperty(PROPERTY_NAME_PROFILES_ACTIVE);
		if (null != active) {
			for (String profileName : active.split(",")) {
				if (!profileName.trim().isEmpty()) {
					activeProfiles.add(loadProfile(profileName.trim()));
				}
			}
		}
		return activeProfiles;
	}

	private void applySystemProperties(Properties configuration) {
		for (String prop : System.getProperties().stringPropertyNames()) {
			if (prop.startsWith(PROPERTY_PREFIX_DYNLINK)) {
				configuration.put(prop, System.getProperty(prop));
			}
		}
	}

	protected Properties loadProfile(String name) {
		Properties properties = new Properties();
		String resourceName = String.format(FORMAT_RESOURCE_NAME, name);
		InputStream inputStream = getClass().getResourceAsStream(resourceName);
		if (null == inputStream) {
			logger.debug("No properties file found in the classpath at '{}' for profile '{}'", resourceName, name);
			return properties;
		}
		try {
			properties.load(inputStream);
		} catch (IOException e) {
			logger.error("Failed to load properties from '{}' for profile '{}'", resourceName, name, e);
		} finally {
			try {
				inputStream.close();
			} catch (IOException e) {
				logger.debug("Failed to close '{}'", resourceName, e);
			}
		}
		return properties;
	}

}
