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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dynlink.signal.ConnectFlag;

/**
 * An encapsulation of the configuration for dynlink. Values are parsed from the raw properties on access; a value that
 * cannot be parsed is logged and replaced by its default.
 */
public class DynlinkConfiguration {

	public static final String PROPERTY_TRACE_EMISSIONS      = "dynlink.bus.traceEmissions";
	public static final String PROPERTY_MAX_DEFERRED_PASSES  = "dynlink.bus.maxDeferredPasses";
	public static final String PROPERTY_DEFAULT_FLAGS        = "dynlink.connection.defaultFlags";

	public static final int DEFAULT_MAX_DEFERRED_PASSES = 8;

	private static final Logger log = LoggerFactory.getLogger(DynlinkConfiguration.class);

	private final Properties properties;

	public DynlinkConfiguration(Properties properties) {
		this.properties = new Properties();
		if (null != properties) {
			this.properties.putAll(properties);
		}
	}

	/**
	 * @return whether buses log every emission and wiring change
	 */
	public boolean isTraceEmissions() {
		return Boolean.parseBoolean(properties.getProperty(PROPERTY_TRACE_EMISSIONS, "false").trim());
	}

	/**
	 * @return how many passes a deferred flush may take before leaving calls queued
	 */
	public int getMaxDeferredPasses() {
		String value = properties.getProperty(PROPERTY_MAX_DEFERRED_PASSES);
		if (null == value) {
			return DEFAULT_MAX_DEFERRED_PASSES;
		}
		try {
			int passes = Integer.parseInt(value.trim());
			if (passes > 0) {
				return passes;
			}
			log.warn("'{}' must be positive, was {}; using {}", PROPERTY_MAX_DEFERRED_PASSES, passes,
			  DEFAULT_MAX_DEFERRED_PASSES);
		} catch (NumberFormatException e) {
			log.warn("'{}' is not a number: '{}'; using {}", PROPERTY_MAX_DEFERRED_PASSES, value,
			  DEFAULT_MAX_DEFERRED_PASSES);
		}
		return DEFAULT_MAX_DEFERRED_PASSES;
	}

	/**
	 * @return the flags new dynamic connections start with
	 */
	public Set<ConnectFlag> getDefaultConnectFlags() {
		EnumSet<ConnectFlag> flags = ConnectFlag.none();
		String value = properties.getProperty(PROPERTY_DEFAULT_FLAGS, "");
		for (String name : value.split(",")) {
			String flag = name.trim();
			if (flag.isEmpty()) {
				continue;
			}
			try {
				flags.add(ConnectFlag.valueOf(flag.toUpperCase(Locale.ROOT)));
			} catch (IllegalArgumentException e) {
				log.warn("The connect flag '{}' in '{}' is not recognized", flag, PROPERTY_DEFAULT_FLAGS);
			}
		}
		return flags;
	}

	/**
	 * @return a copy of the raw configuration properties
	 */
	public Properties getProperties() {
		Properties copy = new Properties();
		copy.putAll(properties);
		return copy;
	}

}
