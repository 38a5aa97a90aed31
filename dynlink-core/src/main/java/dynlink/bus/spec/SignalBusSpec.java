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

package dynlink.bus.spec;

import dynlink.bus.SignalBus;
import dynlink.configuration.DynlinkConfiguration;
import dynlink.configuration.PropertiesConfigurationReader;
import dynlink.fn.Consumer;
import dynlink.fn.Supplier;
import dynlink.support.Assert;

/**
 * A helper class for configuring a new {@link SignalBus}. Anything not set explicitly is taken from the
 * {@link DynlinkConfiguration}, which is read from the classpath and system properties unless one is given.
 */
public final class SignalBusSpec implements Supplier<SignalBus> {

	private DynlinkConfiguration configuration;
	private Consumer<Throwable>  errorHandler;
	private Boolean              traceEmissions;
	private Integer              maxDeferredPasses;

	/**
	 * Configures the configuration the unset options fall back to.
	 *
	 * @param configuration the configuration to use
	 * @return {@code this}
	 */
	public SignalBusSpec configuration(DynlinkConfiguration configuration) {
		Assert.notNull(configuration, "Configuration cannot be null.");
		this.configuration = configuration;
		return this;
	}

	/**
	 * Configures the handler for exceptions thrown by callbacks. By default they are logged.
	 *
	 * @param errorHandler the error handler for callback errors
	 * @return {@code this}
	 */
	public SignalBusSpec errorHandler(Consumer<Throwable> errorHandler) {
		this.errorHandler = errorHandler;
		return this;
	}

	/**
	 * Configures the bus to log every emission and wiring change.
	 *
	 * @return {@code this}
	 */
	public SignalBusSpec traceEmissions() {
		return traceEmissions(true);
	}

	/**
	 * Configures the bus to log or not log every emission and wiring change.
	 *
	 * @param b whether to trace or not
	 * @return {@code this}
	 */
	public SignalBusSpec traceEmissions(boolean b) {
		this.traceEmissions = b;
		return this;
	}

	/**
	 * Configures how many passes a single deferred flush may take.
	 *
	 * @param passes a positive number of passes
	 * @return {@code this}
	 */
	public SignalBusSpec maxDeferredPasses(int passes) {
		Assert.isTrue(passes > 0, "Max deferred passes must be positive.");
		this.maxDeferredPasses = passes;
		return this;
	}

	@Override
	public SignalBus get() {
		DynlinkConfiguration config = (null != configuration ? configuration :
		  new PropertiesConfigurationReader().read());
		return new SignalBus(
		  errorHandler,
		  null != traceEmissions ? traceEmissions : config.isTraceEmissions(),
		  null != maxDeferredPasses ? maxDeferredPasses : config.getMaxDeferredPasses()
		);
	}

}
