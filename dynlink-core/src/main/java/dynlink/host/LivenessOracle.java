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

package dynlink.host;

import javax.annotation.Nullable;

import dynlink.signal.Callback;
import dynlink.signal.Signal;

/**
 * Answers whether host objects are still alive, and derives from that whether signals and callbacks can be used.
 */
public interface LivenessOracle {

	/**
	 * @param object a host object
	 * @return {@literal true} if {@code object} is non-null and has not been freed
	 */
	boolean isAlive(@Nullable Object object);

	/**
	 * @param signal a signal, may be {@code null}
	 * @return {@literal true} if {@code signal} is non-null and its owner is alive
	 */
	default boolean hasLiveOwner(@Nullable Signal signal) {
		return null != signal && isAlive(signal.getOwner());
	}

	/**
	 * @param callback a callback, may be {@code null}
	 * @return {@literal true} if {@code callback} is non-null and either has no receiver or a live one
	 */
	default boolean isInvokable(@Nullable Callback callback) {
		return null != callback && (null == callback.getReceiver() || isAlive(callback.getReceiver()));
	}

}
