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

package dynlink.signal;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Behaviours a link between a {@link Signal} and a {@link Callback} can carry.
 */
public enum ConnectFlag {

	/**
	 * Queue the invocation instead of running it during emission. Queued calls run when the host flushes them.
	 */
	DEFERRED,

	/**
	 * Unwire the link after its first firing.
	 */
	ONE_SHOT,

	/**
	 * Allow the same pair to be wired several times. Each connect increments a counter and each disconnect decrements
	 * it; the link goes away when the counter reaches zero.
	 */
	REFERENCE_COUNTED;

	/**
	 * @return an empty, mutable set of flags
	 */
	public static EnumSet<ConnectFlag> none() {
		return EnumSet.noneOf(ConnectFlag.class);
	}

	/**
	 * Copy {@code flags} into a read-only set, treating {@code null} as no flags.
	 *
	 * @param flags the flags to copy
	 * @return an unmodifiable snapshot
	 */
	public static Set<ConnectFlag> snapshot(Set<ConnectFlag> flags) {
		if (null == flags || flags.isEmpty()) {
			return Collections.unmodifiableSet(none());
		}
		return Collections.unmodifiableSet(EnumSet.copyOf(flags));
	}

}
