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

import dynlink.support.Assert;

/**
 * A named event-emission point owned by some object. Signals compare equal when they share the same owner
 * instance and the same name, so any two {@code Signal.of(button, "pressed")} calls denote the same signal.
 */
public final class Signal {

	private final Object owner;
	private final String name;

	private Signal(Object owner, String name) {
		this.owner = owner;
		this.name = name;
	}

	/**
	 * Create a signal named {@code name} owned by {@code owner}.
	 *
	 * @param owner the object emitting the signal
	 * @param name  the signal name
	 * @return a new {@literal Signal}
	 */
	public static Signal of(Object owner, String name) {
		Assert.notNull(owner, "Signal owner cannot be null.");
		Assert.isTrue(null != name && !name.isEmpty(), "Signal name cannot be empty.");
		return new Signal(owner, name);
	}

	public Object getOwner() {
		return owner;
	}

	public String getName() {
		return name;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Signal)) {
			return false;
		}
		Signal that = (Signal) o;
		return owner == that.owner && name.equals(that.name);
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode(owner) + name.hashCode();
	}

	@Override
	public String toString() {
		return owner.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(owner)) +
		  "::" + name;
	}

}
