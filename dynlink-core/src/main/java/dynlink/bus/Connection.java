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

package dynlink.bus;

import java.util.Set;

import dynlink.signal.Callback;
import dynlink.signal.ConnectFlag;
import dynlink.signal.Signal;

/**
 * A {@code Connection} is a link between a {@link Signal} and a {@link Callback} that has been wired into a
 * {@link SignalBus}.
 */
public class Connection {

	private final Signal           signal;
	private final Callback         callback;
	private final Set<ConnectFlag> flags;
	private final Runnable         onCancel;

	private int     references = 1;
	private boolean cancelled  = false;

	Connection(Signal signal, Callback callback, Set<ConnectFlag> flags, Runnable onCancel) {
		this.signal = signal;
		this.callback = callback;
		this.flags = ConnectFlag.snapshot(flags);
		this.onCancel = onCancel;
	}

	public Signal getSignal() {
		return signal;
	}

	public Callback getCallback() {
		return callback;
	}

	/**
	 * @return the read-only flags this connection was wired with
	 */
	public Set<ConnectFlag> getFlags() {
		return flags;
	}

	public boolean isOneShot() {
		return flags.contains(ConnectFlag.ONE_SHOT);
	}

	public boolean isDeferred() {
		return flags.contains(ConnectFlag.DEFERRED);
	}

	public boolean isReferenceCounted() {
		return flags.contains(ConnectFlag.REFERENCE_COUNTED);
	}

	/**
	 * @return how many times this pair has been wired and not yet unwired
	 */
	public int getReferenceCount() {
		return cancelled ? 0 : references;
	}

	void retain() {
		references++;
	}

	/**
	 * Drop one reference, cancelling the connection once none remain.
	 *
	 * @return {@literal true} if the connection was cancelled by this call
	 */
	boolean release() {
		if (--references > 0) {
			return false;
		}
		cancel();
		return true;
	}

	/**
	 * Cancel this {@literal Connection} by removing it from its registry, regardless of its reference count.
	 */
	void cancel() {
		if (!cancelled) {
			this.cancelled = true;
			if (null != onCancel) {
				onCancel.run();
			}
		}
	}

	/**
	 * Has this been cancelled?
	 *
	 * @return {@literal true} if this has been cancelled, {@literal false} otherwise.
	 */
	public boolean isCancelled() {
		return cancelled;
	}

	@Override
	public String toString() {
		return "Connection{" +
		  "signal=" + signal +
		  ", callback=" + callback +
		  ", flags=" + flags +
		  ", references=" + references +
		  ", cancelled=" + cancelled +
		  '}';
	}

}
