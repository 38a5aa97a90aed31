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

import java.util.Set;

import dynlink.signal.Callback;
import dynlink.signal.ConnectFlag;
import dynlink.signal.Signal;

/**
 * The primitive wiring operations of a host event system.
 */
public interface EventSystem {

	/**
	 * Wire {@code signal} to {@code callback}.
	 *
	 * @param signal   the source to wire
	 * @param callback the target to wire
	 * @param flags    the behaviours of the new link, may be empty
	 * @return {@literal true} if the link was wired or its reference count raised, {@literal false} if the host
	 * refused it
	 */
	boolean connect(Signal signal, Callback callback, Set<ConnectFlag> flags);

	/**
	 * Unwire {@code signal} from {@code callback}.
	 *
	 * @param signal   the source to unwire
	 * @param callback the target to unwire
	 * @return {@literal true} if a link existed, {@literal false} otherwise
	 */
	boolean disconnect(Signal signal, Callback callback);

	/**
	 * Is {@code signal} currently wired to {@code callback}?
	 *
	 * @param signal   the source
	 * @param callback the target
	 * @return {@literal true} if the link is currently wired
	 */
	boolean isConnected(Signal signal, Callback callback);

}
