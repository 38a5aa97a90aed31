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

package dynlink.connection;

import java.util.EnumSet;
import java.util.Set;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dynlink.configuration.DynlinkConfiguration;
import dynlink.host.EventSystem;
import dynlink.host.Host;
import dynlink.host.LivenessOracle;
import dynlink.signal.Callback;
import dynlink.signal.ConnectFlag;
import dynlink.signal.Signal;
import dynlink.support.Assert;

/**
 * Holds a single, replaceable link between a {@link Signal} and a {@link Callback}.
 * <p>
 * Every change of the stored pair goes through {@link #setLinkOrNull(Signal, Callback)}: the link this handle wired
 * before is unwired first, then the new pair is wired if it is valid. A handle therefore never has more than one live
 * link in its host, and never leaves an old one behind.
 * <p>
 * The {@code *OrNull} setters accept anything and treat an invalid pair as "no link". The strict setters
 * ({@link #setLink(Signal, Callback)}, {@link #setSource(Signal)}, {@link #setTarget(Callback)} and
 * {@link #withLink(Host, Signal, Callback)}) reject an invalid pair with an {@link IllegalArgumentException} and leave
 * the handle untouched.
 * <p>
 * The handle does not own the pairs it stores. If the host refuses to wire a valid pair, for instance because the
 * same pair was already wired by someone else, the pair is still stored, and the next rewire or
 * {@link #removeLink()} disconnects that pair from the host even though this handle did not make the link.
 * <p>
 * A {@literal DynamicConnection} is not thread-safe.
 */
public final class DynamicConnection implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(DynamicConnection.class);

	private final EventSystem    events;
	private final LivenessOracle liveness;

	private Signal               source;
	private Callback             target;
	private EnumSet<ConnectFlag> flags;

	/**
	 * Create an empty handle without flags.
	 *
	 * @param host the host to wire links into
	 */
	public DynamicConnection(Host host) {
		this(host, host, ConnectFlag.none());
	}

	/**
	 * Create an empty handle.
	 *
	 * @param host  the host to wire links into
	 * @param flags the flags links are wired with
	 */
	public DynamicConnection(Host host, Set<ConnectFlag> flags) {
		this(host, host, flags);
	}

	/**
	 * Create an empty handle against separate wiring and liveness collaborators.
	 *
	 * @param events   the event system to wire links into
	 * @param liveness the oracle that decides whether a pair is valid
	 * @param flags    the flags links are wired with
	 */
	public DynamicConnection(EventSystem events, LivenessOracle liveness, Set<ConnectFlag> flags) {
		Assert.notNull(events, "EventSystem cannot be null.");
		Assert.notNull(liveness, "LivenessOracle cannot be null.");
		this.events = events;
		this.liveness = liveness;
		this.flags = copyOf(flags);
		relink(null, null);
	}

	/**
	 * Create an empty handle whose flags come from {@link DynlinkConfiguration#getDefaultConnectFlags()}.
	 *
	 * @param host          the host to wire links into
	 * @param configuration the configuration to take the default flags from
	 * @return a new, empty {@literal DynamicConnection}
	 */
	public static DynamicConnection create(Host host, DynlinkConfiguration configuration) {
		Assert.notNull(configuration, "Configuration cannot be null.");
		return new DynamicConnection(host, configuration.getDefaultConnectFlags());
	}

	/**
	 * Create a handle already linking {@code source} to {@code target}.
	 *
	 * @param host   the host to wire links into
	 * @param source the signal to link
	 * @param target the callback to link
	 * @return a linked {@literal DynamicConnection}
	 * @throws IllegalArgumentException if the pair is not valid
	 */
	public static DynamicConnection withLink(Host host, Signal source, Callback target) {
		return withLink(host, source, target, ConnectFlag.none());
	}

	/**
	 * Create a handle already linking {@code source} to {@code target} with {@code flags}.
	 *
	 * @param host   the host to wire links into
	 * @param source the signal to link
	 * @param target the callback to link
	 * @param flags  the flags links are wired with
	 * @return a linked {@literal DynamicConnection}
	 * @throws IllegalArgumentException if the pair is not valid
	 */
	public static DynamicConnection withLink(Host host, Signal source, Callback target, Set<ConnectFlag> flags) {
		DynamicConnection connection = new DynamicConnection(host, flags);
		connection.setLink(source, target);
		return connection;
	}

	/**
	 * Is {@code source} a live signal and {@code target} an invokable callback?
	 *
	 * @param source a signal, may be {@code null}
	 * @param target a callback, may be {@code null}
	 * @return {@literal true} if the pair may be wired
	 */
	public boolean isPairValid(@Nullable Signal source, @Nullable Callback target) {
		return liveness.hasLiveOwner(source) && liveness.isInvokable(target);
	}

	/**
	 * Replace the stored pair, keeping the current flags. Never fails; an invalid pair is stored but not wired.
	 * A valid pair is stored even when the host refuses to wire it, and is unwired by the next change.
	 *
	 * @param newSource the new signal, may be {@code null}
	 * @param newTarget the new callback, may be {@code null}
	 */
	public void setLinkOrNull(@Nullable Signal newSource, @Nullable Callback newTarget) {
		relink(newSource, newTarget);
	}

	/**
	 * Replace the stored flags and pair. Never fails; an invalid pair is stored but not wired.
	 *
	 * @param newSource the new signal, may be {@code null}
	 * @param newTarget the new callback, may be {@code null}
	 * @param flags     the flags to wire with from now on
	 */
	public void setLinkOrNull(@Nullable Signal newSource, @Nullable Callback newTarget, Set<ConnectFlag> flags) {
		this.flags = copyOf(flags);
		relink(newSource, newTarget);
	}

	/**
	 * Replace the stored pair, keeping the current flags.
	 *
	 * @param newSource the new signal
	 * @param newTarget the new callback
	 * @throws IllegalArgumentException if the pair is not valid, in which case nothing changes
	 */
	public void setLink(Signal newSource, Callback newTarget) {
		checkPair(newSource, newTarget);
		setLinkOrNull(newSource, newTarget);
	}

	/**
	 * Replace the stored flags and pair.
	 *
	 * @param newSource the new signal
	 * @param newTarget the new callback
	 * @param flags     the flags to wire with from now on
	 * @throws IllegalArgumentException if the pair is not valid, in which case nothing changes
	 */
	public void setLink(Signal newSource, Callback newTarget, Set<ConnectFlag> flags) {
		checkPair(newSource, newTarget);
		setLinkOrNull(newSource, newTarget, flags);
	}

	/**
	 * Unwire the current link, if any, and clear the stored pair. Calling this on an empty handle does nothing.
	 */
	public void removeLink() {
		setLinkOrNull(null, null);
	}

	public void setSourceOrNull(@Nullable Signal newSource) {
		setLinkOrNull(newSource, target);
	}

	/**
	 * Link {@code newSource} to the stored callback.
	 *
	 * @param newSource the new signal
	 * @throws IllegalArgumentException if the resulting pair is not valid
	 */
	public void setSource(Signal newSource) {
		setLink(newSource, target);
	}

	public void setTargetOrNull(@Nullable Callback newTarget) {
		setLinkOrNull(source, newTarget);
	}

	/**
	 * Link the stored signal to {@code newTarget}.
	 *
	 * @param newTarget the new callback
	 * @throws IllegalArgumentException if the resulting pair is not valid
	 */
	public void setTarget(Callback newTarget) {
		setLink(source, newTarget);
	}

	@Nullable
	public Signal getSource() {
		return source;
	}

	@Nullable
	public Callback getTarget() {
		return target;
	}

	/**
	 * @return a copy of the flags links are wired with
	 */
	public Set<ConnectFlag> getFlags() {
		return EnumSet.copyOf(flags);
	}

	/**
	 * Does the stored pair pass {@link #isPairValid(Signal, Callback)}? A valid pair is not necessarily wired: the
	 * link may have been cut outside this handle, or removed by the host after a one-shot firing. Use
	 * {@link #isLinkActive()} for that.
	 *
	 * @return {@literal true} if the stored pair is valid
	 */
	public boolean isValid() {
		return isPairValid(source, target);
	}

	/**
	 * @return {@literal true} if the stored pair is valid and the host reports it wired
	 */
	public boolean isLinkActive() {
		return isValid() && events.isConnected(source, target);
	}

	/**
	 * Same as {@link #removeLink()}.
	 */
	@Override
	public void close() {
		removeLink();
	}

	private void relink(Signal newSource, Callback newTarget) {
		if (isValid() && events.isConnected(source, target)) {
			events.disconnect(source, target);
			log.debug("Unwired {} from {}", source, target);
		}
		if (isPairValid(newSource, newTarget)) {
			if (events.connect(newSource, newTarget, flags)) {
				log.debug("Wired {} to {} with {}", newSource, newTarget, flags);
			} else {
				log.warn("Host refused to wire {} to {}", newSource, newTarget);
			}
		}
		this.source = newSource;
		this.target = newTarget;
	}

	private void checkPair(Signal newSource, Callback newTarget) {
		Assert.isTrue(liveness.hasLiveOwner(newSource), "Signal must be non-null and owned by a live object.");
		Assert.isTrue(liveness.isInvokable(newTarget), "Callback must be non-null and invokable.");
	}

	private static EnumSet<ConnectFlag> copyOf(Set<ConnectFlag> flags) {
		EnumSet<ConnectFlag> copy = ConnectFlag.none();
		if (null != flags) {
			copy.addAll(flags);
		}
		return copy;
	}

}
