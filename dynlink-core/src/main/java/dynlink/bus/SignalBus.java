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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Queue;
import java.util.Set;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dynlink.bus.spec.SignalBusSpec;
import dynlink.fn.Consumer;
import dynlink.host.Host;
import dynlink.signal.Callback;
import dynlink.signal.ConnectFlag;
import dynlink.signal.Signal;
import dynlink.support.Assert;

/**
 * A synchronous signal bus. Components wire {@link Callback Callbacks} to {@link Signal Signals} and are invoked,
 * in wiring order, when the signal is {@link #emit(Signal, Object...) emitted}.
 * <p>
 * The bus also tracks object liveness: once an object is {@link #free(Object) freed}, every connection it takes part
 * in is removed and no new connection involving it is accepted. Calls on links flagged {@link ConnectFlag#DEFERRED}
 * are queued until {@link #flushDeferred()}.
 * <p>
 * Freed objects are remembered by identity for the life of the bus so that they keep reporting as dead. The bus
 * therefore holds a strong reference to every object it has freed; a bus that frees many short-lived objects should
 * itself be short-lived, or be replaced once {@link #freedCount()} grows large.
 * <p>
 * A bus is meant to be driven from a single thread.
 */
public class SignalBus implements Host {

	private static final Logger log      = LoggerFactory.getLogger(SignalBus.class);
	private static final Logger traceLog = LoggerFactory.getLogger("dynlink.bus.trace");

	private final ConnectionRegistry  registry = new ConnectionRegistry();
	private final Set<Object>         freed    = Collections.newSetFromMap(new IdentityHashMap<Object, Boolean>());
	private final Queue<DeferredCall> deferred = new ArrayDeque<DeferredCall>();

	private final Consumer<Throwable> errorHandler;
	private final boolean             traceEmissions;
	private final int                 maxDeferredPasses;

	/**
	 * Create a new {@literal SignalBus}.
	 *
	 * @param errorHandler      The {@link Consumer} to be handed exceptions thrown by callbacks. May be {@code null}
	 *                          in which case exceptions will be logged.
	 * @param traceEmissions    whether to log every emission and wiring change
	 * @param maxDeferredPasses how many passes a single {@link #flushDeferred()} may take
	 */
	public SignalBus(@Nullable Consumer<Throwable> errorHandler, boolean traceEmissions, int maxDeferredPasses) {
		Assert.isTrue(maxDeferredPasses > 0, "Max deferred passes must be positive.");
		this.traceEmissions = traceEmissions;
		this.maxDeferredPasses = maxDeferredPasses;
		if (null == errorHandler) {
			this.errorHandler = new Consumer<Throwable>() {
				@Override
				public void accept(Throwable t) {
					log.error(t.getMessage(), t);
				}
			};
		} else {
			this.errorHandler = errorHandler;
		}
	}

	/**
	 * Create a bus configured from {@code META-INF/dynlink/default.properties} and {@code dynlink.*} system
	 * properties.
	 *
	 * @return a new {@literal SignalBus}
	 */
	public static SignalBus create() {
		return new SignalBusSpec().get();
	}

	@Override
	public boolean isAlive(@Nullable Object object) {
		return null != object && !freed.contains(object);
	}

	@Override
	public boolean connect(@Nonnull Signal signal, @Nonnull Callback callback, @Nullable Set<ConnectFlag> flags) {
		Assert.notNull(signal, "Signal cannot be null.");
		Assert.notNull(callback, "Callback cannot be null.");

		if (!hasLiveOwner(signal)) {
			log.warn("Refusing to connect {} to {}: the signal owner has been freed", signal, callback);
			return false;
		}
		if (!isInvokable(callback)) {
			log.warn("Refusing to connect {} to {}: the callback receiver has been freed", signal, callback);
			return false;
		}

		Connection existing = registry.find(signal, callback);
		if (null != existing) {
			if (null != flags && flags.contains(ConnectFlag.REFERENCE_COUNTED) && existing.isReferenceCounted()) {
				existing.retain();
				trace("retained {}", existing);
				return true;
			}
			log.warn("{} is already connected to {}", signal, callback);
			return false;
		}

		Connection conn = registry.register(signal, callback, flags);
		trace("connected {}", conn);
		return true;
	}

	@Override
	public boolean disconnect(@Nullable Signal signal, @Nullable Callback callback) {
		if (null == signal || null == callback) {
			return false;
		}
		Connection conn = registry.find(signal, callback);
		if (null == conn) {
			log.debug("Attempt to disconnect a nonexistent connection from {} to {}", signal, callback);
			return false;
		}
		if (conn.release()) {
			trace("disconnected {}", conn);
		} else {
			trace("released {}", conn);
		}
		return true;
	}

	@Override
	public boolean isConnected(@Nullable Signal signal, @Nullable Callback callback) {
		if (null == signal || null == callback) {
			return false;
		}
		Connection conn = registry.find(signal, callback);
		return null != conn && !conn.isCancelled();
	}

	/**
	 * Notify every callback wired to {@code signal}. One-shot links are removed before their callback runs; calls on
	 * deferred links are queued. Exceptions thrown by callbacks are handed to the error handler and do not stop the
	 * emission.
	 *
	 * @param signal the signal to emit
	 * @param args   the emitted arguments
	 * @return the number of callbacks invoked or queued
	 */
	public int emit(@Nonnull Signal signal, Object... args) {
		Assert.notNull(signal, "Signal cannot be null.");
		if (!hasLiveOwner(signal)) {
			log.debug("Not emitting {}: the signal owner has been freed", signal);
			return 0;
		}

		List<Connection> conns = registry.select(signal);
		trace("emitting {} to {} connection(s)", signal, conns.size());

		int count = 0;
		for (Connection conn : conns) {
			// an earlier callback may have cut this link or freed its receiver
			if (conn.isCancelled() || !isInvokable(conn.getCallback())) {
				continue;
			}
			if (conn.isOneShot()) {
				conn.cancel();
			}
			if (conn.isDeferred()) {
				deferred.add(new DeferredCall(signal, conn.getCallback(), args));
			} else {
				invoke(signal, conn.getCallback(), args);
			}
			count++;
		}
		return count;
	}

	/**
	 * Run the queued deferred calls. Calls queued while flushing run in a later pass of the same flush, up to the
	 * configured number of passes; anything left after that stays queued for the next flush.
	 *
	 * @return the number of calls run
	 */
	public int flushDeferred() {
		int run = 0;
		int passes = 0;
		while (!deferred.isEmpty() && passes < maxDeferredPasses) {
			List<DeferredCall> pass = new ArrayList<DeferredCall>(deferred);
			deferred.clear();
			for (DeferredCall call : pass) {
				if (!isInvokable(call.callback)) {
					log.debug("Dropping deferred call to {}: the receiver has been freed", call.callback);
					continue;
				}
				invoke(call.signal, call.callback, call.args);
				run++;
			}
			passes++;
		}
		if (!deferred.isEmpty()) {
			log.warn("{} deferred call(s) still queued after {} passes", deferred.size(), maxDeferredPasses);
		}
		return run;
	}

	/**
	 * @return the number of objects this bus has freed and still remembers
	 */
	public int freedCount() {
		return freed.size();
	}

	/**
	 * @return whether this bus logs every emission and wiring change
	 */
	public boolean isTraceEmissions() {
		return traceEmissions;
	}

	/**
	 * @return how many passes a single {@link #flushDeferred()} may take
	 */
	public int getMaxDeferredPasses() {
		return maxDeferredPasses;
	}

	/**
	 * @return the number of deferred calls waiting for {@link #flushDeferred()}
	 */
	public int pendingDeferredCount() {
		return deferred.size();
	}

	/**
	 * Mark {@code object} as freed and remove every connection it owns a signal of or receives a callback of.
	 * Freeing an object twice has no further effect.
	 *
	 * @param object the object to free
	 * @return {@literal true} if the object was alive before this call
	 */
	public boolean free(@Nonnull Object object) {
		Assert.notNull(object, "Object cannot be null.");
		if (!freed.add(object)) {
			return false;
		}
		int removed = registry.cancelInvolving(object);
		if (removed > 0) {
			log.debug("Freed {} and removed {} connection(s)", object, removed);
		}
		return true;
	}

	/**
	 * @param signal the signal to look up
	 * @return a snapshot of the connections wired to {@code signal}, in wiring order
	 */
	public List<Connection> getConnections(@Nonnull Signal signal) {
		Assert.notNull(signal, "Signal cannot be null.");
		return registry.select(signal);
	}

	/**
	 * @return the number of links currently wired into this bus
	 */
	public int connectionCount() {
		return registry.size();
	}

	/**
	 * Unwire every link and drop every queued deferred call.
	 */
	public void clear() {
		registry.clear();
		deferred.clear();
		trace("cleared");
	}

	private void invoke(Signal signal, Callback callback, Object[] args) {
		try {
			callback.invoke(args);
		} catch (Exception e) {
			log.debug("Callback {} failed on {}", callback, signal);
			errorHandler.accept(e);
		}
	}

	private void trace(String format, Object... args) {
		if (traceEmissions && traceLog.isDebugEnabled()) {
			traceLog.debug(format, args);
		}
	}

	private static final class DeferredCall {
		final Signal   signal;
		final Callback callback;
		final Object[] args;

		DeferredCall(Signal signal, Callback callback, Object[] args) {
			this.signal = signal;
			this.callback = callback;
			this.args = (null == args ? new Object[0] : args.clone());
		}
	}

}
