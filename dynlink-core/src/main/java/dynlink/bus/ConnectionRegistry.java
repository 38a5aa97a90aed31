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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import dynlink.signal.Callback;
import dynlink.signal.ConnectFlag;
import dynlink.signal.Signal;

/**
 * Holds the {@link Connection Connections} of a {@link SignalBus}, grouped by {@link Signal} and kept in wiring
 * order. Not designed for concurrent use: the bus that owns it is single-threaded.
 */
class ConnectionRegistry implements Iterable<Connection> {

	private final Map<Signal, List<Connection>> connections = new LinkedHashMap<Signal, List<Connection>>();

	Connection register(final Signal signal, Callback callback, Set<ConnectFlag> flags) {
		List<Connection> conns = connections.get(signal);
		if (null == conns) {
			conns = new ArrayList<Connection>();
			connections.put(signal, conns);
		}

		final List<Connection> owner = conns;
		final Connection[] self = new Connection[1];
		self[0] = new Connection(signal, callback, flags, new Runnable() {
			@Override
			public void run() {
				owner.remove(self[0]);
				if (owner.isEmpty()) {
					connections.remove(signal);
				}
			}
		});
		conns.add(self[0]);

		return self[0];
	}

	@Nullable
	Connection find(Signal signal, Callback callback) {
		List<Connection> conns = connections.get(signal);
		if (null == conns) {
			return null;
		}
		for (Connection conn : conns) {
			if (conn.getCallback().equals(callback)) {
				return conn;
			}
		}
		return null;
	}

	/**
	 * @param signal the signal to look up
	 * @return a snapshot of the signal's connections, in wiring order
	 */
	List<Connection> select(Signal signal) {
		List<Connection> conns = connections.get(signal);
		if (null == conns) {
			return Collections.emptyList();
		}
		return new ArrayList<Connection>(conns);
	}

	/**
	 * Cancel every connection whose signal owner or callback receiver is {@code object}.
	 *
	 * @param object the freed object
	 * @return how many connections were cancelled
	 */
	int cancelInvolving(Object object) {
		List<Connection> doomed = new ArrayList<Connection>();
		for (Connection conn : this) {
			if (conn.getSignal().getOwner() == object || conn.getCallback().getReceiver() == object) {
				doomed.add(conn);
			}
		}
		for (Connection conn : doomed) {
			conn.cancel();
		}
		return doomed.size();
	}

	int size() {
		int size = 0;
		for (List<Connection> conns : connections.values()) {
			size += conns.size();
		}
		return size;
	}

	void clear() {
		for (Connection conn : this) {
			conn.cancel();
		}
	}

	@Override
	public Iterator<Connection> iterator() {
		List<Connection> all = new ArrayList<Connection>();
		for (List<Connection> conns : connections.values()) {
			all.addAll(conns);
		}
		return all.iterator();
	}

}
