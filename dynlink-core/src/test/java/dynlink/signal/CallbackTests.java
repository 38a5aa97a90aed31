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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import dynlink.fn.Consumer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

public class CallbackTests {

	private final Object             receiver = new Object();
	private final List<List<Object>> received = new ArrayList<List<Object>>();
	private final Consumer<Object[]> fn       = new Consumer<Object[]>() {
		@Override
		public void accept(Object[] args) {
			received.add(Arrays.asList(args));
		}
	};

	@Test
	public void invokeAppendsBoundArguments() {
		Callback callback = Callback.of(receiver, "handle", fn).bind(1, 2).bind(3);

		callback.invoke("a", "b");

		assertThat(received, contains(Arrays.<Object>asList("a", "b", 1, 2, 3)));
	}

	@Test
	public void unbindDropsTrailingArguments() {
		Callback callback = Callback.of(receiver, "handle", fn).bind(1, 2, 3).unbind(2);

		callback.invoke();

		assertThat(received, contains(Arrays.<Object>asList(1)));
		assertThat(Arrays.asList(callback.getBoundArgs()), contains((Object) 1));
		assertThat(callback, is(Callback.of(receiver, "handle", fn).bind(1)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void unbindingMoreThanIsBoundFails() {
		Callback.of(receiver, "handle", fn).bind(1).unbind(2);
	}

	@Test
	public void equalityIsByReceiverIdentityNameFunctionAndBoundArguments() {
		Callback base = Callback.of(receiver, "handle", fn);

		assertThat(base, is(Callback.of(receiver, "handle", fn)));
		assertThat(base.hashCode(), is(Callback.of(receiver, "handle", fn).hashCode()));
		assertThat(base, is(not(Callback.of(new Object(), "handle", fn))));
		assertThat(base, is(not(Callback.of(receiver, "other", fn))));
		assertThat(base, is(not(base.bind("x"))));
		assertThat(base.bind("x"), is(base.bind("x")));
	}

	@Test
	public void invokeHandsTheFunctionItsOwnArguments() {
		Callback callback = Callback.from("writer", new Consumer<Object[]>() {
			@Override
			public void accept(Object[] args) {
				args[0] = "changed";
			}
		});
		Object[] args = {"kept"};

		callback.invoke(args);

		assertThat(args[0], is((Object) "kept"));
	}

	@Test
	public void standaloneCallbacksHaveNoReceiver() {
		Callback callback = Callback.from("standalone", fn);

		assertThat(callback.getReceiver(), is(nullValue()));
		assertThat(callback.toString(), is("standalone"));
	}

	@Test
	public void signalsAreEqualByOwnerIdentityAndName() {
		Object owner = new Object();

		assertThat(Signal.of(owner, "pressed"), is(Signal.of(owner, "pressed")));
		assertThat(Signal.of(owner, "pressed"), is(not(Signal.of(owner, "released"))));
		assertThat(Signal.of(owner, "pressed"), is(not(Signal.of(new Object(), "pressed"))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void signalsNeedAnOwner() {
		Signal.of(null, "pressed");
	}

	@Test(expected = IllegalArgumentException.class)
	public void signalsNeedAName() {
		Signal.of(new Object(), "");
	}

}
