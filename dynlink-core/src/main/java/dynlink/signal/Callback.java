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

import java.util.Arrays;

import javax.annotation.Nullable;

import dynlink.fn.Consumer;
import dynlink.support.Assert;

/**
 * An invokable unit: an optional receiver object, a method name and the function that does the work, optionally
 * pre-bound with trailing arguments.
 * <p>
 * When invoked, the function is handed the call arguments followed by the bound arguments. Two callbacks are equal
 * when they share the receiver instance, the name, the function instance and equal bound arguments; this is what lets
 * a host find an existing link again from a freshly built but equivalent callback.
 */
public final class Callback {

	private static final Object[] NO_ARGS = new Object[0];

	private final Object             receiver;
	private final String             name;
	private final Consumer<Object[]> function;
	private final Object[]           boundArgs;

	private Callback(@Nullable Object receiver, String name, Consumer<Object[]> function, Object[] boundArgs) {
		this.receiver = receiver;
		this.name = name;
		this.function = function;
		this.boundArgs = boundArgs;
	}

	/**
	 * Create a callback bound to a receiver object. The callback is only invokable while the receiver is alive.
	 *
	 * @param receiver the object the callback acts upon
	 * @param name     the method name, used for equality and diagnostics
	 * @param function the work to perform
	 * @return a new {@literal Callback}
	 */
	public static Callback of(Object receiver, String name, Consumer<Object[]> function) {
		Assert.notNull(receiver, "Callback receiver cannot be null.");
		Assert.notNull(name, "Callback name cannot be null.");
		Assert.notNull(function, "Callback function cannot be null.");
		return new Callback(receiver, name, function, NO_ARGS);
	}

	/**
	 * Create a standalone callback without a receiver. It stays invokable for as long as it is referenced.
	 *
	 * @param name     the name, used for equality and diagnostics
	 * @param function the work to perform
	 * @return a new {@literal Callback}
	 */
	public static Callback from(String name, Consumer<Object[]> function) {
		Assert.notNull(name, "Callback name cannot be null.");
		Assert.notNull(function, "Callback function cannot be null.");
		return new Callback(null, name, function, NO_ARGS);
	}

	/**
	 * Return a copy of this callback with {@code args} appended to its bound arguments.
	 *
	 * @param args the arguments to bind
	 * @return a new {@literal Callback}
	 */
	public Callback bind(Object... args) {
		if (null == args || args.length == 0) {
			return this;
		}
		Object[] bound = Arrays.copyOf(boundArgs, boundArgs.length + args.length);
		System.arraycopy(args, 0, bound, boundArgs.length, args.length);
		return new Callback(receiver, name, function, bound);
	}

	/**
	 * Return a copy of this callback with the last {@code count} bound arguments dropped.
	 *
	 * @param count how many trailing bound arguments to drop
	 * @return a new {@literal Callback}
	 */
	public Callback unbind(int count) {
		Assert.isTrue(count >= 0 && count <= boundArgs.length,
		  "Cannot unbind " + count + " arguments from a callback bound with " + boundArgs.length + ".");
		if (count == 0) {
			return this;
		}
		return new Callback(receiver, name, function, Arrays.copyOf(boundArgs, boundArgs.length - count));
	}

	/**
	 * Run the callback with {@code args} followed by the bound arguments. The function always receives its own
	 * copy, so it may change the array without affecting the caller or other callbacks.
	 *
	 * @param args the call arguments
	 */
	public void invoke(Object... args) {
		Object[] callArgs = (null == args ? NO_ARGS : args);
		if (boundArgs.length == 0) {
			function.accept(callArgs.clone());
			return;
		}
		Object[] all = Arrays.copyOf(callArgs, callArgs.length + boundArgs.length);
		System.arraycopy(boundArgs, 0, all, callArgs.length, boundArgs.length);
		function.accept(all);
	}

	@Nullable
	public Object getReceiver() {
		return receiver;
	}

	public String getName() {
		return name;
	}

	public Object[] getBoundArgs() {
		return boundArgs.clone();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Callback)) {
			return false;
		}
		Callback that = (Callback) o;
		return receiver == that.receiver
		  && function == that.function
		  && name.equals(that.name)
		  && Arrays.equals(boundArgs, that.boundArgs);
	}

	@Override
	public int hashCode() {
		int result = System.identityHashCode(receiver);
		result = 31 * result + name.hashCode();
		result = 31 * result + System.identityHashCode(function);
		result = 31 * result + Arrays.hashCode(boundArgs);
		return result;
	}

	@Override
	public String toString() {
		String prefix = (null == receiver ? "" : receiver.getClass().getSimpleName() + "@" +
		  Integer.toHexString(System.identityHashCode(receiver)) + "::");
		return prefix + name + (boundArgs.length == 0 ? "" : Arrays.toString(boundArgs));
	}

}
