/*
 * Copyright 2026 The StuntDB Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.stuntdb;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Base for the dynamic proxies which implement the JDBC interfaces.
 * <p>
 * Handles {@link Object} methods and {@link java.sql.Wrapper} methods, then dispatches on method name. Anything a
 * subclass does not handle should fail through {@link #unsupported(Method)}.
 *
 * @since 1.0.0
 */
abstract class JdbcInvocationHandler implements InvocationHandler {
	@NonNull
	private static final Object[] NO_ARGUMENTS = new Object[0];

	@Override
	@Nullable
	public final Object invoke(@NonNull Object proxy,
														 @NonNull Method method,
														 @Nullable Object[] args) throws Throwable {
		requireNonNull(proxy);
		requireNonNull(method);

		Object[] arguments = args == null ? NO_ARGUMENTS : args;

		if (method.getDeclaringClass() == Object.class) {
			switch (method.getName()) {
				case "equals":
					return proxy == arguments[0];
				case "hashCode":
					return System.identityHashCode(proxy);
				case "toString":
					return toString();
				default:
					throw new UnsupportedOperationException(method.getName());
			}
		}

		if ("unwrap".equals(method.getName()) && arguments.length == 1)
			return unwrap(proxy, (Class<?>) arguments[0]);

		if ("isWrapperFor".equals(method.getName()) && arguments.length == 1)
			return isWrapperFor(proxy, (Class<?>) arguments[0]);

		return handle(proxy, method, arguments);
	}

	/**
	 * Handles a JDBC interface method.
	 *
	 * @param proxy     the proxy the method was invoked on
	 * @param method    the invoked method
	 * @param arguments the method arguments, never {@code null}
	 * @return the method result
	 * @throws Throwable whatever the JDBC method would throw
	 */
	@Nullable
	protected abstract Object handle(@NonNull Object proxy,
																	 @NonNull Method method,
																	 @NonNull Object[] arguments) throws Throwable;

	/**
	 * The object, besides this handler and its proxy, that {@code unwrap} may return.
	 */
	@NonNull
	protected Optional<Object> getWrapped() {
		return Optional.empty();
	}

	@NonNull
	protected SQLFeatureNotSupportedException unsupported(@NonNull Method method) {
		requireNonNull(method);
		return new SQLFeatureNotSupportedException(format("%s.%s is not supported by StuntDB",
				method.getDeclaringClass().getSimpleName(), method.getName()));
	}

	@NonNull
	protected static <T> T newProxy(@NonNull Class<T> iface,
																	@NonNull JdbcInvocationHandler handler) {
		requireNonNull(iface);
		requireNonNull(handler);

		return iface.cast(Proxy.newProxyInstance(
				JdbcInvocationHandler.class.getClassLoader(),
				new Class<?>[]{iface},
				handler));
	}

	@NonNull
	private Object unwrap(@NonNull Object proxy,
												@NonNull Class<?> iface) throws SQLException {
		requireNonNull(proxy);
		requireNonNull(iface);

		if (iface.isInstance(proxy))
			return proxy;

		Object wrapped = getWrapped().orElse(null);

		if (iface.isInstance(wrapped))
			return wrapped;

		throw new SQLException(format("%s does not wrap %s", this, iface.getName()));
	}

	private boolean isWrapperFor(@NonNull Object proxy,
															 @NonNull Class<?> iface) {
		requireNonNull(proxy);
		requireNonNull(iface);

		return iface.isInstance(proxy) || iface.isInstance(getWrapped().orElse(null));
	}
}
