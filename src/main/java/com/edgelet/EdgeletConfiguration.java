/*
 * Copyright 2022-2025 Revetware LLC.
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


package com.edgelet;

import com.edgelet.core.FileLoader;
import com.edgelet.core.LifecycleInterceptor;
import com.edgelet.core.RouteTable;
import com.edgelet.core.Server;
import com.edgelet.core.TemplateEngine;
import com.edgelet.core.impl.DefaultFileLoader;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Defines how an Edgelet system is configured.
 *
 * @param <T> the application type whose instances back routed handlers
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class EdgeletConfiguration<T> {
	@Nonnull
	private final Server server;
	@Nonnull
	private final RouteTable<T> routeTable;
	@Nonnull
	private final LifecycleInterceptor lifecycleInterceptor;
	@Nullable
	private final TemplateEngine templateEngine;
	@Nonnull
	private final FileLoader fileLoader;

	/**
	 * Vends a configuration builder for the given server and routes.
	 *
	 * @param server     the server that will accept connections
	 * @param routeTable the routes to dispatch to
	 * @param <T>        the application type
	 * @return a builder for {@link EdgeletConfiguration} instances
	 */
	@Nonnull
	public static <T> Builder<T> withServer(@Nonnull Server server,
																					@Nonnull RouteTable<T> routeTable) {
		requireNonNull(server);
		requireNonNull(routeTable);

		return new Builder<>(server, routeTable);
	}

	protected EdgeletConfiguration(@Nonnull Builder<T> builder) {
		requireNonNull(builder);

		this.server = builder.server;
		this.routeTable = builder.routeTable;
		this.lifecycleInterceptor = builder.lifecycleInterceptor != null ? builder.lifecycleInterceptor : LifecycleInterceptor.withDefaults();
		this.templateEngine = builder.templateEngine;
		this.fileLoader = builder.fileLoader != null ? builder.fileLoader : DefaultFileLoader.sharedInstance();
	}

	/**
	 * The server managed by Edgelet.
	 *
	 * @return the server instance
	 */
	@Nonnull
	public Server getServer() {
		return this.server;
	}

	/**
	 * The routes requests are matched against. Edgelet freezes the table when it starts.
	 *
	 * @return the route table
	 */
	@Nonnull
	public RouteTable<T> getRouteTable() {
		return this.routeTable;
	}

	/**
	 * How Edgelet will perform custom behavior during server and request lifecycle events.
	 *
	 * @return the instance responsible for performing lifecycle event customization
	 */
	@Nonnull
	public LifecycleInterceptor getLifecycleInterceptor() {
		return this.lifecycleInterceptor;
	}

	/**
	 * The engine backing {@link com.edgelet.core.Response#render(String, java.util.Map)}, if any.
	 * <p>
	 * Without one, every render attempt fails with a 500.
	 *
	 * @return the template engine, if configured
	 */
	@Nonnull
	public Optional<TemplateEngine> getTemplateEngine() {
		return Optional.ofNullable(this.templateEngine);
	}

	@Nonnull
	public FileLoader getFileLoader() {
		return this.fileLoader;
	}

	/**
	 * Builder used to construct instances of {@link EdgeletConfiguration}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static class Builder<T> {
		@Nonnull
		private Server server;
		@Nonnull
		private RouteTable<T> routeTable;
		@Nullable
		private LifecycleInterceptor lifecycleInterceptor;
		@Nullable
		private TemplateEngine templateEngine;
		@Nullable
		private FileLoader fileLoader;

		protected Builder(@Nonnull Server server,
											@Nonnull RouteTable<T> routeTable) {
			requireNonNull(server);
			requireNonNull(routeTable);

			this.server = server;
			this.routeTable = routeTable;
		}

		@Nonnull
		public Builder<T> server(@Nonnull Server server) {
			requireNonNull(server);
			this.server = server;
			return this;
		}

		@Nonnull
		public Builder<T> routeTable(@Nonnull RouteTable<T> routeTable) {
			requireNonNull(routeTable);
			this.routeTable = routeTable;
			return this;
		}

		@Nonnull
		public Builder<T> lifecycleInterceptor(@Nullable LifecycleInterceptor lifecycleInterceptor) {
			this.lifecycleInterceptor = lifecycleInterceptor;
			return this;
		}

		@Nonnull
		public Builder<T> templateEngine(@Nullable TemplateEngine templateEngine) {
			this.templateEngine = templateEngine;
			return this;
		}

		@Nonnull
		public Builder<T> fileLoader(@Nullable FileLoader fileLoader) {
			this.fileLoader = fileLoader;
			return this;
		}

		@Nonnull
		public EdgeletConfiguration<T> build() {
			return new EdgeletConfiguration<>(this);
		}
	}
}
