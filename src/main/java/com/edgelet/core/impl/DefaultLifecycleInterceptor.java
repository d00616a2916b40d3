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

package com.edgelet.core.impl;

import com.edgelet.core.LifecycleInterceptor;
import com.edgelet.core.LogEvent;
import com.edgelet.core.Request;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The {@link LifecycleInterceptor} used when none is configured.
 * <p>
 * Request hooks do nothing. Log events go to {@code stderr}, prefixed with the request they concern (if any) so
 * concurrent failures can be told apart.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class DefaultLifecycleInterceptor implements LifecycleInterceptor {
	@Nonnull
	private static final DefaultLifecycleInterceptor SHARED_INSTANCE;

	static {
		SHARED_INSTANCE = new DefaultLifecycleInterceptor();
	}

	@Nonnull
	public static DefaultLifecycleInterceptor sharedInstance() {
		return SHARED_INSTANCE;
	}

	@Override
	public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);

		Request request = logEvent.getRequest().orElse(null);

		if (request == null) {
			LifecycleInterceptor.super.didReceiveLogEvent(logEvent);
			return;
		}

		LogEvent describedLogEvent = LogEvent.with(logEvent.getLogEventType(),
						format("%s %s: %s", request.getHttpMethod().name(), request.getRawUrl(), logEvent.getMessage()))
				.throwable(logEvent.getThrowable().orElse(null))
				.request(request)
				.route(logEvent.getRoute().orElse(null))
				.build();

		LifecycleInterceptor.super.didReceiveLogEvent(describedLogEvent);
	}
}
