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

package com.edgelet.core;

import java.time.Duration;
import java.util.List;

/**
 * Kinds of {@link LogEvent} instances that Edgelet can produce.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * Indicates the per-request application instance could not be created.
	 */
	INSTANCE_CREATION_FAILED,
	/**
	 * Indicates {@link Middleware#before(Object, Request.Editor)} threw an exception.
	 */
	MIDDLEWARE_FAILED,
	/**
	 * Indicates a route handler threw an exception other than a {@link com.edgelet.exception.HandlerException}.
	 */
	CALLBACK_FAILED,
	/**
	 * Indicates a handler returned without committing, streaming or deferring its response.
	 */
	RESPONSE_NOT_COMMITTED,
	/**
	 * Indicates template rendering failed.
	 */
	TEMPLATE_RENDERING_FAILED,
	/**
	 * Indicates a file could not be read for {@link Response#sendFile(java.nio.file.Path)}.
	 */
	FILE_LOADING_FAILED,
	/**
	 * Indicates a chunk could not be delivered to a streaming client.
	 */
	STREAM_WRITING_FAILED,
	/**
	 * Indicates {@link LifecycleInterceptor#didStartRequestHandling(Request, Route)} threw an exception.
	 */
	LIFECYCLE_INTERCEPTOR_DID_START_REQUEST_HANDLING_FAILED,
	/**
	 * Indicates {@link LifecycleInterceptor#didFinishRequestHandling(Request, Route, Integer, Duration, List)} threw an exception.
	 */
	LIFECYCLE_INTERCEPTOR_DID_FINISH_REQUEST_HANDLING_FAILED,
	/**
	 * Indicates an HTTP request could not be understood.
	 */
	SERVER_UNPARSEABLE_REQUEST,
	/**
	 * Indicates an internal {@link Server} error occurred.
	 */
	SERVER_INTERNAL_ERROR
}
