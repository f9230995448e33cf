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

package com.cspheader.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a header value (or a single token within it) is not acceptable - for example, because it
 * contains a CR or LF character that could be used for HTTP response splitting.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class IllegalHeaderValueException extends IllegalArgumentException {
	@NonNull
	private final String headerName;
	@Nullable
	private final String headerValue;

	public IllegalHeaderValueException(@Nullable String message,
																		 @NonNull String headerName,
																		 @Nullable String headerValue) {
		super(message);
		this.headerName = requireNonNull(headerName);
		this.headerValue = headerValue;
	}

	@NonNull
	public String getHeaderName() {
		return this.headerName;
	}

	@NonNull
	public Optional<String> getHeaderValue() {
		return Optional.ofNullable(this.headerValue);
	}
}
