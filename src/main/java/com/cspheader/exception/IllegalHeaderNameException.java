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

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a header line carries a field name that is malformed or is not the one expected by the
 * header type doing the parsing (for example, {@code X-Content-Security-Policy} handed to the
 * {@code Content-Security-Policy} parser).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class IllegalHeaderNameException extends IllegalArgumentException {
	@NonNull
	private final String headerName;

	public IllegalHeaderNameException(@Nullable String message,
																		@NonNull String headerName) {
		super(message);
		this.headerName = requireNonNull(headerName);
	}

	/**
	 * The offending header field name, as it appeared in the input.
	 *
	 * @return the offending header field name
	 */
	@NonNull
	public String getHeaderName() {
		return this.headerName;
	}
}
