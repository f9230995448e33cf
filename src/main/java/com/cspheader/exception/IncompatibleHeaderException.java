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
 * Exception thrown when headers of different types are combined where only a single type is permitted, e.g. when
 * rendering several {@code Content-Security-Policy} occurrences as one block.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class IncompatibleHeaderException extends RuntimeException {
	@NonNull
	private final Class<?> expectedType;
	@NonNull
	private final Class<?> actualType;

	public IncompatibleHeaderException(@Nullable String message,
																		 @NonNull Class<?> expectedType,
																		 @NonNull Class<?> actualType) {
		super(message);
		this.expectedType = requireNonNull(expectedType);
		this.actualType = requireNonNull(actualType);
	}

	@NonNull
	public Class<?> getExpectedType() {
		return this.expectedType;
	}

	@NonNull
	public Class<?> getActualType() {
		return this.actualType;
	}
}
