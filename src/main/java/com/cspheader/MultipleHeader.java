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

package com.cspheader;

import org.jspecify.annotations.NonNull;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Header} which may legally appear more than once in the same message, each occurrence on its own line.
 * <p>
 * Clients merge the occurrences, so a single logical value can be split across several wire-format lines.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface MultipleHeader extends Header {
	/**
	 * Renders this header followed by each of {@code headers}, every line terminated by {@code CRLF}.
	 *
	 * @param headers additional occurrences of this header, in output order
	 * @return the rendered header lines
	 * @throws com.cspheader.exception.IncompatibleHeaderException if any of {@code headers} is not of this header's type
	 */
	@NonNull
	String toStringMultipleHeaders(@NonNull Header... headers);

	/**
	 * {@link List} variant of {@link #toStringMultipleHeaders(Header...)}.
	 *
	 * @param headers additional occurrences of this header, in output order
	 * @return the rendered header lines
	 */
	@NonNull
	default String toStringMultipleHeaders(@NonNull List<? extends Header> headers) {
		requireNonNull(headers);
		return toStringMultipleHeaders(headers.toArray(new Header[0]));
	}
}
